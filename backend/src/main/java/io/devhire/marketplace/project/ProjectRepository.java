package io.devhire.marketplace.project;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ProjectRepository extends JpaRepository<Project, UUID> {

  /**
   * Loads the project with a row lock held until the surrounding transaction ends. Proposal
   * submission and acceptance serialize on this lock.
   */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT p FROM Project p WHERE p.id = :id")
  Optional<Project> findByIdForUpdate(@Param("id") UUID id);

  @Query("SELECT p FROM Project p WHERE p.status = :status ORDER BY p.createdAt DESC")
  List<Project> findByStatus(@Param("status") ProjectStatus status);

  @Query("SELECT p FROM Project p WHERE p.buyerId = :buyerId ORDER BY p.createdAt DESC")
  List<Project> findByBuyerId(@Param("buyerId") UUID buyerId);

  long countByStatus(ProjectStatus status);
}
