package io.devhire.marketplace.proposal;

import jakarta.persistence.LockModeType;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ProposalRepository extends JpaRepository<Proposal, UUID> {

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT p FROM Proposal p WHERE p.id = :id")
  Optional<Proposal> findByIdForUpdate(@Param("id") UUID id);

  /** Resolves the owning project without loading the proposal into the persistence context. */
  @Query("SELECT p.projectId FROM Proposal p WHERE p.id = :id")
  Optional<UUID> findProjectIdById(@Param("id") UUID id);

  @Query("SELECT p FROM Proposal p WHERE p.projectId = :projectId ORDER BY p.createdAt ASC")
  List<Proposal> findByProjectId(@Param("projectId") UUID projectId);

  @Query("SELECT p FROM Proposal p WHERE p.developerId = :developerId ORDER BY p.createdAt DESC")
  List<Proposal> findByDeveloperId(@Param("developerId") UUID developerId);

  @Query(
      """
      SELECT p FROM Proposal p
      WHERE p.projectId = :projectId AND p.status = :status
      ORDER BY p.createdAt ASC
      """)
  List<Proposal> findByProjectIdAndStatus(
      @Param("projectId") UUID projectId, @Param("status") ProposalStatus status);

  @Query(
      """
      SELECT COUNT(p) > 0 FROM Proposal p
      WHERE p.projectId = :projectId
        AND p.developerId = :developerId
        AND p.status IN :statuses
      """)
  boolean existsByProjectIdAndDeveloperIdAndStatusIn(
      @Param("projectId") UUID projectId,
      @Param("developerId") UUID developerId,
      @Param("statuses") Collection<ProposalStatus> statuses);

  long countByStatus(ProposalStatus status);

  @Modifying
  @Query("DELETE FROM Proposal p WHERE p.projectId = :projectId")
  int deleteByProjectId(@Param("projectId") UUID projectId);
}
