package io.devhire.marketplace.task;

import jakarta.persistence.LockModeType;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TaskRepository extends JpaRepository<Task, UUID> {

  /** Loads the task with a row lock; submission, status changes and payment serialize on it. */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT t FROM Task t WHERE t.id = :id")
  Optional<Task> findByIdForUpdate(@Param("id") UUID id);

  @Query("SELECT t FROM Task t WHERE t.projectId = :projectId ORDER BY t.createdAt DESC")
  List<Task> findByProjectId(@Param("projectId") UUID projectId);

  @Query("SELECT t FROM Task t WHERE t.developerId = :developerId ORDER BY t.createdAt DESC")
  List<Task> findByDeveloperId(@Param("developerId") UUID developerId);

  @Query("SELECT t FROM Task t WHERE t.buyerId = :buyerId ORDER BY t.createdAt DESC")
  List<Task> findByBuyerId(@Param("buyerId") UUID buyerId);

  @Query("SELECT COUNT(t) FROM Task t WHERE t.projectId = :projectId")
  long countByProjectId(@Param("projectId") UUID projectId);

  long countByStatus(TaskStatus status);

  /** Sum of hours logged on submitted or paid tasks. */
  @Query("SELECT COALESCE(SUM(t.timeSpent), 0) FROM Task t WHERE t.timeSpent IS NOT NULL")
  BigDecimal sumTimeSpent();
}
