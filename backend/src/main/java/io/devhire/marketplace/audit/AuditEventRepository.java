package io.devhire.marketplace.audit;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AuditEventRepository extends JpaRepository<AuditEvent, UUID> {

  @Query(
      """
      SELECT e FROM AuditEvent e
      WHERE e.entityType = :entityType AND e.entityId = :entityId
      ORDER BY e.occurredAt ASC
      """)
  List<AuditEvent> findByEntity(
      @Param("entityType") String entityType, @Param("entityId") UUID entityId);
}
