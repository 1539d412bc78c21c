package io.devhire.marketplace.payment;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PaymentRepository extends JpaRepository<Payment, UUID> {

  Optional<Payment> findByTaskId(UUID taskId);

  boolean existsByTaskId(UUID taskId);

  @Query("SELECT p FROM Payment p WHERE p.buyerId = :buyerId ORDER BY p.createdAt DESC")
  List<Payment> findByBuyerId(@Param("buyerId") UUID buyerId);

  @Query("SELECT COALESCE(SUM(p.amount), 0) FROM Payment p")
  BigDecimal sumAmount();
}
