package io.devhire.marketplace.payment;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.UUID;

/**
 * A recorded payment for one task. Append-only: there are no mutators, and {@code task_id} carries
 * a unique constraint so a task is paid at most once.
 */
@Entity
@Table(name = "payments")
public class Payment {

  static final int AMOUNT_SCALE = 2;

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "task_id", nullable = false, unique = true, updatable = false)
  private UUID taskId;

  @Column(name = "buyer_id", nullable = false, updatable = false)
  private UUID buyerId;

  @Column(name = "amount", nullable = false, precision = 12, scale = 2, updatable = false)
  private BigDecimal amount;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Payment() {}

  public Payment(UUID taskId, UUID buyerId, BigDecimal amount) {
    this.taskId = taskId;
    this.buyerId = buyerId;
    this.amount = amount;
    this.createdAt = Instant.now();
  }

  /** Amount owed for the given rate and hours, rounded half-up to cents. */
  public static BigDecimal amountFor(BigDecimal hourlyRate, BigDecimal timeSpent) {
    return hourlyRate.multiply(timeSpent).setScale(AMOUNT_SCALE, RoundingMode.HALF_UP);
  }

  public UUID getId() {
    return id;
  }

  public UUID getTaskId() {
    return taskId;
  }

  public UUID getBuyerId() {
    return buyerId;
  }

  public BigDecimal getAmount() {
    return amount;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
