package io.devhire.marketplace.task;

import io.devhire.marketplace.exception.InvalidStateException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "tasks")
public class Task {

  /** Upper bounds that keep {@code hourlyRate * timeSpent} within the NUMERIC(12,2) amount. */
  public static final BigDecimal MAX_HOURLY_RATE = new BigDecimal("999999.99");

  public static final BigDecimal MAX_TIME_SPENT = new BigDecimal("9999.99");

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "project_id", nullable = false, updatable = false)
  private UUID projectId;

  @Column(name = "developer_id", nullable = false, updatable = false)
  private UUID developerId;

  @Column(name = "buyer_id", nullable = false, updatable = false)
  private UUID buyerId;

  @Column(name = "title", nullable = false, length = 255)
  private String title;

  @Column(name = "description", length = 4000)
  private String description;

  @Column(name = "hourly_rate", nullable = false, precision = 12, scale = 2)
  private BigDecimal hourlyRate;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private TaskStatus status;

  @Column(name = "solution_key", length = 255)
  private String solutionKey;

  @Column(name = "solution_filename", length = 255)
  private String solutionFilename;

  @Column(name = "time_spent", precision = 12, scale = 2)
  private BigDecimal timeSpent;

  @Version
  @Column(name = "version", nullable = false)
  private int version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  @Column(name = "submitted_at")
  private Instant submittedAt;

  @Column(name = "paid_at")
  private Instant paidAt;

  protected Task() {}

  public Task(
      UUID projectId,
      UUID developerId,
      UUID buyerId,
      String title,
      String description,
      BigDecimal hourlyRate) {
    this.projectId = projectId;
    this.developerId = developerId;
    this.buyerId = buyerId;
    this.title = title;
    this.description = description;
    this.hourlyRate = hourlyRate;
    this.status = TaskStatus.ASSIGNED;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  // --- Lifecycle transition methods ---

  /** Developer starts work. Only valid from ASSIGNED. */
  public void start() {
    requireTransition(TaskStatus.IN_PROGRESS, "start");
    this.status = TaskStatus.IN_PROGRESS;
    this.updatedAt = Instant.now();
  }

  /**
   * Attaches the stored solution archive and the hours worked. The handle and the hours are set
   * together with the status, never separately.
   */
  public void submit(String solutionKey, String solutionFilename, BigDecimal timeSpent) {
    requireTransition(TaskStatus.SUBMITTED, "submit");
    if (solutionKey == null || solutionKey.isBlank()) {
      throw new InvalidStateException("Invalid submission", "Solution handle is required");
    }
    if (timeSpent == null || timeSpent.signum() <= 0) {
      throw new InvalidStateException("Invalid submission", "Time spent must be positive");
    }
    this.solutionKey = solutionKey;
    this.solutionFilename = solutionFilename;
    this.timeSpent = timeSpent;
    this.status = TaskStatus.SUBMITTED;
    this.submittedAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /** Marks the task paid. Only the payment ledger calls this, in the same transaction. */
  public void markPaid() {
    requireTransition(TaskStatus.PAID, "pay");
    this.status = TaskStatus.PAID;
    this.paidAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public boolean isAssignedTo(UUID userId) {
    return developerId.equals(userId);
  }

  public boolean isBoughtBy(UUID userId) {
    return buyerId.equals(userId);
  }

  private void requireTransition(TaskStatus target, String action) {
    if (!status.canTransitionTo(target)) {
      throw new InvalidStateException(
          "Invalid task state", "Cannot " + action + " task in status " + status);
    }
  }

  public UUID getId() {
    return id;
  }

  public UUID getProjectId() {
    return projectId;
  }

  public UUID getDeveloperId() {
    return developerId;
  }

  public UUID getBuyerId() {
    return buyerId;
  }

  public String getTitle() {
    return title;
  }

  public String getDescription() {
    return description;
  }

  public BigDecimal getHourlyRate() {
    return hourlyRate;
  }

  public TaskStatus getStatus() {
    return status;
  }

  public String getSolutionKey() {
    return solutionKey;
  }

  public String getSolutionFilename() {
    return solutionFilename;
  }

  public BigDecimal getTimeSpent() {
    return timeSpent;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public Instant getSubmittedAt() {
    return submittedAt;
  }

  public Instant getPaidAt() {
    return paidAt;
  }
}
