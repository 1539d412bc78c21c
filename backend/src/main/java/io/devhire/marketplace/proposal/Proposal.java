package io.devhire.marketplace.proposal;

import io.devhire.marketplace.exception.InvalidStateException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "proposals")
public class Proposal {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "project_id", nullable = false, updatable = false)
  private UUID projectId;

  @Column(name = "developer_id", nullable = false, updatable = false)
  private UUID developerId;

  @Column(name = "cover_letter", length = 4000, updatable = false)
  private String coverLetter;

  @Column(name = "proposed_hourly_rate", nullable = false, precision = 12, scale = 2)
  private BigDecimal proposedHourlyRate;

  @Column(name = "estimated_hours", precision = 12, scale = 2)
  private BigDecimal estimatedHours;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private ProposalStatus status;

  @Version
  @Column(name = "version", nullable = false)
  private int version;

  @Column(name = "decided_at")
  private Instant decidedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Proposal() {}

  public Proposal(
      UUID projectId,
      UUID developerId,
      String coverLetter,
      BigDecimal proposedHourlyRate,
      BigDecimal estimatedHours) {
    this.projectId = projectId;
    this.developerId = developerId;
    this.coverLetter = coverLetter;
    this.proposedHourlyRate = proposedHourlyRate;
    this.estimatedHours = estimatedHours;
    this.status = ProposalStatus.PENDING;
  }

  @PrePersist
  void onPrePersist() {
    var now = Instant.now();
    this.createdAt = now;
    this.updatedAt = now;
  }

  @PreUpdate
  void onPreUpdate() {
    this.updatedAt = Instant.now();
  }

  // --- Lifecycle transitions ---

  public void accept() {
    requireTransition(ProposalStatus.ACCEPTED, "accept");
    this.status = ProposalStatus.ACCEPTED;
    this.decidedAt = Instant.now();
  }

  public void reject() {
    requireTransition(ProposalStatus.REJECTED, "reject");
    this.status = ProposalStatus.REJECTED;
    this.decidedAt = Instant.now();
  }

  public void withdraw() {
    requireTransition(ProposalStatus.WITHDRAWN, "withdraw");
    this.status = ProposalStatus.WITHDRAWN;
    this.decidedAt = Instant.now();
  }

  public boolean isAuthoredBy(UUID userId) {
    return developerId.equals(userId);
  }

  private void requireTransition(ProposalStatus target, String action) {
    if (!status.canTransitionTo(target)) {
      throw new InvalidStateException(
          "Invalid proposal state", "Cannot " + action + " proposal in status " + status);
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

  public String getCoverLetter() {
    return coverLetter;
  }

  public BigDecimal getProposedHourlyRate() {
    return proposedHourlyRate;
  }

  public BigDecimal getEstimatedHours() {
    return estimatedHours;
  }

  public ProposalStatus getStatus() {
    return status;
  }

  public Instant getDecidedAt() {
    return decidedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
