package io.devhire.marketplace.project;

import io.devhire.marketplace.exception.InvalidStateException;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

@Entity
@Table(name = "projects")
public class Project {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "buyer_id", nullable = false, updatable = false)
  private UUID buyerId;

  @Column(name = "title", nullable = false, length = 255)
  private String title;

  @Column(name = "description", length = 4000)
  private String description;

  @Column(name = "expected_hourly_rate", precision = 12, scale = 2)
  private BigDecimal expectedHourlyRate;

  @Column(name = "expected_duration_hours", precision = 12, scale = 2)
  private BigDecimal expectedDurationHours;

  @ElementCollection(fetch = FetchType.EAGER)
  @CollectionTable(name = "project_tags", joinColumns = @JoinColumn(name = "project_id"))
  @Column(name = "tag", nullable = false, length = 50)
  private Set<String> tags = new TreeSet<>();

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private ProjectStatus status;

  @Version
  @Column(name = "version", nullable = false)
  private int version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  @Column(name = "closed_at")
  private Instant closedAt;

  protected Project() {}

  public Project(
      UUID buyerId,
      String title,
      String description,
      BigDecimal expectedHourlyRate,
      BigDecimal expectedDurationHours,
      Collection<String> tags) {
    this.buyerId = buyerId;
    this.title = title;
    this.description = description;
    this.expectedHourlyRate = expectedHourlyRate;
    this.expectedDurationHours = expectedDurationHours;
    replaceTags(tags);
    this.status = ProjectStatus.OPEN;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /** Replaces the editable listing fields. Only an OPEN listing can be edited. */
  public void update(
      String title,
      String description,
      BigDecimal expectedHourlyRate,
      BigDecimal expectedDurationHours,
      Collection<String> tags) {
    if (status != ProjectStatus.OPEN) {
      throw new InvalidStateException(
          "Invalid project state", "Cannot update project in status " + status);
    }
    this.title = title;
    this.description = description;
    this.expectedHourlyRate = expectedHourlyRate;
    this.expectedDurationHours = expectedDurationHours;
    replaceTags(tags);
    this.updatedAt = Instant.now();
  }

  /** Closes the listing. Called when a proposal is accepted or by the owner directly. */
  public void close() {
    if (!status.canTransitionTo(ProjectStatus.CLOSED)) {
      throw new InvalidStateException(
          "Invalid project state", "Cannot close project in status " + status);
    }
    this.status = ProjectStatus.CLOSED;
    this.closedAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public boolean isOpen() {
    return status == ProjectStatus.OPEN;
  }

  public boolean isOwnedBy(UUID userId) {
    return buyerId.equals(userId);
  }

  private void replaceTags(Collection<String> newTags) {
    this.tags.clear();
    if (newTags != null) {
      newTags.stream().map(String::trim).filter(t -> !t.isEmpty()).forEach(this.tags::add);
    }
  }

  public UUID getId() {
    return id;
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

  public BigDecimal getExpectedHourlyRate() {
    return expectedHourlyRate;
  }

  public BigDecimal getExpectedDurationHours() {
    return expectedDurationHours;
  }

  public Set<String> getTags() {
    return tags;
  }

  public ProjectStatus getStatus() {
    return status;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public Instant getClosedAt() {
    return closedAt;
  }
}
