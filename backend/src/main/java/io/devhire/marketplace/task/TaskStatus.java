package io.devhire.marketplace.task;

import java.util.Map;
import java.util.Set;

/** Task lifecycle status. Transitions go forward one step at a time. */
public enum TaskStatus {
  ASSIGNED,
  IN_PROGRESS,
  SUBMITTED,
  PAID;

  private static final Map<TaskStatus, Set<TaskStatus>> ALLOWED_TRANSITIONS =
      Map.of(
          ASSIGNED, Set.of(IN_PROGRESS),
          IN_PROGRESS, Set.of(SUBMITTED),
          SUBMITTED, Set.of(PAID),
          PAID, Set.of());

  /** Returns the set of statuses this status can transition to. */
  public Set<TaskStatus> allowedTransitions() {
    return ALLOWED_TRANSITIONS.getOrDefault(this, Set.of());
  }

  /** Returns true if transitioning from this status to the target is allowed. */
  public boolean canTransitionTo(TaskStatus target) {
    return allowedTransitions().contains(target);
  }

  /**
   * Returns true for statuses that are only reachable through a dedicated operation (solution
   * submission or payment) rather than a plain status change.
   */
  public boolean isGuarded() {
    return this == SUBMITTED || this == PAID;
  }

  /** Returns true if a solution archive is attached in this status. */
  public boolean hasSolution() {
    return this == SUBMITTED || this == PAID;
  }
}
