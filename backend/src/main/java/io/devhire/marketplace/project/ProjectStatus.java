package io.devhire.marketplace.project;

import java.util.Map;
import java.util.Set;

/** Project listing status. A project leaves OPEN once and never returns. */
public enum ProjectStatus {
  OPEN,
  CLOSED;

  private static final Map<ProjectStatus, Set<ProjectStatus>> ALLOWED_TRANSITIONS =
      Map.of(OPEN, Set.of(CLOSED), CLOSED, Set.of());

  public Set<ProjectStatus> allowedTransitions() {
    return ALLOWED_TRANSITIONS.getOrDefault(this, Set.of());
  }

  public boolean canTransitionTo(ProjectStatus target) {
    return allowedTransitions().contains(target);
  }
}
