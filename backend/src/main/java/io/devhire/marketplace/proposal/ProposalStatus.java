package io.devhire.marketplace.proposal;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/** Proposal decision status. Every status other than PENDING is final. */
public enum ProposalStatus {
  PENDING,
  ACCEPTED,
  REJECTED,
  WITHDRAWN;

  private static final Map<ProposalStatus, Set<ProposalStatus>> ALLOWED_TRANSITIONS =
      Map.of(
          PENDING, Set.of(ACCEPTED, REJECTED, WITHDRAWN),
          ACCEPTED, Set.of(),
          REJECTED, Set.of(),
          WITHDRAWN, Set.of());

  public Set<ProposalStatus> allowedTransitions() {
    return ALLOWED_TRANSITIONS.getOrDefault(this, Set.of());
  }

  public boolean canTransitionTo(ProposalStatus target) {
    return allowedTransitions().contains(target);
  }

  /** PENDING and ACCEPTED proposals block the same developer from bidding again. */
  public boolean isActive() {
    return this == PENDING || this == ACCEPTED;
  }

  public static Set<ProposalStatus> activeStatuses() {
    return Arrays.stream(values())
        .filter(ProposalStatus::isActive)
        .collect(Collectors.toCollection(() -> EnumSet.noneOf(ProposalStatus.class)));
  }
}
