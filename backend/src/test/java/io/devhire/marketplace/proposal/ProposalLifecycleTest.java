package io.devhire.marketplace.proposal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.devhire.marketplace.exception.InvalidStateException;
import io.devhire.marketplace.testutil.TestEntityFactory;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class ProposalLifecycleTest {

  @Test
  void accept_pendingProposalOnlyOnce() {
    var proposal = newProposal();

    proposal.accept();

    assertThat(proposal.getStatus()).isEqualTo(ProposalStatus.ACCEPTED);
    assertThat(proposal.getDecidedAt()).isNotNull();
    assertThatThrownBy(proposal::accept)
        .isInstanceOf(InvalidStateException.class)
        .hasMessageContaining("Invalid proposal state");
  }

  @Test
  void accept_rejectsWithdrawnProposal() {
    var proposal = newProposal();
    proposal.withdraw();

    assertThatThrownBy(proposal::accept).isInstanceOf(InvalidStateException.class);
    assertThat(proposal.getStatus()).isEqualTo(ProposalStatus.WITHDRAWN);
  }

  @Test
  void withdraw_rejectsRejectedProposal() {
    var proposal = newProposal();
    proposal.reject();

    assertThatThrownBy(proposal::withdraw).isInstanceOf(InvalidStateException.class);
  }

  @Test
  void isActive_onlyPendingAndAccepted() {
    assertThat(ProposalStatus.PENDING.isActive()).isTrue();
    assertThat(ProposalStatus.ACCEPTED.isActive()).isTrue();
    assertThat(ProposalStatus.REJECTED.isActive()).isFalse();
    assertThat(ProposalStatus.WITHDRAWN.isActive()).isFalse();
    assertThat(ProposalStatus.activeStatuses())
        .containsExactlyInAnyOrder(ProposalStatus.PENDING, ProposalStatus.ACCEPTED);
  }

  private static Proposal newProposal() {
    return TestEntityFactory.proposal(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID());
  }
}
