package io.devhire.marketplace.task;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TaskStatusTest {

  @Test
  void canTransitionTo_onlyImmediateSuccessor() {
    assertThat(TaskStatus.ASSIGNED.allowedTransitions()).containsExactly(TaskStatus.IN_PROGRESS);
    assertThat(TaskStatus.IN_PROGRESS.allowedTransitions()).containsExactly(TaskStatus.SUBMITTED);
    assertThat(TaskStatus.SUBMITTED.allowedTransitions()).containsExactly(TaskStatus.PAID);
    assertThat(TaskStatus.PAID.allowedTransitions()).isEmpty();
  }

  @Test
  void canTransitionTo_rejectsSkippedStep() {
    assertThat(TaskStatus.ASSIGNED.canTransitionTo(TaskStatus.SUBMITTED)).isFalse();
    assertThat(TaskStatus.IN_PROGRESS.canTransitionTo(TaskStatus.PAID)).isFalse();
    assertThat(TaskStatus.SUBMITTED.canTransitionTo(TaskStatus.IN_PROGRESS)).isFalse();
  }

  @Test
  void isGuarded_submittedAndPaidCarryASolution() {
    assertThat(TaskStatus.SUBMITTED.isGuarded()).isTrue();
    assertThat(TaskStatus.PAID.isGuarded()).isTrue();
    assertThat(TaskStatus.IN_PROGRESS.isGuarded()).isFalse();
    assertThat(TaskStatus.ASSIGNED.hasSolution()).isFalse();
    assertThat(TaskStatus.PAID.hasSolution()).isTrue();
  }
}
