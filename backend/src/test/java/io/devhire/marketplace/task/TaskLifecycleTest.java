package io.devhire.marketplace.task;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.devhire.marketplace.exception.InvalidStateException;
import io.devhire.marketplace.testutil.TestEntityFactory;
import java.math.BigDecimal;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class TaskLifecycleTest {

  private static final UUID PROJECT_ID = UUID.randomUUID();
  private static final UUID DEVELOPER_ID = UUID.randomUUID();
  private static final UUID BUYER_ID = UUID.randomUUID();

  @Test
  void newTask_isAssignedWithoutSolution() {
    var task = newTask();

    assertThat(task.getStatus()).isEqualTo(TaskStatus.ASSIGNED);
    assertThat(task.getSolutionKey()).isNull();
    assertThat(task.getTimeSpent()).isNull();
  }

  @Test
  void start_transitionsToInProgress() {
    var task = newTask();

    task.start();

    assertThat(task.getStatus()).isEqualTo(TaskStatus.IN_PROGRESS);
  }

  @Test
  void start_twiceThrows() {
    var task = newTask();
    task.start();

    assertThatThrownBy(task::start)
        .isInstanceOf(InvalidStateException.class)
        .hasMessageContaining("Invalid task state");
  }

  @Test
  void submit_setsHandleAndHoursTogether() {
    var task = newTask();
    task.start();

    task.submit("tasks/x/solutions/y", "solution.zip", new BigDecimal("8.5"));

    assertThat(task.getStatus()).isEqualTo(TaskStatus.SUBMITTED);
    assertThat(task.getSolutionKey()).isEqualTo("tasks/x/solutions/y");
    assertThat(task.getSolutionFilename()).isEqualTo("solution.zip");
    assertThat(task.getTimeSpent()).isEqualByComparingTo("8.5");
    assertThat(task.getSubmittedAt()).isNotNull();
  }

  @Test
  void submit_fromAssignedThrowsAndLeavesTaskUntouched() {
    var task = newTask();

    assertThatThrownBy(() -> task.submit("key", "a.zip", BigDecimal.ONE))
        .isInstanceOf(InvalidStateException.class);
    assertThat(task.getStatus()).isEqualTo(TaskStatus.ASSIGNED);
    assertThat(task.getSolutionKey()).isNull();
  }

  @Test
  void submit_withNonPositiveHoursThrows() {
    var task = newTask();
    task.start();

    assertThatThrownBy(() -> task.submit("key", "a.zip", BigDecimal.ZERO))
        .isInstanceOf(InvalidStateException.class);
    assertThat(task.getStatus()).isEqualTo(TaskStatus.IN_PROGRESS);
    assertThat(task.getTimeSpent()).isNull();
  }

  @Test
  void markPaid_onlyAfterSubmission() {
    var task = newTask();
    task.start();

    assertThatThrownBy(task::markPaid).isInstanceOf(InvalidStateException.class);

    task.submit("key", "a.zip", BigDecimal.TEN);
    task.markPaid();

    assertThat(task.getStatus()).isEqualTo(TaskStatus.PAID);
    assertThat(task.getPaidAt()).isNotNull();
    assertThat(task.getSolutionKey()).isEqualTo("key");
  }

  @Test
  void ownership_checks() {
    var task = newTask();

    assertThat(task.isAssignedTo(DEVELOPER_ID)).isTrue();
    assertThat(task.isAssignedTo(BUYER_ID)).isFalse();
    assertThat(task.isBoughtBy(BUYER_ID)).isTrue();
  }

  private static Task newTask() {
    return TestEntityFactory.task(UUID.randomUUID(), PROJECT_ID, DEVELOPER_ID, BUYER_ID);
  }
}
