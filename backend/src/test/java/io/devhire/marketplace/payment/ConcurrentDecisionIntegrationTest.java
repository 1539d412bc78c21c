package io.devhire.marketplace.payment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.devhire.marketplace.TestcontainersConfiguration;
import io.devhire.marketplace.exception.InvalidStateException;
import io.devhire.marketplace.project.ProjectService;
import io.devhire.marketplace.proposal.ProposalRepository;
import io.devhire.marketplace.proposal.ProposalService;
import io.devhire.marketplace.proposal.ProposalStatus;
import io.devhire.marketplace.security.Actor;
import io.devhire.marketplace.task.TaskRepository;
import io.devhire.marketplace.task.TaskService;
import io.devhire.marketplace.task.TaskStatus;
import io.devhire.marketplace.task.TaskSubmissionService;
import java.math.BigDecimal;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.support.TransactionTemplate;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class ConcurrentDecisionIntegrationTest {

  @Autowired private ProjectService projectService;
  @Autowired private ProposalService proposalService;
  @Autowired private TaskService taskService;
  @Autowired private TaskSubmissionService taskSubmissionService;
  @Autowired private PaymentService paymentService;
  @Autowired private PaymentRepository paymentRepository;
  @Autowired private ProposalRepository proposalRepository;
  @Autowired private TaskRepository taskRepository;
  @Autowired private TransactionTemplate transactionTemplate;

  @Test
  void pay_concurrentCallsRecordExactlyOnePayment() throws Exception {
    var buyer = Actor.buyer(UUID.randomUUID());
    var developer = Actor.developer(UUID.randomUUID());
    var project = projectService.create(buyer, "Race", null, null, null, Set.of());
    var task =
        taskService.assign(
            buyer, project.getId(), developer.id(), new BigDecimal("40.00"), null, null);
    taskService.advance(developer, task.getId(), TaskStatus.IN_PROGRESS);
    taskSubmissionService.submit(
        developer, task.getId(), new byte[] {1, 2}, "race.zip", "application/zip", BigDecimal.TEN);

    var outcome = race(() -> paymentService.pay(buyer, task.getId()));

    assertThat(outcome.successes()).hasSize(1);
    assertThat(outcome.errors())
        .singleElement()
        .isInstanceOf(InvalidStateException.class);
    assertThat(paymentRepository.findByTaskId(task.getId())).isPresent();
    assertThat(paymentRepository.findByTaskId(task.getId()).get().getAmount())
        .isEqualByComparingTo("400.00");
    assertThat(taskRepository.findById(task.getId()).orElseThrow().getStatus())
        .isEqualTo(TaskStatus.PAID);
  }

  @Test
  void accept_concurrentCallsHireExactlyOneDeveloper() throws Exception {
    var buyer = Actor.buyer(UUID.randomUUID());
    var project = projectService.create(buyer, "Contested", null, null, null, Set.of());
    var first =
        proposalService.submit(
            Actor.developer(UUID.randomUUID()), project.getId(), null, BigDecimal.ONE, null);
    var second =
        proposalService.submit(
            Actor.developer(UUID.randomUUID()), project.getId(), null, BigDecimal.TEN, null);
    var ids = new ConcurrentLinkedQueue<>(List.of(first.getId(), second.getId()));

    var outcome = race(() -> proposalService.accept(buyer, ids.poll()));

    assertThat(outcome.successes()).hasSize(1);
    assertThat(outcome.errors())
        .singleElement()
        .isInstanceOf(InvalidStateException.class);
    assertThat(
            proposalRepository.findByProjectIdAndStatus(project.getId(), ProposalStatus.ACCEPTED))
        .hasSize(1);
    assertThat(projectService.get(buyer, project.getId()).isOpen()).isFalse();
  }

  @Test
  void assign_waitsForInFlightAcceptAndRejectsOtherDeveloper() throws Exception {
    var buyer = Actor.buyer(UUID.randomUUID());
    var hired = Actor.developer(UUID.randomUUID());
    var outsider = Actor.developer(UUID.randomUUID());
    var project = projectService.create(buyer, "Interleaved", null, null, null, Set.of());
    var proposal =
        proposalService.submit(hired, project.getId(), null, new BigDecimal("50.00"), null);

    var accepted = new CountDownLatch(1);
    var commit = new CountDownLatch(1);
    var executor = Executors.newFixedThreadPool(2);
    try {
      var acceptance =
          executor.submit(
              () ->
                  transactionTemplate.execute(
                      status -> {
                        proposalService.accept(buyer, proposal.getId());
                        accepted.countDown();
                        awaitQuietly(commit);
                        return null;
                      }));
      assertThat(accepted.await(10, TimeUnit.SECONDS)).isTrue();

      var assignment =
          executor.submit(
              () ->
                  taskService.assign(
                      buyer, project.getId(), outsider.id(), new BigDecimal("60.00"), null, null));

      // Blocked on the project row held by the open acceptance
      Thread.sleep(500);
      assertThat(assignment.isDone()).isFalse();

      commit.countDown();
      acceptance.get(10, TimeUnit.SECONDS);

      assertThatThrownBy(() -> assignment.get(10, TimeUnit.SECONDS))
          .isInstanceOf(ExecutionException.class)
          .cause()
          .isInstanceOf(InvalidStateException.class)
          .satisfies(
              e ->
                  assertThat(((InvalidStateException) e).getBody().getTitle())
                      .isEqualTo("Developer not hired"));
    } finally {
      commit.countDown();
      executor.shutdown();
      assertThat(executor.awaitTermination(15, TimeUnit.SECONDS)).isTrue();
    }

    assertThat(taskRepository.findByProjectId(project.getId())).isEmpty();
    assertThat(
            proposalRepository.findByProjectIdAndStatus(project.getId(), ProposalStatus.ACCEPTED))
        .singleElement()
        .satisfies(p -> assertThat(p.getDeveloperId()).isEqualTo(hired.id()));
  }

  private static void awaitQuietly(CountDownLatch latch) {
    try {
      if (!latch.await(10, TimeUnit.SECONDS)) {
        throw new IllegalStateException("Timed out holding the acceptance open");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException(e);
    }
  }

  private <T> Outcome<T> race(Callable<T> action) throws InterruptedException {
    var latch = new CountDownLatch(1);
    var successes = new ConcurrentLinkedQueue<T>();
    var errors = new ConcurrentLinkedQueue<Throwable>();
    var executor = Executors.newFixedThreadPool(2);

    for (int i = 0; i < 2; i++) {
      executor.submit(
          () -> {
            try {
              latch.await();
              successes.add(action.call());
            } catch (Exception e) {
              errors.add(e);
            }
          });
    }

    // Release both threads at the same time
    latch.countDown();

    executor.shutdown();
    assertThat(executor.awaitTermination(15, TimeUnit.SECONDS)).isTrue();
    return new Outcome<>(List.copyOf(successes), List.copyOf(errors));
  }

  private record Outcome<T>(List<T> successes, List<Throwable> errors) {}
}
