package io.devhire.marketplace.payment;

import io.devhire.marketplace.audit.AuditEventBuilder;
import io.devhire.marketplace.audit.AuditService;
import io.devhire.marketplace.exception.ForbiddenException;
import io.devhire.marketplace.exception.InvalidStateException;
import io.devhire.marketplace.exception.ResourceNotFoundException;
import io.devhire.marketplace.security.Actor;
import io.devhire.marketplace.task.TaskRepository;
import io.devhire.marketplace.task.TaskStatus;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.hibernate.exception.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Payment ledger. A payment row exists exactly for the tasks in status PAID. */
@Service
public class PaymentService {

  private static final Logger log = LoggerFactory.getLogger(PaymentService.class);

  static final String TASK_UNIQUE_CONSTRAINT = "uq_payments_task";

  private final PaymentRepository paymentRepository;
  private final TaskRepository taskRepository;
  private final AuditService auditService;

  public PaymentService(
      PaymentRepository paymentRepository,
      TaskRepository taskRepository,
      AuditService auditService) {
    this.paymentRepository = paymentRepository;
    this.taskRepository = taskRepository;
    this.auditService = auditService;
  }

  /**
   * Records the buyer's payment for a submitted task and marks the task PAID. The task row is
   * locked before the status check, so of two concurrent calls exactly one succeeds and the other
   * sees PAID.
   */
  @Transactional
  public Payment pay(Actor actor, UUID taskId) {
    var task =
        taskRepository
            .findByIdForUpdate(taskId)
            .orElseThrow(() -> new ResourceNotFoundException("Task", taskId));
    if (!task.isBoughtBy(actor.id())) {
      throw new ForbiddenException(
          "Cannot pay task", "Only the buyer of task " + taskId + " can pay for it");
    }
    if (task.getStatus() != TaskStatus.SUBMITTED) {
      throw new InvalidStateException(
          "Invalid task state", "Cannot pay task in status " + task.getStatus());
    }

    if (paymentRepository.existsByTaskId(taskId)) {
      throw alreadyPaid(taskId);
    }

    var amount = Payment.amountFor(task.getHourlyRate(), task.getTimeSpent());
    Payment payment;
    try {
      payment = paymentRepository.saveAndFlush(new Payment(taskId, task.getBuyerId(), amount));
    } catch (DataIntegrityViolationException e) {
      if (violates(e, TASK_UNIQUE_CONSTRAINT)) {
        throw alreadyPaid(taskId);
      }
      throw e;
    }
    task.markPaid();
    log.info("Recorded payment {} of {} for task {}", payment.getId(), amount, taskId);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("payment.created")
            .entityType("payment")
            .entityId(payment.getId())
            .actor(actor)
            .details(
                Map.of(
                    "task_id", taskId.toString(),
                    "amount", amount.toPlainString(),
                    "time_spent", task.getTimeSpent().toPlainString()))
            .build());

    return payment;
  }

  @Transactional(readOnly = true)
  public List<Payment> listMine(Actor actor) {
    if (!actor.isBuyer()) {
      throw new ForbiddenException("Cannot list payments", "Only buyers make payments");
    }
    return paymentRepository.findByBuyerId(actor.id());
  }

  @Transactional(readOnly = true)
  public Payment get(Actor actor, UUID paymentId) {
    var payment =
        paymentRepository
            .findById(paymentId)
            .orElseThrow(() -> new ResourceNotFoundException("Payment", paymentId));
    if (actor.isAdmin() || payment.getBuyerId().equals(actor.id())) {
      return payment;
    }
    boolean isTaskDeveloper =
        taskRepository
            .findById(payment.getTaskId())
            .map(task -> task.isAssignedTo(actor.id()))
            .orElse(false);
    if (!isTaskDeveloper) {
      throw new ForbiddenException(
          "Cannot view payment", "Payment " + paymentId + " is not visible to you");
    }
    return payment;
  }

  private static InvalidStateException alreadyPaid(UUID taskId) {
    return new InvalidStateException("Already paid", "Task " + taskId + " was already paid");
  }

  private static boolean violates(DataIntegrityViolationException e, String constraintName) {
    for (Throwable cause = e.getCause(); cause != null; cause = cause.getCause()) {
      if (cause instanceof ConstraintViolationException cve) {
        return constraintName.equalsIgnoreCase(cve.getConstraintName());
      }
    }
    return false;
  }
}
