package io.devhire.marketplace.payment;

import io.devhire.marketplace.exception.PaymentRequiredException;
import io.devhire.marketplace.exception.ResourceNotFoundException;
import io.devhire.marketplace.security.Actor;
import io.devhire.marketplace.task.Task;
import io.devhire.marketplace.task.TaskRepository;
import java.util.UUID;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Decides whether a task's solution archive may be handed out. The only caller that reads solution
 * bytes goes through {@link #authorizeRelease(Actor, Task)} first.
 */
@Component
public class ReleaseGate {

  private final PaymentRepository paymentRepository;
  private final TaskRepository taskRepository;

  public ReleaseGate(PaymentRepository paymentRepository, TaskRepository taskRepository) {
    this.paymentRepository = paymentRepository;
    this.taskRepository = taskRepository;
  }

  @Transactional(readOnly = true)
  public Payment authorizeRelease(Actor actor, UUID taskId) {
    var task =
        taskRepository
            .findById(taskId)
            .orElseThrow(() -> new ResourceNotFoundException("Task", taskId));
    return authorizeRelease(actor, task);
  }

  /**
   * Returns the payment that unlocks the task's solution for this actor.
   *
   * @throws PaymentRequiredException unless a payment exists and the actor is the buyer who made
   *     it
   */
  @Transactional(readOnly = true)
  public Payment authorizeRelease(Actor actor, Task task) {
    var payment =
        paymentRepository
            .findByTaskId(task.getId())
            .orElseThrow(() -> new PaymentRequiredException(task.getId()));
    if (!task.isBoughtBy(actor.id()) || !payment.getBuyerId().equals(actor.id())) {
      throw new PaymentRequiredException(task.getId());
    }
    return payment;
  }
}
