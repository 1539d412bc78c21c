package io.devhire.marketplace.task;

import io.devhire.marketplace.audit.AuditEventBuilder;
import io.devhire.marketplace.audit.AuditService;
import io.devhire.marketplace.exception.ForbiddenException;
import io.devhire.marketplace.exception.InvalidStateException;
import io.devhire.marketplace.exception.ResourceNotFoundException;
import io.devhire.marketplace.security.Actor;
import io.devhire.marketplace.storage.StorageKeys;
import io.devhire.marketplace.storage.StorageService;
import java.math.BigDecimal;
import java.util.HashMap;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Accepts a developer's solution archive for a task.
 *
 * <p>The archive is written to the blob store before any transaction or row lock is taken, so slow
 * uploads never hold the task row. The state change then runs in a short transaction that re-reads
 * the task under lock and re-validates it. A failed write leaves the task IN_PROGRESS; a failed
 * commit after a successful write removes the orphaned blob.
 */
@Service
public class TaskSubmissionService {

  private static final Logger log = LoggerFactory.getLogger(TaskSubmissionService.class);

  static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

  private final TaskRepository taskRepository;
  private final StorageService storageService;
  private final AuditService auditService;
  private final TransactionTemplate txTemplate;

  public TaskSubmissionService(
      TaskRepository taskRepository,
      StorageService storageService,
      AuditService auditService,
      PlatformTransactionManager txManager) {
    this.taskRepository = taskRepository;
    this.storageService = storageService;
    this.auditService = auditService;
    this.txTemplate = new TransactionTemplate(txManager);
  }

  public Task submit(
      Actor actor,
      UUID taskId,
      byte[] content,
      String filename,
      String contentType,
      BigDecimal timeSpent) {
    if (timeSpent == null || timeSpent.signum() <= 0) {
      throw new InvalidStateException("Invalid submission", "Time spent must be positive");
    }
    if (timeSpent.compareTo(Task.MAX_TIME_SPENT) > 0) {
      throw new InvalidStateException(
          "Invalid submission", "Time spent must not exceed " + Task.MAX_TIME_SPENT + " hours");
    }
    if (content == null || content.length == 0) {
      throw new InvalidStateException("Invalid submission", "Solution archive must not be empty");
    }

    // Fail fast before paying for an upload
    var snapshot =
        taskRepository
            .findById(taskId)
            .orElseThrow(() -> new ResourceNotFoundException("Task", taskId));
    requireSubmittable(actor, snapshot);

    String key = StorageKeys.solutionKey(taskId);
    storageService.upload(
        key, content, contentType != null ? contentType : DEFAULT_CONTENT_TYPE);

    try {
      return txTemplate.execute(tx -> recordSubmission(actor, taskId, key, filename, timeSpent));
    } catch (RuntimeException e) {
      log.warn("Submission of task {} not recorded, removing blob {}", taskId, key);
      storageService.delete(key);
      throw e;
    }
  }

  private Task recordSubmission(
      Actor actor, UUID taskId, String key, String filename, BigDecimal timeSpent) {
    var task =
        taskRepository
            .findByIdForUpdate(taskId)
            .orElseThrow(() -> new ResourceNotFoundException("Task", taskId));
    requireSubmittable(actor, task);

    task.submit(key, filename, timeSpent);
    log.info("Task {} submitted by developer {} ({} h)", taskId, actor.id(), timeSpent);

    var details = new HashMap<String, Object>();
    details.put("time_spent", timeSpent.toPlainString());
    if (filename != null) {
      details.put("filename", filename);
    }
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("task.submitted")
            .entityType("task")
            .entityId(taskId)
            .actor(actor)
            .details(details)
            .build());

    return task;
  }

  private static void requireSubmittable(Actor actor, Task task) {
    if (!task.isAssignedTo(actor.id())) {
      throw new ForbiddenException(
          "Cannot submit solution", "Only the assigned developer can submit task " + task.getId());
    }
    if (task.getStatus() != TaskStatus.IN_PROGRESS) {
      throw new InvalidStateException(
          "Invalid task state", "Cannot submit task in status " + task.getStatus());
    }
  }
}
