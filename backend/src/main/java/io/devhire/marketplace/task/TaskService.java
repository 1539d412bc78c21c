package io.devhire.marketplace.task;

import io.devhire.marketplace.audit.AuditEventBuilder;
import io.devhire.marketplace.audit.AuditService;
import io.devhire.marketplace.exception.ForbiddenException;
import io.devhire.marketplace.exception.InvalidStateException;
import io.devhire.marketplace.exception.ResourceNotFoundException;
import io.devhire.marketplace.payment.ReleaseGate;
import io.devhire.marketplace.project.ProjectRepository;
import io.devhire.marketplace.proposal.ProposalRepository;
import io.devhire.marketplace.proposal.ProposalStatus;
import io.devhire.marketplace.security.Actor;
import io.devhire.marketplace.storage.StorageService;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class TaskService {

  private static final Logger log = LoggerFactory.getLogger(TaskService.class);

  private final TaskRepository taskRepository;
  private final ProjectRepository projectRepository;
  private final ProposalRepository proposalRepository;
  private final ReleaseGate releaseGate;
  private final StorageService storageService;
  private final AuditService auditService;

  public TaskService(
      TaskRepository taskRepository,
      ProjectRepository projectRepository,
      ProposalRepository proposalRepository,
      ReleaseGate releaseGate,
      StorageService storageService,
      AuditService auditService) {
    this.taskRepository = taskRepository;
    this.projectRepository = projectRepository;
    this.proposalRepository = proposalRepository;
    this.releaseGate = releaseGate;
    this.storageService = storageService;
    this.auditService = auditService;
  }

  /**
   * Creates an ASSIGNED task on the buyer's project. Once a proposal on the project was accepted,
   * only its author can be assigned. Takes the same project row lock as accepting a proposal, so
   * the accepted-author check sees any acceptance that committed first.
   */
  @Transactional
  public Task assign(
      Actor actor,
      UUID projectId,
      UUID developerId,
      BigDecimal hourlyRate,
      String title,
      String description) {
    var project =
        projectRepository
            .findByIdForUpdate(projectId)
            .orElseThrow(() -> new ResourceNotFoundException("Project", projectId));
    if (!project.isOwnedBy(actor.id())) {
      throw new ForbiddenException(
          "Cannot assign task", "Only the owning buyer can assign work on project " + projectId);
    }
    if (hourlyRate == null || hourlyRate.signum() <= 0) {
      throw new InvalidStateException("Invalid task", "Hourly rate must be positive");
    }
    if (hourlyRate.compareTo(Task.MAX_HOURLY_RATE) > 0) {
      throw new InvalidStateException(
          "Invalid task", "Hourly rate must not exceed " + Task.MAX_HOURLY_RATE);
    }

    var accepted = proposalRepository.findByProjectIdAndStatus(projectId, ProposalStatus.ACCEPTED);
    if (accepted.stream().anyMatch(p -> !p.getDeveloperId().equals(developerId))) {
      throw new InvalidStateException(
          "Developer not hired",
          "Project " + projectId + " has an accepted proposal from another developer");
    }

    String taskTitle = title != null && !title.isBlank() ? title : project.getTitle();
    String taskDescription = description != null ? description : project.getDescription();
    var task =
        taskRepository.save(
            new Task(
                projectId,
                developerId,
                project.getBuyerId(),
                taskTitle,
                taskDescription,
                hourlyRate));
    log.info(
        "Assigned task {} in project {} to developer {}", task.getId(), projectId, developerId);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("task.assigned")
            .entityType("task")
            .entityId(task.getId())
            .actor(actor)
            .details(
                Map.of(
                    "project_id", projectId.toString(),
                    "developer_id", developerId.toString(),
                    "hourly_rate", hourlyRate.toPlainString()))
            .build());

    return task;
  }

  /**
   * Moves the task one step forward on behalf of its developer. SUBMITTED and PAID are reachable
   * only through submission and payment.
   */
  @Transactional
  public Task advance(Actor actor, UUID taskId, TaskStatus newStatus) {
    var task =
        taskRepository
            .findByIdForUpdate(taskId)
            .orElseThrow(() -> new ResourceNotFoundException("Task", taskId));
    if (!task.isAssignedTo(actor.id())) {
      throw new ForbiddenException(
          "Cannot update task", "Only the assigned developer can advance task " + taskId);
    }
    if (newStatus == null || newStatus.isGuarded()) {
      throw new InvalidStateException(
          "Invalid task state", "Status " + newStatus + " cannot be set directly");
    }

    var oldStatus = task.getStatus();
    // IN_PROGRESS is the only status a developer sets directly
    if (newStatus == TaskStatus.IN_PROGRESS) {
      task.start();
    } else {
      throw new InvalidStateException(
          "Invalid task state", "Cannot move task from " + oldStatus + " to " + newStatus);
    }
    log.info("Task {} moved from {} to {}", taskId, oldStatus, newStatus);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("task.status_changed")
            .entityType("task")
            .entityId(taskId)
            .actor(actor)
            .details(Map.of("from", oldStatus.name(), "to", newStatus.name()))
            .build());

    return task;
  }

  @Transactional(readOnly = true)
  public Task get(Actor actor, UUID taskId) {
    var task =
        taskRepository
            .findById(taskId)
            .orElseThrow(() -> new ResourceNotFoundException("Task", taskId));
    if (!actor.isAdmin() && !task.isAssignedTo(actor.id()) && !task.isBoughtBy(actor.id())) {
      throw new ForbiddenException("Cannot view task", "Task " + taskId + " is not yours");
    }
    return task;
  }

  @Transactional(readOnly = true)
  public List<Task> listForProject(Actor actor, UUID projectId) {
    var project =
        projectRepository
            .findById(projectId)
            .orElseThrow(() -> new ResourceNotFoundException("Project", projectId));
    if (!actor.isAdmin() && !project.isOwnedBy(actor.id())) {
      throw new ForbiddenException(
          "Cannot list tasks", "Only the owning buyer can list tasks of project " + projectId);
    }
    return taskRepository.findByProjectId(projectId);
  }

  /** Developers see tasks assigned to them, buyers the tasks they pay for. */
  @Transactional(readOnly = true)
  public List<Task> listMine(Actor actor) {
    if (actor.isDeveloper()) {
      return taskRepository.findByDeveloperId(actor.id());
    }
    if (actor.isBuyer()) {
      return taskRepository.findByBuyerId(actor.id());
    }
    throw new ForbiddenException("Cannot list tasks", "Admins have no tasks of their own");
  }

  /** Hands the solution archive to the paying buyer. */
  @Transactional(readOnly = true)
  public SolutionDownload getDownload(Actor actor, UUID taskId) {
    var task =
        taskRepository
            .findById(taskId)
            .orElseThrow(() -> new ResourceNotFoundException("Task", taskId));
    if (!task.isBoughtBy(actor.id())) {
      throw new ForbiddenException(
          "Cannot download solution", "Only the buyer of task " + taskId + " can download it");
    }
    releaseGate.authorizeRelease(actor, task);

    byte[] content = storageService.download(task.getSolutionKey());
    log.info("Released solution of task {} to buyer {}", taskId, actor.id());
    return new SolutionDownload(taskId, task.getSolutionFilename(), content);
  }
}
