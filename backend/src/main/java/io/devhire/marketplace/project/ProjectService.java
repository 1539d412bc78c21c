package io.devhire.marketplace.project;

import io.devhire.marketplace.audit.AuditEventBuilder;
import io.devhire.marketplace.audit.AuditService;
import io.devhire.marketplace.exception.ForbiddenException;
import io.devhire.marketplace.exception.InvalidStateException;
import io.devhire.marketplace.exception.ResourceNotFoundException;
import io.devhire.marketplace.proposal.ProposalRepository;
import io.devhire.marketplace.proposal.ProposalStatus;
import io.devhire.marketplace.security.Actor;
import io.devhire.marketplace.task.TaskRepository;
import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Project registry: buyers list work, and only the owning buyer changes a listing. */
@Service
public class ProjectService {

  private static final Logger log = LoggerFactory.getLogger(ProjectService.class);

  private final ProjectRepository projectRepository;
  private final ProposalRepository proposalRepository;
  private final TaskRepository taskRepository;
  private final AuditService auditService;

  public ProjectService(
      ProjectRepository projectRepository,
      ProposalRepository proposalRepository,
      TaskRepository taskRepository,
      AuditService auditService) {
    this.projectRepository = projectRepository;
    this.proposalRepository = proposalRepository;
    this.taskRepository = taskRepository;
    this.auditService = auditService;
  }

  @Transactional
  public Project create(
      Actor actor,
      String title,
      String description,
      BigDecimal expectedHourlyRate,
      BigDecimal expectedDurationHours,
      Collection<String> tags) {
    if (!actor.isBuyer()) {
      throw new ForbiddenException("Cannot create project", "Only buyers can post projects");
    }

    var project =
        projectRepository.save(
            new Project(
                actor.id(), title, description, expectedHourlyRate, expectedDurationHours, tags));
    log.info("Created project {} for buyer {}", project.getId(), actor.id());

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("project.created")
            .entityType("project")
            .entityId(project.getId())
            .actor(actor)
            .details(Map.of("title", project.getTitle()))
            .build());

    return project;
  }

  @Transactional(readOnly = true)
  public Project get(Actor actor, UUID projectId) {
    return projectRepository
        .findById(projectId)
        .orElseThrow(() -> new ResourceNotFoundException("Project", projectId));
  }

  @Transactional(readOnly = true)
  public List<Project> listOpen(Actor actor) {
    return projectRepository.findByStatus(ProjectStatus.OPEN);
  }

  @Transactional(readOnly = true)
  public List<Project> listMine(Actor actor) {
    if (!actor.isBuyer()) {
      throw new ForbiddenException("Cannot list projects", "Only buyers own projects");
    }
    return projectRepository.findByBuyerId(actor.id());
  }

  @Transactional
  public Project update(
      Actor actor,
      UUID projectId,
      String title,
      String description,
      BigDecimal expectedHourlyRate,
      BigDecimal expectedDurationHours,
      Collection<String> tags) {
    var project = requireOwnedForUpdate(actor, projectId, "update");
    project.update(title, description, expectedHourlyRate, expectedDurationHours, tags);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("project.updated")
            .entityType("project")
            .entityId(projectId)
            .actor(actor)
            .details(Map.of("title", project.getTitle()))
            .build());

    return project;
  }

  /** Closes an OPEN listing without hiring anyone. Pending proposals stay as they are. */
  @Transactional
  public Project close(Actor actor, UUID projectId) {
    var project = requireOwnedForUpdate(actor, projectId, "close");
    project.close();
    log.info("Project {} closed by owner", projectId);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("project.closed")
            .entityType("project")
            .entityId(projectId)
            .actor(actor)
            .details(Map.of("reason", "closed_by_owner"))
            .build());

    return project;
  }

  /**
   * Deletes a listing together with its proposals. Refused once work was hired on it: any task or
   * an accepted proposal keeps the project alive.
   */
  @Transactional
  public void delete(Actor actor, UUID projectId) {
    var project = requireOwnedForUpdate(actor, projectId, "delete");

    if (taskRepository.countByProjectId(projectId) > 0
        || !proposalRepository
            .findByProjectIdAndStatus(projectId, ProposalStatus.ACCEPTED)
            .isEmpty()) {
      throw new InvalidStateException(
          "Project in use", "Cannot delete project " + projectId + " after a developer was hired");
    }

    int removedProposals = proposalRepository.deleteByProjectId(projectId);
    projectRepository.delete(project);
    log.info("Deleted project {} with {} proposals", projectId, removedProposals);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("project.deleted")
            .entityType("project")
            .entityId(projectId)
            .actor(actor)
            .details(Map.of("title", project.getTitle()))
            .build());
  }

  private Project requireOwnedForUpdate(Actor actor, UUID projectId, String action) {
    var project =
        projectRepository
            .findByIdForUpdate(projectId)
            .orElseThrow(() -> new ResourceNotFoundException("Project", projectId));
    if (!project.isOwnedBy(actor.id())) {
      throw new ForbiddenException(
          "Cannot " + action + " project", "Only the owning buyer can " + action + " project");
    }
    return project;
  }
}
