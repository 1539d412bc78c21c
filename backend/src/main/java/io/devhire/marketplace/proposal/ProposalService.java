package io.devhire.marketplace.proposal;

import io.devhire.marketplace.audit.AuditEventBuilder;
import io.devhire.marketplace.audit.AuditService;
import io.devhire.marketplace.exception.ForbiddenException;
import io.devhire.marketplace.exception.InvalidStateException;
import io.devhire.marketplace.exception.ResourceNotFoundException;
import io.devhire.marketplace.project.Project;
import io.devhire.marketplace.project.ProjectRepository;
import io.devhire.marketplace.security.Actor;
import io.devhire.marketplace.task.Task;
import io.devhire.marketplace.task.TaskService;
import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Proposal engine. Every operation that depends on the project's status takes the project row lock
 * first, so submissions, acceptances and rejections on one project run one at a time.
 */
@Service
public class ProposalService {

  private static final Logger log = LoggerFactory.getLogger(ProposalService.class);

  private final ProposalRepository proposalRepository;
  private final ProjectRepository projectRepository;
  private final TaskService taskService;
  private final AuditService auditService;

  public ProposalService(
      ProposalRepository proposalRepository,
      ProjectRepository projectRepository,
      TaskService taskService,
      AuditService auditService) {
    this.proposalRepository = proposalRepository;
    this.projectRepository = projectRepository;
    this.taskService = taskService;
    this.auditService = auditService;
  }

  @Transactional
  public Proposal submit(
      Actor actor,
      UUID projectId,
      String coverLetter,
      BigDecimal proposedHourlyRate,
      BigDecimal estimatedHours) {
    if (!actor.isDeveloper()) {
      throw new ForbiddenException("Cannot submit proposal", "Only developers can bid on projects");
    }
    if (proposedHourlyRate != null && proposedHourlyRate.compareTo(Task.MAX_HOURLY_RATE) > 0) {
      throw new InvalidStateException(
          "Invalid proposal", "Proposed hourly rate must not exceed " + Task.MAX_HOURLY_RATE);
    }
    var project = lockProject(projectId);
    if (!project.isOpen()) {
      throw new InvalidStateException(
          "Project not open", "Project " + projectId + " is not accepting proposals");
    }
    if (proposalRepository.existsByProjectIdAndDeveloperIdAndStatusIn(
        projectId, actor.id(), ProposalStatus.activeStatuses())) {
      throw new InvalidStateException(
          "Duplicate proposal", "You already have an active proposal on project " + projectId);
    }

    var proposal =
        proposalRepository.save(
            new Proposal(projectId, actor.id(), coverLetter, proposedHourlyRate, estimatedHours));
    log.info(
        "Developer {} submitted proposal {} on project {}",
        actor.id(),
        proposal.getId(),
        projectId);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("proposal.submitted")
            .entityType("proposal")
            .entityId(proposal.getId())
            .actor(actor)
            .details(
                Map.of(
                    "project_id", projectId.toString(),
                    "proposed_hourly_rate", proposedHourlyRate.toPlainString()))
            .build());

    return proposal;
  }

  @Transactional
  public Proposal withdraw(Actor actor, UUID proposalId) {
    var proposal =
        proposalRepository
            .findByIdForUpdate(proposalId)
            .orElseThrow(() -> new ResourceNotFoundException("Proposal", proposalId));
    if (!proposal.isAuthoredBy(actor.id())) {
      throw new ForbiddenException(
          "Cannot withdraw proposal", "Only the author can withdraw proposal " + proposalId);
    }
    proposal.withdraw();
    log.info("Proposal {} withdrawn", proposalId);

    logDecision(actor, proposal, "proposal.withdrawn");
    return proposal;
  }

  /**
   * Accepts a PENDING proposal on an OPEN project: the proposal becomes ACCEPTED, every other
   * PENDING proposal of the project becomes REJECTED, and the project is closed, all in one
   * transaction.
   */
  @Transactional
  public Proposal accept(Actor actor, UUID proposalId) {
    var project = lockProjectOf(proposalId);
    requireOwner(actor, project, "accept");
    var proposal = lockProposal(proposalId);

    if (!project.isOpen()) {
      throw new InvalidStateException(
          "Project not open", "Project " + project.getId() + " already closed");
    }
    proposal.accept();

    int rejected = 0;
    for (var other :
        proposalRepository.findByProjectIdAndStatus(project.getId(), ProposalStatus.PENDING)) {
      if (!other.getId().equals(proposalId)) {
        other.reject();
        rejected++;
      }
    }
    project.close();
    log.info(
        "Accepted proposal {} on project {}, rejected {} others",
        proposalId,
        project.getId(),
        rejected);

    var details = new HashMap<String, Object>();
    details.put("project_id", project.getId().toString());
    details.put("developer_id", proposal.getDeveloperId().toString());
    details.put("rejected_count", rejected);
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("proposal.accepted")
            .entityType("proposal")
            .entityId(proposalId)
            .actor(actor)
            .details(details)
            .build());

    return proposal;
  }

  @Transactional
  public Proposal reject(Actor actor, UUID proposalId) {
    var project = lockProjectOf(proposalId);
    requireOwner(actor, project, "reject");
    var proposal = lockProposal(proposalId);

    proposal.reject();
    log.info("Rejected proposal {} on project {}", proposalId, project.getId());

    logDecision(actor, proposal, "proposal.rejected");
    return proposal;
  }

  /**
   * Accepts the proposal and assigns its author a task on the project in the same transaction. The
   * task takes the proposed rate and the project's title and description.
   */
  @Transactional
  public Task hire(Actor actor, UUID proposalId) {
    var proposal = accept(actor, proposalId);
    var project =
        projectRepository
            .findById(proposal.getProjectId())
            .orElseThrow(() -> new ResourceNotFoundException("Project", proposal.getProjectId()));
    return taskService.assign(
        actor,
        proposal.getProjectId(),
        proposal.getDeveloperId(),
        proposal.getProposedHourlyRate(),
        project.getTitle(),
        project.getDescription());
  }

  @Transactional(readOnly = true)
  public Proposal get(Actor actor, UUID proposalId) {
    var proposal =
        proposalRepository
            .findById(proposalId)
            .orElseThrow(() -> new ResourceNotFoundException("Proposal", proposalId));
    if (actor.isAdmin() || proposal.isAuthoredBy(actor.id())) {
      return proposal;
    }
    var project =
        projectRepository
            .findById(proposal.getProjectId())
            .orElseThrow(() -> new ResourceNotFoundException("Project", proposal.getProjectId()));
    if (!project.isOwnedBy(actor.id())) {
      throw new ForbiddenException(
          "Cannot view proposal", "Proposal " + proposalId + " is not visible to you");
    }
    return proposal;
  }

  @Transactional(readOnly = true)
  public List<Proposal> listForProject(Actor actor, UUID projectId) {
    var project =
        projectRepository
            .findById(projectId)
            .orElseThrow(() -> new ResourceNotFoundException("Project", projectId));
    if (!actor.isAdmin() && !project.isOwnedBy(actor.id())) {
      throw new ForbiddenException(
          "Cannot list proposals", "Only the owning buyer can see proposals on " + projectId);
    }
    return proposalRepository.findByProjectId(projectId);
  }

  @Transactional(readOnly = true)
  public List<Proposal> listMine(Actor actor) {
    if (!actor.isDeveloper()) {
      throw new ForbiddenException("Cannot list proposals", "Only developers submit proposals");
    }
    return proposalRepository.findByDeveloperId(actor.id());
  }

  private Project lockProject(UUID projectId) {
    return projectRepository
        .findByIdForUpdate(projectId)
        .orElseThrow(() -> new ResourceNotFoundException("Project", projectId));
  }

  /** Locks the project a proposal belongs to without loading the proposal itself. */
  private Project lockProjectOf(UUID proposalId) {
    var projectId =
        proposalRepository
            .findProjectIdById(proposalId)
            .orElseThrow(() -> new ResourceNotFoundException("Proposal", proposalId));
    return lockProject(projectId);
  }

  private Proposal lockProposal(UUID proposalId) {
    return proposalRepository
        .findByIdForUpdate(proposalId)
        .orElseThrow(() -> new ResourceNotFoundException("Proposal", proposalId));
  }

  private static void requireOwner(Actor actor, Project project, String action) {
    if (!project.isOwnedBy(actor.id())) {
      throw new ForbiddenException(
          "Cannot " + action + " proposal",
          "Only the owner of project " + project.getId() + " can " + action + " proposals");
    }
  }

  private void logDecision(Actor actor, Proposal proposal, String eventType) {
    auditService.log(
        AuditEventBuilder.builder()
            .eventType(eventType)
            .entityType("proposal")
            .entityId(proposal.getId())
            .actor(actor)
            .details(Map.of("project_id", proposal.getProjectId().toString()))
            .build());
  }
}
