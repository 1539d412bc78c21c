package io.devhire.marketplace.reporting;

import io.devhire.marketplace.exception.ForbiddenException;
import io.devhire.marketplace.payment.PaymentRepository;
import io.devhire.marketplace.project.ProjectRepository;
import io.devhire.marketplace.project.ProjectStatus;
import io.devhire.marketplace.proposal.ProposalRepository;
import io.devhire.marketplace.proposal.ProposalStatus;
import io.devhire.marketplace.security.Actor;
import io.devhire.marketplace.task.TaskRepository;
import io.devhire.marketplace.task.TaskStatus;
import java.math.RoundingMode;
import java.util.EnumMap;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class MarketplaceStatsService {

  private final ProjectRepository projectRepository;
  private final ProposalRepository proposalRepository;
  private final TaskRepository taskRepository;
  private final PaymentRepository paymentRepository;

  public MarketplaceStatsService(
      ProjectRepository projectRepository,
      ProposalRepository proposalRepository,
      TaskRepository taskRepository,
      PaymentRepository paymentRepository) {
    this.projectRepository = projectRepository;
    this.proposalRepository = proposalRepository;
    this.taskRepository = taskRepository;
    this.paymentRepository = paymentRepository;
  }

  @Transactional(readOnly = true)
  public MarketplaceStats getStats(Actor actor) {
    if (!actor.isAdmin()) {
      throw new ForbiddenException("Cannot view stats", "Only admins can view platform stats");
    }

    var projects = new EnumMap<ProjectStatus, Long>(ProjectStatus.class);
    for (var status : ProjectStatus.values()) {
      projects.put(status, projectRepository.countByStatus(status));
    }
    var proposals = new EnumMap<ProposalStatus, Long>(ProposalStatus.class);
    for (var status : ProposalStatus.values()) {
      proposals.put(status, proposalRepository.countByStatus(status));
    }
    var tasks = new EnumMap<TaskStatus, Long>(TaskStatus.class);
    for (var status : TaskStatus.values()) {
      tasks.put(status, taskRepository.countByStatus(status));
    }

    return new MarketplaceStats(
        projects,
        proposals,
        tasks,
        paymentRepository.count(),
        paymentRepository.sumAmount().setScale(2, RoundingMode.HALF_UP),
        taskRepository.sumTimeSpent().setScale(2, RoundingMode.HALF_UP));
  }
}
