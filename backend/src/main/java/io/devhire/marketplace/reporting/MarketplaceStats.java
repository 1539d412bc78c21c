package io.devhire.marketplace.reporting;

import io.devhire.marketplace.project.ProjectStatus;
import io.devhire.marketplace.proposal.ProposalStatus;
import io.devhire.marketplace.task.TaskStatus;
import java.math.BigDecimal;
import java.util.Map;

/**
 * Platform-wide counters for administrators.
 *
 * @param totalRevenue sum of all recorded payment amounts
 * @param totalHours hours logged on submitted and paid tasks
 */
public record MarketplaceStats(
    Map<ProjectStatus, Long> projectsByStatus,
    Map<ProposalStatus, Long> proposalsByStatus,
    Map<TaskStatus, Long> tasksByStatus,
    long payments,
    BigDecimal totalRevenue,
    BigDecimal totalHours) {}
