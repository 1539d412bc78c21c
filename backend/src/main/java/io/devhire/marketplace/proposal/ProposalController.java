package io.devhire.marketplace.proposal;

import io.devhire.marketplace.security.Actor;
import io.devhire.marketplace.security.CurrentActor;
import io.devhire.marketplace.task.TaskController.TaskResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ProposalController {

  private final ProposalService proposalService;

  public ProposalController(ProposalService proposalService) {
    this.proposalService = proposalService;
  }

  @PostMapping("/api/projects/{projectId}/proposals")
  @PreAuthorize("hasRole('DEVELOPER')")
  public ResponseEntity<ProposalResponse> submitProposal(
      @CurrentActor Actor actor,
      @PathVariable UUID projectId,
      @Valid @RequestBody SubmitProposalRequest request) {
    var proposal =
        proposalService.submit(
            actor,
            projectId,
            request.coverLetter(),
            request.proposedHourlyRate(),
            request.estimatedHours());
    return ResponseEntity.created(URI.create("/api/proposals/" + proposal.getId()))
        .body(ProposalResponse.from(proposal));
  }

  @GetMapping("/api/projects/{projectId}/proposals")
  @PreAuthorize("hasAnyRole('BUYER', 'ADMIN')")
  public ResponseEntity<List<ProposalResponse>> listProjectProposals(
      @CurrentActor Actor actor, @PathVariable UUID projectId) {
    return ResponseEntity.ok(
        proposalService.listForProject(actor, projectId).stream()
            .map(ProposalResponse::from)
            .toList());
  }

  @GetMapping("/api/proposals/mine")
  @PreAuthorize("hasRole('DEVELOPER')")
  public ResponseEntity<List<ProposalResponse>> listMyProposals(@CurrentActor Actor actor) {
    return ResponseEntity.ok(
        proposalService.listMine(actor).stream().map(ProposalResponse::from).toList());
  }

  @GetMapping("/api/proposals/{id}")
  public ResponseEntity<ProposalResponse> getProposal(
      @CurrentActor Actor actor, @PathVariable UUID id) {
    return ResponseEntity.ok(ProposalResponse.from(proposalService.get(actor, id)));
  }

  @PostMapping("/api/proposals/{id}/withdraw")
  @PreAuthorize("hasRole('DEVELOPER')")
  public ResponseEntity<ProposalResponse> withdrawProposal(
      @CurrentActor Actor actor, @PathVariable UUID id) {
    return ResponseEntity.ok(ProposalResponse.from(proposalService.withdraw(actor, id)));
  }

  @PostMapping("/api/proposals/{id}/accept")
  @PreAuthorize("hasRole('BUYER')")
  public ResponseEntity<ProposalResponse> acceptProposal(
      @CurrentActor Actor actor, @PathVariable UUID id) {
    return ResponseEntity.ok(ProposalResponse.from(proposalService.accept(actor, id)));
  }

  @PostMapping("/api/proposals/{id}/reject")
  @PreAuthorize("hasRole('BUYER')")
  public ResponseEntity<ProposalResponse> rejectProposal(
      @CurrentActor Actor actor, @PathVariable UUID id) {
    return ResponseEntity.ok(ProposalResponse.from(proposalService.reject(actor, id)));
  }

  @PostMapping("/api/proposals/{id}/hire")
  @PreAuthorize("hasRole('BUYER')")
  public ResponseEntity<TaskResponse> hireProposalAuthor(
      @CurrentActor Actor actor, @PathVariable UUID id) {
    var task = proposalService.hire(actor, id);
    return ResponseEntity.created(URI.create("/api/tasks/" + task.getId()))
        .body(TaskResponse.from(task));
  }

  // --- DTOs ---

  public record SubmitProposalRequest(
      @Size(max = 4000, message = "coverLetter must not exceed 4000 characters")
          String coverLetter,
      @NotNull(message = "proposedHourlyRate is required")
          @Positive(message = "proposedHourlyRate must be positive")
          @Digits(integer = 6, fraction = 2, message = "proposedHourlyRate is out of range")
          BigDecimal proposedHourlyRate,
      @Positive(message = "estimatedHours must be positive")
          @Digits(integer = 10, fraction = 2, message = "estimatedHours is out of range")
          BigDecimal estimatedHours) {}

  public record ProposalResponse(
      UUID id,
      UUID projectId,
      UUID developerId,
      String coverLetter,
      BigDecimal proposedHourlyRate,
      BigDecimal estimatedHours,
      ProposalStatus status,
      Instant createdAt,
      Instant updatedAt,
      Instant decidedAt) {

    public static ProposalResponse from(Proposal proposal) {
      return new ProposalResponse(
          proposal.getId(),
          proposal.getProjectId(),
          proposal.getDeveloperId(),
          proposal.getCoverLetter(),
          proposal.getProposedHourlyRate(),
          proposal.getEstimatedHours(),
          proposal.getStatus(),
          proposal.getCreatedAt(),
          proposal.getUpdatedAt(),
          proposal.getDecidedAt());
    }
  }
}
