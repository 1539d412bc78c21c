package io.devhire.marketplace.project;

import io.devhire.marketplace.security.Actor;
import io.devhire.marketplace.security.CurrentActor;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ProjectController {

  private final ProjectService projectService;

  public ProjectController(ProjectService projectService) {
    this.projectService = projectService;
  }

  @PostMapping("/api/projects")
  @PreAuthorize("hasRole('BUYER')")
  public ResponseEntity<ProjectResponse> createProject(
      @CurrentActor Actor actor, @Valid @RequestBody ProjectRequest request) {
    var project =
        projectService.create(
            actor,
            request.title(),
            request.description(),
            request.expectedHourlyRate(),
            request.expectedDurationHours(),
            request.tags());
    return ResponseEntity.created(URI.create("/api/projects/" + project.getId()))
        .body(ProjectResponse.from(project));
  }

  @GetMapping("/api/projects/{id}")
  public ResponseEntity<ProjectResponse> getProject(
      @CurrentActor Actor actor, @PathVariable UUID id) {
    return ResponseEntity.ok(ProjectResponse.from(projectService.get(actor, id)));
  }

  @GetMapping("/api/projects/open")
  public ResponseEntity<List<ProjectResponse>> listOpenProjects(@CurrentActor Actor actor) {
    return ResponseEntity.ok(
        projectService.listOpen(actor).stream().map(ProjectResponse::from).toList());
  }

  @GetMapping("/api/projects/mine")
  @PreAuthorize("hasRole('BUYER')")
  public ResponseEntity<List<ProjectResponse>> listMyProjects(@CurrentActor Actor actor) {
    return ResponseEntity.ok(
        projectService.listMine(actor).stream().map(ProjectResponse::from).toList());
  }

  @PutMapping("/api/projects/{id}")
  @PreAuthorize("hasRole('BUYER')")
  public ResponseEntity<ProjectResponse> updateProject(
      @CurrentActor Actor actor,
      @PathVariable UUID id,
      @Valid @RequestBody ProjectRequest request) {
    var project =
        projectService.update(
            actor,
            id,
            request.title(),
            request.description(),
            request.expectedHourlyRate(),
            request.expectedDurationHours(),
            request.tags());
    return ResponseEntity.ok(ProjectResponse.from(project));
  }

  @PostMapping("/api/projects/{id}/close")
  @PreAuthorize("hasRole('BUYER')")
  public ResponseEntity<ProjectResponse> closeProject(
      @CurrentActor Actor actor, @PathVariable UUID id) {
    return ResponseEntity.ok(ProjectResponse.from(projectService.close(actor, id)));
  }

  @DeleteMapping("/api/projects/{id}")
  @PreAuthorize("hasRole('BUYER')")
  public ResponseEntity<Void> deleteProject(@CurrentActor Actor actor, @PathVariable UUID id) {
    projectService.delete(actor, id);
    return ResponseEntity.noContent().build();
  }

  // --- DTOs ---

  public record ProjectRequest(
      @NotBlank(message = "title is required")
          @Size(max = 255, message = "title must not exceed 255 characters")
          String title,
      @Size(max = 4000, message = "description must not exceed 4000 characters")
          String description,
      @Positive(message = "expectedHourlyRate must be positive")
          @Digits(integer = 10, fraction = 2, message = "expectedHourlyRate is out of range")
          BigDecimal expectedHourlyRate,
      @Positive(message = "expectedDurationHours must be positive")
          @Digits(integer = 10, fraction = 2, message = "expectedDurationHours is out of range")
          BigDecimal expectedDurationHours,
      Set<@Size(max = 50, message = "tags must not exceed 50 characters") String> tags) {}

  public record ProjectResponse(
      UUID id,
      UUID buyerId,
      String title,
      String description,
      BigDecimal expectedHourlyRate,
      BigDecimal expectedDurationHours,
      Set<String> tags,
      ProjectStatus status,
      Instant createdAt,
      Instant updatedAt,
      Instant closedAt) {

    public static ProjectResponse from(Project project) {
      return new ProjectResponse(
          project.getId(),
          project.getBuyerId(),
          project.getTitle(),
          project.getDescription(),
          project.getExpectedHourlyRate(),
          project.getExpectedDurationHours(),
          Set.copyOf(project.getTags()),
          project.getStatus(),
          project.getCreatedAt(),
          project.getUpdatedAt(),
          project.getClosedAt());
    }
  }
}
