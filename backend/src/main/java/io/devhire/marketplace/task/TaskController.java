package io.devhire.marketplace.task;

import io.devhire.marketplace.security.Actor;
import io.devhire.marketplace.security.CurrentActor;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
public class TaskController {

  private static final String DEFAULT_FILENAME = "solution.zip";

  private final TaskService taskService;
  private final TaskSubmissionService taskSubmissionService;

  public TaskController(TaskService taskService, TaskSubmissionService taskSubmissionService) {
    this.taskService = taskService;
    this.taskSubmissionService = taskSubmissionService;
  }

  @PostMapping("/api/projects/{projectId}/tasks")
  @PreAuthorize("hasRole('BUYER')")
  public ResponseEntity<TaskResponse> assignTask(
      @CurrentActor Actor actor,
      @PathVariable UUID projectId,
      @Valid @RequestBody AssignTaskRequest request) {
    var task =
        taskService.assign(
            actor,
            projectId,
            request.developerId(),
            request.hourlyRate(),
            request.title(),
            request.description());
    return ResponseEntity.created(URI.create("/api/tasks/" + task.getId()))
        .body(TaskResponse.from(task));
  }

  @GetMapping("/api/projects/{projectId}/tasks")
  @PreAuthorize("hasAnyRole('BUYER', 'ADMIN')")
  public ResponseEntity<List<TaskResponse>> listProjectTasks(
      @CurrentActor Actor actor, @PathVariable UUID projectId) {
    return ResponseEntity.ok(
        taskService.listForProject(actor, projectId).stream().map(TaskResponse::from).toList());
  }

  @GetMapping("/api/tasks/mine")
  @PreAuthorize("hasAnyRole('BUYER', 'DEVELOPER')")
  public ResponseEntity<List<TaskResponse>> listMyTasks(@CurrentActor Actor actor) {
    return ResponseEntity.ok(taskService.listMine(actor).stream().map(TaskResponse::from).toList());
  }

  @GetMapping("/api/tasks/{id}")
  public ResponseEntity<TaskResponse> getTask(@CurrentActor Actor actor, @PathVariable UUID id) {
    return ResponseEntity.ok(TaskResponse.from(taskService.get(actor, id)));
  }

  @PatchMapping("/api/tasks/{id}/status")
  @PreAuthorize("hasRole('DEVELOPER')")
  public ResponseEntity<TaskResponse> advanceTask(
      @CurrentActor Actor actor,
      @PathVariable UUID id,
      @Valid @RequestBody AdvanceTaskRequest request) {
    return ResponseEntity.ok(TaskResponse.from(taskService.advance(actor, id, request.status())));
  }

  @PostMapping(value = "/api/tasks/{id}/submission", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  @PreAuthorize("hasRole('DEVELOPER')")
  public ResponseEntity<TaskResponse> submitSolution(
      @CurrentActor Actor actor,
      @PathVariable UUID id,
      @RequestParam("file") MultipartFile file,
      @RequestParam("timeSpent") BigDecimal timeSpent)
      throws IOException {
    var task =
        taskSubmissionService.submit(
            actor,
            id,
            file.getBytes(),
            file.getOriginalFilename(),
            file.getContentType(),
            timeSpent);
    return ResponseEntity.ok(TaskResponse.from(task));
  }

  @GetMapping("/api/tasks/{id}/solution")
  @PreAuthorize("hasRole('BUYER')")
  public ResponseEntity<byte[]> downloadSolution(
      @CurrentActor Actor actor, @PathVariable UUID id) {
    var download = taskService.getDownload(actor, id);
    String filename = download.filename() != null ? download.filename() : DEFAULT_FILENAME;
    return ResponseEntity.ok()
        .contentType(MediaType.APPLICATION_OCTET_STREAM)
        .header(
            HttpHeaders.CONTENT_DISPOSITION,
            ContentDisposition.attachment().filename(filename).build().toString())
        .body(download.content());
  }

  // --- DTOs ---

  public record AssignTaskRequest(
      @NotNull(message = "developerId is required") UUID developerId,
      @NotNull(message = "hourlyRate is required")
          @Positive(message = "hourlyRate must be positive")
          @Digits(integer = 6, fraction = 2, message = "hourlyRate is out of range")
          BigDecimal hourlyRate,
      @Size(max = 255, message = "title must not exceed 255 characters") String title,
      @Size(max = 4000, message = "description must not exceed 4000 characters")
          String description) {}

  public record AdvanceTaskRequest(@NotNull(message = "status is required") TaskStatus status) {}

  /** Task view. The solution handle itself is never exposed, only whether one is attached. */
  public record TaskResponse(
      UUID id,
      UUID projectId,
      UUID developerId,
      UUID buyerId,
      String title,
      String description,
      BigDecimal hourlyRate,
      TaskStatus status,
      boolean hasSolution,
      String solutionFilename,
      BigDecimal timeSpent,
      Instant createdAt,
      Instant updatedAt,
      Instant submittedAt,
      Instant paidAt) {

    public static TaskResponse from(Task task) {
      return new TaskResponse(
          task.getId(),
          task.getProjectId(),
          task.getDeveloperId(),
          task.getBuyerId(),
          task.getTitle(),
          task.getDescription(),
          task.getHourlyRate(),
          task.getStatus(),
          task.getStatus().hasSolution(),
          task.getSolutionFilename(),
          task.getTimeSpent(),
          task.getCreatedAt(),
          task.getUpdatedAt(),
          task.getSubmittedAt(),
          task.getPaidAt());
    }
  }
}
