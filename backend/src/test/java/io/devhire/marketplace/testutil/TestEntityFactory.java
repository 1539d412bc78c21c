package io.devhire.marketplace.testutil;

import io.devhire.marketplace.payment.Payment;
import io.devhire.marketplace.project.Project;
import io.devhire.marketplace.proposal.Proposal;
import io.devhire.marketplace.task.Task;
import java.math.BigDecimal;
import java.util.Set;
import java.util.UUID;

/** Shared test utility for building unsaved entities with a preset id. */
public final class TestEntityFactory {

  private TestEntityFactory() {}

  public static Project project(UUID id, UUID buyerId) {
    var project =
        new Project(
            buyerId,
            "Build a REST API",
            "Spring backend for a storefront",
            new BigDecimal("50.00"),
            new BigDecimal("40.00"),
            Set.of("java", "spring"));
    return withId(project, id);
  }

  public static Proposal proposal(UUID id, UUID projectId, UUID developerId) {
    var proposal =
        new Proposal(
            projectId,
            developerId,
            "I have built several of these",
            new BigDecimal("45.00"),
            new BigDecimal("30.00"));
    return withId(proposal, id);
  }

  public static Task task(UUID id, UUID projectId, UUID developerId, UUID buyerId) {
    var task =
        new Task(
            projectId, developerId, buyerId, "Implement API", "Endpoints", new BigDecimal("50.00"));
    return withId(task, id);
  }

  /** A task already moved to IN_PROGRESS. */
  public static Task startedTask(UUID id, UUID projectId, UUID developerId, UUID buyerId) {
    var task = task(id, projectId, developerId, buyerId);
    task.start();
    return task;
  }

  /** A task with a solution attached, awaiting payment. */
  public static Task submittedTask(
      UUID id, UUID projectId, UUID developerId, UUID buyerId, BigDecimal timeSpent) {
    var task = startedTask(id, projectId, developerId, buyerId);
    task.submit("tasks/" + id + "/solutions/" + UUID.randomUUID(), "solution.zip", timeSpent);
    return task;
  }

  public static Payment payment(UUID id, UUID taskId, UUID buyerId, BigDecimal amount) {
    return withId(new Payment(taskId, buyerId, amount), id);
  }

  public static <T> T withId(T entity, UUID id) {
    try {
      var idField = entity.getClass().getDeclaredField("id");
      idField.setAccessible(true);
      idField.set(entity, id);
    } catch (ReflectiveOperationException e) {
      throw new RuntimeException("Failed to set entity ID", e);
    }
    return entity;
  }
}
