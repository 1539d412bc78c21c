package io.devhire.marketplace.project;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.devhire.marketplace.audit.AuditService;
import io.devhire.marketplace.exception.ForbiddenException;
import io.devhire.marketplace.exception.InvalidStateException;
import io.devhire.marketplace.proposal.ProposalRepository;
import io.devhire.marketplace.proposal.ProposalStatus;
import io.devhire.marketplace.security.Actor;
import io.devhire.marketplace.task.TaskRepository;
import io.devhire.marketplace.testutil.TestEntityFactory;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ProjectServiceTest {

  private static final UUID PROJECT_ID = UUID.randomUUID();
  private static final Actor BUYER = Actor.buyer(UUID.randomUUID());

  @Mock private ProjectRepository projectRepository;
  @Mock private ProposalRepository proposalRepository;
  @Mock private TaskRepository taskRepository;
  @Mock private AuditService auditService;
  @InjectMocks private ProjectService service;

  @Test
  void create_forbiddenForDeveloper() {
    var developer = Actor.developer(UUID.randomUUID());

    assertThatThrownBy(() -> service.create(developer, "Title", null, null, null, Set.of()))
        .isInstanceOf(ForbiddenException.class);
    verify(projectRepository, never()).save(any());
  }

  @Test
  void create_opensProjectWithTrimmedTags() {
    when(projectRepository.save(any(Project.class)))
        .thenAnswer(inv -> TestEntityFactory.withId(inv.getArgument(0), PROJECT_ID));

    var project =
        service.create(
            BUYER,
            "API",
            "desc",
            new BigDecimal("60"),
            new BigDecimal("20"),
            List.of(" java ", ""));

    assertThat(project.getStatus()).isEqualTo(ProjectStatus.OPEN);
    assertThat(project.getBuyerId()).isEqualTo(BUYER.id());
    assertThat(project.getTags()).containsExactly("java");
  }

  @Test
  void update_forbiddenForNonOwner() {
    when(projectRepository.findByIdForUpdate(PROJECT_ID))
        .thenReturn(Optional.of(TestEntityFactory.project(PROJECT_ID, BUYER.id())));

    assertThatThrownBy(
            () ->
                service.update(
                    Actor.buyer(UUID.randomUUID()), PROJECT_ID, "New", null, null, null, null))
        .isInstanceOf(ForbiddenException.class);
  }

  @Test
  void update_rejectsClosedProject() {
    var project = TestEntityFactory.project(PROJECT_ID, BUYER.id());
    project.close();
    when(projectRepository.findByIdForUpdate(PROJECT_ID)).thenReturn(Optional.of(project));

    assertThatThrownBy(() -> service.update(BUYER, PROJECT_ID, "New", null, null, null, null))
        .isInstanceOf(InvalidStateException.class);
    assertThatThrownBy(() -> service.close(BUYER, PROJECT_ID))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void delete_rejectsProjectWithTasks() {
    when(projectRepository.findByIdForUpdate(PROJECT_ID))
        .thenReturn(Optional.of(TestEntityFactory.project(PROJECT_ID, BUYER.id())));
    when(taskRepository.countByProjectId(PROJECT_ID)).thenReturn(1L);

    assertThatThrownBy(() -> service.delete(BUYER, PROJECT_ID))
        .isInstanceOf(InvalidStateException.class);
    verify(projectRepository, never()).delete(any());
  }

  @Test
  void delete_removesProjectAndItsProposals() {
    var project = TestEntityFactory.project(PROJECT_ID, BUYER.id());
    when(projectRepository.findByIdForUpdate(PROJECT_ID)).thenReturn(Optional.of(project));
    when(taskRepository.countByProjectId(PROJECT_ID)).thenReturn(0L);
    when(proposalRepository.findByProjectIdAndStatus(PROJECT_ID, ProposalStatus.ACCEPTED))
        .thenReturn(List.of());
    when(proposalRepository.deleteByProjectId(PROJECT_ID)).thenReturn(2);

    service.delete(BUYER, PROJECT_ID);

    verify(proposalRepository).deleteByProjectId(PROJECT_ID);
    verify(projectRepository).delete(project);
  }

  @Test
  void listMine_forbiddenForDeveloper() {
    assertThatThrownBy(() -> service.listMine(Actor.developer(UUID.randomUUID())))
        .isInstanceOf(ForbiddenException.class);
  }
}
