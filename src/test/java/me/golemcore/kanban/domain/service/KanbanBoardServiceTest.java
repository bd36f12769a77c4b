package me.golemcore.kanban.domain.service;

import me.golemcore.kanban.domain.model.MetadataKeys;
import me.golemcore.kanban.domain.model.PatchRequest;
import me.golemcore.kanban.domain.model.Project;
import me.golemcore.kanban.domain.model.RemotePersistenceException;
import me.golemcore.kanban.domain.model.RemoteWorkflowRecord;
import me.golemcore.kanban.domain.model.RemoteWorkflowUpdate;
import me.golemcore.kanban.domain.model.Stage;
import me.golemcore.kanban.domain.model.Task;
import me.golemcore.kanban.domain.model.TaskDraft;
import me.golemcore.kanban.domain.model.TaskUpdate;
import me.golemcore.kanban.domain.model.WorkItemType;
import me.golemcore.kanban.infrastructure.config.KanbanProperties;
import me.golemcore.kanban.port.outbound.WorkflowPersistencePort;
import me.golemcore.kanban.port.outbound.WorkflowTransportPort;
import me.golemcore.kanban.testsupport.loop.DirectControlLoop;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class KanbanBoardServiceTest {

    private static final Instant NOW = Instant.parse("2026-06-01T10:00:00Z");

    private TaskStore store;
    private WorkflowPersistencePort persistence;
    private KanbanBoardService board;

    @BeforeEach
    void setUp() {
        KanbanProperties properties = new KanbanProperties();
        DirectControlLoop loop = new DirectControlLoop();
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        store = new TaskStore(properties);
        ExternalIdIndex index = new ExternalIdIndex(store);
        NotificationService notifications = new NotificationService(loop, properties, clock);
        OptimisticSyncController sync = new OptimisticSyncController(store,
                new TaskMutationQueue(loop, properties), notifications, loop, clock);
        StageTransitionStateMachine stateMachine = new StageTransitionStateMachine(properties, clock);
        WorkflowTriggerService triggers = new WorkflowTriggerService(store, mock(WorkflowTransportPort.class), sync,
                notifications, loop, properties, clock);
        persistence = mock(WorkflowPersistencePort.class);
        board = new KanbanBoardService(store, index, sync, stateMachine, triggers, persistence, notifications, clock);
    }

    // ===== Create =====

    @Test
    void shouldCreateLocalTaskInBacklog() {
        Task task = board.createTask(TaskDraft.builder()
                .title("  Add login  ")
                .queuedStages(List.of(Stage.PLAN, Stage.BUILD))
                .build()).join();

        assertEquals(1, task.getId());
        assertEquals("Add login", task.getTitle());
        assertEquals(Stage.BACKLOG, task.getStage());
        assertEquals("adw_plan_build", task.getPipelineId());
        assertEquals(NOW, task.getCreatedAt());
        verify(persistence, never()).create(any());
    }

    @Test
    void shouldNeverReuseIds() {
        Task first = board.createTask(TaskDraft.builder().title("A").build()).join();
        board.deleteTask(first.getId()).join();
        Task second = board.createTask(TaskDraft.builder().title("B").build()).join();

        assertNotEquals(first.getId(), second.getId());
    }

    @Test
    void shouldRejectBlankTitle() {
        CompletableFuture<Task> result = board.createTask(TaskDraft.builder().title(" ").build());

        CompletionException error = assertThrows(CompletionException.class, result::join);
        assertEquals("Title is required", error.getCause().getMessage());
        assertTrue(store.getTasks().isEmpty());
    }

    @Test
    void shouldCreateRemoteRecordWhenImportingRun() {
        when(persistence.create(any())).thenReturn(CompletableFuture.completedFuture(RemoteWorkflowRecord.builder()
                .adwId("abc123").branchName("feature/abc123").build()));

        Task task = board.createTask(TaskDraft.builder().title("Imported").externalId("abc123").build()).join();

        assertEquals("feature/abc123", task.getMetadata().get(MetadataKeys.BRANCH_NAME));
        assertEquals("abc123", task.getMetadata().get(MetadataKeys.ADW_ID));
        assertEquals(task.getId(), board.getTaskByExternalId("abc123").orElseThrow().getId());
    }

    // ===== Update & move =====

    @Test
    void shouldUpdateLocalTaskWithoutRemoteCall() {
        Task task = board.createTask(TaskDraft.builder().title("A").build()).join();

        Task updated = board.updateTask(task.getId(), TaskUpdate.builder()
                .title("B")
                .workItemType(WorkItemType.BUG)
                .metadata(Map.of("note", "x"))
                .build()).join();

        assertEquals("B", updated.getTitle());
        assertEquals(WorkItemType.BUG, updated.getWorkItemType());
        assertEquals("x", updated.getMetadata().get("note"));
        verify(persistence, never()).update(any(), any());
    }

    @Test
    void shouldPatchRemoteRecordAndMergeCanonicalFields() {
        seedRemoteTask();
        when(persistence.update(eq("abc123"), any())).thenReturn(CompletableFuture.completedFuture(
                RemoteWorkflowRecord.builder().workflowName("adw_plan_build_iso").build()));

        Task updated = board.updateTask(1, TaskUpdate.builder().title("Renamed").build()).join();

        ArgumentCaptor<RemoteWorkflowUpdate> body = ArgumentCaptor.forClass(RemoteWorkflowUpdate.class);
        verify(persistence).update(eq("abc123"), body.capture());
        assertEquals("Renamed", body.getValue().getIssueTitle());
        assertNull(body.getValue().getIssueBody());
        assertEquals("adw_plan_build_iso", updated.getMetadata().get(MetadataKeys.WORKFLOW_NAME));
    }

    @Test
    void shouldMergeCanonicalFieldsButKeepLiveRunStatus() {
        Task task = Task.builder().id(1).title("T").externalId("abc123").stage(Stage.BUILD).build();
        task.mergeMetadata(Map.of(MetadataKeys.WORKFLOW_STATUS, "running"));

        KanbanBoardService.mergeCanonicalFields(task, RemoteWorkflowRecord.builder()
                .workflowName("adw_plan_build_iso")
                .branchName("feature/abc123")
                .patchFile("specs/patch-1.md")
                .patchHistory(List.of(Map.of("patch_number", 1)))
                .status("pending")
                .build());

        assertEquals("adw_plan_build_iso", task.getMetadata().get(MetadataKeys.WORKFLOW_NAME));
        assertEquals("feature/abc123", task.getMetadata().get(MetadataKeys.BRANCH_NAME));
        assertEquals("specs/patch-1.md", task.getMetadata().get(MetadataKeys.PATCH_FILE));
        assertEquals(List.of(Map.of("patch_number", 1)), task.getMetadata().get(MetadataKeys.PATCH_HISTORY));
        assertEquals("running", task.getMetadata().get(MetadataKeys.WORKFLOW_STATUS));
    }

    @Test
    void shouldDecideRemoteWriteWhenQueuedUpdateRuns() {
        seedRemoteTask();
        CompletableFuture<RemoteWorkflowRecord> inFlight = new CompletableFuture<>();
        when(persistence.update(eq("abc123"), any())).thenReturn(inFlight);
        when(persistence.update(eq("def456"), any()))
                .thenReturn(CompletableFuture.completedFuture(RemoteWorkflowRecord.builder().adwId("def456").build()));

        CompletableFuture<Task> first = board.updateTask(1, TaskUpdate.builder().title("First").build());
        CompletableFuture<Task> second = board.updateTask(1, TaskUpdate.builder().title("Second").build());
        CompletableFuture<Task> third = board.updateTask(1, TaskUpdate.builder().title("Third").build());
        Task rebound = store.getTask(1).orElseThrow();
        rebound.setExternalId("def456");
        store.putTask("rebind", rebound);
        inFlight.complete(RemoteWorkflowRecord.builder().adwId("abc123").build());

        first.join();
        assertEquals("Second", second.join().getTitle());
        assertEquals("Third", third.join().getTitle());
        verify(persistence).update(eq("abc123"), any());
        verify(persistence, times(2)).update(eq("def456"), any());
    }

    @Test
    void shouldKeepQueuedUpdateLocalWhenTaskLostItsRun() {
        seedRemoteTask();
        CompletableFuture<RemoteWorkflowRecord> inFlight = new CompletableFuture<>();
        when(persistence.update(eq("abc123"), any())).thenReturn(inFlight);

        CompletableFuture<Task> first = board.updateTask(1, TaskUpdate.builder().title("First").build());
        CompletableFuture<Task> second = board.updateTask(1, TaskUpdate.builder().title("Second").build());
        Task detached = store.getTask(1).orElseThrow();
        detached.setExternalId(null);
        store.putTask("detach", detached);
        inFlight.complete(RemoteWorkflowRecord.builder().adwId("abc123").build());

        first.join();
        assertEquals("Second", second.join().getTitle());
        verify(persistence, times(1)).update(any(), any());
        verify(persistence, never()).update(isNull(), any());
    }

    @Test
    void shouldRevertMoveWhenRemoteFails() {
        seedRemoteTask();
        when(persistence.update(eq("abc123"), any()))
                .thenReturn(CompletableFuture.failedFuture(new RemotePersistenceException(0, "Network error: down")));

        CompletableFuture<Task> result = board.moveTaskToStage(1, Stage.COMPLETED);

        assertThrows(CompletionException.class, result::join);
        assertEquals(Stage.BUILD, store.getTask(1).orElseThrow().getStage());
        ArgumentCaptor<RemoteWorkflowUpdate> body = ArgumentCaptor.forClass(RemoteWorkflowUpdate.class);
        verify(persistence).update(eq("abc123"), body.capture());
        assertEquals("completed", body.getValue().getCurrentStage());
        assertEquals(NOW.toString(), body.getValue().getCompletedAt());
    }

    @Test
    void shouldCompleteProgressWhenMovedToTerminalStage() {
        Task task = board.createTask(TaskDraft.builder().title("A").build()).join();

        Task moved = board.moveTaskToStage(task.getId(), Stage.READY_TO_MERGE).join();

        assertEquals(100, moved.getProgress());
        assertEquals(true, moved.getMetadata().get(MetadataKeys.WORKFLOW_COMPLETE));
    }

    // ===== Patch =====

    @Test
    void shouldAppendPatchHistory() {
        seedRemoteTask();
        when(persistence.update(eq("abc123"), any()))
                .thenReturn(CompletableFuture.completedFuture(new RemoteWorkflowRecord()));

        board.applyPatch(1, new PatchRequest("Fix the failing login test", "specs/patch-1.md")).join();
        Task task = board.applyPatch(1, new PatchRequest("Also handle empty passwords", null)).join();

        List<?> history = (List<?>) task.getMetadata().get(MetadataKeys.PATCH_HISTORY);
        assertEquals(2, history.size());
        assertEquals(2, ((Map<?, ?>) history.get(1)).get("patch_number"));
        assertEquals("specs/patch-1.md", task.getMetadata().get(MetadataKeys.PATCH_FILE));
    }

    @Test
    void shouldRejectShortPatchRequest() {
        seedRemoteTask();

        CompletableFuture<Task> result = board.applyPatch(1, new PatchRequest("fix", null));

        assertThrows(CompletionException.class, result::join);
        verify(persistence, never()).update(any(), any());
    }

    @Test
    void shouldRejectPatchWithoutRun() {
        Task task = board.createTask(TaskDraft.builder().title("A").build()).join();

        CompletableFuture<Task> result = board.applyPatch(task.getId(), new PatchRequest("A long enough request", null));

        CompletionException error = assertThrows(CompletionException.class, result::join);
        assertInstanceOf(IllegalStateException.class, error.getCause());
    }

    // ===== Queries =====

    @Test
    void shouldSearchAndCountTasks() {
        board.createTask(TaskDraft.builder().title("Add Login").build()).join();
        board.createTask(TaskDraft.builder().title("Fix logout").description("Session LOGIN cookie").build()).join();
        board.createTask(TaskDraft.builder().title("Docs").build()).join();
        seedRemoteTask();

        assertEquals(2, board.searchTasks("login").size());
        assertEquals(1, board.searchTasks("ABC1").size());
        assertEquals(4, board.searchTasks(" ").size());
        Map<Stage, Integer> stats = board.getStatistics();
        assertEquals(3, stats.get(Stage.BACKLOG));
        assertEquals(1, stats.get(Stage.BUILD));
        assertEquals(0, stats.get(Stage.COMPLETED));
        assertEquals(1, board.getTasksByStage(Stage.BUILD).size());
    }

    // ===== Projects =====

    @Test
    void shouldManageProjects() {
        Project project = board.addProject("Kanban", "/repos/kanban").join();

        assertEquals(project.getId(), board.getSelectedProjectId().orElseThrow());
        Task task = board.createTask(TaskDraft.builder().title("A").build()).join();
        assertEquals(project.getId(), task.getProjectId());

        assertThrows(CompletionException.class, () -> board.selectProject("missing").join());
        assertTrue(board.removeProject(project.getId()).join());
        assertFalse(board.removeProject(project.getId()).join());
        assertTrue(board.getSelectedProjectId().isEmpty());
    }

    private void seedRemoteTask() {
        store.putTask("seed", Task.builder().id(store.nextTaskId()).title("Remote").externalId("abc123")
                .stage(Stage.BUILD).build());
    }
}
