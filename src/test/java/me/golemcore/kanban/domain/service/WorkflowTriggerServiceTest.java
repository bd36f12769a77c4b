package me.golemcore.kanban.domain.service;

import me.golemcore.kanban.domain.model.ActiveWorkflow;
import me.golemcore.kanban.domain.model.MergeState;
import me.golemcore.kanban.domain.model.MetadataKeys;
import me.golemcore.kanban.domain.model.Stage;
import me.golemcore.kanban.domain.model.Task;
import me.golemcore.kanban.domain.model.TriggerOptions;
import me.golemcore.kanban.domain.model.TriggerWorkflowRequest;
import me.golemcore.kanban.domain.model.WorkItemType;
import me.golemcore.kanban.domain.model.event.TriggerResponseEvent;
import me.golemcore.kanban.infrastructure.config.KanbanProperties;
import me.golemcore.kanban.port.outbound.WorkflowTransportPort;
import me.golemcore.kanban.testsupport.loop.DirectControlLoop;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WorkflowTriggerServiceTest {

    private static final Instant NOW = Instant.parse("2026-05-10T14:00:00Z");

    private TaskStore store;
    private ExternalIdIndex index;
    private NotificationService notifications;
    private WorkflowTransportPort transport;
    private WorkflowTriggerService service;

    @BeforeEach
    void setUp() {
        KanbanProperties properties = new KanbanProperties();
        DirectControlLoop loop = new DirectControlLoop();
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        store = new TaskStore(properties);
        index = new ExternalIdIndex(store);
        notifications = new NotificationService(loop, properties, clock);
        transport = mock(WorkflowTransportPort.class);
        OptimisticSyncController sync = new OptimisticSyncController(store,
                new TaskMutationQueue(loop, properties), notifications, loop, clock);
        service = new WorkflowTriggerService(store, transport, sync, notifications, loop, properties, clock);
    }

    // ===== Trigger =====

    @Test
    void shouldBindTaskAndStartFirstStageOnAcceptance() {
        store.putTask("seed", Task.builder().id(1).title("Add login").description("OAuth flow")
                .workItemType(WorkItemType.FEATURE).queuedStages(List.of(Stage.PLAN, Stage.BUILD)).build());
        when(transport.triggerWorkflow(any())).thenReturn(CompletableFuture.completedFuture(
                accepted("abc123", "adw_plan_build_iso")));

        Task task = service.triggerWorkflowForTask(1, null).join();

        assertEquals("abc123", task.getExternalId());
        assertEquals(Stage.PLAN, task.getStage());
        assertEquals(MetadataKeys.STATUS_STARTED, task.getMetadata().get(MetadataKeys.WORKFLOW_STATUS));
        assertEquals(1L, index.resolveTaskId("abc123").orElseThrow());
        ActiveWorkflow run = store.getActiveWorkflow("abc123").orElseThrow();
        assertEquals(1, run.getTaskId());
        assertEquals(NOW, run.getStartedAt());

        ArgumentCaptor<TriggerWorkflowRequest> request = ArgumentCaptor.forClass(TriggerWorkflowRequest.class);
        verify(transport).triggerWorkflow(request.capture());
        assertEquals("adw_plan_build_iso", request.getValue().getWorkflowType());
        assertEquals("feature", request.getValue().getIssueType());
        assertEquals("base", request.getValue().getModelSet());
        assertEquals("Kanban task: Add login", request.getValue().getTriggerReason());
        assertEquals("OAuth flow", request.getValue().getIssueJson().getBody());
        assertEquals(1, request.getValue().getIssueJson().getNumber());
    }

    @Test
    void shouldKeepStageWhenTaskAlreadyLeftBacklog() {
        store.putTask("seed", Task.builder().id(1).title("T").stage(Stage.TEST).build());
        when(transport.triggerWorkflow(any())).thenReturn(CompletableFuture.completedFuture(
                accepted("abc123", "adw_plan_build_iso")));

        Task task = service.triggerWorkflowForTask(1,
                TriggerOptions.builder().workflowType("adw_plan_build_iso").build()).join();

        assertEquals(Stage.TEST, task.getStage());
    }

    @Test
    void shouldRequireWorkflowType() {
        store.putTask("seed", Task.builder().id(1).title("T").build());

        CompletableFuture<Task> result = service.triggerWorkflowForTask(1, new TriggerOptions());

        CompletionException error = assertThrows(CompletionException.class, result::join);
        assertInstanceOf(IllegalArgumentException.class, error.getCause());
        verify(transport, never()).triggerWorkflow(any());
    }

    @Test
    void shouldNotifyWhenTriggerFails() {
        store.putTask("seed", Task.builder().id(1).title("T").build());
        when(transport.triggerWorkflow(any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("WebSocket is not connected")));

        CompletableFuture<Task> result = service.triggerWorkflowForTask(1,
                TriggerOptions.builder().workflowType("adw_plan_iso").build());

        assertThrows(CompletionException.class, result::join);
        assertFalse(store.getTask(1).orElseThrow().hasExternalId());
        assertEquals("Failed to trigger workflow: WebSocket is not connected",
                notifications.getNotifications().get(0).getMessage());
    }

    // ===== Merge =====

    @Test
    void shouldStartMergeForReadyTask() {
        store.putTask("seed", Task.builder().id(1).title("T").externalId("abc123").stage(Stage.READY_TO_MERGE)
                .build());
        when(transport.triggerWorkflow(any())).thenReturn(CompletableFuture.completedFuture(
                accepted("abc123", "adw_merge_iso")));

        Task task = service.triggerMergeWorkflow(1).join();

        assertEquals(true, task.getMetadata().get(MetadataKeys.MERGE_IN_PROGRESS));
        assertEquals(MergeState.MergeStatus.IN_PROGRESS, store.getMergeState(1).orElseThrow().getStatus());
        ArgumentCaptor<TriggerWorkflowRequest> request = ArgumentCaptor.forClass(TriggerWorkflowRequest.class);
        verify(transport).triggerWorkflow(request.capture());
        assertEquals("adw_merge_iso", request.getValue().getWorkflowType());
        assertEquals("abc123", request.getValue().getAdwId());
    }

    @Test
    void shouldRollBackMergeBookkeepingOnFailure() {
        store.putTask("seed", Task.builder().id(1).title("T").externalId("abc123").stage(Stage.READY_TO_MERGE)
                .build());
        when(transport.triggerWorkflow(any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("Merge conflict")));

        CompletableFuture<Task> result = service.triggerMergeWorkflow(1);

        assertThrows(CompletionException.class, result::join);
        assertFalse(store.getTask(1).orElseThrow().getMetadata().containsKey(MetadataKeys.MERGE_IN_PROGRESS));
        MergeState state = store.getMergeState(1).orElseThrow();
        assertEquals(MergeState.MergeStatus.ERROR, state.getStatus());
        assertEquals("Merge conflict", state.getMessage());
    }

    @Test
    void shouldRejectMergeOutsideReadyToMerge() {
        store.putTask("seed", Task.builder().id(1).title("T").externalId("abc123").stage(Stage.BUILD).build());

        CompletableFuture<Task> result = service.triggerMergeWorkflow(1);

        assertTrue(result.isCompletedExceptionally());
        verify(transport, never()).triggerWorkflow(any());
    }

    private static TriggerResponseEvent accepted(String externalId, String workflowName) {
        return new TriggerResponseEvent(externalId, "accepted", workflowName, "Started", "/logs/" + externalId,
                null, null, NOW);
    }
}
