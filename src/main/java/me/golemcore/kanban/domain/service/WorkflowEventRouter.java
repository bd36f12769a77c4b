package me.golemcore.kanban.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.kanban.domain.model.DeletionState;
import me.golemcore.kanban.domain.model.Task;
import me.golemcore.kanban.domain.model.TaskLogEntry;
import me.golemcore.kanban.domain.model.TaskMutation;
import me.golemcore.kanban.domain.model.event.AgentLogEvent;
import me.golemcore.kanban.domain.model.event.AgentSummaryUpdateEvent;
import me.golemcore.kanban.domain.model.event.FileChangedEvent;
import me.golemcore.kanban.domain.model.event.StageTransitionEvent;
import me.golemcore.kanban.domain.model.event.StatusUpdateEvent;
import me.golemcore.kanban.domain.model.event.SystemLogEvent;
import me.golemcore.kanban.domain.model.event.TextBlockEvent;
import me.golemcore.kanban.domain.model.event.ThinkingBlockEvent;
import me.golemcore.kanban.domain.model.event.ToolUsePostEvent;
import me.golemcore.kanban.domain.model.event.ToolUsePreEvent;
import me.golemcore.kanban.domain.model.event.TriggerResponseEvent;
import me.golemcore.kanban.domain.model.event.WorkflowEvent;
import me.golemcore.kanban.domain.model.event.WorkflowLogEvent;
import me.golemcore.kanban.port.inbound.WorkflowEventPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Inbound pipeline for workflow events: deduplicate, route by external id,
 * interpret, apply.
 *
 * <p>
 * Runs on the control thread. Nothing thrown while handling an event escapes
 * to the transport; failures are logged and the event is dropped.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkflowEventRouter implements WorkflowEventPort {

    private final MessageDeduplicator deduplicator;
    private final ExternalIdIndex externalIdIndex;
    private final StageTransitionStateMachine stateMachine;
    private final BatchedMutationApplier applier;
    private final TaskStore taskStore;
    private final NotificationService notificationService;
    private final Clock clock;

    @Override
    public void onEvent(WorkflowEvent event) {
        if (event == null) {
            return;
        }
        try {
            if (deduplicator.isDuplicate(event)) {
                log.debug("[Router] Duplicate {} for {} dropped", event.type().getWireType(), event.externalId());
                return;
            }
            boolean routed = dispatch(event);
            if (!routed) {
                log.warn("[Router] No task owns {} ({} dropped)", event.externalId(), event.type().getWireType());
            }
        } catch (Exception e) { // NOSONAR - transport entry point must never throw
            log.error("[Router] Failed to handle {} for {}", event.type().getWireType(), event.externalId(), e);
        }
    }

    @Override
    public void onConnected() {
        try {
            deduplicator.clear();
            log.info("[Router] Transport connected, deduplication state reset");
        } catch (Exception e) { // NOSONAR - transport entry point must never throw
            log.error("[Router] Failed to reset on connect", e);
        }
    }

    @Override
    public void onDisconnected() {
        log.info("[Router] Transport disconnected");
    }

    /**
     * Returns {@code false} when the event names a run no task owns.
     */
    private boolean dispatch(WorkflowEvent event) {
        Instant now = clock.instant();
        return switch (event.type()) {
            case STATUS_UPDATE -> handleStatusUpdate((StatusUpdateEvent) event);
            case WORKFLOW_LOG -> appendLog(event.externalId(),
                    WorkflowLogMapper.fromWorkflowLog((WorkflowLogEvent) event, now), "workflowLog");
            case TRIGGER_RESPONSE -> handleTriggerResponse((TriggerResponseEvent) event);
            case STAGE_TRANSITION -> handleStageTransition((StageTransitionEvent) event);
            case AGENT_LOG -> appendLog(event.externalId(),
                    WorkflowLogMapper.fromAgentLog((AgentLogEvent) event, now), "agentLog");
            case THINKING_BLOCK -> appendLog(event.externalId(),
                    WorkflowLogMapper.fromThinkingBlock((ThinkingBlockEvent) event, now), "thinkingBlock");
            case TOOL_USE_PRE -> appendLog(event.externalId(),
                    WorkflowLogMapper.fromToolUsePre((ToolUsePreEvent) event, now), "toolUsePre");
            case TOOL_USE_POST -> appendLog(event.externalId(),
                    WorkflowLogMapper.fromToolUsePost((ToolUsePostEvent) event, now), "toolUsePost");
            case TEXT_BLOCK -> appendLog(event.externalId(),
                    WorkflowLogMapper.fromTextBlock((TextBlockEvent) event, now), "textBlock");
            case FILE_CHANGED -> appendLog(event.externalId(),
                    WorkflowLogMapper.fromFileChanged((FileChangedEvent) event, now), "fileChanged");
            case AGENT_SUMMARY_UPDATE -> appendLog(event.externalId(),
                    WorkflowLogMapper.fromSummaryUpdate((AgentSummaryUpdateEvent) event, now), "summaryUpdate");
            case SYSTEM_LOG -> handleSystemLog((SystemLogEvent) event);
        };
    }

    // ==================== Handlers ====================

    /**
     * Status history, active-workflow progress, the task's stage and the
     * derived log line all land in one commit.
     */
    private boolean handleStatusUpdate(StatusUpdateEvent event) {
        Instant now = clock.instant();
        Consumer<TaskStore.Transaction> boardChanges = tx -> {
            tx.recordStatus(event);
            tx.activeWorkflow(event.externalId()).ifPresent(workflow -> tx.putActiveWorkflow(workflow.toBuilder()
                    .status(event.status() != null ? event.status() : workflow.getStatus())
                    .progress(event.progressPercent() != null ? event.progressPercent() : workflow.getProgress())
                    .currentStep(event.currentStep() != null ? event.currentStep() : workflow.getCurrentStep())
                    .lastMessage(event.message() != null ? event.message() : workflow.getLastMessage())
                    .updatedAt(now)
                    .build()));
        };

        Optional<Task> task = externalIdIndex.resolve(event.externalId());
        if (task.isEmpty()) {
            taskStore.commit("statusHistory", boardChanges);
            return false;
        }
        TaskMutation mutation = stateMachine.onStatusUpdate(task.get(), event);
        if (event.message() != null) {
            mutation.setLogEntry(WorkflowLogMapper.fromStatusUpdate(event, now));
        }
        applier.apply(task.get().getId(), mutation, "statusUpdate", boardChanges);
        return true;
    }

    private boolean handleTriggerResponse(TriggerResponseEvent event) {
        Optional<Task> task = externalIdIndex.resolve(event.externalId());
        if (task.isEmpty()) {
            return false;
        }
        if (event.isAccepted()) {
            applier.apply(task.get().getId(), stateMachine.onTriggerAccepted(event), "triggerResponse");
        } else {
            log.info("[Router] Trigger for {} answered '{}': {}", event.externalId(), event.status(),
                    event.error() != null ? event.error() : event.message());
        }
        return true;
    }

    private boolean handleStageTransition(StageTransitionEvent event) {
        Optional<Task> task = externalIdIndex.resolve(event.externalId());
        if (task.isEmpty()) {
            return false;
        }
        stateMachine.onStageTransition(task.get(), event)
                .ifPresent(mutation -> applier.apply(task.get().getId(), mutation, "stageTransition"));
        return true;
    }

    private boolean appendLog(String externalId, TaskLogEntry entry, String action) {
        Optional<Long> taskId = externalIdIndex.resolveTaskId(externalId);
        if (taskId.isEmpty()) {
            return false;
        }
        applier.apply(taskId.get(), TaskMutation.ofLog(entry), action);
        return true;
    }

    private boolean handleSystemLog(SystemLogEvent event) {
        String eventType = event.eventType();
        String externalId = event.externalId();
        if (SystemLogEvent.EVENT_WORKTREE_DELETED.equals(eventType) && externalId != null) {
            Optional<Long> taskId = externalIdIndex.resolveTaskId(externalId);
            if (taskId.isEmpty()) {
                return false;
            }
            taskStore.commit("worktreeDeleted", tx -> {
                tx.removeTask(taskId.get());
                tx.removeDeletionState(externalId);
            });
            log.info("[Router] Worktree for {} deleted, removed task {}", externalId, taskId.get());
            notificationService.success(event.message() != null
                    ? event.message()
                    : "ADW " + externalId + " deleted successfully");
            return true;
        }
        if (SystemLogEvent.EVENT_WORKTREE_DELETE_FAILED.equals(eventType) && externalId != null) {
            String error = event.message() != null ? event.message() : "Deletion failed";
            taskStore.commit("worktreeDeleteFailed",
                    tx -> tx.putDeletionState(externalId, DeletionState.failed(error)));
            log.warn("[Router] Worktree deletion failed for {}: {}", externalId, error);
            notificationService.error(event.message() != null
                    ? event.message()
                    : "Failed to delete ADW " + externalId);
            return true;
        }
        log.info("[SystemLog] {}: {}", event.level(), event.message());
        return true;
    }
}
