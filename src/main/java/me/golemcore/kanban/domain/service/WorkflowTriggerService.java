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
import me.golemcore.kanban.domain.loop.ControlLoop;
import me.golemcore.kanban.domain.model.ActiveWorkflow;
import me.golemcore.kanban.domain.model.MergeState;
import me.golemcore.kanban.domain.model.MetadataKeys;
import me.golemcore.kanban.domain.model.Stage;
import me.golemcore.kanban.domain.model.Task;
import me.golemcore.kanban.domain.model.TriggerOptions;
import me.golemcore.kanban.domain.model.TriggerWorkflowRequest;
import me.golemcore.kanban.domain.model.event.TriggerResponseEvent;
import me.golemcore.kanban.infrastructure.config.KanbanProperties;
import me.golemcore.kanban.port.outbound.WorkflowTransportPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Starts workflow runs for tasks over the transport.
 *
 * <p>
 * When the backend accepts a trigger the task is bound to the run's external
 * id in the same commit that records the run, so events arriving right after
 * the acceptance already route to it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkflowTriggerService {

    private static final int REASON_PREVIEW_LENGTH = 50;

    private final TaskStore taskStore;
    private final WorkflowTransportPort transport;
    private final OptimisticSyncController syncController;
    private final NotificationService notificationService;
    private final ControlLoop controlLoop;
    private final KanbanProperties properties;
    private final Clock clock;

    /**
     * Triggers a run for the task. The workflow type comes from the options or,
     * failing that, from the task's queued stages. Must be called on the
     * control thread.
     */
    public CompletableFuture<Task> triggerWorkflowForTask(long taskId, TriggerOptions options) {
        Optional<Task> found = taskStore.getTask(taskId);
        if (found.isEmpty()) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Task not found: " + taskId));
        }
        Task task = found.get();
        TriggerOptions effective = options != null ? options : new TriggerOptions();
        String workflowType = resolveWorkflowType(task, effective);
        if (workflowType == null) {
            return CompletableFuture.failedFuture(
                    new IllegalArgumentException("Workflow type is required. Please select a workflow type."));
        }

        TriggerWorkflowRequest request = buildRequest(task, workflowType, effective);
        log.info("[Trigger] Triggering {} for task {}", workflowType, taskId);

        CompletableFuture<Task> result = new CompletableFuture<>();
        transport.triggerWorkflow(request).whenCompleteAsync((response, error) -> {
            if (error != null) {
                Throwable cause = OptimisticSyncController.unwrap(error);
                log.error("[Trigger] Trigger of {} for task {} failed: {}", workflowType, taskId, cause.getMessage());
                notificationService.error("Failed to trigger workflow: " + OptimisticSyncController.describe(cause));
                result.completeExceptionally(cause);
                return;
            }
            Optional<Task> updated = recordAcceptedRun(taskId, response);
            if (updated.isEmpty()) {
                result.completeExceptionally(new IllegalStateException(
                        "Task " + taskId + " was removed before run " + response.externalId() + " was accepted"));
                return;
            }
            result.complete(updated.get());
        }, controlLoop);
        return result;
    }

    /**
     * Starts the merge run for a task waiting in ready-to-merge. The merge
     * bookkeeping is applied optimistically and rolled back when the trigger
     * fails; the outcome arrives later as a merge-run status update.
     */
    public CompletableFuture<Task> triggerMergeWorkflow(long taskId) {
        Optional<Task> found = taskStore.getTask(taskId);
        if (found.isEmpty()) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Task not found: " + taskId));
        }
        Task task = found.get();
        if (task.getStage() != Stage.READY_TO_MERGE) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("Task must be in \"Ready to Merge\" stage to trigger merge"));
        }
        if (!task.hasExternalId()) {
            return CompletableFuture.failedFuture(new IllegalStateException("Task is missing ADW ID"));
        }

        Instant now = clock.instant();
        String mergeWorkflow = properties.getWorkflow().getMergeWorkflow();
        taskStore.commit("mergeStarted", tx -> tx.putMergeState(taskId, new MergeState(
                MergeState.MergeStatus.IN_PROGRESS, "Starting merge via " + mergeWorkflow, now)));

        TriggerWorkflowRequest request = buildRequest(task, mergeWorkflow, TriggerOptions.builder()
                .externalId(task.getExternalId())
                .build());

        CompletableFuture<Task> result = syncController.<TriggerResponseEvent>mutate(taskId, "merge",
                working -> working.mergeMetadata(Map.of(
                        MetadataKeys.MERGE_TRIGGERED, true,
                        MetadataKeys.MERGE_TRIGGERED_AT, now.toString(),
                        MetadataKeys.MERGE_IN_PROGRESS, true)),
                working -> transport.triggerWorkflow(request),
                null);
        return result.whenCompleteAsync((merged, error) -> {
            if (error != null) {
                String detail = OptimisticSyncController.describe(OptimisticSyncController.unwrap(error));
                taskStore.commit("mergeFailed", tx -> tx.putMergeState(taskId,
                        new MergeState(MergeState.MergeStatus.ERROR, detail, clock.instant())));
            } else {
                log.info("[Trigger] Merge run started for task {} ({})", taskId, task.getExternalId());
            }
        }, controlLoop);
    }

    private Optional<Task> recordAcceptedRun(long taskId, TriggerResponseEvent response) {
        Instant now = clock.instant();
        Optional<Stage> initialStage = WorkflowStageSequence.initialStage(response.workflowName());
        AtomicReference<Task> updated = new AtomicReference<>();
        taskStore.commit("setAdwIdAndMoveStage", tx -> tx.task(taskId).ifPresent(task -> {
            if (initialStage.isPresent() && task.getStage() == Stage.BACKLOG) {
                task.setStage(initialStage.get());
                task.setSubstage(null);
                task.setProgress(0);
            }
            task.setExternalId(response.externalId());
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put(MetadataKeys.ADW_ID, response.externalId());
            if (response.workflowName() != null) {
                metadata.put(MetadataKeys.WORKFLOW_NAME, response.workflowName());
            }
            metadata.put(MetadataKeys.WORKFLOW_STATUS, MetadataKeys.STATUS_STARTED);
            if (response.logsPath() != null) {
                metadata.put(MetadataKeys.LOGS_PATH, response.logsPath());
            }
            task.mergeMetadata(metadata);
            task.setUpdatedAt(now);
            tx.putTask(task);
            tx.putActiveWorkflow(ActiveWorkflow.builder()
                    .externalId(response.externalId())
                    .taskId(taskId)
                    .workflowName(response.workflowName())
                    .status(MetadataKeys.STATUS_STARTED)
                    .logsPath(response.logsPath())
                    .progress(0)
                    .startedAt(now)
                    .updatedAt(now)
                    .build());
            updated.set(task);
        }));
        if (updated.get() != null) {
            log.info("[Trigger] Task {} bound to run {} ({}), stage {}", taskId, response.externalId(),
                    response.workflowName(), updated.get().getStage().getWireId());
        }
        return Optional.ofNullable(updated.get());
    }

    private String resolveWorkflowType(Task task, TriggerOptions options) {
        if (options.getWorkflowType() != null && !options.getWorkflowType().isBlank()) {
            return options.getWorkflowType();
        }
        boolean hasQueuedStages = task.getQueuedStages() != null
                && task.getQueuedStages().stream().anyMatch(Stage::isWorkflowStage);
        return hasQueuedStages ? WorkflowStageSequence.workflowNameFor(task.getQueuedStages()) : null;
    }

    private TriggerWorkflowRequest buildRequest(Task task, String workflowType, TriggerOptions options) {
        String title = task.getTitle() != null && !task.getTitle().isBlank()
                ? task.getTitle()
                : "Task " + task.getId();
        String description = task.getDescription() != null ? task.getDescription() : "";
        String reasonSource = task.getTitle() != null && !task.getTitle().isBlank()
                ? task.getTitle()
                : description.substring(0, Math.min(REASON_PREVIEW_LENGTH, description.length()));
        return TriggerWorkflowRequest.builder()
                .workflowType(workflowType)
                .adwId(options.getExternalId() != null ? options.getExternalId() : task.getExternalId())
                .issueNumber(options.getIssueNumber())
                .issueType(task.getWorkItemType() != null ? task.getWorkItemType().getWireId() : null)
                .issueJson(TriggerWorkflowRequest.IssueJson.builder()
                        .title(title)
                        .body(description)
                        .number(task.getId())
                        .build())
                .modelSet(options.getModelSet() != null
                        ? options.getModelSet()
                        : properties.getWorkflow().getDefaultModelSet())
                .triggerReason("Kanban task: " + reasonSource)
                .build();
    }
}
