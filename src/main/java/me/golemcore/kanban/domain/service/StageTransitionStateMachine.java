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
import me.golemcore.kanban.domain.model.MergeState;
import me.golemcore.kanban.domain.model.MetadataKeys;
import me.golemcore.kanban.domain.model.Stage;
import me.golemcore.kanban.domain.model.Task;
import me.golemcore.kanban.domain.model.TaskMutation;
import me.golemcore.kanban.domain.model.WorkflowProgress;
import me.golemcore.kanban.domain.model.event.StageTransitionEvent;
import me.golemcore.kanban.domain.model.event.StatusUpdateEvent;
import me.golemcore.kanban.domain.model.event.TriggerResponseEvent;
import me.golemcore.kanban.infrastructure.config.KanbanProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns inbound workflow events into task mutations.
 *
 * <p>
 * Three sources move a task between stages, in decreasing authority:
 * <ul>
 * <li>an explicit {@code stage_transition}, applied unconditionally</li>
 * <li>a {@code "Stage: X"} hint in a status update, applied only when it moves
 * the task forward in its workflow's stage sequence</li>
 * <li>a {@code failed} status, which moves the task to errored</li>
 * </ul>
 * Merge runs are routed to merge completion or failure instead of the stage
 * machine. Nothing here touches the store; the returned mutation is applied by
 * {@link BatchedMutationApplier}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StageTransitionStateMachine {

    private static final String MERGE_MARKER = "merge_iso";

    private final KanbanProperties properties;
    private final Clock clock;

    // ==================== Explicit transitions ====================

    /**
     * Mutation for a backend-decided stage move, or empty when the target is
     * not a known stage.
     */
    public Optional<TaskMutation> onStageTransition(Task task, StageTransitionEvent event) {
        Optional<Stage> target = Stage.parse(event.toStage());
        if (target.isEmpty()) {
            log.warn("[StageMachine] Invalid target stage '{}' for {}", event.toStage(), event.externalId());
            return Optional.empty();
        }
        log.info("[StageMachine] Task {} {} -> {} via stage transition", task.getId(), task.getStage().getWireId(),
                target.get().getWireId());
        return Optional.of(moveTo(target.get()));
    }

    /**
     * Mutation for moving a task to {@code stage}, including the bookkeeping
     * terminal stages carry.
     */
    public TaskMutation moveTo(Stage stage) {
        TaskMutation.TaskMutationBuilder mutation = TaskMutation.builder().stage(stage);
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (stage.isTerminalSuccess()) {
            mutation.progress(100);
            metadata.put(MetadataKeys.WORKFLOW_COMPLETE, true);
        } else if (stage == Stage.ERRORED) {
            metadata.put(MetadataKeys.WORKFLOW_STATUS, MetadataKeys.STATUS_FAILED);
        }
        return mutation.metadata(metadata).build();
    }

    // ==================== Status updates ====================

    public TaskMutation onStatusUpdate(Task task, StatusUpdateEvent event) {
        Instant now = clock.instant();
        Map<String, Object> metadata = new LinkedHashMap<>();
        putIfPresent(metadata, MetadataKeys.WORKFLOW_STATUS, event.status());
        putIfPresent(metadata, MetadataKeys.WORKFLOW_MESSAGE, event.message());
        putIfPresent(metadata, MetadataKeys.WORKFLOW_PROGRESS, event.progressPercent());
        putIfPresent(metadata, MetadataKeys.WORKFLOW_STEP, event.currentStep());

        TaskMutation.TaskMutationBuilder mutation = TaskMutation.builder()
                .workflowProgress(WorkflowProgress.builder()
                        .status(event.status())
                        .progress(event.progressPercent())
                        .currentStep(event.currentStep())
                        .message(event.message())
                        .timestamp(event.timestamp() != null ? event.timestamp() : now)
                        .build());

        inferStage(task, event.currentStep()).ifPresent(stage -> {
            log.info("[StageMachine] Task {} {} -> {} from step '{}'", task.getId(), task.getStage().getWireId(),
                    stage.getWireId(), event.currentStep());
            mutation.stage(stage);
        });

        if (MetadataKeys.STATUS_COMPLETED.equals(event.status())) {
            if (isMergeRun(task, event.workflowName())) {
                log.info("[StageMachine] Merge completed for {}", event.externalId());
                metadata.putAll(mergeCompletedMetadata(task, now));
                mutation.mergeState(new MergeState(MergeState.MergeStatus.SUCCESS,
                        "Merge completed successfully", now));
            } else {
                log.debug("[StageMachine] Run {} completed, waiting for stage transition", event.externalId());
            }
        } else if (MetadataKeys.STATUS_FAILED.equals(event.status())) {
            if (containsMergeMarker(event.workflowName())) {
                String error = event.message() != null ? event.message() : "Merge failed";
                log.warn("[StageMachine] Merge failed for {}: {}", event.externalId(), error);
                metadata.putAll(mergeFailedMetadata(error, now));
                mutation.mergeState(new MergeState(MergeState.MergeStatus.ERROR, error, now));
            } else {
                log.info("[StageMachine] Run {} failed, moving task {} to errored", event.externalId(), task.getId());
                mutation.stage(Stage.ERRORED);
                putIfPresent(metadata, MetadataKeys.WORKFLOW_ERROR, event.message());
            }
        }
        return mutation.metadata(metadata).build();
    }

    /**
     * Stage a {@code "Stage: X"} hint may advance the task to. Empty when the
     * hint is absent, unknown, equal to the current stage, behind it, or the
     * task already settled in errored or a terminal stage. When either
     * position in the workflow's sequence is unknown the move is allowed.
     */
    public Optional<Stage> inferStage(Task task, String currentStep) {
        Optional<Stage> hinted = StageHintParser.parseStage(currentStep);
        if (hinted.isEmpty() || hinted.get() == task.getStage() || task.getStage().isSettled()) {
            return Optional.empty();
        }
        List<Stage> sequence = WorkflowStageSequence.parse(task.getWorkflowName());
        int targetIndex = sequence.indexOf(hinted.get());
        int currentIndex = sequence.indexOf(task.getStage());
        if (targetIndex == -1 || currentIndex == -1) {
            log.debug("[StageMachine] Position unknown in workflow '{}', allowing move to {}",
                    task.getWorkflowName(), hinted.get().getWireId());
            return hinted;
        }
        return targetIndex > currentIndex ? hinted : Optional.empty();
    }

    // ==================== Trigger & merge ====================

    public TaskMutation onTriggerAccepted(TriggerResponseEvent event) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        putIfPresent(metadata, MetadataKeys.ADW_ID, event.externalId());
        putIfPresent(metadata, MetadataKeys.WORKFLOW_NAME, event.workflowName());
        metadata.put(MetadataKeys.TRIGGER_STATUS, MetadataKeys.STATUS_ACCEPTED);
        putIfPresent(metadata, MetadataKeys.TRIGGER_MESSAGE, event.message());
        putIfPresent(metadata, MetadataKeys.LOGS_PATH, event.logsPath());
        putIfPresent(metadata, MetadataKeys.PLAN_FILE, event.planFile());
        metadata.put(MetadataKeys.TRIGGERED_AT, clock.instant().toString());
        return TaskMutation.builder().metadata(metadata).build();
    }

    /**
     * Whether a status for this task belongs to a merge run rather than the
     * task's own workflow.
     */
    public boolean isMergeRun(Task task, String workflowName) {
        if (containsMergeMarker(workflowName)) {
            return true;
        }
        Object adwIds = task.getMetadata().get(MetadataKeys.ADW_IDS);
        return adwIds instanceof Collection<?> ids && ids.contains(properties.getWorkflow().getMergeWorkflow());
    }

    private Map<String, Object> mergeCompletedMetadata(Task task, Instant now) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(MetadataKeys.MERGE_COMPLETED, true);
        metadata.put(MetadataKeys.MERGE_COMPLETED_AT, now.toString());
        putIfPresent(metadata, MetadataKeys.MERGED_BRANCH, task.getMetadata().get(MetadataKeys.BRANCH_NAME));
        metadata.put(MetadataKeys.MERGE_IN_PROGRESS, false);
        metadata.put(MetadataKeys.MERGE_METHOD, properties.getWorkflow().getMergeMethod());
        return metadata;
    }

    private Map<String, Object> mergeFailedMetadata(String error, Instant now) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(MetadataKeys.MERGE_ERROR, error);
        metadata.put(MetadataKeys.MERGE_ERROR_AT, now.toString());
        metadata.put(MetadataKeys.MERGE_IN_PROGRESS, false);
        return metadata;
    }

    private static boolean containsMergeMarker(String workflowName) {
        return workflowName != null && workflowName.contains(MERGE_MARKER);
    }

    private static void putIfPresent(Map<String, Object> metadata, String key, Object value) {
        if (value != null) {
            metadata.put(key, value);
        }
    }
}
