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
import me.golemcore.kanban.domain.model.MergeState;
import me.golemcore.kanban.domain.model.MetadataKeys;
import me.golemcore.kanban.domain.model.Notification;
import me.golemcore.kanban.domain.model.PatchRequest;
import me.golemcore.kanban.domain.model.Project;
import me.golemcore.kanban.domain.model.RemoteWorkflowRecord;
import me.golemcore.kanban.domain.model.RemoteWorkflowUpdate;
import me.golemcore.kanban.domain.model.Stage;
import me.golemcore.kanban.domain.model.Task;
import me.golemcore.kanban.domain.model.TaskDraft;
import me.golemcore.kanban.domain.model.TaskLogEntry;
import me.golemcore.kanban.domain.model.TaskUpdate;
import me.golemcore.kanban.domain.model.TriggerOptions;
import me.golemcore.kanban.domain.model.WorkflowProgress;
import me.golemcore.kanban.port.outbound.WorkflowPersistencePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Board operations exposed to the rest of the application.
 *
 * <p>
 * Every mutating operation is posted to the control thread and runs through
 * {@link OptimisticSyncController}: the store reflects the change immediately,
 * and a failed remote write restores the task and fails the returned future.
 * Tasks without an external id have no remote record, so their edits are
 * final as soon as they are applied. Reads can be called from any thread.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class KanbanBoardService {

    private static final int MIN_PATCH_REQUEST_LENGTH = 10;

    private final TaskStore taskStore;
    private final ExternalIdIndex externalIdIndex;
    private final OptimisticSyncController syncController;
    private final StageTransitionStateMachine stateMachine;
    private final WorkflowTriggerService triggerService;
    private final WorkflowPersistencePort persistencePort;
    private final NotificationService notificationService;
    private final Clock clock;

    // ==================== Task CRUD ====================

    /**
     * Creates a task in backlog. A draft carrying an external id imports an
     * existing run and creates its remote record; on failure the task is
     * removed again.
     */
    public CompletableFuture<Task> createTask(TaskDraft draft) {
        String error = validate(draft);
        if (error != null) {
            return CompletableFuture.failedFuture(new IllegalArgumentException(error));
        }
        return syncController.onLoop(() -> {
            Instant now = clock.instant();
            List<Stage> queued = draft.getQueuedStages() != null
                    ? new ArrayList<>(draft.getQueuedStages())
                    : new ArrayList<>();
            Task task = Task.builder()
                    .id(taskStore.nextTaskId())
                    .externalId(blankToNull(draft.getExternalId()))
                    .title(draft.getTitle().trim())
                    .description(draft.getDescription())
                    .workItemType(draft.getWorkItemType())
                    .queuedStages(queued)
                    .pipelineId(queued.isEmpty() ? null : pipelineIdFor(queued))
                    .projectId(draft.getProjectId() != null
                            ? draft.getProjectId()
                            : taskStore.getSelectedProjectId().orElse(null))
                    .stage(Stage.BACKLOG)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            if (draft.getMetadata() != null) {
                task.mergeMetadata(draft.getMetadata());
            }
            if (!task.hasExternalId()) {
                return syncController.create(task, null, null);
            }
            task.mergeMetadata(Map.of(MetadataKeys.ADW_ID, task.getExternalId()));
            return syncController.create(task,
                    created -> persistencePort.create(toRemoteRecord(created)),
                    KanbanBoardService::mergeCanonicalFields);
        });
    }

    public CompletableFuture<Task> updateTask(long taskId, TaskUpdate update) {
        if (update == null) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Update is required"));
        }
        if (update.getTitle() != null && update.getTitle().isBlank()) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Title cannot be blank"));
        }
        return syncController.onLoop(() -> syncController.mutate(taskId, "update",
                task -> applyUpdate(task, update),
                remoteUpdate(task -> RemoteWorkflowUpdate.builder()
                        .issueTitle(update.getTitle())
                        .issueBody(update.getDescription())
                        .issueClass(update.getWorkItemType() != null ? update.getWorkItemType().getWireId() : null)
                        .build()),
                KanbanBoardService::mergeCanonicalFields));
    }

    /**
     * Moves a task to a stage by user action. Terminal stages carry the same
     * bookkeeping as a backend transition.
     */
    public CompletableFuture<Task> moveTaskToStage(long taskId, Stage stage) {
        if (stage == null) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Stage is required"));
        }
        return syncController.onLoop(() -> syncController.mutate(taskId, "move",
                task -> BatchedMutationApplier.applyToTask(task, stateMachine.moveTo(stage)),
                remoteUpdate(task -> RemoteWorkflowUpdate.builder()
                        .currentStage(stage.getWireId())
                        .completedAt(stage == Stage.COMPLETED ? clock.instant().toString() : null)
                        .build()),
                KanbanBoardService::mergeCanonicalFields));
    }

    /**
     * Deletes a task. A task with a run is removed only once the remote
     * record is gone.
     */
    public CompletableFuture<Void> deleteTask(long taskId) {
        return syncController.onLoop(() -> syncController.delete(taskId,
                task -> persistencePort.delete(task.getExternalId())));
    }

    /**
     * Records a follow-up patch request on a task with a run and persists the
     * updated patch history.
     */
    public CompletableFuture<Task> applyPatch(long taskId, PatchRequest patch) {
        if (patch == null || patch.request() == null || patch.request().trim().length() < MIN_PATCH_REQUEST_LENGTH) {
            return CompletableFuture.failedFuture(new IllegalArgumentException(
                    "Please provide a more detailed patch description (at least "
                            + MIN_PATCH_REQUEST_LENGTH + " characters)"));
        }
        return syncController.onLoop(() -> {
            Optional<Task> found = taskStore.getTask(taskId);
            if (found.isEmpty()) {
                return CompletableFuture.failedFuture(new IllegalArgumentException("Task not found: " + taskId));
            }
            if (!found.get().hasExternalId()) {
                return CompletableFuture.failedFuture(
                        new IllegalStateException("Task " + taskId + " has no workflow run to patch"));
            }
            Instant now = clock.instant();
            return syncController.mutate(taskId, "patch",
                    task -> {
                        List<Map<String, Object>> history = patchHistory(task);
                        Map<String, Object> entry = new LinkedHashMap<>();
                        entry.put("patch_number", history.size() + 1);
                        entry.put("patch_request", patch.request().trim());
                        entry.put("requested_at", now.toString());
                        if (patch.patchFile() != null) {
                            entry.put(MetadataKeys.PATCH_FILE, patch.patchFile());
                        }
                        history.add(entry);
                        Map<String, Object> changes = new LinkedHashMap<>();
                        changes.put(MetadataKeys.PATCH_HISTORY, history);
                        if (patch.patchFile() != null) {
                            changes.put(MetadataKeys.PATCH_FILE, patch.patchFile());
                        }
                        task.mergeMetadata(changes);
                    },
                    remoteUpdate(task -> RemoteWorkflowUpdate.builder()
                            .patchFile(patch.patchFile())
                            .patchHistory(patchHistory(task))
                            .build()),
                    KanbanBoardService::mergeCanonicalFields);
        });
    }

    // ==================== Workflows ====================

    public CompletableFuture<Task> triggerWorkflowForTask(long taskId, TriggerOptions options) {
        return syncController.onLoop(() -> triggerService.triggerWorkflowForTask(taskId, options));
    }

    public CompletableFuture<Task> triggerMergeWorkflow(long taskId) {
        return syncController.onLoop(() -> triggerService.triggerMergeWorkflow(taskId));
    }

    // ==================== Queries ====================

    public Optional<Task> getTask(long taskId) {
        return taskStore.getTask(taskId);
    }

    public List<Task> getTasks() {
        return taskStore.getTasks();
    }

    public Optional<Task> getTaskByExternalId(String externalId) {
        return externalIdIndex.resolve(externalId);
    }

    public List<TaskLogEntry> getWorkflowLogsForTask(long taskId) {
        return taskStore.getLogs(taskId);
    }

    public Optional<WorkflowProgress> getWorkflowProgressForTask(long taskId) {
        return taskStore.getProgress(taskId);
    }

    public List<Task> getTasksByStage(Stage stage) {
        return taskStore.getTasks().stream()
                .filter(task -> task.getStage() == stage)
                .toList();
    }

    /**
     * Case-insensitive match on title, description or external id.
     */
    public List<Task> searchTasks(String query) {
        if (query == null || query.isBlank()) {
            return taskStore.getTasks();
        }
        String needle = query.trim().toLowerCase(Locale.ROOT);
        return taskStore.getTasks().stream()
                .filter(task -> contains(task.getTitle(), needle)
                        || contains(task.getDescription(), needle)
                        || contains(task.getExternalId(), needle))
                .toList();
    }

    public Map<Stage, Integer> getStatistics() {
        Map<Stage, Integer> counts = new EnumMap<>(Stage.class);
        for (Stage stage : Stage.values()) {
            counts.put(stage, 0);
        }
        for (Task task : taskStore.getTasks()) {
            counts.merge(task.getStage(), 1, Integer::sum);
        }
        return counts;
    }

    public Optional<MergeState> getMergeState(long taskId) {
        return taskStore.getMergeState(taskId);
    }

    public Optional<DeletionState> getDeletionState(String externalId) {
        return taskStore.getDeletionState(externalId);
    }

    public List<Notification> getNotifications() {
        return notificationService.getNotifications();
    }

    public boolean dismissNotification(String notificationId) {
        return notificationService.dismiss(notificationId);
    }

    // ==================== Projects ====================

    public CompletableFuture<Project> addProject(String name, String path) {
        if (name == null || name.isBlank()) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Project name is required"));
        }
        return syncController.onLoop(() -> {
            Project project = Project.builder()
                    .id(UUID.randomUUID().toString())
                    .name(name.trim())
                    .path(path)
                    .createdAt(clock.instant())
                    .build();
            taskStore.commit("addProject", tx -> {
                tx.addProject(project);
                tx.selectProject(project.getId());
            });
            log.info("[Board] Added project '{}' ({})", project.getName(), project.getId());
            return CompletableFuture.completedFuture(project);
        });
    }

    public CompletableFuture<Void> selectProject(String projectId) {
        return syncController.onLoop(() -> {
            boolean known = taskStore.getProjects().stream().anyMatch(p -> p.getId().equals(projectId));
            if (!known) {
                return CompletableFuture.failedFuture(new IllegalArgumentException("Unknown project: " + projectId));
            }
            taskStore.commit("selectProject", tx -> tx.selectProject(projectId));
            return CompletableFuture.completedFuture(null);
        });
    }

    public CompletableFuture<Boolean> removeProject(String projectId) {
        return syncController.onLoop(() -> {
            AtomicBoolean removed = new AtomicBoolean();
            taskStore.commit("removeProject", tx -> removed.set(tx.removeProject(projectId)));
            return CompletableFuture.completedFuture(removed.get());
        });
    }

    public List<Project> getProjects() {
        return taskStore.getProjects();
    }

    public Optional<String> getSelectedProjectId() {
        return taskStore.getSelectedProjectId();
    }

    // ==================== Helpers ====================

    /**
     * PATCHes the remote record of the task as it is when the queued operation
     * runs; a task without a run at that point stays local.
     */
    private Function<Task, CompletableFuture<RemoteWorkflowRecord>> remoteUpdate(
            Function<Task, RemoteWorkflowUpdate> body) {
        return task -> {
            if (!task.hasExternalId()) {
                log.debug("[Board] Task {} has no run, change kept local", task.getId());
                return CompletableFuture.completedFuture(null);
            }
            return persistencePort.update(task.getExternalId(), body.apply(task));
        };
    }

    private static void applyUpdate(Task task, TaskUpdate update) {
        if (update.getTitle() != null) {
            task.setTitle(update.getTitle().trim());
        }
        if (update.getDescription() != null) {
            task.setDescription(update.getDescription());
        }
        if (update.getWorkItemType() != null) {
            task.setWorkItemType(update.getWorkItemType());
        }
        if (update.getQueuedStages() != null) {
            task.setQueuedStages(new ArrayList<>(update.getQueuedStages()));
            task.setPipelineId(update.getQueuedStages().isEmpty() ? null : pipelineIdFor(update.getQueuedStages()));
        }
        task.mergeMetadata(update.getMetadata());
    }

    /**
     * Server fields that are authoritative once a write succeeded.
     */
    static void mergeCanonicalFields(Task task, RemoteWorkflowRecord record) {
        if (record == null) {
            return;
        }
        Map<String, Object> canonical = new LinkedHashMap<>();
        if (record.getWorkflowName() != null) {
            canonical.put(MetadataKeys.WORKFLOW_NAME, record.getWorkflowName());
        }
        if (record.getBranchName() != null) {
            canonical.put(MetadataKeys.BRANCH_NAME, record.getBranchName());
        }
        if (record.getPatchFile() != null) {
            canonical.put(MetadataKeys.PATCH_FILE, record.getPatchFile());
        }
        if (record.getPatchHistory() != null) {
            canonical.put(MetadataKeys.PATCH_HISTORY, record.getPatchHistory());
        }
        task.mergeMetadata(canonical);
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> patchHistory(Task task) {
        Object raw = task.getMetadata().get(MetadataKeys.PATCH_HISTORY);
        List<Map<String, Object>> history = new ArrayList<>();
        if (raw instanceof List<?> entries) {
            for (Object entry : entries) {
                if (entry instanceof Map<?, ?> map) {
                    history.add((Map<String, Object>) map);
                }
            }
        }
        return history;
    }

    private static RemoteWorkflowRecord toRemoteRecord(Task task) {
        return RemoteWorkflowRecord.builder()
                .adwId(task.getExternalId())
                .issueTitle(task.getTitle())
                .issueBody(task.getDescription())
                .issueClass(task.getWorkItemType() != null ? task.getWorkItemType().getWireId() : null)
                .workflowName(task.getWorkflowName())
                .currentStage(task.getStage().getWireId())
                .build();
    }

    private static String pipelineIdFor(List<Stage> stages) {
        StringBuilder id = new StringBuilder("adw");
        for (Stage stage : stages) {
            id.append('_').append(stage.getWireId());
        }
        return id.toString();
    }

    private static String validate(TaskDraft draft) {
        if (draft == null) {
            return "Task draft is required";
        }
        if (draft.getTitle() == null || draft.getTitle().isBlank()) {
            return "Title is required";
        }
        return null;
    }

    private static boolean contains(String value, String needle) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(needle);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
