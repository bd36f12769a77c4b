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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.kanban.domain.model.ActiveWorkflow;
import me.golemcore.kanban.domain.model.BoardSnapshot;
import me.golemcore.kanban.domain.model.DeletionState;
import me.golemcore.kanban.domain.model.MergeState;
import me.golemcore.kanban.domain.model.Project;
import me.golemcore.kanban.domain.model.Task;
import me.golemcore.kanban.domain.model.TaskLogEntry;
import me.golemcore.kanban.domain.model.WorkflowProgress;
import me.golemcore.kanban.domain.model.event.StatusUpdateEvent;
import me.golemcore.kanban.infrastructure.config.KanbanProperties;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Authoritative in-memory board state: tasks keyed by local id, plus the
 * per-task side data the workflow engine maintains (logs, progress, merge and
 * deletion state, active runs).
 *
 * <p>
 * Every change goes through {@link #commit(String, Consumer)}. A commit applies
 * all of its changes first, then notifies task-change listeners once per
 * changed task and board listeners once per commit, so observers never see a
 * half-applied update. Reads return copies.
 */
@Service
@Slf4j
public class TaskStore {

    private final KanbanProperties properties;

    private final Map<Long, Task> tasks = new LinkedHashMap<>();
    private final Map<Long, Deque<TaskLogEntry>> logs = new HashMap<>();
    private final Map<Long, WorkflowProgress> progress = new HashMap<>();
    private final Map<Long, MergeState> mergeStates = new HashMap<>();
    private final Map<String, DeletionState> deletionStates = new HashMap<>();
    private final Map<String, ActiveWorkflow> activeWorkflows = new LinkedHashMap<>();
    private final Deque<StatusUpdateEvent> statusHistory = new ArrayDeque<>();
    private final List<Project> projects = new ArrayList<>();
    private String selectedProjectId;
    private long nextTaskId = 1;
    private long logSequence;

    private final List<TaskChangeListener> taskChangeListeners = new CopyOnWriteArrayList<>();
    private final List<BoardListener> boardListeners = new CopyOnWriteArrayList<>();

    public TaskStore(KanbanProperties properties) {
        this.properties = properties;
    }

    /**
     * Called once per task whose record was added, replaced or removed in a
     * commit. {@code before} is {@code null} for additions, {@code after} for
     * removals.
     */
    @FunctionalInterface
    public interface TaskChangeListener {
        void onTaskChanged(Task before, Task after);
    }

    /**
     * Called once at the end of every commit.
     */
    @FunctionalInterface
    public interface BoardListener {
        void onCommit(String action);
    }

    public void addTaskChangeListener(TaskChangeListener listener) {
        taskChangeListeners.add(listener);
    }

    public void addBoardListener(BoardListener listener) {
        boardListeners.add(listener);
    }

    // ==================== Commit ====================

    /**
     * Applies all changes made through the transaction atomically, then fires
     * listeners.
     */
    public void commit(String action, Consumer<Transaction> changes) {
        Transaction tx = new Transaction();
        synchronized (this) {
            changes.accept(tx);
        }
        if (!tx.isDirty()) {
            return;
        }
        tx.changedTasks.forEach((id, change) -> {
            for (TaskChangeListener listener : taskChangeListeners) {
                listener.onTaskChanged(change.before, change.after);
            }
        });
        log.trace("[BoardStore] Commit '{}' touched {} task(s)", action, tx.changedTasks.size());
        for (BoardListener listener : boardListeners) {
            listener.onCommit(action);
        }
    }

    public void putTask(String action, Task task) {
        commit(action, tx -> tx.putTask(task));
    }

    public void removeTask(String action, long taskId) {
        commit(action, tx -> tx.removeTask(taskId));
    }

    public synchronized long nextTaskId() {
        return nextTaskId++;
    }

    // ==================== Reads ====================

    public synchronized Optional<Task> getTask(long taskId) {
        Task task = tasks.get(taskId);
        return task != null ? Optional.of(task.copy()) : Optional.empty();
    }

    public synchronized boolean containsTask(long taskId) {
        return tasks.containsKey(taskId);
    }

    public synchronized List<Task> getTasks() {
        List<Task> copies = new ArrayList<>(tasks.size());
        for (Task task : tasks.values()) {
            copies.add(task.copy());
        }
        return copies;
    }

    public synchronized int getTaskCount() {
        return tasks.size();
    }

    public synchronized List<TaskLogEntry> getLogs(long taskId) {
        Deque<TaskLogEntry> entries = logs.get(taskId);
        return entries != null ? new ArrayList<>(entries) : List.of();
    }

    public synchronized Optional<WorkflowProgress> getProgress(long taskId) {
        WorkflowProgress value = progress.get(taskId);
        return value != null ? Optional.of(value.toBuilder().build()) : Optional.empty();
    }

    public synchronized Optional<MergeState> getMergeState(long taskId) {
        return Optional.ofNullable(mergeStates.get(taskId));
    }

    public synchronized Optional<DeletionState> getDeletionState(String externalId) {
        return Optional.ofNullable(deletionStates.get(externalId));
    }

    public synchronized Optional<ActiveWorkflow> getActiveWorkflow(String externalId) {
        ActiveWorkflow workflow = activeWorkflows.get(externalId);
        return workflow != null ? Optional.of(workflow.toBuilder().build()) : Optional.empty();
    }

    public synchronized List<StatusUpdateEvent> getStatusHistory() {
        return new ArrayList<>(statusHistory);
    }

    public synchronized List<Project> getProjects() {
        return new ArrayList<>(projects);
    }

    public synchronized Optional<String> getSelectedProjectId() {
        return Optional.ofNullable(selectedProjectId);
    }

    // ==================== Snapshot ====================

    /**
     * Durable form of the board. Deduplication and index state are not part of
     * it.
     */
    public synchronized BoardSnapshot exportSnapshot() {
        Map<Long, List<TaskLogEntry>> logCopy = new LinkedHashMap<>();
        logs.forEach((id, entries) -> logCopy.put(id, new ArrayList<>(entries)));
        return BoardSnapshot.builder()
                .version(BoardSnapshot.CURRENT_VERSION)
                .nextTaskId(nextTaskId)
                .tasks(getTasks())
                .logs(logCopy)
                .progress(new LinkedHashMap<>(progress))
                .activeWorkflows(new ArrayList<>(activeWorkflows.values()))
                .projects(new ArrayList<>(projects))
                .selectedProjectId(selectedProjectId)
                .build();
    }

    /**
     * Replaces the whole board with a rehydrated snapshot. Listeners are not
     * notified; callers rebuild derived state themselves.
     */
    public synchronized void restore(BoardSnapshot snapshot) {
        tasks.clear();
        logs.clear();
        progress.clear();
        mergeStates.clear();
        deletionStates.clear();
        activeWorkflows.clear();
        statusHistory.clear();
        projects.clear();

        long highestId = 0;
        for (Task task : snapshot.getTasks()) {
            tasks.put(task.getId(), task.copy());
            highestId = Math.max(highestId, task.getId());
        }
        snapshot.getLogs().forEach((id, entries) -> {
            if (tasks.containsKey(id)) {
                logs.put(id, new ArrayDeque<>(entries));
            }
        });
        snapshot.getProgress().forEach((id, value) -> {
            if (tasks.containsKey(id)) {
                progress.put(id, value);
            }
        });
        for (ActiveWorkflow workflow : snapshot.getActiveWorkflows()) {
            if (workflow.getExternalId() != null) {
                activeWorkflows.put(workflow.getExternalId(), workflow);
            }
        }
        projects.addAll(snapshot.getProjects());
        selectedProjectId = snapshot.getSelectedProjectId();
        // ids are never reused, even if the persisted counter lags behind
        nextTaskId = Math.max(snapshot.getNextTaskId(), highestId + 1);
    }

    /**
     * Mutable view handed to {@link #commit(String, Consumer)}. Only valid
     * inside the commit callback.
     */
    public final class Transaction {

        private final Map<Long, TaskChange> changedTasks = new LinkedHashMap<>();
        private boolean dirty;

        private Transaction() {
        }

        boolean isDirty() {
            return dirty;
        }

        public Optional<Task> task(long taskId) {
            Task task = tasks.get(taskId);
            return task != null ? Optional.of(task.copy()) : Optional.empty();
        }

        public void putTask(Task task) {
            Task copy = task.copy();
            Task previous = tasks.put(copy.getId(), copy);
            recordChange(copy.getId(), previous, copy);
        }

        public void removeTask(long taskId) {
            Task previous = tasks.remove(taskId);
            if (previous == null) {
                return;
            }
            logs.remove(taskId);
            progress.remove(taskId);
            mergeStates.remove(taskId);
            if (previous.hasExternalId()) {
                activeWorkflows.remove(previous.getExternalId());
                deletionStates.remove(previous.getExternalId());
            }
            recordChange(taskId, previous, null);
        }

        /**
         * Appends a log line, trimming the task's log to the configured size.
         * Entries without an id get {@code <taskId>-<sequence>}.
         */
        public void appendLog(long taskId, TaskLogEntry entry) {
            if (entry.getId() == null) {
                entry.setId(taskId + "-" + (++logSequence));
            }
            Deque<TaskLogEntry> entries = logs.computeIfAbsent(taskId, id -> new ArrayDeque<>());
            entries.addLast(entry);
            int max = properties.getLogs().getMaxPerTask();
            while (entries.size() > max) {
                entries.removeFirst();
            }
            dirty = true;
        }

        public void mergeProgress(long taskId, WorkflowProgress update) {
            WorkflowProgress current = progress.get(taskId);
            progress.put(taskId, current != null ? current.mergedWith(update) : update.toBuilder().build());
            dirty = true;
        }

        public void putMergeState(long taskId, MergeState state) {
            mergeStates.put(taskId, state);
            dirty = true;
        }

        public void putDeletionState(String externalId, DeletionState state) {
            deletionStates.put(externalId, state);
            dirty = true;
        }

        public void removeDeletionState(String externalId) {
            if (deletionStates.remove(externalId) != null) {
                dirty = true;
            }
        }

        public Optional<ActiveWorkflow> activeWorkflow(String externalId) {
            return Optional.ofNullable(activeWorkflows.get(externalId));
        }

        public void putActiveWorkflow(ActiveWorkflow workflow) {
            activeWorkflows.put(workflow.getExternalId(), workflow);
            dirty = true;
        }

        public void recordStatus(StatusUpdateEvent event) {
            statusHistory.addLast(event);
            int max = properties.getLogs().getStatusHistorySize();
            while (statusHistory.size() > max) {
                statusHistory.removeFirst();
            }
            dirty = true;
        }

        public void addProject(Project project) {
            projects.removeIf(existing -> existing.getId().equals(project.getId()));
            projects.add(project);
            dirty = true;
        }

        public boolean removeProject(String projectId) {
            boolean removed = projects.removeIf(project -> project.getId().equals(projectId));
            if (removed && projectId.equals(selectedProjectId)) {
                selectedProjectId = null;
            }
            dirty |= removed;
            return removed;
        }

        public void selectProject(String projectId) {
            selectedProjectId = projectId;
            dirty = true;
        }

        private void recordChange(long taskId, Task before, Task after) {
            TaskChange existing = changedTasks.get(taskId);
            Task originalBefore = existing != null ? existing.before : before;
            changedTasks.put(taskId, new TaskChange(
                    originalBefore != null ? originalBefore.copy() : null,
                    after != null ? after.copy() : null));
            dirty = true;
        }
    }

    private record TaskChange(Task before, Task after) {
    }
}
