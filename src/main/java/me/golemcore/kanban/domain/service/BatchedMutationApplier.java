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
import me.golemcore.kanban.domain.model.Task;
import me.golemcore.kanban.domain.model.TaskLogEntry;
import me.golemcore.kanban.domain.model.TaskMutation;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Applies a {@link TaskMutation} to the store in one commit, so listeners fire
 * once per inbound event and never observe a partially applied change.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BatchedMutationApplier {

    private final TaskStore taskStore;
    private final Clock clock;

    /**
     * Applies the mutation and returns the resulting task, or empty when the
     * task no longer exists.
     */
    public Optional<Task> apply(long taskId, TaskMutation mutation, String action) {
        if (mutation.isEmpty()) {
            return taskStore.getTask(taskId);
        }
        return apply(taskId, mutation, action, tx -> {
        });
    }

    /**
     * Applies the mutation together with board-level changes made by the same
     * event (status history, active workflow), all in one commit. The board
     * changes are applied even when the task no longer exists.
     */
    public Optional<Task> apply(long taskId, TaskMutation mutation, String action,
            Consumer<TaskStore.Transaction> boardChanges) {
        Instant now = clock.instant();
        AtomicReference<Task> result = new AtomicReference<>();
        taskStore.commit(action, tx -> {
            boardChanges.accept(tx);
            Optional<Task> current = tx.task(taskId);
            if (current.isEmpty()) {
                return;
            }
            Task task = current.get();
            boolean taskChanged = applyToTask(task, mutation);
            if (taskChanged) {
                task.setUpdatedAt(now);
                tx.putTask(task);
            }
            if (mutation.getWorkflowProgress() != null) {
                tx.mergeProgress(taskId, mutation.getWorkflowProgress());
            }
            if (mutation.getLogEntry() != null) {
                TaskLogEntry entry = mutation.getLogEntry();
                if (entry.getTimestamp() == null) {
                    entry.setTimestamp(now);
                }
                tx.appendLog(taskId, entry);
            }
            if (mutation.getMergeState() != null) {
                tx.putMergeState(taskId, mutation.getMergeState());
            }
            result.set(task);
        });
        if (result.get() == null) {
            log.debug("[Applier] Task {} vanished before '{}' could be applied", taskId, action);
        }
        return Optional.ofNullable(result.get());
    }

    /**
     * Task-record part of a mutation. A stage change resets substage and
     * progress before explicit values are applied.
     */
    static boolean applyToTask(Task task, TaskMutation mutation) {
        boolean changed = false;
        if (mutation.getStage() != null) {
            task.setStage(mutation.getStage());
            task.setSubstage(null);
            task.setProgress(0);
            changed = true;
        }
        if (mutation.getSubstage() != null) {
            task.setSubstage(mutation.getSubstage());
            changed = true;
        }
        if (mutation.getProgress() != null) {
            task.setProgress(mutation.getProgress());
            changed = true;
        }
        if (mutation.getMetadata() != null && !mutation.getMetadata().isEmpty()) {
            task.mergeMetadata(mutation.getMetadata());
            changed = true;
        }
        return changed;
    }
}
