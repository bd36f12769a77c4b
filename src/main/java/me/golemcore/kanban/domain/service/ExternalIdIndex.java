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
import me.golemcore.kanban.domain.model.Task;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps a workflow run's external id to the task that owns it, so inbound
 * events route in constant time.
 *
 * <p>
 * The index is a projection of the task set, never a source of truth. It
 * follows store commits through a task-change listener and can be rebuilt from
 * scratch at any time.
 */
@Service
@Slf4j
public class ExternalIdIndex {

    private final TaskStore taskStore;
    private final Map<String, Long> taskIdsByExternalId = new HashMap<>();
    private final Map<Long, String> externalIdsByTaskId = new HashMap<>();

    public ExternalIdIndex(TaskStore taskStore) {
        this.taskStore = taskStore;
        taskStore.addTaskChangeListener(this::onTaskChanged);
    }

    /**
     * Task owning the external id, or empty when no live task does.
     */
    public Optional<Task> resolve(String externalId) {
        return resolveTaskId(externalId).flatMap(taskStore::getTask);
    }

    public synchronized Optional<Long> resolveTaskId(String externalId) {
        if (externalId == null) {
            return Optional.empty();
        }
        Long taskId = taskIdsByExternalId.get(externalId);
        if (taskId == null) {
            return Optional.empty();
        }
        if (!taskStore.containsTask(taskId)) {
            log.debug("[Index] Dropping stale entry {} -> {}", externalId, taskId);
            unbind(taskId);
            return Optional.empty();
        }
        return Optional.of(taskId);
    }

    /**
     * Makes {@code taskId} the owner of {@code externalId}. A task owns at most
     * one id and an id has at most one owner, so any previous pairing on either
     * side is dropped.
     */
    public synchronized void bind(long taskId, String externalId) {
        if (externalId == null || externalId.isBlank()) {
            return;
        }
        String previousId = externalIdsByTaskId.get(taskId);
        if (previousId != null && !previousId.equals(externalId)) {
            taskIdsByExternalId.remove(previousId);
        }
        Long previousOwner = taskIdsByExternalId.put(externalId, taskId);
        if (previousOwner != null && previousOwner != taskId) {
            externalIdsByTaskId.remove(previousOwner);
            log.warn("[Index] External id {} moved from task {} to task {}", externalId, previousOwner, taskId);
        }
        externalIdsByTaskId.put(taskId, externalId);
    }

    public synchronized void unbind(long taskId) {
        String externalId = externalIdsByTaskId.remove(taskId);
        if (externalId != null) {
            taskIdsByExternalId.remove(externalId, taskId);
        }
    }

    /**
     * Discards the index and re-derives it from the given tasks.
     */
    public synchronized void rebuild(Collection<Task> tasks) {
        taskIdsByExternalId.clear();
        externalIdsByTaskId.clear();
        for (Task task : tasks) {
            if (task.hasExternalId()) {
                bind(task.getId(), task.getExternalId());
            }
        }
        log.info("[Index] Rebuilt with {} entries from {} tasks", taskIdsByExternalId.size(), tasks.size());
    }

    public synchronized int size() {
        return taskIdsByExternalId.size();
    }

    private void onTaskChanged(Task before, Task after) {
        if (after == null) {
            if (before != null) {
                unbind(before.getId());
            }
            return;
        }
        String previous = before != null ? before.getExternalId() : null;
        if (Objects.equals(previous, after.getExternalId())) {
            return;
        }
        if (after.hasExternalId()) {
            bind(after.getId(), after.getExternalId());
        } else {
            unbind(after.getId());
        }
    }
}
