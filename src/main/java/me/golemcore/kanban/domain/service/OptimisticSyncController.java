package me.golemcore.kanban.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.kanban.domain.loop.ControlLoop;
import me.golemcore.kanban.domain.model.DeletionState;
import me.golemcore.kanban.domain.model.RemotePersistenceException;
import me.golemcore.kanban.domain.model.Task;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Runs locally initiated task mutations optimistically.
 *
 * <p>
 * The change is applied to the store at once, then persisted remotely. On
 * success the optimistic state stays, optionally enriched with the server's
 * canonical fields. On failure the task is restored from a full snapshot taken
 * before the change, an error notification is raised and the returned future
 * fails; nothing is retried. Deletions are the exception to "apply first": the
 * task is only removed after the remote side confirmed.
 *
 * <p>
 * Must be called on the control thread. Continuations hop back onto it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OptimisticSyncController {

    private final TaskStore taskStore;
    private final TaskMutationQueue mutationQueue;
    private final NotificationService notificationService;
    private final ControlLoop controlLoop;
    private final Clock clock;

    /**
     * Adds a new task locally, then creates its remote record when
     * {@code remoteCall} is given. On failure the task is removed again.
     */
    public <R> CompletableFuture<Task> create(Task task, Function<Task, CompletableFuture<R>> remoteCall,
            BiConsumer<Task, R> onConfirmed) {
        taskStore.putTask("createTask", task);
        log.info("[Sync] Created task {} '{}'", task.getId(), task.getTitle());
        if (remoteCall == null) {
            return CompletableFuture.completedFuture(task.copy());
        }
        return mutationQueue.submit(task.getId(), () -> persist(task.getId(), "create", task.copy(), remoteCall,
                onConfirmed, () -> taskStore.removeTask("rollback:create", task.getId())));
    }

    /**
     * Applies {@code localChange} to a copy of the task, commits it, then runs
     * {@code remoteCall}. A {@code null} remote call means the task has no
     * remote representation and the change is final.
     */
    public <R> CompletableFuture<Task> mutate(long taskId, String action, Consumer<Task> localChange,
            Function<Task, CompletableFuture<R>> remoteCall, BiConsumer<Task, R> onConfirmed) {
        return mutationQueue.submit(taskId, () -> {
            Optional<Task> current = taskStore.getTask(taskId);
            if (current.isEmpty()) {
                return CompletableFuture.failedFuture(new IllegalArgumentException("Task not found: " + taskId));
            }
            Task snapshot = current.get();
            Task working = snapshot.copy();
            localChange.accept(working);
            working.setUpdatedAt(clock.instant());
            taskStore.putTask(action, working);
            if (remoteCall == null) {
                return CompletableFuture.completedFuture(working.copy());
            }
            return persist(taskId, action, working.copy(), remoteCall, onConfirmed, () -> restore(snapshot, action));
        });
    }

    /**
     * Deletes a task. Tasks with an external id are removed only after the
     * remote delete succeeds; until then their deletion state is pending.
     */
    public CompletableFuture<Void> delete(long taskId, Function<Task, CompletableFuture<Void>> remoteCall) {
        return mutationQueue.submit(taskId, () -> {
            Optional<Task> current = taskStore.getTask(taskId);
            if (current.isEmpty()) {
                return CompletableFuture.failedFuture(new IllegalArgumentException("Task not found: " + taskId));
            }
            Task task = current.get();
            if (!task.hasExternalId() || remoteCall == null) {
                taskStore.removeTask("deleteTask", taskId);
                log.info("[Sync] Deleted local task {}", taskId);
                return CompletableFuture.completedFuture(null);
            }
            String externalId = task.getExternalId();
            taskStore.commit("deleteTask:pending", tx -> tx.putDeletionState(externalId, DeletionState.pending()));

            CompletableFuture<Void> result = new CompletableFuture<>();
            invokeRemote(remoteCall, task).whenCompleteAsync((ignored, error) -> {
                if (error == null) {
                    taskStore.commit("deleteTask", tx -> {
                        tx.removeTask(taskId);
                        tx.removeDeletionState(externalId);
                    });
                    log.info("[Sync] Deleted task {} ({})", taskId, externalId);
                    result.complete(null);
                    return;
                }
                Throwable cause = unwrap(error);
                String detail = describe(cause);
                taskStore.commit("deleteTask:failed",
                        tx -> tx.putDeletionState(externalId, DeletionState.failed(detail)));
                log.error("[Sync] Failed to delete task {} ({}): {}", taskId, externalId, detail);
                notificationService.error("Failed to delete '" + task.getTitle() + "': " + detail);
                result.completeExceptionally(cause);
            }, controlLoop);
            return result;
        });
    }

    private <R> CompletableFuture<Task> persist(long taskId, String action, Task applied,
            Function<Task, CompletableFuture<R>> remoteCall, BiConsumer<Task, R> onConfirmed, Runnable rollback) {
        CompletableFuture<Task> result = new CompletableFuture<>();
        invokeRemote(remoteCall, applied).whenCompleteAsync((value, error) -> {
            if (error != null) {
                Throwable cause = unwrap(error);
                String detail = describe(cause);
                log.error("[Sync] {} failed for task {}, rolling back: {}", action, taskId, detail);
                rollback.run();
                notificationService.error("Failed to " + action + " '" + applied.getTitle() + "': " + detail);
                result.completeExceptionally(cause);
                return;
            }
            if (onConfirmed != null && value != null) {
                confirm(taskId, action, value, onConfirmed);
            }
            result.complete(taskStore.getTask(taskId).orElse(applied));
        }, controlLoop);
        return result;
    }

    private <R> void confirm(long taskId, String action, R value, BiConsumer<Task, R> onConfirmed) {
        taskStore.commit(action + ":confirmed", tx -> tx.task(taskId).ifPresent(task -> {
            onConfirmed.accept(task, value);
            tx.putTask(task);
        }));
    }

    private void restore(Task snapshot, String action) {
        if (!taskStore.containsTask(snapshot.getId())) {
            log.warn("[Sync] Task {} was removed while '{}' was in flight, not restoring", snapshot.getId(), action);
            return;
        }
        taskStore.putTask("rollback:" + action, snapshot);
    }

    private static <R> CompletableFuture<R> invokeRemote(Function<Task, CompletableFuture<R>> remoteCall, Task task) {
        try {
            return remoteCall.apply(task);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    static String describe(Throwable error) {
        if (error instanceof RemotePersistenceException remote && remote.getDetail() != null) {
            return remote.getDetail();
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    /**
     * Completes the returned future on the control thread.
     */
    public <T> CompletableFuture<T> onLoop(Supplier<CompletableFuture<T>> action) {
        return CompletableFuture.supplyAsync(action, controlLoop).thenCompose(Function.identity());
    }
}
