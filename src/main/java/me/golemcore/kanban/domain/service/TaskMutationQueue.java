package me.golemcore.kanban.domain.service;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.kanban.domain.loop.ControlLoop;
import me.golemcore.kanban.infrastructure.config.KanbanProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Serializes optimistic mutations per task: a mutation starts only after the
 * previous one on the same task has settled. Each rollback then restores a
 * snapshot taken after every earlier mutation resolved.
 *
 * <p>
 * Disabled with {@code kanban.sync.serialize-per-task=false}, in which case
 * mutations overlap and the last writer wins.
 *
 * <p>
 * Only touched from the control thread.
 */
@Component
@Slf4j
public class TaskMutationQueue {

    private final ControlLoop controlLoop;
    private final boolean enabled;
    private final Map<Long, CompletableFuture<?>> tails = new HashMap<>();

    public TaskMutationQueue(ControlLoop controlLoop, KanbanProperties properties) {
        this.controlLoop = controlLoop;
        this.enabled = properties.getSync().isSerializePerTask();
    }

    public <T> CompletableFuture<T> submit(long taskId, Supplier<CompletableFuture<T>> operation) {
        if (!enabled) {
            return invoke(operation);
        }
        CompletableFuture<?> tail = tails.get(taskId);
        CompletableFuture<T> next;
        if (tail == null || tail.isDone()) {
            next = invoke(operation);
        } else {
            log.debug("[Sync] Task {} has a mutation in flight, queueing", taskId);
            next = tail.handleAsync((result, error) -> null, controlLoop)
                    .thenCompose(ignored -> invoke(operation));
        }
        if (!next.isDone()) {
            tails.put(taskId, next);
            next.whenCompleteAsync((result, error) -> tails.remove(taskId, next), controlLoop);
        }
        return next;
    }

    public int pendingTasks() {
        return tails.size();
    }

    private static <T> CompletableFuture<T> invoke(Supplier<CompletableFuture<T>> operation) {
        try {
            return operation.get();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
