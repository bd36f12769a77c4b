package me.golemcore.kanban.infrastructure.loop;

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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.kanban.domain.loop.ControlLoop;
import me.golemcore.kanban.infrastructure.config.KanbanProperties;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link ControlLoop} backed by one daemon thread.
 *
 * <p>
 * Idle work is polled: it runs once no posted work is pending, or after
 * {@code kanban.loop.max-idle-deferrals} checks so a busy board cannot starve
 * it forever. A task that throws is logged and the loop keeps running.
 */
@Slf4j
public class SingleThreadControlLoop implements ControlLoop {

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final ScheduledExecutorService executor;
    private final Duration idleCheckInterval;
    private final int maxIdleDeferrals;
    private final AtomicInteger pending = new AtomicInteger();

    public SingleThreadControlLoop(KanbanProperties properties) {
        this.idleCheckInterval = properties.getLoop().getIdleCheckInterval();
        this.maxIdleDeferrals = properties.getLoop().getMaxIdleDeferrals();
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "kanban-control-loop");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void execute(Runnable task) {
        pending.incrementAndGet();
        try {
            executor.execute(() -> {
                try {
                    runSafely(task);
                } finally {
                    pending.decrementAndGet();
                }
            });
        } catch (RejectedExecutionException e) {
            pending.decrementAndGet();
            throw e;
        }
    }

    @Override
    public Cancellable schedule(Runnable task, Duration delay) {
        ScheduledFuture<?> future = executor.schedule(() -> runSafely(task), delay.toMillis(), TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }

    @Override
    public void executeWhenIdle(Runnable task) {
        scheduleIdleCheck(task, 0);
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("[Loop] Control loop did not drain in {}s, forcing shutdown", SHUTDOWN_TIMEOUT_SECONDS);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void scheduleIdleCheck(Runnable task, int deferrals) {
        executor.schedule(() -> {
            if (pending.get() > 0 && deferrals < maxIdleDeferrals) {
                scheduleIdleCheck(task, deferrals + 1);
                return;
            }
            if (deferrals >= maxIdleDeferrals) {
                log.debug("[Loop] Running idle work after {} deferrals", deferrals);
            }
            runSafely(task);
        }, idleCheckInterval.toMillis(), TimeUnit.MILLISECONDS);
    }

    private static void runSafely(Runnable task) {
        try {
            task.run();
        } catch (Exception e) { // NOSONAR - one failing task must not stop the loop
            log.error("[Loop] Task failed", e);
        }
    }
}
