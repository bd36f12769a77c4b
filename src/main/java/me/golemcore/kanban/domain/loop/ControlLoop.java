package me.golemcore.kanban.domain.loop;

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

import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * The single control thread that owns all board state.
 *
 * <p>
 * Inbound transport events, user actions and persistence continuations are all
 * posted here, so store mutations never race. Work runs in submission order.
 * Idle work runs only once no ready work is queued, or after a bounded number
 * of deferrals.
 */
public interface ControlLoop extends Executor {

    /**
     * Queue work to run on the control thread.
     */
    @Override
    void execute(Runnable task);

    /**
     * Run work on the control thread after a delay.
     */
    Cancellable schedule(Runnable task, Duration delay);

    /**
     * Run low-priority work once the loop has nothing else to do.
     */
    void executeWhenIdle(Runnable task);

    /**
     * Handle to scheduled work.
     */
    @FunctionalInterface
    interface Cancellable {
        void cancel();
    }
}
