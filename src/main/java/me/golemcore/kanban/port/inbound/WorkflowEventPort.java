package me.golemcore.kanban.port.inbound;

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

import me.golemcore.kanban.domain.model.event.WorkflowEvent;

/**
 * Entry point for events delivered by the workflow transport. Implementations
 * must never throw back into the transport.
 */
public interface WorkflowEventPort {

    /**
     * Handle one decoded event. Called on the control thread in delivery order.
     */
    void onEvent(WorkflowEvent event);

    /**
     * Transport (re)connected. Deduplication state from the previous connection
     * is discarded.
     */
    void onConnected();

    void onDisconnected();
}
