package me.golemcore.kanban.port.outbound;

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

import me.golemcore.kanban.domain.model.TriggerWorkflowRequest;
import me.golemcore.kanban.domain.model.event.TriggerResponseEvent;

import java.util.concurrent.CompletableFuture;

/**
 * Port for the duplex channel to the workflow backend.
 */
public interface WorkflowTransportPort {

    void connect();

    void disconnect();

    boolean isConnected();

    /**
     * Send a trigger request. The future completes with the matching accepted
     * {@code trigger_response}, or exceptionally when the backend rejects the
     * request, the connection is down or the response times out.
     */
    CompletableFuture<TriggerResponseEvent> triggerWorkflow(TriggerWorkflowRequest request);
}
