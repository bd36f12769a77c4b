package me.golemcore.kanban.adapter.inbound.websocket;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.kanban.domain.loop.ControlLoop;
import me.golemcore.kanban.domain.model.TriggerWorkflowRequest;
import me.golemcore.kanban.domain.model.event.TriggerResponseEvent;
import me.golemcore.kanban.domain.model.event.WorkflowEvent;
import me.golemcore.kanban.infrastructure.config.KanbanProperties;
import me.golemcore.kanban.port.inbound.WorkflowEventPort;
import me.golemcore.kanban.port.outbound.WorkflowTransportPort;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.util.retry.Retry;

import java.net.URI;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Reactive WebSocket connection to the workflow backend.
 *
 * <p>
 * Decoded events are handed to the {@link WorkflowEventPort} on the
 * {@link ControlLoop}, in delivery order. Triggers are correlated FIFO with
 * the next {@code trigger_response}; the pending trigger is completed before
 * the response event is posted, so the caller's continuation runs on the loop
 * ahead of the event and the task is already bound when the event is routed.
 *
 * <p>
 * Lost connections are re-established with exponential backoff and jitter. A
 * session that came up resets the attempt budget. Triggers issued while a
 * reconnect is under way are queued, bounded by
 * {@code kanban.transport.max-queued-triggers} with the oldest dropped first,
 * and sent in order once the next session opens. The trigger timeout runs
 * from the call, queued time included.
 */
@Component
@Slf4j
public class WorkflowWebSocketClient implements WorkflowTransportPort {

    private final WebSocketClient webSocketClient;
    private final WorkflowEventCodec codec;
    private final WorkflowEventPort eventPort;
    private final ControlLoop controlLoop;
    private final KanbanProperties.TransportProperties config;
    private final Deque<PendingTrigger> pendingTriggers = new ConcurrentLinkedDeque<>();
    // guarded by itself, together with the outbound/connected handover
    private final Deque<QueuedTrigger> queuedTriggers = new ArrayDeque<>();

    private volatile Sinks.Many<String> outbound;
    private volatile boolean connected;
    private volatile boolean stopping;
    private volatile Disposable connection;

    @Autowired
    public WorkflowWebSocketClient(WorkflowEventCodec codec, WorkflowEventPort eventPort, ControlLoop controlLoop,
            KanbanProperties properties) {
        this(new ReactorNettyWebSocketClient(), codec, eventPort, controlLoop, properties);
    }

    WorkflowWebSocketClient(WebSocketClient webSocketClient, WorkflowEventCodec codec, WorkflowEventPort eventPort,
            ControlLoop controlLoop, KanbanProperties properties) {
        this.webSocketClient = webSocketClient;
        this.codec = codec;
        this.eventPort = eventPort;
        this.controlLoop = controlLoop;
        this.config = properties.getTransport();
    }

    // ==================== Connection ====================

    @Override
    public synchronized void connect() {
        if (connection != null && !connection.isDisposed()) {
            return;
        }
        stopping = false;
        URI uri = URI.create(config.getUrl());
        log.info("[WebSocket] Connecting to {}", uri);
        connection = Mono.defer(() -> webSocketClient.execute(uri, this::handleSession))
                .then(Mono.defer(() -> stopping
                        ? Mono.<Void>empty()
                        : Mono.<Void>error(new IllegalStateException("Connection closed by server"))))
                .retryWhen(Retry.backoff(config.getMaxReconnectAttempts(), config.getReconnectInitialDelay())
                        .maxBackoff(config.getReconnectMaxDelay())
                        .jitter(config.getReconnectJitter())
                        .transientErrors(true)
                        .filter(error -> !stopping)
                        .doBeforeRetry(signal -> log.warn("[WebSocket] Reconnecting (attempt {}): {}",
                                signal.totalRetriesInARow() + 1, signal.failure().getMessage())))
                .subscribe(
                        ignored -> {
                        },
                        error -> {
                            log.error("[WebSocket] Giving up on {}: {}", uri, error.getMessage());
                            failQueuedTriggers("Could not reconnect to the workflow backend");
                        },
                        () -> log.info("[WebSocket] Connection to {} closed", uri));
    }

    @Override
    @PreDestroy
    public synchronized void disconnect() {
        stopping = true;
        if (connection != null) {
            connection.dispose();
            connection = null;
        }
        connected = false;
        outbound = null;
        failQueuedTriggers("Transport disconnected");
        failPendingTriggers("Transport disconnected");
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    /**
     * Drives one WebSocket session: heartbeats and queued frames out, decoded
     * events in. Completes when the server closes the inbound stream.
     */
    Mono<Void> handleSession(WebSocketSession session) {
        Sinks.Many<String> sink = Sinks.many().unicast().onBackpressureBuffer();
        synchronized (queuedTriggers) {
            outbound = sink;
            connected = true;
            flushQueuedTriggers(sink);
        }
        log.info("[WebSocket] Connected (session {})", session.getId());
        controlLoop.execute(eventPort::onConnected);

        Flux<String> heartbeats = Flux.interval(config.getHeartbeatInterval())
                .map(tick -> codec.encodePing());
        Mono<Void> send = session.send(Flux.merge(sink.asFlux(), heartbeats).map(session::textMessage));
        Mono<Void> receive = session.receive()
                .map(WebSocketMessage::getPayloadAsText)
                .doOnNext(this::handleFrame)
                .then();

        return Mono.firstWithSignal(receive, send)
                .doFinally(signal -> {
                    if (outbound == sink) {
                        outbound = null;
                        connected = false;
                    }
                    log.info("[WebSocket] Session {} ended: {}", session.getId(), signal);
                    failPendingTriggers("Connection lost before the trigger was answered");
                    controlLoop.execute(eventPort::onDisconnected);
                });
    }

    void handleFrame(String frame) {
        try {
            List<WorkflowEvent> events = codec.decode(frame);
            if (events.isEmpty()) {
                return;
            }
            for (WorkflowEvent event : events) {
                if (event instanceof TriggerResponseEvent response) {
                    completePendingTrigger(response);
                }
            }
            controlLoop.execute(() -> events.forEach(eventPort::onEvent));
        } catch (UnknownEventTypeException e) {
            log.warn("[WebSocket] {}, dropped", e.getMessage());
        } catch (JsonProcessingException | RuntimeException e) { // NOSONAR - a bad frame must not kill the session
            log.warn("[WebSocket] Failed to process inbound frame: {}", e.getMessage());
        }
    }

    // ==================== Triggers ====================

    @Override
    public CompletableFuture<TriggerResponseEvent> triggerWorkflow(TriggerWorkflowRequest request) {
        String frame;
        try {
            frame = codec.encodeTrigger(request);
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(e);
        }

        PendingTrigger pending = new PendingTrigger(request.getWorkflowType(), new CompletableFuture<>());
        synchronized (queuedTriggers) {
            Sinks.Many<String> sink = outbound;
            if (connected && sink != null) {
                armTimeout(pending);
                send(sink, frame, pending);
                return pending.future();
            }
            if (!config.isMessageQueueEnabled() || !isReconnecting()) {
                return CompletableFuture.failedFuture(new IllegalStateException("WebSocket is not connected"));
            }
            armTimeout(pending);
            enqueue(new QueuedTrigger(frame, pending));
        }
        return pending.future();
    }

    int pendingTriggerCount() {
        return pendingTriggers.size();
    }

    int queuedTriggerCount() {
        synchronized (queuedTriggers) {
            return queuedTriggers.size();
        }
    }

    private boolean isReconnecting() {
        Disposable current = connection;
        return !stopping && current != null && !current.isDisposed();
    }

    private void armTimeout(PendingTrigger pending) {
        long timeoutMillis = config.getTriggerTimeout().toMillis();
        CompletableFuture.delayedExecutor(timeoutMillis, TimeUnit.MILLISECONDS)
                .execute(() -> pending.future().completeExceptionally(
                        new TimeoutException("Workflow trigger timed out after " + timeoutMillis + "ms")));
    }

    private void send(Sinks.Many<String> sink, String frame, PendingTrigger pending) {
        pendingTriggers.addLast(pending);
        pending.future().whenComplete((response, error) -> pendingTriggers.remove(pending));
        Sinks.EmitResult result = sink.tryEmitNext(frame);
        if (result.isFailure()) {
            pending.future().completeExceptionally(
                    new IllegalStateException("Failed to send trigger: " + result));
        } else {
            log.info("[WebSocket] Sent trigger for {}", pending.workflowType());
        }
    }

    private void enqueue(QueuedTrigger queued) {
        if (queuedTriggers.size() >= config.getMaxQueuedTriggers()) {
            QueuedTrigger dropped = queuedTriggers.pollFirst();
            if (dropped != null) {
                log.warn("[WebSocket] Trigger queue full, dropping oldest {} trigger",
                        dropped.pending().workflowType());
                dropped.pending().future().completeExceptionally(
                        new IllegalStateException("Trigger dropped from full outbound queue"));
            }
        }
        queuedTriggers.addLast(queued);
        queued.pending().future().whenComplete((response, error) -> {
            synchronized (queuedTriggers) {
                queuedTriggers.remove(queued);
            }
        });
        log.info("[WebSocket] Not connected, queued {} trigger ({} waiting)", queued.pending().workflowType(),
                queuedTriggers.size());
    }

    private void flushQueuedTriggers(Sinks.Many<String> sink) {
        if (queuedTriggers.isEmpty()) {
            return;
        }
        List<QueuedTrigger> queued = new ArrayList<>(queuedTriggers);
        queuedTriggers.clear();
        log.info("[WebSocket] Sending {} queued trigger(s)", queued.size());
        for (QueuedTrigger trigger : queued) {
            if (!trigger.pending().future().isDone()) {
                send(sink, trigger.frame(), trigger.pending());
            }
        }
    }

    private void failQueuedTriggers(String reason) {
        List<QueuedTrigger> queued;
        synchronized (queuedTriggers) {
            queued = new ArrayList<>(queuedTriggers);
            queuedTriggers.clear();
        }
        for (QueuedTrigger trigger : queued) {
            log.warn("[WebSocket] Failing queued {} trigger: {}", trigger.pending().workflowType(), reason);
            trigger.pending().future().completeExceptionally(new IllegalStateException(reason));
        }
    }

    private void completePendingTrigger(TriggerResponseEvent response) {
        PendingTrigger pending = pendingTriggers.pollFirst();
        if (pending == null) {
            log.debug("[WebSocket] Unsolicited trigger response for {}", response.externalId());
            return;
        }
        if (response.isAccepted()) {
            pending.future().complete(response);
            return;
        }
        String reason = response.error() != null ? response.error() : response.message();
        pending.future().completeExceptionally(new IllegalStateException(
                reason != null ? reason : "Workflow trigger was " + response.status()));
    }

    private void failPendingTriggers(String reason) {
        PendingTrigger pending;
        while ((pending = pendingTriggers.pollFirst()) != null) {
            log.warn("[WebSocket] Failing pending {} trigger: {}", pending.workflowType(), reason);
            pending.future().completeExceptionally(new IllegalStateException(reason));
        }
    }

    private record PendingTrigger(String workflowType, CompletableFuture<TriggerResponseEvent> future) {
    }

    private record QueuedTrigger(String frame, PendingTrigger pending) {
    }
}
