package me.golemcore.kanban.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration of the board engine, bound from application.properties.
 *
 * <p>
 * All settings live under the {@code kanban.*} prefix:
 * <ul>
 * <li>{@link TransportProperties} - workflow WebSocket connection</li>
 * <li>{@link ApiProperties} - remote ADW records API</li>
 * <li>{@link DedupProperties} - inbound message deduplication</li>
 * <li>{@link LogsProperties} - per-task log retention</li>
 * <li>{@link SyncProperties} - optimistic mutation behaviour</li>
 * <li>{@link StorageProperties} - local board snapshot</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "kanban")
@Data
public class KanbanProperties {

    private TransportProperties transport = new TransportProperties();
    private ApiProperties api = new ApiProperties();
    private DedupProperties dedup = new DedupProperties();
    private LogsProperties logs = new LogsProperties();
    private SyncProperties sync = new SyncProperties();
    private NotificationProperties notifications = new NotificationProperties();
    private WorkflowProperties workflow = new WorkflowProperties();
    private LoopProperties loop = new LoopProperties();
    private StorageProperties storage = new StorageProperties();
    private HttpProperties http = new HttpProperties();

    // ==================== TRANSPORT ====================

    @Data
    public static class TransportProperties {
        private boolean enabled = true;
        private String url = "ws://localhost:8500/ws/trigger";
        private Duration heartbeatInterval = Duration.ofSeconds(15);
        private Duration reconnectInitialDelay = Duration.ofSeconds(1);
        private Duration reconnectMaxDelay = Duration.ofSeconds(30);
        private int maxReconnectAttempts = 20;
        private double reconnectJitter = 0.3;
        private Duration triggerTimeout = Duration.ofSeconds(30);
        private boolean messageQueueEnabled = true;
        private int maxQueuedTriggers = 100;
    }

    @Data
    public static class ApiProperties {
        private String baseUrl = "http://localhost:8502";
    }

    // ==================== ENGINE ====================

    @Data
    public static class DedupProperties {
        private int maxSize = 1000;
        private Duration ttl = Duration.ofMinutes(5);
        private double sweepThreshold = 0.8;
        private double evictionRatio = 0.2;
    }

    @Data
    public static class LogsProperties {
        private int maxPerTask = 500;
        private int statusHistorySize = 100;
    }

    @Data
    public static class SyncProperties {
        private boolean serializePerTask = true;
    }

    @Data
    public static class NotificationProperties {
        private Duration defaultDuration = Duration.ofSeconds(5);
        private Duration errorDuration = Duration.ofSeconds(7);
    }

    @Data
    public static class WorkflowProperties {
        private String defaultModelSet = "base";
        private String mergeWorkflow = "adw_merge_iso";
        private String mergeMethod = "squash";
    }

    @Data
    public static class LoopProperties {
        private Duration idleCheckInterval = Duration.ofMillis(50);
        private int maxIdleDeferrals = 20;
    }

    // ==================== STORAGE ====================

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.golemcore/kanban";
        private String directory = "board";
        private String snapshotFile = "board.json";
        private Duration saveDebounce = Duration.ofMillis(500);
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 30000;
        private long writeTimeout = 30000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
