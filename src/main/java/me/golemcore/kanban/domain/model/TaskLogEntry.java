package me.golemcore.kanban.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * One line of a task's workflow log. Produced from {@code workflow_log} events
 * and from the fine-grained agent events (tool calls, thinking blocks, file
 * changes).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskLogEntry {

    private String id;
    private String externalId;

    /**
     * Coarse origin: {@code system}, {@code assistant} or {@code result}.
     */
    private String entryType;
    private String subtype;
    private String level;
    private String message;
    private String toolName;
    private Map<String, Object> toolInput;
    private Map<String, Object> usage;
    private String sessionId;
    private String model;
    private String currentStep;
    private Integer progressPercent;
    private String workflowName;
    private Instant timestamp;
}
