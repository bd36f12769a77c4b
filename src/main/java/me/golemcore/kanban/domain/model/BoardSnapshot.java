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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Durable form of the board written to local storage. The external-id index
 * and the deduplication cache are deliberately absent: both are rebuilt or
 * discarded on load.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BoardSnapshot {

    public static final int CURRENT_VERSION = 1;

    private int version;
    private long nextTaskId;

    @Builder.Default
    private List<Task> tasks = new ArrayList<>();

    @Builder.Default
    private Map<Long, List<TaskLogEntry>> logs = new LinkedHashMap<>();

    @Builder.Default
    private Map<Long, WorkflowProgress> progress = new LinkedHashMap<>();

    @Builder.Default
    private List<ActiveWorkflow> activeWorkflows = new ArrayList<>();

    @Builder.Default
    private List<Project> projects = new ArrayList<>();

    private String selectedProjectId;
}
