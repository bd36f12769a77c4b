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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Input for creating a task. {@code externalId} is only set when importing a
 * run that already exists on the backend.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskDraft {

    private String title;
    private String description;
    private WorkItemType workItemType;

    @Builder.Default
    private List<Stage> queuedStages = new ArrayList<>();

    private String projectId;
    private String externalId;

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();
}
