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

/**
 * Latest progress reported by a task's workflow run.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowProgress {

    private String status;
    private Integer progress;
    private String currentStep;
    private String message;
    private Instant timestamp;

    /**
     * Returns a new progress value where every non-null field of {@code update}
     * overrides this one.
     */
    public WorkflowProgress mergedWith(WorkflowProgress update) {
        if (update == null) {
            return toBuilder().build();
        }
        return WorkflowProgress.builder()
                .status(update.status != null ? update.status : status)
                .progress(update.progress != null ? update.progress : progress)
                .currentStep(update.currentStep != null ? update.currentStep : currentStep)
                .message(update.message != null ? update.message : message)
                .timestamp(update.timestamp != null ? update.timestamp : timestamp)
                .build();
    }
}
