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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Board column a task currently sits in. The wire id is what the backend sends
 * in {@code stage_transition} events and what the remote API stores as
 * {@code current_stage}.
 */
public enum Stage {

    BACKLOG("backlog"),
    PLAN("plan"),
    BUILD("build"),
    TEST("test"),
    REVIEW("review"),
    DOCUMENT("document"),
    READY_TO_MERGE("ready-to-merge"),
    ERRORED("errored"),
    COMPLETED("completed");

    private static final Set<Stage> WORKFLOW_STAGES = EnumSet.of(PLAN, BUILD, TEST, REVIEW, DOCUMENT);
    private static final Set<Stage> TERMINAL_SUCCESS = EnumSet.of(READY_TO_MERGE, COMPLETED);

    private final String wireId;

    Stage(String wireId) {
        this.wireId = wireId;
    }

    @JsonValue
    public String getWireId() {
        return wireId;
    }

    /**
     * Whether the stage is one of the five stages a workflow run executes.
     */
    public boolean isWorkflowStage() {
        return WORKFLOW_STAGES.contains(this);
    }

    public boolean isTerminalSuccess() {
        return TERMINAL_SUCCESS.contains(this);
    }

    /**
     * Stages a status hint may never move a task out of.
     */
    public boolean isSettled() {
        return this == ERRORED || isTerminalSuccess();
    }

    public static Optional<Stage> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Stage stage : values()) {
            if (stage.wireId.equals(normalized)) {
                return Optional.of(stage);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static Stage fromWire(String value) {
        return parse(value).orElse(null);
    }
}
