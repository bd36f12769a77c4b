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

import java.util.Locale;

/**
 * Kind of work a task represents. Sent to the backend as {@code issue_type} /
 * {@code issue_class}.
 */
public enum WorkItemType {

    FEATURE("feature"),
    CHORE("chore"),
    BUG("bug"),
    PATCH("patch");

    private final String wireId;

    WorkItemType(String wireId) {
        this.wireId = wireId;
    }

    @JsonValue
    public String getWireId() {
        return wireId;
    }

    @JsonCreator
    public static WorkItemType fromWire(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }
        for (WorkItemType type : values()) {
            if (type.wireId.equals(normalized)) {
                return type;
            }
        }
        return null;
    }
}
