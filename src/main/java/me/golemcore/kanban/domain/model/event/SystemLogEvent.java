package me.golemcore.kanban.domain.model.event;

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

import java.time.Instant;
import java.util.Map;

/**
 * Backend housekeeping notice. The run it concerns, if any, is carried in
 * {@code context.adw_id} rather than at the top level.
 */
public record SystemLogEvent(
        String level,
        String message,
        Map<String, Object> context,
        Instant timestamp) implements WorkflowEvent {

    public static final String EVENT_WORKTREE_DELETED = "worktree_deleted";
    public static final String EVENT_WORKTREE_DELETE_FAILED = "worktree_delete_failed";

    @Override
    public WorkflowEventType type() {
        return WorkflowEventType.SYSTEM_LOG;
    }

    @Override
    public String externalId() {
        return contextValue("adw_id");
    }

    public String eventType() {
        return contextValue("event_type");
    }

    private String contextValue(String key) {
        if (context == null) {
            return null;
        }
        Object value = context.get(key);
        return value != null ? value.toString() : null;
    }
}
