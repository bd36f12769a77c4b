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

/**
 * Event received from the workflow backend. Every implementation is a record
 * that reports its kind through {@link #type()}.
 */
public interface WorkflowEvent {

    WorkflowEventType type();

    /**
     * External id of the run the event belongs to, may be {@code null} for
     * system-wide events.
     */
    String externalId();

    /**
     * Backend timestamp, {@code null} when the backend did not send one.
     */
    Instant timestamp();
}
