package me.golemcore.kanban.domain.service;

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

import me.golemcore.kanban.domain.model.event.StatusUpdateEvent;
import me.golemcore.kanban.domain.model.event.TriggerResponseEvent;
import me.golemcore.kanban.domain.model.event.WorkflowEvent;
import me.golemcore.kanban.domain.model.event.WorkflowLogEvent;

/**
 * Content fingerprint of an inbound event:
 * {@code type:externalId:status+level:progress:step:message}. The backend
 * timestamp is excluded, otherwise every re-delivery would look new.
 */
public final class MessageFingerprint {

    private MessageFingerprint() {
    }

    public static String of(WorkflowEvent event) {
        String status = "";
        String level = "";
        Integer progress = null;
        String step = null;
        String message = null;

        if (event instanceof StatusUpdateEvent update) {
            status = nullToEmpty(update.status());
            progress = update.progressPercent();
            step = update.currentStep();
            message = update.message();
        } else if (event instanceof WorkflowLogEvent logEvent) {
            level = nullToEmpty(logEvent.level());
            progress = logEvent.progressPercent();
            step = logEvent.currentStep();
            message = logEvent.message();
        } else if (event instanceof TriggerResponseEvent response) {
            status = nullToEmpty(response.status());
            message = response.message();
        }

        return event.type().getWireType()
                + ':' + nullToEmpty(event.externalId())
                + ':' + status + level
                + ':' + (progress != null ? progress.toString() : "")
                + ':' + nullToEmpty(step)
                + ':' + nullToEmpty(message);
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
