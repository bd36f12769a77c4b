package me.golemcore.kanban.domain.model.event;

import java.time.Instant;

public record TextBlockEvent(
        String externalId,
        String content,
        String sessionId,
        String model,
        Instant timestamp) implements WorkflowEvent {

    @Override
    public WorkflowEventType type() {
        return WorkflowEventType.TEXT_BLOCK;
    }
}
