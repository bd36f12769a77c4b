package me.golemcore.kanban.domain.model.event;

import java.time.Instant;

public record AgentLogEvent(
        String externalId,
        String level,
        String message,
        String sessionId,
        String model,
        Instant timestamp) implements WorkflowEvent {

    @Override
    public WorkflowEventType type() {
        return WorkflowEventType.AGENT_LOG;
    }
}
