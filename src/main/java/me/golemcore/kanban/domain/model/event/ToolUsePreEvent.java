package me.golemcore.kanban.domain.model.event;

import java.time.Instant;
import java.util.Map;

public record ToolUsePreEvent(
        String externalId,
        String toolName,
        Map<String, Object> toolInput,
        String sessionId,
        String model,
        Instant timestamp) implements WorkflowEvent {

    @Override
    public WorkflowEventType type() {
        return WorkflowEventType.TOOL_USE_PRE;
    }
}
