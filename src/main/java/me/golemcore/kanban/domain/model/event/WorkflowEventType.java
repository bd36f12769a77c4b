package me.golemcore.kanban.domain.model.event;

import java.util.Optional;

/**
 * Closed set of inbound event kinds. Switches over this enum are exhaustive, so
 * adding a kind forces every handler to decide what to do with it.
 */
public enum WorkflowEventType {

    STATUS_UPDATE("status_update", true),
    WORKFLOW_LOG("workflow_log", true),
    TRIGGER_RESPONSE("trigger_response", true),
    STAGE_TRANSITION("stage_transition", false),
    AGENT_LOG("agent_log", false),
    THINKING_BLOCK("thinking_block", false),
    TOOL_USE_PRE("tool_use_pre", false),
    TOOL_USE_POST("tool_use_post", false),
    TEXT_BLOCK("text_block", false),
    FILE_CHANGED("file_changed", false),
    AGENT_SUMMARY_UPDATE("agent_summary_update", false),
    SYSTEM_LOG("system_log", false);

    private final String wireType;
    private final boolean deduplicated;

    WorkflowEventType(String wireType, boolean deduplicated) {
        this.wireType = wireType;
        this.deduplicated = deduplicated;
    }

    public String getWireType() {
        return wireType;
    }

    /**
     * Whether events of this kind pass through the message deduplicator.
     */
    public boolean isDeduplicated() {
        return deduplicated;
    }

    public static Optional<WorkflowEventType> fromWire(String wireType) {
        for (WorkflowEventType type : values()) {
            if (type.wireType.equals(wireType)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
