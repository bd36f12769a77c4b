package me.golemcore.kanban.domain.service;

import me.golemcore.kanban.domain.model.TaskLogEntry;
import me.golemcore.kanban.domain.model.event.AgentLogEvent;
import me.golemcore.kanban.domain.model.event.AgentSummaryUpdateEvent;
import me.golemcore.kanban.domain.model.event.FileChangedEvent;
import me.golemcore.kanban.domain.model.event.StatusUpdateEvent;
import me.golemcore.kanban.domain.model.event.TextBlockEvent;
import me.golemcore.kanban.domain.model.event.ThinkingBlockEvent;
import me.golemcore.kanban.domain.model.event.ToolUsePostEvent;
import me.golemcore.kanban.domain.model.event.ToolUsePreEvent;
import me.golemcore.kanban.domain.model.event.WorkflowLogEvent;

import java.time.Instant;
import java.util.Locale;

/**
 * Converts log-bearing events into {@link TaskLogEntry} lines.
 */
public final class WorkflowLogMapper {

    private static final String SYSTEM = "system";
    private static final String ASSISTANT = "assistant";
    private static final String RESULT = "result";

    private WorkflowLogMapper() {
    }

    public static TaskLogEntry fromWorkflowLog(WorkflowLogEvent event, Instant now) {
        return TaskLogEntry.builder()
                .externalId(event.externalId())
                .entryType(SYSTEM)
                .subtype("workflow")
                .level(event.level() != null ? event.level() : "INFO")
                .message(event.message())
                .currentStep(event.currentStep())
                .progressPercent(event.progressPercent())
                .workflowName(event.workflowName())
                .timestamp(orNow(event.timestamp(), now))
                .build();
    }

    /**
     * Log line for a status update that carries a message; the level follows
     * the status.
     */
    public static TaskLogEntry fromStatusUpdate(StatusUpdateEvent event, Instant now) {
        return TaskLogEntry.builder()
                .externalId(event.externalId())
                .entryType(SYSTEM)
                .subtype("workflow")
                .level(levelForStatus(event.status()))
                .message(event.message())
                .currentStep(event.currentStep())
                .progressPercent(event.progressPercent())
                .workflowName(event.workflowName())
                .timestamp(orNow(event.timestamp(), now))
                .build();
    }

    static String levelForStatus(String status) {
        if (status == null) {
            return "INFO";
        }
        return switch (status) {
            case "completed" -> "SUCCESS";
            case "failed" -> "ERROR";
            default -> "INFO";
        };
    }

    public static TaskLogEntry fromAgentLog(AgentLogEvent event, Instant now) {
        String level = event.level() != null ? event.level() : "INFO";
        return TaskLogEntry.builder()
                .externalId(event.externalId())
                .entryType(SYSTEM)
                .subtype(level.toLowerCase(Locale.ROOT))
                .level(level)
                .message(event.message() != null ? event.message() : "Agent log entry")
                .sessionId(event.sessionId())
                .model(event.model())
                .timestamp(orNow(event.timestamp(), now))
                .build();
    }

    public static TaskLogEntry fromThinkingBlock(ThinkingBlockEvent event, Instant now) {
        return TaskLogEntry.builder()
                .externalId(event.externalId())
                .entryType(ASSISTANT)
                .subtype("thinking")
                .message(event.content() != null ? event.content() : "Thinking...")
                .sessionId(event.sessionId())
                .model(event.model())
                .timestamp(orNow(event.timestamp(), now))
                .build();
    }

    public static TaskLogEntry fromToolUsePre(ToolUsePreEvent event, Instant now) {
        return TaskLogEntry.builder()
                .externalId(event.externalId())
                .entryType(ASSISTANT)
                .subtype("tool_call")
                .message("Calling tool: " + event.toolName())
                .toolName(event.toolName())
                .toolInput(event.toolInput())
                .sessionId(event.sessionId())
                .model(event.model())
                .timestamp(orNow(event.timestamp(), now))
                .build();
    }

    public static TaskLogEntry fromToolUsePost(ToolUsePostEvent event, Instant now) {
        return TaskLogEntry.builder()
                .externalId(event.externalId())
                .entryType(RESULT)
                .subtype("tool_result")
                .message("Tool result: " + event.toolName())
                .toolName(event.toolName())
                .usage(event.usage())
                .sessionId(event.sessionId())
                .model(event.model())
                .timestamp(orNow(event.timestamp(), now))
                .build();
    }

    public static TaskLogEntry fromTextBlock(TextBlockEvent event, Instant now) {
        return TaskLogEntry.builder()
                .externalId(event.externalId())
                .entryType(ASSISTANT)
                .subtype("text")
                .message(event.content() != null ? event.content() : "Text output")
                .sessionId(event.sessionId())
                .model(event.model())
                .timestamp(orNow(event.timestamp(), now))
                .build();
    }

    public static TaskLogEntry fromFileChanged(FileChangedEvent event, Instant now) {
        String change = event.changeType() != null ? event.changeType() : "changed";
        return TaskLogEntry.builder()
                .externalId(event.externalId())
                .entryType(SYSTEM)
                .subtype("file_operation")
                .message("File " + change + ": " + event.filePath())
                .timestamp(orNow(event.timestamp(), now))
                .build();
    }

    public static TaskLogEntry fromSummaryUpdate(AgentSummaryUpdateEvent event, Instant now) {
        return TaskLogEntry.builder()
                .externalId(event.externalId())
                .entryType(SYSTEM)
                .subtype("summary")
                .message(event.summary() != null ? event.summary() : "Agent summary update")
                .currentStep(event.currentStep())
                .timestamp(orNow(event.timestamp(), now))
                .build();
    }

    private static Instant orNow(Instant timestamp, Instant now) {
        return timestamp != null ? timestamp : now;
    }
}
