package me.golemcore.kanban.adapter.inbound.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.kanban.domain.model.TriggerWorkflowRequest;
import me.golemcore.kanban.domain.model.event.AgentLogEvent;
import me.golemcore.kanban.domain.model.event.AgentSummaryUpdateEvent;
import me.golemcore.kanban.domain.model.event.FileChangedEvent;
import me.golemcore.kanban.domain.model.event.StageTransitionEvent;
import me.golemcore.kanban.domain.model.event.StatusUpdateEvent;
import me.golemcore.kanban.domain.model.event.SystemLogEvent;
import me.golemcore.kanban.domain.model.event.TextBlockEvent;
import me.golemcore.kanban.domain.model.event.ThinkingBlockEvent;
import me.golemcore.kanban.domain.model.event.ToolUsePostEvent;
import me.golemcore.kanban.domain.model.event.ToolUsePreEvent;
import me.golemcore.kanban.domain.model.event.TriggerResponseEvent;
import me.golemcore.kanban.domain.model.event.WorkflowEvent;
import me.golemcore.kanban.domain.model.event.WorkflowLogEvent;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * JSON codec for the workflow transport's {@code {"type", "data"}} envelopes.
 *
 * <p>
 * An {@code error} message is delivered as an ERROR-level workflow log.
 * Connection housekeeping messages decode to nothing.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WorkflowEventCodec {

    static final String TYPE_TRIGGER_WORKFLOW = "trigger_workflow";
    static final String TYPE_PING = "ping";

    private static final String TYPE_ERROR = "error";
    private static final String TYPE_SUMMARY_UPDATE = "summary_update";
    private static final Set<String> IGNORED_TYPES = Set.of("pong", "connection_ack", "heartbeat");
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    /**
     * Decodes one frame. Returns an empty list for housekeeping messages.
     *
     * @throws JsonProcessingException
     *             when the frame is not a JSON envelope
     * @throws UnknownEventTypeException
     *             when the envelope type is not recognized
     */
    public List<WorkflowEvent> decode(String frame) throws JsonProcessingException {
        JsonNode envelope = objectMapper.readTree(frame);
        if (envelope == null || !envelope.isObject()) {
            throw new IllegalArgumentException("Envelope is not a JSON object");
        }
        String type = text(envelope, "type");
        if (type == null) {
            throw new IllegalArgumentException("Envelope has no type");
        }
        JsonNode data = envelope.path("data");
        if (IGNORED_TYPES.contains(type)) {
            return List.of();
        }
        return switch (type) {
            case "status_update" -> decodeStatusUpdate(data);
            case "workflow_log" -> List.of(workflowLog(data, text(data, "level")));
            case TYPE_ERROR -> data.hasNonNull("message") ? List.of(workflowLog(data, "ERROR")) : List.of();
            case "trigger_response" -> List.of(new TriggerResponseEvent(
                    text(data, "adw_id"), text(data, "status"), text(data, "workflow_name"),
                    text(data, "message"), text(data, "logs_path"), text(data, "plan_file"),
                    text(data, TYPE_ERROR), timestamp(data)));
            case "stage_transition" -> List.of(new StageTransitionEvent(
                    text(data, "adw_id"), text(data, "from_stage"), text(data, "to_stage"),
                    text(data, "workflow_name"), timestamp(data)));
            case "agent_log" -> List.of(new AgentLogEvent(
                    text(data, "adw_id"), text(data, "level"), text(data, "message"),
                    text(data, "session_id"), text(data, "model"), timestamp(data)));
            case "thinking_block" -> List.of(new ThinkingBlockEvent(
                    text(data, "adw_id"), text(data, "content"), text(data, "session_id"),
                    text(data, "model"), timestamp(data)));
            case "tool_use_pre" -> List.of(new ToolUsePreEvent(
                    text(data, "adw_id"), text(data, "tool_name"), map(data, "tool_input"),
                    text(data, "session_id"), text(data, "model"), timestamp(data)));
            case "tool_use_post" -> List.of(new ToolUsePostEvent(
                    text(data, "adw_id"), text(data, "tool_name"), map(data, "usage"),
                    text(data, "stop_reason"), text(data, "session_id"), text(data, "model"), timestamp(data)));
            case "text_block" -> List.of(new TextBlockEvent(
                    text(data, "adw_id"), text(data, "content"), text(data, "session_id"),
                    text(data, "model"), timestamp(data)));
            case "file_changed" -> List.of(new FileChangedEvent(
                    text(data, "adw_id"), text(data, "file_path"), text(data, "change_type"), timestamp(data)));
            case "agent_summary_update", TYPE_SUMMARY_UPDATE -> List.of(new AgentSummaryUpdateEvent(
                    text(data, "adw_id"), text(data, "summary"), text(data, "current_step"), timestamp(data)));
            case "system_log" -> List.of(new SystemLogEvent(
                    text(data, "level"), text(data, "message"), map(data, "context"), timestamp(data)));
            default -> throw new UnknownEventTypeException(type);
        };
    }

    public String encodeTrigger(TriggerWorkflowRequest request) throws JsonProcessingException {
        ObjectNode envelope = objectMapper.createObjectNode();
        envelope.put("type", TYPE_TRIGGER_WORKFLOW);
        envelope.set("data", objectMapper.valueToTree(request));
        return objectMapper.writeValueAsString(envelope);
    }

    public String encodePing() {
        return "{\"type\":\"" + TYPE_PING + "\"}";
    }

    private List<WorkflowEvent> decodeStatusUpdate(JsonNode data) {
        return List.of(new StatusUpdateEvent(
                text(data, "adw_id"), text(data, "workflow_name"), text(data, "status"),
                text(data, "message"), integer(data, "progress_percent"), text(data, "current_step"),
                timestamp(data)));
    }

    private WorkflowLogEvent workflowLog(JsonNode data, String level) {
        return new WorkflowLogEvent(text(data, "adw_id"), text(data, "workflow_name"),
                level != null ? level : "INFO", text(data, "message"), text(data, "current_step"),
                integer(data, "progress_percent"), timestamp(data));
    }

    private Map<String, Object> map(JsonNode data, String field) {
        JsonNode node = data.path(field);
        if (!node.isObject()) {
            return null;
        }
        return objectMapper.convertValue(node, MAP_TYPE);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node == null ? MissingNode.getInstance() : node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        return value.isValueNode() ? value.asText() : value.toString();
    }

    private static Integer integer(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isNumber() ? Integer.valueOf(value.asInt()) : null;
    }

    /**
     * Server timestamps are ISO-8601, with or without an offset. Naive values
     * are taken as UTC; unparseable ones are left for the receiver to stamp.
     */
    private static Instant timestamp(JsonNode data) {
        String raw = text(data, "timestamp");
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(raw);
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(raw).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException ignored) {
                log.debug("[WebSocket] Unparseable timestamp '{}'", raw);
                return null;
            }
        }
    }
}
