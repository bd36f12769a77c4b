package me.golemcore.kanban.domain.service;

import me.golemcore.kanban.domain.model.TaskLogEntry;
import me.golemcore.kanban.domain.model.event.StatusUpdateEvent;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;

class WorkflowLogMapperTest {

    private static final Instant NOW = Instant.parse("2026-04-01T09:00:00Z");

    @Test
    void shouldMapStatusToLogLevel() {
        assertEquals("SUCCESS", WorkflowLogMapper.levelForStatus("completed"));
        assertEquals("ERROR", WorkflowLogMapper.levelForStatus("failed"));
        assertEquals("INFO", WorkflowLogMapper.levelForStatus("running"));
        assertEquals("INFO", WorkflowLogMapper.levelForStatus(null));
    }

    @Test
    void shouldBuildWorkflowLineFromStatusUpdate() {
        TaskLogEntry entry = WorkflowLogMapper.fromStatusUpdate(new StatusUpdateEvent("abc123",
                "adw_plan_build_iso", "completed", "All done", 100, "Stage: document", null), NOW);

        assertEquals("workflow", entry.getSubtype());
        assertEquals("SUCCESS", entry.getLevel());
        assertEquals("All done", entry.getMessage());
        assertEquals(100, entry.getProgressPercent());
        assertEquals("adw_plan_build_iso", entry.getWorkflowName());
        assertEquals(NOW, entry.getTimestamp());
    }
}
