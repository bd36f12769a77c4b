package me.golemcore.kanban.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * All changes one inbound event makes to one task, applied in a single store
 * commit.
 *
 * <p>
 * Setting {@link #stage} resets substage and progress; an explicit
 * {@link #substage} or {@link #progress} is applied after that reset.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TaskMutation {

    private Stage stage;
    private String substage;
    private Integer progress;

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    private WorkflowProgress workflowProgress;
    private TaskLogEntry logEntry;
    private MergeState mergeState;

    public boolean isEmpty() {
        return stage == null
                && substage == null
                && progress == null
                && (metadata == null || metadata.isEmpty())
                && workflowProgress == null
                && logEntry == null
                && mergeState == null;
    }

    public static TaskMutation ofLog(TaskLogEntry entry) {
        return TaskMutation.builder().logEntry(entry).build();
    }
}
