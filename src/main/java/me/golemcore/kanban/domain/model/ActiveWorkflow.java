package me.golemcore.kanban.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A workflow run started from this board and not yet forgotten.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ActiveWorkflow {

    private String externalId;
    private long taskId;
    private String workflowName;
    private String status;
    private String logsPath;
    private Integer progress;
    private String currentStep;
    private String lastMessage;
    private Instant startedAt;
    private Instant updatedAt;
}
