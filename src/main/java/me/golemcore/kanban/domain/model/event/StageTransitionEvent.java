package me.golemcore.kanban.domain.model.event;

import java.time.Instant;

/**
 * Authoritative stage move decided by the backend. Stages are kept as raw wire
 * ids so an unknown target can be reported instead of failing the decode.
 */
public record StageTransitionEvent(
        String externalId,
        String fromStage,
        String toStage,
        String workflowName,
        Instant timestamp) implements WorkflowEvent {

    @Override
    public WorkflowEventType type() {
        return WorkflowEventType.STAGE_TRANSITION;
    }
}
