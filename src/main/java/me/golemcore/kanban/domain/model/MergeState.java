package me.golemcore.kanban.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Progress of a merge run for a task sitting in {@link Stage#READY_TO_MERGE}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MergeState {

    private MergeStatus status;
    private String message;
    private Instant timestamp;

    public enum MergeStatus {
        IN_PROGRESS, SUCCESS, ERROR
    }
}
