package me.golemcore.kanban.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A card on the board. Each card tracks at most one remote workflow run,
 * identified by {@link #externalId} once the backend has accepted a trigger.
 *
 * <p>
 * {@link #metadata} holds remote-origin fields and is always merged into,
 * never replaced. {@link #copy()} produces a deep copy used for rollback
 * snapshots.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Task {

    private long id;
    private String externalId;
    private String title;
    private String description;
    private WorkItemType workItemType;

    @Builder.Default
    private List<Stage> queuedStages = new ArrayList<>();

    private String pipelineId;
    private String projectId;

    @Builder.Default
    private Stage stage = Stage.BACKLOG;

    private String substage;
    private int progress;

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    private Instant createdAt;
    private Instant updatedAt;

    /**
     * Workflow name recorded in metadata, or {@code null} when the task has not
     * been triggered.
     */
    @JsonIgnore
    public String getWorkflowName() {
        Object value = metadata != null ? metadata.get(MetadataKeys.WORKFLOW_NAME) : null;
        return value != null ? value.toString() : null;
    }

    @JsonIgnore
    public boolean hasExternalId() {
        return externalId != null && !externalId.isBlank();
    }

    /**
     * Merges the given entries into metadata. A {@code null} value removes the
     * key.
     */
    public void mergeMetadata(Map<String, ?> changes) {
        if (changes == null || changes.isEmpty()) {
            return;
        }
        if (metadata == null) {
            metadata = new LinkedHashMap<>();
        }
        changes.forEach((key, value) -> {
            if (value == null) {
                metadata.remove(key);
            } else {
                metadata.put(key, deepCopyValue(value));
            }
        });
    }

    public Task copy() {
        return toBuilder()
                .queuedStages(queuedStages != null ? new ArrayList<>(queuedStages) : new ArrayList<>())
                .metadata(deepCopyMap(metadata))
                .build();
    }

    static Map<String, Object> deepCopyMap(Map<String, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (source != null) {
            source.forEach((key, value) -> copy.put(key, deepCopyValue(value)));
        }
        return copy;
    }

    @SuppressWarnings("unchecked")
    private static Object deepCopyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return deepCopyMap((Map<String, ?>) map);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            for (Object element : collection) {
                copy.add(deepCopyValue(element));
            }
            return copy;
        }
        return value;
    }
}
