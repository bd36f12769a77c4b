package me.golemcore.kanban.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Payload of an outbound {@code trigger_workflow} message.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TriggerWorkflowRequest {

    private String workflowType;
    private String adwId;
    private String issueNumber;
    private String issueType;
    private IssueJson issueJson;
    private String modelSet;
    private String triggerReason;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class IssueJson {
        private String title;
        private String body;
        private long number;

        @Builder.Default
        private List<Object> images = new ArrayList<>();
    }
}
