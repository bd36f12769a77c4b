package me.golemcore.kanban.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Canonical server-side representation of a workflow run, as returned by the
 * ADW records API. Also used as the creation payload.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RemoteWorkflowRecord {

    private String adwId;
    private String issueNumber;
    private String issueTitle;
    private String issueBody;
    private String issueClass;
    private String branchName;
    private String workflowName;
    private String currentStage;
    private String status;
    private String patchFile;
    private List<Map<String, Object>> patchHistory;
    private String completedAt;
    private String createdAt;
    private String updatedAt;
}
