package me.golemcore.kanban.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.kanban.domain.model.Stage;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Ordered stages a workflow run goes through, derived from its name.
 *
 * <p>
 * {@code adw_plan_build_test_iso} becomes [plan, build, test]: the {@code adw_}
 * prefix and {@code _iso} suffix are stripped and the rest split on
 * underscores. {@code sdlc} expands to all five workflow stages and
 * {@code orchestrator} to [plan]. Tokens that are not workflow stages are kept
 * out of the sequence.
 */
public final class WorkflowStageSequence {

    private static final String PREFIX = "adw_";
    private static final String SUFFIX = "_iso";
    private static final List<Stage> SDLC = List.of(Stage.PLAN, Stage.BUILD, Stage.TEST, Stage.REVIEW, Stage.DOCUMENT);

    private WorkflowStageSequence() {
    }

    public static List<Stage> parse(String workflowName) {
        if (workflowName == null || workflowName.isBlank()) {
            return List.of();
        }
        String name = workflowName.trim().toLowerCase(Locale.ROOT);
        if (name.startsWith(PREFIX)) {
            name = name.substring(PREFIX.length());
        }
        if (name.endsWith(SUFFIX)) {
            name = name.substring(0, name.length() - SUFFIX.length());
        }
        if ("sdlc".equals(name)) {
            return SDLC;
        }
        if ("orchestrator".equals(name)) {
            return List.of(Stage.PLAN);
        }
        List<Stage> stages = new ArrayList<>();
        for (String token : name.split("_")) {
            Stage.parse(token)
                    .filter(Stage::isWorkflowStage)
                    .ifPresent(stages::add);
        }
        return List.copyOf(stages);
    }

    /**
     * First stage a newly triggered run of this workflow starts in.
     */
    public static Optional<Stage> initialStage(String workflowName) {
        List<Stage> stages = parse(workflowName);
        return stages.isEmpty() ? Optional.empty() : Optional.of(stages.get(0));
    }

    /**
     * Workflow name for a queue of stages: {@code adw_<stage>_..._iso}.
     */
    public static String workflowNameFor(List<Stage> stages) {
        StringBuilder name = new StringBuilder(PREFIX);
        for (Stage stage : stages) {
            if (stage.isWorkflowStage()) {
                name.append(stage.getWireId()).append('_');
            }
        }
        return name.append("iso").toString();
    }
}
