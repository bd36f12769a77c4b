package me.golemcore.kanban.domain.service;

import me.golemcore.kanban.domain.model.Stage;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkflowStageSequenceTest {

    @Test
    void shouldStripPrefixAndSuffix() {
        assertEquals(List.of(Stage.PLAN, Stage.BUILD, Stage.TEST),
                WorkflowStageSequence.parse("adw_plan_build_test_iso"));
    }

    @Test
    void shouldExpandSdlcToAllWorkflowStages() {
        assertEquals(List.of(Stage.PLAN, Stage.BUILD, Stage.TEST, Stage.REVIEW, Stage.DOCUMENT),
                WorkflowStageSequence.parse("adw_sdlc_iso"));
    }

    @Test
    void shouldMapOrchestratorToPlan() {
        assertEquals(List.of(Stage.PLAN), WorkflowStageSequence.parse("adw_orchestrator_iso"));
    }

    @Test
    void shouldDropTokensThatAreNotWorkflowStages() {
        assertEquals(List.of(Stage.PLAN, Stage.BUILD), WorkflowStageSequence.parse("adw_plan_build_pr_iso"));
        assertEquals(List.of(), WorkflowStageSequence.parse("adw_merge_iso"));
    }

    @Test
    void shouldReturnEmptyForMissingName() {
        assertTrue(WorkflowStageSequence.parse(null).isEmpty());
        assertTrue(WorkflowStageSequence.parse(" ").isEmpty());
        assertEquals(Optional.empty(), WorkflowStageSequence.initialStage(null));
    }

    @Test
    void shouldResolveInitialStage() {
        assertEquals(Optional.of(Stage.BUILD), WorkflowStageSequence.initialStage("adw_build_test_iso"));
    }

    @Test
    void shouldBuildWorkflowNameFromQueuedStages() {
        assertEquals("adw_plan_build_iso",
                WorkflowStageSequence.workflowNameFor(List.of(Stage.PLAN, Stage.BUILD)));
        assertEquals("adw_plan_iso",
                WorkflowStageSequence.workflowNameFor(List.of(Stage.PLAN, Stage.READY_TO_MERGE)));
    }
}
