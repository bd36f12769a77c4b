package me.golemcore.kanban.domain.service;

import me.golemcore.kanban.domain.model.ActiveWorkflow;
import me.golemcore.kanban.domain.model.BoardSnapshot;
import me.golemcore.kanban.domain.model.DeletionState;
import me.golemcore.kanban.domain.model.Project;
import me.golemcore.kanban.domain.model.Stage;
import me.golemcore.kanban.domain.model.Task;
import me.golemcore.kanban.domain.model.TaskLogEntry;
import me.golemcore.kanban.domain.model.WorkflowProgress;
import me.golemcore.kanban.domain.model.event.StatusUpdateEvent;
import me.golemcore.kanban.infrastructure.config.KanbanProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaskStoreTest {

    private KanbanProperties properties;
    private TaskStore store;
    private List<String> commits;
    private List<String> taskChanges;

    @BeforeEach
    void setUp() {
        properties = new KanbanProperties();
        properties.getLogs().setMaxPerTask(3);
        store = new TaskStore(properties);
        commits = new ArrayList<>();
        taskChanges = new ArrayList<>();
        store.addBoardListener(commits::add);
        store.addTaskChangeListener((before, after) -> taskChanges.add(
                (before != null ? before.getStage().getWireId() : "none") + "->"
                        + (after != null ? after.getStage().getWireId() : "none")));
    }

    @Test
    void shouldNotifyOncePerCommitAfterAllChanges() {
        store.putTask("create", task(1));

        store.commit("batch", tx -> {
            Task task = tx.task(1).orElseThrow();
            task.setStage(Stage.PLAN);
            tx.putTask(task);
            task.setStage(Stage.BUILD);
            tx.putTask(task);
            tx.appendLog(1, TaskLogEntry.builder().message("hello").build());
        });

        assertEquals(List.of("create", "batch"), commits);
        assertEquals(List.of("none->backlog", "backlog->build"), taskChanges);
    }

    @Test
    void shouldNotNotifyForEmptyCommit() {
        store.commit("noop", tx -> tx.task(42));

        assertTrue(commits.isEmpty());
    }

    @Test
    void shouldReturnCopiesFromReads() {
        store.putTask("create", task(1));

        Task read = store.getTask(1).orElseThrow();
        read.setTitle("changed outside");
        read.getMetadata().put("leak", true);

        Task again = store.getTask(1).orElseThrow();
        assertEquals("Task 1", again.getTitle());
        assertFalse(again.getMetadata().containsKey("leak"));
    }

    @Test
    void shouldTrimLogsAndAssignIds() {
        store.putTask("create", task(1));
        for (int i = 0; i < 5; i++) {
            int line = i;
            store.commit("log", tx -> tx.appendLog(1, TaskLogEntry.builder().message("line " + line).build()));
        }

        List<TaskLogEntry> logs = store.getLogs(1);
        assertEquals(3, logs.size());
        assertEquals("line 2", logs.get(0).getMessage());
        assertTrue(logs.get(2).getId().startsWith("1-"));
    }

    @Test
    void shouldClearSideDataWhenTaskRemoved() {
        Task task = task(1);
        task.setExternalId("abc");
        store.putTask("create", task);
        store.commit("side", tx -> {
            tx.appendLog(1, TaskLogEntry.builder().message("x").build());
            tx.mergeProgress(1, WorkflowProgress.builder().progress(50).build());
            tx.putDeletionState("abc", DeletionState.pending());
            tx.putActiveWorkflow(ActiveWorkflow.builder().externalId("abc").taskId(1L).build());
        });

        store.removeTask("delete", 1);

        assertTrue(store.getLogs(1).isEmpty());
        assertTrue(store.getProgress(1).isEmpty());
        assertTrue(store.getDeletionState("abc").isEmpty());
        assertTrue(store.getActiveWorkflow("abc").isEmpty());
    }

    @Test
    void shouldHandOutIncreasingIds() {
        long first = store.nextTaskId();
        long second = store.nextTaskId();

        assertEquals(first + 1, second);
    }

    @Test
    void shouldNeverReuseIdsAfterRestore() {
        BoardSnapshot snapshot = BoardSnapshot.builder()
                .version(BoardSnapshot.CURRENT_VERSION)
                .nextTaskId(2)
                .tasks(List.of(task(1), task(7)))
                .logs(Map.of(7L, List.of(TaskLogEntry.builder().message("kept").build()),
                        99L, List.of(TaskLogEntry.builder().message("orphan").build())))
                .build();

        store.restore(snapshot);

        assertEquals(8, store.nextTaskId());
        assertEquals(2, store.getTaskCount());
        assertEquals(1, store.getLogs(7).size());
        assertTrue(store.getLogs(99).isEmpty());
        assertTrue(commits.isEmpty());
    }

    @Test
    void shouldRoundTripBoardThroughSnapshot() {
        store.putTask("create", task(1));
        store.commit("project", tx -> {
            tx.addProject(Project.builder().id("p1").name("Repo").build());
            tx.selectProject("p1");
        });

        TaskStore restored = new TaskStore(properties);
        restored.restore(store.exportSnapshot());

        assertEquals(1, restored.getTaskCount());
        assertEquals("p1", restored.getSelectedProjectId().orElseThrow());
        assertEquals(1, restored.getProjects().size());
    }

    @Test
    void shouldClearSelectionWhenSelectedProjectRemoved() {
        store.commit("project", tx -> {
            tx.addProject(Project.builder().id("p1").name("Repo").build());
            tx.selectProject("p1");
        });

        store.commit("removeProject", tx -> assertTrue(tx.removeProject("p1")));

        assertTrue(store.getSelectedProjectId().isEmpty());
        assertTrue(store.getProjects().isEmpty());
    }

    @Test
    void shouldBoundStatusHistory() {
        properties.getLogs().setStatusHistorySize(2);
        for (int i = 0; i < 4; i++) {
            int progress = i;
            store.commit("status", tx -> tx.recordStatus(
                    new StatusUpdateEvent("abc", null, "running", null,
                            progress, null, null)));
        }

        assertEquals(2, store.getStatusHistory().size());
        assertEquals(3, store.getStatusHistory().get(1).progressPercent());
    }

    @Test
    void shouldReportMissingTaskAsEmpty() {
        assertTrue(store.getTask(5).isEmpty());
        assertFalse(store.containsTask(5));
        assertNull(store.getMergeState(5).orElse(null));
    }

    private static Task task(long id) {
        return Task.builder().id(id).title("Task " + id).build();
    }
}
