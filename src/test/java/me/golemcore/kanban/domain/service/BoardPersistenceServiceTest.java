package me.golemcore.kanban.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.kanban.domain.model.MetadataKeys;
import me.golemcore.kanban.domain.model.Stage;
import me.golemcore.kanban.domain.model.Task;
import me.golemcore.kanban.domain.model.TaskLogEntry;
import me.golemcore.kanban.domain.model.event.StatusUpdateEvent;
import me.golemcore.kanban.infrastructure.config.AutoConfiguration;
import me.golemcore.kanban.infrastructure.config.KanbanProperties;
import me.golemcore.kanban.port.outbound.StoragePort;
import me.golemcore.kanban.testsupport.loop.DirectControlLoop;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BoardPersistenceServiceTest {

    private static final Instant NOW = Instant.parse("2026-07-01T00:00:00Z");

    private KanbanProperties properties;
    private DirectControlLoop loop;
    private InMemoryStorage storage;
    private ObjectMapper objectMapper;
    private Clock clock;

    @BeforeEach
    void setUp() {
        properties = new KanbanProperties();
        loop = new DirectControlLoop();
        storage = new InMemoryStorage();
        objectMapper = AutoConfiguration.objectMapper();
        clock = Clock.fixed(NOW, ZoneOffset.UTC);
    }

    // ===== Debounced save =====

    @Test
    void shouldCoalesceBurstOfCommitsIntoOneSave() {
        Board board = newBoard();

        board.store.putTask("a", task(board.store.nextTaskId(), "A", null));
        board.store.putTask("b", task(board.store.nextTaskId(), "B", null));
        board.store.putTask("c", task(board.store.nextTaskId(), "C", null));

        assertEquals(1, loop.scheduledTaskCount());
        assertEquals(List.of(Duration.ofMillis(500)), loop.scheduledDelays());
        assertEquals(0, storage.writes);

        loop.runScheduledTasks();

        assertEquals(1, storage.writes);
        assertTrue(storage.lastBackupFlag);
        assertFalse(board.persistence.hasPendingSave());
    }

    @Test
    void shouldFlushPendingSaveOnShutdown() {
        Board board = newBoard();
        board.store.putTask("a", task(board.store.nextTaskId(), "A", null));

        board.persistence.flush();

        assertEquals(1, storage.writes);
        assertEquals(0, loop.scheduledTaskCount());
    }

    @Test
    void shouldSkipFlushWhenNothingPending() {
        Board board = newBoard();

        board.persistence.flush();

        assertEquals(0, storage.writes);
    }

    // ===== Rehydration =====

    @Test
    void shouldRestoreBoardAndRebuildIndex() {
        Board first = newBoard();
        Task bound = task(first.store.nextTaskId(), "Bound", "abc123");
        bound.getMetadata().put(MetadataKeys.WORKFLOW_NAME, "adw_plan_build_iso");
        first.store.putTask("a", bound);
        first.store.putTask("b", task(first.store.nextTaskId(), "Local", null));
        first.store.commit("log", tx -> tx.appendLog(1, TaskLogEntry.builder().message("Planning").build()));
        first.persistence.save().join();

        Board second = newBoard();
        second.deduplicator.isDuplicate(new StatusUpdateEvent("x", null, "running", null, null, null, NOW));
        second.persistence.rehydrate().join();

        assertEquals(2, second.store.getTaskCount());
        Task restored = second.index.resolve("abc123").orElseThrow();
        assertEquals("Bound", restored.getTitle());
        assertEquals(Stage.PLAN, restored.getStage());
        assertEquals("adw_plan_build_iso", restored.getWorkflowName());
        assertEquals("Planning", second.store.getLogs(1).get(0).getMessage());
        assertEquals(0, second.deduplicator.size());
        assertEquals(3, second.store.nextTaskId());
    }

    @Test
    void shouldStartEmptyWhenSnapshotMissing() {
        Board board = newBoard();

        board.persistence.rehydrate().join();

        assertEquals(0, board.store.getTaskCount());
    }

    @Test
    void shouldStartEmptyWhenSnapshotCorrupted() {
        storage.files.put("board/board.json", "{not json");
        Board board = newBoard();

        board.persistence.rehydrate().join();

        assertEquals(0, board.store.getTaskCount());
    }

    @Test
    void shouldStartEmptyWhenStorageFails() {
        storage.failReads = true;
        Board board = newBoard();

        board.persistence.rehydrate().join();

        assertEquals(0, board.store.getTaskCount());
    }

    @Test
    void shouldLoadKnownFieldsOfNewerSnapshot() {
        storage.files.put("board/board.json", """
                {"version": 99, "nextTaskId": 7, "futureField": true,
                 "tasks": [{"id": 5, "title": "From the future", "stage": "review", "externalId": "fut1"}]}
                """);
        Board board = newBoard();

        board.persistence.rehydrate().join();

        assertEquals("From the future", board.index.resolve("fut1").orElseThrow().getTitle());
        assertEquals(7, board.store.nextTaskId());
        assertNull(board.store.getTask(5).orElseThrow().getDescription());
    }

    private Board newBoard() {
        TaskStore store = new TaskStore(properties);
        ExternalIdIndex index = new ExternalIdIndex(store);
        MessageDeduplicator deduplicator = new MessageDeduplicator(index, loop, properties, clock);
        BoardPersistenceService persistence = new BoardPersistenceService(store, index, deduplicator, storage, loop,
                objectMapper, properties);
        return new Board(store, index, deduplicator, persistence);
    }

    private static Task task(long id, String title, String externalId) {
        return Task.builder().id(id).title(title).externalId(externalId)
                .stage(externalId != null ? Stage.PLAN : Stage.BACKLOG).createdAt(NOW).build();
    }

    private record Board(TaskStore store, ExternalIdIndex index, MessageDeduplicator deduplicator,
            BoardPersistenceService persistence) {
    }

    private static final class InMemoryStorage implements StoragePort {

        private final Map<String, String> files = new HashMap<>();
        private int writes;
        private boolean lastBackupFlag;
        private boolean failReads;

        @Override
        public CompletableFuture<String> getText(String directory, String path) {
            if (failReads) {
                return CompletableFuture.failedFuture(new IllegalStateException("disk unavailable"));
            }
            return CompletableFuture.completedFuture(files.get(directory + "/" + path));
        }

        @Override
        public CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup) {
            files.put(directory + "/" + path, content);
            writes++;
            lastBackupFlag = backup;
            return CompletableFuture.completedFuture(null);
        }
    }
}
