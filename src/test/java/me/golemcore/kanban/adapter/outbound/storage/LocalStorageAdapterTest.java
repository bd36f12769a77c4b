package me.golemcore.kanban.adapter.outbound.storage;

import me.golemcore.kanban.infrastructure.config.KanbanProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalStorageAdapterTest {

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storage;

    @BeforeEach
    void setUp() {
        KanbanProperties properties = new KanbanProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        storage = new LocalStorageAdapter(properties);
        storage.init();
    }

    @Test
    void shouldCreateBoardDirectoryOnInit() {
        assertTrue(Files.isDirectory(tempDir.resolve("board")));
    }

    @Test
    void shouldWriteAndReadText() {
        storage.putTextAtomic("board", "board.json", "{\"version\":1}", false).join();

        assertEquals("{\"version\":1}", storage.getText("board", "board.json").join());
        assertTrue(Files.exists(tempDir.resolve("board/board.json")));
        assertFalse(Files.exists(tempDir.resolve("board/board.json.tmp")));
    }

    @Test
    void shouldReturnNullForMissingFile() {
        assertNull(storage.getText("board", "missing.json").join());
    }

    @Test
    void shouldKeepPreviousContentAsBackup() throws IOException {
        storage.putTextAtomic("board", "board.json", "first", true).join();
        storage.putTextAtomic("board", "board.json", "second", true).join();

        assertEquals("second", storage.getText("board", "board.json").join());
        assertEquals("first", Files.readString(tempDir.resolve("board/board.json.bak"), StandardCharsets.UTF_8));
    }

    @Test
    void shouldCreateMissingParentDirectories() {
        storage.putTextAtomic("archive", "2026/01/board.json", "old", false).join();

        assertEquals("old", storage.getText("archive", "2026/01/board.json").join());
    }

    @Test
    void shouldBlockPathTraversal() {
        CompletionException error = assertThrows(CompletionException.class,
                () -> storage.getText("board", "../../etc/passwd").join());

        assertInstanceOf(IllegalArgumentException.class, error.getCause());
    }
}
