package me.golemcore.kanban.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.kanban.domain.loop.ControlLoop;
import me.golemcore.kanban.domain.model.BoardSnapshot;
import me.golemcore.kanban.infrastructure.config.KanbanProperties;
import me.golemcore.kanban.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Keeps the board durable across restarts.
 *
 * <p>
 * Every commit (re)arms a debounced save, so a burst of events costs one write.
 * The snapshot is written atomically with a backup of the previous one. On
 * startup the board is rehydrated from the last snapshot, after which the
 * external-id index is rebuilt and the deduplication cache starts empty.
 */
@Service
@Slf4j
public class BoardPersistenceService {

    private static final long FLUSH_TIMEOUT_SECONDS = 10;

    private final TaskStore taskStore;
    private final ExternalIdIndex externalIdIndex;
    private final MessageDeduplicator deduplicator;
    private final StoragePort storagePort;
    private final ControlLoop controlLoop;
    private final ObjectMapper objectMapper;
    private final String directory;
    private final String snapshotFile;
    private final Duration saveDebounce;

    private ControlLoop.Cancellable pendingSave;

    public BoardPersistenceService(TaskStore taskStore, ExternalIdIndex externalIdIndex,
            MessageDeduplicator deduplicator, StoragePort storagePort, ControlLoop controlLoop,
            ObjectMapper objectMapper, KanbanProperties properties) {
        this.taskStore = taskStore;
        this.externalIdIndex = externalIdIndex;
        this.deduplicator = deduplicator;
        this.storagePort = storagePort;
        this.controlLoop = controlLoop;
        this.objectMapper = objectMapper;
        this.directory = properties.getStorage().getDirectory();
        this.snapshotFile = properties.getStorage().getSnapshotFile();
        this.saveDebounce = properties.getStorage().getSaveDebounce();
        taskStore.addBoardListener(this::onCommit);
    }

    /**
     * Loads the last snapshot into the store. A missing or unreadable snapshot
     * leaves the board empty.
     */
    public CompletableFuture<Void> rehydrate() {
        return storagePort.getText(directory, snapshotFile)
                .exceptionally(error -> {
                    log.warn("[Persistence] Failed to read board snapshot: {}", error.getMessage());
                    return null;
                })
                .thenAcceptAsync(this::restoreFrom, controlLoop);
    }

    /**
     * Writes the current board now, cancelling any pending debounced save.
     */
    public CompletableFuture<Void> save() {
        cancelPendingSave();
        String json;
        try {
            json = objectMapper.writeValueAsString(taskStore.exportSnapshot());
        } catch (JsonProcessingException e) {
            log.error("[Persistence] Failed to serialize board", e);
            return CompletableFuture.failedFuture(e);
        }
        return storagePort.putTextAtomic(directory, snapshotFile, json, true)
                .whenComplete((ignored, error) -> {
                    if (error != null) {
                        log.error("[Persistence] Failed to write board snapshot: {}", error.getMessage());
                    } else {
                        log.debug("[Persistence] Board saved ({} tasks)", taskStore.getTaskCount());
                    }
                });
    }

    @PreDestroy
    public void flush() {
        if (!hasPendingSave()) {
            return;
        }
        log.info("[Persistence] Flushing pending board save");
        try {
            save().get(FLUSH_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Persistence] Interrupted while flushing board");
        } catch (ExecutionException | TimeoutException e) {
            log.error("[Persistence] Final board save failed: {}", e.getMessage());
        }
    }

    synchronized boolean hasPendingSave() {
        return pendingSave != null;
    }

    private synchronized void onCommit(String action) {
        cancelPendingSave();
        pendingSave = controlLoop.schedule(this::save, saveDebounce);
    }

    private synchronized void cancelPendingSave() {
        if (pendingSave != null) {
            pendingSave.cancel();
            pendingSave = null;
        }
    }

    private void restoreFrom(String json) {
        if (json == null || json.isBlank()) {
            log.info("[Persistence] No board snapshot found, starting empty");
            return;
        }
        BoardSnapshot snapshot;
        try {
            snapshot = objectMapper.readValue(json, BoardSnapshot.class);
        } catch (JsonProcessingException e) {
            log.warn("[Persistence] Board snapshot is unreadable, starting empty: {}", e.getOriginalMessage());
            return;
        }
        if (snapshot.getVersion() > BoardSnapshot.CURRENT_VERSION) {
            log.warn("[Persistence] Board snapshot version {} is newer than supported {}, loading known fields",
                    snapshot.getVersion(), BoardSnapshot.CURRENT_VERSION);
        }
        taskStore.restore(snapshot);
        externalIdIndex.rebuild(taskStore.getTasks());
        deduplicator.clear();
        log.info("[Persistence] Rehydrated {} tasks, {} bound to runs", taskStore.getTaskCount(),
                externalIdIndex.size());
    }
}
