package me.golemcore.kanban.port.outbound;

import java.util.concurrent.CompletableFuture;

/**
 * Port for local durable key-value storage. Keys are a directory plus a
 * relative path.
 */
public interface StoragePort {

    CompletableFuture<String> getText(String directory, String path);

    /**
     * Write through a temp file and rename, so readers never see a partial
     * file. With {@code backup} the previous content is kept as {@code .bak}.
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup);
}
