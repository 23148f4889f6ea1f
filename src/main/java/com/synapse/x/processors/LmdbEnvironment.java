package com.synapse.x.processors;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.synapse.x.exceptions.StoreUnavailableException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.lmdbjava.Dbi;
import org.lmdbjava.DbiFlags;
import org.lmdbjava.Env;
import org.lmdbjava.EnvFlags;
import org.lmdbjava.Txn;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;


/**
 * Owns the LMDB environment and its four databases:
 * <ul>
 *     <li>{@code records}: every record version, keyed by view, company and timestamp</li>
 *     <li>{@code latest}: the newest version per (view, company)</li>
 *     <li>{@code views}: feature view catalog with running counters</li>
 *     <li>{@code models}: model registry</li>
 * </ul>
 */
@Slf4j
@Component
public class LmdbEnvironment implements AutoCloseable {

    private Env<ByteBuffer> env;
    private Dbi<ByteBuffer> recordsDbi;
    private Dbi<ByteBuffer> latestDbi;
    private Dbi<ByteBuffer> viewsDbi;
    private Dbi<ByteBuffer> modelsDbi;
    private volatile boolean closed;

    private final String dbPath;
    private final long maxDbSize;
    private final long syncIntervalMs;

    private final ScheduledExecutorService syncExecutor =
            Executors.newSingleThreadScheduledExecutor(
                    new ThreadFactoryBuilder()
                            .setNameFormat("lmdb-sync-%d")
                            .setDaemon(true)
                            .build()
            );

    public LmdbEnvironment(@Value("${synapse.store.path:./data/feature-store}") String dbPath,
                           @Value("${synapse.store.map-size:1073741824}") long maxDbSize,
                           @Value("${synapse.store.sync-interval-ms:1000}") long syncIntervalMs) {
        this.dbPath = dbPath;
        this.maxDbSize = maxDbSize;
        this.syncIntervalMs = syncIntervalMs;
    }

    @PostConstruct
    public void init() throws IOException {
        Path path = Paths.get(dbPath);
        Files.createDirectories(path);

        log.info("Initializing LMDB at {} ({} MiB)",
                path.toAbsolutePath(),
                maxDbSize / (1024L * 1024));

        this.env = Env.create()
                .setMapSize(maxDbSize)
                .setMaxDbs(8)
                .setMaxReaders(1024)
                .open(path.toFile(),
                        EnvFlags.MDB_NOTLS
                );

        this.recordsDbi = env.openDbi("records", DbiFlags.MDB_CREATE);
        this.latestDbi = env.openDbi("latest", DbiFlags.MDB_CREATE);
        this.viewsDbi = env.openDbi("views", DbiFlags.MDB_CREATE);
        this.modelsDbi = env.openDbi("models", DbiFlags.MDB_CREATE);

        if (syncIntervalMs > 0) {
            startPeriodicSync();
        }

        log.info("LMDB initialized successfully. Database path: {}", path);
    }

    private void startPeriodicSync() {
        syncExecutor.scheduleAtFixedRate(() -> {
            try {
                if (!closed) {
                    env.sync(false);
                    log.debug("LMDB synced to disk");
                }
            } catch (Exception e) {
                log.error("Failed to sync LMDB", e);
            }
        }, syncIntervalMs, syncIntervalMs, TimeUnit.MILLISECONDS);

        log.info("Periodic sync enabled (interval = {} ms)", syncIntervalMs);
    }

    public Txn<ByteBuffer> txnRead() {
        ensureOpen();
        return env.txnRead();
    }

    /**
     * Opens the single write transaction. Callers block here while another writer is active.
     */
    public Txn<ByteBuffer> txnWrite() {
        ensureOpen();
        return env.txnWrite();
    }

    private void ensureOpen() {
        if (closed || env == null || env.isClosed()) {
            throw new StoreUnavailableException("LMDB environment is closed");
        }
    }

    public boolean isOpen() {
        return !closed && env != null && !env.isClosed();
    }

    /**
     * Size of the data file on disk, or -1 when it cannot be read.
     */
    public long dataFileSize() {
        try {
            Path dataFile = Paths.get(dbPath, "data.mdb");
            if (!Files.exists(dataFile)) return 0;
            return Files.size(dataFile);
        } catch (IOException e) {
            log.warn("Failed to read LMDB size", e);
            return -1;
        }
    }

    @PreDestroy
    @Override
    public void close() {
        if (env == null || closed) return;
        closed = true;

        try {
            log.info("Graceful shutdown: syncing LMDB to disk...");
            syncExecutor.shutdown();
            syncExecutor.awaitTermination(5, TimeUnit.SECONDS);
            env.sync(true);
            log.info("LMDB synced and closed cleanly");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while stopping LMDB sync");
        } catch (Exception e) {
            log.error("Error during LMDB shutdown", e);
        } finally {
            try {
                recordsDbi.close();
                latestDbi.close();
                viewsDbi.close();
                modelsDbi.close();
                env.close();
            } catch (Exception e) {
                log.error("Error closing LMDB resources", e);
            }
        }
    }

    public Dbi<ByteBuffer> recordsDbi() { return recordsDbi; }
    public Dbi<ByteBuffer> latestDbi()  { return latestDbi; }
    public Dbi<ByteBuffer> viewsDbi()   { return viewsDbi; }
    public Dbi<ByteBuffer> modelsDbi()  { return modelsDbi; }
}
