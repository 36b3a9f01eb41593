// file: storage/src/main/java/io/regstore/storage/BucketDb.java
package io.regstore.storage;

import org.rocksdb.Options;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.WriteOptions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Embedded bucket database backed by a RocksDB directory.
 * <p>
 * Responsibilities:
 *  - Open the directory, waiting a bounded time for its file lock.
 *  - Hand out transactions: any number of snapshot readers, one writer at a time.
 *  - Run managed transactions ({@link #view}, {@link #update}) that always end
 *    in commit or rollback.
 */
public final class BucketDb implements AutoCloseable {
    private static final Logger log = Logger.getLogger(BucketDb.class.getName());
    private static final long LOCK_RETRY_MILLIS = 50;

    static {
        RocksDB.loadLibrary();
    }

    private final Path path;
    private final Options options;
    private final WriteOptions writeOptions;
    private final RocksDB rocks;
    private final ReentrantLock writer = new ReentrantLock();
    private volatile boolean closed;

    private BucketDb(Path path, Options options, WriteOptions writeOptions, RocksDB rocks) {
        this.path = path;
        this.options = options;
        this.writeOptions = writeOptions;
        this.rocks = rocks;
    }

    /**
     * Open (creating if needed) the store directory named by the config.
     *
     * @throws StoreException if the directory cannot be opened, or its lock is still
     *                        held by someone else once the lock timeout has elapsed
     */
    public static BucketDb open(StoreConfig config) {
        Path path = config.path().toAbsolutePath();
        try {
            Files.createDirectories(path);
        } catch (IOException e) {
            throw new StoreException("cannot create store directory " + path, e);
        }
        Options options = new Options().setCreateIfMissing(true);
        WriteOptions writeOptions = new WriteOptions().setSync(config.syncWrites());
        try {
            RocksDB rocks = openWithLockTimeout(path, options, config.lockTimeout().toMillis());
            log.log(Level.INFO, "opened store " + path);
            return new BucketDb(path, options, writeOptions, rocks);
        } catch (RuntimeException e) {
            writeOptions.close();
            options.close();
            throw e;
        }
    }

    private static RocksDB openWithLockTimeout(Path path, Options options, long timeoutMillis) {
        long deadline = System.currentTimeMillis() + timeoutMillis;
        int attempts = 0;
        while (true) {
            try {
                return RocksDB.open(options, path.toString());
            } catch (RocksDBException e) {
                if (!isLockConflict(e.getMessage())) {
                    throw new StoreException("cannot open store " + path, e);
                }
                attempts++;
                if (System.currentTimeMillis() >= deadline) {
                    throw new StoreException(String.format(
                            "timed out after %d ms waiting for the lock on %s", timeoutMillis, path), e);
                }
                if (attempts == 1) {
                    log.log(Level.FINE, "store " + path + " is locked, waiting up to " + timeoutMillis + " ms");
                }
                try {
                    Thread.sleep(LOCK_RETRY_MILLIS);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new StoreException("interrupted while waiting for the lock on " + path, ie);
                }
            }
        }
    }

    /**
     * RocksDB reports a held directory lock as an IO error on the LOCK file, e.g.
     * "While lock file: /db/LOCK: Resource temporarily unavailable" from another process
     * or "lock hold by current process" from this one.
     */
    static boolean isLockConflict(String msg) {
        if (msg == null) return false;
        return msg.contains("While lock file")
                || msg.contains("lock hold by current process")
                || msg.contains("/LOCK:")
                || msg.contains("\\LOCK:");
    }

    public Path path() {
        return path;
    }

    /**
     * Begin a transaction. A writable transaction blocks until the current writer is done.
     * The caller owns the transaction and must commit, roll back or close it.
     */
    public BucketTx begin(boolean writable) {
        checkOpen();
        if (!writable) {
            return new BucketTx(this, rocks, false);
        }
        writer.lock();
        try {
            return new BucketTx(this, rocks, true);
        } catch (RuntimeException e) {
            writer.unlock();
            throw e;
        }
    }

    /** Run {@code fn} in a read-only transaction. */
    public <R> R view(TxFunction<R> fn) {
        try (BucketTx tx = begin(false)) {
            return fn.apply(tx);
        }
    }

    /** Run {@code fn} in a write transaction, committing on return and rolling back on failure. */
    public <R> R update(TxFunction<R> fn) {
        try (BucketTx tx = begin(true)) {
            R result;
            try {
                result = fn.apply(tx);
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "write transaction on " + path + " rolled back", e);
                throw e;
            }
            tx.commit();
            return result;
        }
    }

    WriteOptions writeOptions() {
        return writeOptions;
    }

    void releaseWriter() {
        writer.unlock();
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        rocks.close();
        writeOptions.close();
        options.close();
        log.log(Level.INFO, "closed store " + path);
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("store " + path + " is closed");
        }
    }
}
