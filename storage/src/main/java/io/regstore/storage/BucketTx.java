// file: storage/src/main/java/io/regstore/storage/BucketTx.java
package io.regstore.storage;

import org.rocksdb.ReadOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.Snapshot;
import org.rocksdb.WriteBatchWithIndex;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.BiConsumer;

/**
 * A read or write transaction over the bucket hierarchy.
 * <p>
 * Semantics:
 *  - Every read goes through a snapshot taken when the transaction begins, so a
 *    transaction never sees writes committed after that point.
 *  - A write transaction buffers its writes in an indexed batch and sees its own
 *    uncommitted writes. {@link #commit()} applies the whole batch atomically.
 *  - Only one write transaction is open at a time per store; it holds the writer lock
 *    until commit, rollback or close, and must be finished on the thread that began it.
 *  - Closing a transaction that was not committed rolls it back.
 */
public final class BucketTx implements AutoCloseable {
    private final BucketDb db;
    private final RocksDB rocks;
    private final Snapshot snapshot;
    private final ReadOptions readOptions;
    private final WriteBatchWithIndex batch; // null for read-only transactions
    private final Bucket root;
    private boolean done;

    BucketTx(BucketDb db, RocksDB rocks, boolean writable) {
        this.db = db;
        this.rocks = rocks;
        this.snapshot = rocks.getSnapshot();
        this.readOptions = new ReadOptions().setSnapshot(snapshot);
        this.batch = writable ? new WriteBatchWithIndex(true) : null;
        this.root = new Bucket(this, new byte[0]);
    }

    public boolean writable() {
        return batch != null;
    }

    /** @return the top-level bucket, or null if it does not exist */
    public Bucket bucket(String name) {
        return root.bucket(name);
    }

    public Bucket createBucket(String name) {
        return root.createBucket(name);
    }

    public Bucket createBucketIfNotExists(String name) {
        return root.createBucketIfNotExists(name);
    }

    public void deleteBucket(String name) {
        root.deleteBucket(name);
    }

    /** Visit top-level entries in key order. */
    public void forEach(BiConsumer<String, byte[]> visitor) {
        root.forEach(visitor);
    }

    public void commit() {
        checkOpen();
        if (batch == null) {
            throw new IllegalStateException("read-only transaction cannot be committed");
        }
        try {
            rocks.write(db.writeOptions(), batch);
        } catch (RocksDBException e) {
            throw new StoreException("commit failed", e);
        } finally {
            release();
        }
    }

    public void rollback() {
        checkOpen();
        release();
    }

    @Override
    public void close() {
        if (!done) {
            release();
        }
    }

    // ----------------- engine access used by Bucket -----------------

    byte[] read(byte[] key) {
        checkOpen();
        try {
            return batch == null
                    ? rocks.get(readOptions, key)
                    : batch.getFromBatchAndDB(rocks, readOptions, key);
        } catch (RocksDBException e) {
            throw new StoreException("read failed", e);
        }
    }

    void write(byte[] key, byte[] value) {
        checkWritable();
        try {
            batch.put(key, value);
        } catch (RocksDBException e) {
            throw new StoreException("write failed", e);
        }
    }

    void remove(byte[] key) {
        checkWritable();
        try {
            batch.delete(key);
        } catch (RocksDBException e) {
            throw new StoreException("delete failed", e);
        }
    }

    /** Remove every key in [from, to). */
    void removeRange(byte[] from, byte[] to) {
        List<byte[]> doomed = new ArrayList<>();
        try (RocksIterator it = iterator()) {
            for (it.seek(from); it.isValid(); it.next()) {
                byte[] key = it.key();
                if (Arrays.compareUnsigned(key, to) >= 0) break;
                doomed.add(key);
            }
            checkIterator(it);
        }
        // the batch must not change while an iterator over it is open
        for (byte[] key : doomed) {
            remove(key);
        }
    }

    RocksIterator iterator() {
        checkOpen();
        RocksIterator base = rocks.newIterator(readOptions);
        return batch == null ? base : batch.newIteratorWithBase(base);
    }

    void checkIterator(RocksIterator it) {
        try {
            it.status();
        } catch (RocksDBException e) {
            throw new StoreException("iteration failed", e);
        }
    }

    void checkWritable() {
        checkOpen();
        if (batch == null) {
            throw new IllegalStateException("transaction is read-only");
        }
    }

    private void checkOpen() {
        if (done) {
            throw new IllegalStateException("transaction already closed");
        }
    }

    private void release() {
        done = true;
        readOptions.close();
        rocks.releaseSnapshot(snapshot);
        if (batch != null) {
            batch.close();
            db.releaseWriter();
        }
    }
}
