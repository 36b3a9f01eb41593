// file: storage/src/main/java/io/regstore/storage/Bucket.java
package io.regstore.storage;

import org.rocksdb.RocksIterator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BiConsumer;

/**
 * A named collection of entries inside a transaction. An entry is either a plain value
 * or a nested bucket; both share one name space per bucket.
 * <p>
 * A Bucket is only valid for the lifetime of the transaction that produced it.
 * Values returned by {@link #get(String)} are copies and may be kept after the
 * transaction ends.
 */
public final class Bucket {
    private final BucketTx tx;
    private final byte[] prefix;

    Bucket(BucketTx tx, byte[] prefix) {
        this.tx = tx;
        this.prefix = prefix;
    }

    public boolean writable() {
        return tx.writable();
    }

    /** @return the value stored under {@code key}, or null if absent or a nested bucket */
    public byte[] get(String key) {
        byte[] stored = tx.read(BucketKeys.child(prefix, key));
        return BucketKeys.isValue(stored) ? BucketKeys.unwrapValue(stored) : null;
    }

    public void put(String key, byte[] value) {
        Objects.requireNonNull(value, "value");
        tx.checkWritable();
        byte[] k = BucketKeys.child(prefix, key);
        if (BucketKeys.isBucket(tx.read(k))) {
            throw new StoreException("incompatible value: " + key + " is a bucket");
        }
        tx.write(k, BucketKeys.wrapValue(value));
    }

    /** Remove a plain value; absent keys are ignored. */
    public void delete(String key) {
        tx.checkWritable();
        byte[] k = BucketKeys.child(prefix, key);
        byte[] stored = tx.read(k);
        if (BucketKeys.isBucket(stored)) {
            throw new StoreException("incompatible value: " + key + " is a bucket");
        }
        if (stored != null) {
            tx.remove(k);
        }
    }

    /** @return the nested bucket, or null if absent or a plain value */
    public Bucket bucket(String name) {
        byte[] k = BucketKeys.child(prefix, name);
        return BucketKeys.isBucket(tx.read(k)) ? new Bucket(tx, k) : null;
    }

    public Bucket createBucket(String name) {
        tx.checkWritable();
        byte[] k = BucketKeys.child(prefix, name);
        byte[] stored = tx.read(k);
        if (BucketKeys.isBucket(stored)) {
            throw new StoreException("bucket already exists: " + name);
        }
        if (stored != null) {
            throw new StoreException("incompatible value: " + name + " is not a bucket");
        }
        tx.write(k, BucketKeys.bucketHeader());
        return new Bucket(tx, k);
    }

    public Bucket createBucketIfNotExists(String name) {
        Bucket existing = bucket(name);
        return existing != null ? existing : createBucket(name);
    }

    /** Remove a nested bucket together with everything below it. */
    public void deleteBucket(String name) {
        tx.checkWritable();
        byte[] k = BucketKeys.child(prefix, name);
        byte[] stored = tx.read(k);
        if (stored == null) {
            throw new StoreException("bucket not found: " + name);
        }
        if (!BucketKeys.isBucket(stored)) {
            throw new StoreException("incompatible value: " + name + " is not a bucket");
        }
        tx.removeRange(k, BucketKeys.upperBound(k));
    }

    /**
     * Visit direct children in key order. The value passed for a nested bucket is null.
     * The visitor must not modify this bucket.
     */
    public void forEach(BiConsumer<String, byte[]> visitor) {
        try (RocksIterator it = tx.iterator()) {
            it.seek(prefix);
            while (it.isValid()) {
                byte[] key = it.key();
                if (!BucketKeys.hasPrefix(key, prefix)) break;
                String name = BucketKeys.lastSegment(key, prefix.length);
                byte[] stored = it.value();
                if (name == null) {
                    it.next();
                    continue;
                }
                if (BucketKeys.isBucket(stored)) {
                    visitor.accept(name, null);
                    it.seek(BucketKeys.upperBound(key));
                } else {
                    visitor.accept(name, BucketKeys.unwrapValue(stored));
                    it.next();
                }
            }
            tx.checkIterator(it);
        }
    }

    /** Names of the direct children, in key order. */
    public List<String> keys() {
        List<String> keys = new ArrayList<>();
        forEach((k, v) -> keys.add(k));
        return keys;
    }

    /** Number of direct children. */
    public int count() {
        int[] n = {0};
        forEach((k, v) -> n[0]++);
        return n[0];
    }
}
