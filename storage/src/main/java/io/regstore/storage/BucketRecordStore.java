// file: storage/src/main/java/io/regstore/storage/BucketRecordStore.java
package io.regstore.storage;

import io.regstore.core.FieldMapper;
import io.regstore.core.FieldSchema;
import io.regstore.core.RecordSchema;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link RecordStore} on a {@link BucketDb}.
 * <p>
 * Layout:
 *  - one top-level bucket per record type, created on first save;
 *  - one child bucket per record key;
 *  - inside it the entries written by {@link RecordCodec}.
 */
public final class BucketRecordStore implements RecordStore {
    private static final Logger log = Logger.getLogger(BucketRecordStore.class.getName());

    private final BucketDb db;

    public BucketRecordStore(BucketDb db) {
        this.db = Objects.requireNonNull(db, "db");
    }

    /** Open the store directory named by {@code config}. */
    public static BucketRecordStore open(StoreConfig config) {
        return new BucketRecordStore(BucketDb.open(config));
    }

    @Override
    public void saveValue(String type, String key, Object record) {
        Objects.requireNonNull(record, "record");
        RecordSchema<Object> schema = schemaOf(record);
        db.update(tx -> {
            Bucket typeBucket = tx.createBucketIfNotExists(type);
            if (typeBucket.bucket(key) != null) {
                typeBucket.deleteBucket(key);
            } else {
                typeBucket.delete(key);
            }
            RecordCodec.serialize(typeBucket.createBucket(key), schema, record);
            return null;
        });
    }

    @Override
    public void deleteValues(String type, Collection<String> keys) {
        if (keys.isEmpty()) return;
        db.update(tx -> {
            Bucket typeBucket = tx.bucket(type);
            if (typeBucket == null) return null;
            for (String key : keys) {
                if (typeBucket.bucket(key) != null) {
                    typeBucket.deleteBucket(key);
                }
            }
            return null;
        });
    }

    @Override
    public void updateValue(String type, String key, Map<String, ?> properties) {
        if (properties.isEmpty()) return;
        db.update(tx -> {
            Bucket record = recordBucket(tx, type, key);
            if (record == null) return null;
            for (Map.Entry<String, ?> e : properties.entrySet()) {
                Object value = e.getValue();
                if (value == null || !RecordCodec.writeProperty(record, FieldMapper.toBucketKey(e.getKey()), value)) {
                    log.log(Level.FINE, String.format("skip property %s of %s/%s: unsupported value %s",
                            e.getKey(), type, key, value == null ? "null" : value.getClass().getName()));
                }
            }
            return null;
        });
    }

    @Override
    public void updateValue(String type, String key, Class<?> shape, Map<String, ?> properties) {
        if (properties.isEmpty()) return;
        RecordSchema<?> schema = RecordSchema.of(shape);
        Map<FieldSchema, Object> resolved = new LinkedHashMap<>();
        for (Map.Entry<String, ?> e : properties.entrySet()) {
            FieldSchema field = schema.field(e.getKey());
            Object value = e.getValue();
            if (value != null) {
                RecordCodec.checkProperty(field, value);
                resolved.put(field, value);
            } else {
                log.log(Level.FINE, String.format("skip null property %s of %s/%s", e.getKey(), type, key));
            }
        }
        db.update(tx -> {
            Bucket record = recordBucket(tx, type, key);
            if (record == null) return null;
            for (Map.Entry<FieldSchema, Object> e : resolved.entrySet()) {
                RecordCodec.writeProperty(record, e.getKey(), e.getValue());
            }
            return null;
        });
    }

    @Override
    public <T> Map<String, T> loadValues(String type, Collection<String> keys, Class<T> shape) {
        Map<String, T> out = new LinkedHashMap<>();
        if (keys.isEmpty()) return out;
        RecordSchema<T> schema = RecordSchema.of(shape);
        return db.view(tx -> {
            Bucket typeBucket = tx.bucket(type);
            if (typeBucket == null) return out;
            for (String key : keys) {
                Bucket record = typeBucket.bucket(key);
                if (record != null) {
                    out.put(key, RecordCodec.deserialize(record, schema));
                }
            }
            return out;
        });
    }

    @Override
    public <T> Map<String, T> loadValuesByFilter(String type, List<String> fields, Class<T> shape,
                                                 Predicate<Map<String, Object>> filter) {
        RecordSchema<T> schema = RecordSchema.of(shape);
        boolean matchAll = filter == null || fields == null || fields.isEmpty();
        return db.view(tx -> {
            Map<String, T> out = new LinkedHashMap<>();
            Bucket typeBucket = tx.bucket(type);
            if (typeBucket == null) return out;
            for (String key : typeBucket.keys()) {
                Bucket record = recordOrWarn(typeBucket, type, key);
                if (record == null) continue;
                if (!matchAll) {
                    Map<String, Object> values = new LinkedHashMap<>();
                    for (String field : fields) {
                        Object value = RecordCodec.readField(record, schema, field);
                        if (value != null) {
                            values.put(field, value);
                        }
                    }
                    if (!filter.test(values)) continue;
                }
                out.put(key, RecordCodec.deserialize(record, schema));
            }
            return out;
        });
    }

    @Override
    public <T> Map<String, T> loadValuesAll(String type, Class<T> shape) {
        return loadValuesByFilter(type, List.of(), shape, null);
    }

    @Override
    public void iterateFields(String type, String field, Class<?> shape, Consumer<Object> process) {
        if (process == null) return;
        RecordSchema<?> schema = RecordSchema.of(shape);
        schema.field(field);
        db.view(tx -> {
            Bucket typeBucket = tx.bucket(type);
            if (typeBucket == null) return null;
            for (String key : typeBucket.keys()) {
                Bucket record = recordOrWarn(typeBucket, type, key);
                if (record != null) {
                    process.accept(RecordCodec.readField(record, schema, field));
                }
            }
            return null;
        });
    }

    @Override
    public int countValues(String type) {
        return db.view(tx -> {
            Bucket typeBucket = tx.bucket(type);
            return typeBucket == null ? 0 : typeBucket.count();
        });
    }

    @Override
    public <R> R execute(boolean writable, TxFunction<R> process) {
        return writable ? db.update(process) : db.view(process);
    }

    @Override
    public BucketTx transaction() {
        return db.begin(true);
    }

    @Override
    public void close() {
        db.close();
    }

    // ----------------- helpers -----------------

    @SuppressWarnings("unchecked")
    private static RecordSchema<Object> schemaOf(Object record) {
        return (RecordSchema<Object>) (RecordSchema<?>) RecordSchema.of(record.getClass());
    }

    private static Bucket recordBucket(BucketTx tx, String type, String key) {
        Bucket typeBucket = tx.bucket(type);
        return typeBucket == null ? null : typeBucket.bucket(key);
    }

    private static Bucket recordOrWarn(Bucket typeBucket, String type, String key) {
        Bucket record = typeBucket.bucket(key);
        if (record == null) {
            log.log(Level.WARNING, String.format("record %s/%s is not a bucket, skipped", type, key));
        }
        return record;
    }
}
