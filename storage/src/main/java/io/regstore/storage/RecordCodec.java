// file: storage/src/main/java/io/regstore/storage/RecordCodec.java
package io.regstore.storage;

import io.regstore.core.FieldKind;
import io.regstore.core.FieldSchema;
import io.regstore.core.RecordSchema;
import io.regstore.core.SchemaException;
import io.regstore.core.TaggedValueCodec;
import io.regstore.core.TypeTag;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Maps records to and from the entries of a record bucket.
 * <p>
 * Layout inside a record bucket:
 *  - every scalar or message field is one flat tagged value under its bucket key;
 *  - a map field is a nested bucket under its bucket key holding raw UTF-8 entries.
 * <p>
 * Field resolution on read is always flat first, then nested, then zero value.
 */
public final class RecordCodec {
    private static final Logger log = Logger.getLogger(RecordCodec.class.getName());

    private RecordCodec() {}

    /**
     * Write a record into an empty record bucket.
     *
     * @return the flat entries written (nested map buckets are not part of it)
     */
    public static <T> Map<String, byte[]> serialize(Bucket bucket, RecordSchema<T> schema, T record) {
        Map<String, byte[]> flat = new LinkedHashMap<>();
        for (FieldSchema f : schema.fields()) {
            Object value = schema.get(record, f);
            if (value == null) continue;
            if (f.kind() == FieldKind.STRING_MAP) {
                Map<?, ?> map = (Map<?, ?>) value;
                if (!map.isEmpty()) {
                    writeStringMap(bucket, f.bucketKey(), map);
                }
                continue;
            }
            byte[] encoded = f.kind().encode(f.name(), value);
            bucket.put(f.bucketKey(), encoded);
            flat.put(f.bucketKey(), encoded);
        }
        return flat;
    }

    /** Rebuild a record from its bucket; fields with no usable value keep their zero value. */
    public static <T> T deserialize(Bucket bucket, RecordSchema<T> schema) {
        Object[] values = new Object[schema.fields().size()];
        int i = 0;
        for (FieldSchema f : schema.fields()) {
            values[i++] = readTyped(bucket, f);
        }
        return schema.newInstance(values);
    }

    /**
     * Read one field by name, decoding scalars by their stored tag.
     *
     * @return the value, or null if the record has no value for it
     * @throws SchemaException if the field is not part of the schema, or a message is
     *                         stored under a field that is not message-typed
     */
    public static Object readField(Bucket bucket, RecordSchema<?> schema, String fieldName) {
        FieldSchema f = schema.field(fieldName);
        byte[] raw = bucket.get(f.bucketKey());
        if (raw != null && raw.length > 0) {
            if (TaggedValueCodec.tagOf(raw) == TypeTag.MESSAGE && f.kind() != FieldKind.MESSAGE) {
                throw new SchemaException("field %s of %s is not a message but holds one"
                        .formatted(f.name(), schema.type().getName()));
            }
            return TaggedValueCodec.decode(f.name(), raw, f.messageType());
        }
        Bucket nested = bucket.bucket(f.bucketKey());
        return nested == null ? null : readStringMap(nested);
    }

    /**
     * Overwrite one property, choosing the encoding from the runtime type of the value.
     *
     * @return false if the value has no storable type and nothing was written
     */
    public static boolean writeProperty(Bucket bucket, String bucketKey, Object value) {
        if (value instanceof Map<?, ?> map) {
            if (!isStringMap(map)) return false;
            replaceStringMap(bucket, bucketKey, map);
            return true;
        }
        byte[] encoded = TaggedValueCodec.encode(value);
        if (encoded == null) return false;
        putFlat(bucket, bucketKey, encoded);
        return true;
    }

    /**
     * Overwrite one property with the declared kind of its schema field.
     *
     * @throws SchemaException if the value does not fit the field
     */
    public static void writeProperty(Bucket bucket, FieldSchema field, Object value) {
        checkProperty(field, value);
        if (field.kind() == FieldKind.STRING_MAP) {
            replaceStringMap(bucket, field.bucketKey(), (Map<?, ?>) value);
            return;
        }
        putFlat(bucket, field.bucketKey(), field.kind().encode(field.name(), value));
    }

    /**
     * Check that a value can be written to a field, without writing it.
     *
     * @throws SchemaException if the value does not fit the field
     */
    public static void checkProperty(FieldSchema field, Object value) {
        if (field.kind() == FieldKind.STRING_MAP) {
            if (!(value instanceof Map<?, ?> map) || !isStringMap(map)) {
                throw new SchemaException("field " + field.name() + " needs a Map<String, String>");
            }
            return;
        }
        field.kind().encode(field.name(), value);
    }

    static boolean isStringMap(Map<?, ?> map) {
        for (Map.Entry<?, ?> e : map.entrySet()) {
            if (!(e.getKey() instanceof String) || !(e.getValue() instanceof String)) return false;
        }
        return true;
    }

    // ----------------- helpers -----------------

    private static Object readTyped(Bucket bucket, FieldSchema f) {
        byte[] raw = bucket.get(f.bucketKey());
        if (raw != null && raw.length > 0) {
            TypeTag tag = TaggedValueCodec.tagOf(raw);
            if (tag == TypeTag.MESSAGE && f.kind() != FieldKind.MESSAGE) {
                throw new SchemaException("field " + f.name() + " is not a message but holds one");
            }
            if (tag != null && tag != f.kind().tag()) {
                if (tag.isInteger() && f.kind().tag() != null && f.kind().tag().isInteger()) {
                    return convertInteger(f, tag, (Number) TaggedValueCodec.decode(f.name(), raw, null));
                }
                log.log(Level.WARNING, String.format(
                        "field %s is declared %s but stored as %s, value skipped", f.name(), f.kind(), tag));
                return null;
            }
            return TaggedValueCodec.decode(f.name(), raw, f.messageType());
        }
        if (f.kind() != FieldKind.STRING_MAP) {
            return null;
        }
        Bucket nested = bucket.bucket(f.bucketKey());
        return nested == null ? Map.of() : readStringMap(nested);
    }

    /**
     * Convert an integer stored under another width or signedness to the declared kind.
     * Values outside the declared range are logged and skipped.
     */
    private static Object convertInteger(FieldSchema f, TypeTag stored, Number decoded) {
        int storedBits = stored.payloadSize() * 8;
        BigInteger value = stored.isUnsignedInteger()
                ? new BigInteger(Long.toUnsignedString(storedBits == 64 ? decoded.longValue()
                        : decoded.longValue() & ((1L << storedBits) - 1)))
                : BigInteger.valueOf(decoded.longValue());

        TypeTag declared = f.kind().tag();
        int bits = declared.payloadSize() * 8;
        BigInteger min = declared.isUnsignedInteger() ? BigInteger.ZERO : BigInteger.ONE.shiftLeft(bits - 1).negate();
        BigInteger max = declared.isUnsignedInteger()
                ? BigInteger.ONE.shiftLeft(bits).subtract(BigInteger.ONE)
                : BigInteger.ONE.shiftLeft(bits - 1).subtract(BigInteger.ONE);
        if (value.compareTo(min) < 0 || value.compareTo(max) > 0) {
            log.log(Level.WARNING, String.format(
                    "field %s is declared %s but holds %s %s out of range, value skipped", f.name(), f.kind(), stored, value));
            return null;
        }
        long bitsValue = value.longValue();
        switch (bits) {
            case 8: return (byte) bitsValue;
            case 16: return (short) bitsValue;
            case 32: return (int) bitsValue;
            default: return bitsValue;
        }
    }

    private static Map<String, String> readStringMap(Bucket nested) {
        Map<String, String> map = new LinkedHashMap<>();
        nested.forEach((k, v) -> {
            if (v != null) {
                map.put(k, new String(v, StandardCharsets.UTF_8));
            }
        });
        return Collections.unmodifiableMap(map);
    }

    private static void writeStringMap(Bucket bucket, String bucketKey, Map<?, ?> map) {
        Bucket nested = bucket.createBucket(bucketKey);
        for (Map.Entry<?, ?> e : map.entrySet()) {
            nested.put((String) e.getKey(), ((String) e.getValue()).getBytes(StandardCharsets.UTF_8));
        }
    }

    private static void replaceStringMap(Bucket bucket, String bucketKey, Map<?, ?> map) {
        if (bucket.bucket(bucketKey) != null) {
            bucket.deleteBucket(bucketKey);
        } else {
            bucket.delete(bucketKey);
        }
        if (!map.isEmpty()) {
            writeStringMap(bucket, bucketKey, map);
        }
    }

    private static void putFlat(Bucket bucket, String bucketKey, byte[] encoded) {
        if (bucket.bucket(bucketKey) != null) {
            bucket.deleteBucket(bucketKey);
        }
        bucket.put(bucketKey, encoded);
    }
}
