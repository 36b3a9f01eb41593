// file: core/src/main/java/io/regstore/core/RecordSchema.java
package io.regstore.core;

import com.google.protobuf.MessageLite;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Storage description of a Java record class: its fields in declaration order, with the
 * kind each one is stored as.
 * <p>
 * A schema is derived once per record class and cached; use {@link #of(Class)}.
 * <p>
 * Invariants:
 *  - Every component has a supported {@link FieldKind}; derivation fails otherwise.
 *  - Bucket keys are unique within a schema.
 */
public final class RecordSchema<T> {

    private static final ClassValue<RecordSchema<?>> CACHE = new ClassValue<>() {
        @Override
        protected RecordSchema<?> computeValue(Class<?> type) {
            return derive(type);
        }
    };

    private final Class<T> type;
    private final List<FieldSchema> fields;
    private final Map<String, FieldSchema> byName;
    private final Constructor<T> constructor;

    private RecordSchema(Class<T> type, List<FieldSchema> fields, Constructor<T> constructor) {
        this.type = type;
        this.fields = Collections.unmodifiableList(fields);
        Map<String, FieldSchema> index = new LinkedHashMap<>();
        for (FieldSchema f : fields) {
            index.put(f.name(), f);
        }
        this.byName = Collections.unmodifiableMap(index);
        this.constructor = constructor;
    }

    /**
     * @return the cached schema of a record class
     * @throws SchemaException if the class is not a record or declares an unsupported component
     */
    @SuppressWarnings("unchecked")
    public static <T> RecordSchema<T> of(Class<T> type) {
        return (RecordSchema<T>) CACHE.get(type);
    }

    public Class<T> type() { return type; }

    public List<FieldSchema> fields() { return fields; }

    /** @return the field, or null if the record has no such field */
    public FieldSchema findField(String name) {
        return byName.get(name);
    }

    /**
     * @throws SchemaException if the record has no such field
     */
    public FieldSchema field(String name) {
        FieldSchema f = byName.get(name);
        if (f == null) {
            throw new SchemaException("field %s not found in %s".formatted(name, type.getName()));
        }
        return f;
    }

    /** Read a field value off a record instance. */
    public Object get(T record, FieldSchema field) {
        try {
            return field.accessor().invoke(record);
        } catch (IllegalAccessException e) {
            throw new SchemaException("cannot read field " + field.name() + " of " + type.getName(), e);
        } catch (InvocationTargetException e) {
            throw new IllegalStateException("accessor " + field.name() + " failed", e.getCause());
        }
    }

    /**
     * Build a record from field values in schema order. Null entries for primitive
     * components are replaced by the zero value.
     */
    public T newInstance(Object[] values) {
        if (values.length != fields.size()) {
            throw new IllegalArgumentException("expected %d values, got %d".formatted(fields.size(), values.length));
        }
        Object[] args = values.clone();
        for (int i = 0; i < args.length; i++) {
            if (args[i] == null) {
                args[i] = fields.get(i).zeroValue();
            }
        }
        try {
            return constructor.newInstance(args);
        } catch (InstantiationException | IllegalAccessException e) {
            throw new SchemaException("cannot instantiate " + type.getName(), e);
        } catch (InvocationTargetException e) {
            throw new ValueFormatException("stored values rejected by " + type.getName(), e.getCause());
        }
    }

    @Override
    public String toString() {
        return "RecordSchema[" + type.getName() + ", fields=" + byName.keySet() + "]";
    }

    // ----------------- derivation -----------------

    private static <T> RecordSchema<T> derive(Class<T> type) {
        if (!type.isRecord()) {
            throw new SchemaException(type.getName() + " is not a record class");
        }
        RecordComponent[] components = type.getRecordComponents();
        List<FieldSchema> fields = new ArrayList<>(components.length);
        Map<String, String> bucketKeys = new LinkedHashMap<>();
        Class<?>[] parameterTypes = new Class<?>[components.length];

        for (int i = 0; i < components.length; i++) {
            RecordComponent c = components[i];
            parameterTypes[i] = c.getType();
            boolean unsigned = c.isAnnotationPresent(Unsigned.class);
            FieldKind kind;
            try {
                kind = FieldKind.resolve(c.getType(), c.getGenericType(), unsigned);
            } catch (SchemaException e) {
                throw new SchemaException("%s.%s: %s".formatted(type.getName(), c.getName(), e.getMessage()), e);
            }
            String bucketKey = FieldMapper.toBucketKey(c.getName());
            String clash = bucketKeys.putIfAbsent(bucketKey, c.getName());
            if (clash != null) {
                throw new SchemaException("fields %s and %s of %s map to the same key"
                        .formatted(clash, c.getName(), type.getName()));
            }
            var accessor = c.getAccessor();
            accessor.setAccessible(true);
            fields.add(new FieldSchema(c.getName(), bucketKey, kind, c.getType(), messageType(kind, c.getType()), accessor));
        }

        try {
            Constructor<T> constructor = type.getDeclaredConstructor(parameterTypes);
            constructor.setAccessible(true);
            return new RecordSchema<>(type, fields, constructor);
        } catch (NoSuchMethodException e) {
            throw new SchemaException("no canonical constructor on " + type.getName(), e);
        }
    }

    @SuppressWarnings("unchecked")
    private static Class<? extends MessageLite> messageType(FieldKind kind, Class<?> type) {
        return kind == FieldKind.MESSAGE ? (Class<? extends MessageLite>) type : null;
    }
}
