// file: core/src/main/java/io/regstore/core/FieldKind.java
package io.regstore.core;

import com.google.protobuf.MessageLite;

import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.time.Instant;
import java.util.Map;

/**
 * Closed set of field kinds a record may declare.
 * <p>
 * Every kind except STRING_MAP is stored as a flat tagged value under {@link #tag()}.
 * STRING_MAP is stored as a nested bucket of raw string entries and has no tag.
 */
public enum FieldKind {
    STRING(TypeTag.STRING),
    BOOL(TypeTag.BOOL),
    INT8(TypeTag.INT8),
    INT16(TypeTag.INT16),
    INT32(TypeTag.INT32),
    INT64(TypeTag.INT64),
    UINT8(TypeTag.UINT8),
    UINT16(TypeTag.UINT16),
    UINT32(TypeTag.UINT32),
    UINT64(TypeTag.UINT64),
    TIME(TypeTag.TIME),
    MESSAGE(TypeTag.MESSAGE),
    STRING_MAP(null);

    private final TypeTag tag;

    FieldKind(TypeTag tag) {
        this.tag = tag;
    }

    /** Tag used for the stored value, or null for STRING_MAP. */
    public TypeTag tag() { return tag; }

    /**
     * Resolve the kind of a declared component type.
     *
     * @param type        erased component type
     * @param genericType full generic type, used to check map type arguments
     * @param unsigned    whether the component carries {@link Unsigned}
     * @throws SchemaException if the type is not supported
     */
    public static FieldKind resolve(Class<?> type, Type genericType, boolean unsigned) {
        if (type == byte.class || type == Byte.class) return unsigned ? UINT8 : INT8;
        if (type == short.class || type == Short.class) return unsigned ? UINT16 : INT16;
        if (type == int.class || type == Integer.class) return unsigned ? UINT32 : INT32;
        if (type == long.class || type == Long.class) return unsigned ? UINT64 : INT64;
        if (unsigned) {
            throw new SchemaException("@Unsigned is only allowed on integer types, not " + type.getName());
        }
        if (type == String.class) return STRING;
        if (type == boolean.class || type == Boolean.class) return BOOL;
        if (type == Instant.class) return TIME;
        if (MessageLite.class.isAssignableFrom(type)) {
            if (type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
                throw new SchemaException("message field needs a concrete message class, got " + type.getName());
            }
            return MESSAGE;
        }
        if (type == Map.class && isStringToString(genericType)) return STRING_MAP;
        throw new SchemaException("unsupported field type " + genericType.getTypeName());
    }

    /** Zero value a field of this kind takes when nothing is stored for it. */
    public Object zeroValue(Class<?> javaType) {
        if (this == STRING_MAP) return Map.of();
        if (!javaType.isPrimitive()) return null;
        return switch (this) {
            case BOOL -> Boolean.FALSE;
            case INT8, UINT8 -> (byte) 0;
            case INT16, UINT16 -> (short) 0;
            case INT32, UINT32 -> 0;
            case INT64, UINT64 -> 0L;
            default -> throw new IllegalStateException("no primitive zero for " + this);
        };
    }

    /**
     * Encode a value as this kind.
     *
     * @throws SchemaException if the value does not fit this kind, or the kind is STRING_MAP
     */
    public byte[] encode(String field, Object value) {
        switch (this) {
            case STRING:
                if (value instanceof String s) return TaggedValueCodec.encodeString(s);
                break;
            case BOOL:
                if (value instanceof Boolean b) return TaggedValueCodec.encodeBool(b);
                break;
            case TIME:
                if (value instanceof Instant t) return TaggedValueCodec.encodeTime(t);
                break;
            case MESSAGE:
                if (value instanceof MessageLite m) return TaggedValueCodec.encodeMessage(m);
                break;
            case STRING_MAP:
                throw new SchemaException("field " + field + " is a map and has no tagged encoding");
            default:
                if (value instanceof UnsignedValue u && u.tag() == tag) {
                    return TaggedValueCodec.encodeInteger(u.bits(), tag);
                }
                if (value instanceof Number n && fitsWidth(n)) {
                    return TaggedValueCodec.encodeInteger(n.longValue(), tag);
                }
        }
        throw new SchemaException("field %s of kind %s cannot hold %s".formatted(
                field, this, value == null ? "null" : value.getClass().getName()));
    }

    private boolean fitsWidth(Number n) {
        return switch (tag.payloadSize()) {
            case Byte.BYTES -> n instanceof Byte;
            case Short.BYTES -> n instanceof Short;
            case Integer.BYTES -> n instanceof Integer;
            default -> n instanceof Long;
        };
    }

    private static boolean isStringToString(Type genericType) {
        if (!(genericType instanceof ParameterizedType p)) return false;
        Type[] args = p.getActualTypeArguments();
        return args.length == 2 && args[0] == String.class && args[1] == String.class;
    }
}
