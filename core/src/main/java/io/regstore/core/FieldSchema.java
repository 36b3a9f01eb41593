package io.regstore.core;

import com.google.protobuf.MessageLite;

import java.lang.reflect.Method;

/**
 * One field of a record shape.
 *
 * @param name        record component name
 * @param bucketKey   key of the field inside a record bucket (see {@link FieldMapper})
 * @param kind        storage kind
 * @param javaType    declared component type
 * @param messageType concrete message class for MESSAGE fields, null otherwise
 * @param accessor    record accessor method
 */
public record FieldSchema(
        String name,
        String bucketKey,
        FieldKind kind,
        Class<?> javaType,
        Class<? extends MessageLite> messageType,
        Method accessor
) {

    /** Zero value of this field. */
    public Object zeroValue() {
        return kind.zeroValue(javaType);
    }
}
