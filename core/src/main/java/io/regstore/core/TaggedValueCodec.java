// file: core/src/main/java/io/regstore/core/TaggedValueCodec.java
package io.regstore.core;

import com.google.protobuf.Internal;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.MessageLite;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Binary framing for a single field value.
 * <p>
 * Layout of a tagged buffer:
 * <p>
 *   [TAG (1 byte)]     discriminant, see {@link TypeTag}
 *   [PAYLOAD (n bytes, little-endian)]
 *     - STRING:          UTF-8 bytes
 *     - BOOL:            1 byte (0 or 1)
 *     - TIME:            int64 epoch seconds + int32 nanos
 *     - MESSAGE:         protobuf binary encoding of the message
 *     - INTn / UINTn:    n/8 bytes two's complement (the raw bits for unsigned)
 * <p>
 * Scalars are decoded from the tag alone. A MESSAGE payload does not say which message
 * it holds, so the caller must supply the target message class.
 */
public final class TaggedValueCodec {
    private static final Logger log = Logger.getLogger(TaggedValueCodec.class.getName());

    private TaggedValueCodec() {
        // utility
    }

    public static byte[] encodeString(String value) {
        byte[] utf8 = value.getBytes(StandardCharsets.UTF_8);
        return allocate(TypeTag.STRING, utf8.length).put(utf8).array();
    }

    public static byte[] encodeBool(boolean value) {
        return allocate(TypeTag.BOOL, 1).put((byte) (value ? 1 : 0)).array();
    }

    public static byte[] encodeTime(Instant value) {
        return allocate(TypeTag.TIME, TypeTag.TIME.payloadSize())
                .putLong(value.getEpochSecond())
                .putInt(value.getNano())
                .array();
    }

    public static byte[] encodeMessage(MessageLite message) {
        byte[] body = message.toByteArray();
        return allocate(TypeTag.MESSAGE, body.length).put(body).array();
    }

    /**
     * Encode an integer under one of the INTn/UINTn tags. Bits above the tag's width
     * are dropped, so callers pass either the sign-extended signed value or the
     * zero-extended unsigned value.
     */
    public static byte[] encodeInteger(long value, TypeTag tag) {
        if (!tag.isInteger()) {
            throw new IllegalArgumentException("not an integer tag: " + tag);
        }
        ByteBuffer b = allocate(tag, tag.payloadSize());
        switch (tag.payloadSize()) {
            case Byte.BYTES -> b.put((byte) value);
            case Short.BYTES -> b.putShort((short) value);
            case Integer.BYTES -> b.putInt((int) value);
            default -> b.putLong(value);
        }
        return b.array();
    }

    /**
     * Encode a value by its runtime type.
     *
     * @return the tagged buffer, or null when the runtime type has no tag
     *         (maps are not tagged values, see the record codec).
     */
    public static byte[] encode(Object value) {
        if (value instanceof String s) return encodeString(s);
        if (value instanceof Boolean b) return encodeBool(b);
        if (value instanceof Byte n) return encodeInteger(n, TypeTag.INT8);
        if (value instanceof Short n) return encodeInteger(n, TypeTag.INT16);
        if (value instanceof Integer n) return encodeInteger(n, TypeTag.INT32);
        if (value instanceof Long n) return encodeInteger(n, TypeTag.INT64);
        if (value instanceof UnsignedValue u) return encodeInteger(u.bits(), u.tag());
        if (value instanceof Instant t) return encodeTime(t);
        if (value instanceof MessageLite m) return encodeMessage(m);
        return null;
    }

    /**
     * @return the tag of a buffer, or null when the buffer is empty or the tag byte is unknown.
     */
    public static TypeTag tagOf(byte[] buffer) {
        if (buffer == null || buffer.length == 0) return null;
        return TypeTag.fromCode(buffer[0]);
    }

    /** Decode a scalar buffer; message buffers need {@link #decode(String, byte[], Class)}. */
    public static Object decode(byte[] buffer) {
        return decode("?", buffer, null);
    }

    /**
     * Decode a tagged buffer.
     *
     * @param field       field name, for diagnostics only
     * @param buffer      non-empty tagged buffer
     * @param messageType target class when the buffer holds a MESSAGE, may be null otherwise
     * @return the decoded value, or null when the tag byte is not recognised
     * @throws SchemaException      a MESSAGE buffer was found but no message type was given
     * @throws ValueFormatException the payload does not match its tag
     */
    public static Object decode(String field, byte[] buffer, Class<? extends MessageLite> messageType) {
        if (buffer == null || buffer.length == 0) {
            throw new IllegalArgumentException("empty tagged buffer for field " + field);
        }
        TypeTag tag = TypeTag.fromCode(buffer[0]);
        if (tag == null) {
            log.log(Level.WARNING, String.format(
                    "unrecognized value tag %d for field %s, value skipped", buffer[0] & 0xFF, field));
            return null;
        }
        ByteBuffer payload = payload(field, tag, buffer);
        return switch (tag) {
            case STRING -> StandardCharsets.UTF_8.decode(payload).toString();
            case BOOL -> decodeBool(field, payload.get());
            case TIME -> decodeTime(field, payload.getLong(), payload.getInt());
            case MESSAGE -> {
                if (messageType == null) {
                    throw new SchemaException("field " + field + " holds a message but no message type is known");
                }
                yield decodeMessage(field, buffer, messageType);
            }
            case INT8, UINT8 -> payload.get();
            case INT16, UINT16 -> payload.getShort();
            case INT32, UINT32 -> payload.getInt();
            case INT64, UINT64 -> payload.getLong();
        };
    }

    public static <M extends MessageLite> M decodeMessage(String field, byte[] buffer, Class<M> messageType) {
        if (tagOf(buffer) != TypeTag.MESSAGE) {
            throw new ValueFormatException("field " + field + " is not a message value");
        }
        MessageLite prototype = Internal.getDefaultInstance(messageType);
        try {
            MessageLite parsed = prototype.getParserForType().parseFrom(buffer, 1, buffer.length - 1);
            return messageType.cast(parsed);
        } catch (InvalidProtocolBufferException e) {
            throw new ValueFormatException(
                    "field %s cannot be parsed as %s".formatted(field, messageType.getName()), e);
        }
    }

    // ----------------- helpers -----------------

    private static ByteBuffer allocate(TypeTag tag, int payloadLength) {
        ByteBuffer b = ByteBuffer.allocate(1 + payloadLength).order(ByteOrder.LITTLE_ENDIAN);
        b.put(tag.code());
        return b;
    }

    private static ByteBuffer payload(String field, TypeTag tag, byte[] buffer) {
        int length = buffer.length - 1;
        if (tag.payloadSize() != 0 && length != tag.payloadSize()) {
            throw new ValueFormatException("field %s: %s payload must be %d bytes, got %d"
                    .formatted(field, tag, tag.payloadSize(), length));
        }
        return ByteBuffer.wrap(buffer, 1, length).order(ByteOrder.LITTLE_ENDIAN);
    }

    private static Boolean decodeBool(String field, byte b) {
        if (b == 0) return Boolean.FALSE;
        if (b == 1) return Boolean.TRUE;
        throw new ValueFormatException("field %s: invalid bool byte %d".formatted(field, b));
    }

    private static Instant decodeTime(String field, long seconds, int nanos) {
        try {
            return Instant.ofEpochSecond(seconds, nanos);
        } catch (DateTimeException | ArithmeticException e) {
            throw new ValueFormatException("field %s: invalid timestamp".formatted(field), e);
        }
    }
}
