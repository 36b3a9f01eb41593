// file: core/src/main/java/io/regstore/core/TypeTag.java
package io.regstore.core;

/**
 * Discriminant byte written as the first byte of every tagged value buffer.
 * <p>
 * Signed and unsigned integers get distinct tags per width so that a value read back
 * without a destination type still knows its original bit width and signedness.
 * <p>
 * The byte values are part of the on-disk format and must never be renumbered.
 */
public enum TypeTag {
    STRING((byte) 0x01, 0),
    BOOL((byte) 0x02, 1),
    TIME((byte) 0x03, Long.BYTES + Integer.BYTES),
    MESSAGE((byte) 0x04, 0),
    INT8((byte) 0x05, Byte.BYTES),
    INT16((byte) 0x06, Short.BYTES),
    INT32((byte) 0x07, Integer.BYTES),
    INT64((byte) 0x08, Long.BYTES),
    UINT8((byte) 0x09, Byte.BYTES),
    UINT16((byte) 0x0A, Short.BYTES),
    UINT32((byte) 0x0B, Integer.BYTES),
    UINT64((byte) 0x0C, Long.BYTES);

    private static final TypeTag[] BY_CODE = new TypeTag[256];

    static {
        for (TypeTag t : values()) {
            BY_CODE[t.code & 0xFF] = t;
        }
    }

    private final byte code;
    private final int payloadSize; // 0 = variable length

    TypeTag(byte code, int payloadSize) {
        this.code = code;
        this.payloadSize = payloadSize;
    }

    public byte code() { return code; }

    /** Fixed payload length in bytes, or 0 when the payload is variable-length. */
    public int payloadSize() { return payloadSize; }

    public boolean isSignedInteger() {
        return this == INT8 || this == INT16 || this == INT32 || this == INT64;
    }

    public boolean isUnsignedInteger() {
        return this == UINT8 || this == UINT16 || this == UINT32 || this == UINT64;
    }

    public boolean isInteger() {
        return isSignedInteger() || isUnsignedInteger();
    }

    /**
     * @return the tag for a discriminant byte, or null when the byte is unknown
     *         (e.g. data written by a newer version of the format).
     */
    public static TypeTag fromCode(byte code) {
        return BY_CODE[code & 0xFF];
    }
}
