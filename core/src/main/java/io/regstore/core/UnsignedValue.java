// file: core/src/main/java/io/regstore/core/UnsignedValue.java
package io.regstore.core;

import java.util.Objects;

/**
 * Runtime carrier for an unsigned integer of a given width.
 * <p>
 * Java has no unsigned primitives, so a property map handed to a partial update cannot
 * tell an unsigned 32-bit value from a signed one by its runtime type alone. Wrap the
 * value in an UnsignedValue to have it stored under the matching UINT tag.
 * <p>
 * Invariants:
 *  - tag is one of UINT8, UINT16, UINT32, UINT64.
 *  - bits fit in the width of the tag (interpreted as unsigned).
 */
public record UnsignedValue(long bits, TypeTag tag) {

    public UnsignedValue {
        Objects.requireNonNull(tag, "tag");
        if (!tag.isUnsignedInteger()) {
            throw new IllegalArgumentException("not an unsigned tag: " + tag);
        }
        if (tag != TypeTag.UINT64 && (bits >>> (tag.payloadSize() * 8)) != 0) {
            throw new IllegalArgumentException(
                    "value %s does not fit in %s".formatted(Long.toUnsignedString(bits), tag));
        }
    }

    public static UnsignedValue uint8(int value) { return new UnsignedValue(value, TypeTag.UINT8); }

    public static UnsignedValue uint16(int value) { return new UnsignedValue(value, TypeTag.UINT16); }

    public static UnsignedValue uint32(long value) { return new UnsignedValue(value, TypeTag.UINT32); }

    public static UnsignedValue uint64(long bits) { return new UnsignedValue(bits, TypeTag.UINT64); }

    @Override
    public String toString() {
        return tag + "(" + Long.toUnsignedString(bits) + ")";
    }
}
