// file: storage/src/main/java/io/regstore/storage/BucketKeys.java
package io.regstore.storage;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Flattens the bucket hierarchy onto the engine's single ordered key space.
 * <p>
 * Key layout for an entry {@code name} inside bucket path {@code p1 / p2 / ... / pk}:
 * <p>
 *   enc(p1) enc(p2) ... enc(pk) enc(name)
 * <p>
 * where enc(s) is the UTF-8 bytes of s with every 0x00 written as 0x00 0xFF, followed
 * by the terminator 0x00 0x01. The encoding is prefix-free and keeps siblings in
 * lexicographic order of their name bytes.
 * <p>
 * Stored value layout:
 *   [MARKER (1 byte)] 0x00 = nested bucket header, 0x01 = plain value
 *   [VALUE  (n bytes)] plain values only
 * <p>
 * UTF-8 never produces 0xFF, so no encoded segment starts with 0xFF and every descendant
 * of a bucket key K sorts strictly below K + 0xFF.
 */
final class BucketKeys {
    static final byte BUCKET_MARKER = 0x00;
    static final byte VALUE_MARKER = 0x01;

    private static final byte ESCAPE = (byte) 0xFF;
    private static final byte TERMINATOR = 0x01;

    private BucketKeys() {
        // utility
    }

    /** Key prefix shared by every entry of a bucket: its own encoded path. */
    static byte[] child(byte[] bucketPrefix, String name) {
        byte[] seg = segment(name);
        byte[] out = Arrays.copyOf(bucketPrefix, bucketPrefix.length + seg.length);
        System.arraycopy(seg, 0, out, bucketPrefix.length, seg.length);
        return out;
    }

    /**
     * Encode one path segment including its terminator.
     *
     * @throws IllegalArgumentException if the name is not valid UTF-16 (unpaired surrogate)
     */
    static byte[] segment(String name) {
        byte[] raw = utf8(name);
        ByteArrayOutputStream out = new ByteArrayOutputStream(raw.length + 2);
        for (byte b : raw) {
            out.write(b);
            if (b == 0x00) out.write(ESCAPE);
        }
        out.write(0x00);
        out.write(TERMINATOR);
        return out.toByteArray();
    }

    private static byte[] utf8(String name) {
        CharsetEncoder encoder = StandardCharsets.UTF_8.newEncoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            ByteBuffer encoded = encoder.encode(CharBuffer.wrap(name));
            byte[] out = new byte[encoded.remaining()];
            encoded.get(out);
            return out;
        } catch (CharacterCodingException e) {
            throw new IllegalArgumentException("name is not valid unicode: " + name.length() + " chars", e);
        }
    }

    /**
     * Decode the first segment of {@code key} starting at {@code offset}.
     *
     * @return the decoded name, or null when the key has further segments after it
     *         (i.e. the key belongs to a deeper descendant) or is malformed
     */
    static String lastSegment(byte[] key, int offset) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(key.length - offset);
        int i = offset;
        while (i < key.length) {
            byte b = key[i];
            if (b != 0x00) {
                out.write(b);
                i++;
                continue;
            }
            if (i + 1 >= key.length) return null;
            byte next = key[i + 1];
            if (next == ESCAPE) {
                out.write(0x00);
                i += 2;
            } else if (next == TERMINATOR) {
                return i + 2 == key.length ? out.toString(StandardCharsets.UTF_8) : null;
            } else {
                return null;
            }
        }
        return null;
    }

    /** Smallest key above every descendant of {@code bucketKey}. */
    static byte[] upperBound(byte[] bucketKey) {
        byte[] out = Arrays.copyOf(bucketKey, bucketKey.length + 1);
        out[bucketKey.length] = (byte) 0xFF;
        return out;
    }

    static boolean hasPrefix(byte[] key, byte[] prefix) {
        if (key.length < prefix.length) return false;
        return Arrays.equals(key, 0, prefix.length, prefix, 0, prefix.length);
    }

    static byte[] wrapValue(byte[] value) {
        byte[] out = new byte[value.length + 1];
        out[0] = VALUE_MARKER;
        System.arraycopy(value, 0, out, 1, value.length);
        return out;
    }

    static byte[] unwrapValue(byte[] stored) {
        return Arrays.copyOfRange(stored, 1, stored.length);
    }

    static boolean isBucket(byte[] stored) {
        return stored != null && stored.length > 0 && stored[0] == BUCKET_MARKER;
    }

    static boolean isValue(byte[] stored) {
        return stored != null && stored.length > 0 && stored[0] == VALUE_MARKER;
    }

    static byte[] bucketHeader() {
        return new byte[]{BUCKET_MARKER};
    }
}
