package io.regstore.storage;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class BucketKeysTest {

    @Test
    void segment_escapes_zero_bytes_and_decodes_back() {
        byte[] key = BucketKeys.child(new byte[0], "a\u0000b");
        assertArrayEquals(new byte[]{'a', 0x00, (byte) 0xFF, 'b', 0x00, 0x01}, key);
        assertEquals("a\u0000b", BucketKeys.lastSegment(key, 0));
    }

    @Test
    void unpaired_surrogates_do_not_collide_with_question_mark() {
        assertThrows(IllegalArgumentException.class, () -> BucketKeys.segment("\uD800"));
        assertThrows(IllegalArgumentException.class, () -> BucketKeys.child(new byte[0], "a\uDC00b"));
        assertEquals("\uD83D\uDE00", BucketKeys.lastSegment(BucketKeys.child(new byte[0], "\uD83D\uDE00"), 0));
        assertArrayEquals(new byte[]{'?', 0x00, 0x01}, BucketKeys.segment("?"));
    }

    @Test
    void deeper_keys_are_not_direct_children() {
        byte[] parent = BucketKeys.child(new byte[0], "svc");
        byte[] child = BucketKeys.child(parent, "a");
        byte[] grandchild = BucketKeys.child(child, "tags");
        assertEquals("a", BucketKeys.lastSegment(child, parent.length));
        assertNull(BucketKeys.lastSegment(grandchild, parent.length));
        assertNull(BucketKeys.lastSegment(parent, parent.length));
    }

    @Test
    void sibling_order_follows_name_bytes() {
        byte[] root = new byte[0];
        String[] names = {"b", "a", "ab", "a\u0000", "B", "é"};
        byte[][] keys = new byte[names.length][];
        for (int i = 0; i < names.length; i++) keys[i] = BucketKeys.child(root, names[i]);
        Arrays.sort(keys, Arrays::compareUnsigned);
        String[] sorted = names.clone();
        Arrays.sort(sorted, (x, y) -> Arrays.compareUnsigned(
                x.getBytes(StandardCharsets.UTF_8), y.getBytes(StandardCharsets.UTF_8)));
        for (int i = 0; i < names.length; i++) {
            assertEquals(sorted[i], BucketKeys.lastSegment(keys[i], 0));
        }
    }

    @Test
    void descendants_sort_below_upper_bound_and_siblings_above() {
        byte[] a = BucketKeys.child(new byte[0], "a");
        byte[] bound = BucketKeys.upperBound(a);
        byte[] descendant = BucketKeys.child(BucketKeys.child(a, "x"), "y");
        byte[] sibling = BucketKeys.child(new byte[0], "a\u0000");
        assertTrue(Arrays.compareUnsigned(descendant, bound) < 0);
        assertTrue(Arrays.compareUnsigned(sibling, bound) > 0);
        assertTrue(BucketKeys.hasPrefix(descendant, a));
    }

    @Test
    void value_marker_distinguishes_values_from_buckets() {
        byte[] stored = BucketKeys.wrapValue(new byte[]{7});
        assertTrue(BucketKeys.isValue(stored));
        assertFalse(BucketKeys.isBucket(stored));
        assertArrayEquals(new byte[]{7}, BucketKeys.unwrapValue(stored));
        assertTrue(BucketKeys.isBucket(BucketKeys.bucketHeader()));
        assertFalse(BucketKeys.isValue(null));
    }
}
