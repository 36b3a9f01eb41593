package io.regstore.core;

import com.google.protobuf.StringValue;
import com.google.protobuf.Timestamp;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TaggedValueCodecTest {

    @Test
    void integers_round_trip_at_zero_max_and_min() {
        for (long v : new long[]{0, Byte.MAX_VALUE, Byte.MIN_VALUE}) {
            assertEquals((byte) v, TaggedValueCodec.decode(TaggedValueCodec.encode((byte) v)));
        }
        for (long v : new long[]{0, Short.MAX_VALUE, Short.MIN_VALUE}) {
            assertEquals((short) v, TaggedValueCodec.decode(TaggedValueCodec.encode((short) v)));
        }
        for (long v : new long[]{0, Integer.MAX_VALUE, Integer.MIN_VALUE}) {
            assertEquals((int) v, TaggedValueCodec.decode(TaggedValueCodec.encode((int) v)));
        }
        for (long v : new long[]{0, Long.MAX_VALUE, Long.MIN_VALUE}) {
            assertEquals(v, TaggedValueCodec.decode(TaggedValueCodec.encode(v)));
        }
    }

    @Test
    void unsigned_values_keep_their_tag_and_bit_pattern() {
        byte[] u8 = TaggedValueCodec.encode(UnsignedValue.uint8(255));
        assertEquals(TypeTag.UINT8, TaggedValueCodec.tagOf(u8));
        assertEquals((byte) -1, TaggedValueCodec.decode(u8));

        byte[] u32 = TaggedValueCodec.encode(UnsignedValue.uint32(0xFFFF_FFFFL));
        assertEquals(TypeTag.UINT32, TaggedValueCodec.tagOf(u32));
        assertEquals(0xFFFF_FFFFL, Integer.toUnsignedLong((Integer) TaggedValueCodec.decode(u32)));

        byte[] u64 = TaggedValueCodec.encode(UnsignedValue.uint64(-1L));
        assertEquals(TypeTag.UINT64, TaggedValueCodec.tagOf(u64));
        assertEquals("18446744073709551615", Long.toUnsignedString((Long) TaggedValueCodec.decode(u64)));

        assertNotEquals(TaggedValueCodec.tagOf(TaggedValueCodec.encode(0)),
                TaggedValueCodec.tagOf(TaggedValueCodec.encode(UnsignedValue.uint32(0))));
    }

    @Test
    void unsigned_value_rejects_values_wider_than_its_tag() {
        assertThrows(IllegalArgumentException.class, () -> UnsignedValue.uint8(256));
        assertThrows(IllegalArgumentException.class, () -> UnsignedValue.uint16(-1));
        assertThrows(IllegalArgumentException.class, () -> new UnsignedValue(1, TypeTag.INT32));
    }

    @Test
    void strings_bools_and_times_round_trip() {
        assertEquals("", TaggedValueCodec.decode(TaggedValueCodec.encode("")));
        assertEquals("héllo", TaggedValueCodec.decode(TaggedValueCodec.encode("héllo")));
        assertEquals(Boolean.TRUE, TaggedValueCodec.decode(TaggedValueCodec.encode(true)));
        assertEquals(Boolean.FALSE, TaggedValueCodec.decode(TaggedValueCodec.encode(false)));

        Instant t = Instant.parse("2021-01-02T15:04:05.123456789Z");
        assertEquals(t, TaggedValueCodec.decode(TaggedValueCodec.encode(t)));
        assertEquals(Instant.EPOCH, TaggedValueCodec.decode(TaggedValueCodec.encode(Instant.EPOCH)));
        Instant before = Instant.ofEpochSecond(-1, 500);
        assertEquals(before, TaggedValueCodec.decode(TaggedValueCodec.encode(before)));
    }

    @Test
    void first_byte_is_the_tag_and_payload_is_little_endian() {
        byte[] b = TaggedValueCodec.encode(0x01020304);
        assertEquals(5, b.length);
        assertEquals(0x07, b[0]);
        assertEquals(0x04, b[1]);
        assertEquals(0x01, b[4]);

        byte[] s = TaggedValueCodec.encode("ab");
        assertEquals(0x01, s[0]);
        assertEquals("ab", new String(s, 1, 2, StandardCharsets.UTF_8));
    }

    @Test
    void messages_decode_with_the_destination_type() {
        StringValue msg = StringValue.of("payload");
        byte[] b = TaggedValueCodec.encode(msg);
        assertEquals(TypeTag.MESSAGE, TaggedValueCodec.tagOf(b));
        assertEquals(msg, TaggedValueCodec.decode("m", b, StringValue.class));
        assertEquals(StringValue.getDefaultInstance(),
                TaggedValueCodec.decode("m", TaggedValueCodec.encode(StringValue.getDefaultInstance()), StringValue.class));

        SchemaException e = assertThrows(SchemaException.class, () -> TaggedValueCodec.decode(b));
        assertTrue(e.getMessage().contains("message"));
    }

    @Test
    void undecodable_message_is_a_format_error() {
        byte[] garbage = {TypeTag.MESSAGE.code(), (byte) 0xFF, (byte) 0xFF};
        assertThrows(ValueFormatException.class, () -> TaggedValueCodec.decode("m", garbage, Timestamp.class));
    }

    @Test
    void unknown_tag_reads_as_no_value() {
        assertNull(TaggedValueCodec.tagOf(new byte[]{0x7F, 1, 2}));
        assertNull(TaggedValueCodec.decode(new byte[]{0x7F, 1, 2}));
        assertNull(TaggedValueCodec.decode(new byte[]{0x00}));
    }

    @Test
    void wrong_payload_length_is_a_format_error() {
        byte[] shortInt = ByteBuffer.allocate(3).order(ByteOrder.LITTLE_ENDIAN)
                .put(TypeTag.INT32.code()).putShort((short) 1).array();
        assertThrows(ValueFormatException.class, () -> TaggedValueCodec.decode(shortInt));
        assertThrows(ValueFormatException.class, () -> TaggedValueCodec.decode(new byte[]{TypeTag.BOOL.code()}));
        assertThrows(ValueFormatException.class, () -> TaggedValueCodec.decode(new byte[]{TypeTag.BOOL.code(), 2}));
        assertThrows(IllegalArgumentException.class, () -> TaggedValueCodec.decode(new byte[0]));
    }

    @Test
    void unsupported_runtime_types_have_no_encoding() {
        assertNull(TaggedValueCodec.encode(3.5d));
        assertNull(TaggedValueCodec.encode(new Object()));
        assertNull(TaggedValueCodec.encode(null));
    }
}
