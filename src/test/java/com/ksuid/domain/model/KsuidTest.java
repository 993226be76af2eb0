package com.ksuid.domain.model;

import com.ksuid.domain.error.KsuidError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Ksuid")
class KsuidTest {

    private static final long UNIX_TIME = 1632859955L;
    private static final byte[] PAYLOAD_ONE = payload(1);

    private final Random random = new Random(3);

    @Nested
    @DisplayName("construction")
    class ConstructionTests {

        @Test
        void fromPartsShouldStoreCorrectedTimestampAndPayload() {
            Ksuid id = Ksuid.fromParts(Instant.ofEpochSecond(UNIX_TIME), PAYLOAD_ONE).getOrThrow();

            assertEquals(UNIX_TIME - 1_400_000_000L, id.timestamp());
            assertEquals(Instant.ofEpochSecond(UNIX_TIME), id.time());
            assertArrayEquals(PAYLOAD_ONE, id.payload());
            assertEquals(id, Ksuid.fromBytes(id.toBytes()).getOrThrow());
            assertEquals(id, Ksuid.parse(id.toString()).getOrThrow());
        }

        @Test
        void fromPartsShouldTruncateToSeconds() {
            Instant time = Instant.ofEpochSecond(UNIX_TIME, 999_999_999);
            Ksuid id = Ksuid.fromParts(time, PAYLOAD_ONE).getOrThrow();
            assertEquals(Instant.ofEpochSecond(UNIX_TIME), id.time());
        }

        @Test
        void fromPartsShouldRejectWrongPayloadSize() {
            var result = Ksuid.fromParts(Instant.now(), new byte[15]);
            var error = assertInstanceOf(KsuidError.InvalidPayloadSize.class, result.errorOrNull());
            assertEquals(15, error.actual());
            assertEquals(Ksuid.NIL, Ksuid.fromPartsOrNil(Instant.now(), new byte[17]));
        }

        @Test
        void fromBytesShouldRejectWrongSize() {
            assertInstanceOf(KsuidError.InvalidSize.class, Ksuid.fromBytes(new byte[19]).errorOrNull());
            assertInstanceOf(KsuidError.InvalidSize.class, Ksuid.fromBytes(new byte[21]).errorOrNull());
            assertInstanceOf(KsuidError.InvalidSize.class, Ksuid.fromBytes(null).errorOrNull());
            assertEquals(Ksuid.NIL, Ksuid.fromBytesOrNil(new byte[21]));
        }

        @Test
        void parseShouldRejectWrongLength() {
            assertInstanceOf(KsuidError.InvalidStringSize.class, Ksuid.parse("0".repeat(26)).errorOrNull());
            assertInstanceOf(KsuidError.InvalidStringSize.class, Ksuid.parse("0".repeat(28)).errorOrNull());
            assertInstanceOf(KsuidError.InvalidStringSize.class, Ksuid.parse(null).errorOrNull());
        }

        @Test
        void parseShouldRejectValueAboveMax() {
            var result = Ksuid.parse("aWgEPTl1tmebfsQzFP4bxwgy80W");
            var error = assertInstanceOf(KsuidError.InvalidStringValue.class, result.errorOrNull());
            assertEquals("KSUID_INVALID_STRING_VALUE", error.code());
        }

        @Test
        void parseShouldRejectCharacterOutsideAlphabet() {
            var result = Ksuid.parse("0ujtsYcgvSTl8PAuAdqWYSMnLO+");
            assertInstanceOf(KsuidError.InvalidStringValue.class, result.errorOrNull());
            assertTrue(result.errorOrNull().message().contains("'+'"));
        }

        @Test
        void parseOrNilShouldDropError() {
            assertEquals(Ksuid.NIL, Ksuid.parseOrNil("not a ksuid"));
            assertEquals(Ksuid.MAX, Ksuid.parseOrNil(Ksuid.MAX_STRING_ENCODED));
        }

        @Test
        void parseShouldRoundTripKnownValue() {
            String value = "0ujtsYcgvSTl8PAuAdqWYSMnLOv";
            Ksuid id = Ksuid.parse(value).getOrThrow();
            assertEquals(value, id.toString());
            assertEquals(107608047L, id.timestamp());
        }
    }

    @Nested
    @DisplayName("sentinels")
    class SentinelTests {

        @Test
        void nilShouldBeAllZero() {
            assertArrayEquals(new byte[20], Ksuid.NIL.toBytes());
            assertEquals(Ksuid.MIN_STRING_ENCODED, Ksuid.NIL.toString());
            assertTrue(Ksuid.NIL.isNil());
            assertEquals(0L, Ksuid.NIL.timestamp());
            assertEquals(Instant.ofEpochSecond(Ksuid.EPOCH_SECONDS), Ksuid.NIL.time());
        }

        @Test
        void maxShouldBeAllOnes() {
            byte[] ones = new byte[20];
            Arrays.fill(ones, (byte) 0xFF);
            assertArrayEquals(ones, Ksuid.MAX.toBytes());
            assertEquals(Ksuid.MAX_STRING_ENCODED, Ksuid.MAX.toString());
            assertFalse(Ksuid.MAX.isNil());
            assertEquals(0xFFFF_FFFFL, Ksuid.MAX.timestamp());
        }
    }

    @Nested
    @DisplayName("next and prev")
    class AdjacencyTests {

        @Test
        void nextOfNilShouldHavePayloadOne() {
            Ksuid next = Ksuid.NIL.next();
            assertEquals(0L, next.timestamp());
            assertArrayEquals(PAYLOAD_ONE, next.payload());
        }

        @Test
        void nextShouldCarryIntoTimestamp() {
            byte[] ones = new byte[16];
            Arrays.fill(ones, (byte) 0xFF);
            Ksuid id = Ksuid.fromParts(Instant.ofEpochSecond(UNIX_TIME), ones).getOrThrow();

            Ksuid next = id.next();

            assertEquals(id.timestamp() + 1, next.timestamp());
            assertArrayEquals(new byte[16], next.payload());
            assertEquals(id, next.prev());
        }

        @Test
        void prevShouldBorrowFromTimestamp() {
            Ksuid id = Ksuid.fromParts(Instant.ofEpochSecond(UNIX_TIME), new byte[16]).getOrThrow();

            Ksuid prev = id.prev();

            byte[] ones = new byte[16];
            Arrays.fill(ones, (byte) 0xFF);
            assertEquals(id.timestamp() - 1, prev.timestamp());
            assertArrayEquals(ones, prev.payload());
        }

        @Test
        void nextShouldCarryAcrossPayloadHalves() {
            byte[] payload = new byte[16];
            Arrays.fill(payload, 8, 16, (byte) 0xFF);
            Ksuid id = Ksuid.fromParts(Instant.ofEpochSecond(UNIX_TIME), payload).getOrThrow();

            byte[] expected = new byte[16];
            expected[7] = 1;
            assertArrayEquals(expected, id.next().payload());
            assertEquals(id.timestamp(), id.next().timestamp());
        }

        @Test
        void nextAndPrevShouldBeInverse() {
            for (int i = 0; i < 500; i++) {
                Ksuid id = random();
                assertEquals(id, id.next().prev());
                assertEquals(id, id.prev().next());
                assertTrue(id.compareTo(id.next()) < 0);
                assertTrue(id.compareTo(id.prev()) > 0);
            }
        }

        @Test
        void sentinelsShouldWrapAround() {
            assertEquals(Ksuid.NIL, Ksuid.MAX.next());
            assertEquals(Ksuid.MAX, Ksuid.NIL.prev());
        }

        @Test
        void nextShouldNotMutateOriginal() {
            Ksuid id = random();
            String before = id.toString();
            id.next();
            id.prev();
            assertEquals(before, id.toString());
        }
    }

    @Nested
    @DisplayName("value semantics")
    class ValueTests {

        @Test
        void shouldBeEqualForSameBytes() {
            Ksuid a = random();
            Ksuid b = Ksuid.fromBytes(a.toBytes()).getOrThrow();
            assertEquals(a, b);
            assertEquals(a.hashCode(), b.hashCode());
            assertEquals(0, a.compareTo(b));
        }

        @Test
        void shouldNotExposeInternalBytes() {
            Ksuid id = random();
            String before = id.toString();

            id.toBytes()[0] ^= 0x7F;
            id.payload()[0] ^= 0x7F;

            assertEquals(before, id.toString());
        }

        @Test
        void shouldCopyInputBytes() {
            byte[] bytes = random().toBytes();
            Ksuid id = Ksuid.fromBytes(bytes).getOrThrow();
            String before = id.toString();

            bytes[5] ^= 0x7F;

            assertEquals(before, id.toString());
        }

        @Test
        void shouldRoundTripThroughTextAndBinary() {
            for (int i = 0; i < 200; i++) {
                Ksuid id = random();
                assertEquals(id, Ksuid.parse(id.toString()).getOrThrow());
                assertEquals(id, Ksuid.fromBytes(id.toBytes()).getOrThrow());
                assertEquals(27, id.toString().length());
            }
        }

        @Test
        void orderingShouldFollowTimestampFirst() {
            Ksuid earlier = Ksuid.fromParts(Instant.ofEpochSecond(UNIX_TIME), filledPayload(0xFF)).getOrThrow();
            Ksuid later = Ksuid.fromParts(Instant.ofEpochSecond(UNIX_TIME + 1), new byte[16]).getOrThrow();

            assertTrue(earlier.compareTo(later) < 0);
            assertTrue(earlier.toString().compareTo(later.toString()) < 0);
        }
    }

    private Ksuid random() {
        byte[] bytes = new byte[20];
        random.nextBytes(bytes);
        return Ksuid.fromBytes(bytes).getOrThrow();
    }

    private static byte[] payload(int lastByte) {
        byte[] payload = new byte[16];
        payload[15] = (byte) lastByte;
        return payload;
    }

    private static byte[] filledPayload(int value) {
        byte[] payload = new byte[16];
        Arrays.fill(payload, (byte) value);
        return payload;
    }
}
