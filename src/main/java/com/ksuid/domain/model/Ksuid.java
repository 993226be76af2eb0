package com.ksuid.domain.model;

import com.ksuid.domain.codec.Base62;
import com.ksuid.domain.error.KsuidError;

import java.time.Instant;
import java.util.Arrays;

/**
 * Value Object for a K-Sortable Unique IDentifier.
 * <p>
 * 20 bytes: a big-endian unsigned 32-bit count of seconds since {@link #EPOCH_SECONDS},
 * followed by a 16-byte payload. Byte order, string order and chronological order agree.
 * Instances are immutable; every accessor returning bytes hands out a copy.
 */
public final class Ksuid implements Comparable<Ksuid> {

    /**
     * Unix time of timestamp zero. Pushes the 32-bit rollover out to 2150.
     */
    public static final long EPOCH_SECONDS = 1_400_000_000L;

    public static final int TIMESTAMP_LENGTH = 4;
    public static final int PAYLOAD_LENGTH = 16;
    public static final int BYTE_LENGTH = TIMESTAMP_LENGTH + PAYLOAD_LENGTH;
    public static final int STRING_LENGTH = Base62.ENCODED_LENGTH;

    public static final String MIN_STRING_ENCODED = "000000000000000000000000000";
    public static final String MAX_STRING_ENCODED = "aWgEPTl1tmebfsQzFP4bxwgy80V";

    /**
     * All zero bytes; represents the absence of an id.
     */
    public static final Ksuid NIL = new Ksuid(new byte[BYTE_LENGTH]);

    /**
     * All 0xFF bytes; the largest representable id.
     */
    public static final Ksuid MAX = new Ksuid(filled((byte) 0xFF));

    private final byte[] bytes;

    private Ksuid(byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * Builds a KSUID from a point in time (truncated to the second) and a 16-byte payload.
     */
    public static Result<Ksuid, KsuidError> fromParts(Instant time, byte[] payload) {
        if (payload == null || payload.length != PAYLOAD_LENGTH) {
            return Result.failure(new KsuidError.InvalidPayloadSize(payload == null ? 0 : payload.length));
        }
        byte[] bytes = new byte[BYTE_LENGTH];
        writeTimestamp(bytes, toCorrectedTimestamp(time));
        System.arraycopy(payload, 0, bytes, TIMESTAMP_LENGTH, PAYLOAD_LENGTH);
        return Result.success(new Ksuid(bytes));
    }

    public static Ksuid fromPartsOrNil(Instant time, byte[] payload) {
        return fromParts(time, payload).orElse(NIL);
    }

    public static Result<Ksuid, KsuidError> fromBytes(byte[] bytes) {
        if (bytes == null || bytes.length != BYTE_LENGTH) {
            return Result.failure(new KsuidError.InvalidSize(bytes == null ? 0 : bytes.length));
        }
        return Result.success(new Ksuid(bytes.clone()));
    }

    public static Ksuid fromBytesOrNil(byte[] bytes) {
        return fromBytes(bytes).orElse(NIL);
    }

    /**
     * Parses the 27-character base62 form.
     */
    public static Result<Ksuid, KsuidError> parse(String value) {
        if (value == null || value.length() != STRING_LENGTH) {
            return Result.failure(new KsuidError.InvalidStringSize(value == null ? 0 : value.length()));
        }
        return Base62.decode(value)
            .<KsuidError>mapError(failure -> new KsuidError.InvalidStringValue(value, failure.reason()))
            .map(Ksuid::new);
    }

    public static Ksuid parseOrNil(String value) {
        return parse(value).orElse(NIL);
    }

    /**
     * Unsigned lexicographic comparison of the binary forms, normalised to -1, 0 or 1.
     */
    public static int compare(Ksuid a, Ksuid b) {
        return Integer.signum(Arrays.compareUnsigned(a.bytes, b.bytes));
    }

    /**
     * Seconds since {@link #EPOCH_SECONDS}, as an unsigned 32-bit value.
     */
    public long timestamp() {
        return Integer.toUnsignedLong(readTimestamp());
    }

    public Instant time() {
        return Instant.ofEpochSecond(timestamp() + EPOCH_SECONDS);
    }

    public byte[] payload() {
        return Arrays.copyOfRange(bytes, TIMESTAMP_LENGTH, BYTE_LENGTH);
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    public boolean isNil() {
        return equals(NIL);
    }

    /**
     * The id immediately after this one in byte order. A payload overflow carries into the
     * timestamp; {@link #MAX} wraps around to {@link #NIL}.
     */
    public Ksuid next() {
        long timestamp = timestamp();
        Uint128 payload = payloadValue().add(Uint128.ONE);
        if (payload.equals(Uint128.ZERO)) {
            timestamp++;
        }
        return of((int) timestamp, payload);
    }

    /**
     * The id immediately before this one in byte order. A payload underflow borrows from the
     * timestamp; {@link #NIL} wraps around to {@link #MAX}.
     */
    public Ksuid prev() {
        long timestamp = timestamp();
        Uint128 payload = payloadValue().subtract(Uint128.ONE);
        if (payload.equals(Uint128.MAX)) {
            timestamp--;
        }
        return of((int) timestamp, payload);
    }

    @Override
    public int compareTo(Ksuid other) {
        return compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Ksuid other && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    /**
     * The 27-character base62 form.
     */
    @Override
    public String toString() {
        return Base62.encode(bytes);
    }

    static int toCorrectedTimestamp(Instant time) {
        // wraps like a uint32 outside [EPOCH, EPOCH + 2^32)
        return (int) (time.getEpochSecond() - EPOCH_SECONDS);
    }

    private Uint128 payloadValue() {
        return Uint128.fromBytes(bytes, TIMESTAMP_LENGTH);
    }

    private int readTimestamp() {
        return ((bytes[0] & 0xFF) << 24)
            | ((bytes[1] & 0xFF) << 16)
            | ((bytes[2] & 0xFF) << 8)
            | (bytes[3] & 0xFF);
    }

    private static Ksuid of(int timestamp, Uint128 payload) {
        byte[] bytes = new byte[BYTE_LENGTH];
        writeTimestamp(bytes, timestamp);
        payload.writeTo(bytes, TIMESTAMP_LENGTH);
        return new Ksuid(bytes);
    }

    private static void writeTimestamp(byte[] bytes, int timestamp) {
        bytes[0] = (byte) (timestamp >>> 24);
        bytes[1] = (byte) (timestamp >>> 16);
        bytes[2] = (byte) (timestamp >>> 8);
        bytes[3] = (byte) timestamp;
    }

    private static byte[] filled(byte value) {
        byte[] bytes = new byte[BYTE_LENGTH];
        Arrays.fill(bytes, value);
        return bytes;
    }
}
