package com.ksuid.domain.model;

/**
 * Unsigned 128-bit integer held as two 64-bit halves. Only what stepping a KSUID payload by
 * one needs: wrapping add and subtract, equality and big-endian byte conversion.
 */
record Uint128(long high, long low) {

    static final Uint128 ZERO = new Uint128(0L, 0L);
    static final Uint128 ONE = new Uint128(0L, 1L);
    static final Uint128 MAX = new Uint128(-1L, -1L);

    static final int BYTES = 16;

    static Uint128 fromHalves(long high, long low) {
        return new Uint128(high, low);
    }

    static Uint128 fromBytes(byte[] src, int offset) {
        return new Uint128(readLong(src, offset), readLong(src, offset + Long.BYTES));
    }

    /**
     * Sum modulo 2^128.
     */
    Uint128 add(Uint128 other) {
        long lo = low + other.low;
        long carry = Long.compareUnsigned(lo, low) < 0 ? 1L : 0L;
        return new Uint128(high + other.high + carry, lo);
    }

    /**
     * Difference modulo 2^128.
     */
    Uint128 subtract(Uint128 other) {
        long lo = low - other.low;
        long borrow = Long.compareUnsigned(low, other.low) < 0 ? 1L : 0L;
        return new Uint128(high - other.high - borrow, lo);
    }

    void writeTo(byte[] dst, int offset) {
        writeLong(dst, offset, high);
        writeLong(dst, offset + Long.BYTES, low);
    }

    byte[] toBytes() {
        byte[] bytes = new byte[BYTES];
        writeTo(bytes, 0);
        return bytes;
    }

    private static long readLong(byte[] src, int offset) {
        long value = 0;
        for (int i = 0; i < Long.BYTES; i++) {
            value = (value << 8) | (src[offset + i] & 0xFFL);
        }
        return value;
    }

    private static void writeLong(byte[] dst, int offset, long value) {
        for (int i = Long.BYTES - 1; i >= 0; i--) {
            dst[offset + i] = (byte) value;
            value >>>= 8;
        }
    }
}
