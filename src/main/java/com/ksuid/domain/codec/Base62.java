package com.ksuid.domain.codec;

import com.ksuid.domain.model.Result;

import java.util.Arrays;

/**
 * Fixed-width base62 codec between a 20-byte big-endian number and a 27-character string.
 * <p>
 * Digits are ordered {@code 0-9A-Za-z}, so the rank of a digit equals its base62 value and
 * comparing two encoded strings gives the same answer as comparing the 160-bit numbers.
 * <p>
 * Instead of dividing byte by byte, the binary side is handled as five 32-bit words and the
 * text side as limbs of five base62 digits (62^5 &lt; 2^30). Every intermediate product then
 * stays below 2^62 and fits a signed {@code long}.
 */
public final class Base62 {

    public static final int ENCODED_LENGTH = 27;
    public static final int DECODED_LENGTH = 20;

    static final String ALPHABET = "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz";

    private static final int RADIX = 62;
    private static final int CHUNK_DIGITS = 5;
    private static final long CHUNK_BASE = 916_132_832L; // 62^5
    private static final int WORDS = DECODED_LENGTH / Integer.BYTES;
    private static final int LIMBS = (ENCODED_LENGTH + CHUNK_DIGITS - 1) / CHUNK_DIGITS;
    private static final long WORD_MASK = 0xFFFF_FFFFL;

    private Base62() {
    }

    /**
     * Why a 27-character string could not be decoded.
     */
    public sealed interface DecodeFailure {

        String reason();

        record InvalidCharacter(char character, int position) implements DecodeFailure {
            @Override
            public String reason() {
                return "invalid base62 character '" + character + "' at position " + position;
            }
        }

        record OutOfRange() implements DecodeFailure {
            public static final OutOfRange INSTANCE = new OutOfRange();

            @Override
            public String reason() {
                return "value does not fit in 160 bits";
            }
        }
    }

    public static String encode(byte[] src) {
        if (src == null || src.length != DECODED_LENGTH) {
            throw new IllegalArgumentException("base62 input must be " + DECODED_LENGTH + " bytes");
        }

        long[] words = new long[WORDS];
        for (int i = 0; i < WORDS; i++) {
            words[i] = readWord(src, i * Integer.BYTES);
        }

        char[] dst = new char[ENCODED_LENGTH];
        int n = ENCODED_LENGTH;
        int start = firstNonZero(words, 0);

        while (start < WORDS) {
            // words /= 62^5, remainder holds the next five digits
            long remainder = 0;
            for (int i = start; i < WORDS; i++) {
                long value = (remainder << 32) | words[i];
                words[i] = value / CHUNK_BASE;
                remainder = value % CHUNK_BASE;
            }
            start = firstNonZero(words, start);

            // 62^27 > 2^160, so anything past the left edge is a zero digit
            for (int d = 0; d < CHUNK_DIGITS && n > 0; d++) {
                dst[--n] = ALPHABET.charAt((int) (remainder % RADIX));
                remainder /= RADIX;
            }
        }

        Arrays.fill(dst, 0, n, ALPHABET.charAt(0));
        return new String(dst);
    }

    public static Result<byte[], DecodeFailure> decode(CharSequence src) {
        if (src == null || src.length() != ENCODED_LENGTH) {
            throw new IllegalArgumentException("base62 input must be " + ENCODED_LENGTH + " characters");
        }

        // 27 digits = a 2-digit leading limb followed by five 5-digit limbs
        long[] limbs = new long[LIMBS];
        int position = 0;
        for (int limb = 0; limb < LIMBS; limb++) {
            int width = limb == 0 ? ENCODED_LENGTH - (LIMBS - 1) * CHUNK_DIGITS : CHUNK_DIGITS;
            long value = 0;
            for (int d = 0; d < width; d++, position++) {
                char c = src.charAt(position);
                int digit = digitValue(c);
                if (digit < 0) {
                    return Result.failure(new DecodeFailure.InvalidCharacter(c, position));
                }
                value = value * RADIX + digit;
            }
            limbs[limb] = value;
        }

        byte[] dst = new byte[DECODED_LENGTH];
        int n = DECODED_LENGTH;
        int start = firstNonZero(limbs, 0);

        while (start < LIMBS) {
            if (n == 0) {
                return Result.failure(DecodeFailure.OutOfRange.INSTANCE);
            }
            // limbs /= 2^32, remainder is the next 32-bit word
            long remainder = 0;
            for (int i = start; i < LIMBS; i++) {
                long value = remainder * CHUNK_BASE + limbs[i];
                limbs[i] = value >>> 32;
                remainder = value & WORD_MASK;
            }
            start = firstNonZero(limbs, start);

            n -= Integer.BYTES;
            writeWord(dst, n, remainder);
        }

        return Result.success(dst);
    }

    static int digitValue(char c) {
        if (c >= '0' && c <= '9') {
            return c - '0';
        }
        if (c >= 'A' && c <= 'Z') {
            return c - 'A' + 10;
        }
        if (c >= 'a' && c <= 'z') {
            return c - 'a' + 36;
        }
        return -1;
    }

    private static int firstNonZero(long[] values, int from) {
        int i = from;
        while (i < values.length && values[i] == 0) {
            i++;
        }
        return i;
    }

    private static long readWord(byte[] src, int offset) {
        return ((src[offset] & 0xFFL) << 24)
            | ((src[offset + 1] & 0xFFL) << 16)
            | ((src[offset + 2] & 0xFFL) << 8)
            | (src[offset + 3] & 0xFFL);
    }

    private static void writeWord(byte[] dst, int offset, long word) {
        dst[offset] = (byte) (word >>> 24);
        dst[offset + 1] = (byte) (word >>> 16);
        dst[offset + 2] = (byte) (word >>> 8);
        dst[offset + 3] = (byte) word;
    }
}
