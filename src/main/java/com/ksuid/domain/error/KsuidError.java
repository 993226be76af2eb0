package com.ksuid.domain.error;

/**
 * Sealed type representing expected failures when building, parsing or generating KSUIDs.
 * These are ordinary return values, not exceptional cases.
 */
public sealed interface KsuidError {

    String message();

    String code();

    record InvalidSize(int actual) implements KsuidError {
        @Override
        public String message() {
            return "valid KSUIDs are 20 bytes (was " + actual + ")";
        }

        @Override
        public String code() {
            return "KSUID_INVALID_SIZE";
        }
    }

    record InvalidStringSize(int actual) implements KsuidError {
        @Override
        public String message() {
            return "valid encoded KSUIDs are 27 characters (was " + actual + ")";
        }

        @Override
        public String code() {
            return "KSUID_INVALID_STRING_SIZE";
        }
    }

    /**
     * Text of the right length that is not a base62 number in the representable range.
     * {@code reason} carries the codec's detail (bad character or out of range).
     */
    record InvalidStringValue(String value, String reason) implements KsuidError {
        @Override
        public String message() {
            return "valid encoded KSUIDs are bounded by 000000000000000000000000000 and "
                + "aWgEPTl1tmebfsQzFP4bxwgy80V: " + reason;
        }

        @Override
        public String code() {
            return "KSUID_INVALID_STRING_VALUE";
        }
    }

    record InvalidPayloadSize(int actual) implements KsuidError {
        @Override
        public String message() {
            return "valid KSUID payloads are 16 bytes (was " + actual + ")";
        }

        @Override
        public String code() {
            return "KSUID_INVALID_PAYLOAD_SIZE";
        }
    }

    record RandomSourceFailure(String detail) implements KsuidError {
        @Override
        public String message() {
            return "unable to read KSUID payload from random source: " + detail;
        }

        @Override
        public String code() {
            return "KSUID_RANDOM_SOURCE_FAILURE";
        }
    }

    // Database driver scans
    record UnsupportedScanType(String typeName) implements KsuidError {
        @Override
        public String message() {
            return "scan: unable to scan type " + typeName + " into KSUID";
        }

        @Override
        public String code() {
            return "KSUID_UNSUPPORTED_SCAN_TYPE";
        }
    }
}
