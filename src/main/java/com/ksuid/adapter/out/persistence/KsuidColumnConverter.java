package com.ksuid.adapter.out.persistence;

import com.ksuid.domain.error.KsuidError;
import com.ksuid.domain.model.Ksuid;
import com.ksuid.domain.model.Result;

import java.nio.charset.StandardCharsets;

/**
 * Converts KSUIDs to and from JDBC column values.
 * <p>
 * Nil is stored as SQL {@code NULL}; any other id as its string form. Reading accepts
 * {@code NULL}, binary (20 bytes) and text (27 characters) columns, and maps an empty value to Nil.
 */
public final class KsuidColumnConverter {

    private KsuidColumnConverter() {
    }

    public static Object toDatabaseValue(Ksuid id) {
        if (id == null || id.isNil()) {
            return null;
        }
        return id.toString();
    }

    public static Result<Ksuid, KsuidError> scan(Object source) {
        if (source == null) {
            return Result.success(Ksuid.NIL);
        }
        if (source instanceof byte[] bytes) {
            return scanBytes(bytes);
        }
        if (source instanceof String text) {
            return scanBytes(text.getBytes(StandardCharsets.UTF_8));
        }
        return Result.failure(new KsuidError.UnsupportedScanType(source.getClass().getName()));
    }

    private static Result<Ksuid, KsuidError> scanBytes(byte[] bytes) {
        return switch (bytes.length) {
            case 0 -> Result.success(Ksuid.NIL);
            case Ksuid.BYTE_LENGTH -> Ksuid.fromBytes(bytes);
            case Ksuid.STRING_LENGTH -> Ksuid.parse(new String(bytes, StandardCharsets.US_ASCII));
            default -> Result.failure(new KsuidError.InvalidSize(bytes.length));
        };
    }
}
