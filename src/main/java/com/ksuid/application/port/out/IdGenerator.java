package com.ksuid.application.port.out;

import com.ksuid.domain.error.KsuidError;
import com.ksuid.domain.model.Ksuid;
import com.ksuid.domain.model.Result;

import java.time.Instant;

/**
 * Port for generating KSUIDs.
 * Abstracts the time and entropy sources from application services.
 */
public interface IdGenerator {

    /**
     * Generates a KSUID for the current time.
     * A broken entropy source is treated as fatal; use {@link #generate(Instant)} to handle it.
     */
    Ksuid generate();

    /**
     * Generates a KSUID for the given time, failing with
     * {@link KsuidError.RandomSourceFailure} when the payload cannot be read.
     */
    Result<Ksuid, KsuidError> generate(Instant time);

    default byte[] generateBytes() {
        return generate().toBytes();
    }

    default String generateString() {
        return generate().toString();
    }
}
