package com.ksuid.infrastructure.id;

import com.ksuid.application.port.out.EntropySource;
import com.ksuid.application.port.out.IdGenerator;
import com.ksuid.domain.error.KsuidError;
import com.ksuid.domain.model.Ksuid;
import com.ksuid.domain.model.Result;
import com.ksuid.infrastructure.exception.EntropyUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Generates KSUIDs from a clock and a shared entropy source.
 * <p>
 * Reads from the source and the scratch buffer are serialized by one lock, so concurrent
 * callers never interleave partial reads. The same lock guards {@link #setSource}.
 */
@Component
public class KsuidGenerator implements IdGenerator {

    private static final Logger log = LoggerFactory.getLogger(KsuidGenerator.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final byte[] buffer = new byte[Ksuid.PAYLOAD_LENGTH];
    private final EntropySource defaultSource;
    private final Clock clock;

    // guarded by lock
    private EntropySource source;

    public KsuidGenerator(EntropySource defaultSource, Clock clock) {
        this.defaultSource = defaultSource;
        this.clock = clock;
        this.source = defaultSource;
    }

    @Override
    public Ksuid generate() {
        return generate(clock.instant())
            .orElseThrow(error -> new EntropyUnavailableException("Couldn't generate KSUID: " + error.message()));
    }

    @Override
    public Result<Ksuid, KsuidError> generate(Instant time) {
        lock.lock();
        try {
            int read = readFully(source, buffer);
            if (read < buffer.length) {
                log.error("Entropy source returned {} of {} payload bytes", read, buffer.length);
                return Result.failure(new KsuidError.RandomSourceFailure(
                    "short read: " + read + " of " + buffer.length + " bytes"));
            }
            return Ksuid.fromParts(time, buffer);
        } catch (IOException e) {
            log.error("Entropy source failed: {}", e.getMessage(), e);
            return Result.failure(new KsuidError.RandomSourceFailure(String.valueOf(e.getMessage())));
        } finally {
            Arrays.fill(buffer, (byte) 0);
            lock.unlock();
        }
    }

    /**
     * Replaces the entropy source; {@code null} restores the source given at construction.
     * Meant for deterministic test harnesses only.
     */
    public void setSource(EntropySource override) {
        lock.lock();
        try {
            source = override != null ? override : defaultSource;
            log.info("KSUID entropy source set to {}", source == defaultSource ? "default" : override.getClass().getName());
        } finally {
            lock.unlock();
        }
    }

    private static int readFully(EntropySource source, byte[] dst) throws IOException {
        int total = 0;
        while (total < dst.length) {
            int n = source.read(dst, total, dst.length - total);
            if (n <= 0) {
                break;
            }
            total += n;
        }
        return total;
    }
}
