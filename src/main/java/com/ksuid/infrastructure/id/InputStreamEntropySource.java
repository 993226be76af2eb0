package com.ksuid.infrastructure.id;

import com.ksuid.application.port.out.EntropySource;

import java.io.IOException;
import java.io.InputStream;

/**
 * Adapts an {@link InputStream}, e.g. a fixed byte sequence for reproducible ids in tests.
 */
public class InputStreamEntropySource implements EntropySource {

    private final InputStream in;

    public InputStreamEntropySource(InputStream in) {
        this.in = in;
    }

    @Override
    public int read(byte[] buffer, int offset, int length) throws IOException {
        return in.read(buffer, offset, length);
    }
}
