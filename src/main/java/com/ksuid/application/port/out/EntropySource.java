package com.ksuid.application.port.out;

import java.io.IOException;

/**
 * Source of random bytes for KSUID payloads. Follows the {@link java.io.InputStream#read(byte[], int, int)}
 * contract: returns the number of bytes read, possibly fewer than requested, or -1 once exhausted.
 */
@FunctionalInterface
public interface EntropySource {

    int read(byte[] buffer, int offset, int length) throws IOException;
}
