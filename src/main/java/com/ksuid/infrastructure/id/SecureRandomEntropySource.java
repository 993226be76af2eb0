package com.ksuid.infrastructure.id;

import com.ksuid.application.port.out.EntropySource;

import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;

/**
 * Default entropy source backed by {@link SecureRandom}. Always fills the requested range.
 */
public class SecureRandomEntropySource implements EntropySource {

    private final SecureRandom random;

    public SecureRandomEntropySource(SecureRandom random) {
        this.random = random;
    }

    public static SecureRandomEntropySource create() {
        return new SecureRandomEntropySource(new SecureRandom());
    }

    public static SecureRandomEntropySource forAlgorithm(String algorithm) throws NoSuchAlgorithmException {
        return new SecureRandomEntropySource(SecureRandom.getInstance(algorithm));
    }

    public String algorithm() {
        return random.getAlgorithm();
    }

    @Override
    public int read(byte[] buffer, int offset, int length) {
        if (offset == 0 && length == buffer.length) {
            random.nextBytes(buffer);
            return length;
        }
        byte[] bytes = new byte[length];
        random.nextBytes(bytes);
        System.arraycopy(bytes, 0, buffer, offset, length);
        return length;
    }
}
