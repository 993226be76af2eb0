package com.ksuid.infrastructure.config;

import com.ksuid.application.port.out.EntropySource;
import com.ksuid.infrastructure.id.SecureRandomEntropySource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.NoSuchAlgorithmException;
import java.time.Clock;

@Configuration
public class InfrastructureConfig {

    private static final Logger log = LoggerFactory.getLogger(InfrastructureConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public EntropySource entropySource(KsuidProperties properties) {
        String algorithm = properties.getGenerator().getAlgorithm();
        if (algorithm == null || algorithm.isBlank()) {
            SecureRandomEntropySource source = SecureRandomEntropySource.create();
            log.debug("Using default SecureRandom ({}) for KSUID payloads", source.algorithm());
            return source;
        }
        try {
            SecureRandomEntropySource source = SecureRandomEntropySource.forAlgorithm(algorithm);
            log.info("Using SecureRandom algorithm {} for KSUID payloads", algorithm);
            return source;
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Unknown SecureRandom algorithm: " + algorithm, e);
        }
    }

    @Bean
    public ConsoleStreams consoleStreams() {
        return ConsoleStreams.system();
    }
}
