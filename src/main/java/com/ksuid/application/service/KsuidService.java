package com.ksuid.application.service;

import com.ksuid.application.port.in.GenerateKsuidsUseCase;
import com.ksuid.application.port.in.ParseKsuidUseCase;
import com.ksuid.application.port.out.IdGenerator;
import com.ksuid.application.port.out.MetricsPort;
import com.ksuid.domain.error.KsuidError;
import com.ksuid.domain.model.Ksuid;
import com.ksuid.domain.model.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class KsuidService implements GenerateKsuidsUseCase, ParseKsuidUseCase {

    private static final Logger log = LoggerFactory.getLogger(KsuidService.class);

    private final IdGenerator idGenerator;
    private final MetricsPort metrics;

    public KsuidService(IdGenerator idGenerator, MetricsPort metrics) {
        this.idGenerator = idGenerator;
        this.metrics = metrics;
    }

    @Override
    public List<Ksuid> generate(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must not be negative: " + count);
        }
        log.debug("Generating {} KSUIDs", count);

        List<Ksuid> ids = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            ids.add(idGenerator.generate());
        }

        metrics.incrementGenerated(count);
        return ids;
    }

    @Override
    public Result<Ksuid, KsuidError> parse(String value) {
        var result = Ksuid.parse(value);
        if (result.isFailure()) {
            log.warn("Rejected KSUID {}: {}", value, result.errorOrNull().message());
            metrics.incrementParseFailures();
            return result;
        }

        log.debug("Parsed KSUID {}", value);
        metrics.incrementParsed();
        return result;
    }
}
