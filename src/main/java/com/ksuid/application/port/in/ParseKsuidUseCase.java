package com.ksuid.application.port.in;

import com.ksuid.domain.error.KsuidError;
import com.ksuid.domain.model.Ksuid;
import com.ksuid.domain.model.Result;

public interface ParseKsuidUseCase {
    Result<Ksuid, KsuidError> parse(String value);
}
