package com.ksuid.infrastructure.exception;

import com.ksuid.domain.error.KsuidError;

public class InvalidKsuidException extends BusinessException {

    public InvalidKsuidException(KsuidError error) {
        super(error.code(), error.message());
    }
}
