package com.ksuid.adapter.in.cli;

import java.util.Arrays;
import java.util.Optional;

public enum OutputFormat {
    STRING("string"),
    INSPECT("inspect"),
    TIME("time"),
    TIMESTAMP("timestamp"),
    PAYLOAD("payload"),
    RAW("raw"),
    TEMPLATE("template");

    private final String flagValue;

    OutputFormat(String flagValue) {
        this.flagValue = flagValue;
    }

    public static Optional<OutputFormat> fromFlag(String value) {
        return Arrays.stream(values())
            .filter(format -> format.flagValue.equals(value))
            .findFirst();
    }
}
