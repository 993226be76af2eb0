package com.ksuid.adapter.in.cli;

import com.ksuid.application.port.in.GenerateKsuidsUseCase;
import com.ksuid.application.port.in.ParseKsuidUseCase;
import com.ksuid.domain.model.Ksuid;
import com.ksuid.infrastructure.config.ConsoleStreams;
import com.ksuid.infrastructure.config.KsuidProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Command line front end. With no positional arguments it generates {@code --n} KSUIDs,
 * otherwise it parses each argument as a KSUID; either way every id is printed in the
 * format chosen with {@code --f}.
 */
@Component
public class KsuidCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(KsuidCommandLineRunner.class);

    static final String USAGE = """
        Usage: ksuid [--n=<count>] [--f=<format>] [--t=<template>] [--v] [ksuid ...]
          --n  Number of KSUIDs to generate when called with no other arguments. (default 1)
          --f  One of string, inspect, time, timestamp, payload, raw, or template. (default "string")
          --t  The template used to format the output, e.g. "{{.String}} {{.Time}}".
          --v  Turn on verbose mode.
        """;

    private final GenerateKsuidsUseCase generateKsuidsUseCase;
    private final ParseKsuidUseCase parseKsuidUseCase;
    private final KsuidProperties properties;
    private final ConsoleStreams console;

    private volatile int exitCode;

    public KsuidCommandLineRunner(
            GenerateKsuidsUseCase generateKsuidsUseCase,
            ParseKsuidUseCase parseKsuidUseCase,
            KsuidProperties properties,
            ConsoleStreams console) {
        this.generateKsuidsUseCase = generateKsuidsUseCase;
        this.parseKsuidUseCase = parseKsuidUseCase;
        this.properties = properties;
        this.console = console;
    }

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(args);
        log.debug("ksuid finished with exit code {}", exitCode);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(ApplicationArguments args) {
        KsuidProperties.Cli defaults = properties.getCli();
        PrintStream out = console.out();
        PrintStream err = console.err();

        String formatName = lastOption(args, "f").orElse(defaults.getFormat());
        Optional<OutputFormat> format = OutputFormat.fromFlag(formatName);
        if (format.isEmpty()) {
            out.println("Bad formatting function: " + formatName);
            return 1;
        }

        String template = lastOption(args, "t").orElse(defaults.getTemplate());
        if (format.get() == OutputFormat.TEMPLATE) {
            Optional<String> unknown = KsuidPrinter.unknownTemplateField(template);
            if (unknown.isPresent()) {
                out.println("Bad template: unknown field ." + unknown.get());
                return 1;
            }
        }

        int count;
        try {
            count = lastOption(args, "n").map(Integer::parseInt).orElse(defaults.getCount());
        } catch (NumberFormatException e) {
            err.println("invalid value for --n: " + e.getMessage());
            err.print(USAGE);
            return 2;
        }
        // a negative count generates nothing
        count = Math.max(count, 0);

        ZoneId zone;
        try {
            zone = defaults.getZone() == null || defaults.getZone().isBlank()
                ? ZoneId.systemDefault()
                : ZoneId.of(defaults.getZone());
        } catch (DateTimeException e) {
            err.println("Bad time zone: " + defaults.getZone());
            return 1;
        }

        boolean verbose = args.containsOption("v")
            ? lastOption(args, "v").map(Boolean::parseBoolean).orElse(true)
            : defaults.isVerbose();

        List<Ksuid> ids;
        List<String> values = args.getNonOptionArgs();
        if (values.isEmpty()) {
            ids = generateKsuidsUseCase.generate(count);
        } else {
            ids = new ArrayList<>(values.size());
            for (String value : values) {
                var result = parseKsuidUseCase.parse(value);
                if (result.isFailure()) {
                    out.printf("Error when parsing \"%s\": %s%n%n", value, result.errorOrNull().message());
                    err.print(USAGE);
                    return 1;
                }
                ids.add(result.getOrThrow());
            }
        }

        KsuidPrinter printer = new KsuidPrinter(format.get(), template, zone);
        for (Ksuid id : ids) {
            if (verbose) {
                out.print(id + ": ");
            }
            printer.print(id, out);
        }
        out.flush();
        return 0;
    }

    private static Optional<String> lastOption(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(values.get(values.size() - 1));
    }
}
