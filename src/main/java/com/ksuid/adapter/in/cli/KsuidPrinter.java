package com.ksuid.adapter.in.cli;

import com.ksuid.domain.model.Ksuid;

import java.io.PrintStream;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.HexFormat;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Writes one KSUID in a chosen {@link OutputFormat}.
 * Templates use {@code {{.Field}}} placeholders over String, Raw, Time, Timestamp and Payload.
 */
final class KsuidPrinter {

    static final Set<String> TEMPLATE_FIELDS = Set.of("String", "Raw", "Time", "Timestamp", "Payload");

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*\\.(\\w+)\\s*}}");
    private static final HexFormat HEX = HexFormat.of().withUpperCase();
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss Z z");

    private static final String INSPECT_FORMAT = """

        REPRESENTATION:

          String: %s
             Raw: %s

        COMPONENTS:

               Time: %s
          Timestamp: %d
            Payload: %s

        """;

    private final OutputFormat format;
    private final String template;
    private final ZoneId zone;

    KsuidPrinter(OutputFormat format, String template, ZoneId zone) {
        this.format = format;
        this.template = template;
        this.zone = zone;
    }

    /**
     * First placeholder in {@code template} that does not name a known field.
     */
    static Optional<String> unknownTemplateField(String template) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        while (matcher.find()) {
            if (!TEMPLATE_FIELDS.contains(matcher.group(1))) {
                return Optional.of(matcher.group(1));
            }
        }
        return Optional.empty();
    }

    void print(Ksuid id, PrintStream out) {
        switch (format) {
            case STRING -> out.println(id);
            case INSPECT -> out.print(INSPECT_FORMAT.formatted(
                id, HEX.formatHex(id.toBytes()), time(id), id.timestamp(), HEX.formatHex(id.payload())));
            case TIME -> out.println(time(id));
            case TIMESTAMP -> out.println(id.timestamp());
            case PAYLOAD -> out.write(id.payload(), 0, Ksuid.PAYLOAD_LENGTH);
            case RAW -> out.write(id.toBytes(), 0, Ksuid.BYTE_LENGTH);
            case TEMPLATE -> out.println(render(id));
        }
    }

    String render(Ksuid id) {
        return PLACEHOLDER.matcher(template)
            .replaceAll(match -> Matcher.quoteReplacement(field(id, match.group(1))));
    }

    private String field(Ksuid id, String name) {
        return switch (name) {
            case "String" -> id.toString();
            case "Raw" -> HEX.formatHex(id.toBytes());
            case "Time" -> time(id);
            case "Timestamp" -> Long.toString(id.timestamp());
            case "Payload" -> HEX.formatHex(id.payload());
            default -> throw new IllegalArgumentException("Unknown template field: ." + name);
        };
    }

    private String time(Ksuid id) {
        return TIME_FORMAT.format(id.time().atZone(zone));
    }
}
