package com.expense.audit.normalize;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Optional;

/**
 * Parses dates against an ordered list of formats. The first format that parses wins,
 * so list order decides ambiguous inputs such as {@code 03/04/2024}.
 */
public final class DateParser {

    public static final List<String> DEFAULT_PATTERNS = List.of("uuuu-M-d", "M/d/uuuu", "uuuu/M/d");

    private static final DateParser DEFAULT = new DateParser(DEFAULT_PATTERNS);

    private final List<DateTimeFormatter> formatters;

    public DateParser(List<String> patterns) {
        this.formatters = patterns.stream()
                .map(p -> DateTimeFormatter.ofPattern(p).withResolverStyle(ResolverStyle.STRICT))
                .toList();
    }

    public static DateParser defaults() {
        return DEFAULT;
    }

    public Optional<LocalDate> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String s = value.strip();
        if (s.isEmpty()) {
            return Optional.empty();
        }
        for (DateTimeFormatter formatter : formatters) {
            Optional<LocalDate> parsed = tryParse(s, formatter);
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return Optional.empty();
    }

    private static Optional<LocalDate> tryParse(String value, DateTimeFormatter formatter) {
        try {
            return Optional.of(LocalDate.parse(value, formatter));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
