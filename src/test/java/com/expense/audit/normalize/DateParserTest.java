package com.expense.audit.normalize;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DateParserTest {

    private final DateParser parser = DateParser.defaults();

    @Test
    void parse_defaultFormats() {
        assertThat(parser.parse("2024-01-06")).contains(LocalDate.of(2024, 1, 6));
        assertThat(parser.parse("01/06/2024")).contains(LocalDate.of(2024, 1, 6));
        assertThat(parser.parse("2024/01/06")).contains(LocalDate.of(2024, 1, 6));
    }

    @Test
    void parse_trimsWhitespace() {
        assertThat(parser.parse("  2024-02-29 ")).contains(LocalDate.of(2024, 2, 29));
    }

    @Test
    void parse_emptyOrInvalid_returnsEmpty() {
        assertThat(parser.parse(null)).isEmpty();
        assertThat(parser.parse("   ")).isEmpty();
        assertThat(parser.parse("yesterday")).isEmpty();
        assertThat(parser.parse("2023-02-29")).isEmpty();
        assertThat(parser.parse("13/01/2024")).isEmpty();
    }

    @Test
    void parse_ambiguousInput_resolvedByFormatOrder() {
        DateParser usFirst = new DateParser(List.of("MM/dd/uuuu", "dd/MM/uuuu"));
        DateParser euFirst = new DateParser(List.of("dd/MM/uuuu", "MM/dd/uuuu"));

        assertThat(usFirst.parse("03/04/2024")).contains(LocalDate.of(2024, 3, 4));
        assertThat(euFirst.parse("03/04/2024")).contains(LocalDate.of(2024, 4, 3));
    }

    @Test
    void parse_fallsThroughToLaterFormat() {
        DateParser euFirst = new DateParser(List.of("dd/MM/uuuu", "MM/dd/uuuu"));

        assertThat(euFirst.parse("25/12/2024")).contains(LocalDate.of(2024, 12, 25));
        // 25 cannot be a month, so the first format rejects it
        assertThat(euFirst.parse("12/25/2024")).contains(LocalDate.of(2024, 12, 25));
    }
}
