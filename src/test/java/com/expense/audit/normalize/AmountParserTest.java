package com.expense.audit.normalize;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class AmountParserTest {

    @Test
    void parse_stripsCurrencySymbolAndThousandsSeparators() {
        assertThat(AmountParser.parse("$1,200.50")).contains(new BigDecimal("1200.50"));
        assertThat(AmountParser.parse("  $ 75 ")).contains(new BigDecimal("75"));
    }

    @Test
    void parse_acceptsNegativeAndExponentForms() {
        assertThat(AmountParser.parse("-12.5")).contains(new BigDecimal("-12.5"));
        assertThat(AmountParser.parse("1e3").map(BigDecimal::intValueExact)).contains(1000);
    }

    @Test
    void parse_emptyOrGarbage_returnsEmpty() {
        assertThat(AmountParser.parse(null)).isEmpty();
        assertThat(AmountParser.parse("")).isEmpty();
        assertThat(AmountParser.parse("$")).isEmpty();
        assertThat(AmountParser.parse("n/a")).isEmpty();
        assertThat(AmountParser.parse("12.3.4")).isEmpty();
    }

    @Test
    void normalize_producesTwoDecimalPlainString() {
        assertThat(AmountParser.normalize("100")).isEqualTo("100.00");
        assertThat(AmountParser.normalize("$100.00")).isEqualTo("100.00");
        assertThat(AmountParser.normalize("1,234.5")).isEqualTo("1234.50");
        assertThat(AmountParser.normalize("1E+7")).isEqualTo("10000000.00");
    }

    @Test
    void normalize_unparseable_isEmptyNotZero() {
        assertThat(AmountParser.normalize("abc")).isEmpty();
        assertThat(AmountParser.normalize(null)).isEmpty();
        assertThat(AmountParser.normalize("0")).isEqualTo("0.00");
    }

    @Test
    @Timeout(5)
    void parse_exponentBeyondDoubleRange_isUnparseable() {
        assertThat(AmountParser.parse("1e2147483647")).isEmpty();
        assertThat(AmountParser.parse("1e99999999")).isEmpty();
        assertThat(AmountParser.parse("-2e308")).isEmpty();
        assertThat(AmountParser.normalize("1e2147483647")).isEmpty();
        assertThat(AmountParser.normalize("1e99999999")).isEmpty();
    }

    @Test
    @Timeout(5)
    void parse_exponentBelowDoubleRange_readsAsZero() {
        assertThat(AmountParser.parse("1e-2147483647")).contains(BigDecimal.ZERO);
        assertThat(AmountParser.normalize("1e-2147483647")).isEqualTo("0.00");
        assertThat(AmountParser.normalize("-5e-400")).isEqualTo("0.00");
    }

    @Test
    void parse_largestDoubleMagnitude_stillAccepted() {
        assertThat(AmountParser.parse("1e308")).isPresent();
        assertThat(AmountParser.parse("1.5e-300")).isPresent();
    }
}
