package com.visualsearch.crawler.crawl.extract;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class PriceParserTest {

    @Test
    void parsesEuropeanAndUsFormats() {
        assertThat(PriceParser.parse("1.234,56 €")).isEqualByComparingTo(new BigDecimal("1234.56"));
        assertThat(PriceParser.parse("$1,234.56")).isEqualByComparingTo(new BigDecimal("1234.56"));
        assertThat(PriceParser.parse("19,99")).isEqualByComparingTo(new BigDecimal("19.99"));
    }

    @Test
    void treatsAmbiguousSeparatorsAsGrouping() {
        assertThat(PriceParser.parse("1,299")).isEqualByComparingTo(new BigDecimal("1299"));
        assertThat(PriceParser.parse("1.234.567")).isEqualByComparingTo(new BigDecimal("1234567"));
    }

    @Test
    void returnsNullWithoutDigits() {
        assertThat(PriceParser.parse("Call for price")).isNull();
        assertThat(PriceParser.parse(null)).isNull();
    }
}
