package com.visualsearch.crawler.crawl.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class UrlPatternFilterTest {

    @Test
    void excludeWinsOverInclude() {
        UrlPatternFilter filter = UrlPatternFilter.of(List.of("/product/"), List.of("/product/archive"));

        assertThat(filter.accepts("https://shop.example.com/Product/chair")).isTrue();
        assertThat(filter.accepts("https://shop.example.com/product/archive/old")).isFalse();
        assertThat(filter.accepts("https://shop.example.com/about")).isFalse();
    }

    @Test
    void invalidPatternsAreIgnored() {
        UrlPatternFilter filter = UrlPatternFilter.of(List.of("["), List.of());

        assertThat(filter.apply(List.of("https://a.example.com/1", "https://a.example.com/2"))).hasSize(2);
    }
}
