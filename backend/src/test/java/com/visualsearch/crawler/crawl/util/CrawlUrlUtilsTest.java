package com.visualsearch.crawler.crawl.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CrawlUrlUtilsTest {

    @Test
    void canonicalizeDropsQueryAndFragmentAndLowercasesHost() {
        assertThat(CrawlUrlUtils.canonicalize("HTTPS://Shop.Example.com/p/Chair-1?utm=x#reviews"))
            .isEqualTo("https://shop.example.com/p/Chair-1");
        assertThat(CrawlUrlUtils.canonicalize("not a url?x=1")).isEqualTo("not a url");
        assertThat(CrawlUrlUtils.canonicalize(" ")).isNull();
    }

    @Test
    void resolveSkipsNonNavigableHrefs() {
        String base = "https://shop.example.com/catalog/chairs/";
        assertThat(CrawlUrlUtils.resolve(base, "../tables/")).isEqualTo("https://shop.example.com/catalog/tables/");
        assertThat(CrawlUrlUtils.resolve(base, "/p/1")).isEqualTo("https://shop.example.com/p/1");
        assertThat(CrawlUrlUtils.resolve(base, "mailto:sales@example.com")).isNull();
        assertThat(CrawlUrlUtils.resolve(base, "javascript:void(0)")).isNull();
        assertThat(CrawlUrlUtils.resolve(base, "#top")).isNull();
    }

    @Test
    void sameHostIgnoresWwwPrefix() {
        assertThat(CrawlUrlUtils.sameHost("https://www.shop.example.com/a", "https://shop.example.com/b")).isTrue();
        assertThat(CrawlUrlUtils.sameHost("https://shop.example.com/a", "https://cdn.example.com/b")).isFalse();
    }

    @Test
    void siteRootKeepsPort() {
        assertThat(CrawlUrlUtils.siteRoot("https://shop.example.com:8443/p/1?x")).isEqualTo("https://shop.example.com:8443");
        assertThat(CrawlUrlUtils.isHttpUrl("ftp://shop.example.com/file")).isFalse();
    }
}
