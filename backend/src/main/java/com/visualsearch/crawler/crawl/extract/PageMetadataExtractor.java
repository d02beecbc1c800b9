package com.visualsearch.crawler.crawl.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.visualsearch.crawler.crawl.model.ProductCandidate;
import com.visualsearch.crawler.crawl.util.CrawlUrlUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Open Graph fallback for pages that declare themselves as a product page.
 */
public class PageMetadataExtractor {
    private final ObjectMapper objectMapper;

    public PageMetadataExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Optional<ProductCandidate> extract(Document document, String pageUrl) {
        String type = meta(document, "og:type");
        if (type == null) {
            return Optional.empty();
        }
        String normalizedType = type.toLowerCase(Locale.ROOT);
        if (!normalizedType.equals("product") && !normalizedType.equals("og:product")) {
            return Optional.empty();
        }
        String title = meta(document, "og:title");
        if (title == null) {
            return Optional.empty();
        }
        String priceAmount = firstNonNull(meta(document, "product:price:amount"), meta(document, "og:price:amount"));
        BigDecimal price = PriceParser.parse(priceAmount);
        String currency = firstNonNull(meta(document, "product:price:currency"), meta(document, "og:price:currency"));
        if (price != null && currency == null) {
            currency = ProductExtractor.DEFAULT_CURRENCY;
        }
        String url = meta(document, "og:url");
        List<String> images = new ArrayList<>();
        String image = CrawlUrlUtils.resolve(pageUrl, meta(document, "og:image"));
        if (image != null) {
            images.add(image);
        }

        ObjectNode raw = objectMapper.createObjectNode();
        for (Element element : document.select("meta[property^=\"og:\"], meta[property^=\"product:\"]")) {
            raw.put(element.attr("property"), element.attr("content"));
        }
        return Optional.of(new ProductCandidate(
            meta(document, "product:retailer_item_id"),
            title,
            meta(document, "og:description"),
            price,
            currency,
            url == null ? null : CrawlUrlUtils.resolve(pageUrl, url),
            null,
            images,
            write(raw)
        ));
    }

    private String meta(Document document, String property) {
        Element element = document.selectFirst("meta[property=\"" + property + "\"]");
        if (element == null) {
            element = document.selectFirst("meta[name=\"" + property + "\"]");
        }
        if (element == null) {
            return null;
        }
        String content = element.attr("content").trim();
        return content.isEmpty() ? null : content;
    }

    private String write(ObjectNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize page metadata", e);
        }
    }

    private static String firstNonNull(String first, String second) {
        return first != null ? first : second;
    }
}
