package com.visualsearch.crawler.crawl.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * A product read from one page, before it is stored for review.
 * {@code productUrl} is null when the page did not name one explicitly.
 */
public record ProductCandidate(
    String externalId,
    String name,
    String description,
    BigDecimal price,
    String currency,
    String productUrl,
    String category,
    List<String> imageUrls,
    String rawPayload
) {
    public ProductCandidate {
        imageUrls = imageUrls == null ? List.of() : List.copyOf(imageUrls);
    }

    public ProductCandidate withProductUrl(String url) {
        return new ProductCandidate(externalId, name, description, price, currency, url, category, imageUrls, rawPayload);
    }
}
