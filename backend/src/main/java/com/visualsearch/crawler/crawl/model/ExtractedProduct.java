package com.visualsearch.crawler.crawl.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

public record ExtractedProduct(
    long id,
    Long jobId,
    long providerId,
    String externalId,
    String name,
    String description,
    BigDecimal price,
    String currency,
    String productUrl,
    String category,
    List<String> imageUrls,
    String rawPayload,
    ExtractedProductStatus status,
    Long importedProductId,
    Instant reviewedAt,
    Instant createdAt
) {
}
