package com.visualsearch.crawler.crawl.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.visualsearch.crawler.crawl.model.CrawlPage;
import com.visualsearch.crawler.crawl.model.CrawlPageResult;
import com.visualsearch.crawler.crawl.model.CrawlPageStatus;
import com.visualsearch.crawler.crawl.model.CrawlerConfig;
import com.visualsearch.crawler.crawl.model.CrawlerType;
import com.visualsearch.crawler.crawl.model.ExtractedProduct;
import com.visualsearch.crawler.crawl.model.ExtractedProductStatus;
import com.visualsearch.crawler.crawl.model.ProductCandidate;
import com.visualsearch.crawler.crawl.model.ProviderCrawlSettings;
import com.visualsearch.crawler.crawl.util.CrawlUrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.visualsearch.crawler.crawl.persistence.CrawlJobRepository.nullableInt;
import static com.visualsearch.crawler.crawl.persistence.CrawlJobRepository.toInstant;

/**
 * Pages, extracted product candidates and the provider settings a job runs with.
 */
@Repository
public class CrawlJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(CrawlJdbcRepository.class);
    private static final int MAX_FRONTIER_KEY_LENGTH = 2048;
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public CrawlJdbcRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    public Optional<ProviderCrawlSettings> findProviderSettings(long providerId) {
        List<ProviderCrawlSettings> rows = jdbc.query(
            """
                SELECT id, name, website_url, crawler_type, crawler_config_json
                FROM providers
                WHERE id = :id
                """,
            Map.of("id", providerId),
            (rs, rowNum) -> new ProviderCrawlSettings(
                rs.getLong("id"),
                rs.getString("name"),
                rs.getString("website_url"),
                CrawlerType.fromValue(rs.getString("crawler_type")),
                parseConfig(rs.getLong("id"), rs.getString("crawler_config_json"))
            )
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public void insertPage(long jobId, CrawlPageResult result, Instant fetchedAt) {
        jdbc.update(
            """
                INSERT INTO crawl_pages (
                    crawl_job_id, url, status, http_status_code, content_type, title, content_hash,
                    products_extracted, error_message, fetched_at
                ) VALUES (
                    :jobId, :url, :status, :httpStatusCode, :contentType, :title, :contentHash,
                    :productsExtracted, :errorMessage, :fetchedAt
                )
                """,
            new MapSqlParameterSource()
                .addValue("jobId", jobId)
                .addValue("url", result.url())
                .addValue("status", (result.success() ? CrawlPageStatus.SUCCEEDED : CrawlPageStatus.FAILED).name())
                .addValue("httpStatusCode", result.httpStatusCode())
                .addValue("contentType", truncate(result.contentType(), 255))
                .addValue("title", result.title())
                .addValue("contentHash", result.contentHash())
                .addValue("productsExtracted", result.products().size())
                .addValue("errorMessage", result.error())
                .addValue("fetchedAt", Timestamp.from(fetchedAt))
        );
    }

    public Set<String> findSucceededPageUrls(long jobId) {
        return new HashSet<>(jdbc.queryForList(
            "SELECT url FROM crawl_pages WHERE crawl_job_id = :jobId AND status = 'SUCCEEDED'",
            Map.of("jobId", jobId),
            String.class
        ));
    }

    /**
     * Records links queued by a link-following run. Urls already recorded for the job (by
     * {@link CrawlUrlUtils#dedupeKey}) are skipped.
     */
    public void insertFrontierUrls(long jobId, List<String> urls, Instant discoveredAt) {
        if (urls == null || urls.isEmpty()) {
            return;
        }
        List<MapSqlParameterSource> batch = new ArrayList<>();
        for (String url : urls) {
            String key = CrawlUrlUtils.dedupeKey(url);
            if (key == null || key.isEmpty() || key.length() > MAX_FRONTIER_KEY_LENGTH) {
                log.debug("Not recording frontier url for job {}: {}", jobId, url);
                continue;
            }
            batch.add(new MapSqlParameterSource()
                .addValue("jobId", jobId)
                .addValue("url", url)
                .addValue("urlKey", key)
                .addValue("discoveredAt", Timestamp.from(discoveredAt)));
        }
        if (batch.isEmpty()) {
            return;
        }
        try {
            jdbc.batchUpdate(
                """
                    INSERT INTO crawl_frontier_urls (crawl_job_id, url, url_key, discovered_at)
                    SELECT CAST(:jobId AS BIGINT), :url, :urlKey, CAST(:discoveredAt AS TIMESTAMP WITH TIME ZONE)
                    WHERE NOT EXISTS (
                        SELECT 1 FROM crawl_frontier_urls
                        WHERE crawl_job_id = :jobId AND url_key = :urlKey
                    )
                    """,
                batch.toArray(new MapSqlParameterSource[0])
            );
        } catch (DuplicateKeyException e) {
            log.debug("Frontier urls for job {} were recorded concurrently: {}", jobId, e.getMessage());
        }
    }

    public List<String> findFrontierUrls(long jobId) {
        return jdbc.queryForList(
            "SELECT url FROM crawl_frontier_urls WHERE crawl_job_id = :jobId ORDER BY id",
            Map.of("jobId", jobId),
            String.class
        );
    }

    public List<CrawlPage> findPages(long jobId) {
        return jdbc.query(
            "SELECT * FROM crawl_pages WHERE crawl_job_id = :jobId ORDER BY fetched_at ASC, id ASC",
            Map.of("jobId", jobId),
            this::mapPage
        );
    }

    public List<CrawlPage> findRecentPages(long jobId, int limit) {
        return jdbc.query(
            "SELECT * FROM crawl_pages WHERE crawl_job_id = :jobId ORDER BY fetched_at DESC, id DESC LIMIT :limit",
            new MapSqlParameterSource().addValue("jobId", jobId).addValue("limit", limit),
            this::mapPage
        );
    }

    public void insertExtractedProducts(long jobId, long providerId, List<ProductCandidate> products, Instant createdAt) {
        if (products == null || products.isEmpty()) {
            return;
        }
        List<MapSqlParameterSource> batch = new ArrayList<>();
        for (ProductCandidate product : products) {
            batch.add(new MapSqlParameterSource()
                .addValue("jobId", jobId)
                .addValue("providerId", providerId)
                .addValue("externalId", truncate(product.externalId(), 255))
                .addValue("name", product.name())
                .addValue("description", product.description())
                .addValue("price", product.price())
                .addValue("currency", truncate(product.currency(), 8))
                .addValue("productUrl", product.productUrl())
                .addValue("category", product.category())
                .addValue("imageUrlsJson", writeJson(product.imageUrls()))
                .addValue("rawPayload", product.rawPayload() == null ? "{}" : product.rawPayload())
                .addValue("status", ExtractedProductStatus.PENDING.name())
                .addValue("createdAt", Timestamp.from(createdAt)));
        }
        jdbc.batchUpdate(
            """
                INSERT INTO extracted_products (
                    crawl_job_id, provider_id, external_id, name, description, price, currency, product_url,
                    category, image_urls_json, raw_payload, status, created_at
                ) VALUES (
                    :jobId, :providerId, :externalId, :name, :description, :price, :currency, :productUrl,
                    :category, :imageUrlsJson, :rawPayload, :status, :createdAt
                )
                """,
            batch.toArray(new MapSqlParameterSource[0])
        );
    }

    public List<ExtractedProduct> findExtractedProducts(long jobId) {
        return jdbc.query(
            "SELECT * FROM extracted_products WHERE crawl_job_id = :jobId ORDER BY id ASC",
            Map.of("jobId", jobId),
            this::mapProduct
        );
    }

    private CrawlerConfig parseConfig(long providerId, String json) {
        if (json == null || json.isBlank()) {
            return CrawlerConfig.defaults();
        }
        try {
            CrawlerConfig config = objectMapper.readValue(json, CrawlerConfig.class);
            return config == null ? CrawlerConfig.defaults() : config;
        } catch (JsonProcessingException e) {
            log.warn("Invalid crawler config for provider {}, using defaults: {}", providerId, e.getOriginalMessage());
            return CrawlerConfig.defaults();
        }
    }

    private String writeJson(List<String> values) {
        try {
            return objectMapper.writeValueAsString(values == null ? List.of() : values);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize image urls", e);
        }
    }

    private List<String> readStringList(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            log.debug("Unreadable image url list: {}", e.getOriginalMessage());
            return List.of();
        }
    }

    private CrawlPage mapPage(ResultSet rs, int rowNum) throws SQLException {
        return new CrawlPage(
            rs.getLong("id"),
            rs.getLong("crawl_job_id"),
            rs.getString("url"),
            CrawlPageStatus.valueOf(rs.getString("status")),
            nullableInt(rs, "http_status_code"),
            rs.getString("content_type"),
            rs.getString("title"),
            rs.getString("content_hash"),
            rs.getInt("products_extracted"),
            rs.getString("error_message"),
            toInstant(rs.getTimestamp("fetched_at"))
        );
    }

    private ExtractedProduct mapProduct(ResultSet rs, int rowNum) throws SQLException {
        long jobId = rs.getLong("crawl_job_id");
        Long nullableJobId = rs.wasNull() ? null : jobId;
        long importedId = rs.getLong("imported_product_id");
        Long nullableImportedId = rs.wasNull() ? null : importedId;
        return new ExtractedProduct(
            rs.getLong("id"),
            nullableJobId,
            rs.getLong("provider_id"),
            rs.getString("external_id"),
            rs.getString("name"),
            rs.getString("description"),
            rs.getBigDecimal("price"),
            rs.getString("currency"),
            rs.getString("product_url"),
            rs.getString("category"),
            readStringList(rs.getString("image_urls_json")),
            rs.getString("raw_payload"),
            ExtractedProductStatus.valueOf(rs.getString("status")),
            nullableImportedId,
            toInstant(rs.getTimestamp("reviewed_at")),
            toInstant(rs.getTimestamp("created_at"))
        );
    }

    private static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }
}
