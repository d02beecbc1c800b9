package com.visualsearch.crawler.crawl.persistence;

import com.visualsearch.crawler.crawl.CrawlTestData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class CrawlJdbcRepositoryFrontierTest {

    @Autowired
    private CrawlJdbcRepository repository;

    @Autowired
    private CrawlJobRepository jobRepository;

    @Autowired
    private NamedParameterJdbcTemplate jdbc;

    private long jobId;

    @BeforeEach
    void setUp() {
        CrawlTestData.clean(jdbc);
        long providerId = CrawlTestData.insertProvider(jdbc, "https://shop.example.com", "generic", null);
        jobId = jobRepository.insertJob(providerId, "https://shop.example.com", null, null, Instant.now());
    }

    @Test
    void recordsEachUrlOnceInDiscoveryOrder() {
        Instant now = Instant.now();
        repository.insertFrontierUrls(jobId, List.of("https://shop.example.com/b", "https://shop.example.com/a"), now);
        repository.insertFrontierUrls(jobId, List.of("https://SHOP.example.com/B", "https://shop.example.com/c"), now);

        assertThat(repository.findFrontierUrls(jobId)).containsExactly(
            "https://shop.example.com/b",
            "https://shop.example.com/a",
            "https://shop.example.com/c"
        );
    }

    @Test
    void skipsBlankAndOversizedUrls() {
        repository.insertFrontierUrls(jobId, List.of(" ", "https://shop.example.com/" + "x".repeat(3000)), Instant.now());

        assertThat(repository.findFrontierUrls(jobId)).isEmpty();
    }

    @Test
    void recordedUrlsAreRemovedWithTheJob() {
        repository.insertFrontierUrls(jobId, List.of("https://shop.example.com/a"), Instant.now());
        jdbc.update("UPDATE crawl_jobs SET status = 'CANCELED' WHERE id = :id", Map.of("id", jobId));

        assertThat(jobRepository.deleteInactive(jobId)).isTrue();
        assertThat(repository.findFrontierUrls(jobId)).isEmpty();
    }
}
