package com.visualsearch.crawler.crawl.service;

import com.visualsearch.crawler.crawl.CrawlTestData;
import com.visualsearch.crawler.crawl.model.CrawlJobDetail;
import com.visualsearch.crawler.crawl.model.CrawlJobListResponse;
import com.visualsearch.crawler.crawl.model.CrawlJobStatus;
import com.visualsearch.crawler.crawl.model.CrawlJobView;
import com.visualsearch.crawler.crawl.model.CrawlPage;
import com.visualsearch.crawler.crawl.model.CrawlPageResult;
import com.visualsearch.crawler.crawl.model.CreateCrawlJobRequest;
import com.visualsearch.crawler.crawl.model.ProductCandidate;
import com.visualsearch.crawler.crawl.persistence.CrawlJdbcRepository;
import com.visualsearch.crawler.crawl.persistence.CrawlJobRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

@SpringBootTest
@ActiveProfiles("test")
class CrawlJobServiceTest {

    @Autowired
    private CrawlJobService jobService;

    @Autowired
    private JobLeaseManager leaseManager;

    @Autowired
    private CrawlJobRepository jobRepository;

    @Autowired
    private CrawlJdbcRepository repository;

    @Autowired
    private NamedParameterJdbcTemplate jdbc;

    private long providerId;

    @BeforeEach
    void setUp() {
        CrawlTestData.clean(jdbc);
        providerId = CrawlTestData.insertProvider(jdbc, "https://shop.example.com", "generic", null);
    }

    @Test
    void createDefaultsStartUrlToProviderWebsite() {
        CrawlJobView job = jobService.create(new CreateCrawlJobRequest(providerId, null, null, 25));

        assertThat(job.status()).isEqualTo(CrawlJobStatus.QUEUED);
        assertThat(job.startUrl()).isEqualTo("https://shop.example.com");
        assertThat(job.maxPages()).isEqualTo(25);
        assertThat(job.providerName()).isEqualTo("Test Shop");
        assertThat(job.leaseOwner()).isNull();
    }

    @Test
    void createRejectsInvalidInput() {
        assertThatThrownBy(() -> jobService.create(new CreateCrawlJobRequest(providerId + 1000, null, null, null)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> jobService.create(new CreateCrawlJobRequest(providerId, "not a url", null, null)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> jobService.create(new CreateCrawlJobRequest(providerId, null, null, 0)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> jobService.create(new CreateCrawlJobRequest(null, null, null, null)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void pauseOnlyFromRunningAndResumeOnlyFromPaused() {
        long jobId = jobService.create(new CreateCrawlJobRequest(providerId, null, null, null)).id();

        InvalidJobTransitionException rejected =
            catchThrowableOfType(() -> jobService.pause(jobId), InvalidJobTransitionException.class);
        assertThat(rejected.getCurrentStatus()).isEqualTo(CrawlJobStatus.QUEUED);
        assertThat(rejected.getAction()).isEqualTo("pause");
        assertThatThrownBy(() -> jobService.resume(jobId)).isInstanceOf(InvalidJobTransitionException.class);

        leaseManager.claim("w-1").orElseThrow();
        CrawlJobView paused = jobService.pause(jobId);
        assertThat(paused.status()).isEqualTo(CrawlJobStatus.PAUSED);
        assertThat(paused.pausedAt()).isNotNull();
        assertThat(paused.leaseOwner()).isNull();
        assertThat(leaseManager.renew(jobId, "w-1")).isFalse();

        CrawlJobView resumed = jobService.resume(jobId);
        assertThat(resumed.status()).isEqualTo(CrawlJobStatus.QUEUED);
        assertThat(resumed.pausedAt()).isNull();
    }

    @Test
    void cancelFromQueuedOrRunningOnly() {
        long queued = jobService.create(new CreateCrawlJobRequest(providerId, null, null, null)).id();
        CrawlJobView canceled = jobService.cancel(queued);
        assertThat(canceled.status()).isEqualTo(CrawlJobStatus.CANCELED);
        assertThat(canceled.canceledAt()).isNotNull();
        assertThatThrownBy(() -> jobService.cancel(queued)).isInstanceOf(InvalidJobTransitionException.class);

        long running = jobService.create(new CreateCrawlJobRequest(providerId, null, null, null)).id();
        leaseManager.claim("w-1").orElseThrow();
        assertThat(jobService.cancel(running).status()).isEqualTo(CrawlJobStatus.CANCELED);
        assertThat(leaseManager.release(running, "w-1", CrawlJobStatus.SUCCEEDED, null)).isFalse();
    }

    @Test
    void retryQueuesNewJobWithSameSettings() {
        long jobId = jobService.create(new CreateCrawlJobRequest(providerId, "https://shop.example.com/es", "https://shop.example.com/s.xml", 7)).id();
        assertThatThrownBy(() -> jobService.retry(jobId)).isInstanceOf(InvalidJobTransitionException.class);

        leaseManager.claim("w-1").orElseThrow();
        leaseManager.release(jobId, "w-1", CrawlJobStatus.FAILED, "Discovery failed: unreachable");

        CrawlJobView retried = jobService.retry(jobId);
        assertThat(retried.id()).isNotEqualTo(jobId);
        assertThat(retried.status()).isEqualTo(CrawlJobStatus.QUEUED);
        assertThat(retried.startUrl()).isEqualTo("https://shop.example.com/es");
        assertThat(retried.sitemapUrl()).isEqualTo("https://shop.example.com/s.xml");
        assertThat(retried.maxPages()).isEqualTo(7);
        assertThat(jobService.get(jobId).job().status()).isEqualTo(CrawlJobStatus.FAILED);
    }

    @Test
    void deleteRemovesPagesButKeepsExtractedProducts() {
        long jobId = jobService.create(new CreateCrawlJobRequest(providerId, null, null, null)).id();
        leaseManager.claim("w-1").orElseThrow();
        assertThatThrownBy(() -> jobService.delete(jobId)).isInstanceOf(InvalidJobTransitionException.class);

        ProductCandidate chair = new ProductCandidate("CH-1", "Chair", null, new BigDecimal("10.00"), "EUR",
            "https://shop.example.com/p/chair", null, List.of(), "{}");
        CrawlPageResult page = new CrawlPageResult("https://shop.example.com/p/chair", true, 200, "text/html", "Chair",
            "abc", List.of(chair), List.of(), null);
        repository.insertPage(jobId, page, Instant.now());
        repository.insertExtractedProducts(jobId, providerId, List.of(chair), Instant.now());
        leaseManager.release(jobId, "w-1", CrawlJobStatus.SUCCEEDED, null);

        jobService.delete(jobId);

        assertThatThrownBy(() -> jobService.get(jobId)).isInstanceOf(CrawlJobNotFoundException.class);
        assertThat(repository.findPages(jobId)).isEmpty();
        Long orphaned = jdbc.queryForObject(
            "SELECT COUNT(*) FROM extracted_products WHERE crawl_job_id IS NULL AND external_id = 'CH-1'", Map.of(), Long.class);
        assertThat(orphaned).isEqualTo(1L);
    }

    @Test
    void getIncludesRecentPagesAndCounts() {
        long jobId = jobService.create(new CreateCrawlJobRequest(providerId, null, null, null)).id();
        Instant base = Instant.now();
        repository.insertPage(jobId, CrawlPageResult.failure("https://shop.example.com/a", 500, "HTTP 500: Internal Server Error"), base);
        repository.insertPage(jobId, new CrawlPageResult("https://shop.example.com/b", true, 200, "text/html", "B", "h",
            List.of(), List.of(), null), base.plusSeconds(1));

        CrawlJobDetail detail = jobService.get(jobId);

        assertThat(detail.job().pagesTotal()).isEqualTo(2);
        assertThat(detail.job().pagesSucceeded()).isEqualTo(1);
        assertThat(detail.job().pagesFailed()).isEqualTo(1);
        assertThat(detail.recentPages()).extracting(CrawlPage::url)
            .containsExactly("https://shop.example.com/b", "https://shop.example.com/a");
        assertThatThrownBy(() -> jobService.get(jobId + 1000)).isInstanceOf(CrawlJobNotFoundException.class);
    }

    @Test
    void listPagesNewestFirstAndClampsPageSize() {
        for (int i = 0; i < 3; i++) {
            jobRepository.insertJob(providerId, "https://shop.example.com/" + i, null, null, Instant.now().plusSeconds(i));
        }

        CrawlJobListResponse firstPage = jobService.list(1, 2, null, null);
        CrawlJobListResponse secondPage = jobService.list(2, 2, CrawlJobStatus.QUEUED, providerId);

        assertThat(firstPage.totalCount()).isEqualTo(3);
        assertThat(firstPage.items()).extracting(CrawlJobView::startUrl)
            .containsExactly("https://shop.example.com/2", "https://shop.example.com/1");
        assertThat(secondPage.items()).extracting(CrawlJobView::startUrl).containsExactly("https://shop.example.com/0");
        assertThat(jobService.list(0, 1000, null, null).pageSize()).isEqualTo(100);
        assertThat(jobService.stats().queued()).isEqualTo(3);
    }
}
