package com.visualsearch.crawler.crawl.service;

import com.visualsearch.crawler.crawl.model.CrawlJob;
import com.visualsearch.crawler.crawl.model.CrawlJobDetail;
import com.visualsearch.crawler.crawl.model.CrawlJobListResponse;
import com.visualsearch.crawler.crawl.model.CrawlJobStats;
import com.visualsearch.crawler.crawl.model.CrawlJobStatus;
import com.visualsearch.crawler.crawl.model.CrawlJobView;
import com.visualsearch.crawler.crawl.model.CreateCrawlJobRequest;
import com.visualsearch.crawler.crawl.model.ProviderCrawlSettings;
import com.visualsearch.crawler.crawl.persistence.CrawlJdbcRepository;
import com.visualsearch.crawler.crawl.persistence.CrawlJobRepository;
import com.visualsearch.crawler.crawl.util.CrawlUrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Job control operations. Each transition is one guarded update; when it matches no row the
 * job is reloaded to tell a missing job from a transition its status does not allow.
 */
@Service
public class CrawlJobService {
    private static final Logger log = LoggerFactory.getLogger(CrawlJobService.class);
    private static final int RECENT_PAGES = 20;
    private static final int MAX_PAGE_SIZE = 100;

    private final CrawlJobRepository jobRepository;
    private final CrawlJdbcRepository repository;
    private final Clock clock;

    public CrawlJobService(CrawlJobRepository jobRepository, CrawlJdbcRepository repository, Clock clock) {
        this.jobRepository = jobRepository;
        this.repository = repository;
        this.clock = clock;
    }

    public CrawlJobView create(CreateCrawlJobRequest request) {
        if (request == null || request.providerId() == null) {
            throw new IllegalArgumentException("providerId is required");
        }
        ProviderCrawlSettings provider = repository.findProviderSettings(request.providerId())
            .orElseThrow(() -> new IllegalArgumentException("Provider " + request.providerId() + " not found"));
        String startUrl = blankToNull(request.startUrl());
        if (startUrl == null) {
            startUrl = blankToNull(provider.websiteUrl());
        }
        if (startUrl == null || !CrawlUrlUtils.isHttpUrl(startUrl)) {
            throw new IllegalArgumentException("A valid startUrl is required when the provider has no website url");
        }
        if (request.maxPages() != null && request.maxPages() < 1) {
            throw new IllegalArgumentException("maxPages must be at least 1");
        }
        long jobId = jobRepository.insertJob(
            provider.providerId(),
            startUrl,
            blankToNull(request.sitemapUrl()),
            request.maxPages(),
            clock.instant()
        );
        log.info("Queued crawl job {} for provider {} start={}", jobId, provider.providerId(), startUrl);
        return getView(jobId);
    }

    public CrawlJobDetail get(long jobId) {
        return new CrawlJobDetail(getView(jobId), repository.findRecentPages(jobId, RECENT_PAGES));
    }

    public CrawlJobListResponse list(int page, int pageSize, CrawlJobStatus status, Long providerId) {
        int safePage = Math.max(1, page);
        int safePageSize = Math.min(MAX_PAGE_SIZE, Math.max(1, pageSize));
        List<CrawlJobView> items = jobRepository.listViews(status, providerId, safePageSize, (safePage - 1) * safePageSize);
        long total = jobRepository.countJobs(status, providerId);
        return new CrawlJobListResponse(items, total, safePage, safePageSize);
    }

    public CrawlJobStats stats() {
        return jobRepository.fetchStats();
    }

    public CrawlJobView cancel(long jobId) {
        if (!jobRepository.markCanceled(jobId, clock.instant())) {
            throw rejected(jobId, "cancel");
        }
        log.info("Crawl job {} canceled", jobId);
        return getView(jobId);
    }

    public CrawlJobView pause(long jobId) {
        if (!jobRepository.markPaused(jobId, clock.instant())) {
            throw rejected(jobId, "pause");
        }
        log.info("Crawl job {} paused", jobId);
        return getView(jobId);
    }

    public CrawlJobView resume(long jobId) {
        if (!jobRepository.markResumed(jobId)) {
            throw rejected(jobId, "resume");
        }
        log.info("Crawl job {} resumed", jobId);
        return getView(jobId);
    }

    /**
     * Queues a new job with the same provider, start url, sitemap and page budget. The original
     * job is left untouched.
     */
    public CrawlJobView retry(long jobId) {
        CrawlJob original = jobRepository.findById(jobId).orElseThrow(() -> new CrawlJobNotFoundException(jobId));
        if (original.status() != CrawlJobStatus.FAILED && original.status() != CrawlJobStatus.CANCELED) {
            throw new InvalidJobTransitionException(jobId, original.status(), "retry");
        }
        long newJobId = jobRepository.insertJob(
            original.providerId(),
            original.startUrl(),
            original.sitemapUrl(),
            original.maxPages(),
            clock.instant()
        );
        log.info("Crawl job {} retried as {}", jobId, newJobId);
        return getView(newJobId);
    }

    public void delete(long jobId) {
        if (!jobRepository.deleteInactive(jobId)) {
            throw rejected(jobId, "delete");
        }
        log.info("Crawl job {} deleted", jobId);
    }

    private CrawlJobView getView(long jobId) {
        return jobRepository.findView(jobId).orElseThrow(() -> new CrawlJobNotFoundException(jobId));
    }

    private RuntimeException rejected(long jobId, String action) {
        CrawlJob current = jobRepository.findById(jobId).orElseThrow(() -> new CrawlJobNotFoundException(jobId));
        return new InvalidJobTransitionException(jobId, current.status(), action);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
