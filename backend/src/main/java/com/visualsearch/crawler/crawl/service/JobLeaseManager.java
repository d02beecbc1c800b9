package com.visualsearch.crawler.crawl.service;

import com.visualsearch.crawler.config.CrawlerProperties;
import com.visualsearch.crawler.crawl.model.CrawlJob;
import com.visualsearch.crawler.crawl.model.CrawlJobStatus;
import com.visualsearch.crawler.crawl.persistence.CrawlJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Claims, renews and releases job leases. Losing a race is not an error: the call simply
 * reports that nothing was claimed or renewed.
 */
@Service
public class JobLeaseManager {
    private static final Logger log = LoggerFactory.getLogger(JobLeaseManager.class);

    private final CrawlJobRepository jobRepository;
    private final CrawlerProperties properties;
    private final Clock clock;

    public JobLeaseManager(CrawlJobRepository jobRepository, CrawlerProperties properties, Clock clock) {
        this.jobRepository = jobRepository;
        this.properties = properties;
        this.clock = clock;
    }

    public Optional<CrawlJob> claim(String workerId) {
        Instant now = clock.instant();
        Optional<CrawlJob> claimed = jobRepository.claimNext(workerId, now, now.plus(leaseDuration()));
        claimed.ifPresent(job -> log.info("Worker {} claimed job {} (lease until {})", workerId, job.id(), job.leaseExpiresAt()));
        return claimed;
    }

    public boolean renew(long jobId, String workerId) {
        boolean renewed = jobRepository.renewLease(jobId, workerId, clock.instant().plus(leaseDuration()));
        if (!renewed) {
            log.info("Worker {} no longer holds the lease on job {}", workerId, jobId);
        }
        return renewed;
    }

    /**
     * Terminal transition for a job this worker holds; clears the lease in the same update.
     */
    public boolean release(long jobId, String workerId, CrawlJobStatus terminalStatus, String errorMessage) {
        boolean released = jobRepository.completeLeased(jobId, workerId, terminalStatus, errorMessage, clock.instant());
        if (!released) {
            log.info("Job {} was no longer leased by {} when finishing as {}", jobId, workerId, terminalStatus);
        }
        return released;
    }

    public Duration leaseDuration() {
        return Duration.ofSeconds(properties.getWorker().getLeaseSeconds());
    }

    public Duration renewalInterval() {
        return Duration.ofSeconds(properties.getWorker().getLeaseRenewalSeconds());
    }
}
