package com.visualsearch.crawler.crawl.service;

import com.visualsearch.crawler.config.CrawlerProperties;
import com.visualsearch.crawler.crawl.model.CrawlJob;
import com.visualsearch.crawler.crawl.model.CrawlJobStatus;
import com.visualsearch.crawler.crawl.model.CrawlPageResult;
import com.visualsearch.crawler.crawl.model.CrawlerConfig;
import com.visualsearch.crawler.crawl.model.ProviderCrawlSettings;
import com.visualsearch.crawler.crawl.model.UrlDiscoveryResult;
import com.visualsearch.crawler.crawl.persistence.CrawlJdbcRepository;
import com.visualsearch.crawler.crawl.persistence.CrawlJobRepository;
import com.visualsearch.crawler.crawl.strategy.CrawlerStrategy;
import com.visualsearch.crawler.crawl.strategy.CrawlerStrategyRegistry;
import com.visualsearch.crawler.crawl.strategy.DiscoveryException;
import com.visualsearch.crawler.crawl.util.CrawlUrlUtils;
import com.visualsearch.crawler.crawl.util.UrlPatternFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one claimed job: discover, fetch and extract each page, persist as it goes, and finish
 * the job. The lease is renewed in the background for the whole run; a pause, cancel or lost
 * lease stops the loop without touching rows already written.
 */
@Service
public class CrawlJobRunner {
    private static final Logger log = LoggerFactory.getLogger(CrawlJobRunner.class);
    static final int MAX_ERROR_LENGTH = 2000;

    public enum Outcome {
        SUCCEEDED,
        FAILED,
        STOPPED
    }

    private final CrawlJobRepository jobRepository;
    private final CrawlJdbcRepository repository;
    private final JobLeaseManager leaseManager;
    private final CrawlerStrategyRegistry strategyRegistry;
    private final CrawlerProperties properties;
    private final ScheduledExecutorService heartbeatScheduler;
    private final Clock clock;

    public CrawlJobRunner(
        CrawlJobRepository jobRepository,
        CrawlJdbcRepository repository,
        JobLeaseManager leaseManager,
        CrawlerStrategyRegistry strategyRegistry,
        CrawlerProperties properties,
        @Qualifier("leaseHeartbeatScheduler") ScheduledExecutorService heartbeatScheduler,
        Clock clock
    ) {
        this.jobRepository = jobRepository;
        this.repository = repository;
        this.leaseManager = leaseManager;
        this.strategyRegistry = strategyRegistry;
        this.properties = properties;
        this.heartbeatScheduler = heartbeatScheduler;
        this.clock = clock;
    }

    public Outcome run(CrawlJob job, String workerId) throws InterruptedException {
        RunSignal signal = new RunSignal();
        long renewalMs = leaseManager.renewalInterval().toMillis();
        ScheduledFuture<?> heartbeat = heartbeatScheduler.scheduleAtFixedRate(
            () -> heartbeat(job.id(), workerId, signal),
            renewalMs,
            renewalMs,
            TimeUnit.MILLISECONDS
        );
        ExecutorService pagePool = null;
        try {
            Optional<ProviderCrawlSettings> settings = repository.findProviderSettings(job.providerId());
            if (settings.isEmpty()) {
                return fail(job, workerId, "Provider " + job.providerId() + " not found");
            }
            CrawlerStrategy strategy = strategyRegistry.resolve(settings.get().crawlerType());
            CrawlerConfig config = settings.get().config();
            int maxPages = effectiveMaxPages(job);

            UrlDiscoveryResult discovery;
            try {
                discovery = strategy.discoverUrls(job.startUrl(), job.sitemapUrl(), config, maxPages);
            } catch (DiscoveryException e) {
                return fail(job, workerId, "Discovery failed: " + e.getMessage());
            }
            log.info(
                "Job {} ({}) discovered {} urls via {} maxPages={}",
                job.id(),
                strategy.type().value(),
                discovery.urls().size(),
                discovery.source(),
                maxPages
            );

            Set<String> completed = new HashSet<>();
            for (String url : repository.findSucceededPageUrls(job.id())) {
                completed.add(CrawlUrlUtils.dedupeKey(url));
            }
            Set<String> seen = new HashSet<>();
            ArrayDeque<String> frontier = new ArrayDeque<>();
            enqueue(discovery.urls(), seen, frontier, maxPages);
            if (discovery.followLinks()) {
                List<String> recorded = repository.findFrontierUrls(job.id());
                if (!recorded.isEmpty()) {
                    log.info("Job {} restored {} recorded links", job.id(), recorded.size());
                }
                enqueue(recorded, seen, frontier, maxPages);
            }
            UrlPatternFilter linkFilter = UrlPatternFilter.of(config.getIncludePatterns(), config.getExcludePatterns());

            int concurrency = config.getMaxConcurrency();
            pagePool = Executors.newFixedThreadPool(concurrency, pageThreadFactory(job.id()));
            CompletionService<CrawlPageResult> completion = new ExecutorCompletionService<>(pagePool);
            Map<Future<CrawlPageResult>, String> inFlight = new HashMap<>();
            int pagesFetched = 0;
            int pagesFailed = 0;

            while (isStillLeased(job.id(), workerId, signal)) {
                while (inFlight.size() < concurrency && !frontier.isEmpty()) {
                    String url = frontier.pollFirst();
                    if (completed.contains(CrawlUrlUtils.dedupeKey(url))) {
                        continue;
                    }
                    inFlight.put(completion.submit(() -> strategy.fetchAndExtract(url, config)), url);
                }
                if (inFlight.isEmpty()) {
                    break;
                }
                Future<CrawlPageResult> done = completion.poll(properties.getWorker().getSignalCheckMs(), TimeUnit.MILLISECONDS);
                if (done == null) {
                    continue;
                }
                String url = inFlight.remove(done);
                CrawlPageResult result = resultOf(done, url);
                if (result == null) {
                    continue;
                }
                persist(job, result);
                pagesFetched++;
                if (result.success()) {
                    completed.add(CrawlUrlUtils.dedupeKey(url));
                } else {
                    pagesFailed++;
                    log.warn("Job {} page {} failed: {}", job.id(), url, result.error());
                }
                if (discovery.followLinks()) {
                    List<String> accepted = new ArrayList<>();
                    for (String link : result.discoveredUrls()) {
                        if (linkFilter.accepts(link)) {
                            accepted.add(link);
                        }
                    }
                    List<String> added = enqueue(accepted, seen, frontier, maxPages);
                    repository.insertFrontierUrls(job.id(), added, clock.instant());
                }
            }

            if (signal.isStopped()) {
                inFlight.keySet().forEach(future -> future.cancel(true));
                log.info("Job {} stopped by {} after {} pages: {}", job.id(), workerId, pagesFetched, signal.reason());
                return Outcome.STOPPED;
            }
            if (!leaseManager.release(job.id(), workerId, CrawlJobStatus.SUCCEEDED, null)) {
                return Outcome.STOPPED;
            }
            log.info("Job {} succeeded: {} pages fetched, {} failed", job.id(), pagesFetched, pagesFailed);
            return Outcome.SUCCEEDED;
        } catch (InterruptedException e) {
            log.info("Job {} interrupted on {}, lease left to expire", job.id(), workerId);
            throw e;
        } catch (RuntimeException e) {
            log.warn("Job {} failed with an unexpected error", job.id(), e);
            return fail(job, workerId, e.getClass().getSimpleName() + ": " + e.getMessage());
        } finally {
            heartbeat.cancel(false);
            if (pagePool != null) {
                pagePool.shutdownNow();
            }
        }
    }

    /**
     * Adds urls not seen before (by {@link CrawlUrlUtils#dedupeKey}) while the page budget allows,
     * returning the ones added.
     */
    private static List<String> enqueue(List<String> urls, Set<String> seen, ArrayDeque<String> frontier, int maxPages) {
        List<String> added = new ArrayList<>();
        for (String url : urls) {
            if (seen.size() >= maxPages) {
                break;
            }
            String key = CrawlUrlUtils.dedupeKey(url);
            if (key != null && !key.isEmpty() && seen.add(key)) {
                frontier.addLast(url);
                added.add(url);
            }
        }
        return added;
    }

    int effectiveMaxPages(CrawlJob job) {
        int cap = properties.getWorker().getMaxPagesPerJob();
        if (job.maxPages() == null || job.maxPages() <= 0) {
            return cap;
        }
        return Math.min(job.maxPages(), cap);
    }

    private CrawlPageResult resultOf(Future<CrawlPageResult> future, String url) throws InterruptedException {
        try {
            return future.get();
        } catch (CancellationException e) {
            return null;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof InterruptedException) {
                return null;
            }
            log.warn("Unexpected error while crawling {}", url, cause);
            return CrawlPageResult.failure(url, null, "Unexpected error: " + cause);
        }
    }

    private void persist(CrawlJob job, CrawlPageResult result) {
        Instant now = clock.instant();
        repository.insertPage(job.id(), result, now);
        if (result.success() && !result.products().isEmpty()) {
            repository.insertExtractedProducts(job.id(), job.providerId(), result.products(), now);
        }
    }

    private boolean isStillLeased(long jobId, String workerId, RunSignal signal) {
        if (signal.isStopped()) {
            return false;
        }
        Optional<CrawlJob> current = jobRepository.findById(jobId);
        if (current.isEmpty()) {
            signal.stop("job deleted");
            return false;
        }
        if (!current.get().isLeasedBy(workerId)) {
            signal.stop("job is " + current.get().status() + " owned by " + current.get().leaseOwner());
            return false;
        }
        return true;
    }

    private void heartbeat(long jobId, String workerId, RunSignal signal) {
        if (signal.isStopped()) {
            return;
        }
        try {
            if (!leaseManager.renew(jobId, workerId)) {
                signal.stop("lease not renewable");
            }
        } catch (RuntimeException e) {
            log.warn("Lease renewal for job {} failed, will retry", jobId, e);
        }
    }

    private Outcome fail(CrawlJob job, String workerId, String message) {
        String error = truncate(message);
        log.warn("Job {} failed: {}", job.id(), error);
        return leaseManager.release(job.id(), workerId, CrawlJobStatus.FAILED, error) ? Outcome.FAILED : Outcome.STOPPED;
    }

    static String truncate(String message) {
        if (message == null) {
            return null;
        }
        return message.length() > MAX_ERROR_LENGTH ? message.substring(0, MAX_ERROR_LENGTH) : message;
    }

    private static ThreadFactory pageThreadFactory(long jobId) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("crawl-job-" + jobId + "-page-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static final class RunSignal {
        private volatile String reason;

        boolean isStopped() {
            return reason != null;
        }

        void stop(String why) {
            if (reason == null) {
                reason = why;
            }
        }

        String reason() {
            return reason;
        }
    }
}
