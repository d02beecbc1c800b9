package com.visualsearch.crawler.crawl.service;

import com.visualsearch.crawler.config.CrawlerProperties;
import com.visualsearch.crawler.crawl.model.CrawlJob;
import com.visualsearch.crawler.crawl.model.CrawlJobStats;
import com.visualsearch.crawler.crawl.model.CrawlWorkerStatusResponse;
import com.visualsearch.crawler.crawl.persistence.CrawlJobRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.lang.management.ManagementFactory;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background claim loops. Each loop claims one job at a time under its own lease owner id
 * ({@code <workerId>-<n>}) and sleeps for the poll interval when nothing is claimable.
 */
@Service
public class CrawlWorkerService {
    private static final Logger log = LoggerFactory.getLogger(CrawlWorkerService.class);

    private final JobLeaseManager leaseManager;
    private final CrawlJobRunner jobRunner;
    private final CrawlJobRepository jobRepository;
    private final CrawlerProperties properties;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();
    private final Map<String, Long> jobsInProgress = new ConcurrentHashMap<>();
    private final String workerId;

    private ExecutorService executor;
    private int activeLoopCount;

    public CrawlWorkerService(
        JobLeaseManager leaseManager,
        CrawlJobRunner jobRunner,
        CrawlJobRepository jobRepository,
        CrawlerProperties properties
    ) {
        this.leaseManager = leaseManager;
        this.jobRunner = jobRunner;
        this.jobRepository = jobRepository;
        this.properties = properties;
        String configured = properties.getWorker().getWorkerId();
        this.workerId = configured == null || configured.isBlank()
            ? "worker-" + ManagementFactory.getRuntimeMXBean().getName()
            : configured.trim();
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getWorker().isEnabled()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public String getWorkerId() {
        return workerId;
    }

    public CrawlWorkerStatusResponse getStatus() {
        CrawlJobStats stats;
        try {
            stats = jobRepository.fetchStats();
        } catch (RuntimeException e) {
            log.warn("Failed to load crawl job stats", e);
            stats = new CrawlJobStats(0, 0, 0, 0, 0, 0, 0);
        }
        return new CrawlWorkerStatusResponse(running.get(), workerId, activeLoopCount, new TreeMap<>(jobsInProgress), stats);
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            int loopCount = properties.getWorker().getWorkerCount();
            activeLoopCount = loopCount;
            executor = Executors.newFixedThreadPool(loopCount, runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("crawl-worker");
                thread.setDaemon(true);
                return thread;
            });
            running.set(true);
            for (int i = 0; i < loopCount; i++) {
                int loopIndex = i + 1;
                executor.submit(() -> workerLoop(loopIndex));
            }
            log.info("Crawl worker {} started with {} loops", workerId, loopCount);
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            if (executor != null) {
                executor.shutdownNow();
                try {
                    if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                        log.warn("Crawl worker loops did not stop within 5s");
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                executor = null;
            }
            activeLoopCount = 0;
            log.info("Crawl worker {} stopped", workerId);
        }
    }

    private void workerLoop(int loopIndex) {
        String owner = workerId + "-" + loopIndex;
        Thread.currentThread().setName("crawl-worker-" + loopIndex);
        int pollIntervalMs = properties.getWorker().getPollIntervalMs();
        int errorPauseMs = properties.getWorker().getErrorPauseMs();
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            Optional<CrawlJob> claimed;
            try {
                claimed = leaseManager.claim(owner);
            } catch (RuntimeException e) {
                log.warn("Worker {} failed to claim a job", owner, e);
                if (!sleep(errorPauseMs)) {
                    return;
                }
                continue;
            }
            if (claimed.isEmpty()) {
                if (!sleep(pollIntervalMs)) {
                    return;
                }
                continue;
            }

            CrawlJob job = claimed.get();
            jobsInProgress.put(owner, job.id());
            try {
                CrawlJobRunner.Outcome outcome = jobRunner.run(job, owner);
                log.info("Worker {} finished job {} with {}", owner, job.id(), outcome);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (RuntimeException e) {
                log.warn("Worker {} failed while running job {}", owner, job.id(), e);
                if (!sleep(errorPauseMs)) {
                    return;
                }
            } finally {
                jobsInProgress.remove(owner);
            }
        }
    }

    private boolean sleep(long millis) {
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
