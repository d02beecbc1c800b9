package com.visualsearch.crawler.crawl.service;

import com.visualsearch.crawler.config.CrawlerProperties;
import com.visualsearch.crawler.crawl.model.CrawlJob;
import com.visualsearch.crawler.crawl.model.CrawlJobStats;
import com.visualsearch.crawler.crawl.model.CrawlJobStatus;
import com.visualsearch.crawler.crawl.model.CrawlWorkerStatusResponse;
import com.visualsearch.crawler.crawl.persistence.CrawlJobRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CrawlWorkerServiceTest {
    private final JobLeaseManager leaseManager = Mockito.mock(JobLeaseManager.class);
    private final CrawlJobRunner jobRunner = Mockito.mock(CrawlJobRunner.class);
    private final CrawlJobRepository jobRepository = Mockito.mock(CrawlJobRepository.class);
    private CrawlerProperties properties;
    private CrawlWorkerService workerService;

    @BeforeEach
    void setUp() {
        properties = new CrawlerProperties();
        properties.getWorker().setWorkerId("node-a");
        properties.getWorker().setWorkerCount(2);
        properties.getWorker().setPollIntervalMs(20);
        properties.getWorker().setErrorPauseMs(0);
        when(jobRepository.fetchStats()).thenReturn(new CrawlJobStats(0, 0, 0, 0, 0, 0, 0));
        workerService = new CrawlWorkerService(leaseManager, jobRunner, jobRepository, properties);
    }

    @AfterEach
    void tearDown() {
        workerService.stop();
    }

    @Test
    void startAndStopToggleStatus() {
        when(leaseManager.claim(anyString())).thenReturn(Optional.empty());

        workerService.start();
        workerService.start();
        CrawlWorkerStatusResponse running = workerService.getStatus();
        assertThat(running.running()).isTrue();
        assertThat(running.workerId()).isEqualTo("node-a");
        assertThat(running.activeLoopCount()).isEqualTo(2);

        verify(leaseManager, timeout(2000)).claim("node-a-1");
        verify(leaseManager, timeout(2000)).claim("node-a-2");

        workerService.stop();
        assertThat(workerService.getStatus().running()).isFalse();
        assertThat(workerService.getStatus().activeLoopCount()).isZero();
    }

    @Test
    void claimedJobIsRunUnderLoopOwnerAndTracked() throws Exception {
        properties.getWorker().setWorkerCount(1);
        CrawlJob job = new CrawlJob(42L, 1L, "https://shop.example.com", null, null, CrawlJobStatus.RUNNING,
            Instant.now(), Instant.now(), null, null, null, "node-a-1", Instant.now().plusSeconds(30), null, 1L);
        CountDownLatch running = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(leaseManager.claim("node-a-1")).thenReturn(Optional.of(job)).thenReturn(Optional.empty());
        when(jobRunner.run(eq(job), eq("node-a-1"))).thenAnswer(invocation -> {
            running.countDown();
            release.await(5, TimeUnit.SECONDS);
            return CrawlJobRunner.Outcome.SUCCEEDED;
        });

        workerService.start();

        assertThat(running.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(workerService.getStatus().jobsInProgress()).containsEntry("node-a-1", 42L);
        release.countDown();
        verify(leaseManager, timeout(2000).atLeast(2)).claim("node-a-1");
        assertThat(workerService.getStatus().jobsInProgress()).isEmpty();
    }

    @Test
    void claimErrorsDoNotKillTheLoop() {
        properties.getWorker().setWorkerCount(1);
        when(leaseManager.claim("node-a-1"))
            .thenThrow(new IllegalStateException("database unavailable"))
            .thenReturn(Optional.empty());

        workerService.start();

        verify(leaseManager, timeout(2000).atLeast(2)).claim("node-a-1");
        assertThat(workerService.getStatus().running()).isTrue();
    }

    @Test
    void defaultWorkerIdComesFromRuntime() {
        CrawlWorkerService unnamed = new CrawlWorkerService(leaseManager, jobRunner, jobRepository, new CrawlerProperties());

        assertThat(unnamed.getWorkerId()).startsWith("worker-");
    }
}
