package com.visualsearch.crawler.crawl.service;

import com.visualsearch.crawler.config.CrawlerProperties;
import com.visualsearch.crawler.crawl.model.CrawlJobStatus;
import com.visualsearch.crawler.crawl.persistence.CrawlJobRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JobLeaseManagerTest {
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private final CrawlJobRepository repository = Mockito.mock(CrawlJobRepository.class);
    private JobLeaseManager leaseManager;

    @BeforeEach
    void setUp() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.getWorker().setLeaseSeconds(120);
        properties.getWorker().setLeaseRenewalSeconds(40);
        leaseManager = new JobLeaseManager(repository, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void claimAndRenewExtendLeaseFromNow() {
        when(repository.claimNext("w-1", NOW, NOW.plusSeconds(120))).thenReturn(Optional.empty());
        when(repository.renewLease(7L, "w-1", NOW.plusSeconds(120))).thenReturn(true);

        assertThat(leaseManager.claim("w-1")).isEmpty();
        assertThat(leaseManager.renew(7L, "w-1")).isTrue();
        verify(repository).claimNext(eq("w-1"), eq(NOW), eq(NOW.plusSeconds(120)));
    }

    @Test
    void releaseReportsLostLease() {
        when(repository.completeLeased(7L, "w-1", CrawlJobStatus.SUCCEEDED, null, NOW)).thenReturn(false);

        assertThat(leaseManager.release(7L, "w-1", CrawlJobStatus.SUCCEEDED, null)).isFalse();
    }

    @Test
    void exposesConfiguredDurations() {
        assertThat(leaseManager.leaseDuration()).isEqualTo(Duration.ofSeconds(120));
        assertThat(leaseManager.renewalInterval()).isEqualTo(Duration.ofSeconds(40));
    }
}
