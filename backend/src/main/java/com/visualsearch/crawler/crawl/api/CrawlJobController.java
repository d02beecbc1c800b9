package com.visualsearch.crawler.crawl.api;

import com.visualsearch.crawler.crawl.model.CrawlJobDetail;
import com.visualsearch.crawler.crawl.model.CrawlJobListResponse;
import com.visualsearch.crawler.crawl.model.CrawlJobStats;
import com.visualsearch.crawler.crawl.model.CrawlJobStatus;
import com.visualsearch.crawler.crawl.model.CrawlJobView;
import com.visualsearch.crawler.crawl.model.CreateCrawlJobRequest;
import com.visualsearch.crawler.crawl.service.CrawlJobService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/jobs")
public class CrawlJobController {
    private final CrawlJobService jobService;

    public CrawlJobController(CrawlJobService jobService) {
        this.jobService = jobService;
    }

    @PostMapping
    public ResponseEntity<CrawlJobView> create(@RequestBody CreateCrawlJobRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(jobService.create(request));
    }

    @GetMapping
    public CrawlJobListResponse list(
        @RequestParam(name = "page", defaultValue = "1") int page,
        @RequestParam(name = "pageSize", defaultValue = "20") int pageSize,
        @RequestParam(name = "status", required = false) String status,
        @RequestParam(name = "providerId", required = false) Long providerId
    ) {
        return jobService.list(page, pageSize, CrawlJobStatus.fromValue(status), providerId);
    }

    @GetMapping("/stats")
    public CrawlJobStats stats() {
        return jobService.stats();
    }

    @GetMapping("/{id}")
    public CrawlJobDetail get(@PathVariable("id") long id) {
        return jobService.get(id);
    }

    @PostMapping("/{id}/cancel")
    public CrawlJobView cancel(@PathVariable("id") long id) {
        return jobService.cancel(id);
    }

    @PostMapping("/{id}/pause")
    public CrawlJobView pause(@PathVariable("id") long id) {
        return jobService.pause(id);
    }

    @PostMapping("/{id}/resume")
    public CrawlJobView resume(@PathVariable("id") long id) {
        return jobService.resume(id);
    }

    @PostMapping("/{id}/retry")
    public ResponseEntity<CrawlJobView> retry(@PathVariable("id") long id) {
        return ResponseEntity.status(HttpStatus.CREATED).body(jobService.retry(id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable("id") long id) {
        jobService.delete(id);
        return ResponseEntity.noContent().build();
    }
}
