package com.visualsearch.crawler.crawl.api;

import com.visualsearch.crawler.crawl.model.CrawlWorkerStatusResponse;
import com.visualsearch.crawler.crawl.service.CrawlWorkerService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/worker")
public class CrawlWorkerController {
    private final CrawlWorkerService workerService;

    public CrawlWorkerController(CrawlWorkerService workerService) {
        this.workerService = workerService;
    }

    @PostMapping("/start")
    public CrawlWorkerStatusResponse start() {
        workerService.start();
        return workerService.getStatus();
    }

    @PostMapping("/stop")
    public CrawlWorkerStatusResponse stop() {
        workerService.stop();
        return workerService.getStatus();
    }

    @GetMapping("/status")
    public CrawlWorkerStatusResponse status() {
        return workerService.getStatus();
    }
}
