package com.visualsearch.crawler.crawl.service;

import com.visualsearch.crawler.crawl.model.CrawlJobStatus;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class InvalidJobTransitionException extends RuntimeException {
    private final long jobId;
    private final CrawlJobStatus currentStatus;
    private final String action;

    public InvalidJobTransitionException(long jobId, CrawlJobStatus currentStatus, String action) {
        super("Cannot " + action + " crawl job " + jobId + " in status " + currentStatus);
        this.jobId = jobId;
        this.currentStatus = currentStatus;
        this.action = action;
    }

    public long getJobId() {
        return jobId;
    }

    public CrawlJobStatus getCurrentStatus() {
        return currentStatus;
    }

    public String getAction() {
        return action;
    }
}
