package com.example.sitemirror.model;

import java.time.Duration;
import java.time.Instant;

public class CrawlTask {
    public enum Status { QUEUED, RUNNING, SUCCEEDED, FAILED, CANCELLED }

    private final String id;
    private final CrawlJob job;
    private volatile CrawlResult result;
    private volatile Status status;
    private volatile Instant startTime;
    private volatile Instant endTime;
    private volatile String errorMessage;
    private volatile String threadName;

    public CrawlTask(String id, CrawlJob job) {
        this.id = id;
        this.job = job;
        this.status = Status.QUEUED;
    }

    public String getId() { return id; }
    public CrawlJob getJob() { return job; }
    public CrawlResult getResult() { return result; }
    public void setResult(CrawlResult result) { this.result = result; }
    public Status getStatus() { return status; }
    public void setStatus(Status status) { this.status = status; }
    public Instant getStartTime() { return startTime; }
    public void setStartTime(Instant startTime) { this.startTime = startTime; }
    public Instant getEndTime() { return endTime; }
    public void setEndTime(Instant endTime) { this.endTime = endTime; }
    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }
    public String getThreadName() { return threadName; }
    public void setThreadName(String threadName) { this.threadName = threadName; }

    public int getPageCount() {
        return result == null ? 0 : result.getPageCount();
    }

    public int getErrorsCount() {
        return result == null ? 0 : result.getErrors().size();
    }

    public boolean isDone() {
        return status == Status.SUCCEEDED || status == Status.FAILED || status == Status.CANCELLED;
    }

    public String getDuration() {
        Instant end = endTime != null ? endTime : Instant.now();
        Instant start = startTime != null ? startTime : end;
        Duration d = Duration.between(start, end);
        long s = d.getSeconds();
        long m = s / 60; s = s % 60;
        return (m > 0 ? (m + "m ") : "") + s + "s";
    }
}
