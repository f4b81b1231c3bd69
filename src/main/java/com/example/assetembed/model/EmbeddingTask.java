package com.example.assetembed.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

public class EmbeddingTask {
    public enum Status { QUEUED, RUNNING, SUCCEEDED, FAILED, CANCELLED }

    private final String id;
    private final BatchRequest request;
    private volatile List<BatchPageResult> results = Collections.emptyList();
    private volatile Status status;
    private volatile Instant startTime;
    private volatile Instant endTime;
    private volatile String errorMessage;
    private volatile String threadName;

    public EmbeddingTask(BatchRequest request) {
        this.id = UUID.randomUUID().toString();
        this.request = request;
        this.status = Status.QUEUED;
    }

    public String getId() { return id; }
    @JsonIgnore
    public BatchRequest getRequest() { return request; }
    public List<BatchPageResult> getResults() { return results; }
    public void setResults(List<BatchPageResult> results) { this.results = Collections.unmodifiableList(results); }
    public Status getStatus() { return status; }

    // 状态只能沿 QUEUED -> RUNNING -> 终态 前进；取消与完成互斥
    public synchronized boolean transition(Status expected, Status next) {
        if (status != expected) return false;
        status = next;
        return true;
    }

    /** Returns the status the task was cancelled from, or null when it had already finished. */
    public synchronized Status cancel() {
        if (status != Status.QUEUED && status != Status.RUNNING) return null;
        Status previous = status;
        status = Status.CANCELLED;
        return previous;
    }

    public Instant getStartTime() { return startTime; }
    public void setStartTime(Instant startTime) { this.startTime = startTime; }
    public Instant getEndTime() { return endTime; }
    public void setEndTime(Instant endTime) { this.endTime = endTime; }
    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }
    public String getThreadName() { return threadName; }
    public void setThreadName(String threadName) { this.threadName = threadName; }

    public int getPageCount() {
        return request.getPages() == null ? 0 : request.getPages().size();
    }

    public long getPagesSucceeded() {
        return results.stream().filter(BatchPageResult::isSuccess).count();
    }

    public long getPagesFailed() {
        return results.size() - getPagesSucceeded();
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
