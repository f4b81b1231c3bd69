package com.example.assetembed.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.LinkedHashMap;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class BatchPageResult {

    private final boolean success;
    private final String pageName;
    private final String error;
    private final EmbeddingStats stats;
    private final Map<String, Long> decisionsCount;

    private BatchPageResult(boolean success, String pageName, String error, EmbeddingStats stats, Map<String, Long> decisionsCount) {
        this.success = success;
        this.pageName = pageName;
        this.error = error;
        this.stats = stats;
        this.decisionsCount = decisionsCount;
    }

    public static BatchPageResult succeeded(String pageName, EmbeddingResult result) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (DecisionKind kind : DecisionKind.values()) {
            counts.put(kind.getLabel(), result.count(kind));
        }
        return new BatchPageResult(true, pageName, null, result.getStats(), counts);
    }

    public static BatchPageResult failed(String pageName, String error) {
        return new BatchPageResult(false, pageName, error, null, null);
    }

    public boolean isSuccess() { return success; }
    public String getPageName() { return pageName; }
    public String getError() { return error; }
    public EmbeddingStats getStats() { return stats; }
    public Map<String, Long> getDecisionsCount() { return decisionsCount; }
}
