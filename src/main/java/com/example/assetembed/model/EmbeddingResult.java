package com.example.assetembed.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class EmbeddingResult {

    private final String html;
    private final Map<String, AssetDecision> decisions;
    private final Map<String, AssetProfile> profiles;
    private final EmbeddingStats stats;
    private final List<String> recommendations;

    public EmbeddingResult(String html,
                           Map<String, AssetDecision> decisions,
                           Map<String, AssetProfile> profiles,
                           EmbeddingStats stats,
                           List<String> recommendations) {
        this.html = html;
        this.decisions = Collections.unmodifiableMap(new LinkedHashMap<>(decisions));
        this.profiles = Collections.unmodifiableMap(new LinkedHashMap<>(profiles));
        this.stats = stats;
        this.recommendations = Collections.unmodifiableList(recommendations);
    }

    public String getHtml() { return html; }
    public Map<String, AssetDecision> getDecisions() { return decisions; }
    public Map<String, AssetProfile> getProfiles() { return profiles; }
    public EmbeddingStats getStats() { return stats; }
    public List<String> getRecommendations() { return recommendations; }

    public long count(DecisionKind kind) {
        return decisions.values().stream().filter(d -> d.getDecision() == kind).count();
    }
}
