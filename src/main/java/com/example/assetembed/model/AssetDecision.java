package com.example.assetembed.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AssetDecision {

    private final String assetPath;
    private final MediaKind assetType;
    private final int originalSize;
    private final DecisionKind decision;
    private final String reason;
    private final String payload;
    private final String externalUrl;
    private final Savings savings;
    private final List<String> warnings;

    private AssetDecision(Builder b) {
        this.assetPath = Objects.requireNonNull(b.assetPath, "assetPath");
        this.assetType = Objects.requireNonNull(b.assetType, "assetType");
        this.originalSize = b.originalSize;
        this.decision = Objects.requireNonNull(b.decision, "decision");
        this.reason = b.reason;
        this.payload = b.payload;
        this.externalUrl = b.externalUrl;
        this.savings = b.savings;
        this.warnings = Collections.unmodifiableList(new ArrayList<>(b.warnings));
    }

    public static Builder of(AssetRecord record, DecisionKind decision) {
        return new Builder(record.getPath(), record.getMediaKind(), record.getSize(), decision);
    }

    public String getAssetPath() { return assetPath; }
    public MediaKind getAssetType() { return assetType; }
    public int getOriginalSize() { return originalSize; }
    public DecisionKind getDecision() { return decision; }
    public String getReason() { return reason; }
    /** Data URI for inline-base64, raw markup for inline-svg, otherwise null. */
    public String getPayload() { return payload; }
    public String getExternalUrl() { return externalUrl; }
    public Savings getSavings() { return savings; }
    public List<String> getWarnings() { return warnings; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AssetDecision)) return false;
        AssetDecision d = (AssetDecision) o;
        return originalSize == d.originalSize
                && assetPath.equals(d.assetPath)
                && assetType == d.assetType
                && decision == d.decision
                && Objects.equals(reason, d.reason)
                && Objects.equals(payload, d.payload)
                && Objects.equals(externalUrl, d.externalUrl)
                && Objects.equals(savings, d.savings)
                && warnings.equals(d.warnings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(assetPath, assetType, originalSize, decision, reason, payload, externalUrl, savings, warnings);
    }

    @Override
    public String toString() {
        return assetPath + " -> " + decision.getLabel() + " (" + reason + ")";
    }

    public static final class Builder {
        private final String assetPath;
        private final MediaKind assetType;
        private final int originalSize;
        private final DecisionKind decision;
        private String reason;
        private String payload;
        private String externalUrl;
        private Savings savings;
        private final List<String> warnings = new ArrayList<>();

        private Builder(String assetPath, MediaKind assetType, int originalSize, DecisionKind decision) {
            this.assetPath = assetPath;
            this.assetType = assetType;
            this.originalSize = originalSize;
            this.decision = decision;
        }

        public Builder reason(String reason) { this.reason = reason; return this; }
        public Builder payload(String payload) { this.payload = payload; return this; }
        public Builder externalUrl(String externalUrl) { this.externalUrl = externalUrl; return this; }
        public Builder savings(int httpRequests, long bytes) { this.savings = new Savings(httpRequests, bytes); return this; }
        public Builder warning(String warning) { this.warnings.add(warning); return this; }

        public AssetDecision build() {
            return new AssetDecision(this);
        }
    }
}
