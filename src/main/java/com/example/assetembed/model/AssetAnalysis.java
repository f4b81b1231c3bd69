package com.example.assetembed.model;

import java.util.List;
import java.util.Map;

public class AssetAnalysis {

    private final int totalAssets;
    private final long totalSize;
    private final long averageSize;
    private final Map<MediaKind, Integer> assetsByType;
    private final Map<String, Integer> usageCounts;
    private final List<String> criticalAssets;
    private final Map<String, AssetProfile> profiles;

    public AssetAnalysis(int totalAssets,
                         long totalSize,
                         long averageSize,
                         Map<MediaKind, Integer> assetsByType,
                         Map<String, Integer> usageCounts,
                         List<String> criticalAssets,
                         Map<String, AssetProfile> profiles) {
        this.totalAssets = totalAssets;
        this.totalSize = totalSize;
        this.averageSize = averageSize;
        this.assetsByType = assetsByType;
        this.usageCounts = usageCounts;
        this.criticalAssets = criticalAssets;
        this.profiles = profiles;
    }

    public int getTotalAssets() { return totalAssets; }
    public long getTotalSize() { return totalSize; }
    public long getAverageSize() { return averageSize; }
    public Map<MediaKind, Integer> getAssetsByType() { return assetsByType; }
    public Map<String, Integer> getUsageCounts() { return usageCounts; }
    public List<String> getCriticalAssets() { return criticalAssets; }
    public Map<String, AssetProfile> getProfiles() { return profiles; }
}
