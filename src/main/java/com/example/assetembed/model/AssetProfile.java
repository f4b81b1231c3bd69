package com.example.assetembed.model;

public final class AssetProfile {

    private final String path;
    private final MediaKind mediaKind;
    private final String format;
    private final int size;
    private final int usageCount;
    private final boolean critical;
    private final boolean cacheable;
    private final RecommendedAction recommendedAction;
    private final String reason;

    public AssetProfile(String path,
                        MediaKind mediaKind,
                        String format,
                        int size,
                        int usageCount,
                        boolean critical,
                        boolean cacheable,
                        RecommendedAction recommendedAction,
                        String reason) {
        if (usageCount < 1) {
            throw new IllegalArgumentException("usageCount must be >= 1 for " + path);
        }
        this.path = path;
        this.mediaKind = mediaKind;
        this.format = format;
        this.size = size;
        this.usageCount = usageCount;
        this.critical = critical;
        this.cacheable = cacheable;
        this.recommendedAction = recommendedAction;
        this.reason = reason;
    }

    public String getPath() { return path; }
    public MediaKind getMediaKind() { return mediaKind; }
    public String getFormat() { return format; }
    public int getSize() { return size; }
    public int getUsageCount() { return usageCount; }
    public boolean isCritical() { return critical; }
    public boolean isCacheable() { return cacheable; }
    public RecommendedAction getRecommendedAction() { return recommendedAction; }
    public String getReason() { return reason; }
}
