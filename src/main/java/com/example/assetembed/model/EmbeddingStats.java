package com.example.assetembed.model;

/**
 * Running totals collected while a document is rewritten, one count per distinct asset.
 */
public class EmbeddingStats {

    private int totalAssets;
    private int inlined;
    private int external;
    private int wordPressUploaded;
    private long totalSizeBefore;
    private long totalSizeAfter;
    private int httpRequestsSaved;

    public int getTotalAssets() { return totalAssets; }
    public int getInlined() { return inlined; }
    public int getExternal() { return external; }
    public int getWordPressUploaded() { return wordPressUploaded; }
    public long getTotalSizeBefore() { return totalSizeBefore; }
    public long getTotalSizeAfter() { return totalSizeAfter; }
    public int getHttpRequestsSaved() { return httpRequestsSaved; }

    public void recordInlined(long sizeBefore, long sizeAfter) {
        record(sizeBefore, sizeAfter);
        inlined++;
        httpRequestsSaved++;
    }

    public void recordExternal(long size) {
        record(size, size);
        external++;
    }

    public void recordUploaded(long size) {
        record(size, size);
        wordPressUploaded++;
    }

    private void record(long before, long after) {
        totalAssets++;
        totalSizeBefore += before;
        totalSizeAfter += after;
    }

    /** Share of assets whose request was removed, rounded; 0 when there were no assets. */
    public int reductionPercent() {
        if (totalAssets == 0) return 0;
        return (int) Math.round(httpRequestsSaved * 100.0 / totalAssets);
    }
}
