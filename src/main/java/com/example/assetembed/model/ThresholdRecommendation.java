package com.example.assetembed.model;

public class ThresholdRecommendation {

    private final int inlineThreshold;
    private final int imageThreshold;
    private final int fontThreshold;
    private final String reasoning;

    public ThresholdRecommendation(int inlineThreshold, int imageThreshold, int fontThreshold, String reasoning) {
        this.inlineThreshold = inlineThreshold;
        this.imageThreshold = imageThreshold;
        this.fontThreshold = fontThreshold;
        this.reasoning = reasoning;
    }

    public int getInlineThreshold() { return inlineThreshold; }
    public int getImageThreshold() { return imageThreshold; }
    public int getFontThreshold() { return fontThreshold; }
    public String getReasoning() { return reasoning; }
}
