package com.example.assetembed.model;

/**
 * Thresholds and switches for one embedding run. Bound from request JSON; the engine
 * works on a {@link #copy()} so the caller's instance is never read mid-run.
 */
public class EmbeddingOptions {

	public static final int DEFAULT_INLINE_THRESHOLD = 10240;

	public static final int DEFAULT_IMAGE_THRESHOLD = 8192;

	public static final int DEFAULT_FONT_THRESHOLD = 50000;

	// HTTP/2 多路复用下请求成本更低，阈值减半
	public static final double HTTP2_THRESHOLD_MULTIPLIER = 0.5;

	private int inlineThreshold = DEFAULT_INLINE_THRESHOLD;

	private int imageThreshold = DEFAULT_IMAGE_THRESHOLD;

	private int fontThreshold = DEFAULT_FONT_THRESHOLD;

	private boolean enableBase64 = true;

	private boolean enableInlineSVG = true;

	private boolean optimizeForHTTP2 = false;

	// 关闭时上传规则不再要求资源可缓存
	private boolean respectCacheHeaders = true;

	private boolean uploadToWordPress = false;

	private UploadTarget wordPressConfig;

	public int getInlineThreshold() {
		return inlineThreshold;
	}

	public void setInlineThreshold(int inlineThreshold) {
		this.inlineThreshold = inlineThreshold;
	}

	public int getImageThreshold() {
		return imageThreshold;
	}

	public void setImageThreshold(int imageThreshold) {
		this.imageThreshold = imageThreshold;
	}

	public int getFontThreshold() {
		return fontThreshold;
	}

	public void setFontThreshold(int fontThreshold) {
		this.fontThreshold = fontThreshold;
	}

	public boolean isEnableBase64() {
		return enableBase64;
	}

	public void setEnableBase64(boolean enableBase64) {
		this.enableBase64 = enableBase64;
	}

	public boolean isEnableInlineSVG() {
		return enableInlineSVG;
	}

	public void setEnableInlineSVG(boolean enableInlineSVG) {
		this.enableInlineSVG = enableInlineSVG;
	}

	public boolean isOptimizeForHTTP2() {
		return optimizeForHTTP2;
	}

	public void setOptimizeForHTTP2(boolean optimizeForHTTP2) {
		this.optimizeForHTTP2 = optimizeForHTTP2;
	}

	public boolean isRespectCacheHeaders() {
		return respectCacheHeaders;
	}

	public void setRespectCacheHeaders(boolean respectCacheHeaders) {
		this.respectCacheHeaders = respectCacheHeaders;
	}

	public boolean isUploadToWordPress() {
		return uploadToWordPress;
	}

	public void setUploadToWordPress(boolean uploadToWordPress) {
		this.uploadToWordPress = uploadToWordPress;
	}

	public UploadTarget getWordPressConfig() {
		return wordPressConfig;
	}

	public void setWordPressConfig(UploadTarget wordPressConfig) {
		this.wordPressConfig = wordPressConfig;
	}

	public int thresholdFor(MediaKind kind) {
		if (kind == MediaKind.IMAGE) return imageThreshold;
		if (kind == MediaKind.FONT) return fontThreshold;
		return inlineThreshold;
	}

	public EmbeddingOptions copy() {
		EmbeddingOptions c = new EmbeddingOptions();
		c.inlineThreshold = inlineThreshold;
		c.imageThreshold = imageThreshold;
		c.fontThreshold = fontThreshold;
		c.enableBase64 = enableBase64;
		c.enableInlineSVG = enableInlineSVG;
		c.optimizeForHTTP2 = optimizeForHTTP2;
		c.respectCacheHeaders = respectCacheHeaders;
		c.uploadToWordPress = uploadToWordPress;
		c.wordPressConfig = wordPressConfig == null ? null : wordPressConfig.copy();
		return c;
	}
}
