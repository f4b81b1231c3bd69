package com.example.assetembed.config;

import com.example.assetembed.model.EmbeddingOptions;
import com.example.assetembed.model.UploadTarget;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "assetembed")
public class EmbeddingProperties {

	// 请求未提供 options 时使用的默认值，支持通过外部配置文件覆盖
	private final Defaults defaults = new Defaults();

	private final Executor executor = new Executor();

	public Defaults getDefaults() {
		return defaults;
	}

	public Executor getExecutor() {
		return executor;
	}

	public EmbeddingOptions newOptions() {
		EmbeddingOptions o = new EmbeddingOptions();
		o.setInlineThreshold(defaults.getInlineThreshold());
		o.setImageThreshold(defaults.getImageThreshold());
		o.setFontThreshold(defaults.getFontThreshold());
		o.setOptimizeForHTTP2(defaults.isOptimizeForHttp2());
		if (defaults.getUploadSiteUrl() != null && !defaults.getUploadSiteUrl().trim().isEmpty()) {
			o.setWordPressConfig(new UploadTarget(defaults.getUploadSiteUrl().trim(), defaults.getUploadMediaPath()));
		}
		return o;
	}

	public static class Defaults {

		private int inlineThreshold = EmbeddingOptions.DEFAULT_INLINE_THRESHOLD;

		private int imageThreshold = EmbeddingOptions.DEFAULT_IMAGE_THRESHOLD;

		private int fontThreshold = EmbeddingOptions.DEFAULT_FONT_THRESHOLD;

		private boolean optimizeForHttp2 = false;

		private String uploadSiteUrl;

		private String uploadMediaPath = UploadTarget.DEFAULT_MEDIA_PATH;

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

		public boolean isOptimizeForHttp2() {
			return optimizeForHttp2;
		}

		public void setOptimizeForHttp2(boolean optimizeForHttp2) {
			this.optimizeForHttp2 = optimizeForHttp2;
		}

		public String getUploadSiteUrl() {
			return uploadSiteUrl;
		}

		public void setUploadSiteUrl(String uploadSiteUrl) {
			this.uploadSiteUrl = uploadSiteUrl;
		}

		public String getUploadMediaPath() {
			return uploadMediaPath;
		}

		public void setUploadMediaPath(String uploadMediaPath) {
			this.uploadMediaPath = uploadMediaPath;
		}
	}

	public static class Executor {

		// 批处理线程数，<=0 时按 CPU 核数的一半（至少 2）
		private int threads = 0;

		private int queueCapacity = 100;

		public int getThreads() {
			return threads;
		}

		public void setThreads(int threads) {
			this.threads = threads;
		}

		public int getQueueCapacity() {
			return queueCapacity;
		}

		public void setQueueCapacity(int queueCapacity) {
			this.queueCapacity = queueCapacity;
		}
	}
}
