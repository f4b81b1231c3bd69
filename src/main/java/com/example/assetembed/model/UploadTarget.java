package com.example.assetembed.model;

/**
 * Media library that large single-use assets are routed to. Only the public URL is
 * synthesised here; the upload itself happens elsewhere.
 */
public class UploadTarget {

	public static final String DEFAULT_MEDIA_PATH = "/wp-content/uploads/";

	public static final String FILENAME_PLACEHOLDER = "{filename}";

	private String siteUrl;

	// 媒体路径模板，可包含 {filename}；未包含时文件名直接追加在末尾
	private String mediaPath = DEFAULT_MEDIA_PATH;

	public UploadTarget() {
	}

	public UploadTarget(String siteUrl, String mediaPath) {
		this.siteUrl = siteUrl;
		this.mediaPath = mediaPath;
	}

	public String getSiteUrl() {
		return siteUrl;
	}

	public void setSiteUrl(String siteUrl) {
		this.siteUrl = siteUrl;
	}

	public String getMediaPath() {
		return mediaPath;
	}

	public void setMediaPath(String mediaPath) {
		this.mediaPath = mediaPath;
	}

	public boolean isUsable() {
		return siteUrl != null && !siteUrl.trim().isEmpty();
	}

	public String resolve(String fileName) {
		if (!isUsable()) {
			throw new IllegalStateException("upload target has no siteUrl");
		}
		String base = siteUrl.trim();
		String template = (mediaPath == null || mediaPath.trim().isEmpty()) ? DEFAULT_MEDIA_PATH : mediaPath.trim();
		String path = template.contains(FILENAME_PLACEHOLDER)
				? template.replace(FILENAME_PLACEHOLDER, fileName)
				: (template.endsWith("/") ? template : template + "/") + fileName;
		// 拼接处只保留一个斜杠
		if (base.endsWith("/") && path.startsWith("/")) {
			return base + path.substring(1);
		}
		if (!base.endsWith("/") && !path.startsWith("/")) {
			return base + "/" + path;
		}
		return base + path;
	}

	public UploadTarget copy() {
		return new UploadTarget(siteUrl, mediaPath);
	}
}
