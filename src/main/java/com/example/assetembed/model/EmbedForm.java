package com.example.assetembed.model;

/**
 * Backing object of the admin page form.
 */
public class EmbedForm {

	private String html;

	// 资源 JSON：{"路径": "base64 内容"}
	private String assetsJson;

	private boolean enableBase64 = true;

	private boolean enableInlineSvg = true;

	private boolean optimizeForHttp2 = false;

	private boolean uploadToWordPress = false;

	private String uploadSiteUrl;

	public String getHtml() {
		return html;
	}

	public void setHtml(String html) {
		this.html = html;
	}

	public String getAssetsJson() {
		return assetsJson;
	}

	public void setAssetsJson(String assetsJson) {
		this.assetsJson = assetsJson;
	}

	public boolean isEnableBase64() {
		return enableBase64;
	}

	public void setEnableBase64(boolean enableBase64) {
		this.enableBase64 = enableBase64;
	}

	public boolean isEnableInlineSvg() {
		return enableInlineSvg;
	}

	public void setEnableInlineSvg(boolean enableInlineSvg) {
		this.enableInlineSvg = enableInlineSvg;
	}

	public boolean isOptimizeForHttp2() {
		return optimizeForHttp2;
	}

	public void setOptimizeForHttp2(boolean optimizeForHttp2) {
		this.optimizeForHttp2 = optimizeForHttp2;
	}

	public boolean isUploadToWordPress() {
		return uploadToWordPress;
	}

	public void setUploadToWordPress(boolean uploadToWordPress) {
		this.uploadToWordPress = uploadToWordPress;
	}

	public String getUploadSiteUrl() {
		return uploadSiteUrl;
	}

	public void setUploadSiteUrl(String uploadSiteUrl) {
		this.uploadSiteUrl = uploadSiteUrl;
	}
}
