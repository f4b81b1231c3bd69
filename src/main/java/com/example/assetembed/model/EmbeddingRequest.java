package com.example.assetembed.model;

import java.util.LinkedHashMap;
import java.util.Map;

public class EmbeddingRequest {

	private String html;

	// 资源：路径 -> base64 内容；非字符串值会被跳过
	private Map<String, Object> assets;

	// 覆盖默认配置的选项（仅包含需要覆盖的字段）
	private Map<String, Object> options = new LinkedHashMap<>();

	public String getHtml() {
		return html;
	}

	public void setHtml(String html) {
		this.html = html;
	}

	public Map<String, Object> getAssets() {
		return assets;
	}

	public void setAssets(Map<String, Object> assets) {
		this.assets = assets;
	}

	public Map<String, Object> getOptions() {
		return options;
	}

	public void setOptions(Map<String, Object> options) {
		this.options = options;
	}
}
