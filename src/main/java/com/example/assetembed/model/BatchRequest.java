package com.example.assetembed.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class BatchRequest {

	private List<BatchPage> pages = new ArrayList<>();

	// 各页面共享的选项，页面自身 options 优先
	private Map<String, Object> globalOptions = new LinkedHashMap<>();

	public List<BatchPage> getPages() {
		return pages;
	}

	public void setPages(List<BatchPage> pages) {
		this.pages = pages;
	}

	public Map<String, Object> getGlobalOptions() {
		return globalOptions;
	}

	public void setGlobalOptions(Map<String, Object> globalOptions) {
		this.globalOptions = globalOptions;
	}
}
