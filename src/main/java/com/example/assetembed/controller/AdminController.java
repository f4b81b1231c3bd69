package com.example.assetembed.controller;

import com.example.assetembed.model.EmbedForm;
import com.example.assetembed.model.EmbeddingOptions;
import com.example.assetembed.model.EmbeddingResult;
import com.example.assetembed.model.UploadTarget;
import com.example.assetembed.service.AssetEmbeddingService;
import com.example.assetembed.service.EmbeddingManager;
import com.example.assetembed.service.EmbeddingRequestMapper;
import com.example.assetembed.service.InvalidAssetException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.validation.BindingResult;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PostMapping;

import java.util.LinkedHashMap;
import java.util.Map;

@Controller
public class AdminController {

	private final AssetEmbeddingService embeddingService;
	private final EmbeddingManager embeddingManager;
	private final EmbeddingRequestMapper requestMapper;
	private final ObjectMapper objectMapper;

	public AdminController(AssetEmbeddingService embeddingService,
	                       EmbeddingManager embeddingManager,
	                       EmbeddingRequestMapper requestMapper,
	                       ObjectMapper objectMapper) {
		this.embeddingService = embeddingService;
		this.embeddingManager = embeddingManager;
		this.requestMapper = requestMapper;
		this.objectMapper = objectMapper;
	}

	@GetMapping("/")
	public String index(Model model) {
		model.addAttribute("form", new EmbedForm());
		model.addAttribute("thresholds", embeddingService.calculateOptimalThresholds(false));
		return "index";
	}

	@PostMapping("/embed")
	public String embed(@ModelAttribute("form") EmbedForm form,
	                    BindingResult bindingResult,
	                    Model model) {
		// 简单兜底校验，避免空 HTML
		if (form.getHtml() == null || form.getHtml().trim().isEmpty()) {
			bindingResult.rejectValue("html", "html.empty", "HTML content is required");
			return "index";
		}
		Map<String, Object> assets;
		try {
			assets = parseAssets(form.getAssetsJson());
		} catch (JsonProcessingException e) {
			bindingResult.rejectValue("assetsJson", "assetsJson.invalid", "Assets must be a JSON object of path to base64: " + e.getOriginalMessage());
			return "index";
		}

		EmbeddingOptions options = requestMapper.options();
		options.setEnableBase64(form.isEnableBase64());
		options.setEnableInlineSVG(form.isEnableInlineSvg());
		options.setOptimizeForHTTP2(form.isOptimizeForHttp2());
		options.setUploadToWordPress(form.isUploadToWordPress());
		if (form.getUploadSiteUrl() != null && !form.getUploadSiteUrl().trim().isEmpty()) {
			options.setWordPressConfig(new UploadTarget(form.getUploadSiteUrl().trim(), UploadTarget.DEFAULT_MEDIA_PATH));
		}

		try {
			EmbeddingResult result = embeddingService.process(form.getHtml(), requestMapper.decodeAssets(assets), options);
			model.addAttribute("result", result);
		} catch (InvalidAssetException e) {
			bindingResult.rejectValue("assetsJson", "assetsJson.base64", e.getMessage());
			return "index";
		}
		return "result";
	}

	@GetMapping("/tasks")
	public String tasksPage(Model model) {
		model.addAttribute("tasks", embeddingManager.list());
		model.addAttribute("history", embeddingManager.history());
		return "tasks";
	}

	private Map<String, Object> parseAssets(String json) throws JsonProcessingException {
		if (json == null || json.trim().isEmpty()) return new LinkedHashMap<>();
		return objectMapper.readValue(json, new TypeReference<LinkedHashMap<String, Object>>() {});
	}
}
