package com.example.assetembed.controller;

import com.example.assetembed.model.AssetAnalysis;
import com.example.assetembed.model.AssetDecision;
import com.example.assetembed.model.AssetProfile;
import com.example.assetembed.model.BatchPageResult;
import com.example.assetembed.model.BatchRequest;
import com.example.assetembed.model.DecisionKind;
import com.example.assetembed.model.EmbeddingOptions;
import com.example.assetembed.model.EmbeddingRequest;
import com.example.assetembed.model.EmbeddingResult;
import com.example.assetembed.model.EmbeddingTask;
import com.example.assetembed.model.ThresholdRecommendation;
import com.example.assetembed.service.AssetEmbeddingService;
import com.example.assetembed.service.ByteFormat;
import com.example.assetembed.service.EmbeddingManager;
import com.example.assetembed.service.EmbeddingRequestMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/asset-embedding")
public class AssetEmbeddingController {

    private static final Logger log = LoggerFactory.getLogger(AssetEmbeddingController.class);

    private final AssetEmbeddingService embeddingService;
    private final EmbeddingManager embeddingManager;
    private final EmbeddingRequestMapper requestMapper;

    public AssetEmbeddingController(AssetEmbeddingService embeddingService,
                                    EmbeddingManager embeddingManager,
                                    EmbeddingRequestMapper requestMapper) {
        this.embeddingService = embeddingService;
        this.embeddingManager = embeddingManager;
        this.requestMapper = requestMapper;
    }

    @PostMapping("/process")
    public ResponseEntity<Map<String, Object>> process(@RequestBody EmbeddingRequest form) {
        ResponseEntity<Map<String, Object>> invalid = validate(form);
        if (invalid != null) return invalid;
        EmbeddingResult result = run(form, requestMapper.options(form.getOptions()));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("html", result.getHtml());
        payload.put("decisions", new ArrayList<>(result.getDecisions().values()));
        payload.put("stats", result.getStats());
        payload.put("recommendations", result.getRecommendations());
        Map<String, Object> body = ok();
        body.put("result", payload);
        return ResponseEntity.ok(body);
    }

    @PostMapping("/analyze")
    public ResponseEntity<Map<String, Object>> analyze(@RequestBody EmbeddingRequest form) {
        ResponseEntity<Map<String, Object>> invalid = validate(form);
        if (invalid != null) return invalid;
        AssetAnalysis analysis = embeddingService.analyze(form.getHtml(), requestMapper.decodeAssets(form.getAssets()));
        Map<String, Object> body = ok();
        body.put("analysis", analysis);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/calculate-thresholds")
    public ResponseEntity<Map<String, Object>> calculateThresholds(@RequestParam(value = "http2", required = false) String http2) {
        boolean useHttp2 = "true".equals(http2) || "1".equals(http2);
        ThresholdRecommendation t = embeddingService.calculateOptimalThresholds(useHttp2);

        Map<String, Object> formatted = new LinkedHashMap<>();
        formatted.put("inlineThreshold", ByteFormat.format(t.getInlineThreshold()));
        formatted.put("imageThreshold", ByteFormat.format(t.getImageThreshold()));
        formatted.put("fontThreshold", ByteFormat.format(t.getFontThreshold()));
        Map<String, Object> body = ok();
        body.put("http2", useHttp2);
        body.put("thresholds", t);
        body.put("formatted", formatted);
        return ResponseEntity.ok(body);
    }

    // 使用面向 HTTP/2 的默认选项快速处理
    @PostMapping("/quick-process")
    public ResponseEntity<Map<String, Object>> quickProcess(@RequestBody EmbeddingRequest form) {
        ResponseEntity<Map<String, Object>> invalid = validate(form);
        if (invalid != null) return invalid;
        EmbeddingOptions options = requestMapper.options();
        options.setOptimizeForHTTP2(true);
        options.setEnableBase64(true);
        options.setEnableInlineSVG(true);
        EmbeddingResult result = run(form, options);

        Map<String, Object> body = ok();
        body.put("html", result.getHtml());
        body.put("stats", result.getStats());
        return ResponseEntity.ok(body);
    }

    @PostMapping("/batch-process")
    public ResponseEntity<Map<String, Object>> batchProcess(@RequestBody BatchRequest batch) {
        if (batch == null || batch.getPages() == null) {
            return badRequest("Pages array is required");
        }
        List<BatchPageResult> results = embeddingManager.runBatch(batch);
        long successful = results.stream().filter(BatchPageResult::isSuccess).count();

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("total", results.size());
        summary.put("successful", successful);
        summary.put("failed", results.size() - successful);
        Map<String, Object> body = ok();
        body.put("results", results);
        body.put("summary", summary);
        return ResponseEntity.ok(body);
    }

    @PostMapping("/stats")
    public ResponseEntity<Map<String, Object>> stats(@RequestBody EmbeddingRequest form) {
        ResponseEntity<Map<String, Object>> invalid = validate(form);
        if (invalid != null) return invalid;
        EmbeddingResult result = run(form, requestMapper.options(form.getOptions()));
        Map<String, Object> body = ok();
        body.put("stats", result.getStats());
        body.put("recommendations", result.getRecommendations());
        return ResponseEntity.ok(body);
    }

    @PostMapping("/decision-preview")
    public ResponseEntity<Map<String, Object>> decisionPreview(@RequestBody EmbeddingRequest form) {
        ResponseEntity<Map<String, Object>> invalid = validate(form);
        if (invalid != null) return invalid;
        EmbeddingResult result = run(form, requestMapper.options(form.getOptions()));

        Map<String, Long> counts = new LinkedHashMap<>();
        for (DecisionKind kind : DecisionKind.values()) {
            counts.put(kind.getLabel(), result.count(kind));
        }
        List<Map<String, Object>> entries = new ArrayList<>();
        for (AssetDecision d : result.getDecisions().values()) {
            AssetProfile p = result.getProfiles().get(d.getAssetPath());
            Map<String, Object> e = new LinkedHashMap<>();
            e.put("path", d.getAssetPath());
            e.put("type", d.getAssetType());
            e.put("size", d.getOriginalSize());
            e.put("sizeFormatted", ByteFormat.format(d.getOriginalSize()));
            e.put("decision", d.getDecision());
            e.put("reason", d.getReason());
            e.put("isCritical", p != null && p.isCritical());
            entries.add(e);
        }
        Map<String, Object> preview = new LinkedHashMap<>();
        preview.put("totalAssets", result.getDecisions().size());
        preview.put("decisionCounts", counts);
        preview.put("decisions", entries);
        preview.put("stats", result.getStats());
        Map<String, Object> body = ok();
        body.put("preview", preview);
        return ResponseEntity.ok(body);
    }

    // 异步提交批处理任务
    @PostMapping("/batch/async")
    public ResponseEntity<String> batchAsync(@RequestBody BatchRequest batch) {
        if (batch == null || batch.getPages() == null || batch.getPages().isEmpty()) {
            return ResponseEntity.badRequest().body("Pages array is required");
        }
        log.info("[FORM][ASYNC] pages={}, globalOptions={}", batch.getPages().size(), batch.getGlobalOptions());
        EmbeddingTask task = embeddingManager.submit(batch);
        return ResponseEntity.ok(task.getId());
    }

    @GetMapping("/tasks/{id}")
    public ResponseEntity<Object> getTask(@PathVariable("id") String id) {
        EmbeddingTask t = embeddingManager.get(id);
        if (t == null) return ResponseEntity.status(HttpStatus.NOT_FOUND).body("Task not found");
        return ResponseEntity.ok(t);
    }

    @GetMapping("/tasks")
    public ResponseEntity<Object> listTasks() {
        return ResponseEntity.ok(embeddingManager.list());
    }

    @PostMapping("/tasks/{id}/cancel")
    public ResponseEntity<Map<String, Object>> cancelTask(@PathVariable("id") String id) {
        if (embeddingManager.get(id) == null) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("success", false);
            body.put("error", "Task not found");
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", embeddingManager.cancel(id));
        return ResponseEntity.ok(body);
    }

    private EmbeddingResult run(EmbeddingRequest form, EmbeddingOptions options) {
        return embeddingService.process(form.getHtml(), requestMapper.decodeAssets(form.getAssets()), options);
    }

    private static ResponseEntity<Map<String, Object>> validate(EmbeddingRequest form) {
        if (form == null || form.getHtml() == null || form.getHtml().isEmpty()) {
            return badRequest("HTML content is required");
        }
        if (form.getAssets() == null) {
            return badRequest("Assets object is required (key: path, value: base64 content)");
        }
        return null;
    }

    private static Map<String, Object> ok() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        return body;
    }

    static ResponseEntity<Map<String, Object>> badRequest(String error) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", error);
        return ResponseEntity.badRequest().body(body);
    }
}
