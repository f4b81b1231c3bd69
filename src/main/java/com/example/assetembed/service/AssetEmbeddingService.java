package com.example.assetembed.service;

import com.example.assetembed.model.AssetAnalysis;
import com.example.assetembed.model.AssetDecision;
import com.example.assetembed.model.AssetProfile;
import com.example.assetembed.model.AssetRecord;
import com.example.assetembed.model.AssetReference;
import com.example.assetembed.model.EmbeddingOptions;
import com.example.assetembed.model.EmbeddingResult;
import com.example.assetembed.model.EmbeddingStats;
import com.example.assetembed.model.MediaKind;
import com.example.assetembed.model.ThresholdRecommendation;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Extract, profile, decide, rewrite, report: one pass over one page.
 */
@Service
public class AssetEmbeddingService {

    private static final Logger log = LoggerFactory.getLogger(AssetEmbeddingService.class);

    private final ReferenceExtractor extractor;
    private final AssetProfiler profiler;
    private final DecisionEngine engine;
    private final DocumentMutator mutator;
    private final EmbeddingReporter reporter;

    public AssetEmbeddingService(ReferenceExtractor extractor,
                                 AssetProfiler profiler,
                                 DecisionEngine engine,
                                 DocumentMutator mutator,
                                 EmbeddingReporter reporter) {
        this.extractor = extractor;
        this.profiler = profiler;
        this.engine = engine;
        this.mutator = mutator;
        this.reporter = reporter;
    }

    public EmbeddingResult process(String html, Map<String, byte[]> assets, EmbeddingOptions options) {
        Instant start = Instant.now();
        EmbeddingOptions opts = options == null ? new EmbeddingOptions() : options.copy();
        Document doc = Jsoup.parse(html == null ? "" : html);
        // 关闭格式化，避免改动与资源无关的空白
        doc.outputSettings().prettyPrint(false);
        Map<String, AssetRecord> records = toRecords(assets);

        List<AssetReference> refs = extractor.extract(doc);
        Map<String, AssetProfile> profiles = profiler.profile(refs, records);
        Map<String, AssetDecision> decisions = decideAll(profiles, records, opts);
        EmbeddingStats stats = mutator.apply(refs, decisions);
        List<String> recommendations = reporter.recommend(decisions, profiles, stats, opts);

        log.info("[EMBED][DONE] refs={}, assets={}, inlined={}, external={}, uploaded={}, saved={}, elapsed={}ms",
                refs.size(), stats.getTotalAssets(), stats.getInlined(), stats.getExternal(),
                stats.getWordPressUploaded(), stats.getHttpRequestsSaved(),
                Duration.between(start, Instant.now()).toMillis());
        return new EmbeddingResult(doc.outerHtml(), decisions, profiles, stats, recommendations);
    }

    public AssetAnalysis analyze(String html, Map<String, byte[]> assets) {
        Document doc = Jsoup.parse(html == null ? "" : html);
        List<AssetReference> refs = extractor.extract(doc);
        Map<String, AssetProfile> profiles = profiler.profile(refs, toRecords(assets));

        long totalSize = 0;
        Map<MediaKind, Integer> byType = new EnumMap<>(MediaKind.class);
        Map<String, Integer> usage = new LinkedHashMap<>();
        List<String> critical = new ArrayList<>();
        for (AssetProfile p : profiles.values()) {
            totalSize += p.getSize();
            byType.merge(p.getMediaKind(), 1, Integer::sum);
            usage.put(p.getPath(), p.getUsageCount());
            if (p.isCritical()) critical.add(p.getPath());
        }
        long average = profiles.isEmpty() ? 0 : totalSize / profiles.size();
        return new AssetAnalysis(profiles.size(), totalSize, average, byType, usage, critical, profiles);
    }

    public ThresholdRecommendation calculateOptimalThresholds(boolean useHttp2) {
        if (useHttp2) {
            return new ThresholdRecommendation(5120, 4096, 25000,
                    "HTTP/2 multiplexing reduces the cost of additional requests. Lower thresholds recommended.");
        }
        return new ThresholdRecommendation(
                EmbeddingOptions.DEFAULT_INLINE_THRESHOLD,
                EmbeddingOptions.DEFAULT_IMAGE_THRESHOLD,
                EmbeddingOptions.DEFAULT_FONT_THRESHOLD,
                "HTTP/1.1 has high request overhead. Higher thresholds recommended to reduce requests.");
    }

    // 各资源的决策互不依赖，可并行计算，再按文档顺序合并
    private Map<String, AssetDecision> decideAll(Map<String, AssetProfile> profiles,
                                                 Map<String, AssetRecord> records,
                                                 EmbeddingOptions opts) {
        Map<String, AssetDecision> computed = new ConcurrentHashMap<>();
        profiles.values().parallelStream().forEach(p ->
                computed.put(p.getPath(), engine.decide(records.get(p.getPath()), p, opts)));
        Map<String, AssetDecision> ordered = new LinkedHashMap<>();
        for (String path : profiles.keySet()) {
            ordered.put(path, computed.get(path));
        }
        return ordered;
    }

    private static Map<String, AssetRecord> toRecords(Map<String, byte[]> assets) {
        Map<String, AssetRecord> records = new LinkedHashMap<>();
        if (assets == null) return records;
        for (Map.Entry<String, byte[]> e : assets.entrySet()) {
            if (e.getKey() == null || e.getValue() == null) continue;
            records.put(e.getKey(), new AssetRecord(e.getKey(), e.getValue()));
        }
        return records;
    }
}
