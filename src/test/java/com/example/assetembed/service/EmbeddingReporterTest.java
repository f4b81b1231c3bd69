package com.example.assetembed.service;

import com.example.assetembed.model.AssetDecision;
import com.example.assetembed.model.AssetProfile;
import com.example.assetembed.model.AssetRecord;
import com.example.assetembed.model.DecisionKind;
import com.example.assetembed.model.EmbeddingOptions;
import com.example.assetembed.model.EmbeddingStats;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class EmbeddingReporterTest {

    private final EmbeddingReporter reporter = new EmbeddingReporter();
    private final AssetProfiler profiler = new AssetProfiler();

    private final Map<String, AssetDecision> decisions = new LinkedHashMap<>();
    private final Map<String, AssetProfile> profiles = new LinkedHashMap<>();
    private final EmbeddingStats stats = new EmbeddingStats();

    private void add(String path, int size, DecisionKind kind, boolean critical) {
        AssetRecord record = new AssetRecord(path, new byte[size]);
        decisions.put(path, AssetDecision.of(record, kind).reason("test").build());
        profiles.put(path, profiler.profileOf(record, 1, critical));
        if (kind == DecisionKind.INLINE_BASE64 || kind == DecisionKind.INLINE_SVG) {
            stats.recordInlined(size, size);
        } else if (kind == DecisionKind.WORDPRESS_UPLOAD) {
            stats.recordUploaded(size);
        } else {
            stats.recordExternal(size);
        }
    }

    @Test
    void zeroAssetsStillProducesAWellFormedReport() {
        List<String> out = reporter.recommend(Collections.emptyMap(), Collections.emptyMap(), new EmbeddingStats(), new EmbeddingOptions());

        assertEquals(1, out.size());
        assertThat(out.get(0)).contains("current: 0% reduction");
    }

    @Test
    void excellentReductionWithSavedRequests() {
        add("/a.png", 100, DecisionKind.INLINE_BASE64, false);
        add("/b.png", 100, DecisionKind.INLINE_BASE64, false);
        add("/c.png", 100, DecisionKind.EXTERNAL, false);

        List<String> out = reporter.recommend(decisions, profiles, stats, new EmbeddingOptions());

        assertEquals(List.of("Saved 2 HTTP requests by inlining small assets", "Excellent! Reduced HTTP requests by 67%"), out);
    }

    @Test
    void goodTierBetweenTenAndThirtyPercent() {
        add("/a.png", 100, DecisionKind.INLINE_BASE64, false);
        for (int i = 0; i < 4; i++) add("/x" + i + ".bin", 100, DecisionKind.EXTERNAL, false);

        List<String> out = reporter.recommend(decisions, profiles, stats, new EmbeddingOptions());

        assertThat(out).contains("Good! Reduced HTTP requests by 20%");
    }

    @Test
    void warnsAboutBase64OverheadAboveFiftyKilobytes() {
        add("/a.woff", 30000, DecisionKind.INLINE_BASE64, false);
        add("/b.woff", 30000, DecisionKind.INLINE_BASE64, false);

        List<String> out = reporter.recommend(decisions, profiles, stats, new EmbeddingOptions());

        assertThat(out).anyMatch(s -> s.startsWith("58.59KB of assets inlined"));
    }

    @Test
    void suggestsHttp2OnlyWhenItIsOffAndManyAssetsWereInlined() {
        for (int i = 0; i < 11; i++) add("/i" + i + ".png", 10, DecisionKind.INLINE_BASE64, false);
        EmbeddingOptions http2 = new EmbeddingOptions();
        http2.setOptimizeForHTTP2(true);

        assertThat(reporter.recommend(decisions, profiles, stats, new EmbeddingOptions())).anyMatch(s -> s.contains("HTTP/2"));
        assertThat(reporter.recommend(decisions, profiles, stats, http2)).noneMatch(s -> s.contains("HTTP/2"));
    }

    @Test
    void suggestsUploadForLargeExternalAssetsUnlessEnabled() {
        add("/big.jpg", 150000, DecisionKind.EXTERNAL, false);
        EmbeddingOptions upload = new EmbeddingOptions();
        upload.setUploadToWordPress(true);

        assertThat(reporter.recommend(decisions, profiles, stats, new EmbeddingOptions()))
                .anyMatch(s -> s.startsWith("1 large assets (>100KB) detected"));
        assertThat(reporter.recommend(decisions, profiles, stats, upload)).noneMatch(s -> s.contains("100KB"));
    }

    @Test
    void warnsWhenCriticalAssetsStayExternal() {
        add("/hero.jpg", 90000, DecisionKind.EXTERNAL, true);
        add("/footer.jpg", 90000, DecisionKind.EXTERNAL, false);

        List<String> out = reporter.recommend(decisions, profiles, stats, new EmbeddingOptions());

        assertThat(out).anyMatch(s -> s.startsWith("1 critical assets are external"));
        assertThat(out.get(out.size() - 1)).contains("current: 0% reduction");
    }
}
