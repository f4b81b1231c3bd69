package com.example.assetembed.service;

import com.example.assetembed.model.AssetDecision;
import com.example.assetembed.model.AssetProfile;
import com.example.assetembed.model.DecisionKind;
import com.example.assetembed.model.EmbeddingOptions;
import com.example.assetembed.model.EmbeddingStats;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Derives advisory messages from a finished run. Each check is independent; the output
 * order follows the order of the checks below.
 */
@Component
public class EmbeddingReporter {

    static final long INLINED_BYTES_WARNING = 50000;
    static final int HTTP2_SUGGESTION_INLINED = 10;
    static final long LARGE_EXTERNAL_BYTES = 100000;
    static final int EXCELLENT_PERCENT = 30;
    static final int GOOD_PERCENT = 10;

    public List<String> recommend(Map<String, AssetDecision> decisions,
                                  Map<String, AssetProfile> profiles,
                                  EmbeddingStats stats,
                                  EmbeddingOptions options) {
        List<String> out = new ArrayList<>();

        if (stats.getHttpRequestsSaved() > 0) {
            out.add("Saved " + stats.getHttpRequestsSaved() + " HTTP requests by inlining small assets");
        }

        long inlinedBytes = decisions.values().stream()
                .filter(d -> d.getDecision() == DecisionKind.INLINE_BASE64)
                .mapToLong(AssetDecision::getOriginalSize)
                .sum();
        if (inlinedBytes > INLINED_BYTES_WARNING) {
            out.add(String.format(Locale.ROOT,
                    "%.2fKB of assets inlined. This increases HTML size by ~37%% due to Base64 encoding.",
                    inlinedBytes / 1024.0));
        }

        if (!options.isOptimizeForHTTP2() && stats.getInlined() > HTTP2_SUGGESTION_INLINED) {
            out.add("Consider enabling HTTP/2 optimization. With HTTP/2 multiplexing, fewer assets need inlining.");
        }

        long largeExternal = decisions.values().stream()
                .filter(d -> d.getDecision() == DecisionKind.EXTERNAL && d.getOriginalSize() > LARGE_EXTERNAL_BYTES)
                .count();
        if (largeExternal > 0 && !options.isUploadToWordPress()) {
            out.add(largeExternal + " large assets (>100KB) detected. Consider uploading to the WordPress media library.");
        }

        long criticalExternal = decisions.values().stream()
                .filter(d -> d.getDecision() == DecisionKind.EXTERNAL)
                .filter(d -> {
                    AssetProfile p = profiles.get(d.getAssetPath());
                    return p != null && p.isCritical();
                })
                .count();
        if (criticalExternal > 0) {
            out.add(criticalExternal + " critical assets are external. Consider inlining them for a faster first paint.");
        }

        int reduction = stats.reductionPercent();
        if (reduction >= EXCELLENT_PERCENT) {
            out.add("Excellent! Reduced HTTP requests by " + reduction + "%");
        } else if (reduction >= GOOD_PERCENT) {
            out.add("Good! Reduced HTTP requests by " + reduction + "%");
        } else {
            out.add("Consider adjusting thresholds to inline more small assets (current: " + reduction + "% reduction)");
        }
        return out;
    }
}
