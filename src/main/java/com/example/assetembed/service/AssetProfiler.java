package com.example.assetembed.service;

import com.example.assetembed.model.AssetProfile;
import com.example.assetembed.model.AssetRecord;
import com.example.assetembed.model.AssetReference;
import com.example.assetembed.model.MediaKind;
import com.example.assetembed.model.RecommendedAction;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds one {@link AssetProfile} per referenced path that has content. Paths without
 * content, and content nobody references, are left out.
 */
@Component
public class AssetProfiler {

    /** The first N image elements in the page are treated as above the fold. */
    public static final int CRITICAL_IMAGE_LIMIT = 5;

    static final String CRITICAL_REGION_QUERY = "header, .hero, .banner, [class*=above-fold]";

    private static final Set<String> CACHEABLE_FORMATS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            ".jpg", ".jpeg", ".png", ".gif", ".webp", ".svg",
            ".woff", ".woff2", ".ttf", ".eot",
            ".mp4", ".webm", ".mp3")));

    public Map<String, AssetProfile> profile(List<AssetReference> refs, Map<String, AssetRecord> records) {
        // 按首次出现顺序聚合
        Map<String, Integer> usage = new LinkedHashMap<>();
        Map<String, AssetReference> firstImage = new LinkedHashMap<>();
        for (AssetReference ref : refs) {
            usage.merge(ref.getPath(), 1, Integer::sum);
            if (ref.isImageElement()) {
                firstImage.putIfAbsent(ref.getPath(), ref);
            }
        }

        Map<String, AssetProfile> profiles = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> e : usage.entrySet()) {
            AssetRecord record = records.get(e.getKey());
            if (record == null) continue;
            boolean critical = isCritical(firstImage.get(e.getKey()));
            profiles.put(e.getKey(), profileOf(record, e.getValue(), critical));
        }
        return profiles;
    }

    AssetProfile profileOf(AssetRecord record, int usageCount, boolean critical) {
        boolean cacheable = isCacheable(record.getFormat());
        MediaKind kind = record.getMediaKind();
        int size = record.getSize();

        RecommendedAction action;
        String reason;
        if (kind.isStreamingMedia()) {
            action = RecommendedAction.EXTERNAL;
            reason = "Media files are too large";
        } else if (size < 10240 && usageCount == 1) {
            action = RecommendedAction.INLINE;
            reason = "Small, single-use asset";
        } else if (critical && size < 20480) {
            action = RecommendedAction.INLINE;
            reason = "Critical for first paint";
        } else if (usageCount > 1) {
            action = RecommendedAction.EXTERNAL;
            reason = "Reused multiple times";
        } else if (size > 50000 && cacheable) {
            action = RecommendedAction.UPLOAD;
            reason = "Large, cacheable asset";
        } else {
            action = RecommendedAction.EXTERNAL;
            reason = "Default strategy";
        }
        return new AssetProfile(record.getPath(), kind, record.getFormat(), size, usageCount, critical, cacheable, action, reason);
    }

    static boolean isCritical(AssetReference firstImage) {
        if (firstImage == null) return false;
        if (firstImage.getElement().closest(CRITICAL_REGION_QUERY) != null) return true;
        return firstImage.getImageIndex() < CRITICAL_IMAGE_LIMIT;
    }

    static boolean isCacheable(String format) {
        return format != null && CACHEABLE_FORMATS.contains(format);
    }
}
