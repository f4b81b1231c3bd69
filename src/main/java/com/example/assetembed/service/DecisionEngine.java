package com.example.assetembed.service;

import com.example.assetembed.model.AssetDecision;
import com.example.assetembed.model.AssetProfile;
import com.example.assetembed.model.AssetRecord;
import com.example.assetembed.model.DecisionKind;
import com.example.assetembed.model.EmbeddingOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Turns one profiled asset into exactly one {@link AssetDecision}. The result depends
 * only on the record, its profile and the options, so assets can be decided in any
 * order or in parallel.
 */
@Component
public class DecisionEngine {

    private static final Logger log = LoggerFactory.getLogger(DecisionEngine.class);

    // base64 膨胀的估算系数（实际约 33%）
    public static final double BASE64_OVERHEAD = 0.37;

    private static final Map<String, String> MIME_TYPES = new HashMap<>();

    static {
        MIME_TYPES.put(".jpg", "image/jpeg");
        MIME_TYPES.put(".jpeg", "image/jpeg");
        MIME_TYPES.put(".png", "image/png");
        MIME_TYPES.put(".gif", "image/gif");
        MIME_TYPES.put(".webp", "image/webp");
        MIME_TYPES.put(".svg", "image/svg+xml");
        MIME_TYPES.put(".bmp", "image/bmp");
        MIME_TYPES.put(".ico", "image/x-icon");
        MIME_TYPES.put(".woff", "font/woff");
        MIME_TYPES.put(".woff2", "font/woff2");
        MIME_TYPES.put(".ttf", "font/ttf");
        MIME_TYPES.put(".otf", "font/otf");
        MIME_TYPES.put(".eot", "application/vnd.ms-fontobject");
        MIME_TYPES.put(".mp4", "video/mp4");
        MIME_TYPES.put(".webm", "video/webm");
        MIME_TYPES.put(".mp3", "audio/mpeg");
    }

    public AssetDecision decide(AssetRecord record, AssetProfile profile, EmbeddingOptions options) {
        AssetDecision decision;
        if (record.getMediaKind().isStreamingMedia()) {
            decision = AssetDecision.of(record, DecisionKind.EXTERNAL)
                    .reason("Media files are too large to inline")
                    .warning("Consider a streaming service for " + record.getMediaKind().getLabel() + " content")
                    .build();
        } else {
            decision = null;
            DecisionContext ctx = new DecisionContext(record, profile, options);
            for (EmbeddingRule rule : EmbeddingRule.values()) {
                if (rule.matches(ctx)) {
                    decision = rule.apply(ctx);
                    log.debug("[EMBED][RULE] {} matched {}", rule, record.getPath());
                    break;
                }
            }
        }
        log.debug("[EMBED][DECIDE] {}", decision);
        return decision;
    }

    static AssetDecision.Builder inlineBase64(DecisionContext ctx) {
        return AssetDecision.of(ctx.record, DecisionKind.INLINE_BASE64)
                .payload(dataUri(mimeTypeOf(ctx.record.getFormat()), ctx.record.base64()))
                .savings(1, Math.round(ctx.size() * BASE64_OVERHEAD));
    }

    public static String dataUri(String mimeType, String base64) {
        return "data:" + mimeType + ";base64," + base64;
    }

    public static String mimeTypeOf(String format) {
        String mime = format == null ? null : MIME_TYPES.get(format.toLowerCase(Locale.ROOT));
        return mime != null ? mime : "application/octet-stream";
    }
}
