package com.example.assetembed.service;

import com.example.assetembed.model.AssetDecision;
import com.example.assetembed.model.DecisionKind;
import com.example.assetembed.model.EmbeddingOptions;

/**
 * Embedding rules in priority order. {@link DecisionEngine} applies the first constant
 * whose {@link #matches} returns true; {@link #DEFAULT_EXTERNAL} always matches.
 */
enum EmbeddingRule {

    VECTOR_INLINE {
        @Override
        boolean matches(DecisionContext ctx) {
            return ctx.options.isEnableInlineSVG() && ".svg".equals(ctx.record.getFormat());
        }

        @Override
        AssetDecision apply(DecisionContext ctx) {
            return AssetDecision.of(ctx.record, DecisionKind.INLINE_SVG)
                    .reason("Vector formats benefit from inlining for manipulation")
                    .payload(ctx.record.text())
                    .savings(1, 0)
                    .build();
        }
    },

    DELEGATE_UPLOAD {
        @Override
        boolean matches(DecisionContext ctx) {
            EmbeddingOptions o = ctx.options;
            // 未配置上传目标时不生成无效 URL，交给后续规则
            if (!o.isUploadToWordPress() || o.getWordPressConfig() == null || !o.getWordPressConfig().isUsable()) {
                return false;
            }
            boolean cacheable = !o.isRespectCacheHeaders() || ctx.profile.isCacheable();
            return ctx.size() > ctx.threshold && cacheable && ctx.profile.getUsageCount() == 1;
        }

        @Override
        AssetDecision apply(DecisionContext ctx) {
            return AssetDecision.of(ctx.record, DecisionKind.WORDPRESS_UPLOAD)
                    .reason("Large single-use asset routed to managed storage")
                    .externalUrl(ctx.options.getWordPressConfig().resolve(ctx.record.fileName()))
                    .build();
        }
    },

    SIZE_INLINE {
        @Override
        boolean matches(DecisionContext ctx) {
            if (!ctx.options.isEnableBase64() || ctx.size() > ctx.threshold) {
                return false;
            }
            double effective = ctx.options.isOptimizeForHTTP2()
                    ? ctx.threshold * EmbeddingOptions.HTTP2_THRESHOLD_MULTIPLIER
                    : ctx.threshold;
            return ctx.size() <= effective;
        }

        @Override
        AssetDecision apply(DecisionContext ctx) {
            return DecisionEngine.inlineBase64(ctx)
                    .reason("Small asset (" + ctx.size() + " bytes, " + ByteFormat.format(ctx.size()) + ") inlined to save an HTTP request")
                    .build();
        }
    },

    CRITICAL_INLINE {
        @Override
        boolean matches(DecisionContext ctx) {
            return ctx.profile.isCritical()
                    && ctx.size() <= 2L * ctx.threshold
                    && ctx.options.isEnableBase64();
        }

        @Override
        AssetDecision apply(DecisionContext ctx) {
            AssetDecision.Builder b = DecisionEngine.inlineBase64(ctx)
                    .reason("Critical above-the-fold asset inlined for faster paint");
            if (ctx.size() > ctx.threshold) {
                b.warning("Asset is " + ByteFormat.format(ctx.size()) + ", larger than the "
                        + ByteFormat.format(ctx.threshold) + " inline threshold");
            }
            return b.build();
        }
    },

    MULTI_USE {
        @Override
        boolean matches(DecisionContext ctx) {
            return ctx.profile.getUsageCount() > 1;
        }

        @Override
        AssetDecision apply(DecisionContext ctx) {
            return AssetDecision.of(ctx.record, DecisionKind.EXTERNAL)
                    .reason("Used " + ctx.profile.getUsageCount() + " times; a shared external file can be cached")
                    .build();
        }
    },

    DEFAULT_EXTERNAL {
        @Override
        boolean matches(DecisionContext ctx) {
            return true;
        }

        @Override
        AssetDecision apply(DecisionContext ctx) {
            return AssetDecision.of(ctx.record, DecisionKind.EXTERNAL)
                    .reason("Asset size (" + ctx.size() + " bytes) exceeds every inline threshold")
                    .build();
        }
    };

    abstract boolean matches(DecisionContext ctx);

    abstract AssetDecision apply(DecisionContext ctx);
}
