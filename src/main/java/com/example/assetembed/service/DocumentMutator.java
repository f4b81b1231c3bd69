package com.example.assetembed.service;

import com.example.assetembed.model.AssetDecision;
import com.example.assetembed.model.AssetReference;
import com.example.assetembed.model.DecisionKind;
import com.example.assetembed.model.EmbeddingStats;
import com.example.assetembed.model.ReferenceLocator;
import org.jsoup.nodes.DataNode;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Writes decisions back into a page. Every occurrence of a decided path is rewritten the
 * same way; everything else in the page is left alone. Not thread-safe per document.
 */
@Component
public class DocumentMutator {

    private static final Logger log = LoggerFactory.getLogger(DocumentMutator.class);

    private static final Pattern XML_PROLOG = Pattern.compile("^\\s*(<\\?xml[^>]*\\?>\\s*)?(<!DOCTYPE[^>]*>\\s*)?", Pattern.CASE_INSENSITIVE);

    private final ReferenceExtractor extractor;

    public DocumentMutator(ReferenceExtractor extractor) {
        this.extractor = extractor;
    }

    public EmbeddingStats apply(Document doc, Map<String, AssetDecision> decisions) {
        return apply(extractor.extract(doc), decisions);
    }

    public EmbeddingStats apply(List<AssetReference> refs, Map<String, AssetDecision> decisions) {
        EmbeddingStats stats = new EmbeddingStats();
        Set<String> counted = new HashSet<>();
        // 同一元素的样式文本只重写一次，按元素收集需要替换的片段
        Map<Element, List<AssetReference>> styleAttrRefs = new LinkedHashMap<>();
        Map<Element, List<AssetReference>> styleBlockRefs = new LinkedHashMap<>();

        for (AssetReference ref : refs) {
            AssetDecision decision = decisions.get(ref.getPath());
            if (decision == null) continue;
            if (counted.add(ref.getPath())) {
                record(stats, decision);
            }
            switch (ref.getLocator()) {
                case IMG_SRC:
                case MEDIA_SRC:
                    applyToElement(ref, decision);
                    break;
                case STYLE_ATTRIBUTE:
                    if (cssValueFor(decision) != null) {
                        styleAttrRefs.computeIfAbsent(ref.getElement(), k -> new ArrayList<>()).add(ref);
                    }
                    break;
                case STYLE_BLOCK:
                    if (cssValueFor(decision) != null) {
                        styleBlockRefs.computeIfAbsent(ref.getElement(), k -> new ArrayList<>()).add(ref);
                    }
                    break;
                default:
                    break;
            }
        }

        for (Map.Entry<Element, List<AssetReference>> e : styleAttrRefs.entrySet()) {
            Element el = e.getKey();
            el.attr("style", splice(el.attr("style"), e.getValue(), decisions));
        }
        for (Map.Entry<Element, List<AssetReference>> e : styleBlockRefs.entrySet()) {
            Element st = e.getKey();
            String css = splice(st.data(), e.getValue(), decisions);
            st.empty();
            st.appendChild(new DataNode(css));
        }
        log.debug("[EMBED][MUTATE] refs={}, inlined={}, external={}, uploaded={}",
                refs.size(), stats.getInlined(), stats.getExternal(), stats.getWordPressUploaded());
        return stats;
    }

    private static void record(EmbeddingStats stats, AssetDecision d) {
        long size = d.getOriginalSize();
        switch (d.getDecision()) {
            case INLINE_BASE64:
                stats.recordInlined(size, Math.round(size * (1 + DecisionEngine.BASE64_OVERHEAD)));
                break;
            case INLINE_SVG:
                stats.recordInlined(size, size);
                break;
            case WORDPRESS_UPLOAD:
                stats.recordUploaded(size);
                break;
            default:
                stats.recordExternal(size);
                break;
        }
    }

    private static void applyToElement(AssetReference ref, AssetDecision d) {
        Element el = ref.getElement();
        if (el.parent() == null) return; // 已被替换
        switch (d.getDecision()) {
            case INLINE_BASE64:
                el.attr("src", d.getPayload());
                break;
            case INLINE_SVG:
                if (ref.getLocator() == ReferenceLocator.IMG_SRC) {
                    el.before(stripProlog(d.getPayload()));
                    el.remove();
                }
                break;
            case WORDPRESS_UPLOAD:
                el.attr("src", d.getExternalUrl());
                break;
            default:
                break;
        }
    }

    /**
     * Replaces each reference's recorded path span inside {@code cssText}. Spans are
     * applied from the end so earlier offsets stay valid; quotes and the surrounding
     * {@code url(...)} are kept.
     */
    static String splice(String cssText, List<AssetReference> refs, Map<String, AssetDecision> decisions) {
        List<AssetReference> ordered = new ArrayList<>(refs);
        ordered.sort(Comparator.comparingInt(AssetReference::getStart).reversed());
        StringBuilder sb = new StringBuilder(cssText);
        for (AssetReference ref : ordered) {
            if (ref.getStart() < 0 || ref.getEnd() > sb.length()) {
                log.warn("[EMBED][SPAN-STALE] {} in <{}>", ref.getPath(), ref.getElement().tagName());
                continue;
            }
            sb.replace(ref.getStart(), ref.getEnd(), cssValueFor(decisions.get(ref.getPath())));
        }
        return sb.toString();
    }

    private static String cssValueFor(AssetDecision d) {
        if (d.getDecision() == DecisionKind.INLINE_BASE64) {
            return d.getPayload();
        }
        if (d.getDecision() == DecisionKind.INLINE_SVG) {
            // 样式中无法放入标记，改用 SVG 的 data URI
            String b64 = Base64.getEncoder().encodeToString(d.getPayload().getBytes(StandardCharsets.UTF_8));
            return DecisionEngine.dataUri("image/svg+xml", b64);
        }
        if (d.getDecision() == DecisionKind.WORDPRESS_UPLOAD) {
            return d.getExternalUrl();
        }
        return null;
    }

    static String stripProlog(String svg) {
        return XML_PROLOG.matcher(svg).replaceFirst("");
    }
}
