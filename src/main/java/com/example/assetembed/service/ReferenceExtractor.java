package com.example.assetembed.service;

import com.example.assetembed.model.AssetReference;
import com.example.assetembed.model.ReferenceLocator;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Walks a parsed page and lists every asset reference in document order. Duplicates are
 * kept; counting happens in {@link AssetProfiler}.
 */
@Component
public class ReferenceExtractor {

    // 正则：匹配 CSS 文本中的 url(...) 模式，引号可选；未闭合的 url( 不会匹配
    static final Pattern CSS_URL_PATTERN = Pattern.compile("url\\(\\s*(['\\\"]?)([^\\)\\'\\\"]+)\\1\\s*\\)", Pattern.CASE_INSENSITIVE);

    public List<AssetReference> extract(Document doc) {
        List<AssetReference> refs = new ArrayList<>();
        int imageIndex = 0;
        // getAllElements() 为先序遍历，即文档顺序
        for (Element el : doc.getAllElements()) {
            String tag = el.normalName();
            if ("img".equals(tag)) {
                String src = usable(el.attr("src"));
                if (src != null) {
                    refs.add(AssetReference.image(src, el, imageIndex++));
                }
            } else if (isMediaSource(el)) {
                String src = usable(el.attr("src"));
                if (src != null) {
                    refs.add(AssetReference.media(src, el));
                }
            }
            if (el.hasAttr("style")) {
                scanCss(el.attr("style"), el, ReferenceLocator.STYLE_ATTRIBUTE, refs);
            }
            if ("style".equals(tag)) {
                scanCss(el.data(), el, ReferenceLocator.STYLE_BLOCK, refs);
            }
        }
        return refs;
    }

    private static void scanCss(String css, Element owner, ReferenceLocator locator, List<AssetReference> out) {
        if (css == null || css.isEmpty()) return;
        Matcher m = CSS_URL_PATTERN.matcher(css);
        while (m.find()) {
            String path = usable(m.group(2));
            if (path == null) continue;
            out.add(AssetReference.style(path, locator, owner, m.start(2), m.end(2)));
        }
    }

    private static boolean isMediaSource(Element el) {
        String tag = el.normalName();
        if ("video".equals(tag) || "audio".equals(tag)) return true;
        if (!"source".equals(tag)) return false;
        Element parent = el.parent();
        return parent != null && ("video".equals(parent.normalName()) || "audio".equals(parent.normalName()));
    }

    // 空值与 data: 内联值不算引用
    static String usable(String raw) {
        if (raw == null) return null;
        String v = raw.trim();
        if (v.isEmpty()) return null;
        if (v.toLowerCase(Locale.ROOT).startsWith("data:")) return null;
        return v;
    }
}
