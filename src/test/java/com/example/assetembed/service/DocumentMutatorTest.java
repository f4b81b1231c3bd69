package com.example.assetembed.service;

import com.example.assetembed.model.AssetDecision;
import com.example.assetembed.model.AssetRecord;
import com.example.assetembed.model.AssetReference;
import com.example.assetembed.model.DecisionKind;
import com.example.assetembed.model.EmbeddingStats;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class DocumentMutatorTest {

    private static final String PNG_URI = "data:image/png;base64,AAEC";
    private static final String SVG = "<svg xmlns=\"http://www.w3.org/2000/svg\" id=\"logo\"><circle r=\"4\"></circle></svg>";

    private final ReferenceExtractor extractor = new ReferenceExtractor();
    private final DocumentMutator mutator = new DocumentMutator(extractor);

    private static Document parse(String html) {
        Document doc = Jsoup.parse(html);
        doc.outputSettings().prettyPrint(false);
        return doc;
    }

    private static AssetDecision decision(String path, int size, DecisionKind kind, String payload, String url) {
        AssetDecision.Builder b = AssetDecision.of(new AssetRecord(path, new byte[size]), kind);
        if (payload != null) b.payload(payload);
        if (url != null) b.externalUrl(url);
        return b.reason("test").build();
    }

    private static Map<String, AssetDecision> decisions(AssetDecision... ds) {
        Map<String, AssetDecision> m = new LinkedHashMap<>();
        for (AssetDecision d : ds) m.put(d.getAssetPath(), d);
        return m;
    }

    @Test
    void inlinesEveryOccurrenceOfAPath() {
        Document doc = parse("<style>.a{background:url('/i.png')} .keep{background:url(/other.png)}</style>"
                + "<img src=\"/i.png\" alt=\"x\">"
                + "<div style=\"color:red; background:url(/i.png)\"></div>");

        EmbeddingStats stats = mutator.apply(doc, decisions(decision("/i.png", 100, DecisionKind.INLINE_BASE64, PNG_URI, null)));

        assertEquals(PNG_URI, doc.selectFirst("img").attr("src"));
        assertEquals("x", doc.selectFirst("img").attr("alt"));
        assertEquals("color:red; background:url(" + PNG_URI + ")", doc.selectFirst("div").attr("style"));
        assertEquals(".a{background:url('" + PNG_URI + "')} .keep{background:url(/other.png)}", doc.selectFirst("style").data());
        assertEquals(1, stats.getTotalAssets());
        assertEquals(1, stats.getInlined());
        assertEquals(1, stats.getHttpRequestsSaved());
        assertEquals(100, stats.getTotalSizeBefore());
        assertEquals(137, stats.getTotalSizeAfter());
    }

    @Test
    void severalSpansInOneStyleTextAreReplacedInPlace() {
        Document doc = parse("<div style=\"a:url(/x.png);b:url(/missing.png);c:url( '/x.png' );d:url(&quot;/big.jpg&quot;)\"></div>");
        String url = "https://cms.example.com/wp-content/uploads/big.jpg";

        mutator.apply(doc, decisions(
                decision("/x.png", 3, DecisionKind.INLINE_BASE64, PNG_URI, null),
                decision("/big.jpg", 90000, DecisionKind.WORDPRESS_UPLOAD, null, url)));

        assertEquals("a:url(" + PNG_URI + ");b:url(/missing.png);c:url( '" + PNG_URI + "' );d:url(\"" + url + "\")",
                doc.selectFirst("div").attr("style"));
    }

    @Test
    void vectorDecisionReplacesTheImageElement() {
        Document doc = parse("<p>before<img src=\"/logo.svg\" class=\"logo\">after</p>");
        String withProlog = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n" + SVG;

        mutator.apply(doc, decisions(decision("/logo.svg", withProlog.length(), DecisionKind.INLINE_SVG, withProlog, null)));

        assertNull(doc.selectFirst("img"));
        assertNotNull(doc.selectFirst("p > svg#logo"));
        assertThat(doc.selectFirst("p").html()).startsWith("before<svg").endsWith("</svg>after");
        assertThat(doc.outerHtml()).doesNotContain("<?xml");
    }

    @Test
    void vectorDecisionInsideStyleTextBecomesSvgDataUri() {
        Document doc = parse("<div style=\"background:url(/logo.svg)\"></div>");

        mutator.apply(doc, decisions(decision("/logo.svg", SVG.length(), DecisionKind.INLINE_SVG, SVG, null)));

        String expected = "data:image/svg+xml;base64,"
                + java.util.Base64.getEncoder().encodeToString(SVG.getBytes(StandardCharsets.UTF_8));
        assertEquals("background:url(" + expected + ")", doc.selectFirst("div").attr("style"));
    }

    @Test
    void uploadDecisionRewritesToTheTargetUrl() {
        Document doc = parse("<img src=\"/big.jpg\"><div style=\"background:url(&quot;/big.jpg&quot;)\"></div>");
        String url = "https://cms.example.com/wp-content/uploads/big.jpg";

        EmbeddingStats stats = mutator.apply(doc, decisions(decision("/big.jpg", 90000, DecisionKind.WORDPRESS_UPLOAD, null, url)));

        assertEquals(url, doc.selectFirst("img").attr("src"));
        assertEquals("background:url(\"" + url + "\")", doc.selectFirst("div").attr("style"));
        assertEquals(1, stats.getWordPressUploaded());
        assertEquals(90000, stats.getTotalSizeAfter());
    }

    @Test
    void externalDecisionsAndUndecidedPathsAreLeftAlone() {
        String html = "<html><head><style>a{background:url( '/a.png' )}</style></head>"
                + "<body><img src=\"/b.png\"><img src=\"/unknown.png\"></body></html>";
        Document doc = parse(html);
        String before = doc.outerHtml();

        EmbeddingStats stats = mutator.apply(doc, decisions(
                decision("/a.png", 50, DecisionKind.EXTERNAL, null, null),
                decision("/b.png", 70, DecisionKind.EXTERNAL, null, null)));

        assertEquals(before, doc.outerHtml());
        assertEquals(2, stats.getExternal());
        assertEquals(0, stats.getHttpRequestsSaved());
        assertEquals(120, stats.getTotalSizeAfter());
    }

    @Test
    void reapplyingToAnAlreadyMutatedDocumentChangesNothing() {
        Document doc = parse("<style>.a{background:url(/i.png)}</style><img src=\"/i.png\"><img src=\"/logo.svg\">"
                + "<div style=\"background:url('/i.png')\"></div><img src=\"/big.jpg\">");
        Map<String, AssetDecision> ds = decisions(
                decision("/i.png", 100, DecisionKind.INLINE_BASE64, PNG_URI, null),
                decision("/logo.svg", SVG.length(), DecisionKind.INLINE_SVG, SVG, null),
                decision("/big.jpg", 90000, DecisionKind.WORDPRESS_UPLOAD, null, "https://cms.example.com/big.jpg"));

        mutator.apply(doc, ds);
        String once = doc.outerHtml();
        EmbeddingStats second = mutator.apply(doc, ds);

        assertEquals(once, doc.outerHtml());
        assertEquals(0, second.getTotalAssets());
        for (AssetReference ref : extractor.extract(doc)) {
            assertFalse(ds.containsKey(ref.getPath()), ref.toString());
        }
        assertThat(once).contains(PNG_URI).contains("id=\"logo\"");
    }
}
