package com.example.assetembed.service;

import com.example.assetembed.model.AssetReference;
import com.example.assetembed.model.ReferenceLocator;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ReferenceExtractorTest {

    private final ReferenceExtractor extractor = new ReferenceExtractor();

    @Test
    void collectsReferencesInDocumentOrderKeepingDuplicates() {
        Document doc = Jsoup.parse("<html><head>"
                + "<style>.a{background:url('/bg.png')} .b{background:url(/bg.png)}</style>"
                + "</head><body>"
                + "<img src=\"/a.png\">"
                + "<div style=\"background-image: url(&quot;/c.jpg&quot;)\"></div>"
                + "<img src=\"/a.png\">"
                + "<video><source src=\"/v.mp4\"></video>"
                + "</body></html>");

        List<AssetReference> refs = extractor.extract(doc);

        assertEquals(List.of("/bg.png", "/bg.png", "/a.png", "/c.jpg", "/a.png", "/v.mp4"),
                refs.stream().map(AssetReference::getPath).collect(Collectors.toList()));
        assertEquals(List.of(ReferenceLocator.STYLE_BLOCK, ReferenceLocator.STYLE_BLOCK, ReferenceLocator.IMG_SRC,
                        ReferenceLocator.STYLE_ATTRIBUTE, ReferenceLocator.IMG_SRC, ReferenceLocator.MEDIA_SRC),
                refs.stream().map(AssetReference::getLocator).collect(Collectors.toList()));
    }

    @Test
    void imageIndexCountsOnlyImageElements() {
        Document doc = Jsoup.parse("<div style=\"background:url(/x.png)\"></div><img src=\"/1.png\"><img src=\"/2.png\">");

        List<AssetReference> refs = extractor.extract(doc);

        assertEquals(-1, refs.get(0).getImageIndex());
        assertEquals(0, refs.get(1).getImageIndex());
        assertEquals(1, refs.get(2).getImageIndex());
    }

    @Test
    void styleReferencesCarryTheSpanOfThePath() {
        String css = ".hero { background: url( \"/img/hero.webp\" ) no-repeat; }";
        Document doc = Jsoup.parse("<style>" + css + "</style>");

        AssetReference ref = extractor.extract(doc).get(0);

        assertEquals("/img/hero.webp", ref.getPath());
        assertEquals("/img/hero.webp", css.substring(ref.getStart(), ref.getEnd()));
    }

    @Test
    void malformedUrlAndEmptyDocumentsYieldNothing() {
        assertTrue(extractor.extract(Jsoup.parse("<div style=\"background:url(/broken.png\"></div>")).isEmpty());
        assertTrue(extractor.extract(Jsoup.parse("<style>body{background:url('/x.png}</style>")).isEmpty());
        assertTrue(extractor.extract(Jsoup.parse("<p>nothing here</p>")).isEmpty());
        assertTrue(extractor.extract(Jsoup.parse("")).isEmpty());
    }

    @Test
    void skipsDataUrisAndBlankSources() {
        Document doc = Jsoup.parse("<img src=\"data:image/png;base64,AAAA\"><img src=\"  \">"
                + "<div style=\"background:url(data:image/gif;base64,R0lG)\"></div>"
                + "<audio src=\"/a.mp3\"></audio>");

        List<AssetReference> refs = extractor.extract(doc);

        assertEquals(1, refs.size());
        assertEquals("/a.mp3", refs.get(0).getPath());
        assertEquals(ReferenceLocator.MEDIA_SRC, refs.get(0).getLocator());
    }

    @Test
    void sourceOutsideMediaElementsIsIgnored() {
        Document doc = Jsoup.parse("<picture><source src=\"/p.webp\"><img src=\"/p.png\"></picture>");

        List<AssetReference> refs = extractor.extract(doc);

        assertEquals(1, refs.size());
        assertEquals("/p.png", refs.get(0).getPath());
    }
}
