package com.example.assetembed.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.jsoup.nodes.Element;

import java.util.Objects;

/**
 * One occurrence of an asset inside a document. Style references also carry the
 * [start, end) span of the path inside the style text they were found in.
 */
public final class AssetReference {

    private final String path;
    private final ReferenceLocator locator;
    private final Element element;
    private final int start;
    private final int end;
    private final int imageIndex;

    private AssetReference(String path, ReferenceLocator locator, Element element, int start, int end, int imageIndex) {
        this.path = Objects.requireNonNull(path, "path");
        this.locator = Objects.requireNonNull(locator, "locator");
        this.element = Objects.requireNonNull(element, "element");
        this.start = start;
        this.end = end;
        this.imageIndex = imageIndex;
    }

    public static AssetReference image(String path, Element img, int imageIndex) {
        return new AssetReference(path, ReferenceLocator.IMG_SRC, img, -1, -1, imageIndex);
    }

    public static AssetReference media(String path, Element el) {
        return new AssetReference(path, ReferenceLocator.MEDIA_SRC, el, -1, -1, -1);
    }

    public static AssetReference style(String path, ReferenceLocator locator, Element owner, int start, int end) {
        if (!locator.isStyleText()) {
            throw new IllegalArgumentException("not a style locator: " + locator);
        }
        return new AssetReference(path, locator, owner, start, end, -1);
    }

    public String getPath() { return path; }
    public ReferenceLocator getLocator() { return locator; }
    @JsonIgnore
    public Element getElement() { return element; }
    public int getStart() { return start; }
    public int getEnd() { return end; }

    /** Document-order index among image element references, -1 for everything else. */
    public int getImageIndex() { return imageIndex; }

    public boolean isImageElement() {
        return locator == ReferenceLocator.IMG_SRC;
    }

    @Override
    public String toString() {
        return locator + "<" + element.tagName() + ">" + (start >= 0 ? "[" + start + "," + end + ")" : "") + " " + path;
    }
}
