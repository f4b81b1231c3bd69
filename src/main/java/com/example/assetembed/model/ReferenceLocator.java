package com.example.assetembed.model;

/**
 * Where in the document an asset reference was found.
 */
public enum ReferenceLocator {
    /** {@code <img src>} */
    IMG_SRC,
    /** {@code <video>/<audio>} and their {@code <source>} children */
    MEDIA_SRC,
    /** url(...) inside an element's style attribute */
    STYLE_ATTRIBUTE,
    /** url(...) inside a {@code <style>} block */
    STYLE_BLOCK;

    public boolean isStyleText() {
        return this == STYLE_ATTRIBUTE || this == STYLE_BLOCK;
    }
}
