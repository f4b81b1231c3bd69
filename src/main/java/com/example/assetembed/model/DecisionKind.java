package com.example.assetembed.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DecisionKind {
    INLINE_BASE64("inline-base64"),
    INLINE_SVG("inline-svg"),
    EXTERNAL("external"),
    WORDPRESS_UPLOAD("wordpress-upload");

    private final String label;

    DecisionKind(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public boolean isInlined() {
        return this == INLINE_BASE64 || this == INLINE_SVG;
    }
}
