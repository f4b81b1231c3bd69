package com.example.assetembed.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

public enum MediaKind {
    IMAGE("image"),
    FONT("font"),
    VIDEO("video"),
    AUDIO("audio"),
    OTHER("other");

    private static final Set<String> IMAGE_FORMATS = new HashSet<>(Arrays.asList(".jpg", ".jpeg", ".png", ".gif", ".webp", ".svg", ".bmp", ".ico"));
    private static final Set<String> FONT_FORMATS = new HashSet<>(Arrays.asList(".woff", ".woff2", ".ttf", ".eot", ".otf"));
    private static final Set<String> VIDEO_FORMATS = new HashSet<>(Arrays.asList(".mp4", ".webm", ".ogg", ".mov"));
    private static final Set<String> AUDIO_FORMATS = new HashSet<>(Arrays.asList(".mp3", ".wav", ".ogg", ".m4a"));

    private final String label;

    MediaKind(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public boolean isStreamingMedia() {
        return this == VIDEO || this == AUDIO;
    }

    // 按扩展名分类；.ogg 同时出现在视频与音频表中，视频优先
    public static MediaKind fromFormat(String format) {
        if (format == null) return OTHER;
        String f = format.toLowerCase(Locale.ROOT);
        if (IMAGE_FORMATS.contains(f)) return IMAGE;
        if (FONT_FORMATS.contains(f)) return FONT;
        if (VIDEO_FORMATS.contains(f)) return VIDEO;
        if (AUDIO_FORMATS.contains(f)) return AUDIO;
        return OTHER;
    }
}
