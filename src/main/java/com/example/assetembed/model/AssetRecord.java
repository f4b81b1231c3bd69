package com.example.assetembed.model;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Locale;
import java.util.Objects;

/**
 * Read-only view over an already fetched asset.
 */
public final class AssetRecord {

    private final String path;
    private final byte[] content;
    private final String format;
    private final MediaKind mediaKind;

    public AssetRecord(String path, byte[] content) {
        this.path = Objects.requireNonNull(path, "path");
        this.content = content == null ? new byte[0] : content.clone();
        this.format = formatOf(path);
        this.mediaKind = MediaKind.fromFormat(format);
    }

    public String getPath() { return path; }
    public int getSize() { return content.length; }
    public String getFormat() { return format; }
    public MediaKind getMediaKind() { return mediaKind; }

    public String text() {
        return new String(content, StandardCharsets.UTF_8);
    }

    public String base64() {
        return Base64.getEncoder().encodeToString(content);
    }

    public String fileName() {
        return fileNameOf(path);
    }

    // 扩展名（含点，小写）；忽略查询串与片段
    public static String formatOf(String path) {
        String name = fileNameOf(path);
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) return "";
        return name.substring(dot).toLowerCase(Locale.ROOT);
    }

    public static String fileNameOf(String path) {
        if (path == null) return "";
        String p = path;
        int cut = p.indexOf('?');
        if (cut >= 0) p = p.substring(0, cut);
        cut = p.indexOf('#');
        if (cut >= 0) p = p.substring(0, cut);
        int slash = Math.max(p.lastIndexOf('/'), p.lastIndexOf('\\'));
        return slash >= 0 ? p.substring(slash + 1) : p;
    }
}
