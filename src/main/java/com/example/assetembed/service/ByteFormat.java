package com.example.assetembed.service;

import java.util.Locale;

public final class ByteFormat {

    private ByteFormat() {
    }

    public static String format(long bytes) {
        if (bytes < 1024) return bytes + "B";
        if (bytes < 1048576) return String.format(Locale.ROOT, "%.2fKB", bytes / 1024.0);
        return String.format(Locale.ROOT, "%.2fMB", bytes / 1048576.0);
    }
}
