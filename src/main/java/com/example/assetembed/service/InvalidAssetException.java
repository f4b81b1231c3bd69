package com.example.assetembed.service;

public class InvalidAssetException extends RuntimeException {

    private final String assetPath;

    public InvalidAssetException(String assetPath, String message, Throwable cause) {
        super(message, cause);
        this.assetPath = assetPath;
    }

    public String getAssetPath() {
        return assetPath;
    }
}
