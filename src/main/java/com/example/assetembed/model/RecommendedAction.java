package com.example.assetembed.model;

public enum RecommendedAction { INLINE, EXTERNAL, UPLOAD }
