package com.example.assetembed.model;

public class BatchPage extends EmbeddingRequest {

	private String name;

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	public String displayName() {
		return (name == null || name.trim().isEmpty()) ? "Unknown" : name;
	}
}
