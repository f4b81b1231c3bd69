package com.example.assetembed;

import com.example.assetembed.config.EmbeddingProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(EmbeddingProperties.class)
public class AssetEmbedderApplication {

	public static void main(String[] args) {
		SpringApplication.run(AssetEmbedderApplication.class, args);
	}
}
