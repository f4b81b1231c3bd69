package com.example.assetembed.service;

import com.example.assetembed.config.EmbeddingProperties;
import com.example.assetembed.model.EmbeddingOptions;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Converts the JSON shapes of the HTTP API (base64 assets, partial option maps) into
 * the engine's inputs.
 */
@Component
public class EmbeddingRequestMapper {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final ObjectMapper objectMapper;
    private final EmbeddingProperties properties;

    public EmbeddingRequestMapper(ObjectMapper objectMapper, EmbeddingProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * Decodes path to base64 entries. Non-string values are skipped; a string that is not
     * valid base64 is rejected.
     */
    public Map<String, byte[]> decodeAssets(Map<String, Object> assets) {
        Map<String, byte[]> out = new LinkedHashMap<>();
        if (assets == null) return out;
        for (Map.Entry<String, Object> e : assets.entrySet()) {
            if (!(e.getValue() instanceof String)) continue;
            try {
                // 允许客户端折行，去掉空白后严格解码
                String cleaned = WHITESPACE.matcher((String) e.getValue()).replaceAll("");
                out.put(e.getKey(), Base64.getDecoder().decode(cleaned));
            } catch (IllegalArgumentException ex) {
                throw new InvalidAssetException(e.getKey(), "Asset '" + e.getKey() + "' is not valid base64", ex);
            }
        }
        return out;
    }

    /**
     * Configured defaults, then each override map in order; later maps win field by field.
     */
    @SafeVarargs
    public final EmbeddingOptions options(Map<String, Object>... overrides) {
        EmbeddingOptions options = properties.newOptions();
        for (Map<String, Object> o : overrides) {
            if (o == null || o.isEmpty()) continue;
            try {
                options = objectMapper.updateValue(options, o);
            } catch (JsonMappingException ex) {
                throw new IllegalArgumentException("Invalid options: " + ex.getOriginalMessage(), ex);
            }
        }
        return options;
    }
}
