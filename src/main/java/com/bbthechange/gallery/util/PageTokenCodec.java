package com.bbthechange.gallery.util;

import com.bbthechange.gallery.exception.ValidationException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Encodes a DynamoDB LastEvaluatedKey as a URL-safe base64 JSON token and back.
 * All key attributes of the GalleryTable are strings.
 */
public final class PageTokenCodec {

    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, String>> MAP_TYPE = new TypeReference<>() {};

    private PageTokenCodec() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static String encode(Map<String, AttributeValue> lastEvaluatedKey) {
        if (lastEvaluatedKey == null || lastEvaluatedKey.isEmpty()) {
            return null;
        }
        Map<String, String> plain = new LinkedHashMap<>();
        lastEvaluatedKey.forEach((name, value) -> plain.put(name, value.s()));
        try {
            byte[] json = objectMapper.writeValueAsBytes(plain);
            return Base64.getUrlEncoder().withoutPadding().encodeToString(json);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to encode page token", e);
        }
    }

    public static Map<String, AttributeValue> decode(String token) {
        if (token == null || token.isBlank()) {
            return null;
        }
        try {
            byte[] json = Base64.getUrlDecoder().decode(token);
            Map<String, String> plain = objectMapper.readValue(new String(json, StandardCharsets.UTF_8), MAP_TYPE);
            Map<String, AttributeValue> key = new LinkedHashMap<>();
            plain.forEach((name, value) -> key.put(name, AttributeValue.builder().s(value).build()));
            return key;
        } catch (Exception e) {
            throw new ValidationException("Invalid page token");
        }
    }
}
