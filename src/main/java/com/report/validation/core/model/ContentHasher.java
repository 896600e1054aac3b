package com.report.validation.core.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Canonical serialization and hashing of node content.
 * Object keys are sorted so that logically equal content always hashes identically.
 */
public final class ContentHasher {

    private static final ObjectMapper CANONICAL_MAPPER = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private ContentHasher() {
        // Utility class
    }

    /**
     * Returns the key-sorted compact JSON form of the given content.
     */
    public static String canonicalJson(JsonNode content) {
        if (content == null || content.isMissingNode()) {
            return "null";
        }
        try {
            Object plain = CANONICAL_MAPPER.treeToValue(content, Object.class);
            return CANONICAL_MAPPER.writeValueAsString(plain);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Content is not serializable: " + e.getMessage(), e);
        }
    }

    /**
     * SHA-256 hex digest of the canonical JSON form.
     */
    public static String hash(JsonNode content) {
        return sha256(canonicalJson(content));
    }

    public static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
