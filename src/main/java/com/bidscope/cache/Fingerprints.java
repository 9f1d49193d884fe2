package com.bidscope.cache;

import com.bidscope.filter.FilterSpec;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stable cache keys derived from a normalized filter plus operation parameters.
 *
 * <p>The key is {@code bidscope:{operation}:{sha256}} over the canonical JSON of
 * {@code {operation, filters, params}} with all map keys sorted. Two requests that normalize
 * to the same {@link FilterSpec} and parameters share a key regardless of input order or casing.
 */
public final class Fingerprints {

    public static final String KEY_PREFIX = "bidscope";

    private static final ObjectMapper CANONICAL_MAPPER = new ObjectMapper()
        .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private Fingerprints() {
    }

    public static String key(String operation, FilterSpec spec, Map<String, ?> params) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("operation", operation);
        payload.put("filters", spec == null ? null : spec.toCanonicalMap());
        payload.put("params", params == null ? Map.of() : params);
        return KEY_PREFIX + ":" + operation + ":" + sha256(canonicalJson(payload));
    }

    public static String key(String operation, Map<String, ?> params) {
        return key(operation, null, params);
    }

    static String canonicalJson(Object payload) {
        try {
            return CANONICAL_MAPPER.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cache key payload is not serializable", e);
        }
    }

    private static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
