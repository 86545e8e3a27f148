package com.climateplatform.collector.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Deterministic identity of a (source, parameters) combination.
 *
 * <p>The digest is SHA-256 over {@code source + ":" + canonicalJson}, where the canonical JSON is
 * the parameter mapping with keys sorted and every value stringified. Insertion order of the
 * mapping therefore never affects the key, and {@code 7}, {@code 7L} and {@code "7"} hash alike.
 *
 * @param source source identifier
 * @param digest lowercase hex SHA-256 digest, also the cache file's base name
 */
public record CacheKey(String source, String digest) {

    public static final String FILE_EXTENSION = ".arrow";

    private static final ObjectMapper CANONICAL_JSON = new ObjectMapper();

    public CacheKey {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(digest, "digest");
    }

    public static CacheKey of(String source, Map<String, ?> parameters) {
        return new CacheKey(source, sha256Hex(source + ":" + canonicalize(parameters)));
    }

    /** Sorted-key JSON of the parameters with stringified values. */
    static String canonicalize(Map<String, ?> parameters) {
        TreeMap<String, String> sorted = new TreeMap<>();
        if (parameters != null) {
            parameters.forEach((name, value) -> sorted.put(name, String.valueOf(value)));
        }
        try {
            return CANONICAL_JSON.writeValueAsString(sorted);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot canonicalize fetch parameters", e);
        }
    }

    public String fileName() {
        return digest + FILE_EXTENSION;
    }

    private static String sha256Hex(String text) {
        try {
            MessageDigest sha = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(sha.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Override
    public String toString() {
        return source + "/" + digest;
    }
}
