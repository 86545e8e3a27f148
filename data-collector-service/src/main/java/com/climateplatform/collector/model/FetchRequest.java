package com.climateplatform.collector.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One (source, parameters) fetch. The parameter mapping is copied and frozen; {@code null}
 * means no parameters. Its insertion order carries no meaning.
 */
public record FetchRequest(String source, Map<String, Object> parameters) {

    public FetchRequest {
        Objects.requireNonNull(source, "source");
        parameters = parameters == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public static FetchRequest of(String source, Map<String, ?> parameters) {
        return new FetchRequest(source, parameters == null ? null : new LinkedHashMap<>(parameters));
    }

    /** Copy of this request with {@code name} set to {@code value}. */
    public FetchRequest with(String name, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(parameters);
        copy.put(name, value);
        return new FetchRequest(source, copy);
    }
}
