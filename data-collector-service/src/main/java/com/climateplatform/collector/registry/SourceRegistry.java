package com.climateplatform.collector.registry;

import com.climateplatform.common.exception.InvalidSourceException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Static mapping from source identifier to its {@link SourceDescriptor}.
 *
 * <p>Built once at startup and never modified, so it is shared freely between concurrent fetches.
 */
public class SourceRegistry {

    private final Map<String, SourceDescriptor> descriptors;

    public SourceRegistry(Collection<SourceDescriptor> descriptors) {
        Map<String, SourceDescriptor> byId = new LinkedHashMap<>();
        for (SourceDescriptor descriptor : descriptors) {
            if (byId.put(descriptor.id(), descriptor) != null) {
                throw new IllegalArgumentException("Source registered twice: " + descriptor.id());
            }
        }
        this.descriptors = Collections.unmodifiableMap(byId);
    }

    public boolean contains(String sourceId) {
        return sourceId != null && descriptors.containsKey(sourceId);
    }

    /**
     * @throws InvalidSourceException if the identifier is not registered
     */
    public SourceDescriptor descriptor(String sourceId) {
        SourceDescriptor descriptor = sourceId == null ? null : descriptors.get(sourceId);
        if (descriptor == null) {
            throw new InvalidSourceException(sourceId, descriptors.keySet());
        }
        return descriptor;
    }

    /** Registered identifiers, sorted. */
    public Set<String> sourceIds() {
        return Collections.unmodifiableSet(new TreeSet<>(descriptors.keySet()));
    }
}
