package org.netpreserve.scrapekit.adapter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Site adapters by id. Populated at startup; each lookup creates a fresh adapter.
 */
public class AdapterRegistry {
    private static final Logger log = LoggerFactory.getLogger(AdapterRegistry.class);

    private final Map<String, Supplier<? extends SiteAdapter>> factories = new ConcurrentHashMap<>();

    /**
     * @throws IllegalArgumentException if the id is already taken
     */
    public AdapterRegistry register(String id, Supplier<? extends SiteAdapter> factory) {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("Adapter id must not be blank");
        if (factories.putIfAbsent(id, factory) != null) {
            throw new IllegalArgumentException("Adapter already registered: " + id);
        }
        log.debug("Registered adapter for site {}", id);
        return this;
    }

    public Optional<SiteAdapter> lookup(String id) {
        var factory = factories.get(id);
        if (factory == null) return Optional.empty();
        return Optional.of(factory.get());
    }

    public Set<String> ids() {
        return new TreeSet<>(factories.keySet());
    }
}
