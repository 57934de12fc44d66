package com.zero.core.registry;

import com.zero.core.model.AnalyzerDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Catalog of analyzers: descriptor plus run function, keyed by id.
 * <p>
 * Populated once at startup and passed explicitly to the scheduler and engine, so
 * tests can build isolated registries. Iteration follows registration order, which
 * is also the tie-break order inside a wave.
 */
public class AnalyzerRegistry {

    private static final Logger log = LoggerFactory.getLogger(AnalyzerRegistry.class);

    private final Map<String, Entry> entries = new LinkedHashMap<>();

    public synchronized void register(AnalyzerDescriptor descriptor, Analyzer analyzer) {
        Objects.requireNonNull(descriptor, "descriptor");
        Objects.requireNonNull(analyzer, "analyzer");
        if (entries.containsKey(descriptor.id())) {
            throw new DuplicateAnalyzerException(descriptor.id());
        }
        entries.put(descriptor.id(), new Entry(descriptor, analyzer, entries.size()));
        log.debug("Registered analyzer {} (deps={}, ttl={})",
                descriptor.id(), descriptor.dependencies(), descriptor.defaultTtl());
    }

    /**
     * Returns the descriptors for {@code ids} in the given order.
     *
     * @throws UnknownAnalyzerException naming every id that is not registered
     */
    public synchronized List<AnalyzerDescriptor> resolve(Collection<String> ids) {
        var unknown = new ArrayList<String>();
        var resolved = new ArrayList<AnalyzerDescriptor>();
        for (var id : ids) {
            var entry = entries.get(id);
            if (entry == null) {
                unknown.add(id);
            } else {
                resolved.add(entry.descriptor());
            }
        }
        if (!unknown.isEmpty()) {
            throw new UnknownAnalyzerException(unknown);
        }
        return resolved;
    }

    public synchronized Optional<AnalyzerDescriptor> descriptor(String id) {
        return Optional.ofNullable(entries.get(id)).map(Entry::descriptor);
    }

    public synchronized Analyzer analyzer(String id) {
        var entry = entries.get(id);
        if (entry == null) {
            throw new UnknownAnalyzerException(List.of(id));
        }
        return entry.analyzer();
    }

    /** All descriptors in registration order. */
    public synchronized List<AnalyzerDescriptor> descriptors() {
        return entries.values().stream().map(Entry::descriptor).toList();
    }

    /** Position of {@code id} in registration order, or -1 when unregistered. */
    public synchronized int registrationIndex(String id) {
        var entry = entries.get(id);
        return entry != null ? entry.index() : -1;
    }

    public synchronized boolean contains(String id) {
        return entries.containsKey(id);
    }

    public synchronized int size() {
        return entries.size();
    }

    private record Entry(AnalyzerDescriptor descriptor, Analyzer analyzer, int index) {}
}
