package com.zero.core.scheduler;

import java.util.List;

/**
 * Thrown when the requested analyzers (or their transitive dependencies) contain a
 * dependency cycle, so no execution order exists.
 */
public class CycleDetectedException extends RuntimeException {

    private final List<String> ids;
    private final List<String> cycle;

    /**
     * @param ids   every analyzer that could not be placed in a wave
     * @param cycle one concrete cycle, first node repeated at the end (e.g. [a, b, a])
     */
    public CycleDetectedException(List<String> ids, List<String> cycle) {
        super("Dependency cycle detected: " + String.join(" -> ", cycle)
                + " (unschedulable: " + String.join(", ", ids) + ")");
        this.ids = List.copyOf(ids);
        this.cycle = List.copyOf(cycle);
    }

    public List<String> getIds() {
        return ids;
    }

    public List<String> getCycle() {
        return cycle;
    }
}
