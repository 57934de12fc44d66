package com.zero.core.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Ordered list of execution waves. Every analyzer in a wave has all of its
 * dependencies satisfied by earlier waves, so a wave can run in parallel.
 *
 * @param requested analyzers the caller asked for, in request order
 * @param waves     wave contents; dependencies pulled in transitively appear here too
 */
public record ExecutionPlan(List<String> requested, List<List<String>> waves) {

    public ExecutionPlan {
        requested = List.copyOf(new LinkedHashSet<>(requested));
        var copy = new ArrayList<List<String>>(waves.size());
        for (var wave : waves) {
            copy.add(List.copyOf(wave));
        }
        waves = List.copyOf(copy);
    }

    public int waveCount() {
        return waves.size();
    }

    /** All analyzers in execution order (wave by wave). */
    public List<String> analyzers() {
        var all = new ArrayList<String>();
        waves.forEach(all::addAll);
        return all;
    }

    public Set<String> analyzerSet() {
        return new LinkedHashSet<>(analyzers());
    }

    public boolean isRequested(String analyzerId) {
        return requested.contains(analyzerId);
    }

    public OptionalInt waveIndexOf(String analyzerId) {
        for (int i = 0; i < waves.size(); i++) {
            if (waves.get(i).contains(analyzerId)) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }
}
