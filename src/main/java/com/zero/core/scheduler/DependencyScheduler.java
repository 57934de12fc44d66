package com.zero.core.scheduler;

import com.zero.core.model.AnalyzerDescriptor;
import com.zero.core.model.ExecutionPlan;
import com.zero.core.registry.AnalyzerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Turns a requested analyzer set into an {@link ExecutionPlan} of waves.
 * <p>
 * The dependency graph is restricted to the transitive closure of the request: a
 * dependency that was not asked for is still pulled in because its artifact is
 * needed. Nodes are indexed in registry order and sorted with a layered Kahn pass:
 * wave 0 holds nodes without predecessors, wave k the nodes whose predecessors all
 * sit in waves before k. Within a wave, registry order decides, so plans are
 * reproducible.
 */
public class DependencyScheduler {

    private static final Logger log = LoggerFactory.getLogger(DependencyScheduler.class);

    /**
     * Computes the wave plan for {@code requested}.
     *
     * @throws com.zero.core.registry.UnknownAnalyzerException if a requested id is not registered
     * @throws UnknownDependencyException if a dependency in the closure is not registered
     * @throws CycleDetectedException if the closure contains a cycle
     */
    public ExecutionPlan plan(List<String> requested, AnalyzerRegistry registry) {
        var requestedIds = new ArrayList<>(new LinkedHashSet<>(requested));
        registry.resolve(requestedIds);

        Map<String, AnalyzerDescriptor> closure = closure(requestedIds, registry);

        // Index nodes in registry order; adjacency by index avoids any pointer graph.
        List<String> nodes = new ArrayList<>(closure.keySet());
        nodes.sort(Comparator.comparingInt(registry::registrationIndex));
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            index.put(nodes.get(i), i);
        }

        int n = nodes.size();
        int[] inDegree = new int[n];
        List<List<Integer>> successors = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            successors.add(new ArrayList<>());
        }
        for (int i = 0; i < n; i++) {
            for (String dep : closure.get(nodes.get(i)).dependencies()) {
                int d = index.get(dep);
                successors.get(d).add(i);
                inDegree[i]++;
            }
        }

        var waves = new ArrayList<List<String>>();
        var current = new ArrayList<Integer>();
        for (int i = 0; i < n; i++) {
            if (inDegree[i] == 0) {
                current.add(i);
            }
        }
        int placed = 0;
        while (!current.isEmpty()) {
            current.sort(Integer::compare);
            var wave = new ArrayList<String>(current.size());
            var next = new ArrayList<Integer>();
            for (int i : current) {
                wave.add(nodes.get(i));
                for (int s : successors.get(i)) {
                    if (--inDegree[s] == 0) {
                        next.add(s);
                    }
                }
            }
            placed += wave.size();
            waves.add(wave);
            current = next;
        }

        if (placed < n) {
            var unplaced = new ArrayList<String>();
            for (int i = 0; i < n; i++) {
                if (inDegree[i] > 0) {
                    unplaced.add(nodes.get(i));
                }
            }
            var cycle = findCycle(unplaced, closure);
            log.warn("Cannot plan {}: cycle {}", requestedIds, cycle);
            throw new CycleDetectedException(unplaced, cycle);
        }

        var plan = new ExecutionPlan(requestedIds, waves);
        log.debug("Planned {} -> {} wave(s): {}", requestedIds, plan.waveCount(), waves);
        return plan;
    }

    private Map<String, AnalyzerDescriptor> closure(List<String> requested, AnalyzerRegistry registry) {
        var closure = new LinkedHashMap<String, AnalyzerDescriptor>();
        var queue = new ArrayDeque<>(requested);
        while (!queue.isEmpty()) {
            String id = queue.poll();
            if (closure.containsKey(id)) {
                continue;
            }
            AnalyzerDescriptor descriptor = registry.descriptor(id)
                    .orElseThrow(() -> new IllegalStateException("Analyzer vanished from registry: " + id));
            closure.put(id, descriptor);
            for (String dep : descriptor.dependencies()) {
                if (!registry.contains(dep)) {
                    throw new UnknownDependencyException(id, dep);
                }
                if (!closure.containsKey(dep)) {
                    queue.add(dep);
                }
            }
        }
        return closure;
    }

    /**
     * Every unplaced node still has an unplaced predecessor, so walking
     * dependencies inside the unplaced set must revisit a node.
     */
    private List<String> findCycle(List<String> unplaced, Map<String, AnalyzerDescriptor> closure) {
        var unplacedSet = new LinkedHashSet<>(unplaced);
        var path = new ArrayList<String>();
        var position = new HashMap<String, Integer>();
        String node = unplaced.get(0);
        while (!position.containsKey(node)) {
            position.put(node, path.size());
            path.add(node);
            node = closure.get(node).dependencies().stream()
                    .filter(unplacedSet::contains)
                    .findFirst()
                    .orElseThrow(() -> new IllegalStateException("Unplaced analyzer without unplaced dependency"));
        }
        var cycle = new ArrayList<>(path.subList(position.get(node), path.size()));
        cycle.add(node);
        return cycle;
    }
}
