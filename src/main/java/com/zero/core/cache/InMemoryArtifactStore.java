package com.zero.core.cache;

import com.zero.core.model.Artifact;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Artifact store backed by a {@link ConcurrentHashMap}. Artifacts are immutable,
 * so replacing the map entry is the atomic swap.
 */
public class InMemoryArtifactStore implements ArtifactStore {

    private final ConcurrentHashMap<Key, Artifact> artifacts = new ConcurrentHashMap<>();

    @Override
    public Optional<Artifact> get(String target, String analyzerId) {
        return Optional.ofNullable(artifacts.get(new Key(target, analyzerId)));
    }

    @Override
    public void put(Artifact artifact) {
        artifacts.put(new Key(artifact.target(), artifact.analyzerId()), artifact);
    }

    @Override
    public boolean putUnlessOk(Artifact artifact) {
        var written = new boolean[1];
        artifacts.compute(new Key(artifact.target(), artifact.analyzerId()), (key, existing) -> {
            if (existing != null && existing.isOk()) {
                return existing;
            }
            written[0] = true;
            return artifact;
        });
        return written[0];
    }

    @Override
    public boolean remove(String target, String analyzerId) {
        return artifacts.remove(new Key(target, analyzerId)) != null;
    }

    @Override
    public int removeAll(String target) {
        int before = artifacts.size();
        artifacts.keySet().removeIf(k -> k.target().equals(target));
        return before - artifacts.size();
    }

    @Override
    public List<Artifact> list(String target) {
        return artifacts.values().stream()
                .filter(a -> a.target().equals(target))
                .sorted(Comparator.comparing(Artifact::analyzerId))
                .toList();
    }

    @Override
    public String describe() {
        return "memory";
    }

    private record Key(String target, String analyzerId) {}
}
