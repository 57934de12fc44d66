package com.zero.core.cache;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.zero.core.model.Artifact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Artifact store on the local filesystem.
 * <p>
 * Layout: {@code <root>/repos/<target>/analysis/<analyzerId>.artifact.json}. Each
 * write goes to a temp file in the same directory and is moved over the previous
 * file, so readers never observe a half-written artifact. Writers of one key are
 * serialized on a per-key lock, which makes {@link #putUnlessOk} a single step.
 */
public class FileSystemArtifactStore implements ArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemArtifactStore.class);

    static final String SUFFIX = ".artifact.json";

    private final Path root;
    private final ObjectMapper mapper;
    private final ConcurrentHashMap<Path, Object> keyLocks = new ConcurrentHashMap<>();

    public FileSystemArtifactStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public Path root() {
        return root;
    }

    @Override
    public Optional<Artifact> get(String target, String analyzerId) {
        Path file = artifactFile(target, analyzerId);
        try {
            return Optional.of(read(file));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new ArtifactStoreException("Failed to read artifact " + file, e);
        }
    }

    @Override
    public void put(Artifact artifact) {
        Path file = artifactFile(artifact.target(), artifact.analyzerId());
        synchronized (lockFor(file)) {
            write(file, artifact);
        }
    }

    @Override
    public boolean putUnlessOk(Artifact artifact) {
        Path file = artifactFile(artifact.target(), artifact.analyzerId());
        synchronized (lockFor(file)) {
            try {
                if (read(file).isOk()) {
                    return false;
                }
            } catch (NoSuchFileException e) {
                log.trace("No artifact yet at {}", file);
            } catch (IOException e) {
                throw new ArtifactStoreException("Failed to read artifact " + file, e);
            }
            write(file, artifact);
            return true;
        }
    }

    @Override
    public boolean remove(String target, String analyzerId) {
        Path file = artifactFile(target, analyzerId);
        try {
            return Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new ArtifactStoreException("Failed to delete artifact " + file, e);
        }
    }

    @Override
    public int removeAll(String target) {
        int removed = 0;
        for (Path file : artifactFiles(target)) {
            try {
                if (Files.deleteIfExists(file)) {
                    removed++;
                }
            } catch (IOException e) {
                throw new ArtifactStoreException("Failed to delete artifact " + file, e);
            }
        }
        return removed;
    }

    @Override
    public List<Artifact> list(String target) {
        var artifacts = new ArrayList<Artifact>();
        for (Path file : artifactFiles(target)) {
            try {
                artifacts.add(read(file));
            } catch (NoSuchFileException e) {
                log.debug("Artifact {} removed while listing", file);
            } catch (IOException e) {
                throw new ArtifactStoreException("Failed to read artifact " + file, e);
            }
        }
        return artifacts;
    }

    @Override
    public String describe() {
        return "filesystem:" + root;
    }

    Path analysisDirectory(String target) {
        validateTarget(target);
        return root.resolve("repos").resolve(target).resolve("analysis").normalize();
    }

    Path artifactFile(String target, String analyzerId) {
        if (analyzerId == null || analyzerId.isBlank() || analyzerId.contains("/")
                || analyzerId.contains("\\") || analyzerId.startsWith(".")) {
            throw new IllegalArgumentException("Invalid analyzer id for storage: " + analyzerId);
        }
        return analysisDirectory(target).resolve(analyzerId + SUFFIX);
    }

    private Object lockFor(Path file) {
        return keyLocks.computeIfAbsent(file, k -> new Object());
    }

    private void write(Path file, Artifact artifact) {
        Path tmp = null;
        try {
            Files.createDirectories(file.getParent());
            tmp = Files.createTempFile(file.getParent(), artifact.analyzerId() + ".", ".tmp");
            mapper.writeValue(tmp.toFile(), StoredArtifact.from(artifact));
            try {
                Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Stored artifact {}/{} ({} status)", artifact.target(), artifact.analyzerId(), artifact.status());
        } catch (IOException e) {
            deleteTemp(tmp);
            throw new ArtifactStoreException("Failed to write artifact " + file, e);
        }
    }

    private List<Path> artifactFiles(String target) {
        Path dir = analysisDirectory(target);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(SUFFIX))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
        } catch (IOException e) {
            throw new ArtifactStoreException("Failed to list artifacts in " + dir, e);
        }
    }

    /** @throws NoSuchFileException if nothing is stored at {@code file} */
    private Artifact read(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return mapper.readValue(in, StoredArtifact.class).toArtifact();
        }
    }

    private static void validateTarget(String target) {
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException("Target must not be blank");
        }
        if (target.startsWith("/") || target.startsWith("\\") || Path.of(target).isAbsolute()) {
            throw new IllegalArgumentException("Target must be a relative name: " + target);
        }
        for (String segment : target.split("[/\\\\]")) {
            if (segment.isEmpty() || segment.equals("..") || segment.equals(".")) {
                throw new IllegalArgumentException("Invalid target path segment in: " + target);
            }
        }
    }

    private static void deleteTemp(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.debug("Could not delete temp file {}: {}", tmp, e.getMessage());
        }
    }
}
