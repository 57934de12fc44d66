package com.zero.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * Stored output of one analyzer run for one target. Immutable; a re-run produces
 * a new artifact that replaces this one for the same (target, analyzerId) key.
 *
 * @param sourceCommit commit of the target the artifact was produced from; null when unknown
 */
public record Artifact(
    @JsonProperty("analyzer_id") String analyzerId,
    String target,
    @JsonProperty("produced_at") Instant producedAt,
    byte[] payload,
    ArtifactStatus status,
    String error,
    @JsonProperty("source_commit") String sourceCommit
) {

    public Artifact {
        Objects.requireNonNull(analyzerId, "analyzerId");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(producedAt, "producedAt");
        Objects.requireNonNull(status, "status");
        payload = payload != null ? payload.clone() : new byte[0];
        if (sourceCommit != null && sourceCommit.isBlank()) {
            sourceCommit = null;
        }
    }

    public Artifact(String analyzerId, String target, Instant producedAt, byte[] payload,
                    ArtifactStatus status, String error) {
        this(analyzerId, target, producedAt, payload, status, error, null);
    }

    public static Artifact ok(String target, String analyzerId, byte[] payload, Instant producedAt) {
        return ok(target, analyzerId, payload, producedAt, null);
    }

    public static Artifact ok(String target, String analyzerId, byte[] payload, Instant producedAt,
                              String sourceCommit) {
        return new Artifact(analyzerId, target, producedAt, payload, ArtifactStatus.OK, null, sourceCommit);
    }

    public static Artifact error(String target, String analyzerId, String error, Instant producedAt) {
        return new Artifact(analyzerId, target, producedAt, new byte[0], ArtifactStatus.ERROR, error, null);
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }

    public String payloadAsString() {
        return new String(payload, StandardCharsets.UTF_8);
    }

    public boolean isOk() {
        return status == ArtifactStatus.OK;
    }

    /**
     * True only when both this artifact and the caller know a commit and the two differ.
     * An unknown commit on either side never invalidates.
     */
    public boolean commitChanged(String currentCommit) {
        if (sourceCommit == null || currentCommit == null || currentCommit.isBlank()) {
            return false;
        }
        return !sourceCommit.equals(currentCommit.strip());
    }

    public Duration age(Instant now) {
        Duration age = Duration.between(producedAt, now);
        return age.isNegative() ? Duration.ZERO : age;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Artifact other)) return false;
        return analyzerId.equals(other.analyzerId)
                && target.equals(other.target)
                && producedAt.equals(other.producedAt)
                && Arrays.equals(payload, other.payload)
                && status == other.status
                && Objects.equals(error, other.error)
                && Objects.equals(sourceCommit, other.sourceCommit);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(analyzerId, target, producedAt, status, error, sourceCommit);
        return 31 * result + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "Artifact[" + target + "/" + analyzerId + ", " + status + ", producedAt=" + producedAt
                + (sourceCommit != null ? ", commit=" + sourceCommit : "") + ", " + payload.length + " bytes]";
    }
}
