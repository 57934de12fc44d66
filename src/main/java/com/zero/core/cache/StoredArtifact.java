package com.zero.core.cache;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.zero.core.model.Artifact;
import com.zero.core.model.ArtifactStatus;

import java.time.Instant;

/**
 * On-disk JSON envelope of an {@link Artifact}. The payload is base64 encoded by Jackson.
 */
record StoredArtifact(
    int version,
    @JsonProperty("analyzer_id") String analyzerId,
    String target,
    @JsonProperty("produced_at") Instant producedAt,
    ArtifactStatus status,
    String error,
    byte[] payload,
    @JsonProperty("source_commit") String sourceCommit
) {

    static final int CURRENT_VERSION = 1;

    static StoredArtifact from(Artifact artifact) {
        return new StoredArtifact(CURRENT_VERSION, artifact.analyzerId(), artifact.target(),
                artifact.producedAt(), artifact.status(), artifact.error(), artifact.payload(),
                artifact.sourceCommit());
    }

    Artifact toArtifact() {
        return new Artifact(analyzerId, target, producedAt, payload, status, error, sourceCommit);
    }
}
