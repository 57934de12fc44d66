package com.zero.core.model;

/**
 * Outcome recorded on a stored artifact.
 */
public enum ArtifactStatus {
    OK,
    ERROR
}
