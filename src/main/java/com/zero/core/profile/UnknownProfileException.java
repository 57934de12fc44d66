package com.zero.core.profile;

/**
 * Thrown when a scan names a profile that is not configured.
 */
public class UnknownProfileException extends RuntimeException {

    private final String profile;

    public UnknownProfileException(String profile) {
        super("Unknown profile: " + profile);
        this.profile = profile;
    }

    public String getProfile() {
        return profile;
    }
}
