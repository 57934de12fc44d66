package com.zero.core.profile;

import java.util.List;

/**
 * Named subset of analyzers to run for a scan.
 */
public record ScanProfile(String name, String description, List<String> analyzers) {

    public ScanProfile {
        description = description != null ? description : "";
        analyzers = List.copyOf(analyzers);
    }
}
