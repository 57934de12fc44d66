package com.zero.core.profile;

import com.zero.core.registry.AnalyzerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Expands a scan request's profile name, or explicit analyzer list, into the
 * analyzer ids to schedule.
 * <p>
 * Accepted forms: a configured profile name ({@code "standard"}), a comma separated
 * list of analyzer ids ({@code "package-sbom,package-vulns"}), a single registered
 * analyzer id, or blank for the default profile.
 */
public class ProfileResolver {

    private static final Logger log = LoggerFactory.getLogger(ProfileResolver.class);

    /** Profile label reported for explicit analyzer lists. */
    public static final String CUSTOM_PROFILE = "custom";

    private final Map<String, ScanProfile> profiles;
    private final String defaultProfile;
    private final AnalyzerRegistry registry;

    public ProfileResolver(Map<String, ScanProfile> profiles, String defaultProfile, AnalyzerRegistry registry) {
        this.profiles = new LinkedHashMap<>(profiles);
        this.defaultProfile = defaultProfile;
        this.registry = registry;
    }

    /**
     * Resolves a profile name or analyzer list.
     *
     * @throws UnknownProfileException if the input is neither a profile nor registered analyzer ids
     */
    public Selection resolve(String profileOrAnalyzers) {
        String input = profileOrAnalyzers == null ? "" : profileOrAnalyzers.strip();
        if (input.isEmpty()) {
            input = defaultProfile;
        }

        var profile = profiles.get(input);
        if (profile != null) {
            log.debug("Profile {} -> {}", profile.name(), profile.analyzers());
            return new Selection(profile.name(), profile.analyzers());
        }

        List<String> ids = Arrays.stream(input.split(","))
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .toList();
        boolean looksLikeList = input.contains(",") || (ids.size() == 1 && registry.contains(ids.get(0)));
        if (!looksLikeList || ids.isEmpty()) {
            throw new UnknownProfileException(input);
        }
        return resolve(ids);
    }

    /** Uses an explicit analyzer list; unknown ids surface later from the scheduler. */
    public Selection resolve(List<String> analyzers) {
        return new Selection(CUSTOM_PROFILE, List.copyOf(new LinkedHashSet<>(analyzers)));
    }

    public Optional<ScanProfile> profile(String name) {
        return Optional.ofNullable(profiles.get(name));
    }

    public List<ScanProfile> profiles() {
        return List.copyOf(profiles.values());
    }

    public String defaultProfile() {
        return defaultProfile;
    }

    /**
     * Result of resolution.
     *
     * @param profile   profile name, or {@link #CUSTOM_PROFILE} for an explicit list
     * @param analyzers requested analyzer ids, de-duplicated, in order
     */
    public record Selection(String profile, List<String> analyzers) {}
}
