package com.zero.core.config;

import com.zero.core.model.AnalyzerDescriptor;
import com.zero.core.profile.ProfileResolver;
import com.zero.core.profile.ScanProfile;
import com.zero.core.registry.Analyzer;
import com.zero.core.registry.AnalyzerRegistry;
import com.zero.core.registry.CommandAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;

/**
 * Builds the analyzer registry and profile table from {@code zero.analyzers.*} and
 * {@code zero.profiles.*}.
 */
@Configuration
public class AnalyzerConfig {

    private static final Logger log = LoggerFactory.getLogger(AnalyzerConfig.class);

    @Bean
    public AnalyzerRegistry analyzerRegistry(ZeroProperties properties) {
        var registry = new AnalyzerRegistry();
        var defaultTtl = properties.getCache().getDefaultTtl();
        properties.getAnalyzers().forEach((id, settings) -> {
            if (!settings.isEnabled()) {
                log.info("Analyzer {} disabled by configuration", id);
                return;
            }
            var descriptor = new AnalyzerDescriptor(id, settings.getDescription(), settings.getDependencies(),
                    settings.getTtl() != null ? settings.getTtl() : defaultTtl, settings.getTimeout());
            registry.register(descriptor, analyzerFor(id, settings));
        });
        log.info("Registered {} analyzer(s): {}", registry.size(),
                registry.descriptors().stream().map(AnalyzerDescriptor::id).toList());
        return registry;
    }

    @Bean
    public ProfileResolver profileResolver(ZeroProperties properties, AnalyzerRegistry registry) {
        var profiles = new LinkedHashMap<String, ScanProfile>();
        properties.getProfiles().forEach((name, settings) ->
                profiles.put(name, new ScanProfile(name, settings.getDescription(), settings.getAnalyzers())));
        return new ProfileResolver(profiles, properties.getScan().getDefaultProfile(), registry);
    }

    static Analyzer analyzerFor(String id, ZeroProperties.AnalyzerProperties settings) {
        if (settings.getCommand() == null || settings.getCommand().isEmpty()) {
            return context -> {
                throw new IllegalStateException("No command configured for analyzer " + id);
            };
        }
        return new CommandAnalyzer(settings.getCommand());
    }
}
