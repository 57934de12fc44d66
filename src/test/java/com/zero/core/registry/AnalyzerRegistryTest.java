package com.zero.core.registry;

import com.zero.core.model.AnalyzerDescriptor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AnalyzerRegistryTest {

    private static final Duration DAY = Duration.ofHours(24);
    private static final Analyzer NOOP = ctx -> new byte[0];

    private AnalyzerRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new AnalyzerRegistry();
        registry.register(AnalyzerDescriptor.of("sbom", DAY), NOOP);
        registry.register(AnalyzerDescriptor.of("package-vulns", Duration.ofHours(1), "sbom"), NOOP);
    }

    @Test
    @DisplayName("register rejects a duplicate id")
    void duplicateId() {
        var ex = assertThrows(DuplicateAnalyzerException.class,
                () -> registry.register(AnalyzerDescriptor.of("sbom", DAY), NOOP));
        assertEquals("sbom", ex.getAnalyzerId());
        assertEquals(2, registry.size());
    }

    @Test
    @DisplayName("resolve returns descriptors in the requested order")
    void resolveInOrder() {
        var resolved = registry.resolve(List.of("package-vulns", "sbom"));
        assertEquals(List.of("package-vulns", "sbom"), resolved.stream().map(AnalyzerDescriptor::id).toList());
    }

    @Test
    @DisplayName("resolve names every unknown id")
    void resolveUnknown() {
        var ex = assertThrows(UnknownAnalyzerException.class,
                () -> registry.resolve(List.of("sbom", "nope", "also-nope")));
        assertEquals(List.of("nope", "also-nope"), ex.getIds());
        assertTrue(ex.getMessage().contains("nope"));
    }

    @Test
    @DisplayName("descriptors and registration index follow registration order")
    void registrationOrder() {
        assertEquals(List.of("sbom", "package-vulns"),
                registry.descriptors().stream().map(AnalyzerDescriptor::id).toList());
        assertEquals(0, registry.registrationIndex("sbom"));
        assertEquals(1, registry.registrationIndex("package-vulns"));
        assertEquals(-1, registry.registrationIndex("missing"));
    }

    @Test
    @DisplayName("analyzer lookup of an unregistered id fails")
    void analyzerLookup() {
        assertSame(NOOP, registry.analyzer("sbom"));
        assertThrows(UnknownAnalyzerException.class, () -> registry.analyzer("missing"));
        assertTrue(registry.descriptor("missing").isEmpty());
    }

    @Test
    @DisplayName("descriptor de-duplicates dependencies and requires a positive TTL")
    void descriptorValidation() {
        var d = new AnalyzerDescriptor("x", null, List.of("a", "b", "a"), DAY, null);
        assertEquals(List.of("a", "b"), d.dependencies());
        assertEquals("", d.description());
        assertThrows(IllegalArgumentException.class, () -> AnalyzerDescriptor.of("x", Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> AnalyzerDescriptor.of(" ", DAY));
    }
}
