package com.zero.core.registry;

/**
 * Run capability of a single analyzer. The engine depends only on this interface,
 * never on concrete analyzer types.
 *
 * <p>Implementations must honour {@link AnalyzerContext#isCancelled()} and thread
 * interruption: both are raised when the job is cancelled or the run's timeout expires.
 * The engine invokes an analyzer at most once per (target, analyzer) key at a time.
 */
@FunctionalInterface
public interface Analyzer {

    /**
     * Analyzes {@link AnalyzerContext#target()} and returns the artifact payload
     * (typically UTF-8 JSON).
     *
     * @throws Exception any failure; the engine records it against this analyzer only
     */
    byte[] run(AnalyzerContext context) throws Exception;
}
