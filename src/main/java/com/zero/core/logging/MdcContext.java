package com.zero.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing scan-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String JOB_ID = "jobId";
    public static final String ANALYZER_ID = "analyzerId";
    public static final String WAVE_NUMBER = "waveNumber";

    private MdcContext() {}

    public static void setJob(String jobId) {
        MDC.put(JOB_ID, jobId);
    }

    public static void setWave(String jobId, int waveNumber) {
        MDC.put(JOB_ID, jobId);
        MDC.put(WAVE_NUMBER, String.valueOf(waveNumber));
    }

    public static void setAnalyzer(String jobId, int waveNumber, String analyzerId) {
        setWave(jobId, waveNumber);
        MDC.put(ANALYZER_ID, analyzerId);
    }

    public static void clearAnalyzer() {
        MDC.remove(ANALYZER_ID);
    }

    public static void clear() {
        MDC.remove(JOB_ID);
        MDC.remove(ANALYZER_ID);
        MDC.remove(WAVE_NUMBER);
    }
}
