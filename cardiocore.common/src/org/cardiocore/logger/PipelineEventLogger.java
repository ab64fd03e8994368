package org.cardiocore.logger;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.log4j.Logger;
import org.apache.log4j.MDC;

/**
 * Pipeline Event Logger
 *
 * Centralized logger for analysis lifecycle events:
 * - Analysis start/finish (binds the analysis id into the log4j MDC)
 * - Stage start/complete
 * - Stage degradation (non-fatal faults absorbed into warnings)
 * - Fatal analysis failures
 *
 * Keeps per-event-type counters so operators can see how often stages degrade.
 * This is a singleton - every pipeline stage reports to the same instance.
 */
public class PipelineEventLogger {

    public static final String MDC_ANALYSIS_ID = "analysisId";

    private static PipelineEventLogger instance;
    private static final Logger logger = Logger.getLogger(PipelineEventLogger.class);

    private final ConcurrentHashMap<String, AtomicLong> eventCounts = new ConcurrentHashMap<>();

    private PipelineEventLogger() {
        logger.info("=== PIPELINE EVENT LOGGER INITIALIZED ===");
    }

    public static synchronized PipelineEventLogger getInstance() {
        if (instance == null) {
            instance = new PipelineEventLogger();
        }
        return instance;
    }

    // ========== Analysis Lifecycle Events ==========

    public void logAnalysisStarted(String analysisId, String sourceDescription) {
        MDC.put(MDC_ANALYSIS_ID, analysisId);
        count("ANALYSIS_STARTED");
        logger.info(String.format("ANALYSIS_STARTED: analysisId=%s, source=%s", analysisId, sourceDescription));
    }

    public void logAnalysisCompleted(String analysisId, String urgency, int warningCount) {
        count("ANALYSIS_COMPLETED");
        logger.info(String.format("ANALYSIS_COMPLETED: analysisId=%s, urgency=%s, warnings=%d",
                analysisId, urgency, warningCount));
    }

    public void logAnalysisFailed(String analysisId, Exception e) {
        count("ANALYSIS_FAILED");
        logger.error(String.format("ANALYSIS_FAILED: analysisId=%s, error=%s", analysisId, e));
    }

    /**
     * Unbind the analysis id from the current thread. Always called from a finally block.
     */
    public void clearAnalysisContext() {
        MDC.remove(MDC_ANALYSIS_ID);
    }

    // ========== Stage Events ==========

    public void logStageStart(String stageName, String analysisId) {
        count("STAGE_START");
        if (logger.isDebugEnabled()) {
            logger.debug(String.format("STAGE_START: stage=%s, analysisId=%s", stageName, analysisId));
        }
    }

    public void logStageComplete(String stageName, String analysisId, long elapsedMillis) {
        count("STAGE_COMPLETE");
        logger.info(String.format("STAGE_COMPLETE: stage=%s, analysisId=%s, executionTime=%dms",
                stageName, analysisId, elapsedMillis));
    }

    public void logStageDegraded(String stageName, String analysisId, Exception e) {
        count("STAGE_DEGRADED");
        logger.warn(String.format("STAGE_DEGRADED: stage=%s, analysisId=%s, error=%s",
                stageName, analysisId, e.getMessage()), e);
    }

    public void logStageWarning(String stageName, String analysisId, String warning) {
        count("STAGE_WARNING");
        logger.warn(String.format("STAGE_WARNING: stage=%s, analysisId=%s, warning=%s",
                stageName, analysisId, warning));
    }

    // ========== Statistics ==========

    public long getEventCount(String eventType) {
        AtomicLong counter = eventCounts.get(eventType);
        return counter == null ? 0 : counter.get();
    }

    public Map<String, Long> getEventCounts() {
        Map<String, Long> snapshot = new TreeMap<>();
        eventCounts.forEach((type, counter) -> snapshot.put(type, counter.get()));
        return snapshot;
    }

    private void count(String eventType) {
        eventCounts.computeIfAbsent(eventType, k -> new AtomicLong()).incrementAndGet();
    }
}
