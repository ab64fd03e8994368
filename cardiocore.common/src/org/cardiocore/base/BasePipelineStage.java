package org.cardiocore.base;

import java.util.ArrayList;
import java.util.List;

import org.cardiocore.exceptions.ServiceProcessingException;
import org.cardiocore.logger.PipelineEventLogger;

/**
 * Abstract base class for every non-fatal pipeline stage.
 *
 * ARCHITECTURAL CONTRACT:
 * - {@link #execute} is the template method. It logs the stage lifecycle, runs
 *   {@link #processStageSpecific} and never throws.
 * - Any fault inside a stage is absorbed: the stage's {@link #createFallback}
 *   value is returned instead, flagged as degraded, with a warning naming the stage.
 * - Stages are stateless between calls and may be shared across threads.
 *
 * @param <I> input produced by the previous stage
 * @param <O> output handed to the next stage
 */
public abstract class BasePipelineStage<I, O> {

    protected final String stageName;
    protected final PipelineEventLogger eventLogger;

    protected BasePipelineStage(String stageName) {
        this.stageName = stageName;
        this.eventLogger = PipelineEventLogger.getInstance();
    }

    /**
     * Main processing method - template method pattern
     */
    public final StageResult<O> execute(String analysisId, I input) {
        long start = System.currentTimeMillis();
        eventLogger.logStageStart(stageName, analysisId);

        List<String> warnings = new ArrayList<>();
        try {
            O output = processStageSpecific(analysisId, input, warnings);
            if (output == null) {
                throw new IllegalStateException(stageName + " produced no output");
            }
            for (String warning : warnings) {
                eventLogger.logStageWarning(stageName, analysisId, warning);
            }
            eventLogger.logStageComplete(stageName, analysisId, System.currentTimeMillis() - start);
            return new StageResult<>(output, warnings, false);

        } catch (ServiceProcessingException | RuntimeException e) {
            eventLogger.logStageDegraded(stageName, analysisId, e);
            // Partial warnings from the failed attempt no longer describe the output
            List<String> degradedWarnings = new ArrayList<>();
            degradedWarnings.add(stageName + " degraded, default substituted: " + describe(e));
            return new StageResult<>(createFallback(analysisId, input), degradedWarnings, true);
        }
    }

    /**
     * Stage-specific computation. Non-fatal observations go into {@code warnings}.
     */
    protected abstract O processStageSpecific(String analysisId, I input, List<String> warnings)
            throws ServiceProcessingException;

    /**
     * Documented safe default returned when the stage faults. Must not throw.
     */
    protected abstract O createFallback(String analysisId, I input);

    public String getStageName() {
        return stageName;
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message != null ? message : e.getClass().getSimpleName();
    }
}
