package org.cardiocore.base;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.cardiocore.exceptions.StageDegradationException;
import org.cardiocore.logger.PipelineEventLogger;
import org.junit.jupiter.api.Test;

class BasePipelineStageTest {

    /** Doubles its input; negative input faults, zero produces no output. */
    private static class DoublingStage extends BasePipelineStage<Integer, Integer> {

        DoublingStage() {
            super("DOUBLER");
        }

        @Override
        protected Integer processStageSpecific(String analysisId, Integer input, List<String> warnings)
                throws StageDegradationException {
            if (input < 0) {
                warnings.add("partial work");
                throw new StageDegradationException(stageName, analysisId, "negative input");
            }
            if (input == 0) {
                return null;
            }
            if (input > 100) {
                warnings.add("large input");
            }
            return input * 2;
        }

        @Override
        protected Integer createFallback(String analysisId, Integer input) {
            return -1;
        }
    }

    private final DoublingStage stage = new DoublingStage();

    @Test
    void successfulRunKeepsWarnings() {
        StageResult<Integer> result = stage.execute("A1", 200);

        assertEquals(400, result.getValue());
        assertFalse(result.isDegraded());
        assertEquals(List.of("large input"), result.getWarnings());
    }

    @Test
    void checkedFaultSubstitutesFallback() {
        StageResult<Integer> result = stage.execute("A2", -5);

        assertEquals(-1, result.getValue());
        assertTrue(result.isDegraded());
        assertEquals(1, result.getWarnings().size());
        assertEquals("DOUBLER degraded, default substituted: negative input", result.getWarnings().get(0));
    }

    @Test
    void missingOutputIsTreatedAsFault() {
        StageResult<Integer> result = stage.execute("A3", 0);

        assertTrue(result.isDegraded());
        assertEquals(-1, result.getValue());
        assertTrue(result.getWarnings().get(0).contains("produced no output"));
    }

    @Test
    void runtimeFaultIsAbsorbedAndCounted() {
        long before = PipelineEventLogger.getInstance().getEventCount("STAGE_DEGRADED");

        StageResult<Integer> result = stage.execute("A4", null);

        assertTrue(result.isDegraded());
        assertEquals(-1, result.getValue());
        assertTrue(PipelineEventLogger.getInstance().getEventCount("STAGE_DEGRADED") > before);
    }
}
