package org.cardiocore.features;

/**
 * Fiducial sample indices of one delineated beat. Points that could not be
 * located are {@link #ABSENT}.
 */
public final class BeatFiducials {

    public static final int ABSENT = -1;

    public final int rPeak;
    public final int qrsOnset;
    public final int qrsOffset;
    public final int pOnset;
    public final int tEnd;
    public final double isoelectricLevel;

    public BeatFiducials(int rPeak, int qrsOnset, int qrsOffset, int pOnset, int tEnd, double isoelectricLevel) {
        this.rPeak = rPeak;
        this.qrsOnset = qrsOnset;
        this.qrsOffset = qrsOffset;
        this.pOnset = pOnset;
        this.tEnd = tEnd;
        this.isoelectricLevel = isoelectricLevel;
    }

    public boolean hasQrs() {
        return qrsOnset != ABSENT && qrsOffset != ABSENT;
    }

    public boolean hasP() {
        return hasQrs() && pOnset != ABSENT;
    }

    public boolean hasT() {
        return hasQrs() && tEnd != ABSENT;
    }

    @Override
    public String toString() {
        return String.format("Beat{r=%d, qrs=[%d,%d], p=%d, tEnd=%d}", rPeak, qrsOnset, qrsOffset, pOnset, tEnd);
    }
}
