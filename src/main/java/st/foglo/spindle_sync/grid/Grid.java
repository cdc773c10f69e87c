package st.foglo.spindle_sync.grid;

import st.foglo.spindle_sync.ConfigException;

/**
 * The time-frequency grid of a spectrogram. Time runs along x with nTime
 * cells covering [0, timeMax], frequency runs along y with nFreq cells
 * covering [0, freqMax].
 */
public final class Grid {

    public final int nTime;
    public final double timeMax;
    public final int nFreq;
    public final double freqMax;

    public Grid(int nTime, double timeMax, int nFreq, double freqMax) {
        if (nTime <= 0 || nFreq <= 0) {
            throw new ConfigException("grid dimensions must be positive: %d x %d", nTime, nFreq);
        }
        if (!(timeMax > 0 && Double.isFinite(timeMax)) || !(freqMax > 0 && Double.isFinite(freqMax))) {
            throw new ConfigException("grid extent must be positive and finite: %f s, %f Hz", timeMax, freqMax);
        }
        this.nTime = nTime;
        this.timeMax = timeMax;
        this.nFreq = nFreq;
        this.freqMax = freqMax;
    }

    public double timeStep() {
        return timeMax/nTime;
    }

    public double freqStep() {
        return freqMax/nFreq;
    }

    public int timeIndex(double t) {
        return toIndex(t, timeMax, nTime);
    }

    public int freqIndex(double f) {
        return toIndex(f, freqMax, nFreq);
    }

    public static int toIndex(double value, double axisMax, int axisCount) {
        return toIndex(value, axisMax, axisCount, true);
    }

    /**
     * Index of the cell that contains the given value. When clipping, the
     * result is limited to [0, axisCount].
     */
    public static int toIndex(double value, double axisMax, int axisCount, boolean clip) {
        final double cell = axisMax/axisCount;
        final double index = Math.floor(value/cell);
        if (clip) {
            return index < 0 ? 0 : index > axisCount ? axisCount : (int) index;
        }
        return (int) index;
    }

    public static int[] toIndex(double[] values, double axisMax, int axisCount) {
        return toIndex(values, axisMax, axisCount, true);
    }

    public static int[] toIndex(double[] values, double axisMax, int axisCount, boolean clip) {
        final int[] result = new int[values.length];
        for (int k = 0; k < values.length; k++) {
            result[k] = toIndex(values[k], axisMax, axisCount, clip);
        }
        return result;
    }

    /**
     * Lower edge of the given cell.
     */
    public static double toValue(int index, double axisMax, int axisCount) {
        return index*(axisMax/axisCount);
    }

    @Override
    public String toString() {
        return String.format("Grid[%d x %.3f s, %d x %.3f Hz]", nTime, timeMax, nFreq, freqMax);
    }
}
