package st.foglo.spindle_sync.mask;

import st.foglo.spindle_sync.ConfigException;
import st.foglo.spindle_sync.ShapeException;
import st.foglo.spindle_sync.grid.Grid;
import st.foglo.spindle_sync.grid.Slice;
import st.foglo.spindle_sync.lib.Compute;

/**
 * Builds the corridor around a frequency trajectory. A cell is inside the
 * corridor if some point of the trajectory within half the time window
 * lies within half the frequency window of it.
 */
public final class MaskFactory {

    public static final int DEFAULT_UPSAMPLE_FACTOR = 10;

    final Grid grid;
    final double timeWindow;     // s
    final double freqWindow;     // Hz
    final int upsampleFactor;

    public MaskFactory(Grid grid, double timeWindow, double freqWindow) {
        this(grid, timeWindow, freqWindow, DEFAULT_UPSAMPLE_FACTOR);
    }

    public MaskFactory(Grid grid, double timeWindow, double freqWindow, int upsampleFactor) {
        if (!(timeWindow >= 0) || !(freqWindow >= 0)) {
            throw new ConfigException("mask windows must not be negative: %f s, %f Hz", timeWindow, freqWindow);
        }
        if (upsampleFactor < 1) {
            throw new ConfigException("upsample factor must be positive: %d", upsampleFactor);
        }
        this.grid = grid;
        this.timeWindow = timeWindow;
        this.freqWindow = freqWindow;
        this.upsampleFactor = upsampleFactor;
    }

    /**
     * @param curve trajectory in Hz, either one value per grid column or
     *              one value per column of the slice; an empty curve gives
     *              an empty mask
     * @return mask indexed [row][column] relative to the slice
     */
    public boolean[][] buildBinaryMask(double[] curve, Slice slice) {
        if (curve.length == 0) {
            return new boolean[slice.height()][0];
        }

        final double[] local;
        if (curve.length == grid.nTime) {
            local = slice.sliceX(curve);
        }
        else if (curve.length == slice.width()) {
            local = curve;
        }
        else {
            throw new ShapeException("curve length %d matches neither the grid (%d) nor the slice (%d)",
                    curve.length, grid.nTime, slice.width());
        }

        final int n = local.length;
        final boolean[][] result = new boolean[slice.height()][n];

        final int u = upsampleFactor;
        final double[] center = new double[n*u];
        final double[] plus = new double[n*u];
        final double[] minus = new double[n*u];
        for (int j = 0; j < n*u; j++) {
            center[j] = Compute.interpolate(local, (double) j/u);
            plus[j] = center[j] + freqWindow/2;
            minus[j] = center[j] - freqWindow/2;
        }

        final int[] centerIdx = Grid.toIndex(center, grid.freqMax, grid.nFreq);
        final int[] plusIdx = Grid.toIndex(plus, grid.freqMax, grid.nFreq);
        final int[] minusIdx = Grid.toIndex(minus, grid.freqMax, grid.nFreq);

        final int s = Grid.toIndex(timeWindow/2, grid.timeMax, grid.nTime)*u;

        final int[][] variants = new int[][]{
            TimeShifter.right(plusIdx, s),
            TimeShifter.left(plusIdx, s),
            TimeShifter.right(minusIdx, s),
            TimeShifter.left(minusIdx, s),
            plusIdx,
            minusIdx,
            TimeShifter.right(centerIdx, s),
            TimeShifter.left(centerIdx, s)
        };

        final int[] lower = new int[n];
        final int[] upper = new int[n];
        for (int c = 0; c < n; c++) {
            final int j = c*u;
            int lo = Integer.MAX_VALUE;
            int hi = Integer.MIN_VALUE;
            for (int[] v : variants) {
                lo = Compute.iMin(lo, v[j]);
                hi = Compute.iMax(hi, v[j]);
            }
            lower[c] = lo;
            upper[c] = hi;
        }

        for (int r = 0; r < result.length; r++) {
            final int row = slice.fromY + r;
            for (int c = 0; c < n; c++) {
                result[r][c] = lower[c] <= row && row <= upper[c];
            }
        }
        return result;
    }

    /**
     * Cellwise union of two masks of the same shape.
     */
    public static boolean[][] or(boolean[][] a, boolean[][] b) {
        if (a.length != b.length) {
            throw new ShapeException("mask heights differ: %d, %d", a.length, b.length);
        }
        final boolean[][] result = new boolean[a.length][];
        for (int r = 0; r < a.length; r++) {
            if (a[r].length != b[r].length) {
                throw new ShapeException("mask widths differ: %d, %d", a[r].length, b[r].length);
            }
            result[r] = new boolean[a[r].length];
            for (int c = 0; c < a[r].length; c++) {
                result[r][c] = a[r][c] || b[r][c];
            }
        }
        return result;
    }

    public Grid getGrid() {
        return grid;
    }
}
