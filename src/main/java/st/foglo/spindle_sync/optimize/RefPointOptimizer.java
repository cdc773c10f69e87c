package st.foglo.spindle_sync.optimize;

import st.foglo.spindle_sync.ConfigException;
import st.foglo.spindle_sync.ShapeException;
import st.foglo.spindle_sync.SyncLib.Debug;
import st.foglo.spindle_sync.SyncLib.Trace;
import st.foglo.spindle_sync.form.FormFunction;
import st.foglo.spindle_sync.form.FormFunctionFactory;
import st.foglo.spindle_sync.form.ReferencePoints;
import st.foglo.spindle_sync.grid.Grid;
import st.foglo.spindle_sync.grid.IndexSliceConfig;
import st.foglo.spindle_sync.grid.SliceFactory;
import st.foglo.spindle_sync.grid.Slice;
import st.foglo.spindle_sync.lib.Compute;
import st.foglo.spindle_sync.mask.MaskFactory;

/**
 * Moves anchors so that the corridor around the trajectory collects as
 * much spectrogram energy as possible. Each search is exhaustive over an
 * evenly spaced set of candidates; the first best candidate wins.
 */
public final class RefPointOptimizer {

    final FormFunctionFactory formFactory;
    final MaskFactory maskFactory;
    final SliceFactory sliceFactory;
    final double[] timeSamples;
    final float[][] spectrogram;     // [frequency][time]
    final double timeStep;           // s
    final double freqStep;           // Hz
    final boolean useFirstHarmonic;
    final MaskListener listener;

    public RefPointOptimizer(
            FormFunctionFactory formFactory,
            MaskFactory maskFactory,
            SliceFactory sliceFactory,
            double[] timeSamples,
            float[][] spectrogram,
            double timeStep,
            double freqStep) {
        this(formFactory, maskFactory, sliceFactory, timeSamples, spectrogram,
                timeStep, freqStep, true, null);
    }

    public RefPointOptimizer(
            FormFunctionFactory formFactory,
            MaskFactory maskFactory,
            SliceFactory sliceFactory,
            double[] timeSamples,
            float[][] spectrogram,
            double timeStep,
            double freqStep,
            boolean useFirstHarmonic,
            MaskListener listener) {
        if (timeSamples.length != sliceFactory.getGrid().nTime) {
            throw new ShapeException("expected %d time samples, got %d",
                    sliceFactory.getGrid().nTime, timeSamples.length);
        }
        if (!(timeStep > 0) || !(freqStep > 0)) {
            throw new ConfigException("steps must be positive: %f s, %f Hz", timeStep, freqStep);
        }
        this.formFactory = formFactory;
        this.maskFactory = maskFactory;
        this.sliceFactory = sliceFactory;
        this.timeSamples = timeSamples.clone();
        this.spectrogram = spectrogram;
        this.timeStep = timeStep;
        this.freqStep = freqStep;
        this.useFirstHarmonic = useFirstHarmonic;
        this.listener = listener;
    }

    /**
     * Searches the time of anchor i in [lo, hi].
     */
    public ReferencePoints optimizeTime(ReferencePoints points, int i, double lo, double hi, double resolution) {
        checkSearch(points, i, lo, hi, resolution);
        final double[] values = Compute.linspace(lo, hi, Compute.nofCandidates(hi - lo, timeStep, resolution));
        final ReferencePoints[] candidates = new ReferencePoints[values.length];
        for (int k = 0; k < values.length; k++) {
            candidates[k] = points.withTime(i, values[k]);
        }
        new Debug("time search, anchor %d: [%.3f, %.3f] s", i, lo, hi);
        final Grid grid = sliceFactory.getGrid();
        final int[] range = searchRange(lo, hi, grid.timeMax, grid.nTime);
        return best(candidates, sliceFactory.build(IndexSliceConfig.time(range[0], range[1])));
    }

    /**
     * Searches the frequency of anchor i in [lo, hi].
     */
    public ReferencePoints optimizeFrequency(ReferencePoints points, int i, double lo, double hi, double resolution) {
        checkSearch(points, i, lo, hi, resolution);
        final double[] values = Compute.linspace(lo, hi, Compute.nofCandidates(hi - lo, freqStep, resolution));
        final ReferencePoints[] candidates = new ReferencePoints[values.length];
        for (int k = 0; k < values.length; k++) {
            candidates[k] = points.withFrequency(i, values[k]);
        }
        new Debug("frequency search, anchor %d: [%.1f, %.1f] Hz", i, lo, hi);
        final Grid grid = sliceFactory.getGrid();
        final int[] range = searchRange(lo, hi, grid.freqMax, grid.nFreq);
        return best(candidates, sliceFactory.build(IndexSliceConfig.frequency(range[0], range[1])));
    }

    /**
     * Moves all interior anchors together, by up to the distance between
     * the last two anchors.
     */
    public ReferencePoints optimizeAllTimes(ReferencePoints points, double resolution) {
        if (points.size() < 2) {
            throw new ConfigException("at least two anchors needed, got: %d", points.size());
        }
        checkResolution(resolution);
        final double d = points.time(points.size() - 1) - points.time(points.size() - 2);
        if (!(d > 0)) {
            throw new ConfigException("last two anchors coincide: %s", points);
        }
        final double[] shifts = Compute.linspace(0.0, d, Compute.nofCandidates(d, timeStep, resolution));
        final ReferencePoints[] candidates = new ReferencePoints[shifts.length];
        for (int k = 0; k < shifts.length; k++) {
            candidates[k] = points.shifted(shifts[k]);
        }
        new Debug("joint time search: [0, %.3f] s", d);
        return best(candidates, sliceFactory.build());
    }

    /**
     * Index range [from, to) covering [lo, hi] on one axis, at least one
     * cell wide so that a search narrower than a cell still scores.
     */
    static int[] searchRange(double lo, double hi, double axisMax, int axisCount) {
        final int from = Compute.iMin(Grid.toIndex(lo, axisMax, axisCount), axisCount - 1);
        final int to = Compute.iMin(Compute.iMax(Grid.toIndex(hi, axisMax, axisCount), from + 1), axisCount);
        return new int[]{from, to};
    }

    private ReferencePoints best(ReferencePoints[] candidates, Slice slice) {
        final float[][] energy = slice.sliceMatrix(spectrogram);
        final double[] t = slice.sliceX(timeSamples);

        int bestIndex = 0;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (int k = 0; k < candidates.length; k++) {
            final double score = score(candidates[k], t, slice, energy);
            if (score > bestScore) {
                bestScore = score;
                bestIndex = k;
            }
        }
        new Trace("evaluated %d candidates, best: %d, score: %f", candidates.length, bestIndex, bestScore);
        return candidates[bestIndex];
    }

    double score(ReferencePoints points, double[] t, Slice slice, float[][] energy) {
        final FormFunction f = formFactory.parametrize(points);
        final double[] curve = f.apply(t);
        boolean[][] mask = maskFactory.buildBinaryMask(curve, slice);
        if (useFirstHarmonic) {
            final double[] harmonic = new double[curve.length];
            for (int k = 0; k < curve.length; k++) {
                harmonic[k] = 2*curve[k];
            }
            mask = MaskFactory.or(mask, maskFactory.buildBinaryMask(harmonic, slice));
        }
        if (listener != null) {
            listener.maskEvaluated(slice, mask);
        }
        return Compute.sum(energy, mask);
    }

    private static void checkSearch(ReferencePoints points, int i, double lo, double hi, double resolution) {
        if (!Double.isFinite(lo) || !Double.isFinite(hi)) {
            throw new ConfigException("search bounds must be finite: [%f, %f]", lo, hi);
        }
        if (lo >= hi) {
            throw new ConfigException("empty search interval: [%f, %f]", lo, hi);
        }
        checkResolution(resolution);
        if (i < 1 || i > points.size() - 2) {
            throw new ConfigException("anchor %d is not an interior anchor of %d", i, points.size());
        }
    }

    private static void checkResolution(double resolution) {
        if (!(resolution > 0) || !Double.isFinite(resolution)) {
            throw new ConfigException("resolution must be positive: %f", resolution);
        }
    }
}
