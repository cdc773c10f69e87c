package st.foglo.spindle_sync.optimize;

import st.foglo.spindle_sync.ConfigException;
import st.foglo.spindle_sync.SyncLib.Info;
import st.foglo.spindle_sync.form.ReferencePoints;
import st.foglo.spindle_sync.lib.Compute;

/**
 * The three passes that turn nominal anchors into refined ones: a joint
 * time shift, then per-anchor frequency searches, then per-anchor time
 * searches between the midpoints to the neighbours.
 */
public final class Refinement {

    public static final double DEFAULT_GLOBAL_RESOLUTION = 0.2;
    public static final double DEFAULT_FREQ_RESOLUTION = 1.0;
    public static final double DEFAULT_TIME_RESOLUTION = 1.0;
    public static final double DEFAULT_FREQ_SEARCH = 30.0;

    final RefPointOptimizer optimizer;
    final double globalResolution;
    final double freqResolution;
    final double timeResolution;
    final double freqSearch;        // Hz, half width of the frequency search

    public Refinement(RefPointOptimizer optimizer) {
        this(optimizer, DEFAULT_GLOBAL_RESOLUTION, DEFAULT_FREQ_RESOLUTION,
                DEFAULT_TIME_RESOLUTION, DEFAULT_FREQ_SEARCH);
    }

    public Refinement(RefPointOptimizer optimizer,
            double globalResolution,
            double freqResolution,
            double timeResolution,
            double freqSearch) {
        if (!(freqSearch > 0)) {
            throw new ConfigException("frequency search width must be positive: %f", freqSearch);
        }
        this.optimizer = optimizer;
        this.globalResolution = globalResolution;
        this.freqResolution = freqResolution;
        this.timeResolution = timeResolution;
        this.freqSearch = freqSearch;
    }

    public ReferencePoints run(ReferencePoints nominal) {
        ReferencePoints p = optimizer.optimizeAllTimes(nominal, globalResolution);
        new Info("joint time shift: %.3f s", p.size() > 2 ? p.time(1) - nominal.time(1) : 0.0);

        for (int i = 1; i < p.size() - 1; i++) {
            final double f = p.frequency(i);
            if (f == 0.0) {
                continue;
            }
            p = optimizer.optimizeFrequency(p, i, Compute.dMax(0.0, f - freqSearch), f + freqSearch,
                    freqResolution);
            new Info("anchor %d: %.1f Hz -> %.1f Hz", i, f, p.frequency(i));
        }

        for (int i = 1; i < p.size() - 1; i++) {
            final double t = p.time(i);
            final double lo = t - (t - p.time(i - 1))/2;
            final double hi = t + (p.time(i + 1) - t)/2;
            if (lo >= hi) {
                continue;
            }
            p = optimizer.optimizeTime(p, i, lo, hi, timeResolution);
            new Info("anchor %d: %.3f s -> %.3f s", i, t, p.time(i));
        }
        return p;
    }
}
