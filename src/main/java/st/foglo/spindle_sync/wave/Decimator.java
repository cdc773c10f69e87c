package st.foglo.spindle_sync.wave;

import st.foglo.spindle_sync.ConfigException;
import st.foglo.spindle_sync.SyncLib.Debug;

/**
 * Reduces the sample rate by an integer factor. The signal is low-pass
 * filtered at 0.8 of the new Nyquist frequency before every factor-th
 * sample is kept.
 */
public final class Decimator {

    public static final double CUTOFF_FRACTION = 0.8;

    final int factor;
    final int order;

    public Decimator(int factor, int order) {
        if (factor < 1) {
            throw new ConfigException("decimation factor must be positive: %d", factor);
        }
        if (order < 1) {
            throw new ConfigException("filter order must be positive: %d", order);
        }
        this.factor = factor;
        this.order = order;
    }

    public int getFactor() {
        return factor;
    }

    public float[] decimate(float[] signal, int frameRate) {
        if (factor == 1) {
            return signal.clone();
        }

        final double cutoff = CUTOFF_FRACTION*frameRate/(2.0*factor);
        new Debug("decimating by %d, cutoff: %.1f Hz", factor, cutoff);
        final LowpassFilter f = new LowpassButterworth(order, frameRate, cutoff);

        final float[] result = new float[(signal.length + factor - 1)/factor];
        for (int k = 0; k < signal.length; k++) {
            final double out = f.filter(signal[k]);
            if (k % factor == 0) {
                result[k/factor] = (float) out;
            }
        }
        return result;
    }
}
