package st.foglo.spindle_sync.form;

import java.util.Arrays;

import st.foglo.spindle_sync.ConfigException;

/**
 * Anchors of the frequency trajectory: frequency freqs[i] (Hz) at time
 * times[i] (s). Instances are immutable; the with-methods return
 * modified copies.
 */
public final class ReferencePoints {

    private final double[] times;
    private final double[] freqs;

    public ReferencePoints(double[] times, double[] freqs) {
        if (times.length != freqs.length) {
            throw new ConfigException("anchor arrays differ in length: %d times, %d frequencies",
                    times.length, freqs.length);
        }
        this.times = times.clone();
        this.freqs = freqs.clone();
    }

    public int size() {
        return times.length;
    }

    public double time(int i) {
        return times[i];
    }

    public double frequency(int i) {
        return freqs[i];
    }

    public double[] getTimes() {
        return times.clone();
    }

    public double[] getFreqs() {
        return freqs.clone();
    }

    public ReferencePoints withTime(int i, double t) {
        final double[] newTimes = times.clone();
        newTimes[i] = t;
        return new ReferencePoints(newTimes, freqs);
    }

    public ReferencePoints withFrequency(int i, double f) {
        final double[] newFreqs = freqs.clone();
        newFreqs[i] = f;
        return new ReferencePoints(times, newFreqs);
    }

    /**
     * All times except the first and the last moved by dt.
     */
    public ReferencePoints shifted(double dt) {
        final double[] newTimes = times.clone();
        for (int i = 1; i < newTimes.length - 1; i++) {
            newTimes[i] += dt;
        }
        return new ReferencePoints(newTimes, freqs);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof ReferencePoints)) {
            return false;
        }
        final ReferencePoints other = (ReferencePoints) o;
        return Arrays.equals(times, other.times) && Arrays.equals(freqs, other.freqs);
    }

    @Override
    public int hashCode() {
        return 31*Arrays.hashCode(times) + Arrays.hashCode(freqs);
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder("ReferencePoints[");
        for (int i = 0; i < times.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(String.format("(%.3f s, %.1f Hz)", times[i], freqs[i]));
        }
        return sb.append("]").toString();
    }
}
