package st.foglo.spindle_sync.spectrum;

import st.foglo.spindle_sync.grid.Grid;

/**
 * STFT magnitudes of a recording together with the time of each frame
 * and the frequency of each bin.
 */
public final class Spectrogram {

    public final float[][] magnitudes;   // [bin][frame]
    public final double sampleRate;      // Hz
    public final int nFft;
    public final int hopLength;

    public Spectrogram(float[][] magnitudes, double sampleRate, int nFft, int hopLength) {
        this.magnitudes = magnitudes;
        this.sampleRate = sampleRate;
        this.nFft = nFft;
        this.hopLength = hopLength;
    }

    public static Spectrogram compute(float[] signal, double sampleRate, Stft stft) {
        return new Spectrogram(stft.magnitude(signal), sampleRate, stft.nFft, stft.hopLength);
    }

    public int nofFrames() {
        return magnitudes[0].length;
    }

    public int nofBins() {
        return magnitudes.length;
    }

    public double[] times() {
        final double[] result = new double[nofFrames()];
        for (int k = 0; k < result.length; k++) {
            result[k] = k*timeDelta();
        }
        return result;
    }

    public double[] freqs() {
        final double[] result = new double[nofBins()];
        for (int k = 0; k < result.length; k++) {
            result[k] = k*freqDelta();
        }
        return result;
    }

    public double timeDelta() {
        return hopLength/sampleRate;
    }

    public double freqDelta() {
        return sampleRate/nFft;
    }

    public Grid grid() {
        return new Grid(nofFrames(), (nofFrames() - 1)*timeDelta(), nofBins(), (nofBins() - 1)*freqDelta());
    }

    /**
     * Square root of every magnitude; evens out strong and weak ridges.
     */
    public Spectrogram sqrtCompressed() {
        final float[][] m = new float[magnitudes.length][];
        for (int b = 0; b < m.length; b++) {
            m[b] = new float[magnitudes[b].length];
            for (int k = 0; k < m[b].length; k++) {
                m[b][k] = (float) Math.sqrt(magnitudes[b][k]);
            }
        }
        return new Spectrogram(m, sampleRate, nFft, hopLength);
    }
}
