package st.foglo.spindle_sync.spectrum;

import st.foglo.spindle_sync.ConfigException;
import st.foglo.spindle_sync.SyncLib.Debug;
import st.foglo.spindle_sync.lib.Compute;

/**
 * Short-time Fourier transform magnitude. Frames are centred: the signal
 * is padded with nFft/2 zeros at each end, so that frame k is centred on
 * sample k*hopLength. The Hann window of winLength samples sits in the
 * middle of the nFft samples of each frame.
 */
public final class Stft {

    final int nFft;
    final int winLength;
    final int hopLength;
    final double[] window;
    final Fft fft;

    public Stft(int nFft, int winLength, int hopLength) {
        if (!Compute.isPowerOfTwo(nFft)) {
            throw new ConfigException("FFT size must be a power of two: %d", nFft);
        }
        if (winLength < 1 || winLength > nFft) {
            throw new ConfigException("window length must be in [1, %d]: %d", nFft, winLength);
        }
        if (hopLength < 1) {
            throw new ConfigException("hop length must be positive: %d", hopLength);
        }
        this.nFft = nFft;
        this.winLength = winLength;
        this.hopLength = hopLength;
        this.fft = new Fft(nFft);

        // periodic Hann window, centred
        this.window = new double[nFft];
        final int offset = (nFft - winLength)/2;
        for (int i = 0; i < winLength; i++) {
            window[offset + i] = 0.5 - 0.5*Math.cos(Compute.TWO_PI*i/winLength);
        }
    }

    public int nofFrames(int signalLength) {
        return signalLength/hopLength + 1;
    }

    public int nofBins() {
        return nFft/2 + 1;
    }

    /**
     * @return magnitudes indexed [bin][frame]
     */
    public float[][] magnitude(float[] signal) {
        final int nFrames = nofFrames(signal.length);
        final int nBins = nofBins();
        new Debug("stft: %d frames, %d bins", nFrames, nBins);

        final float[][] result = new float[nBins][nFrames];
        final double[] re = new double[nFft];
        final double[] im = new double[nFft];
        final int pad = nFft/2;
        for (int k = 0; k < nFrames; k++) {
            final int start = k*hopLength - pad;
            for (int i = 0; i < nFft; i++) {
                final int q = start + i;
                re[i] = q >= 0 && q < signal.length ? signal[q]*window[i] : 0.0;
                im[i] = 0.0;
            }
            fft.transform(re, im);
            for (int b = 0; b < nBins; b++) {
                result[b][k] = (float) Math.sqrt(re[b]*re[b] + im[b]*im[b]);
            }
        }
        return result;
    }
}
