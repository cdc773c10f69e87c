package st.foglo.spindle_sync.spectrum;

import st.foglo.spindle_sync.ConfigException;
import st.foglo.spindle_sync.lib.Compute;

/**
 * Iterative radix-2 complex FFT of a fixed size. Twiddle factors are
 * computed once per instance.
 */
public final class Fft {

    final int size;
    final double[] sines;
    final double[] coses;

    public Fft(int size) {
        if (!Compute.isPowerOfTwo(size)) {
            throw new ConfigException("FFT size must be a power of two: %d", size);
        }
        this.size = size;
        this.sines = new double[size/2];
        this.coses = new double[size/2];
        for (int j = 0; j < size/2; j++) {
            final double angle = -Compute.TWO_PI*j/size;
            sines[j] = Math.sin(angle);
            coses[j] = Math.cos(angle);
        }
    }

    public int getSize() {
        return size;
    }

    /**
     * Forward transform, in place.
     */
    public void transform(double[] re, double[] im) {
        if (re.length != size || im.length != size) {
            throw new ConfigException("expected arrays of length %d, got %d and %d", size, re.length, im.length);
        }

        // bit reversal
        for (int i = 1, j = 0; i < size; i++) {
            int bit = size >> 1;
            for (; (j & bit) != 0; bit >>= 1) {
                j ^= bit;
            }
            j ^= bit;
            if (i < j) {
                double t = re[i];
                re[i] = re[j];
                re[j] = t;
                t = im[i];
                im[i] = im[j];
                im[j] = t;
            }
        }

        for (int len = 2; len <= size; len <<= 1) {
            final int half = len/2;
            final int stride = size/len;
            for (int i = 0; i < size; i += len) {
                for (int k = 0; k < half; k++) {
                    final double wr = coses[k*stride];
                    final double wi = sines[k*stride];
                    final int a = i + k;
                    final int b = a + half;
                    final double tr = wr*re[b] - wi*im[b];
                    final double ti = wr*im[b] + wi*re[b];
                    re[b] = re[a] - tr;
                    im[b] = im[a] - ti;
                    re[a] += tr;
                    im[a] += ti;
                }
            }
        }
    }
}
