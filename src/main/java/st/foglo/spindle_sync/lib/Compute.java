package st.foglo.spindle_sync.lib;

public final class Compute {

    public static final double TWO_PI = 2*Math.PI;

    private Compute() {
    }

    public static double dMax(double a, double b) {
        return a > b ? a : b;
    }

    public static double dMin(double a, double b) {
        return a < b ? a : b;
    }

    public static int iMax(int a, int b) {
        return a > b ? a : b;
    }

    public static int iMin(int a, int b) {
        return a < b ? a : b;
    }

    public static int iClamp(int k, int lo, int hi) {
        return k < lo ? lo : k > hi ? hi : k;
    }

    public static boolean isPowerOfTwo(int n) {
        return n > 0 && (n & (n - 1)) == 0;
    }

    /**
     * Evenly spaced values from a to b, both included. A single value
     * is a.
     */
    public static double[] linspace(double a, double b, int n) {
        final double[] result = new double[n];
        if (n == 1) {
            result[0] = a;
            return result;
        }
        final double step = (b - a)/(n - 1);
        for (int k = 0; k < n; k++) {
            result[k] = a + k*step;
        }
        if (n > 1) {
            result[n-1] = b;
        }
        return result;
    }

    /**
     * Number of candidates for a search over an interval of the given
     * width: one per grid cell times the resolution, at least one.
     */
    public static int nofCandidates(double width, double cellSize, double resolution) {
        return iMax(1, (int) Math.round(width/cellSize*resolution));
    }

    /**
     * Linear interpolation of y at fractional position x, where y is
     * sampled at 0, 1, ..., n-1. Positions beyond n-1 give the last value.
     */
    public static double interpolate(double[] y, double x) {
        final int n = y.length;
        if (x <= 0) {
            return y[0];
        }
        else if (x >= n - 1) {
            return y[n-1];
        }
        final int k = (int) Math.floor(x);
        final double frac = x - k;
        return y[k] + frac*(y[k+1] - y[k]);
    }

    public static double sum(float[][] m, boolean[][] mask) {
        double result = 0.0;
        for (int r = 0; r < mask.length; r++) {
            final boolean[] maskRow = mask[r];
            final float[] row = m[r];
            for (int c = 0; c < maskRow.length; c++) {
                if (maskRow[c]) {
                    result += row[c];
                }
            }
        }
        return result;
    }

    public static double squared(double x) {
        return x*x;
    }
}
