package st.foglo.spindle_sync.mask;

/**
 * Shifts index curves along the time axis. Vacated positions take the
 * value at the nearest edge; nothing wraps around.
 */
final class TimeShifter {

    private TimeShifter() {
    }

    /**
     * Delays the curve by s positions.
     */
    static int[] right(int[] curve, int s) {
        final int n = curve.length;
        final int[] result = new int[n];
        for (int k = 0; k < n; k++) {
            result[k] = curve[k - s < 0 ? 0 : k - s];
        }
        return result;
    }

    /**
     * Advances the curve by s positions.
     */
    static int[] left(int[] curve, int s) {
        final int n = curve.length;
        final int[] result = new int[n];
        for (int k = 0; k < n; k++) {
            result[k] = curve[k + s > n - 1 ? n - 1 : k + s];
        }
        return result;
    }
}
