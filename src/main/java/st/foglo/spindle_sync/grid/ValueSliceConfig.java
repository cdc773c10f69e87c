package st.foglo.spindle_sync.grid;

/**
 * Bounds given in seconds (x) and Hz (y).
 */
public final class ValueSliceConfig extends SliceConfig {

    public final Double fromX;
    public final Double toX;
    public final Double fromY;
    public final Double toY;

    public ValueSliceConfig(Double fromX, Double toX, Double fromY, Double toY) {
        checkOrder(fromX, toX, "time");
        checkOrder(fromY, toY, "frequency");
        this.fromX = fromX;
        this.toX = toX;
        this.fromY = fromY;
        this.toY = toY;
    }

    public static ValueSliceConfig time(Double from, Double to) {
        return new ValueSliceConfig(from, to, null, null);
    }

    public static ValueSliceConfig frequency(Double from, Double to) {
        return new ValueSliceConfig(null, null, from, to);
    }

    /**
     * Values are converted to clipped indices. Bounds that fall into the
     * same cell give an empty range and are rejected.
     */
    @Override
    public IndexSliceConfig resolve(Grid grid) {
        return new IndexSliceConfig(
                index(fromX, grid.timeMax, grid.nTime),
                index(toX, grid.timeMax, grid.nTime),
                index(fromY, grid.freqMax, grid.nFreq),
                index(toY, grid.freqMax, grid.nFreq));
    }

    private static Integer index(Double value, double axisMax, int axisCount) {
        return value == null ? null : Integer.valueOf(Grid.toIndex(value.doubleValue(), axisMax, axisCount));
    }

    @Override
    public String toString() {
        return String.format("ValueSliceConfig[x: %s..%s, y: %s..%s]", fromX, toX, fromY, toY);
    }
}
