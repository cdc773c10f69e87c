package st.foglo.spindle_sync.grid;

public final class IndexSliceConfig extends SliceConfig {

    public static final IndexSliceConfig NONE = new IndexSliceConfig(null, null, null, null);

    public final Integer fromX;
    public final Integer toX;
    public final Integer fromY;
    public final Integer toY;

    public IndexSliceConfig(Integer fromX, Integer toX, Integer fromY, Integer toY) {
        checkOrder(fromX, toX, "time index");
        checkOrder(fromY, toY, "frequency index");
        this.fromX = fromX;
        this.toX = toX;
        this.fromY = fromY;
        this.toY = toY;
    }

    public static IndexSliceConfig time(Integer from, Integer to) {
        return new IndexSliceConfig(from, to, null, null);
    }

    public static IndexSliceConfig frequency(Integer from, Integer to) {
        return new IndexSliceConfig(null, null, from, to);
    }

    @Override
    public IndexSliceConfig resolve(Grid grid) {
        return this;
    }

    @Override
    public String toString() {
        return String.format("IndexSliceConfig[x: %s..%s, y: %s..%s]", fromX, toX, fromY, toY);
    }
}
