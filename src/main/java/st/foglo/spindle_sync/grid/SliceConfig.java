package st.foglo.spindle_sync.grid;

import st.foglo.spindle_sync.ConfigException;

/**
 * Optional bounds on the time axis (x) and the frequency axis (y). An
 * unset bound is null. Bounds are either grid indices or physical values,
 * see the two subclasses.
 */
public abstract class SliceConfig {

    /**
     * The equivalent index based config on the given grid.
     */
    public abstract IndexSliceConfig resolve(Grid grid);

    static <T extends Comparable<T>> void checkOrder(T from, T to, String axis) {
        if (from != null && to != null && from.compareTo(to) >= 0) {
            throw new ConfigException("empty %s range: from %s, to %s", axis, from, to);
        }
    }
}
