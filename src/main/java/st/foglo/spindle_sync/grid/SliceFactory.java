package st.foglo.spindle_sync.grid;

import st.foglo.spindle_sync.ConfigException;
import st.foglo.spindle_sync.lib.Compute;

/**
 * Builds slices that respect a global restriction. Each slice is the
 * intersection of the global config and a local one.
 */
public final class SliceFactory {

    final Grid grid;
    final SliceConfig global;

    public SliceFactory(Grid grid) {
        this(grid, null);
    }

    public SliceFactory(Grid grid, SliceConfig global) {
        this.grid = grid;
        this.global = global == null ? IndexSliceConfig.NONE : global;
    }

    public Grid getGrid() {
        return grid;
    }

    public Slice build() {
        return build(IndexSliceConfig.NONE);
    }

    public Slice build(SliceConfig local) {
        final IndexSliceConfig g = global.resolve(grid);
        final IndexSliceConfig l = (local == null ? IndexSliceConfig.NONE : local).resolve(grid);

        final int fromX = Compute.iMax(orElse(g.fromX, 0), orElse(l.fromX, 0));
        final int toX = Compute.iMin(orElse(g.toX, grid.nTime), orElse(l.toX, grid.nTime));
        final int fromY = Compute.iMax(orElse(g.fromY, 0), orElse(l.fromY, 0));
        final int toY = Compute.iMin(orElse(g.toY, grid.nFreq), orElse(l.toY, grid.nFreq));

        if (fromX >= toX) {
            throw new ConfigException("empty time slice: [%d, %d)", fromX, toX);
        }
        if (fromY >= toY) {
            throw new ConfigException("empty frequency slice: [%d, %d)", fromY, toY);
        }
        return new Slice(grid, fromX, toX, fromY, toY);
    }

    private static int orElse(Integer value, int dflt) {
        return value == null ? dflt : value.intValue();
    }
}
