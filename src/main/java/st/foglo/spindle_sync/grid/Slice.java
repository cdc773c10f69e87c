package st.foglo.spindle_sync.grid;

import st.foglo.spindle_sync.ShapeException;

/**
 * A rectangular window into the grid: time indices [fromX, toX) and
 * frequency indices [fromY, toY). Matrices are indexed [frequency][time].
 */
public final class Slice {

    final Grid grid;

    public final int fromX;
    public final int toX;
    public final int fromY;
    public final int toY;

    Slice(Grid grid, int fromX, int toX, int fromY, int toY) {
        this.grid = grid;
        this.fromX = fromX;
        this.toX = toX;
        this.fromY = fromY;
        this.toY = toY;
    }

    public IndexRange xRange() {
        return new IndexRange(fromX, toX);
    }

    public IndexRange yRange() {
        return new IndexRange(fromY, toY);
    }

    public int width() {
        return toX - fromX;
    }

    public int height() {
        return toY - fromY;
    }

    public Grid getGrid() {
        return grid;
    }

    public double[] sliceX(double[] values) {
        if (values.length != grid.nTime) {
            throw new ShapeException("expected %d time values, got %d", grid.nTime, values.length);
        }
        final double[] result = new double[width()];
        System.arraycopy(values, fromX, result, 0, result.length);
        return result;
    }

    public double[] sliceY(double[] values) {
        if (values.length != grid.nFreq) {
            throw new ShapeException("expected %d frequency values, got %d", grid.nFreq, values.length);
        }
        final double[] result = new double[height()];
        System.arraycopy(values, fromY, result, 0, result.length);
        return result;
    }

    public float[][] sliceMatrix(float[][] m) {
        if (m.length != grid.nFreq) {
            throw new ShapeException("expected %d matrix rows, got %d", grid.nFreq, m.length);
        }
        final float[][] result = new float[height()][];
        for (int r = 0; r < result.length; r++) {
            final float[] row = m[fromY + r];
            if (row.length != grid.nTime) {
                throw new ShapeException("expected %d matrix columns, got %d", grid.nTime, row.length);
            }
            result[r] = new float[width()];
            System.arraycopy(row, fromX, result[r], 0, width());
        }
        return result;
    }

    @Override
    public String toString() {
        return String.format("Slice[x: %s, y: %s]", xRange(), yRange());
    }
}
