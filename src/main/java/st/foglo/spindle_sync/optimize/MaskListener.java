package st.foglo.spindle_sync.optimize;

import st.foglo.spindle_sync.grid.Slice;

/**
 * Receives every corridor mask the optimizer evaluates.
 */
public interface MaskListener {

    void maskEvaluated(Slice slice, boolean[][] mask);
}
