package st.foglo.spindle_sync.form;

import java.util.List;

/**
 * Produces the pieces of the trajectory between two consecutive anchors
 * (t0, freq0) and (t1, freq1). The pieces cover [t0, t1) without overlap;
 * an interval of zero or negative length gives no pieces.
 */
public interface SegmentBuilder {

    List<BoundedFunction> build(double freq0, double freq1, double t0, double t1);
}
