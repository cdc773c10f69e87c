package st.foglo.spindle_sync.form;

import java.util.ArrayList;
import java.util.List;

/**
 * Straight line from freq0 at t0 towards freq1 at t1.
 */
public final class LinearSegmentBuilder implements SegmentBuilder {

    @Override
    public List<BoundedFunction> build(double freq0, double freq1, double t0, double t1) {
        final List<BoundedFunction> result = new ArrayList<BoundedFunction>();
        if (t1 > t0) {
            result.add(new BoundedFunction.Ramp(t0, t1, freq0, (freq1 - freq0)/(t1 - t0)));
        }
        return result;
    }
}
