package st.foglo.spindle_sync.form;

import java.util.ArrayList;
import java.util.List;

/**
 * Holds freq1 across the whole interval.
 */
public final class PlateauSegmentBuilder implements SegmentBuilder {

    @Override
    public List<BoundedFunction> build(double freq0, double freq1, double t0, double t1) {
        final List<BoundedFunction> result = new ArrayList<BoundedFunction>();
        if (t1 > t0) {
            result.add(new BoundedFunction.Constant(t0, t1, freq1));
        }
        return result;
    }
}
