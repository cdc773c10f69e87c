package st.foglo.spindle_sync.form;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A piecewise defined trajectory. Where no piece applies the value is 0.
 */
public final class FormFunction {

    private final List<BoundedFunction> segments;

    FormFunction(List<BoundedFunction> segments) {
        this.segments = Collections.unmodifiableList(new ArrayList<BoundedFunction>(segments));
    }

    public List<BoundedFunction> getSegments() {
        return segments;
    }

    public double valueAt(double t) {
        for (BoundedFunction f : segments) {
            if (f.contains(t)) {
                return f.valueAt(t);
            }
        }
        return 0.0;
    }

    public double[] apply(double[] t) {
        final double[] result = new double[t.length];
        for (int k = 0; k < t.length; k++) {
            result[k] = valueAt(t[k]);
        }
        return result;
    }
}
