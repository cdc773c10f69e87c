package st.foglo.spindle_sync.form;

/**
 * A function of time that is valid on the half-open interval [start, end).
 * Either bound may be infinite.
 */
public abstract class BoundedFunction {

    public final double start;
    public final double end;

    protected BoundedFunction(double start, double end) {
        this.start = start;
        this.end = end;
    }

    public boolean contains(double t) {
        return t >= start && t < end;
    }

    public abstract double valueAt(double t);

    /**
     * Straight line through (start, startValue) with the given slope.
     */
    public static final class Ramp extends BoundedFunction {

        final double startValue;
        final double slope;

        public Ramp(double start, double end, double startValue, double slope) {
            super(start, end);
            this.startValue = startValue;
            this.slope = slope;
        }

        @Override
        public double valueAt(double t) {
            return startValue + slope*(t - start);
        }

        @Override
        public String toString() {
            return String.format("Ramp[%f, %f): %f + %f*dt", start, end, startValue, slope);
        }
    }

    public static final class Constant extends BoundedFunction {

        final double value;

        public Constant(double start, double end, double value) {
            super(start, end);
            this.value = value;
        }

        @Override
        public double valueAt(double t) {
            return value;
        }

        @Override
        public String toString() {
            return String.format("Constant[%f, %f): %f", start, end, value);
        }
    }
}
