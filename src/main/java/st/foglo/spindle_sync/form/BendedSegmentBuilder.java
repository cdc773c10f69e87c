package st.foglo.spindle_sync.form;

import java.util.ArrayList;
import java.util.List;

import st.foglo.spindle_sync.ConfigException;

/**
 * Models a spindle that accelerates or decelerates at a fixed rate. From
 * t0 the frequency ramps from freq0 with the ramp-up or ramp-down slope
 * until it reaches freq1, then stays there until t1. If t1 comes first
 * the ramp is cut off at t1.
 */
public final class BendedSegmentBuilder implements SegmentBuilder {

    /**
     * Hz/s, not negative
     */
    final double rampUpSlope;

    /**
     * Hz/s, not positive
     */
    final double rampDownSlope;

    private final PlateauSegmentBuilder plateau = new PlateauSegmentBuilder();

    public BendedSegmentBuilder(double rampUpSlope, double rampDownSlope) {
        if (!(rampUpSlope >= 0) || !Double.isFinite(rampUpSlope)) {
            throw new ConfigException("ramp-up slope must be finite and >= 0: %f", rampUpSlope);
        }
        if (!(rampDownSlope <= 0) || !Double.isFinite(rampDownSlope)) {
            throw new ConfigException("ramp-down slope must be finite and <= 0: %f", rampDownSlope);
        }
        this.rampUpSlope = rampUpSlope;
        this.rampDownSlope = rampDownSlope;
    }

    public static BendedSegmentBuilder symmetric(double slope) {
        return new BendedSegmentBuilder(slope, -slope);
    }

    @Override
    public List<BoundedFunction> build(double freq0, double freq1, double t0, double t1) {
        final double slope = freq1 > freq0 ? rampUpSlope : freq1 < freq0 ? rampDownSlope : 0.0;
        if (slope == 0.0) {
            return plateau.build(freq0, freq1, t0, t1);
        }

        final List<BoundedFunction> result = new ArrayList<BoundedFunction>();
        if (!(t1 > t0)) {
            return result;
        }

        final double tMid = t0 + (freq1 - freq0)/slope;
        final double rampEnd = Math.min(tMid, t1);
        if (rampEnd > t0) {
            result.add(new BoundedFunction.Ramp(t0, rampEnd, freq0, slope));
        }
        if (tMid < t1) {
            result.add(new BoundedFunction.Constant(tMid, t1, freq1));
        }
        return result;
    }
}
