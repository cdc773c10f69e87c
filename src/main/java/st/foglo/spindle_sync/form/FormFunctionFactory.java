package st.foglo.spindle_sync.form;

import java.util.ArrayList;
import java.util.List;

import st.foglo.spindle_sync.ConfigException;

/**
 * Turns anchors into a trajectory. The first anchor must be (0, 0) and
 * the last one (terminalTime, 0); in between, the segment builder decides
 * the shape between consecutive anchors.
 */
public final class FormFunctionFactory {

    final SegmentBuilder builder;
    final double terminalTime;

    public FormFunctionFactory(SegmentBuilder builder, double terminalTime) {
        if (!(terminalTime > 0) || !Double.isFinite(terminalTime)) {
            throw new ConfigException("terminal time must be positive and finite: %f", terminalTime);
        }
        this.builder = builder;
        this.terminalTime = terminalTime;
    }

    public double getTerminalTime() {
        return terminalTime;
    }

    public FormFunction parametrize(double[] times, double[] freqs) {
        if (times.length != freqs.length) {
            throw new ConfigException("anchor arrays differ in length: %d times, %d frequencies",
                    times.length, freqs.length);
        }
        return parametrize(new ReferencePoints(times, freqs));
    }

    public FormFunction parametrize(ReferencePoints points) {
        validate(points);

        final int n = points.size();
        final List<BoundedFunction> segments = new ArrayList<BoundedFunction>();
        segments.add(new BoundedFunction.Constant(Double.NEGATIVE_INFINITY, points.time(0), 0.0));

        // the padded anchor sequence repeats the first and the last anchor
        for (int j = -1; j < n; j++) {
            final int a = Math.max(j, 0);
            final int b = Math.min(j + 1, n - 1);
            segments.addAll(builder.build(points.frequency(a), points.frequency(b),
                    points.time(a), points.time(b)));
        }

        segments.add(new BoundedFunction.Constant(points.time(n - 1), Double.POSITIVE_INFINITY, 0.0));
        return new FormFunction(segments);
    }

    void validate(ReferencePoints points) {
        final int n = points.size();
        if (n < 2) {
            throw new ConfigException("at least two anchors needed, got: %d", n);
        }
        for (int i = 0; i < n; i++) {
            if (!Double.isFinite(points.time(i)) || !Double.isFinite(points.frequency(i))) {
                throw new ConfigException("anchor %d is not finite: %s", i, points);
            }
            if (points.frequency(i) < 0) {
                throw new ConfigException("anchor %d has negative frequency: %f", i, points.frequency(i));
            }
            if (i > 0 && points.time(i) < points.time(i - 1)) {
                throw new ConfigException("anchor times decrease at %d: %f < %f",
                        i, points.time(i), points.time(i - 1));
            }
        }
        if (points.time(0) != 0.0) {
            throw new ConfigException("first anchor must be at time 0, got: %f", points.time(0));
        }
        if (points.time(n - 1) != terminalTime) {
            throw new ConfigException("last anchor must be at time %f, got: %f", terminalTime, points.time(n - 1));
        }
        if (points.frequency(0) != 0.0 || points.frequency(n - 1) != 0.0) {
            throw new ConfigException("first and last anchor must have frequency 0: %s", points);
        }
    }
}
