package st.foglo.spindle_sync.form;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

import st.foglo.spindle_sync.ConfigException;

class ReferencePointsTest {

    private final double[] times = {0.0, 1.0, 2.0, 3.0};
    private final double[] freqs = {0.0, 100.0, 200.0, 0.0};

    @Test
    void arraysAreCopied() {
        final ReferencePoints p = new ReferencePoints(times, freqs);
        times[1] = 99.0;
        p.getFreqs()[1] = 99.0;
        assertThat(p.time(1)).isEqualTo(1.0);
        assertThat(p.frequency(1)).isEqualTo(100.0);
    }

    @Test
    void withMethodsLeaveTheOriginalUntouched() {
        final ReferencePoints p = new ReferencePoints(times, freqs);
        final ReferencePoints q = p.withTime(2, 2.5).withFrequency(1, 150.0);
        assertThat(p.getTimes()).containsExactly(0.0, 1.0, 2.0, 3.0);
        assertThat(p.getFreqs()).containsExactly(0.0, 100.0, 200.0, 0.0);
        assertThat(q.getTimes()).containsExactly(0.0, 1.0, 2.5, 3.0);
        assertThat(q.getFreqs()).containsExactly(0.0, 150.0, 200.0, 0.0);
    }

    @Test
    void shiftedMovesInteriorTimesOnly() {
        final ReferencePoints q = new ReferencePoints(times, freqs).shifted(0.5);
        assertThat(q.getTimes()).containsExactly(0.0, 1.5, 2.5, 3.0);
        assertThat(q.getFreqs()).containsExactly(freqs);
    }

    @Test
    void equalityIsByValue() {
        assertThat(new ReferencePoints(times, freqs)).isEqualTo(new ReferencePoints(times.clone(), freqs.clone()));
        assertThat(new ReferencePoints(times, freqs).hashCode())
                .isEqualTo(new ReferencePoints(times.clone(), freqs.clone()).hashCode());
        assertThat(new ReferencePoints(times, freqs)).isNotEqualTo(new ReferencePoints(times, freqs).withTime(1, 1.1));
    }

    @Test
    void rejectsMismatchedLengths() {
        assertThatThrownBy(() -> new ReferencePoints(new double[3], new double[2]))
                .isInstanceOf(ConfigException.class);
    }
}
