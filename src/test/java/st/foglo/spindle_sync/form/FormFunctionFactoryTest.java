package st.foglo.spindle_sync.form;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import st.foglo.spindle_sync.ConfigException;

class FormFunctionFactoryTest {

    private final FormFunctionFactory factory =
            new FormFunctionFactory(BendedSegmentBuilder.symmetric(50.0), 20.0);

    private final FormFunction f = factory.parametrize(
            new double[]{0.0, 5.0, 10.0, 20.0},
            new double[]{0.0, 100.0, 100.0, 0.0});

    @ParameterizedTest
    @CsvSource({
        "-1.0, 0.0",
        "0.0, 0.0",
        "1.0, 50.0",
        "2.0, 100.0",
        "2.5, 100.0",
        "5.0, 100.0",
        "7.0, 100.0",
        "10.0, 100.0",
        "11.0, 50.0",
        "12.0, 0.0",
        "19.999, 0.0",
        "20.0, 0.0",
        "25.0, 0.0"
    })
    void bendedTrajectory(double t, double expected) {
        assertThat(f.valueAt(t)).isCloseTo(expected, within(1e-9));
    }

    @Test
    void interiorAnchorTimesGiveTheAnchorFrequency() {
        final FormFunction g = new FormFunctionFactory(new LinearSegmentBuilder(), 9.0).parametrize(
                new double[]{0.0, 2.0, 4.5, 7.0, 9.0},
                new double[]{0.0, 300.0, 120.0, 80.0, 0.0});
        assertThat(g.valueAt(2.0)).isCloseTo(300.0, within(1e-9));
        assertThat(g.valueAt(4.5)).isCloseTo(120.0, within(1e-9));
        assertThat(g.valueAt(7.0)).isCloseTo(80.0, within(1e-9));
    }

    @Test
    void segmentsAreExclusiveAndExhaustive() {
        for (double t = -3.0; t < 25.0; t += 0.01) {
            int count = 0;
            for (BoundedFunction b : f.getSegments()) {
                if (b.contains(t)) {
                    count++;
                }
            }
            assertThat(count).as("segments containing %f", t).isEqualTo(1);
        }
    }

    @Test
    void applyEvaluatesEachSample() {
        assertThat(f.apply(new double[]{1.0, 7.0, 11.0})).containsExactly(50.0, 100.0, 50.0);
    }

    @Test
    void rejectsMismatchedArrays() {
        assertThatThrownBy(() -> factory.parametrize(new double[]{0.0, 20.0}, new double[]{0.0, 0.0, 0.0}))
                .isInstanceOf(ConfigException.class);
    }

    @Test
    void rejectsBadSentinels() {
        assertThatThrownBy(() -> factory.parametrize(new double[]{1.0, 20.0}, new double[]{0.0, 0.0}))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("time 0");
        assertThatThrownBy(() -> factory.parametrize(new double[]{0.0, 19.0}, new double[]{0.0, 0.0}))
                .isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> factory.parametrize(new double[]{0.0, 5.0, 20.0}, new double[]{10.0, 5.0, 0.0}))
                .isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> factory.parametrize(new double[]{0.0, 5.0, 20.0}, new double[]{0.0, 5.0, 1.0}))
                .isInstanceOf(ConfigException.class);
    }

    @Test
    void rejectsTooFewAnchors() {
        assertThatThrownBy(() -> factory.parametrize(new double[]{0.0}, new double[]{0.0}))
                .isInstanceOf(ConfigException.class);
    }

    @Test
    void rejectsDecreasingTimesAndNegativeFrequencies() {
        assertThatThrownBy(() -> factory.parametrize(new double[]{0.0, 8.0, 6.0, 20.0},
                new double[]{0.0, 5.0, 5.0, 0.0}))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("decrease");
        assertThatThrownBy(() -> factory.parametrize(new double[]{0.0, 8.0, 20.0},
                new double[]{0.0, -5.0, 0.0}))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("negative");
    }

    @Test
    void coincidingAnchorsAreAccepted() {
        final FormFunction g = factory.parametrize(new double[]{0.0, 5.0, 5.0, 20.0},
                new double[]{0.0, 100.0, 200.0, 0.0});
        assertThat(g.valueAt(5.0)).isCloseTo(200.0, within(1e-9));
    }
}
