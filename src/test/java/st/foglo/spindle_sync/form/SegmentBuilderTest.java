package st.foglo.spindle_sync.form;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.List;

import org.junit.jupiter.api.Test;

import st.foglo.spindle_sync.ConfigException;

class SegmentBuilderTest {

    @Test
    void linearRampsBetweenTheEndpoints() {
        final List<BoundedFunction> s = new LinearSegmentBuilder().build(100.0, 200.0, 1.0, 3.0);
        assertThat(s).hasSize(1);
        assertThat(s.get(0).start).isEqualTo(1.0);
        assertThat(s.get(0).end).isEqualTo(3.0);
        assertThat(s.get(0).valueAt(1.0)).isEqualTo(100.0);
        assertThat(s.get(0).valueAt(2.0)).isCloseTo(150.0, within(1e-9));
    }

    @Test
    void plateauHoldsTheTargetFrequency() {
        final List<BoundedFunction> s = new PlateauSegmentBuilder().build(100.0, 200.0, 1.0, 3.0);
        assertThat(s).hasSize(1);
        assertThat(s.get(0).valueAt(1.0)).isEqualTo(200.0);
        assertThat(s.get(0).contains(3.0)).isFalse();
    }

    @Test
    void zeroDurationGivesNoSegments() {
        assertThat(new LinearSegmentBuilder().build(0.0, 100.0, 2.0, 2.0)).isEmpty();
        assertThat(new PlateauSegmentBuilder().build(0.0, 100.0, 2.0, 2.0)).isEmpty();
        assertThat(BendedSegmentBuilder.symmetric(50.0).build(0.0, 100.0, 2.0, 2.0)).isEmpty();
        assertThat(BendedSegmentBuilder.symmetric(50.0).build(100.0, 100.0, 2.0, 1.0)).isEmpty();
    }

    @Test
    void bendedRampsThenHolds() {
        final List<BoundedFunction> s = BendedSegmentBuilder.symmetric(50.0).build(0.0, 100.0, 0.0, 5.0);
        assertThat(s).hasSize(2);
        assertThat(s.get(0)).isInstanceOf(BoundedFunction.Ramp.class);
        assertThat(s.get(0).end).isEqualTo(2.0);
        assertThat(s.get(0).valueAt(1.0)).isEqualTo(50.0);
        assertThat(s.get(1)).isInstanceOf(BoundedFunction.Constant.class);
        assertThat(s.get(1).start).isEqualTo(2.0);
        assertThat(s.get(1).end).isEqualTo(5.0);
        assertThat(s.get(1).valueAt(4.0)).isEqualTo(100.0);
    }

    @Test
    void bendedUsesTheRampDownSlopeWhenFalling() {
        final List<BoundedFunction> s = new BendedSegmentBuilder(500.0, -20.0).build(100.0, 0.0, 10.0, 20.0);
        assertThat(s).hasSize(2);
        assertThat(s.get(0).end).isEqualTo(15.0);
        assertThat(s.get(0).valueAt(12.5)).isEqualTo(50.0);
        assertThat(s.get(1).valueAt(16.0)).isEqualTo(0.0);
    }

    @Test
    void bendedRampIsCutOffAtTheEndOfTheInterval() {
        final List<BoundedFunction> s = BendedSegmentBuilder.symmetric(10.0).build(0.0, 100.0, 0.0, 4.0);
        assertThat(s).hasSize(1);
        assertThat(s.get(0).end).isEqualTo(4.0);
        assertThat(s.get(0).valueAt(3.0)).isEqualTo(30.0);
    }

    @Test
    void bendedWithEqualFrequenciesIsAPlateau() {
        final BoundedFunction bended = BendedSegmentBuilder.symmetric(50.0).build(70.0, 70.0, 1.0, 3.0).get(0);
        final BoundedFunction plateau = new PlateauSegmentBuilder().build(70.0, 70.0, 1.0, 3.0).get(0);
        assertThat(bended).isInstanceOf(BoundedFunction.Constant.class);
        assertThat(bended.start).isEqualTo(plateau.start);
        assertThat(bended.end).isEqualTo(plateau.end);
        assertThat(bended.valueAt(2.0)).isEqualTo(plateau.valueAt(2.0));
    }

    @Test
    void bendedWithZeroSlopeIsAPlateau() {
        final List<BoundedFunction> s = new BendedSegmentBuilder(0.0, -10.0).build(0.0, 100.0, 0.0, 5.0);
        assertThat(s).hasSize(1);
        assertThat(s.get(0).valueAt(0.0)).isEqualTo(100.0);
    }

    @Test
    void bendedRejectsWrongSignedSlopes() {
        assertThatThrownBy(() -> new BendedSegmentBuilder(-1.0, -1.0)).isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> new BendedSegmentBuilder(1.0, 1.0)).isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> BendedSegmentBuilder.symmetric(-5.0)).isInstanceOf(ConfigException.class);
    }
}
