package st.foglo.spindle_sync.optimize;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.Mockito;
import org.mockito.junit.jupiter.MockitoExtension;

import st.foglo.spindle_sync.ConfigException;
import st.foglo.spindle_sync.form.ReferencePoints;

@ExtendWith(MockitoExtension.class)
class RefinementTest {

    @Mock
    private RefPointOptimizer optimizer;

    private final ReferencePoints nominal = new ReferencePoints(
            new double[]{0.0, 1.0, 2.0, 3.0},
            new double[]{0.0, 20.0, 0.0, 0.0});

    @BeforeEach
    void passThrough() {
        when(optimizer.optimizeAllTimes(any(ReferencePoints.class), anyDouble()))
                .thenAnswer(inv -> inv.getArgument(0));
        Mockito.lenient().when(optimizer.optimizeFrequency(any(ReferencePoints.class), anyInt(),
                anyDouble(), anyDouble(), anyDouble()))
                .thenAnswer(inv -> inv.getArgument(0));
        Mockito.lenient().when(optimizer.optimizeTime(any(ReferencePoints.class), anyInt(),
                anyDouble(), anyDouble(), anyDouble()))
                .thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void passesRunInOrder() {
        final ReferencePoints result = new Refinement(optimizer).run(nominal);

        assertThat(result).isEqualTo(nominal);
        final InOrder inOrder = Mockito.inOrder(optimizer);
        inOrder.verify(optimizer).optimizeAllTimes(nominal, 0.2);
        inOrder.verify(optimizer).optimizeFrequency(nominal, 1, 0.0, 50.0, 1.0);
        inOrder.verify(optimizer).optimizeTime(nominal, 1, 0.5, 1.5, 1.0);
        inOrder.verify(optimizer).optimizeTime(nominal, 2, 1.5, 2.5, 1.0);
    }

    @Test
    void anchorsWithoutFrequencyAreNotTuned() {
        new Refinement(optimizer).run(nominal);
        verify(optimizer, never()).optimizeFrequency(any(ReferencePoints.class), eq(2),
                anyDouble(), anyDouble(), anyDouble());
    }

    @Test
    void resolutionsAndSearchWidthAreConfigurable() {
        new Refinement(optimizer, 0.5, 2.0, 3.0, 10.0).run(nominal);
        verify(optimizer).optimizeAllTimes(nominal, 0.5);
        verify(optimizer).optimizeFrequency(nominal, 1, 10.0, 30.0, 2.0);
        verify(optimizer).optimizeTime(nominal, 1, 0.5, 1.5, 3.0);
    }

    @Test
    void anchorsBetweenCoincidingNeighboursAreSkipped() {
        final ReferencePoints p = new ReferencePoints(
                new double[]{0.0, 1.0, 1.0, 1.0, 3.0},
                new double[]{0.0, 0.0, 0.0, 0.0, 0.0});
        new Refinement(optimizer).run(p);
        verify(optimizer, never()).optimizeTime(any(ReferencePoints.class), eq(2),
                anyDouble(), anyDouble(), anyDouble());
        verify(optimizer).optimizeTime(p, 1, 0.5, 1.0, 1.0);
        verify(optimizer).optimizeTime(p, 3, 1.0, 2.0, 1.0);
    }

    @Test
    void errorsPropagate() {
        when(optimizer.optimizeTime(any(ReferencePoints.class), eq(2), anyDouble(), anyDouble(), anyDouble()))
                .thenThrow(new ConfigException("empty time slice"));
        assertThatThrownBy(() -> new Refinement(optimizer).run(nominal))
                .isInstanceOf(ConfigException.class)
                .hasMessage("empty time slice");
    }
}
