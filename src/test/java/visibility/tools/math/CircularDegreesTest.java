package visibility.tools.math;

import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class CircularDegreesTest {

    @Test
    public void normalizeKeepsValuesInRangeUntouched() {
        assertEquals(0.1, CircularDegrees.normalize(0.1), 0);
        assertEquals(359.9, CircularDegrees.normalize(359.9), 0);
        assertEquals(0.0, CircularDegrees.normalize(0.0), 0);
    }

    @Test
    public void normalizeWrapsAnySign() {
        assertEquals(0.0, CircularDegrees.normalize(360), 0);
        assertEquals(350.0, CircularDegrees.normalize(-10), 1e-12);
        assertEquals(10.0, CircularDegrees.normalize(730), 1e-12);
        assertEquals(90.0, CircularDegrees.normalize(-990), 1e-12);
    }

    @Test
    public void normalizeNeverReturnsFullCircle() {
        double tiny = CircularDegrees.normalize(-1e-15);
        assertTrue(tiny >= 0 && tiny < 360);
        assertEquals(0.0, CircularDegrees.normalize(-0.0), 0);
    }

    @Test
    public void forwardSpanCrossesSeam() {
        assertEquals(20.0, CircularDegrees.forwardSpan(350, 10), 1e-12);
        assertEquals(340.0, CircularDegrees.forwardSpan(10, 350), 1e-12);
        assertEquals(0.0, CircularDegrees.forwardSpan(42, 42), 0);
    }

    @Test
    public void separationIsShortestWay() {
        assertEquals(2.0, CircularDegrees.separation(359, 1), 1e-12);
        assertEquals(2.0, CircularDegrees.separation(1, 359), 1e-12);
        assertEquals(180.0, CircularDegrees.separation(0, 180), 1e-12);
    }

    @Test
    public void largestGapWrapsLastToFirst() {
        List<Double> ras = Arrays.asList(359.0, 1.0, 2.0);
        CircularDegrees.Gap gap = CircularDegrees.largestGap(ras);

        assertEquals(2.0, gap.start(), 0);
        assertEquals(359.0, gap.end(), 0);
        assertEquals(357.0, gap.size(), 1e-12);
        assertEquals(3.0, gap.coveredSpan(), 1e-12);
        assertEquals(0.5, gap.coveredCenter(), 1e-12);
    }

    @Test
    public void largestGapWithoutSeamCrossing() {
        CircularDegrees.Gap gap = CircularDegrees.largestGap(Arrays.asList(100.0, 120.0, 110.0));

        // The empty arc runs from 120 around to 100
        assertEquals(120.0, gap.start(), 0);
        assertEquals(100.0, gap.end(), 0);
        assertEquals(340.0, gap.size(), 1e-12);
        assertEquals(110.0, gap.coveredCenter(), 1e-12);
    }

    @Test
    public void largestGapOfSingleValueIsFullCircle() {
        CircularDegrees.Gap gap = CircularDegrees.largestGap(List.of(42.0));
        assertEquals(360.0, gap.size(), 0);
        assertEquals(0.0, gap.coveredSpan(), 0);
        assertEquals(42.0, gap.coveredCenter(), 0);
    }

}
