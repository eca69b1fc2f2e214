package visibility.tools.math;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Wraparound-aware helpers for angles living on the [0, 360) circle, such as azimuths and right ascensions.
 **/
public class CircularDegrees {

    public static final double FULL_CIRCLE = 360.0;

    private CircularDegrees() {

    }

    /**
     * Reduces any real angle into [0, 360)
     *
     * @param degrees the angle, of any sign or magnitude
     * @return the equivalent angle in [0, 360)
     **/
    public static double normalize(double degrees) {
        // Values already in range come back untouched
        double reduced = degrees % FULL_CIRCLE;
        if (reduced < 0) {
            reduced += FULL_CIRCLE;
            if (reduced >= FULL_CIRCLE) {
                reduced = 0;
            }
        }
        return reduced + 0.0;
    }

    /**
     * Angle swept going eastward (increasing) from one value to another
     *
     * @param from starting angle in degrees
     * @param to   ending angle in degrees
     * @return the forward span in [0, 360)
     **/
    public static double forwardSpan(double from, double to) {
        return normalize(to - from);
    }

    /**
     * Shortest angular separation between two values on the circle
     *
     * @return the separation in [0, 180]
     **/
    public static double separation(double a, double b) {
        double forward = forwardSpan(a, b);
        return Math.min(forward, FULL_CIRCLE - forward);
    }

    /**
     * Finds the largest empty arc between a set of angles. Values are normalized and sorted first; the gap between
     * the last and the first value wraps through 0.
     *
     * @param values the angles in degrees, at least one
     * @return the largest gap, starting at the value before it and ending at the value after it
     **/
    public static Gap largestGap(List<Double> values) {

        List<Double> sorted = new ArrayList<>(values.size());
        values.forEach(value -> sorted.add(normalize(value)));
        Collections.sort(sorted);

        double maxGap = 0;
        double gapStart = sorted.get(0);
        double gapEnd = sorted.get(0);

        for (int i = 0; i < sorted.size(); i++) {
            int next = (i + 1) % sorted.size();
            double gap = sorted.get(next) - sorted.get(i);
            if (next == 0) {
                gap = FULL_CIRCLE + gap;
            }
            if (gap > maxGap) {
                maxGap = gap;
                gapStart = sorted.get(i);
                gapEnd = sorted.get(next);
            }
        }

        return new Gap(gapStart, gapEnd, maxGap);
    }

    public record Gap(double start, double end, double size) {

        /**
         * The arc covered by the values, i.e. the complement of this gap
         **/
        public double coveredSpan() {
            return FULL_CIRCLE - size;
        }

        /**
         * Midpoint of the covered arc, which runs from the end of the gap forward to its start
         **/
        public double coveredCenter() {
            return normalize(end + coveredSpan() / 2);
        }
    }

}
