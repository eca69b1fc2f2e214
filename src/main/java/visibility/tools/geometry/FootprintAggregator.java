package visibility.tools.geometry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import visibility.tools.math.CircularDegrees;

import java.util.List;

/**
 * Computes a sky map view that contains a set of footprints
 **/
public class FootprintAggregator {

    private static final Logger log = LoggerFactory.getLogger(FootprintAggregator.class);

    static final double PADDING_FACTOR = 1.5;
    static final double MIN_FIELD_OF_VIEW = 1.0;
    static final double MAX_FIELD_OF_VIEW = 180.0;

    private FootprintAggregator() {

    }

    /**
     * Bounding view over footprints.
     * <ul>
     * <li>No footprints: the whole sky.</li>
     * <li>One footprint: centered on it, twice its larger side.</li>
     * <li>Several: a box padded by each footprint's half diagonal. When the naive right ascension span exceeds 180°
     * the footprints straddle the 0°/360° seam, and the view covers the complement of the largest empty arc between
     * centers instead.</li>
     * </ul>
     *
     * @param footprints the footprints to include
     * @return the view
     **/
    public static ViewBounds boundingView(List<ImageFootprint> footprints) {

        if (footprints.isEmpty()) {
            return ViewBounds.WHOLE_SKY;
        }

        if (footprints.size() == 1) {
            ImageFootprint fp = footprints.get(0);
            return new ViewBounds(fp.getCenterRa(), fp.getCenterDec(), 2 * Math.max(fp.getWidthDeg(), fp.getHeightDeg()));
        }

        double minRa = Double.POSITIVE_INFINITY;
        double maxRa = Double.NEGATIVE_INFINITY;
        double minDec = Double.POSITIVE_INFINITY;
        double maxDec = Double.NEGATIVE_INFINITY;

        for (ImageFootprint fp : footprints) {
            double halfDiagonal = fp.getHalfDiagonal();
            minRa = Math.min(minRa, fp.getCenterRa() - halfDiagonal);
            maxRa = Math.max(maxRa, fp.getCenterRa() + halfDiagonal);
            minDec = Math.min(minDec, fp.getCenterDec() - halfDiagonal);
            maxDec = Math.max(maxDec, fp.getCenterDec() + halfDiagonal);
        }

        minDec = Math.max(-90, minDec);
        maxDec = Math.min(90, maxDec);

        double raSpan = maxRa - minRa;
        double centerRa;

        if (raSpan > 180) {
            CircularDegrees.Gap gap = CircularDegrees.largestGap(footprints.stream().map(ImageFootprint::getCenterRa).toList());
            centerRa = gap.coveredCenter();
            raSpan = gap.coveredSpan();
            log.debug("Footprints straddle RA 0, largest gap {} -> {} ({} deg)", gap.start(), gap.end(), gap.size());
        } else {
            centerRa = (minRa + maxRa) / 2;
        }

        double decSpan = maxDec - minDec;
        double centerDec = (minDec + maxDec) / 2;
        double fov = Math.max(raSpan, decSpan) * PADDING_FACTOR;

        return new ViewBounds(centerRa, centerDec, Math.min(MAX_FIELD_OF_VIEW, Math.max(MIN_FIELD_OF_VIEW, fov)));
    }

}
