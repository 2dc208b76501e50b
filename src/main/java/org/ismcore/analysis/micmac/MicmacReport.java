package org.ismcore.analysis.micmac;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable MICMAC result: one point per element in index order plus the split point.
 */
@Value
public class MicmacReport {
    double splitPoint;
    List<MicmacPoint> points;

    public MicmacReport(double splitPoint, List<MicmacPoint> points) {
        this.splitPoint = splitPoint;
        this.points = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(points, "points")));
    }

    /**
     * Returns a report with no points.
     */
    public static MicmacReport empty() {
        return new MicmacReport(0.0d, List.of());
    }

    /**
     * Returns the point of one element.
     */
    public MicmacPoint pointOf(int element) {
        if (element < 0 || element >= points.size()) {
            throw new IndexOutOfBoundsException("element out of bounds: " + element);
        }
        return points.get(element);
    }

    /**
     * Returns element indices of one quadrant in ascending order.
     */
    public int[] elementsIn(MicmacQuadrant quadrant) {
        Objects.requireNonNull(quadrant, "quadrant");
        return points.stream()
                .filter(point -> point.getQuadrant() == quadrant)
                .mapToInt(MicmacPoint::getElement)
                .toArray();
    }
}
