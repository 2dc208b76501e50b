package org.ismcore.analysis.micmac;

import lombok.experimental.UtilityClass;
import org.ismcore.analysis.matrix.BinaryMatrix;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * MICMAC (cross-impact matrix multiplication applied to classification) over a closure.
 */
@UtilityClass
public final class MicmacAnalyzer {

    /**
     * Computes driving power (row sum) and dependence power (column sum) for every
     * element and classifies it against the split point {@code N / 2}.
     *
     * @param closure final reachability matrix.
     * @return immutable report.
     */
    public static MicmacReport analyze(BinaryMatrix closure) {
        Objects.requireNonNull(closure, "closure");
        int size = closure.size();
        double splitPoint = size / 2.0d;
        List<MicmacPoint> points = new ArrayList<>(size);
        for (int element = 0; element < size; element++) {
            int driving = closure.rowSum(element);
            int dependence = closure.columnSum(element);
            points.add(new MicmacPoint(
                    element,
                    driving,
                    dependence,
                    MicmacQuadrant.classify(driving, dependence, splitPoint)
            ));
        }
        return new MicmacReport(splitPoint, points);
    }
}
