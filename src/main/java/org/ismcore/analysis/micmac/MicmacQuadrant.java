package org.ismcore.analysis.micmac;

/**
 * MICMAC classification by driving and dependence power against the N/2 split.
 *
 * <p>{@code AUTONOMOUS}: weak driving, weak dependence.</p>
 * <p>{@code DEPENDENT}: weak driving, strong dependence.</p>
 * <p>{@code LINKAGE}: strong driving, strong dependence.</p>
 * <p>{@code DRIVER}: strong driving, weak dependence.</p>
 */
public enum MicmacQuadrant {
    AUTONOMOUS,
    DEPENDENT,
    LINKAGE,
    DRIVER;

    /**
     * Classifies one element. Powers equal to the split point count as weak.
     */
    public static MicmacQuadrant classify(int drivingPower, int dependencePower, double splitPoint) {
        boolean strongDriving = drivingPower > splitPoint;
        boolean strongDependence = dependencePower > splitPoint;
        if (!strongDriving) {
            return strongDependence ? DEPENDENT : AUTONOMOUS;
        }
        return strongDependence ? LINKAGE : DRIVER;
    }
}
