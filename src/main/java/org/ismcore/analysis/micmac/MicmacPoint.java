package org.ismcore.analysis.micmac;

import lombok.Value;

/**
 * Driving and dependence power of one element.
 */
@Value
public class MicmacPoint {
    /** Element index. */
    int element;
    /** Closure row sum, self included. */
    int drivingPower;
    /** Closure column sum, self included. */
    int dependencePower;
    /** Quadrant under the report's split point. */
    MicmacQuadrant quadrant;
}
