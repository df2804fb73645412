package com.tomopipe.normalize;

import java.util.Locale;

import com.tomopipe.runtime.AcquisitionSoftware;

/**
 * Tilt-axis angles as recorded by the acquisition software versus the SerialEM/IMOD
 * convention used by every downstream stage.
 */
public final class TiltAxisConvention {

    private TiltAxisConvention() {
    }

    /**
     * Tomography 5 measures the axis from the other reference direction with the opposite sign,
     * so {@code canonical = -90 - source}. A Tomography 5 axis of -87 is -3 in SerialEM terms.
     */
    public static double fromTomography5(double sourceAxis) {
        return -90.0 - sourceAxis;
    }

    public static double toCanonical(AcquisitionSoftware software, double sourceAxis) {
        return software == AcquisitionSoftware.TOMOGRAPHY5 ? fromTomography5(sourceAxis) : sourceAxis;
    }

    public static String format(double canonicalAxis) {
        return String.format(Locale.ROOT, "%.2f", canonicalAxis);
    }
}
