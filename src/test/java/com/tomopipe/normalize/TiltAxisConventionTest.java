package com.tomopipe.normalize;

import org.junit.jupiter.api.Test;

import com.tomopipe.runtime.AcquisitionSoftware;

import static org.junit.jupiter.api.Assertions.assertEquals;

class TiltAxisConventionTest {

    @Test
    void shouldConvertTomography5AxisToSerialEmConvention() {
        assertEquals("-3.00", TiltAxisConvention.format(TiltAxisConvention.toCanonical(AcquisitionSoftware.TOMOGRAPHY5, -87.0)));
        assertEquals("-175.50", TiltAxisConvention.format(TiltAxisConvention.toCanonical(AcquisitionSoftware.TOMOGRAPHY5, 85.5)));
    }

    @Test
    void shouldKeepSerialEmAxisUnchanged() {
        assertEquals("85.30", TiltAxisConvention.format(TiltAxisConvention.toCanonical(AcquisitionSoftware.SERIALEM, 85.3)));
    }
}
