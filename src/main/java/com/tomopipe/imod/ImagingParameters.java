package com.tomopipe.imod;

/**
 * Acquisition values that end up in IMOD directives. The pixel size is kept in Angstrom as it is
 * configured and recorded in sidecars; directives take nanometres.
 */
public record ImagingParameters(double pixelSizeAngstrom, Double tiltAxis, Double exposurePerTilt) {

    public double pixelSizeNm() {
        return pixelSizeAngstrom / 10.0;
    }
}
