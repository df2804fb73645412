package com.tomopipe.normalize;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public record MdocSummary(
        List<Double> tiltAngles,
        Optional<Double> pixelSpacingAngstrom,
        Optional<Double> exposureDose,
        Optional<Double> meanDefocus) {

    public static MdocSummary of(MdocDocument document) throws MetadataParseException {
        List<Double> tiltAngles = new ArrayList<>();
        for (String value : document.values("TiltAngle")) {
            tiltAngles.add(document.parseDouble("TiltAngle", value));
        }
        List<Double> defocus = new ArrayList<>();
        for (String value : document.values("Defocus")) {
            defocus.add(document.parseDouble("Defocus", value));
        }
        Optional<Double> pixelSpacing = Optional.empty();
        Optional<String> rawPixel = document.firstValue("PixelSpacing");
        if (rawPixel.isPresent()) {
            pixelSpacing = Optional.of(document.parseDouble("PixelSpacing", rawPixel.get()));
        }
        Optional<Double> dose = Optional.empty();
        Optional<String> rawDose = document.firstValue("ExposureDose");
        if (rawDose.isPresent()) {
            dose = Optional.of(document.parseDouble("ExposureDose", rawDose.get()));
        }
        Optional<Double> meanDefocus = defocus.isEmpty()
                ? Optional.empty()
                : Optional.of(defocus.stream().mapToDouble(Double::doubleValue).average().orElse(0.0));
        return new MdocSummary(List.copyOf(tiltAngles), pixelSpacing, dose, meanDefocus);
    }

    public double tiltMin() {
        return tiltAngles.stream().mapToDouble(Double::doubleValue).min().orElse(0.0);
    }

    public double tiltMax() {
        return tiltAngles.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
    }
}
