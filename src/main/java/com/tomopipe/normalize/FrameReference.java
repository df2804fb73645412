package com.tomopipe.normalize;

public record FrameReference(int zValue, double tiltAngle, String frameFileName) {
}
