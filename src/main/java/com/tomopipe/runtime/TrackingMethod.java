package com.tomopipe.runtime;

public enum TrackingMethod {
    FIDUCIAL(0),
    PATCH(1);

    private final int directiveValue;

    TrackingMethod(int directiveValue) {
        this.directiveValue = directiveValue;
    }

    public int directiveValue() {
        return directiveValue;
    }
}
