package com.tomopipe.runtime;

public enum Reorientation {
    NONE(0),
    FLIP(1),
    ROTATE_X(2);

    private final int directiveValue;

    Reorientation(int directiveValue) {
        this.directiveValue = directiveValue;
    }

    public int directiveValue() {
        return directiveValue;
    }
}
