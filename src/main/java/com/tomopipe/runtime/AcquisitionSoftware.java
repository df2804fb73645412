package com.tomopipe.runtime;

public enum AcquisitionSoftware {
    SERIALEM,
    TOMOGRAPHY5
}
