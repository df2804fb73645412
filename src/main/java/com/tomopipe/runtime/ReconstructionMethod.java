package com.tomopipe.runtime;

public enum ReconstructionMethod {
    BACKPROJECTION,
    SIRT_LIKE,
    SIRT
}
