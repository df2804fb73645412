package com.tomopipe.runtime;

/**
 * Which DeepDeWedge checkpoint refines the tomograms: lowest validation loss, lowest fitting loss
 * or the latest epoch.
 */
public enum CheckpointSelection {
    VAL_LOSS,
    FITTING_LOSS,
    LATEST_EPOCH
}
