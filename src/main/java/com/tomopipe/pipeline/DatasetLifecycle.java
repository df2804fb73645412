package com.tomopipe.pipeline;

/**
 * Coarse progress of one dataset through the pipeline. Declaration order is the only allowed
 * direction of travel.
 */
public enum DatasetLifecycle {
    RAW,
    NORMALIZED,
    MOTION_CORRECTING,
    MOTION_CORRECTED,
    RECONSTRUCTING,
    RECONSTRUCTED,
    DENOISING_PREP,
    ARCHIVE_TRANSFERRING,
    DONE;

    public boolean canAdvanceTo(DatasetLifecycle next) {
        return next.ordinal() >= ordinal();
    }

    public boolean isAtLeast(DatasetLifecycle other) {
        return ordinal() >= other.ordinal();
    }
}
