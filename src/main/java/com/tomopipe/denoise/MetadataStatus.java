package com.tomopipe.denoise;

/**
 * What is available in a reconstructed unit for rebuilding half tomograms.
 */
public enum MetadataStatus {
    /** Missing transforms or tilt files; nothing can be done. */
    NONE,
    /** Aligned stack present; only {@code tilt} is needed. */
    TILT_ONLY,
    /** Transforms present but no aligned stack; {@code newstack} runs first. */
    NEWSTACK_AND_TILT
}
