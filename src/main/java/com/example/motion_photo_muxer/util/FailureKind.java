package com.example.motion_photo_muxer.util;

/**
 * Per-file failure reasons. None of them aborts a run.
 */
public enum FailureKind {
    CONVERSION,
    VALIDATION,
    IO
}
