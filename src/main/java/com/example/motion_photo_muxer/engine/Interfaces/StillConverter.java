package com.example.motion_photo_muxer.engine.Interfaces;

import com.example.motion_photo_muxer.model.ConversionResult;

import java.nio.file.Path;

public interface StillConverter {
    /**
     * Converts a convertible still into a {@code .jpg} sibling. Never throws for per-file problems;
     * on failure nothing is left behind that a later pass could mistake for an asset.
     */
    ConversionResult convert(Path source);
}
