package com.example.motion_photo_muxer.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A still and the video it was matched to, alive for one mux operation.
 */
public record MatchedPair(MediaAsset still, MediaAsset video, Path outputDir) {

    public MatchedPair {
        Objects.requireNonNull(still, "still");
        Objects.requireNonNull(video, "video");
        Objects.requireNonNull(outputDir, "outputDir");
        if (!still.isStill()) {
            throw new IllegalArgumentException("Pair still must be a converted still: " + still.path());
        }
        if (!video.isVideo()) {
            throw new IllegalArgumentException("Pair video must be a video: " + video.path());
        }
        if (!still.hasStem(video.stem())) {
            throw new IllegalArgumentException("Stems differ: " + still.stem() + " vs " + video.stem());
        }
    }
}
