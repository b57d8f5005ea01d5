package com.example.motion_photo_muxer.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Counts reported at the end of a run. Serialized as-is when the summary file is enabled.
 */
public record RunSummary(
        Path inputDir,
        Path outputDir,
        int matchingPairsFound,
        int convertedUnmatched,
        int problematic,
        int validationFailures,
        int muxFailures,
        int relocated,
        int relocationFailures,
        int deleted,
        int deletionFailures,
        List<Path> containers,
        Path reportFile
) {
    public boolean hasFailures() {
        return problematic > 0 || validationFailures > 0 || muxFailures > 0
                || relocationFailures > 0 || deletionFailures > 0;
    }
}
