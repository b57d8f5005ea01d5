package com.example.motion_photo_muxer.model;

import com.example.motion_photo_muxer.util.FailureKind;

import java.nio.file.Path;

/**
 * Outcome of concatenating a still and a video. {@code offset} counts bytes from the end of the
 * container back to the first video byte.
 */
public record MuxResult(Path containerPath, long offset, long stillSize, long videoSize,
                        FailureKind failure, String reason) {

    public static MuxResult success(Path containerPath, long stillSize, long containerSize) {
        return new MuxResult(containerPath, containerSize - stillSize, stillSize, containerSize - stillSize, null, null);
    }

    public static MuxResult failed(FailureKind failure, String reason) {
        return new MuxResult(null, -1, -1, -1, failure, reason);
    }

    public boolean isSuccess() {
        return failure == null;
    }
}
