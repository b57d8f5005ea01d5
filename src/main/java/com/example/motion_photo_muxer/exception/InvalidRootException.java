package com.example.motion_photo_muxer.exception;

import java.nio.file.Path;

/**
 * Raised before any file is touched when the input or output root cannot be used.
 */
public class InvalidRootException extends RuntimeException {
    private final Path root;

    public InvalidRootException(Path root, String message) {
        super(message + ": " + root);
        this.root = root;
    }

    public InvalidRootException(Path root, String message, Throwable cause) {
        super(message + ": " + root, cause);
        this.root = root;
    }

    public Path getRoot() {
        return root;
    }
}
