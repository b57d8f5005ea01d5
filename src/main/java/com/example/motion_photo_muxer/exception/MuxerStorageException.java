package com.example.motion_photo_muxer.exception;

public class MuxerStorageException extends RuntimeException {
    public MuxerStorageException(String message) {
        super(message);
    }

    public MuxerStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
