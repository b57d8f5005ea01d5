package com.example.motion_photo_muxer.model;

public record FileActionReport(int succeeded, int failed) {

    public static FileActionReport none() {
        return new FileActionReport(0, 0);
    }

    public FileActionReport plus(FileActionReport other) {
        return new FileActionReport(succeeded + other.succeeded, failed + other.failed);
    }
}
