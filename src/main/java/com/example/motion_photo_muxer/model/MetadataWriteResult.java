package com.example.motion_photo_muxer.model;

public record MetadataWriteResult(boolean written, boolean priorXmpFound, String error) {

    public static MetadataWriteResult written(boolean priorXmpFound) {
        return new MetadataWriteResult(true, priorXmpFound, null);
    }

    public static MetadataWriteResult failed(String error) {
        return new MetadataWriteResult(false, false, error);
    }
}
