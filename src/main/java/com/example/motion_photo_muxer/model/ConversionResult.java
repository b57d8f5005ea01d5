package com.example.motion_photo_muxer.model;

import java.nio.file.Path;

public record ConversionResult(Path source, Path converted, boolean metadataCopied, String error) {

    public static ConversionResult success(Path source, Path converted, boolean metadataCopied) {
        return new ConversionResult(source, converted, metadataCopied, null);
    }

    public static ConversionResult failed(Path source, String error) {
        return new ConversionResult(source, null, false, error);
    }

    public boolean isSuccess() {
        return error == null && converted != null;
    }
}
