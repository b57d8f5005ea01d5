package com.example.motion_photo_muxer.service;

import com.example.motion_photo_muxer.model.MediaAsset;
import com.example.motion_photo_muxer.util.AssetKind;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Tags files by extension only. No I/O.
 */
@Component
public class AssetClassifier {

    public AssetKind classify(Path path) {
        if (path == null || path.getFileName() == null) {
            return AssetKind.OTHER;
        }
        return AssetKind.fromExtension(extensionOf(path.getFileName().toString()));
    }

    public MediaAsset describe(Path path) {
        return new MediaAsset(path, classify(path), stemOf(path));
    }

    public static String stemOf(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    public static String extensionOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 && dot < fileName.length() - 1 ? fileName.substring(dot + 1) : "";
    }
}
