package com.example.motion_photo_muxer.model;

import com.example.motion_photo_muxer.util.AssetKind;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * A classified file discovered during the walk. The stem is the join key for matching.
 */
public record MediaAsset(Path path, AssetKind kind, String stem) {

    public MediaAsset {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(stem, "stem");
    }

    public boolean isStill() {
        return kind == AssetKind.STILL;
    }

    public boolean isConvertibleStill() {
        return kind == AssetKind.CONVERTIBLE_STILL;
    }

    public boolean isVideo() {
        return kind == AssetKind.VIDEO;
    }

    public boolean hasStem(String other) {
        return other != null && stem.toLowerCase(Locale.ROOT).equals(other.toLowerCase(Locale.ROOT));
    }

    public MediaAsset withPath(Path newPath, AssetKind newKind) {
        return new MediaAsset(newPath, newKind, stem);
    }
}
