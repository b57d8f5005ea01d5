package com.example.motion_photo_muxer.util;

import java.util.Locale;
import java.util.Set;

/**
 * Enumerates the asset kinds recognized while walking an input tree.
 */
public enum AssetKind {
    STILL(Set.of("jpg", "jpeg")),
    CONVERTIBLE_STILL(Set.of("heic")),
    VIDEO(Set.of("mov", "mp4")),
    OTHER(Set.of());

    private final Set<String> extensions;

    AssetKind(Set<String> extensions) {
        this.extensions = extensions;
    }

    public Set<String> extensions() {
        return extensions;
    }

    /**
     * Resolves the kind for a bare extension (without the dot), ignoring case.
     *
     * @param extension extension to look up, may be {@code null}.
     * @return matching kind, {@link #OTHER} when unrecognized.
     */
    public static AssetKind fromExtension(String extension) {
        if (extension == null || extension.isBlank()) {
            return OTHER;
        }
        String normalized = extension.trim().toLowerCase(Locale.ROOT);
        for (AssetKind kind : values()) {
            if (kind.extensions.contains(normalized)) {
                return kind;
            }
        }
        return OTHER;
    }
}
