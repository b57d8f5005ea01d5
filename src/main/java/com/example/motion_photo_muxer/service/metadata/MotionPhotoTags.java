package com.example.motion_photo_muxer.service.metadata;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fixed XMP tag set of a motion photo container.
 */
public final class MotionPhotoTags {
    public static final String NAMESPACE = "http://ns.google.com/photos/1.0/camera/";
    public static final String PREFIX = "GCamera";

    public static final String MICRO_VIDEO = "MicroVideo";
    public static final String MICRO_VIDEO_VERSION = "MicroVideoVersion";
    public static final String MICRO_VIDEO_OFFSET = "MicroVideoOffset";
    public static final String MICRO_VIDEO_PRESENTATION_TIMESTAMP_US = "MicroVideoPresentationTimestampUs";

    // the still frame of a live photo sits 1.5s into its clip
    public static final long PRESENTATION_TIMESTAMP_US = 1_500_000L;

    private MotionPhotoTags() {
    }

    /**
     * @param offset bytes from end of file to the first video byte.
     * @return tag local names to values, in write order.
     */
    public static Map<String, String> forOffset(long offset) {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0: " + offset);
        }
        Map<String, String> tags = new LinkedHashMap<>();
        tags.put(MICRO_VIDEO, "1");
        tags.put(MICRO_VIDEO_VERSION, "1");
        tags.put(MICRO_VIDEO_OFFSET, Long.toString(offset));
        tags.put(MICRO_VIDEO_PRESENTATION_TIMESTAMP_US, Long.toString(PRESENTATION_TIMESTAMP_US));
        return tags;
    }
}
