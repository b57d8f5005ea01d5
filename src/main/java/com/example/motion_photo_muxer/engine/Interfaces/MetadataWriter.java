package com.example.motion_photo_muxer.engine.Interfaces;

import com.example.motion_photo_muxer.model.MetadataWriteResult;

import java.nio.file.Path;

public interface MetadataWriter {
    /** Tags a container with the motion photo marker and the end-relative video offset. */
    MetadataWriteResult write(Path container, long offset);
}
