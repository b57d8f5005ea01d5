package com.example.motion_photo_muxer.engine;

import com.example.motion_photo_muxer.engine.Interfaces.MetadataWriter;
import com.example.motion_photo_muxer.model.MetadataWriteResult;
import com.example.motion_photo_muxer.service.metadata.XmpPacketBuilder;
import org.apache.commons.imaging.Imaging;
import org.apache.commons.imaging.formats.jpeg.xmp.JpegXmpRewriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * Rewrites the container's APP1 XMP segment. Everything after the JPEG scan data (the video) is
 * carried over untouched, so the end-relative offset stays valid.
 */
@Component
public class XmpMotionPhotoWriter implements MetadataWriter {
    private static final Logger LOGGER = LoggerFactory.getLogger(XmpMotionPhotoWriter.class);

    private final XmpPacketBuilder packetBuilder;

    public XmpMotionPhotoWriter(XmpPacketBuilder packetBuilder) {
        this.packetBuilder = packetBuilder;
    }

    @Override
    public MetadataWriteResult write(Path container, long offset) {
        LOGGER.info("Reading existing metadata container={}", container);
        String existing;
        try {
            existing = Imaging.getXmpXml(container.toFile());
        } catch (IOException | IllegalArgumentException e) {
            LOGGER.warn("Cannot read metadata container={} err={}", container, e.toString());
            return MetadataWriteResult.failed(e.toString());
        }
        boolean prior = existing != null && !existing.isBlank();
        if (prior) {
            LOGGER.warn("Found existing XMP keys in {}. They *may* be affected after this process.", container);
        }

        Path temp = null;
        try {
            String packet = packetBuilder.build(existing, offset);
            temp = Files.createTempFile(container.toAbsolutePath().getParent(), ".xmp-", ".part");
            try (OutputStream os = new BufferedOutputStream(Files.newOutputStream(temp))) {
                new JpegXmpRewriter().updateXmpXml(container.toFile(), os, packet);
            }
            Files.move(temp, container, REPLACE_EXISTING);
            temp = null;
            LOGGER.info("Motion photo metadata written container={} offset={}", container, offset);
            return MetadataWriteResult.written(prior);
        } catch (IOException | IllegalArgumentException e) {
            LOGGER.warn("Metadata write failed container={} err={}", container, e.toString());
            return MetadataWriteResult.failed(e.toString());
        } finally {
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException e) {
                    LOGGER.warn("Could not remove temp file path={} err={}", temp, e.toString());
                }
            }
        }
    }
}
