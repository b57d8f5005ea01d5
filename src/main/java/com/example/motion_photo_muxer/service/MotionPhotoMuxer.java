package com.example.motion_photo_muxer.service;

import com.example.motion_photo_muxer.model.MuxResult;
import com.example.motion_photo_muxer.util.AssetKind;
import com.example.motion_photo_muxer.util.FailureKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.UnaryOperator;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * Writes still bytes followed by video bytes into one container file.
 */
@Service
public class MotionPhotoMuxer {
    private static final Logger LOGGER = LoggerFactory.getLogger(MotionPhotoMuxer.class);

    private final AssetClassifier classifier;

    public MotionPhotoMuxer(AssetClassifier classifier) {
        this.classifier = classifier;
    }

    /**
     * Muxes into {@code outputDir/<still file name>}, replacing an existing file of that name.
     */
    public MuxResult mux(Path stillPath, Path videoPath, Path outputDir) {
        return mux(stillPath, videoPath, outputDir, UnaryOperator.identity());
    }

    /**
     * Muxes a still and a video.
     *
     * @param stillPath      recognized still, existing and non-empty.
     * @param videoPath      recognized video, existing and non-empty.
     * @param outputDir      destination directory, created when absent.
     * @param targetResolver maps the default target ({@code outputDir/<still file name>}) to the final one.
     * @return success with container path and end-relative video offset, or a tagged failure.
     */
    public MuxResult mux(Path stillPath, Path videoPath, Path outputDir, UnaryOperator<Path> targetResolver) {
        String invalid = validate(stillPath, videoPath);
        if (invalid != null) {
            LOGGER.warn("Mux skipped still={} video={} reason={}", stillPath, videoPath, invalid);
            return MuxResult.failed(FailureKind.VALIDATION, invalid);
        }

        Path temp = null;
        try {
            Files.createDirectories(outputDir);
            Path target = targetResolver.apply(outputDir.resolve(stillPath.getFileName().toString()));
            LOGGER.info("Merging still={} video={} into={}", stillPath, videoPath, target);

            temp = Files.createTempFile(outputDir, ".mux-", ".part");
            try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(temp))) {
                Files.copy(stillPath, out);
                Files.copy(videoPath, out);
            }
            moveIntoPlace(temp, target);
            temp = null;

            long stillSize = Files.size(stillPath);
            long containerSize = Files.size(target);
            MuxResult result = MuxResult.success(target, stillSize, containerSize);
            LOGGER.info("Merged container={} size={}B offset={}", target, containerSize, result.offset());
            return result;
        } catch (IOException | RuntimeException e) {
            LOGGER.warn("Mux failed still={} video={} err={}", stillPath, videoPath, e.toString());
            return MuxResult.failed(FailureKind.IO, e.toString());
        } finally {
            if (temp != null) {
                deleteQuietly(temp);
            }
        }
    }

    private String validate(Path stillPath, Path videoPath) {
        if (stillPath == null || videoPath == null) {
            return "missing path";
        }
        if (classifier.classify(stillPath) != AssetKind.STILL) {
            return "photo isn't a JPEG: " + stillPath;
        }
        if (classifier.classify(videoPath) != AssetKind.VIDEO) {
            return "video isn't a MOV or MP4: " + videoPath;
        }
        String stillProblem = unreadable(stillPath);
        if (stillProblem != null) {
            return "photo " + stillProblem + ": " + stillPath;
        }
        String videoProblem = unreadable(videoPath);
        if (videoProblem != null) {
            return "video " + videoProblem + ": " + videoPath;
        }
        return null;
    }

    private String unreadable(Path path) {
        if (!Files.isRegularFile(path)) {
            return "does not exist";
        }
        if (!Files.isReadable(path)) {
            return "is not readable";
        }
        try {
            return Files.size(path) > 0 ? null : "is empty";
        } catch (IOException e) {
            return "cannot be sized (" + e.getMessage() + ")";
        }
    }

    private void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, ATOMIC_MOVE, REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOGGER.warn("Could not remove temp file path={} err={}", path, e.toString());
        }
    }
}
