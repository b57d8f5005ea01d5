package com.example.motion_photo_muxer.service;

import com.example.motion_photo_muxer.model.FileActionReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Second pass: moves every file the matching pass did not consume into the leftover-files area.
 * Runs only after matching has finished, against the final ledger.
 */
@Service
public class LeftoverRelocator {
    private static final Logger LOGGER = LoggerFactory.getLogger(LeftoverRelocator.class);

    private final DirectoryWalker walker;

    public LeftoverRelocator(DirectoryWalker walker) {
        this.walker = walker;
    }

    /**
     * @param inputRoot                 tree to sweep; {@code outputDir} is skipped if nested inside it.
     * @param outputDir                 run output root.
     * @param otherFilesDirName         leftover folder name under {@code outputDir}.
     * @param ledger                    final state of the matching pass; also resolves name collisions.
     * @param keepConvertedUnmatched    leave {@code convertedUnmatched} originals in place (they are due for deletion).
     * @return moved and failed counts.
     */
    public FileActionReport relocateUnmatched(Path inputRoot, Path outputDir, String otherFilesDirName,
                                              RunLedger ledger, boolean keepConvertedUnmatched) {
        Path otherDir = outputDir.resolve(otherFilesDirName);
        List<Path> files = walker.listFiles(inputRoot, outputDir);
        int moved = 0;
        int failed = 0;
        for (Path file : files) {
            if (ledger.isPaired(file)) {
                continue;
            }
            if (keepConvertedUnmatched && ledger.isConvertedUnmatched(file)) {
                continue;
            }
            try {
                Files.createDirectories(otherDir);
                Path target = ledger.reserveTarget(otherDir.resolve(file.getFileName().toString()));
                Files.move(file, target);
                moved++;
                LOGGER.info("Moved leftover file={} to={}", file, target);
            } catch (IOException | RuntimeException e) {
                failed++;
                LOGGER.warn("Could not move leftover file={} err={}", file, e.toString());
            }
        }
        LOGGER.info("Relocation done moved={} failed={} target={}", moved, failed, otherDir);
        return new FileActionReport(moved, failed);
    }
}
