package com.example.motion_photo_muxer.service;

import com.example.motion_photo_muxer.exception.MuxerStorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Recursively lists regular files in a fixed order: lexicographic by full path. Every pass of a run
 * and every match lookup sees files in this order.
 */
@Component
public class DirectoryWalker {
    private static final Logger LOGGER = LoggerFactory.getLogger(DirectoryWalker.class);
    public static final Comparator<Path> WALK_ORDER = Comparator.comparing(Path::toString);

    public List<Path> listFiles(Path root) {
        return listFiles(root, null);
    }

    /**
     * @param root     directory to scan.
     * @param excluded subtree to skip when it sits inside {@code root}; ignored otherwise, may be {@code null}.
     * @return sorted regular files; unreadable entries are logged and skipped.
     */
    public List<Path> listFiles(Path root, Path excluded) {
        Path normalizedRoot = root.toAbsolutePath().normalize();
        Path normalizedExcluded = excluded == null ? null : excluded.toAbsolutePath().normalize();
        if (normalizedExcluded != null && !normalizedExcluded.startsWith(normalizedRoot)) {
            normalizedExcluded = null;
        }
        Path skipped = normalizedExcluded;
        List<Path> files = new ArrayList<>();
        try {
            Files.walkFileTree(normalizedRoot, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (skipped != null && !dir.equals(normalizedRoot) && dir.startsWith(skipped)) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile()) {
                        files.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    LOGGER.warn("Walk skipped unreadable path={} err={}", file, exc.toString());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new MuxerStorageException("Cannot walk " + normalizedRoot, e);
        }
        files.sort(WALK_ORDER);
        LOGGER.debug("Walk root={} files={}", normalizedRoot, files.size());
        return files;
    }
}
