package com.example.motion_photo_muxer.service;

import com.example.motion_photo_muxer.util.FailureKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Bookkeeping for one run. A path lands in at most one of {@code paired}, {@code convertedUnmatched}
 * and {@code problematic}; anything in none of them is untouched. Not thread-safe: one run, one thread.
 */
public class RunLedger {
    private static final Logger LOGGER = LoggerFactory.getLogger(RunLedger.class);

    private final Set<Path> paired = new LinkedHashSet<>();
    private final Set<Path> convertedUnmatched = new LinkedHashSet<>();
    private final Set<Path> problematic = new LinkedHashSet<>();
    private final Set<Path> reservedTargets = new HashSet<>();
    private final List<Path> containers = new ArrayList<>();
    private final Map<FailureKind, Integer> failures = new EnumMap<>(FailureKind.class);
    private int matchingPairsFound;

    public void recordPaired(Path still, Path video) {
        add(paired, still, "paired");
        add(paired, video, "paired");
    }

    public void recordConvertedUnmatched(Path still) {
        add(convertedUnmatched, still, "convertedUnmatched");
    }

    public void recordProblematic(Path still) {
        add(problematic, still, "problematic");
    }

    public void recordContainer(Path container) {
        containers.add(container);
        matchingPairsFound++;
    }

    public void recordFailure(FailureKind kind) {
        failures.merge(kind, 1, Integer::sum);
    }

    public boolean isPaired(Path path) {
        return paired.contains(key(path));
    }

    public boolean isConvertedUnmatched(Path path) {
        return convertedUnmatched.contains(key(path));
    }

    public boolean isProblematic(Path path) {
        return problematic.contains(key(path));
    }

    public Set<Path> paired() {
        return Collections.unmodifiableSet(paired);
    }

    public Set<Path> convertedUnmatched() {
        return Collections.unmodifiableSet(convertedUnmatched);
    }

    public Set<Path> problematic() {
        return Collections.unmodifiableSet(problematic);
    }

    public List<Path> containers() {
        return Collections.unmodifiableList(containers);
    }

    public int matchingPairsFound() {
        return matchingPairsFound;
    }

    public int failureCount(FailureKind kind) {
        return failures.getOrDefault(kind, 0);
    }

    /**
     * Returns {@code desired} when it is free, otherwise the first free {@code name(n).ext} sibling.
     * "Free" means absent on disk and not handed out earlier in this run.
     *
     * @param desired preferred target path.
     * @return reserved target path.
     */
    public Path reserveTarget(Path desired) {
        Path normalized = key(desired);
        Path candidate = normalized;
        String fileName = normalized.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String base = dot > 0 ? fileName.substring(0, dot) : fileName;
        String ext = dot > 0 ? fileName.substring(dot) : "";
        int n = 1;
        while (reservedTargets.contains(candidate) || Files.exists(candidate)) {
            candidate = normalized.resolveSibling(base + "(" + n + ")" + ext);
            n++;
        }
        reservedTargets.add(candidate);
        return candidate;
    }

    private void add(Set<Path> target, Path path, String name) {
        Path normalized = key(path);
        for (Set<Path> other : List.of(paired, convertedUnmatched, problematic)) {
            if (other != target && other.contains(normalized)) {
                throw new IllegalStateException("Path already recorded in another set, cannot add to " + name + ": " + normalized);
            }
        }
        if (target.add(normalized)) {
            LOGGER.debug("Ledger {} += {}", name, normalized);
        }
    }

    private static Path key(Path path) {
        return path.toAbsolutePath().normalize();
    }
}
