package com.example.motion_photo_muxer.service;

import com.example.motion_photo_muxer.util.AssetKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Finds the companion video of a still: same stem ignoring case, recognized video extension.
 * Prefix matches ({@code IMG_001} vs {@code IMG_0011.mov}) never count.
 */
@Component
public class VideoMatcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(VideoMatcher.class);

    private final AssetClassifier classifier;
    private final DirectoryWalker walker;

    public VideoMatcher(AssetClassifier classifier, DirectoryWalker walker) {
        this.classifier = classifier;
        this.walker = walker;
    }

    public Optional<Path> findVideo(Path stillPath, Path searchRoot) {
        return findVideo(AssetClassifier.stemOf(stillPath), walker.listFiles(searchRoot));
    }

    /**
     * Scans {@code candidates} in the given order; the first match wins and later ones are only logged.
     *
     * @param stem       still stem to match.
     * @param candidates files in walk order.
     * @return first matching video.
     */
    public Optional<Path> findVideo(String stem, List<Path> candidates) {
        if (stem == null || candidates == null) {
            return Optional.empty();
        }
        String wanted = stem.toLowerCase(Locale.ROOT);
        Path chosen = null;
        List<Path> ignored = new ArrayList<>();
        for (Path candidate : candidates) {
            if (classifier.classify(candidate) != AssetKind.VIDEO) {
                continue;
            }
            if (!AssetClassifier.stemOf(candidate).toLowerCase(Locale.ROOT).equals(wanted)) {
                continue;
            }
            if (chosen == null) {
                chosen = candidate;
            } else {
                ignored.add(candidate);
            }
        }
        if (!ignored.isEmpty()) {
            LOGGER.warn("Multiple videos for stem={} chosen={} ignored={}", stem, chosen, ignored);
        }
        return Optional.ofNullable(chosen);
    }

    /**
     * Indexes the videos of a listing by lower-cased stem, keeping the first one in listing order.
     * Built once per pass so each lookup is constant time.
     */
    public Map<String, Path> indexVideos(List<Path> candidates) {
        Map<String, Path> index = new HashMap<>();
        Map<String, List<Path>> ignored = new LinkedHashMap<>();
        for (Path candidate : candidates) {
            if (classifier.classify(candidate) != AssetKind.VIDEO) {
                continue;
            }
            String key = AssetClassifier.stemOf(candidate).toLowerCase(Locale.ROOT);
            Path chosen = index.putIfAbsent(key, candidate);
            if (chosen != null) {
                ignored.computeIfAbsent(key, k -> new ArrayList<>()).add(candidate);
            }
        }
        ignored.forEach((key, paths) ->
                LOGGER.warn("Multiple videos for stem={} chosen={} ignored={}", key, index.get(key), paths));
        LOGGER.debug("Indexed videos stems={}", index.size());
        return index;
    }

    public Optional<Path> findVideo(String stem, Map<String, Path> index) {
        if (stem == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(index.get(stem.toLowerCase(Locale.ROOT)));
    }
}
