package com.example.motion_photo_muxer.service;

import com.example.motion_photo_muxer.support.TestMedia;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class VideoMatcherTest {

    @TempDir
    Path tmp;

    private final AssetClassifier classifier = new AssetClassifier();
    private final DirectoryWalker walker = new DirectoryWalker();
    private final VideoMatcher matcher = new VideoMatcher(classifier, walker);

    @Test
    void matchesExactStemIgnoringCase() throws Exception {
        Path still = TestMedia.file(tmp.resolve("IMG_001.jpg"), "s");
        Path video = TestMedia.file(tmp.resolve("img_001.MOV"), "v");

        assertThat(matcher.findVideo(still, tmp)).contains(video);
    }

    @Test
    void prefixOfAnotherStemDoesNotMatch() throws Exception {
        Path still = TestMedia.file(tmp.resolve("IMG_001.jpg"), "s");
        TestMedia.file(tmp.resolve("IMG_0011.mov"), "v");
        TestMedia.file(tmp.resolve("IMG_001_edit.mp4"), "v");

        assertThat(matcher.findVideo(still, tmp)).isEmpty();
    }

    @Test
    void ignoresNonVideoFilesWithSameStem() throws Exception {
        Path still = TestMedia.file(tmp.resolve("a.jpg"), "s");
        TestMedia.file(tmp.resolve("a.png"), "x");
        TestMedia.file(tmp.resolve("a.heic"), "x");

        assertThat(matcher.findVideo(still, tmp)).isEmpty();
    }

    @Test
    void searchesSubdirectoriesAndPicksFirstInPathOrder() throws Exception {
        Path still = TestMedia.file(tmp.resolve("photos/a.jpg"), "s");
        Path later = TestMedia.file(tmp.resolve("videos/b/a.mp4"), "v2");
        Path first = TestMedia.file(tmp.resolve("videos/a/a.mov"), "v1");

        assertThat(matcher.findVideo(still, tmp)).contains(first);
        assertThat(matcher.findVideo(still, tmp)).contains(first);
        assertThat(later).exists();
    }

    @Test
    void candidateListFormHonoursGivenOrder() {
        List<Path> candidates = List.of(Path.of("x/z.mov"), Path.of("y/z.mp4"));

        assertThat(matcher.findVideo("Z", candidates)).contains(Path.of("x/z.mov"));
        assertThat(matcher.findVideo("zz", candidates)).isEmpty();
    }

    @Test
    void indexKeepsFirstVideoPerStemInListingOrder() {
        List<Path> listing = List.of(Path.of("a/IMG_1.jpg"), Path.of("a/img_1.MOV"), Path.of("b/IMG_1.mp4"),
                Path.of("b/IMG_2.mp4"), Path.of("b/notes.txt"));

        Map<String, Path> index = matcher.indexVideos(listing);

        assertThat(index).containsOnlyKeys("img_1", "img_2");
        assertThat(matcher.findVideo("IMG_1", index)).contains(Path.of("a/img_1.MOV"));
        assertThat(matcher.findVideo("img_2", index)).contains(Path.of("b/IMG_2.mp4"));
        assertThat(matcher.findVideo("IMG_3", index)).isEmpty();
    }
}
