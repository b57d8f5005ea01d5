package com.example.motion_photo_muxer.service;

import com.example.motion_photo_muxer.model.MuxResult;
import com.example.motion_photo_muxer.support.TestMedia;
import com.example.motion_photo_muxer.util.FailureKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class MotionPhotoMuxerTest {

    @TempDir
    Path tmp;

    private final MotionPhotoMuxer muxer = new MotionPhotoMuxer(new AssetClassifier());

    @Test
    void containerIsStillThenVideoAndOffsetIsVideoSize() throws Exception {
        Path still = TestMedia.jpeg(tmp.resolve("in/a.jpg"));
        byte[] videoBytes = TestMedia.videoBytes(5_000);
        Path video = Files.write(tmp.resolve("in/a.mov"), videoBytes);
        byte[] stillBytes = Files.readAllBytes(still);
        Path outputDir = tmp.resolve("out/nested");

        MuxResult result = muxer.mux(still, video, outputDir);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.containerPath()).isEqualTo(outputDir.resolve("a.jpg"));
        assertThat(result.offset()).isEqualTo(videoBytes.length);
        assertThat(result.stillSize()).isEqualTo(stillBytes.length);

        byte[] container = Files.readAllBytes(result.containerPath());
        assertThat(container).hasSize(stillBytes.length + videoBytes.length);
        assertThat(Arrays.copyOfRange(container, 0, stillBytes.length)).isEqualTo(stillBytes);
        assertThat(Arrays.copyOfRange(container, stillBytes.length, container.length)).isEqualTo(videoBytes);
        try (var listing = Files.list(outputDir)) {
            assertThat(listing).containsExactly(result.containerPath());
        }
    }

    @Test
    void defaultTargetOverwritesSameName() throws Exception {
        Path outputDir = tmp.resolve("out");
        Path first = TestMedia.file(tmp.resolve("one/p.jpg"), "first-still");
        Path firstVideo = TestMedia.file(tmp.resolve("one/p.mov"), "first-video");
        Path second = TestMedia.file(tmp.resolve("two/p.jpg"), "second-still");
        Path secondVideo = TestMedia.file(tmp.resolve("two/p.mp4"), "v2");

        muxer.mux(first, firstVideo, outputDir);
        MuxResult result = muxer.mux(second, secondVideo, outputDir);

        assertThat(result.containerPath()).isEqualTo(outputDir.resolve("p.jpg"));
        assertThat(Files.readString(result.containerPath())).isEqualTo("second-stillv2");
    }

    @Test
    void ledgerResolverKeepsEarlierContainer() throws Exception {
        Path outputDir = tmp.resolve("out");
        RunLedger ledger = new RunLedger();
        Path first = TestMedia.file(tmp.resolve("one/p.jpg"), "s1");
        Path second = TestMedia.file(tmp.resolve("two/p.jpg"), "s2");
        Path video = TestMedia.file(tmp.resolve("one/p.mov"), "v");

        MuxResult a = muxer.mux(first, video, outputDir, ledger::reserveTarget);
        MuxResult b = muxer.mux(second, video, outputDir, ledger::reserveTarget);

        assertThat(a.containerPath().getFileName().toString()).isEqualTo("p.jpg");
        assertThat(b.containerPath().getFileName().toString()).isEqualTo("p(1).jpg");
        assertThat(Files.readString(a.containerPath())).isEqualTo("s1v");
        assertThat(Files.readString(b.containerPath())).isEqualTo("s2v");
    }

    @Test
    void rejectsWrongExtensionsMissingAndEmptyFiles() throws Exception {
        Path png = TestMedia.file(tmp.resolve("a.png"), "x");
        Path still = TestMedia.file(tmp.resolve("a.jpg"), "x");
        Path video = TestMedia.file(tmp.resolve("a.mov"), "v");
        Path emptyVideo = Files.createFile(tmp.resolve("b.mp4"));

        assertThat(muxer.mux(png, video, tmp.resolve("out")).failure()).isEqualTo(FailureKind.VALIDATION);
        assertThat(muxer.mux(still, png, tmp.resolve("out")).failure()).isEqualTo(FailureKind.VALIDATION);
        assertThat(muxer.mux(tmp.resolve("missing.jpg"), video, tmp.resolve("out")).failure()).isEqualTo(FailureKind.VALIDATION);
        MuxResult empty = muxer.mux(still, emptyVideo, tmp.resolve("out"));
        assertThat(empty.failure()).isEqualTo(FailureKind.VALIDATION);
        assertThat(empty.reason()).contains("empty");
        assertThat(tmp.resolve("out")).doesNotExist();
    }
}
