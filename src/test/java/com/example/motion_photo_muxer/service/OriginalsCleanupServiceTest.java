package com.example.motion_photo_muxer.service;

import com.example.motion_photo_muxer.model.FileActionReport;
import com.example.motion_photo_muxer.support.TestMedia;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class OriginalsCleanupServiceTest {

    @TempDir
    Path tmp;

    private final OriginalsCleanupService cleanupService = new OriginalsCleanupService();

    @Test
    void deletesOnlyPairedPaths() throws Exception {
        Path still = TestMedia.file(tmp.resolve("a.jpg"), "s");
        Path video = TestMedia.file(tmp.resolve("a.mov"), "v");
        Path failed = TestMedia.file(tmp.resolve("broken.heic"), "b");
        Path unmatched = TestMedia.file(tmp.resolve("x.heic"), "x");
        Path untouched = TestMedia.file(tmp.resolve("c.png"), "c");
        RunLedger ledger = new RunLedger();
        ledger.recordPaired(still, video);
        ledger.recordProblematic(failed);
        ledger.recordConvertedUnmatched(unmatched);

        FileActionReport report = cleanupService.deletePaired(ledger);

        assertThat(report.succeeded()).isEqualTo(2);
        assertThat(still).doesNotExist();
        assertThat(video).doesNotExist();
        assertThat(failed).exists();
        assertThat(unmatched).exists();
        assertThat(untouched).exists();
    }

    @Test
    void missingPathsAreSkippedAndUndeletableOnesCounted() throws Exception {
        Path gone = tmp.resolve("gone.jpg");
        Path nonEmptyDir = tmp.resolve("dir.mov");
        Files.createDirectories(nonEmptyDir);
        TestMedia.file(nonEmptyDir.resolve("child"), "c");
        RunLedger ledger = new RunLedger();
        ledger.recordPaired(gone, nonEmptyDir);

        FileActionReport report = cleanupService.deletePaired(ledger);

        assertThat(report.succeeded()).isZero();
        assertThat(report.failed()).isEqualTo(1);
        assertThat(nonEmptyDir).exists();
    }

    @Test
    void convertedUnmatchedDeletionLeavesPairedAlone() throws Exception {
        Path still = TestMedia.file(tmp.resolve("a.jpg"), "s");
        Path video = TestMedia.file(tmp.resolve("a.mov"), "v");
        Path unmatched = TestMedia.file(tmp.resolve("x.heic"), "x");
        RunLedger ledger = new RunLedger();
        ledger.recordPaired(still, video);
        ledger.recordConvertedUnmatched(unmatched);

        cleanupService.deleteConvertedUnmatched(ledger);

        assertThat(unmatched).doesNotExist();
        assertThat(still).exists();
        assertThat(video).exists();
    }
}
