package com.example.motion_photo_muxer.service;

import com.example.motion_photo_muxer.support.TestMedia;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class RunReportWriterTest {

    @TempDir
    Path tmp;

    private final RunReportWriter writer = new RunReportWriter(new ObjectMapper());

    @Test
    void nothingWrittenWhenNoProblems() {
        assertThat(writer.writeProblematicReport(tmp, "problematic_files.txt", Set.of())).isNull();
        assertThat(tmp.resolve("problematic_files.txt")).doesNotExist();
    }

    @Test
    void listsOneProblematicPathPerLine() throws Exception {
        Path report = writer.writeProblematicReport(tmp.resolve("out"), "problematic_files.txt",
                List.of(Path.of("/in/a.heic"), Path.of("/in/b.heic")));

        assertThat(Files.readAllLines(report)).containsExactly(
                RunReportWriter.PROBLEMATIC_HEADER, Path.of("/in/a.heic").toString(), Path.of("/in/b.heic").toString());
    }

    @Test
    void unwritableReportIsLoggedNotThrown() throws Exception {
        Path blocker = TestMedia.file(tmp.resolve("out"), "a file, not a directory");

        assertThat(writer.writeProblematicReport(blocker, "problematic_files.txt", List.of(Path.of("x.heic")))).isNull();
    }
}
