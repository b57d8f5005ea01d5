package com.example.motion_photo_muxer.engine;

import com.example.motion_photo_muxer.model.ConversionResult;
import com.example.motion_photo_muxer.service.metadata.CaptureMetadataCopier;
import com.example.motion_photo_muxer.support.TestMedia;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExternalStillConverterTest {

    private static final List<String> COPY_COMMAND = List.of("sh", "-c", "cp \"$0\" \"$1\"", "{input}", "{output}");

    @TempDir
    Path tmp;

    private final CaptureMetadataCopier copier = new CaptureMetadataCopier();

    @Test
    void convertsIntoJpegSibling() throws Exception {
        Path heic = TestMedia.jpeg(tmp.resolve("IMG_1.heic"));
        ExternalStillConverter converter = new ExternalStillConverter(COPY_COMMAND, 30, true, copier);

        ConversionResult result = converter.convert(heic);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.converted()).isEqualTo(tmp.resolve("IMG_1.jpg"));
        assertThat(Files.readAllBytes(result.converted())).isEqualTo(Files.readAllBytes(heic));
        assertThat(result.metadataCopied()).isFalse();
        assertThat(heic).exists();
        assertNoPartials();
    }

    @Test
    void nonZeroExitLeavesNothingBehind() throws Exception {
        Path heic = TestMedia.file(tmp.resolve("broken.heic"), "not an image");
        List<String> command = List.of("sh", "-c", "cp \"$0\" \"$1\"; echo decode error; exit 3", "{input}", "{output}");
        ExternalStillConverter converter = new ExternalStillConverter(command, 30, true, copier);

        ConversionResult result = converter.convert(heic);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.error()).contains("exit=3").contains("decode error");
        assertThat(tmp.resolve("broken.jpg")).doesNotExist();
        assertNoPartials();
    }

    @Test
    void missingBinaryIsAFailure() throws Exception {
        Path heic = TestMedia.file(tmp.resolve("a.heic"), "x");
        ExternalStillConverter converter = new ExternalStillConverter(
                List.of("no-such-converter-binary-42", "{input}", "{output}"), 30, false, copier);

        ConversionResult result = converter.convert(heic);

        assertThat(result.isSuccess()).isFalse();
        assertThat(tmp.resolve("a.jpg")).doesNotExist();
    }

    @Test
    void existingTargetIsNeverOverwritten() throws Exception {
        Path heic = TestMedia.file(tmp.resolve("a.heic"), "x");
        Path existing = TestMedia.file(tmp.resolve("a.jpg"), "keep me");
        ExternalStillConverter converter = new ExternalStillConverter(COPY_COMMAND, 30, false, copier);

        ConversionResult result = converter.convert(heic);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.error()).contains("already exists");
        assertThat(Files.readString(existing)).isEqualTo("keep me");
    }

    @Test
    void timeoutIsReported() throws Exception {
        Path heic = TestMedia.file(tmp.resolve("slow.heic"), "x");
        ExternalStillConverter converter = new ExternalStillConverter(COPY_COMMAND, 1, false, copier) {
            @Override
            protected ProcessResult runProcess(List<String> cmd, long timeoutSeconds) {
                return new ProcessResult(-1, "", true);
            }
        };

        ConversionResult result = converter.convert(heic);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.error()).contains("timeout");
    }

    @Test
    void placeholdersAreReplacedWithAbsolutePaths() {
        ExternalStillConverter converter = new ExternalStillConverter(
                List.of("heif-convert", "-q", "92", "{input}", "{output}"), 30, false, copier);

        List<String> cmd = converter.buildCommand(Path.of("a.heic"), Path.of("a.jpg"));

        assertThat(cmd).hasSize(5);
        assertThat(cmd.get(3)).isEqualTo(Path.of("a.heic").toAbsolutePath().toString());
        assertThat(cmd.get(4)).isEqualTo(Path.of("a.jpg").toAbsolutePath().toString());
    }

    private void assertNoPartials() throws Exception {
        try (var listing = Files.list(tmp)) {
            assertThat(listing.map(p -> p.getFileName().toString())).noneMatch(name -> name.contains(".converting"));
        }
    }
}
