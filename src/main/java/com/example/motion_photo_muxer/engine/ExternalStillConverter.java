package com.example.motion_photo_muxer.engine;

import com.example.motion_photo_muxer.config.MuxerProperties;
import com.example.motion_photo_muxer.engine.Interfaces.StillConverter;
import com.example.motion_photo_muxer.model.ConversionResult;
import com.example.motion_photo_muxer.service.AssetClassifier;
import com.example.motion_photo_muxer.service.metadata.CaptureMetadataCopier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;
import java.util.concurrent.TimeUnit;

/**
 * Decodes a convertible still by running an external codec (heif-convert by default) into a hidden
 * sibling, copies capture metadata, then renames the result to {@code <stem>.jpg}.
 */
public class ExternalStillConverter implements StillConverter {
    private static final Logger LOGGER = LoggerFactory.getLogger(ExternalStillConverter.class);
    private static final int LOG_SNIPPET_MAX = 2_000;
    static final String TARGET_EXTENSION = ".jpg";

    private final List<String> commandTemplate;
    private final long timeoutSeconds;
    private final boolean copyMetadata;
    private final CaptureMetadataCopier metadataCopier;

    public ExternalStillConverter(MuxerProperties.Converter properties, CaptureMetadataCopier metadataCopier) {
        this(properties.getCommand(), properties.getTimeoutSeconds(), properties.isCopyMetadata(), metadataCopier);
    }

    public ExternalStillConverter(List<String> commandTemplate, long timeoutSeconds, boolean copyMetadata,
                                  CaptureMetadataCopier metadataCopier) {
        this.commandTemplate = List.copyOf(commandTemplate);
        this.timeoutSeconds = timeoutSeconds;
        this.copyMetadata = copyMetadata;
        this.metadataCopier = metadataCopier;
    }

    @Override
    public ConversionResult convert(Path source) {
        String stem = AssetClassifier.stemOf(source);
        Path target = source.resolveSibling(stem + TARGET_EXTENSION);
        Path temp = source.resolveSibling("." + stem + ".converting" + TARGET_EXTENSION);
        LOGGER.info("Converting still to JPEG source={} target={}", source, target);

        if (!Files.isRegularFile(source) || !Files.isReadable(source)) {
            return fail(source, "source missing or unreadable");
        }
        if (Files.exists(target)) {
            return fail(source, "target already exists: " + target);
        }

        try {
            Files.deleteIfExists(temp);
            ProcessResult result = runProcess(buildCommand(source, temp), timeoutSeconds);
            if (result.timedOut()) {
                return fail(source, "converter timeout after " + timeoutSeconds + "s");
            }
            if (result.code() != 0) {
                return fail(source, "converter exit=" + result.code() + " log=" + truncateLog(result.output()));
            }
            if (!Files.isRegularFile(temp) || Files.size(temp) == 0) {
                return fail(source, "converter produced no output");
            }

            boolean metadataCopied = copyMetadata && metadataCopier.copy(source, temp);
            Files.move(temp, target);
            LOGGER.info("Still converted to JPEG target={} metadataCopied={}", target, metadataCopied);
            return ConversionResult.success(source, target, metadataCopied);
        } catch (IOException e) {
            return fail(source, e.toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return fail(source, "interrupted");
        } finally {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException e) {
                LOGGER.warn("Could not remove partial conversion path={} err={}", temp, e.toString());
            }
        }
    }

    List<String> buildCommand(Path input, Path output) {
        List<String> cmd = new ArrayList<>(commandTemplate.size());
        for (String part : commandTemplate) {
            cmd.add(part.replace("{input}", input.toAbsolutePath().toString())
                    .replace("{output}", output.toAbsolutePath().toString()));
        }
        return cmd;
    }

    protected ProcessResult runProcess(List<String> cmd, long timeoutSeconds) throws IOException, InterruptedException {
        Process p = new ProcessBuilder(cmd).redirectErrorStream(true).start();
        StringJoiner joiner = new StringJoiner(System.lineSeparator());
        Thread reader = new Thread(() -> {
            try (BufferedReader br = new BufferedReader(new InputStreamReader(p.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = br.readLine()) != null) {
                    joiner.add(line);
                }
            } catch (IOException e) {
                LOGGER.debug("Converter output stream closed err={}", e.toString());
            }
        }, "still-converter-log");
        reader.start();
        boolean finished = p.waitFor(timeoutSeconds, TimeUnit.SECONDS);
        if (!finished) {
            p.destroyForcibly();
            p.waitFor(5, TimeUnit.SECONDS);
        }
        reader.join();
        int code = finished ? p.exitValue() : -1;
        return new ProcessResult(code, joiner.toString(), !finished);
    }

    private ConversionResult fail(Path source, String reason) {
        LOGGER.warn("Still conversion failed source={} reason={}", source, reason);
        return ConversionResult.failed(source, reason);
    }

    private String truncateLog(String output) {
        if (output == null) {
            return "";
        }
        return output.length() <= LOG_SNIPPET_MAX ? output : output.substring(output.length() - LOG_SNIPPET_MAX);
    }

    protected record ProcessResult(int code, String output, boolean timedOut) { }
}
