package com.example.motion_photo_muxer.service;

import com.example.motion_photo_muxer.config.MuxerProperties;
import com.example.motion_photo_muxer.engine.Interfaces.MetadataWriter;
import com.example.motion_photo_muxer.engine.Interfaces.StillConverter;
import com.example.motion_photo_muxer.exception.InvalidRootException;
import com.example.motion_photo_muxer.model.ConversionResult;
import com.example.motion_photo_muxer.model.FileActionReport;
import com.example.motion_photo_muxer.model.MatchedPair;
import com.example.motion_photo_muxer.model.MediaAsset;
import com.example.motion_photo_muxer.model.MetadataWriteResult;
import com.example.motion_photo_muxer.model.MuxResult;
import com.example.motion_photo_muxer.model.RunSummary;
import com.example.motion_photo_muxer.util.AssetKind;
import com.example.motion_photo_muxer.util.FailureKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Drives one run: match and mux, then relocate leftovers, then delete originals. The passes never
 * overlap and each sees the ledger left by the previous one.
 */
@Service
public class MotionPhotoPipeline {
    private static final Logger LOGGER = LoggerFactory.getLogger(MotionPhotoPipeline.class);

    private final AssetClassifier classifier;
    private final DirectoryWalker walker;
    private final VideoMatcher matcher;
    private final StillConverter stillConverter;
    private final MotionPhotoMuxer muxer;
    private final MetadataWriter metadataWriter;
    private final LeftoverRelocator relocator;
    private final OriginalsCleanupService cleanupService;
    private final RunReportWriter reportWriter;

    public MotionPhotoPipeline(AssetClassifier classifier, DirectoryWalker walker, VideoMatcher matcher,
                               StillConverter stillConverter, MotionPhotoMuxer muxer, MetadataWriter metadataWriter,
                               LeftoverRelocator relocator, OriginalsCleanupService cleanupService,
                               RunReportWriter reportWriter) {
        this.classifier = classifier;
        this.walker = walker;
        this.matcher = matcher;
        this.stillConverter = stillConverter;
        this.muxer = muxer;
        this.metadataWriter = metadataWriter;
        this.relocator = relocator;
        this.cleanupService = cleanupService;
        this.reportWriter = reportWriter;
    }

    public RunSummary run(MuxerProperties options) {
        return run(options, new RunLedger());
    }

    /**
     * Runs all passes against a fresh ledger. Only root problems throw; per-file failures are counted.
     *
     * @throws InvalidRootException when the input root is unusable or the output root cannot be prepared.
     */
    public RunSummary run(MuxerProperties options, RunLedger ledger) {
        Path inputRoot = validateInputRoot(options.getInputDir());
        Path outputRoot = prepareOutputRoot(options.getOutputDir(), inputRoot);
        LOGGER.info("Processing files in: {} output={}", inputRoot, outputRoot);

        List<Path> files = walker.listFiles(inputRoot, outputRoot);
        Map<String, Path> videosByStem = matcher.indexVideos(files);
        UnaryOperator<Path> targetResolver = options.isUniqueOutputNames() ? ledger::reserveTarget : UnaryOperator.identity();
        for (Path file : files) {
            MediaAsset asset = classifier.describe(file);
            if (asset.kind() == AssetKind.STILL) {
                matcher.findVideo(asset.stem(), videosByStem)
                        .ifPresent(video -> muxPair(asset, asset.path(), video, outputRoot, targetResolver, ledger));
            } else if (asset.kind() == AssetKind.CONVERTIBLE_STILL) {
                processConvertible(asset, videosByStem, outputRoot, targetResolver, ledger, options.isConvertAllConvertibleStills());
            }
        }
        LOGGER.info("Conversion complete. matchingPairsFound={}", ledger.matchingPairsFound());

        FileActionReport relocated = FileActionReport.none();
        if (options.isMoveOtherFiles()) {
            relocated = relocator.relocateUnmatched(inputRoot, outputRoot, options.getOtherFilesDir(), ledger,
                    options.isDeleteConvertedOriginalsWithoutMatch());
        }

        FileActionReport deleted = FileActionReport.none();
        if (options.isDeletePairedOriginals()) {
            deleted = deleted.plus(cleanupService.deletePaired(ledger));
        }
        if (options.isDeleteConvertedOriginalsWithoutMatch()) {
            deleted = deleted.plus(cleanupService.deleteConvertedUnmatched(ledger));
        }
        LOGGER.info("Cleanup complete.");

        Path report = reportWriter.writeProblematicReport(outputRoot, options.getReportFileName(), ledger.problematic());
        RunSummary summary = new RunSummary(
                inputRoot,
                outputRoot,
                ledger.matchingPairsFound(),
                ledger.convertedUnmatched().size(),
                ledger.problematic().size(),
                ledger.failureCount(FailureKind.VALIDATION),
                ledger.failureCount(FailureKind.IO),
                relocated.succeeded(),
                relocated.failed(),
                deleted.succeeded(),
                deleted.failed(),
                ledger.containers(),
                report);
        if (options.isWriteSummary()) {
            reportWriter.writeSummary(outputRoot, options.getSummaryFileName(), summary);
        }
        logSummary(summary);
        return summary;
    }

    private void processConvertible(MediaAsset asset, Map<String, Path> videosByStem, Path outputRoot,
                                    UnaryOperator<Path> targetResolver, RunLedger ledger, boolean convertAll) {
        Optional<Path> video = matcher.findVideo(asset.stem(), videosByStem);
        if (video.isEmpty() && !convertAll) {
            LOGGER.debug("No video for convertible still={}, left as is", asset.path());
            return;
        }
        ConversionResult conversion = stillConverter.convert(asset.path());
        if (!conversion.isSuccess()) {
            ledger.recordProblematic(asset.path());
            ledger.recordFailure(FailureKind.CONVERSION);
            return;
        }
        MediaAsset converted = asset.withPath(conversion.converted(), AssetKind.STILL);
        if (video.isPresent()) {
            muxPair(converted, asset.path(), video.get(), outputRoot, targetResolver, ledger);
        } else {
            ledger.recordConvertedUnmatched(asset.path());
        }
    }

    private void muxPair(MediaAsset still, Path original, Path videoPath, Path outputRoot,
                         UnaryOperator<Path> targetResolver, RunLedger ledger) {
        if (ledger.isPaired(videoPath)) {
            LOGGER.warn("Video {} already merged with another still, reusing it for {}", videoPath, original);
        }
        MatchedPair pair = new MatchedPair(still, classifier.describe(videoPath), outputRoot);
        MuxResult mux = muxer.mux(pair.still().path(), pair.video().path(), pair.outputDir(), targetResolver);
        if (!mux.isSuccess()) {
            ledger.recordFailure(mux.failure());
            return;
        }
        MetadataWriteResult metadata = metadataWriter.write(mux.containerPath(), mux.offset());
        if (!metadata.written()) {
            LOGGER.warn("Discarding untagged container={} reason={}", mux.containerPath(), metadata.error());
            discard(mux.containerPath());
            ledger.recordFailure(FailureKind.IO);
            return;
        }
        ledger.recordPaired(original, videoPath);
        if (!original.equals(still.path())) {
            ledger.recordPaired(still.path(), videoPath);
        }
        ledger.recordContainer(mux.containerPath());
    }

    private Path validateInputRoot(String inputDir) {
        if (inputDir == null || inputDir.isBlank()) {
            throw new InvalidRootException(Path.of(""), "Input directory not configured");
        }
        Path root = Path.of(inputDir.trim()).toAbsolutePath().normalize();
        if (!Files.exists(root)) {
            LOGGER.error("Path doesn't exist: {}", root);
            throw new InvalidRootException(root, "Path doesn't exist");
        }
        if (!Files.isDirectory(root)) {
            LOGGER.error("Path is not a directory: {}", root);
            throw new InvalidRootException(root, "Path is not a directory");
        }
        return root;
    }

    private Path prepareOutputRoot(String outputDir, Path inputRoot) {
        Path root = Path.of(outputDir == null || outputDir.isBlank() ? "output" : outputDir.trim()).toAbsolutePath().normalize();
        if (root.equals(inputRoot)) {
            throw new InvalidRootException(root, "Output directory must differ from the input directory");
        }
        if (Files.exists(root) && !Files.isDirectory(root)) {
            throw new InvalidRootException(root, "Output path is not a directory");
        }
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new InvalidRootException(root, "Cannot create output directory", e);
        }
        return root;
    }

    private void discard(Path container) {
        try {
            Files.deleteIfExists(container);
        } catch (IOException e) {
            LOGGER.warn("Could not remove container={} err={}", container, e.toString());
        }
    }

    private void logSummary(RunSummary summary) {
        LOGGER.info("Run finished pairs={} convertedUnmatched={} relocated={} deleted={}",
                summary.matchingPairsFound(), summary.convertedUnmatched(), summary.relocated(), summary.deleted());
        if (summary.hasFailures()) {
            LOGGER.warn("Run finished with failures problematic={} validation={} mux={} relocation={} deletion={} report={}",
                    summary.problematic(), summary.validationFailures(), summary.muxFailures(),
                    summary.relocationFailures(), summary.deletionFailures(), summary.reportFile());
        }
    }
}
