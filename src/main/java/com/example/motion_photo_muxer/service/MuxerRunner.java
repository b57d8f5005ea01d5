package com.example.motion_photo_muxer.service;

import com.example.motion_photo_muxer.config.MuxerProperties;
import com.example.motion_photo_muxer.exception.InvalidRootException;
import com.example.motion_photo_muxer.model.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Process entry: one run per invocation. Exit code 1 when a root is unusable, 0 otherwise.
 */
@Component
public class MuxerRunner implements ApplicationRunner, ExitCodeGenerator {
    private static final Logger LOGGER = LoggerFactory.getLogger(MuxerRunner.class);

    private final MuxerProperties properties;
    private final MotionPhotoPipeline pipeline;
    private final InteractivePrompter prompter;
    private int exitCode;
    private RunSummary lastSummary;

    public MuxerRunner(MuxerProperties properties, MotionPhotoPipeline pipeline, InteractivePrompter prompter) {
        this.properties = properties;
        this.pipeline = pipeline;
        this.prompter = prompter;
    }

    @Override
    public void run(ApplicationArguments args) throws IOException {
        LOGGER.info("Welcome to the Apple Live Photos to Google Motion Photos converter.");
        if ((properties.getInputDir() == null || properties.getInputDir().isBlank())
                && properties.isInteractive() && prompter.isAvailable()) {
            prompter.fillMissing(properties);
        }
        try {
            lastSummary = pipeline.run(properties);
            exitCode = 0;
        } catch (InvalidRootException e) {
            LOGGER.error("Invalid directory path: {}", e.getMessage());
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    public RunSummary getLastSummary() {
        return lastSummary;
    }
}
