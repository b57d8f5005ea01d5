package com.example.motion_photo_muxer.service;

import com.example.motion_photo_muxer.config.MuxerProperties;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Locale;

/**
 * Asks for the run options that were not configured, the way the command-line tool always did.
 */
public class InteractivePrompter {
    private final BufferedReader in;
    private final PrintStream out;
    private final boolean available;

    public InteractivePrompter(BufferedReader in, PrintStream out, boolean available) {
        this.in = in;
        this.out = out;
        this.available = available;
    }

    public boolean isAvailable() {
        return available;
    }

    public void fillMissing(MuxerProperties properties) throws IOException {
        String input = ask("Enter the directory path containing HEIC/JPEG/MOV/MP4 files: ");
        properties.setInputDir(input);

        String output = ask("Enter the output directory path (default is '" + properties.getOutputDir() + "'): ");
        if (!output.isEmpty()) {
            properties.setOutputDir(output);
        }

        properties.setMoveOtherFiles(askYesNo("Move other files to output directory?", properties.isMoveOtherFiles()));
        properties.setConvertAllConvertibleStills(askYesNo("Convert HEIC files without a matching video?", properties.isConvertAllConvertibleStills()));
        properties.setDeletePairedOriginals(askYesNo("Delete originals that were merged?", properties.isDeletePairedOriginals()));
        properties.setDeleteConvertedOriginalsWithoutMatch(askYesNo("Delete converted HEIC originals without a match?",
                properties.isDeleteConvertedOriginalsWithoutMatch()));
    }

    private boolean askYesNo(String question, boolean defaultValue) throws IOException {
        String answer = ask(question + " (y/n, default is '" + (defaultValue ? "y" : "n") + "'): ").toLowerCase(Locale.ROOT);
        if (answer.isEmpty()) {
            return defaultValue;
        }
        return answer.equals("y") || answer.equals("yes");
    }

    private String ask(String prompt) throws IOException {
        out.print(prompt);
        out.flush();
        String line = in.readLine();
        return line == null ? "" : line.trim();
    }
}
