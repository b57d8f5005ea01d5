package com.example.motion_photo_muxer.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Run options for a single muxing invocation.
 */
@Validated
@ConfigurationProperties(prefix = "muxer")
public class MuxerProperties {
    private String inputDir;
    @NotBlank
    private String outputDir = "output";
    private boolean moveOtherFiles = false;
    private boolean convertAllConvertibleStills = false;
    private boolean deleteConvertedOriginalsWithoutMatch = false;
    private boolean deletePairedOriginals = false;

    @NotBlank
    private String otherFilesDir = "other_files";
    @NotBlank
    private String reportFileName = "problematic_files.txt";
    private boolean writeSummary = false;
    @NotBlank
    private String summaryFileName = "run_summary.json";
    private boolean uniqueOutputNames = true;
    private boolean interactive = true;

    @Valid
    private Converter converter = new Converter();

    public String getInputDir() { return inputDir; }
    public void setInputDir(String inputDir) { this.inputDir = inputDir; }

    public String getOutputDir() { return outputDir; }
    public void setOutputDir(String outputDir) { this.outputDir = outputDir; }

    public boolean isMoveOtherFiles() { return moveOtherFiles; }
    public void setMoveOtherFiles(boolean moveOtherFiles) { this.moveOtherFiles = moveOtherFiles; }

    public boolean isConvertAllConvertibleStills() { return convertAllConvertibleStills; }
    public void setConvertAllConvertibleStills(boolean convertAllConvertibleStills) {
        this.convertAllConvertibleStills = convertAllConvertibleStills;
    }

    public boolean isDeleteConvertedOriginalsWithoutMatch() { return deleteConvertedOriginalsWithoutMatch; }
    public void setDeleteConvertedOriginalsWithoutMatch(boolean deleteConvertedOriginalsWithoutMatch) {
        this.deleteConvertedOriginalsWithoutMatch = deleteConvertedOriginalsWithoutMatch;
    }

    public boolean isDeletePairedOriginals() { return deletePairedOriginals; }
    public void setDeletePairedOriginals(boolean deletePairedOriginals) { this.deletePairedOriginals = deletePairedOriginals; }

    public String getOtherFilesDir() { return otherFilesDir; }
    public void setOtherFilesDir(String otherFilesDir) { this.otherFilesDir = otherFilesDir; }

    public String getReportFileName() { return reportFileName; }
    public void setReportFileName(String reportFileName) { this.reportFileName = reportFileName; }

    public boolean isWriteSummary() { return writeSummary; }
    public void setWriteSummary(boolean writeSummary) { this.writeSummary = writeSummary; }

    public String getSummaryFileName() { return summaryFileName; }
    public void setSummaryFileName(String summaryFileName) { this.summaryFileName = summaryFileName; }

    public boolean isUniqueOutputNames() { return uniqueOutputNames; }
    public void setUniqueOutputNames(boolean uniqueOutputNames) { this.uniqueOutputNames = uniqueOutputNames; }

    public boolean isInteractive() { return interactive; }
    public void setInteractive(boolean interactive) { this.interactive = interactive; }

    public Converter getConverter() { return converter; }
    public void setConverter(Converter converter) { this.converter = converter; }

    /**
     * External codec invocation. {@code {input}} and {@code {output}} in the command are replaced with
     * absolute paths.
     */
    public static class Converter {
        @NotEmpty
        private List<String> command = new ArrayList<>(List.of("heif-convert", "-q", "92", "{input}", "{output}"));
        @Min(1)
        private long timeoutSeconds = 120;
        private boolean copyMetadata = true;

        public List<String> getCommand() { return command; }
        public void setCommand(List<String> command) { this.command = command; }

        public long getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(long timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }

        public boolean isCopyMetadata() { return copyMetadata; }
        public void setCopyMetadata(boolean copyMetadata) { this.copyMetadata = copyMetadata; }
    }
}
