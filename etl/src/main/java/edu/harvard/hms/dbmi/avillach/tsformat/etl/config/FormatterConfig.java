package edu.harvard.hms.dbmi.avillach.tsformat.etl.config;

import edu.harvard.hms.dbmi.avillach.tsformat.etl.timeseries.FormatterHyperparams;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the time series formatter, bound from the "formatter.*" prefix.
 *
 * Validated on startup; the application refuses to run with a missing descriptor or an unusable output directory.
 */
@ConfigurationProperties(prefix = "formatter")
public class FormatterConfig {
    private static final Logger log = LoggerFactory.getLogger(FormatterConfig.class);

    // Required properties
    private String datasetDoc;
    private String outputDir;

    // Optional properties with defaults
    private String mainResourceIndex = FormatterHyperparams.DEFAULT_MAIN_RESOURCE_INDEX;
    private Integer fileColIndex; // null = use the first csv file name column found
    private int readThreads = 1;
    private String outputDatasetId;

    @PostConstruct
    public void validateAndLog() {
        log.info("=== VALIDATING CONFIGURATION ===");
        List<String> errors = new ArrayList<>();

        if (datasetDoc == null || datasetDoc.isBlank()) {
            errors.add("formatter.dataset-doc is required");
        } else if (!Files.isRegularFile(Path.of(datasetDoc))) {
            errors.add("Dataset descriptor not found: " + datasetDoc);
        }
        if (outputDir == null || outputDir.isBlank()) {
            errors.add("formatter.output-dir is required");
        }
        if (mainResourceIndex == null || mainResourceIndex.isBlank()) {
            errors.add("formatter.main-resource-index must not be blank");
        }
        if (fileColIndex != null && fileColIndex < 0) {
            errors.add("formatter.file-col-index must not be negative: " + fileColIndex);
        }
        if (readThreads < 1) {
            errors.add("formatter.read-threads must be at least 1: " + readThreads);
        }

        if (!errors.isEmpty()) {
            String errorMsg = "Configuration validation failed:\n  - " + String.join("\n  - ", errors);
            log.error(errorMsg);
            throw new IllegalStateException(errorMsg);
        }

        log.info("=== EFFECTIVE CONFIGURATION ===");
        log.info("Dataset descriptor: {}", datasetDoc);
        log.info("Output dir: {}", outputDir);
        log.info("Main resource: {}", mainResourceIndex);
        log.info("File column: {}", fileColIndex != null ? fileColIndex : "(first csv file name column)");
        log.info("Read threads: {}", readThreads);
        log.info("================================");
    }

    public FormatterHyperparams toHyperparams() {
        return new FormatterHyperparams(fileColIndex, mainResourceIndex, readThreads);
    }

    public String getDatasetDoc() {
        return datasetDoc;
    }

    public void setDatasetDoc(String datasetDoc) {
        this.datasetDoc = datasetDoc;
    }

    public String getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(String outputDir) {
        this.outputDir = outputDir;
    }

    public String getMainResourceIndex() {
        return mainResourceIndex;
    }

    public void setMainResourceIndex(String mainResourceIndex) {
        this.mainResourceIndex = mainResourceIndex;
    }

    public Integer getFileColIndex() {
        return fileColIndex;
    }

    public void setFileColIndex(Integer fileColIndex) {
        this.fileColIndex = fileColIndex;
    }

    public int getReadThreads() {
        return readThreads;
    }

    public void setReadThreads(int readThreads) {
        this.readThreads = readThreads;
    }

    public String getOutputDatasetId() {
        return outputDatasetId;
    }

    public void setOutputDatasetId(String outputDatasetId) {
        this.outputDatasetId = outputDatasetId;
    }
}
