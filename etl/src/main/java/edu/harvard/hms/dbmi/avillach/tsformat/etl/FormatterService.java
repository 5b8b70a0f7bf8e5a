package edu.harvard.hms.dbmi.avillach.tsformat.etl;

import edu.harvard.hms.dbmi.avillach.tsformat.data.dataset.Dataset;
import edu.harvard.hms.dbmi.avillach.tsformat.etl.config.FormatterConfig;
import edu.harvard.hms.dbmi.avillach.tsformat.etl.io.DatasetDescriptorLoader;
import edu.harvard.hms.dbmi.avillach.tsformat.etl.io.DatasetWriter;
import edu.harvard.hms.dbmi.avillach.tsformat.etl.timeseries.TimeSeriesFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;

@Service
public class FormatterService {

    private static final Logger log = LoggerFactory.getLogger(FormatterService.class);

    private final FormatterConfig config;
    private final DatasetDescriptorLoader loader;
    private final TimeSeriesFormatter formatter;
    private final DatasetWriter writer;

    public FormatterService(FormatterConfig config, DatasetDescriptorLoader loader, TimeSeriesFormatter formatter, DatasetWriter writer) {
        this.config = config;
        this.loader = loader;
        this.formatter = formatter;
        this.writer = writer;
    }

    public Path run() throws IOException {
        log.info("Starting time series formatting of {}", config.getDatasetDoc());
        long startTime = System.nanoTime();

        Dataset inputs = loader.load(Path.of(config.getDatasetDoc()));
        Dataset output;
        try {
            output = formatter.produce(inputs, config.toHyperparams());
        } catch (RuntimeException e) {
            log.error("Time series formatting of {} failed", config.getDatasetDoc(), e);
            throw e;
        }

        String datasetId = config.getOutputDatasetId() != null ? config.getOutputDatasetId() : outputDatasetId(config.getDatasetDoc());
        Path descriptor = writer.write(output, datasetId, Path.of(config.getOutputDir()));
        log.info("Time series formatting completed in {} ms, output at {}", (System.nanoTime() - startTime) / 1_000_000, descriptor);
        return descriptor;
    }

    private static String outputDatasetId(String datasetDoc) {
        Path parent = Path.of(datasetDoc).toAbsolutePath().getParent();
        String source = parent == null || parent.getFileName() == null ? "dataset" : parent.getFileName().toString();
        return source + "_timeseries";
    }
}
