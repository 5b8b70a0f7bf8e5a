package edu.harvard.hms.dbmi.avillach.tsformat.etl.timeseries;

import edu.harvard.hms.dbmi.avillach.tsformat.data.dataset.Dataset;
import edu.harvard.hms.dbmi.avillach.tsformat.data.dataset.DatasetMetadata;
import edu.harvard.hms.dbmi.avillach.tsformat.data.dataset.Table;
import edu.harvard.hms.dbmi.avillach.tsformat.exception.FormatterConfigurationException;
import edu.harvard.hms.dbmi.avillach.tsformat.exception.SeriesLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the time series files referenced from a column of a dataset resource into a new M x N resource, where each value of a
 * series occupies one of the M rows. Each row has N columns, the union of the main resource columns, {@code series_id} and the
 * fields found in the time series files. All series files are assumed to share the same set of timestamps.
 */
public class TimeSeriesFormatter {

    private static final Logger log = LoggerFactory.getLogger(TimeSeriesFormatter.class);

    private final SeriesFileReader reader;
    private final OutputAssembler outputAssembler;

    public TimeSeriesFormatter() {
        this(new CsvSeriesFileReader());
    }

    public TimeSeriesFormatter(SeriesFileReader reader) {
        this(reader, new OutputAssembler());
    }

    public TimeSeriesFormatter(SeriesFileReader reader, OutputAssembler outputAssembler) {
        this.reader = reader;
        this.outputAssembler = outputAssembler;
    }

    /**
     * @throws FormatterConfigurationException if no main resource or csv file name column can be established
     * @throws SeriesLoadException if any referenced series file cannot be loaded
     */
    public Dataset produce(Dataset inputs, FormatterHyperparams hyperparams) {
        String mainResourceId = hyperparams.mainResourceIndex();
        if (mainResourceId == null) {
            throw new FormatterConfigurationException("no main resource specified");
        }
        Table mainResource = inputs.getResource(mainResourceId)
            .orElseThrow(() -> new FormatterConfigurationException("main resource " + mainResourceId + " not found in dataset"));

        DatasetMetadata metadata = inputs.getMetadata();
        int fileColumn = resolveFileColumn(metadata, mainResourceId, hyperparams.fileColIndex());
        if (fileColumn >= mainResource.columnCount()) {
            throw new FormatterConfigurationException(
                "column idx=" + fileColumn + " is outside the " + mainResource.columnCount() + " columns of resource " + mainResourceId
            );
        }

        BasePathResolver basePathResolver = new BasePathResolver(metadata);
        String basePath = basePathResolver.resolveBasePath(mainResourceId, fileColumn);
        log.info(
            "Formatting resource {} using file column {}, files referenced through resource {} under {}", mainResourceId, fileColumn,
            basePathResolver.referencedResource(mainResourceId, fileColumn), basePath
        );

        Table longForm = new SeriesJoinEngine(reader, hyperparams.readThreads()).buildLongForm(mainResource, fileColumn, basePath);
        return outputAssembler.assemble(longForm);
    }

    private int resolveFileColumn(DatasetMetadata metadata, String mainResourceId, Integer fileColIndex) {
        CsvFileColumnClassifier classifier = new CsvFileColumnClassifier(metadata);
        if (fileColIndex != null) {
            if (!classifier.isFileReferenceColumn(mainResourceId, fileColIndex)) {
                throw new FormatterConfigurationException(
                    "column idx=" + fileColIndex + " from resource " + mainResourceId + " does not contain csv file names"
                );
            }
            return fileColIndex;
        }
        return new FileColumnFinder(metadata, classifier).findFileColumn(mainResourceId)
            .orElseThrow(() -> new FormatterConfigurationException("no column from resource " + mainResourceId + " contains csv file names"));
    }
}
