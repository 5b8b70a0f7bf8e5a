package edu.harvard.hms.dbmi.avillach.tsformat.etl.timeseries;

import edu.harvard.hms.dbmi.avillach.tsformat.data.dataset.DatasetMetadata;
import edu.harvard.hms.dbmi.avillach.tsformat.data.dataset.SemanticTypes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Finds the csv file name column of a resource when none is configured. The first qualifying column wins; several qualifying
 * columns are not treated as an error.
 */
public class FileColumnFinder {

    private static final Logger log = LoggerFactory.getLogger(FileColumnFinder.class);

    private final DatasetMetadata metadata;
    private final CsvFileColumnClassifier classifier;

    public FileColumnFinder(DatasetMetadata metadata, CsvFileColumnClassifier classifier) {
        this.metadata = metadata;
        this.classifier = classifier;
    }

    public Optional<Integer> findFileColumn(String resourceId) {
        List<Integer> candidates = metadata.listColumnsWithSemanticTypes(resourceId, SemanticTypes.TIMESERIES_FILE_TYPES);
        log.debug("Candidate file name columns of resource {}: {}", resourceId, candidates);
        for (Integer candidate : candidates) {
            if (classifier.isFileReferenceColumn(resourceId, candidate)) {
                log.info("Using column {} of resource {} as the time series file column", candidate, resourceId);
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
