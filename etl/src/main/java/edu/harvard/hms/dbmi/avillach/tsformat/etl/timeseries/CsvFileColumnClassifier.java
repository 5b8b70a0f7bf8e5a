package edu.harvard.hms.dbmi.avillach.tsformat.etl.timeseries;

import edu.harvard.hms.dbmi.avillach.tsformat.data.dataset.ColumnMetadata;
import edu.harvard.hms.dbmi.avillach.tsformat.data.dataset.DatasetMetadata;
import edu.harvard.hms.dbmi.avillach.tsformat.data.dataset.ForeignKey;
import edu.harvard.hms.dbmi.avillach.tsformat.data.dataset.SemanticTypes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Decides whether a column holds the names of csv time series files.
 *
 * The tags that say "this is a csv time series file" are not on the file name column itself but on the column its foreign key
 * points to, so the check is two hops: the column must be textual and carry a foreign key, and the referenced column must be
 * textual, carry one of {@link SemanticTypes#TIMESERIES_FILE_TYPES} and all of {@link SemanticTypes#TIMESERIES_MEDIA_TYPES}.
 */
public class CsvFileColumnClassifier {

    private static final Logger log = LoggerFactory.getLogger(CsvFileColumnClassifier.class);

    private final DatasetMetadata metadata;

    public CsvFileColumnClassifier(DatasetMetadata metadata) {
        this.metadata = metadata;
    }

    public boolean isFileReferenceColumn(String resourceId, int columnIndex) {
        Optional<ColumnMetadata> column = metadata.query(resourceId, columnIndex);
        if (column.isEmpty() || !column.get().structuralType().isTextual()) {
            log.debug("Column {} of resource {} is missing or not textual", columnIndex, resourceId);
            return false;
        }

        Optional<ForeignKey> foreignKey = column.get().getForeignKey();
        if (foreignKey.isEmpty()) {
            log.debug("Column {} of resource {} has no foreign key", columnIndex, resourceId);
            return false;
        }

        return isCsvFileReference(foreignKey.get().resourceId(), foreignKey.get().columnIndex());
    }

    private boolean isCsvFileReference(String resourceId, int columnIndex) {
        Optional<ColumnMetadata> maybeColumn = metadata.query(resourceId, columnIndex);
        if (maybeColumn.isEmpty() || !maybeColumn.get().structuralType().isTextual()) {
            return false;
        }

        ColumnMetadata column = maybeColumn.get();
        return column.hasAnySemanticType(SemanticTypes.TIMESERIES_FILE_TYPES)
            && column.mediaTypes().containsAll(SemanticTypes.TIMESERIES_MEDIA_TYPES);
    }
}
