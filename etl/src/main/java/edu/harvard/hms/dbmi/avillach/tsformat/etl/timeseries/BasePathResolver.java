package edu.harvard.hms.dbmi.avillach.tsformat.etl.timeseries;

import edu.harvard.hms.dbmi.avillach.tsformat.data.dataset.ColumnMetadata;
import edu.harvard.hms.dbmi.avillach.tsformat.data.dataset.DatasetMetadata;
import edu.harvard.hms.dbmi.avillach.tsformat.data.dataset.ForeignKey;
import edu.harvard.hms.dbmi.avillach.tsformat.exception.FormatterConfigurationException;

/**
 * Resolves where the files named by a file name column live, by following the column's foreign key to the referenced column and
 * reading its location base uris.
 */
public class BasePathResolver {

    private final DatasetMetadata metadata;

    public BasePathResolver(DatasetMetadata metadata) {
        this.metadata = metadata;
    }

    /**
     * @return the first location base uri declared on the column referenced by {@code columnIndex}
     * @throws FormatterConfigurationException if there is no foreign key or the referenced column declares no base location
     */
    public String resolveBasePath(String resourceId, int columnIndex) {
        ForeignKey foreignKey = foreignKey(resourceId, columnIndex);
        ColumnMetadata referenced = metadata.query(foreignKey.resourceId(), foreignKey.columnIndex())
            .orElseThrow(() -> new FormatterConfigurationException(
                "column idx=" + columnIndex + " of resource " + resourceId + " refers to unknown column idx=" + foreignKey.columnIndex()
                    + " of resource " + foreignKey.resourceId()
            ));
        if (referenced.locationBaseUris().isEmpty()) {
            throw new FormatterConfigurationException(
                "column idx=" + foreignKey.columnIndex() + " of resource " + foreignKey.resourceId() + " declares no location base uris"
            );
        }
        return referenced.locationBaseUris().get(0);
    }

    public String referencedResource(String resourceId, int columnIndex) {
        return foreignKey(resourceId, columnIndex).resourceId();
    }

    private ForeignKey foreignKey(String resourceId, int columnIndex) {
        ColumnMetadata column = metadata.query(resourceId, columnIndex)
            .orElseThrow(() -> new FormatterConfigurationException("column idx=" + columnIndex + " not found in resource " + resourceId));
        return column.getForeignKey()
            .orElseThrow(() -> new FormatterConfigurationException(
                "column idx=" + columnIndex + " of resource " + resourceId + " has no foreign key"
            ));
    }
}
