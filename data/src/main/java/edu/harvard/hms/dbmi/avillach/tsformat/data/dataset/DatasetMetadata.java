package edu.harvard.hms.dbmi.avillach.tsformat.data.dataset;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * Column level metadata of every resource of a dataset, keyed by resource id and column index.
 */
public class DatasetMetadata {

    private final ImmutableMap<String, ImmutableList<ColumnMetadata>> columnsByResource;

    private DatasetMetadata(Map<String, ImmutableList<ColumnMetadata>> columnsByResource) {
        this.columnsByResource = ImmutableMap.copyOf(columnsByResource);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<ColumnMetadata> query(String resourceId, int columnIndex) {
        ImmutableList<ColumnMetadata> columns = columnsByResource.get(resourceId);
        if (columns == null || columnIndex < 0 || columnIndex >= columns.size()) {
            return Optional.empty();
        }
        return Optional.of(columns.get(columnIndex));
    }

    /**
     * Lists, in column order, the indices of the columns of a resource that carry at least one of the given semantic types.
     */
    public List<Integer> listColumnsWithSemanticTypes(String resourceId, Collection<String> semanticTypes) {
        List<ColumnMetadata> columns = getColumns(resourceId);
        return IntStream.range(0, columns.size())
            .filter(i -> columns.get(i).hasAnySemanticType(semanticTypes))
            .boxed()
            .collect(ImmutableList.toImmutableList());
    }

    public ImmutableList<ColumnMetadata> getColumns(String resourceId) {
        return columnsByResource.getOrDefault(resourceId, ImmutableList.of());
    }

    public int columnCount(String resourceId) {
        return getColumns(resourceId).size();
    }

    public Set<String> getResourceIds() {
        return columnsByResource.keySet();
    }

    public static class Builder {
        private final Map<String, ImmutableList<ColumnMetadata>> columnsByResource = new LinkedHashMap<>();

        public Builder addResource(String resourceId, List<ColumnMetadata> columns) {
            columnsByResource.put(resourceId, ImmutableList.copyOf(columns));
            return this;
        }

        public DatasetMetadata build() {
            return new DatasetMetadata(columnsByResource);
        }
    }
}
