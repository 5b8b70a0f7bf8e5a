package edu.harvard.hms.dbmi.avillach.tsformat.data.dataset;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

import java.util.Map;
import java.util.Optional;

/**
 * An ordered collection of named resources together with their column metadata. Datasets are never modified; transforms build new
 * ones.
 */
public class Dataset {

    private final ImmutableMap<String, Table> resources;
    private final DatasetMetadata metadata;

    public Dataset(Map<String, Table> resources, DatasetMetadata metadata) {
        this.resources = ImmutableMap.copyOf(resources);
        this.metadata = Preconditions.checkNotNull(metadata, "metadata");
    }

    public Optional<Table> getResource(String resourceId) {
        return Optional.ofNullable(resources.get(resourceId));
    }

    public ImmutableMap<String, Table> getResources() {
        return resources;
    }

    public DatasetMetadata getMetadata() {
        return metadata;
    }

    @Override
    public String toString() {
        return "Dataset{resources=" + resources + "}";
    }
}
