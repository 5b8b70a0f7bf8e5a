package edu.harvard.hms.dbmi.avillach.tsformat.etl.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import edu.harvard.hms.dbmi.avillach.tsformat.data.dataset.ForeignKey;
import edu.harvard.hms.dbmi.avillach.tsformat.data.dataset.StructuralType;

import java.util.List;

/**
 * JSON form of a dataset: its resources, where their csv tables live relative to the descriptor, and the annotations of every
 * column. A resource without a path carries metadata only.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record DatasetDescriptor(String datasetId, List<Resource> resources) {

    public DatasetDescriptor {
        resources = resources == null ? List.of() : resources;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Resource(String resId, String path, List<Column> columns) {

        public Resource {
            columns = columns == null ? List.of() : columns;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Column(
        String name,
        StructuralType structuralType,
        List<String> semanticTypes,
        List<String> mediaTypes,
        ForeignKey foreignKey,
        List<String> locationBaseUris
    ) {

        public Column {
            structuralType = structuralType == null ? StructuralType.STRING : structuralType;
            semanticTypes = semanticTypes == null ? List.of() : semanticTypes;
            mediaTypes = mediaTypes == null ? List.of() : mediaTypes;
            locationBaseUris = locationBaseUris == null ? List.of() : locationBaseUris;
        }
    }
}
