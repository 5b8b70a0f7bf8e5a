package edu.harvard.hms.dbmi.avillach.tsformat.etl.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import edu.harvard.hms.dbmi.avillach.tsformat.data.dataset.ColumnMetadata;
import edu.harvard.hms.dbmi.avillach.tsformat.data.dataset.Dataset;
import edu.harvard.hms.dbmi.avillach.tsformat.data.dataset.DatasetMetadata;
import edu.harvard.hms.dbmi.avillach.tsformat.data.dataset.StructuralType;
import edu.harvard.hms.dbmi.avillach.tsformat.data.dataset.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Loads a {@link Dataset} from a {@link DatasetDescriptor} json file.
 *
 * Resource paths and relative location base uris are resolved against the directory holding the descriptor. When a resource
 * declares no columns, they are taken from the csv header as untagged strings.
 */
public class DatasetDescriptorLoader {

    private static final Logger log = LoggerFactory.getLogger(DatasetDescriptorLoader.class);

    private static final Pattern URI_SCHEME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*:");

    private final ObjectMapper objectMapper;
    private final CsvTableReader tableReader;

    public DatasetDescriptorLoader() {
        this(new ObjectMapper(), new CsvTableReader());
    }

    public DatasetDescriptorLoader(ObjectMapper objectMapper, CsvTableReader tableReader) {
        this.objectMapper = objectMapper;
        this.tableReader = tableReader;
    }

    public Dataset load(Path descriptorFile) throws IOException {
        if (!Files.isRegularFile(descriptorFile)) {
            throw new IOException("Dataset descriptor not found: " + descriptorFile);
        }
        Path baseDir = descriptorFile.toAbsolutePath().getParent();
        DatasetDescriptor descriptor = objectMapper.readValue(descriptorFile.toFile(), DatasetDescriptor.class);
        log.info("Loading dataset {} with {} resources from {}", descriptor.datasetId(), descriptor.resources().size(), descriptorFile);

        Map<String, Table> resources = new LinkedHashMap<>();
        DatasetMetadata.Builder metadata = DatasetMetadata.builder();
        for (DatasetDescriptor.Resource resource : descriptor.resources()) {
            if (resource.resId() == null || resource.resId().isBlank()) {
                throw new IOException("Resource without resId in " + descriptorFile);
            }
            if (resources.containsKey(resource.resId())) {
                throw new IOException("Duplicate resource " + resource.resId() + " in " + descriptorFile);
            }

            List<ColumnMetadata> columns = resource.columns().stream()
                .map(column -> toColumnMetadata(column, baseDir))
                .collect(Collectors.toList());

            Table table;
            if (resource.path() == null) {
                table = Table.empty(columns.stream().map(ColumnMetadata::name).collect(Collectors.toList()));
            } else {
                table = tableReader.read(baseDir.resolve(resource.path()));
                if (columns.isEmpty()) {
                    columns = table.getColumnNames().stream()
                        .map(name -> ColumnMetadata.of(name, StructuralType.STRING))
                        .collect(Collectors.toList());
                } else if (columns.size() != table.columnCount()) {
                    throw new IOException(
                        "Resource " + resource.resId() + " declares " + columns.size() + " columns but " + resource.path() + " has "
                            + table.columnCount()
                    );
                }
            }
            log.info("Loaded resource {} with {} rows and {} columns", resource.resId(), table.rowCount(), table.columnCount());
            resources.put(resource.resId(), table);
            metadata.addResource(resource.resId(), columns);
        }
        return new Dataset(resources, metadata.build());
    }

    private ColumnMetadata toColumnMetadata(DatasetDescriptor.Column column, Path baseDir) {
        return ColumnMetadata.of(column.name(), column.structuralType())
            .withSemanticTypes(column.semanticTypes())
            .withMediaTypes(column.mediaTypes())
            .withForeignKey(column.foreignKey())
            .withLocationBaseUris(column.locationBaseUris().stream().map(uri -> resolveLocation(uri, baseDir)).collect(Collectors.toList()));
    }

    static String resolveLocation(String location, Path baseDir) {
        if (location.startsWith("/") || URI_SCHEME.matcher(location).find()) {
            return location;
        }
        String resolved = baseDir.resolve(location).normalize().toString();
        return location.endsWith("/") ? resolved + "/" : resolved;
    }
}
