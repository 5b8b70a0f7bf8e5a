package edu.harvard.hms.dbmi.avillach.tsformat.etl.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import edu.harvard.hms.dbmi.avillach.tsformat.data.dataset.ColumnMetadata;
import edu.harvard.hms.dbmi.avillach.tsformat.data.dataset.Dataset;
import edu.harvard.hms.dbmi.avillach.tsformat.data.dataset.Table;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Writes a dataset to a directory as {@code tables/<resId>.csv} files plus a {@value #DESCRIPTOR_FILE_NAME} describing them.
 */
public class DatasetWriter {

    private static final Logger log = LoggerFactory.getLogger(DatasetWriter.class);

    public static final String DESCRIPTOR_FILE_NAME = "datasetDoc.json";
    private static final String TABLES_DIR = "tables";

    private final ObjectMapper objectMapper;

    public DatasetWriter() {
        this(new ObjectMapper());
    }

    public DatasetWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @return path of the written descriptor
     */
    public Path write(Dataset dataset, String datasetId, Path outputDir) throws IOException {
        Path tablesDir = Files.createDirectories(outputDir.resolve(TABLES_DIR));

        List<DatasetDescriptor.Resource> resources = new ArrayList<>();
        for (Map.Entry<String, Table> entry : dataset.getResources().entrySet()) {
            String fileName = entry.getKey() + ".csv";
            writeTable(entry.getValue(), tablesDir.resolve(fileName));
            List<DatasetDescriptor.Column> columns = dataset.getMetadata().getColumns(entry.getKey()).stream()
                .map(DatasetWriter::toColumn)
                .collect(Collectors.toList());
            resources.add(new DatasetDescriptor.Resource(entry.getKey(), TABLES_DIR + "/" + fileName, columns));
        }

        Path descriptorFile = outputDir.resolve(DESCRIPTOR_FILE_NAME);
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(descriptorFile.toFile(), new DatasetDescriptor(datasetId, resources));
        log.info("Wrote dataset {} with {} resources to {}", datasetId, resources.size(), outputDir);
        return descriptorFile;
    }

    private void writeTable(Table table, Path file) throws IOException {
        try (BufferedWriter out = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             CSVPrinter printer = CSVFormat.DEFAULT.print(out)) {
            printer.printRecord(table.getColumnNames());
            printer.printRecords(table.getRows());
        }
        log.debug("Wrote {} rows to {}", table.rowCount(), file);
    }

    private static DatasetDescriptor.Column toColumn(ColumnMetadata column) {
        return new DatasetDescriptor.Column(
            column.name(), column.structuralType(), List.copyOf(column.semanticTypes()), List.copyOf(column.mediaTypes()),
            column.foreignKey(), column.locationBaseUris()
        );
    }
}
