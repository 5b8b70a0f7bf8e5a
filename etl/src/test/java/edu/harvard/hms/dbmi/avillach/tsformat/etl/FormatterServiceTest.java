package edu.harvard.hms.dbmi.avillach.tsformat.etl;

import edu.harvard.hms.dbmi.avillach.tsformat.data.dataset.Dataset;
import edu.harvard.hms.dbmi.avillach.tsformat.data.dataset.Table;
import edu.harvard.hms.dbmi.avillach.tsformat.etl.config.FormatterConfig;
import edu.harvard.hms.dbmi.avillach.tsformat.etl.io.DatasetDescriptorLoader;
import edu.harvard.hms.dbmi.avillach.tsformat.etl.io.DatasetWriter;
import edu.harvard.hms.dbmi.avillach.tsformat.etl.timeseries.TimeSeriesFormatter;
import edu.harvard.hms.dbmi.avillach.tsformat.exception.SeriesLoadException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

class FormatterServiceTest {

    @Test
    void shouldFormatDatasetOnDisk(@TempDir Path testDir) throws IOException {
        Path datasetDoc = writeDataset(testDir.resolve("ts_dataset"), true);
        FormatterConfig config = config(datasetDoc, testDir.resolve("output"));

        Path descriptor = service(config).run();

        Dataset output = new DatasetDescriptorLoader().load(descriptor);
        Table longForm = output.getResource("0").orElseThrow();
        Assertions.assertEquals(6, longForm.rowCount());
        Assertions.assertEquals(List.of("d3mIndex", "file", "label", "series_id", "timestamp", "value"), longForm.getColumnNames());
        Assertions.assertEquals(List.of("1", "b.csv", "dog", "1", "2", "0.6"), longForm.getRow(5));
        Assertions.assertTrue(Files.readString(descriptor).contains("ts_dataset_timeseries"));
    }

    @Test
    void shouldNotWriteOutputWhenASeriesFileIsMissing(@TempDir Path testDir) throws IOException {
        Path datasetDoc = writeDataset(testDir.resolve("ts_dataset"), false);
        Path outputDir = testDir.resolve("output");
        FormatterConfig config = config(datasetDoc, outputDir);

        Assertions.assertThrows(SeriesLoadException.class, () -> service(config).run());
        Assertions.assertFalse(Files.exists(outputDir.resolve(DatasetWriter.DESCRIPTOR_FILE_NAME)));
    }

    private static FormatterService service(FormatterConfig config) {
        return new FormatterService(config, new DatasetDescriptorLoader(), new TimeSeriesFormatter(), new DatasetWriter());
    }

    private static FormatterConfig config(Path datasetDoc, Path outputDir) {
        FormatterConfig config = new FormatterConfig();
        config.setDatasetDoc(datasetDoc.toString());
        config.setOutputDir(outputDir.toString());
        config.setReadThreads(2);
        return config;
    }

    private static Path writeDataset(Path datasetDir, boolean withSecondSeries) throws IOException {
        Files.createDirectories(datasetDir.resolve("tables"));
        Files.createDirectories(datasetDir.resolve("timeseries"));
        Files.writeString(datasetDir.resolve("tables/learningData.csv"), "d3mIndex,file,label\n0,a.csv,cat\n1,b.csv,dog\n");
        Files.writeString(datasetDir.resolve("timeseries/a.csv"), "timestamp,value\n0,0.1\n1,0.2\n2,0.3\n");
        if (withSecondSeries) {
            Files.writeString(datasetDir.resolve("timeseries/b.csv"), "timestamp,value\n0,0.4\n1,0.5\n2,0.6\n");
        }
        Path datasetDoc = datasetDir.resolve("datasetDoc.json");
        Files.writeString(datasetDoc, """
            {
              "datasetId": "ts_dataset",
              "resources": [
                {"resId": "0", "columns": [
                  {"name": "filename", "structuralType": "STRING",
                   "semanticTypes": ["https://metadata.datadrivendiscovery.org/types/FileName",
                                     "https://metadata.datadrivendiscovery.org/types/Timeseries"],
                   "mediaTypes": ["text/csv"],
                   "locationBaseUris": ["timeseries/"]}
                ]},
                {"resId": "1", "path": "tables/learningData.csv", "columns": [
                  {"name": "d3mIndex", "structuralType": "INTEGER"},
                  {"name": "file", "structuralType": "STRING",
                   "semanticTypes": ["https://metadata.datadrivendiscovery.org/types/FileName"],
                   "foreignKey": {"resourceId": "0", "columnIndex": 0}},
                  {"name": "label", "structuralType": "STRING"}
                ]}
              ]
            }
            """);
        return datasetDoc;
    }
}
