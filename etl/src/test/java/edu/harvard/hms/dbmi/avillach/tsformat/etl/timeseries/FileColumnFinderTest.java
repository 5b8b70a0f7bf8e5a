package edu.harvard.hms.dbmi.avillach.tsformat.etl.timeseries;

import edu.harvard.hms.dbmi.avillach.tsformat.data.dataset.ColumnMetadata;
import edu.harvard.hms.dbmi.avillach.tsformat.data.dataset.DatasetMetadata;
import edu.harvard.hms.dbmi.avillach.tsformat.data.dataset.SemanticTypes;
import edu.harvard.hms.dbmi.avillach.tsformat.data.dataset.StructuralType;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FileColumnFinderTest {

    private static final String BASE = "file:///data/series/";

    @Test
    void shouldFindTheOnlyQualifyingColumn() {
        DatasetMetadata metadata = TimeSeriesDatasets.metadata(BASE);
        FileColumnFinder finder = new FileColumnFinder(metadata, new CsvFileColumnClassifier(metadata));

        assertEquals(Optional.of(TimeSeriesDatasets.FILE_COLUMN), finder.findFileColumn(TimeSeriesDatasets.MAIN));
    }

    @Test
    void shouldSkipCandidateThatFailsClassification() {
        DatasetMetadata metadata = DatasetMetadata.builder()
            .addResource("0", List.of(TimeSeriesDatasets.seriesFileDescriptor(BASE)))
            .addResource("1", List.of(
                ColumnMetadata.of("d3mIndex", StructuralType.INTEGER),
                ColumnMetadata.of("notes", StructuralType.STRING).withSemanticTypes(List.of(SemanticTypes.TEXT)),
                TimeSeriesDatasets.fileNameColumn("file", 0)
            ))
            .build();
        FileColumnFinder finder = new FileColumnFinder(metadata, new CsvFileColumnClassifier(metadata));

        assertEquals(Optional.of(2), finder.findFileColumn("1"));
    }

    @Test
    void shouldPreferFirstOfSeveralQualifyingColumns() {
        DatasetMetadata metadata = DatasetMetadata.builder()
            .addResource("0", List.of(TimeSeriesDatasets.seriesFileDescriptor(BASE)))
            .addResource("1", List.of(TimeSeriesDatasets.fileNameColumn("first", 0), TimeSeriesDatasets.fileNameColumn("second", 0)))
            .build();
        FileColumnFinder finder = new FileColumnFinder(metadata, new CsvFileColumnClassifier(metadata));

        assertEquals(Optional.of(0), finder.findFileColumn("1"));
    }

    @Test
    void shouldReturnEmptyWhenNothingQualifies() {
        DatasetMetadata metadata = DatasetMetadata.builder()
            .addResource("1", List.of(
                ColumnMetadata.of("notes", StructuralType.STRING).withSemanticTypes(List.of(SemanticTypes.TEXT))
            ))
            .build();
        FileColumnFinder finder = new FileColumnFinder(metadata, new CsvFileColumnClassifier(metadata));

        assertEquals(Optional.empty(), finder.findFileColumn("1"));
        assertEquals(Optional.empty(), finder.findFileColumn("unknown"));
    }

    @Test
    void shouldOnlyClassifyColumnsCarryingRequiredSemanticTypes() {
        DatasetMetadata metadata = TimeSeriesDatasets.metadata(BASE);
        CsvFileColumnClassifier classifier = Mockito.mock(CsvFileColumnClassifier.class);
        Mockito.when(classifier.isFileReferenceColumn(TimeSeriesDatasets.MAIN, 1)).thenReturn(false);

        Optional<Integer> actual = new FileColumnFinder(metadata, classifier).findFileColumn(TimeSeriesDatasets.MAIN);

        assertEquals(Optional.empty(), actual);
        Mockito.verify(classifier, Mockito.times(1)).isFileReferenceColumn(TimeSeriesDatasets.MAIN, 1);
        Mockito.verify(classifier, Mockito.never()).isFileReferenceColumn(TimeSeriesDatasets.MAIN, 0);
        Mockito.verify(classifier, Mockito.never()).isFileReferenceColumn(TimeSeriesDatasets.MAIN, 2);
    }
}
