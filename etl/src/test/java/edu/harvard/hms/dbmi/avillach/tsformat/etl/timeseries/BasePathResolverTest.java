package edu.harvard.hms.dbmi.avillach.tsformat.etl.timeseries;

import edu.harvard.hms.dbmi.avillach.tsformat.data.dataset.ColumnMetadata;
import edu.harvard.hms.dbmi.avillach.tsformat.data.dataset.DatasetMetadata;
import edu.harvard.hms.dbmi.avillach.tsformat.data.dataset.ForeignKey;
import edu.harvard.hms.dbmi.avillach.tsformat.data.dataset.StructuralType;
import edu.harvard.hms.dbmi.avillach.tsformat.exception.FormatterConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BasePathResolverTest {

    @Test
    void shouldReturnFirstBaseLocationOfReferencedColumn() {
        DatasetMetadata metadata = DatasetMetadata.builder()
            .addResource("0", List.of(
                TimeSeriesDatasets.seriesFileDescriptor("/data/series/").withLocationBaseUris(List.of("/data/series/", "/mirror/series/"))
            ))
            .addResource("1", List.of(TimeSeriesDatasets.fileNameColumn("file", 0)))
            .build();
        BasePathResolver resolver = new BasePathResolver(metadata);

        assertEquals("/data/series/", resolver.resolveBasePath("1", 0));
        assertEquals("0", resolver.referencedResource("1", 0));
    }

    @Test
    void shouldFailWithoutForeignKey() {
        BasePathResolver resolver = new BasePathResolver(TimeSeriesDatasets.metadata("/data/series/"));

        FormatterConfigurationException e = assertThrows(FormatterConfigurationException.class, () -> resolver.resolveBasePath("1", 2));
        assertTrue(e.getMessage().contains("no foreign key"), e.getMessage());
    }

    @Test
    void shouldFailWhenReferencedColumnDeclaresNoBaseLocation() {
        DatasetMetadata metadata = DatasetMetadata.builder()
            .addResource("0", List.of(ColumnMetadata.of("filename", StructuralType.STRING)))
            .addResource("1", List.of(TimeSeriesDatasets.fileNameColumn("file", 0)))
            .build();

        assertThrows(FormatterConfigurationException.class, () -> new BasePathResolver(metadata).resolveBasePath("1", 0));
    }

    @Test
    void shouldFailWhenReferencedColumnIsUnknown() {
        DatasetMetadata metadata = DatasetMetadata.builder()
            .addResource("1", List.of(ColumnMetadata.of("file", StructuralType.STRING).withForeignKey(new ForeignKey("0", 0))))
            .build();

        assertThrows(FormatterConfigurationException.class, () -> new BasePathResolver(metadata).resolveBasePath("1", 0));
    }

    @Test
    void shouldFailForUnknownColumn() {
        BasePathResolver resolver = new BasePathResolver(TimeSeriesDatasets.metadata("/data/series/"));

        assertThrows(FormatterConfigurationException.class, () -> resolver.resolveBasePath("1", 9));
    }
}
