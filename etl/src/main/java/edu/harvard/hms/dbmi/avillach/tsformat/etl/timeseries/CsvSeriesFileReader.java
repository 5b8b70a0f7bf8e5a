package edu.harvard.hms.dbmi.avillach.tsformat.etl.timeseries;

import edu.harvard.hms.dbmi.avillach.tsformat.data.dataset.Table;
import edu.harvard.hms.dbmi.avillach.tsformat.etl.io.CsvTableReader;
import edu.harvard.hms.dbmi.avillach.tsformat.exception.SeriesLoadException;

import java.io.IOException;
import java.nio.file.Path;

public class CsvSeriesFileReader implements SeriesFileReader {

    private final CsvTableReader tableReader;

    public CsvSeriesFileReader() {
        this(new CsvTableReader());
    }

    public CsvSeriesFileReader(CsvTableReader tableReader) {
        this.tableReader = tableReader;
    }

    @Override
    public Table read(String path) {
        Path file;
        try {
            file = SeriesPaths.toPath(path);
        } catch (IllegalArgumentException e) {
            throw new SeriesLoadException(path, e);
        }

        try {
            return tableReader.read(file);
        } catch (IOException e) {
            throw new SeriesLoadException(path, e);
        }
    }
}
