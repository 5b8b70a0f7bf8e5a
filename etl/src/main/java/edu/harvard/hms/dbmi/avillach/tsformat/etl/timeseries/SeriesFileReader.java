package edu.harvard.hms.dbmi.avillach.tsformat.etl.timeseries;

import edu.harvard.hms.dbmi.avillach.tsformat.data.dataset.Table;
import edu.harvard.hms.dbmi.avillach.tsformat.exception.SeriesLoadException;

/**
 * Loads one time series file. Implementations must be safe to call from several threads at once.
 */
public interface SeriesFileReader {

    /**
     * @param path file path or {@code file:} uri, as produced by {@link SeriesPaths#join(String, String)}
     * @throws SeriesLoadException if the file is missing or cannot be parsed
     */
    Table read(String path);
}
