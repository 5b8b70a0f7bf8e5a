package edu.harvard.hms.dbmi.avillach.tsformat.etl.timeseries;

import javax.annotation.Nullable;

/**
 * @param fileColIndex index of the column of the main resource holding the time series file names; when null the first csv file
 *        name column found is used
 * @param mainResourceIndex id of the resource whose rows reference the time series files
 * @param readThreads number of time series files read concurrently
 */
public record FormatterHyperparams(@Nullable Integer fileColIndex, @Nullable String mainResourceIndex, int readThreads) {

    public static final String DEFAULT_MAIN_RESOURCE_INDEX = "1";

    public static FormatterHyperparams defaults() {
        return new FormatterHyperparams(null, DEFAULT_MAIN_RESOURCE_INDEX, 1);
    }

    public FormatterHyperparams withFileColIndex(@Nullable Integer index) {
        return new FormatterHyperparams(index, mainResourceIndex, readThreads);
    }

    public FormatterHyperparams withMainResourceIndex(@Nullable String resourceId) {
        return new FormatterHyperparams(fileColIndex, resourceId, readThreads);
    }

    public FormatterHyperparams withReadThreads(int threads) {
        return new FormatterHyperparams(fileColIndex, mainResourceIndex, threads);
    }
}
