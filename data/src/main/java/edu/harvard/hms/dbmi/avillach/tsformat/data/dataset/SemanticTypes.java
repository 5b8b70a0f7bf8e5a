package edu.harvard.hms.dbmi.avillach.tsformat.data.dataset;

import com.google.common.collect.ImmutableSet;

public final class SemanticTypes {

    public static final String FILE_NAME = "https://metadata.datadrivendiscovery.org/types/FileName";
    public static final String TIMESERIES = "https://metadata.datadrivendiscovery.org/types/Timeseries";
    public static final String TEXT = "http://schema.org/Text";
    public static final String ATTRIBUTE = "https://metadata.datadrivendiscovery.org/types/Attribute";

    public static final String CSV_MEDIA_TYPE = "text/csv";

    /**
     * Tags of which at least one must be present on a column describing csv time series files.
     */
    public static final ImmutableSet<String> TIMESERIES_FILE_TYPES = ImmutableSet.of(FILE_NAME, TIMESERIES, TEXT, ATTRIBUTE);

    /**
     * Media types that must all be present on a column describing csv time series files.
     */
    public static final ImmutableSet<String> TIMESERIES_MEDIA_TYPES = ImmutableSet.of(CSV_MEDIA_TYPE);

    private SemanticTypes() {
    }
}
