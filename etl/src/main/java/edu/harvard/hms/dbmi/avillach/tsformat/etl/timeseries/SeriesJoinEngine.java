package edu.harvard.hms.dbmi.avillach.tsformat.etl.timeseries;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import edu.harvard.hms.dbmi.avillach.tsformat.data.dataset.Table;
import edu.harvard.hms.dbmi.avillach.tsformat.exception.SeriesLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Expands every row of a main resource into one row per record of the time series file it names.
 *
 * Each output row is the main row, followed by a {@value #SERIES_ID} column holding the zero based position of the main row,
 * followed by the series record. Rows come out grouped by main row in main resource order, and within a group in file order. No
 * timestamp alignment is done; all series are assumed to share the same timestamps.
 *
 * A series column whose name matches a main resource column overwrites that cell. Avoiding such collisions is up to whoever
 * prepared the dataset.
 *
 * With more than one read thread, files are loaded concurrently but consumed strictly in main resource order, so the result is the
 * same as a sequential run. Any load failure aborts the whole join.
 */
public class SeriesJoinEngine {

    private static final Logger log = LoggerFactory.getLogger(SeriesJoinEngine.class);

    public static final String SERIES_ID = "series_id";

    private final SeriesFileReader reader;
    private final int readThreads;

    public SeriesJoinEngine(SeriesFileReader reader) {
        this(reader, 1);
    }

    public SeriesJoinEngine(SeriesFileReader reader, int readThreads) {
        Preconditions.checkArgument(readThreads > 0, "readThreads must be positive: %s", readThreads);
        this.reader = reader;
        this.readThreads = readThreads;
    }

    public Table buildLongForm(Table mainResource, int fileColumnIndex, String basePath) {
        Preconditions.checkElementIndex(fileColumnIndex, mainResource.columnCount(), "fileColumnIndex");

        List<String> paths = new ArrayList<>(mainResource.rowCount());
        for (List<String> row : mainResource.getRows()) {
            paths.add(SeriesPaths.join(basePath, row.get(fileColumnIndex)));
        }
        log.info("Loading {} time series files from {} with {} thread(s)", paths.size(), basePath, readThreads);

        LongFormTableBuilder builder = new LongFormTableBuilder();
        int[] mainPositions = builder.register(mainResource.getColumnNames());
        int seriesIdPosition = builder.register(SERIES_ID);

        if (readThreads == 1 || paths.size() < 2) {
            for (int i = 0; i < paths.size(); i++) {
                Table series = load(paths.get(i));
                append(builder, mainResource.getRow(i), mainPositions, seriesIdPosition, i, series);
            }
        } else {
            readConcurrently(mainResource, paths, builder, mainPositions, seriesIdPosition);
        }

        Table longForm = builder.build();
        log.info("Built long form table with {} rows and {} columns", longForm.rowCount(), longForm.columnCount());
        return longForm;
    }

    private void readConcurrently(
        Table mainResource, List<String> paths, LongFormTableBuilder builder, int[] mainPositions, int seriesIdPosition
    ) {
        ExecutorService readerPool = Executors.newFixedThreadPool(
            Math.min(readThreads, paths.size()), new ThreadFactoryBuilder().setNameFormat("series-reader-%d").setDaemon(true).build()
        );
        try {
            List<Future<Table>> futures = new ArrayList<>(paths.size());
            for (String path : paths) {
                futures.add(readerPool.submit(() -> load(path)));
            }
            // consume in submission order so rows keep main resource order
            for (int i = 0; i < futures.size(); i++) {
                Table series = await(futures.get(i), paths.get(i));
                append(builder, mainResource.getRow(i), mainPositions, seriesIdPosition, i, series);
            }
        } finally {
            readerPool.shutdownNow();
        }
    }

    private Table await(Future<Table> future, String path) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            if (e.getCause() instanceof SeriesLoadException) {
                throw (SeriesLoadException) e.getCause();
            }
            throw new SeriesLoadException(path, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SeriesLoadException(path, e);
        }
    }

    private Table load(String path) {
        log.debug("Reading time series file {}", path);
        return reader.read(path);
    }

    private void append(
        LongFormTableBuilder builder, List<String> mainRow, int[] mainPositions, int seriesIdPosition, int seriesId, Table series
    ) {
        int[] seriesPositions = builder.register(series.getColumnNames());
        String seriesIdValue = Integer.toString(seriesId);
        for (List<String> seriesRow : series.getRows()) {
            String[] row = builder.newRow();
            for (int c = 0; c < mainPositions.length; c++) {
                row[mainPositions[c]] = mainRow.get(c);
            }
            row[seriesIdPosition] = seriesIdValue;
            for (int c = 0; c < seriesPositions.length; c++) {
                row[seriesPositions[c]] = seriesRow.get(c);
            }
            builder.add(row);
        }
        log.debug("Series {} contributed {} rows", seriesId, series.rowCount());
    }
}
