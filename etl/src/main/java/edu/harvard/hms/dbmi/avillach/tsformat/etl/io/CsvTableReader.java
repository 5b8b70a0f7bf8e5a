package edu.harvard.hms.dbmi.avillach.tsformat.etl.io;

import edu.harvard.hms.dbmi.avillach.tsformat.data.dataset.Table;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.csv.DuplicateHeaderMode;
import org.apache.commons.io.input.BOMInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads a comma separated file with a header row into a {@link Table}.
 *
 * A leading UTF-8 byte order mark is skipped. Blank header names become {@code Unnamed: <i>} and repeated names are suffixed
 * {@code .1}, {@code .2}, ... so every column can be addressed by name. Records shorter than the header are padded with empty cells.
 * Records longer than the header and empty files are rejected.
 */
public class CsvTableReader {

    private static final Logger log = LoggerFactory.getLogger(CsvTableReader.class);

    static final String UNNAMED_PREFIX = "Unnamed: ";

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
        .setHeader()
        .setSkipHeaderRecord(true)
        .setIgnoreEmptyLines(true)
        .setAllowMissingColumnNames(true)
        .setDuplicateHeaderMode(DuplicateHeaderMode.ALLOW_ALL)
        .build();

    public Table read(Path csv) throws IOException {
        log.debug("Reading csv table {}", csv);
        try (
            BOMInputStream in = BOMInputStream.builder().setInputStream(Files.newInputStream(csv)).get();
            Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8);
            CSVParser parser = FORMAT.parse(reader)
        ) {
            List<String> rawHeader = parser.getHeaderNames();
            if (rawHeader.isEmpty()) {
                throw new IOException("No header row found in " + csv);
            }
            List<String> header = uniqueColumnNames(rawHeader);
            if (!header.equals(rawHeader)) {
                log.debug("Renamed header of {} from {} to {}", csv, rawHeader, header);
            }

            List<List<String>> rows = new ArrayList<>();
            for (CSVRecord record : parser) {
                if (record.size() > header.size()) {
                    throw new IOException(
                        "Expected " + header.size() + " fields in record " + record.getRecordNumber() + " of " + csv + ", saw " + record.size()
                    );
                }
                String[] cells = new String[header.size()];
                Arrays.fill(cells, "");
                for (int i = 0; i < record.size(); i++) {
                    cells[i] = record.get(i);
                }
                rows.add(Arrays.asList(cells));
            }
            return new Table(header, rows);
        } catch (UncheckedIOException e) {
            throw e.getCause();
        } catch (IllegalArgumentException | IllegalStateException e) {
            // commons-csv reports malformed quoting this way
            throw new IOException("Malformed csv file " + csv + ": " + e.getMessage(), e);
        }
    }

    /**
     * Names blank headers after their position and suffixes repeats with a counter, skipping any name already taken.
     */
    static List<String> uniqueColumnNames(List<String> rawHeader) {
        List<String> names = new ArrayList<>(rawHeader.size());
        Set<String> taken = new HashSet<>();
        Map<String, Integer> repeats = new HashMap<>();
        for (int i = 0; i < rawHeader.size(); i++) {
            String raw = rawHeader.get(i);
            String name = raw == null || raw.isBlank() ? UNNAMED_PREFIX + i : raw;
            if (taken.contains(name)) {
                String base = name;
                int counter = repeats.getOrDefault(base, 0);
                do {
                    counter++;
                    name = base + "." + counter;
                } while (taken.contains(name));
                repeats.put(base, counter);
            }
            taken.add(name);
            names.add(name);
        }
        return names;
    }
}
