package edu.harvard.hms.dbmi.avillach.tsformat.etl.timeseries;

import edu.harvard.hms.dbmi.avillach.tsformat.data.dataset.Table;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only accumulator for long form rows. Columns are registered by name in first-seen order; registering a name twice returns
 * the original position, so a later value for the same name overwrites an earlier one in a row. The table is materialised once, in
 * {@link #build()}, padding rows added before later columns appeared.
 */
class LongFormTableBuilder {

    private final Map<String, Integer> columns = new LinkedHashMap<>();
    private final List<String[]> rows = new ArrayList<>();

    int[] register(List<String> columnNames) {
        int[] positions = new int[columnNames.size()];
        for (int i = 0; i < columnNames.size(); i++) {
            positions[i] = register(columnNames.get(i));
        }
        return positions;
    }

    int register(String columnName) {
        return columns.computeIfAbsent(columnName, name -> columns.size());
    }

    String[] newRow() {
        String[] row = new String[columns.size()];
        Arrays.fill(row, "");
        return row;
    }

    void add(String[] row) {
        rows.add(row);
    }

    int rowCount() {
        return rows.size();
    }

    Table build() {
        int width = columns.size();
        List<List<String>> padded = new ArrayList<>(rows.size());
        for (String[] row : rows) {
            if (row.length < width) {
                String[] wide = Arrays.copyOf(row, width);
                Arrays.fill(wide, row.length, width, "");
                row = wide;
            }
            padded.add(Arrays.asList(row));
        }
        return new Table(new ArrayList<>(columns.keySet()), padded);
    }
}
