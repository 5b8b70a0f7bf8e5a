package edu.harvard.hms.dbmi.avillach.tsformat.data.dataset;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.stream.Collectors;

/**
 * An immutable two dimensional table of string cells with named columns.
 *
 * Column names are not required to be unique; {@link #columnIndex(String)} answers the first match.
 */
public class Table {

    private final ImmutableList<String> columnNames;
    private final ImmutableList<ImmutableList<String>> rows;

    public Table(List<String> columnNames, List<? extends List<String>> rows) {
        this.columnNames = ImmutableList.copyOf(columnNames);
        ImmutableList.Builder<ImmutableList<String>> builder = ImmutableList.builderWithExpectedSize(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            List<String> row = rows.get(i);
            Preconditions.checkArgument(
                row.size() == this.columnNames.size(), "Row %s has %s cells but the table has %s columns", i, row.size(),
                this.columnNames.size()
            );
            // cells may be null for missing values, which ImmutableList does not allow
            builder.add(ImmutableList.copyOf(row.stream().map(cell -> cell == null ? "" : cell).collect(Collectors.toList())));
        }
        this.rows = builder.build();
    }

    public static Table empty(List<String> columnNames) {
        return new Table(columnNames, List.of());
    }

    public ImmutableList<String> getColumnNames() {
        return columnNames;
    }

    public ImmutableList<ImmutableList<String>> getRows() {
        return rows;
    }

    public ImmutableList<String> getRow(int rowIndex) {
        return rows.get(rowIndex);
    }

    public String get(int rowIndex, int columnIndex) {
        return rows.get(rowIndex).get(columnIndex);
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return columnNames.size();
    }

    /**
     * @return index of the first column with the given name, or -1 if there is none
     */
    public int columnIndex(String columnName) {
        return columnNames.indexOf(columnName);
    }

    public ImmutableList<String> getColumn(int columnIndex) {
        Preconditions.checkElementIndex(columnIndex, columnNames.size(), "columnIndex");
        return rows.stream().map(row -> row.get(columnIndex)).collect(ImmutableList.toImmutableList());
    }

    @Override
    public String toString() {
        return "Table{columns=" + columnNames + ", rows=" + rows.size() + "}";
    }
}
