package edu.harvard.hms.dbmi.avillach.tsformat.etl.timeseries;

import com.google.common.collect.ImmutableMap;
import edu.harvard.hms.dbmi.avillach.tsformat.data.dataset.ColumnMetadata;
import edu.harvard.hms.dbmi.avillach.tsformat.data.dataset.Dataset;
import edu.harvard.hms.dbmi.avillach.tsformat.data.dataset.DatasetMetadata;
import edu.harvard.hms.dbmi.avillach.tsformat.data.dataset.StructuralType;
import edu.harvard.hms.dbmi.avillach.tsformat.data.dataset.Table;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Wraps a long form table as the only resource of a new dataset. Column metadata is derived from the table alone; nothing is
 * carried over from the input dataset.
 */
public class OutputAssembler {

    public static final String OUTPUT_RESOURCE_ID = "0";

    // plain decimal or scientific notation, without Java literal suffixes such as "1d" or "7f"
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private final MissingValueDetector missingValueDetector;

    public OutputAssembler() {
        this(new MissingValueDetector());
    }

    public OutputAssembler(MissingValueDetector missingValueDetector) {
        this.missingValueDetector = missingValueDetector;
    }

    public Dataset assemble(Table longForm) {
        List<ColumnMetadata> columns = new ArrayList<>(longForm.columnCount());
        for (int i = 0; i < longForm.columnCount(); i++) {
            columns.add(ColumnMetadata.of(longForm.getColumnNames().get(i), inferType(longForm.getColumn(i))));
        }
        DatasetMetadata metadata = DatasetMetadata.builder().addResource(OUTPUT_RESOURCE_ID, columns).build();
        return new Dataset(ImmutableMap.of(OUTPUT_RESOURCE_ID, longForm), metadata);
    }

    /**
     * INTEGER if every present cell is a long, REAL if every present cell is a plain decimal number, STRING otherwise or when no
     * cell is present.
     */
    StructuralType inferType(List<String> cells) {
        boolean sawValue = false;
        boolean allIntegers = true;
        for (String cell : cells) {
            if (missingValueDetector.isMissing(cell)) {
                continue;
            }
            sawValue = true;
            String trimmed = cell.trim();
            if (allIntegers && !isLong(trimmed)) {
                allIntegers = false;
            }
            if (!allIntegers && !isDouble(trimmed)) {
                return StructuralType.STRING;
            }
        }
        if (!sawValue) {
            return StructuralType.STRING;
        }
        return allIntegers ? StructuralType.INTEGER : StructuralType.REAL;
    }

    private static boolean isLong(String cell) {
        try {
            Long.parseLong(cell);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static boolean isDouble(String cell) {
        if (!DECIMAL.matcher(cell).matches()) {
            return false;
        }
        try {
            Double.parseDouble(cell);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
