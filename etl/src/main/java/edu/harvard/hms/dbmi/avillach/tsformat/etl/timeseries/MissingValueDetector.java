package edu.harvard.hms.dbmi.avillach.tsformat.etl.timeseries;

import java.util.Set;

/**
 * Detects cells that stand for a missing value rather than data, so that a numeric series column with gaps is still typed as
 * numeric.
 *
 * <p>Recognised tokens, compared trimmed and case-insensitively:</p>
 * <ul>
 *   <li>"" (empty cell, also what the long form builder writes for absent columns)</li>
 *   <li>"nan"</li>
 *   <li>"na", "n/a"</li>
 *   <li>"null"</li>
 *   <li>"none"</li>
 *   <li>"\\N"</li>
 * </ul>
 */
public class MissingValueDetector {

    private static final Set<String> MISSING_TOKENS = Set.of(
        "",
        "nan",
        "na",
        "n/a",
        "null",
        "none",
        "\\n"
    );

    public boolean isMissing(String cell) {
        if (cell == null) {
            return true;
        }
        return MISSING_TOKENS.contains(cell.trim().toLowerCase());
    }
}
