package edu.harvard.hms.dbmi.avillach.tsformat.data.dataset;

/**
 * Storage type of the cells of a column.
 */
public enum StructuralType {
    STRING,
    INTEGER,
    REAL,
    BOOLEAN;

    public boolean isTextual() {
        return this == STRING;
    }
}
