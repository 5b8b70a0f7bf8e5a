package edu.harvard.hms.dbmi.avillach.tsformat.data.dataset;

import com.google.common.base.Preconditions;

/**
 * Column level reference to another resource's column.
 */
public record ForeignKey(String resourceId, int columnIndex) {

    public ForeignKey {
        Preconditions.checkNotNull(resourceId, "resourceId");
        Preconditions.checkArgument(columnIndex >= 0, "columnIndex must not be negative: %s", columnIndex);
    }
}
