package com.twbconvert.pbip.report;

import com.twbconvert.ConversionException;

/** A shelf, filter or slicer field does not resolve to an emitted column or measure; only that projection is dropped. */
public final class UnresolvedFieldProjectionException extends ConversionException {
    private static final long serialVersionUID = 1L;

    private final String worksheet;
    private final String field;

    public UnresolvedFieldProjectionException(String worksheet, String field) {
        super("Field " + field + " of " + worksheet + " is not an emitted column or measure");
        this.worksheet = worksheet;
        this.field = field;
    }

    public String getWorksheet() {
        return worksheet;
    }

    public String getField() {
        return field;
    }
}
