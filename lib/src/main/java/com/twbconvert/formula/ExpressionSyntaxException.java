package com.twbconvert.formula;

import com.twbconvert.ConversionException;

/** A calculation formula could not be parsed. Fatal to the field that owns the formula only. */
public final class ExpressionSyntaxException extends ConversionException {
    private static final long serialVersionUID = 1L;

    private final String formula;
    private final int offset;

    public ExpressionSyntaxException(String message, String formula, int offset, Throwable cause) {
        super(message + " at offset " + offset, cause);
        this.formula = formula;
        this.offset = offset;
    }

    public String getFormula() {
        return formula;
    }

    /** Zero-based character offset of the offending input. */
    public int getOffset() {
        return offset;
    }
}
