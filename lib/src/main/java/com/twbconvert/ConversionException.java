package com.twbconvert;

/**
 * Checked exception signalling that a workbook could not be converted. Subclasses separate failures that abort the
 * whole run from failures that only exclude a single entity; see the individual exception types.
 */
public class ConversionException extends Exception {
    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
