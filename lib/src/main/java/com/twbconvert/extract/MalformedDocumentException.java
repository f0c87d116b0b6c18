package com.twbconvert.extract;

import com.twbconvert.ConversionException;

/** The source document lacks a required element or attribute, or carries an unreadable value. */
public final class MalformedDocumentException extends ConversionException {
    private static final long serialVersionUID = 1L;

    public MalformedDocumentException(String message) {
        super(message);
    }

    public MalformedDocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
