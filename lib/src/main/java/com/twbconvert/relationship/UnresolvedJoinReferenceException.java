package com.twbconvert.relationship;

import com.twbconvert.ConversionException;
import com.twbconvert.workbook.JoinEdge;

/** A join endpoint names a table or column the model does not contain; only that relationship is dropped. */
public final class UnresolvedJoinReferenceException extends ConversionException {
    private static final long serialVersionUID = 1L;

    private final transient JoinEdge edge;

    public UnresolvedJoinReferenceException(JoinEdge edge, String missing) {
        super("Join " + edge.describe() + " references unknown " + missing);
        this.edge = edge;
    }

    public JoinEdge getEdge() {
        return edge;
    }
}
