package com.twbconvert.workbook;

import java.util.List;

/**
 * How a table calculation walks the view: the fields it orders by and the fields that partition it. Tableau infers
 * this from the visual; the workbook records it in {@code <table-calc>} and the parser carries it explicitly.
 */
public final class TableCalcAddressing {
    private static final TableCalcAddressing NONE = new TableCalcAddressing(List.of(), List.of(), false);

    private final List<String> orderingFields;
    private final List<String> partitionFields;
    private final boolean descending;

    public TableCalcAddressing(List<String> orderingFields, List<String> partitionFields, boolean descending) {
        this.orderingFields = List.copyOf(orderingFields);
        this.partitionFields = List.copyOf(partitionFields);
        this.descending = descending;
    }

    public static TableCalcAddressing none() {
        return NONE;
    }

    public List<String> getOrderingFields() {
        return orderingFields;
    }

    public List<String> getPartitionFields() {
        return partitionFields;
    }

    public boolean isDescending() {
        return descending;
    }

    public boolean hasOrdering() {
        return !orderingFields.isEmpty();
    }
}
