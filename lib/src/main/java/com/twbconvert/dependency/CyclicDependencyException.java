package com.twbconvert.dependency;

import com.twbconvert.ConversionException;
import com.twbconvert.workbook.FieldKey;
import java.util.List;

/** Calculated fields that reference each other in a loop. Fatal to every member and every dependent of the loop. */
public final class CyclicDependencyException extends ConversionException {
    private static final long serialVersionUID = 1L;

    private final List<FieldKey> cycle;
    private final List<String> cycleNames;

    public CyclicDependencyException(List<FieldKey> cycle, List<String> cycleNames) {
        super("Cyclic dependency between calculated fields " + cycleNames);
        this.cycle = List.copyOf(cycle);
        this.cycleNames = List.copyOf(cycleNames);
    }

    /** Members of the loop in declaration order. */
    public List<FieldKey> getCycle() {
        return cycle;
    }

    public List<String> getCycleNames() {
        return cycleNames;
    }
}
