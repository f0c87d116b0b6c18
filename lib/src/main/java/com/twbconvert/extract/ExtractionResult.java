package com.twbconvert.extract;

import com.twbconvert.assumption.Assumption;
import com.twbconvert.workbook.WorkbookModel;
import java.util.List;
import java.util.Objects;

public final class ExtractionResult {
    private final WorkbookModel model;
    private final List<Assumption> assumptions;

    public ExtractionResult(WorkbookModel model, List<Assumption> assumptions) {
        this.model = Objects.requireNonNull(model, "model");
        this.assumptions = List.copyOf(assumptions);
    }

    public WorkbookModel getModel() {
        return model;
    }

    public List<Assumption> getAssumptions() {
        return assumptions;
    }
}
