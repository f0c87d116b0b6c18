package com.twbconvert.pbip.report;

import java.util.List;
import java.util.Objects;

public final class ReportMappingResult {
    private final ReportSpec report;
    private final List<UnresolvedFieldProjectionException> failures;

    public ReportMappingResult(ReportSpec report, List<UnresolvedFieldProjectionException> failures) {
        this.report = Objects.requireNonNull(report, "report");
        this.failures = List.copyOf(failures);
    }

    public ReportSpec getReport() {
        return report;
    }

    /** One entry per dropped projection. */
    public List<UnresolvedFieldProjectionException> getFailures() {
        return failures;
    }
}
