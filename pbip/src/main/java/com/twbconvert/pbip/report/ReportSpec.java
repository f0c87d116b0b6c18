package com.twbconvert.pbip.report;

import java.util.List;
import java.util.Objects;

public final class ReportSpec {
    private final List<PageSpec> pages;
    private final String activePage;

    public ReportSpec(List<PageSpec> pages, String activePage) {
        this.pages = List.copyOf(pages);
        this.activePage = Objects.requireNonNull(activePage, "activePage");
    }

    /** Pages in display order. */
    public List<PageSpec> getPages() {
        return pages;
    }

    public String getActivePage() {
        return activePage;
    }
}
