package com.twbconvert.pbip.artifact;

import com.twbconvert.pbip.model.SemanticModelSpec;
import com.twbconvert.pbip.report.ReportSpec;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The complete staged output of one conversion: every model and report document plus the typed model and report
 * they were rendered from. It is validated as one unit; nothing in it reaches storage before validation passes.
 */
public final class EmittedArtifactSet {
    private final SemanticModelSpec model;
    private final ReportSpec report;
    private final Map<String, Artifact> documents;

    public EmittedArtifactSet(SemanticModelSpec model, ReportSpec report, List<Artifact> documents) {
        this.model = Objects.requireNonNull(model, "model");
        this.report = Objects.requireNonNull(report, "report");
        Map<String, Artifact> byPath = new LinkedHashMap<>();
        for (Artifact document : documents) {
            if (byPath.put(document.getPath(), document) != null) {
                throw new IllegalArgumentException("Duplicate document path " + document.getPath());
            }
        }
        this.documents = Collections.unmodifiableMap(byPath);
    }

    public SemanticModelSpec getModel() {
        return model;
    }

    public ReportSpec getReport() {
        return report;
    }

    /** Documents keyed by relative path, in emission order. */
    public Map<String, Artifact> getDocuments() {
        return documents;
    }

    public List<String> paths() {
        return new ArrayList<>(documents.keySet());
    }

    public Optional<Artifact> find(String path) {
        return Optional.ofNullable(documents.get(path));
    }

    /** Path to serialized content, for writers and byte-level comparisons. */
    public Map<String, String> render() {
        Map<String, String> rendered = new LinkedHashMap<>();
        for (Artifact document : documents.values()) {
            rendered.put(document.getPath(), document.getContent());
        }
        return rendered;
    }
}
