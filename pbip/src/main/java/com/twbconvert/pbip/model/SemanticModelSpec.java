package com.twbconvert.pbip.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** The typed semantic model the TMDL documents are rendered from. */
public final class SemanticModelSpec {
    private final String culture;
    private final List<ModelTable> tables;
    private final List<ModelRelationship> relationships;

    public SemanticModelSpec(String culture, List<ModelTable> tables, List<ModelRelationship> relationships) {
        this.culture = Objects.requireNonNull(culture, "culture");
        this.tables = List.copyOf(tables);
        this.relationships = List.copyOf(relationships);
    }

    public String getCulture() {
        return culture;
    }

    public List<ModelTable> getTables() {
        return tables;
    }

    public List<ModelRelationship> getRelationships() {
        return relationships;
    }

    public Optional<ModelTable> findTable(String name) {
        return tables.stream().filter(t -> t.getName().equals(name)).findFirst();
    }
}
