package com.twbconvert.pbip.model;

import java.util.List;
import java.util.Objects;

/** An import-mode M partition; {@code source} holds the lines of the {@code let ... in} expression. */
public final class ModelPartition {
    private final String name;
    private final List<String> source;

    public ModelPartition(String name, List<String> source) {
        this.name = Objects.requireNonNull(name, "name");
        this.source = List.copyOf(source);
    }

    public String getName() {
        return name;
    }

    public List<String> getSource() {
        return source;
    }
}
