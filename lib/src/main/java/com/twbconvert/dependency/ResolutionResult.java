package com.twbconvert.dependency;

import com.twbconvert.workbook.CalculatedField;
import com.twbconvert.workbook.FieldKey;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class ResolutionResult {
    private final DependencyGraph graph;
    private final List<CalculatedField> order;
    private final List<List<CalculatedField>> levels;
    private final List<CyclicDependencyException> cycles;
    private final Map<FieldKey, CyclicDependencyException> exclusions;

    ResolutionResult(
            DependencyGraph graph,
            List<CalculatedField> order,
            List<List<CalculatedField>> levels,
            List<CyclicDependencyException> cycles,
            Map<FieldKey, CyclicDependencyException> exclusions) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.order = List.copyOf(order);
        this.levels = levels.stream().map(List::copyOf).toList();
        this.cycles = List.copyOf(cycles);
        this.exclusions = Collections.unmodifiableMap(new LinkedHashMap<>(exclusions));
    }

    public DependencyGraph getGraph() {
        return graph;
    }

    /** Every field that can be translated, dependencies first, declaration order breaking ties. */
    public List<CalculatedField> getOrder() {
        return order;
    }

    /**
     * The same fields grouped by dependency depth: level 0 references no other calculated field, level n only
     * references fields of lower levels. Fields within a level are in declaration order.
     */
    public List<List<CalculatedField>> getLevels() {
        return levels;
    }

    public List<CyclicDependencyException> getCycles() {
        return cycles;
    }

    /** Excluded fields in declaration order, each mapped to the cycle that excluded it. */
    public Map<FieldKey, CyclicDependencyException> getExclusions() {
        return exclusions;
    }

    public boolean isExcluded(FieldKey key) {
        return exclusions.containsKey(key);
    }
}
