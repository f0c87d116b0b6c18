package com.twbconvert.dependency;

import com.twbconvert.workbook.CalculatedField;
import com.twbconvert.workbook.FieldKey;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.TreeSet;

/**
 * Arena of calculated fields indexed by declaration order, with an edge from each field to every field it
 * references. Rebuilt for each conversion and never shared between runs.
 */
public final class DependencyGraph {
    private final List<CalculatedField> nodes;
    private final Map<FieldKey, Integer> indexByKey;
    private final List<TreeSet<Integer>> dependencies;
    private final List<TreeSet<Integer>> dependents;

    DependencyGraph(List<CalculatedField> nodes) {
        this.nodes = List.copyOf(nodes);
        this.indexByKey = new HashMap<>();
        this.dependencies = new ArrayList<>(nodes.size());
        this.dependents = new ArrayList<>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            indexByKey.put(nodes.get(i).getKey(), i);
            dependencies.add(new TreeSet<>());
            dependents.add(new TreeSet<>());
        }
    }

    void addEdge(int from, int to) {
        dependencies.get(from).add(to);
        dependents.get(to).add(from);
    }

    public int size() {
        return nodes.size();
    }

    public CalculatedField node(int index) {
        return nodes.get(index);
    }

    public OptionalInt indexOf(FieldKey key) {
        Integer index = indexByKey.get(key);
        return index == null ? OptionalInt.empty() : OptionalInt.of(index);
    }

    /** Indices of the fields {@code index} references, ascending. */
    public List<Integer> dependenciesOf(int index) {
        return List.copyOf(dependencies.get(index));
    }

    /** Indices of the fields referencing {@code index}, ascending. */
    public List<Integer> dependentsOf(int index) {
        return List.copyOf(dependents.get(index));
    }

    public List<FieldKey> dependenciesOf(FieldKey key) {
        OptionalInt index = indexOf(key);
        if (index.isEmpty()) {
            return List.of();
        }
        List<FieldKey> keys = new ArrayList<>();
        for (int dependency : dependencies.get(index.getAsInt())) {
            keys.add(nodes.get(dependency).getKey());
        }
        return keys;
    }
}
