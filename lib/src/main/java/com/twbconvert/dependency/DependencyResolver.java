package com.twbconvert.dependency;

import com.twbconvert.formula.ReferenceCollector;
import com.twbconvert.formula.ast.ExprNode;
import com.twbconvert.formula.ast.FieldRefNode;
import com.twbconvert.workbook.CalculatedField;
import com.twbconvert.workbook.Datasource;
import com.twbconvert.workbook.FieldKey;
import com.twbconvert.workbook.WorkbookModel;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.TreeMap;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

/**
 * Orders calculated fields so every field comes after the fields it references. Loops are detected as strongly
 * connected components; their members and everything that depends on them are excluded while the rest of the graph
 * is ordered normally.
 */
public final class DependencyResolver {
    private static final Logger LOGGER = Logger.getLogger(DependencyResolver.class.getName());

    /**
     * Resolves the calculated fields of {@code model}. Qualified references may name a datasource by internal name
     * or by caption.
     */
    public ResolutionResult resolve(WorkbookModel model, Map<FieldKey, ExprNode> parsed) {
        Objects.requireNonNull(model, "model");
        return resolve(
                model.getCalculatedFields(),
                parsed,
                qualifier -> model.findDatasource(qualifier).map(Datasource::getName).orElse(qualifier));
    }

    /**
     * @param fields calculated fields of the workbook
     * @param parsed parsed formula of each field; fields without an entry are treated as referencing nothing
     */
    public ResolutionResult resolve(List<CalculatedField> fields, Map<FieldKey, ExprNode> parsed) {
        return resolve(fields, parsed, UnaryOperator.identity());
    }

    private ResolutionResult resolve(
            List<CalculatedField> fields, Map<FieldKey, ExprNode> parsed, UnaryOperator<String> datasourceNames) {
        Objects.requireNonNull(fields, "fields");
        Objects.requireNonNull(parsed, "parsed");
        List<CalculatedField> nodes = new ArrayList<>(fields);
        nodes.sort(Comparator.comparingInt(CalculatedField::getDeclarationIndex));

        DependencyGraph graph = new DependencyGraph(nodes);
        for (int i = 0; i < nodes.size(); i++) {
            CalculatedField field = nodes.get(i);
            ExprNode root = parsed.get(field.getKey());
            if (root == null) {
                continue;
            }
            for (FieldRefNode reference : ReferenceCollector.collect(root)) {
                int target = find(nodes, field, reference, datasourceNames);
                if (target >= 0) {
                    graph.addEdge(i, target);
                }
            }
        }

        List<CyclicDependencyException> cycles = new ArrayList<>();
        Map<FieldKey, CyclicDependencyException> exclusions = new TreeMap<>(byDeclaration(nodes, graph));
        boolean[] excluded = new boolean[nodes.size()];
        for (List<Integer> component : new TarjanComponents(graph).run()) {
            int first = component.get(0);
            boolean loop = component.size() > 1 || graph.dependenciesOf(first).contains(first);
            if (!loop) {
                continue;
            }
            List<FieldKey> keys = new ArrayList<>();
            List<String> names = new ArrayList<>();
            for (int member : component) {
                keys.add(nodes.get(member).getKey());
                names.add(nodes.get(member).getName());
            }
            CyclicDependencyException cycle = new CyclicDependencyException(keys, names);
            cycles.add(cycle);
            LOGGER.warning(cycle.getMessage());

            Deque<Integer> pending = new ArrayDeque<>(component);
            while (!pending.isEmpty()) {
                int current = pending.pop();
                if (excluded[current]) {
                    continue;
                }
                excluded[current] = true;
                exclusions.put(nodes.get(current).getKey(), cycle);
                pending.addAll(graph.dependentsOf(current));
            }
        }

        List<CalculatedField> order = new ArrayList<>();
        List<List<CalculatedField>> levels = new ArrayList<>();
        int[] remaining = new int[nodes.size()];
        int[] level = new int[nodes.size()];
        PriorityQueue<Integer> ready = new PriorityQueue<>();
        for (int i = 0; i < nodes.size(); i++) {
            if (excluded[i]) {
                continue;
            }
            remaining[i] = graph.dependenciesOf(i).size();
            if (remaining[i] == 0) {
                ready.add(i);
            }
        }
        while (!ready.isEmpty()) {
            int current = ready.poll();
            order.add(nodes.get(current));
            while (levels.size() <= level[current]) {
                levels.add(new ArrayList<>());
            }
            levels.get(level[current]).add(nodes.get(current));
            for (int dependent : graph.dependentsOf(current)) {
                if (excluded[dependent]) {
                    continue;
                }
                level[dependent] = Math.max(level[dependent], level[current] + 1);
                if (--remaining[dependent] == 0) {
                    ready.add(dependent);
                }
            }
        }
        for (List<CalculatedField> fieldsOfLevel : levels) {
            fieldsOfLevel.sort(Comparator.comparingInt(CalculatedField::getDeclarationIndex));
        }
        return new ResolutionResult(graph, order, levels, cycles, exclusions);
    }

    private static Comparator<FieldKey> byDeclaration(List<CalculatedField> nodes, DependencyGraph graph) {
        return Comparator.comparingInt(key -> graph.indexOf(key).orElse(nodes.size()));
    }

    /**
     * Resolves a reference to a calculated field: by internal name or caption in the referencing field's datasource,
     * or in the datasource named by the qualifier. Returns -1 for columns, parameters and unknown names.
     */
    private static int find(
            List<CalculatedField> nodes,
            CalculatedField from,
            FieldRefNode reference,
            UnaryOperator<String> datasourceNames) {
        String datasource = reference.isQualified()
                ? datasourceNames.apply(reference.getQualifier())
                : from.getDatasourceName();
        for (int i = 0; i < nodes.size(); i++) {
            CalculatedField candidate = nodes.get(i);
            if (candidate.getDatasourceName().equals(datasource) && candidate.answersTo(reference.getName())) {
                return i;
            }
        }
        return -1;
    }

    /** Tarjan's algorithm; components come out with members sorted by declaration order. */
    private static final class TarjanComponents {
        private final DependencyGraph graph;
        private final int[] index;
        private final int[] lowLink;
        private final boolean[] onStack;
        private final Deque<Integer> stack = new ArrayDeque<>();
        private final List<List<Integer>> components = new ArrayList<>();
        private int counter;

        TarjanComponents(DependencyGraph graph) {
            this.graph = graph;
            this.index = new int[graph.size()];
            this.lowLink = new int[graph.size()];
            this.onStack = new boolean[graph.size()];
            Arrays.fill(index, -1);
        }

        List<List<Integer>> run() {
            for (int i = 0; i < graph.size(); i++) {
                if (index[i] < 0) {
                    connect(i);
                }
            }
            components.sort(Comparator.comparingInt(component -> component.get(0)));
            return components;
        }

        private void connect(int node) {
            index[node] = counter;
            lowLink[node] = counter;
            counter++;
            stack.push(node);
            onStack[node] = true;
            for (int next : graph.dependenciesOf(node)) {
                if (index[next] < 0) {
                    connect(next);
                    lowLink[node] = Math.min(lowLink[node], lowLink[next]);
                } else if (onStack[next]) {
                    lowLink[node] = Math.min(lowLink[node], index[next]);
                }
            }
            if (lowLink[node] == index[node]) {
                List<Integer> component = new ArrayList<>();
                int member;
                do {
                    member = stack.pop();
                    onStack[member] = false;
                    component.add(member);
                } while (member != node);
                component.sort(null);
                components.add(component);
            }
        }
    }
}
