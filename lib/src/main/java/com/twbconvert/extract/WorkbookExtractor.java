package com.twbconvert.extract;

import static com.twbconvert.extract.XmlElements.attr;
import static com.twbconvert.extract.XmlElements.child;
import static com.twbconvert.extract.XmlElements.children;
import static com.twbconvert.extract.XmlElements.descendants;
import static com.twbconvert.extract.XmlElements.formattedText;
import static com.twbconvert.extract.XmlElements.lastPart;
import static com.twbconvert.extract.XmlElements.path;
import static com.twbconvert.extract.XmlElements.text;
import static com.twbconvert.extract.XmlElements.unbracket;

import com.twbconvert.assumption.Assumption;
import com.twbconvert.assumption.AssumptionCategory;
import com.twbconvert.workbook.AggregationType;
import com.twbconvert.workbook.CalculatedField;
import com.twbconvert.workbook.Column;
import com.twbconvert.workbook.ColumnRole;
import com.twbconvert.workbook.Dashboard;
import com.twbconvert.workbook.DashboardZone;
import com.twbconvert.workbook.DataConnection;
import com.twbconvert.workbook.DataType;
import com.twbconvert.workbook.Datasource;
import com.twbconvert.workbook.Encoding;
import com.twbconvert.workbook.FieldKey;
import com.twbconvert.workbook.FieldUsage;
import com.twbconvert.workbook.FilterAction;
import com.twbconvert.workbook.JoinEdge;
import com.twbconvert.workbook.Parameter;
import com.twbconvert.workbook.Table;
import com.twbconvert.workbook.TableCalcAddressing;
import com.twbconvert.workbook.WorkbookModel;
import com.twbconvert.workbook.Worksheet;
import com.twbconvert.workbook.WorksheetFilter;
import com.twbconvert.workbook.ZoneType;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Builds a {@link WorkbookModel} from a parsed Tableau workbook document. The extractor keeps no state between
 * calls and never modifies the document it reads.
 */
public final class WorkbookExtractor {
    private static final Logger LOGGER = Logger.getLogger(WorkbookExtractor.class.getName());

    /** Name of the pseudo-datasource that holds workbook parameters. */
    public static final String PARAMETERS_DATASOURCE = "Parameters";

    public ExtractionResult extract(Document document) throws MalformedDocumentException, DuplicateNameException {
        Objects.requireNonNull(document, "document");
        Element root = document.getDocumentElement();
        if (root == null || !"workbook".equals(root.getTagName())) {
            throw new MalformedDocumentException(
                    "Expected a <workbook> root element but found "
                            + (root == null ? "an empty document" : "<" + root.getTagName() + ">"));
        }
        Element datasources = requireChild(root, "datasources");
        Element worksheets = requireChild(root, "worksheets");
        Element dashboards = requireChild(root, "dashboards");

        State state = new State();
        for (Element datasource : children(datasources, "datasource")) {
            extractDatasource(datasource, state);
        }
        for (Element worksheet : children(worksheets, "worksheet")) {
            extractWorksheet(worksheet, state);
        }
        for (Element dashboard : children(dashboards, "dashboard")) {
            extractDashboard(dashboard, state);
        }
        for (Element action : children(child(root, "actions"), "action")) {
            extractAction(action, state);
        }

        WorkbookModel model =
                new WorkbookModel(
                        state.datasources,
                        state.tables,
                        state.calculatedFields,
                        state.parameters,
                        state.joinEdges,
                        state.worksheets,
                        state.dashboards,
                        state.filterActions);
        LOGGER.fine(
                () ->
                        String.format(
                                Locale.ROOT,
                                "Extracted %d tables, %d calculated fields, %d worksheets, %d dashboards",
                                model.getTables().size(),
                                model.getCalculatedFields().size(),
                                model.getWorksheets().size(),
                                model.getDashboards().size()));
        return new ExtractionResult(model, state.assumptions);
    }

    private static Element requireChild(Element parent, String tagName) throws MalformedDocumentException {
        Element element = child(parent, tagName);
        if (element == null) {
            throw new MalformedDocumentException("Missing required <" + tagName + "> element");
        }
        return element;
    }

    private static String requireName(Element element, String kind) throws MalformedDocumentException {
        String name = attr(element, "name");
        if (name == null) {
            throw new MalformedDocumentException("A <" + kind + "> element has no name attribute");
        }
        return name;
    }

    // ---------------------------------------------------------------- datasources

    private void extractDatasource(Element element, State state)
            throws MalformedDocumentException, DuplicateNameException {
        String name = requireName(element, "datasource");
        if (PARAMETERS_DATASOURCE.equals(name)) {
            extractParameters(element, state);
            return;
        }
        Datasource datasource = new Datasource(name, attr(element, "caption"), connectionOf(element));
        state.datasources.add(datasource);

        Map<String, Element> declaredColumns = new LinkedHashMap<>();
        List<Element> calculations = new ArrayList<>();
        for (Element column : children(element, "column")) {
            String columnName = unbracket(attr(column, "name"));
            if (columnName == null) {
                state.assume(
                        AssumptionCategory.EXTRACTION,
                        "datasource " + datasource.getCaption(),
                        "<column>",
                        "",
                        "Column without a name attribute was skipped");
                continue;
            }
            if (child(column, "calculation") != null) {
                calculations.add(column);
            } else {
                declaredColumns.put(columnName, column);
            }
        }

        List<Table> tables = extractTables(datasource, element, declaredColumns, state);
        if (tables.isEmpty() && !calculations.isEmpty()) {
            tables = List.of(new Table(datasource.getCaption(), name, datasource.getCaption(), List.of()));
        }
        for (Table table : tables) {
            if (!state.tableNames.add(table.getName())) {
                throw new DuplicateNameException("table", table.getName(), "the workbook");
            }
            state.tables.add(table);
        }

        String owningTable = tables.isEmpty() ? datasource.getCaption() : tables.get(0).getName();
        Set<String> captions = new HashSet<>();
        for (Element column : calculations) {
            CalculatedField field = calculatedField(datasource, column, owningTable, state);
            if (!captions.add(field.getName())) {
                throw new DuplicateNameException(
                        "calculated field", field.getName(), "datasource " + datasource.getCaption());
            }
            state.calculatedFields.add(field);
        }

        extractJoinRelations(datasource, element, state);
        extractObjectGraph(datasource, element, state);
    }

    private static DataConnection connectionOf(Element datasource) {
        Element connection = child(datasource, "connection");
        if (connection == null) {
            return DataConnection.unknown();
        }
        Element named = path(connection, "named-connections", "named-connection", "connection");
        Element physical = named != null ? named : connection;
        String connectionClass = attr(physical, "class");
        return new DataConnection(
                connectionClass == null ? "" : connectionClass,
                attr(physical, "filename"),
                attr(physical, "server"),
                attr(physical, "dbname"));
    }

    private List<Table> extractTables(
            Datasource datasource, Element element, Map<String, Element> declaredColumns, State state)
            throws DuplicateNameException {
        Map<String, List<Column>> columnsByTable = new LinkedHashMap<>();
        List<Element> records = new ArrayList<>();
        for (Element record : descendants(element, "metadata-record")) {
            if ("column".equals(attr(record, "class"))) {
                records.add(record);
            }
        }

        if (records.isEmpty()) {
            List<Column> columns = new ArrayList<>();
            for (Map.Entry<String, Element> entry : declaredColumns.entrySet()) {
                Element declared = entry.getValue();
                columns.add(
                        column(datasource, entry.getKey(), null, attr(declared, "datatype"), null, declared, state));
            }
            if (!columns.isEmpty()) {
                columnsByTable.put(datasource.getCaption(), columns);
            }
        } else {
            for (Element record : records) {
                String localName = unbracket(text(child(record, "local-name")));
                if (localName == null || localName.isEmpty()) {
                    continue;
                }
                String parent = unbracket(text(child(record, "parent-name")));
                String table = parent == null || parent.isEmpty() ? datasource.getCaption() : parent;
                Element declared = declaredColumns.get(localName);
                String datatype = declared != null && attr(declared, "datatype") != null
                        ? attr(declared, "datatype")
                        : text(child(record, "local-type"));
                columnsByTable
                        .computeIfAbsent(table, key -> new ArrayList<>())
                        .add(
                                column(
                                        datasource,
                                        localName,
                                        text(child(record, "remote-name")),
                                        datatype,
                                        text(child(record, "aggregation")),
                                        declared,
                                        state));
            }
        }

        List<Table> tables = new ArrayList<>();
        for (Map.Entry<String, List<Column>> entry : columnsByTable.entrySet()) {
            Set<String> names = new HashSet<>();
            for (Column column : entry.getValue()) {
                if (!names.add(column.getName())) {
                    throw new DuplicateNameException("column", column.getName(), "table " + entry.getKey());
                }
            }
            tables.add(
                    new Table(
                            entry.getKey(),
                            datasource.getName(),
                            sourceObjectOf(element, entry.getKey()),
                            entry.getValue()));
        }
        return tables;
    }

    private Column column(
            Datasource datasource,
            String internalName,
            String remoteName,
            String datatype,
            String aggregation,
            Element declared,
            State state) {
        String caption = declared == null ? null : attr(declared, "caption");
        String name = caption == null ? internalName : caption;
        DataType dataType = dataTypeOf(datatype, datasource.getCaption() + "/" + name, state);
        ColumnRole role = ColumnRole.fromTableau(declared == null ? null : attr(declared, "role"), dataType);
        String declaredAggregation = declared == null ? null : attr(declared, "aggregation");
        AggregationType defaultAggregation =
                AggregationType.fromTableau(declaredAggregation != null ? declaredAggregation : aggregation, role);
        if (role == ColumnRole.DIMENSION && declaredAggregation == null) {
            defaultAggregation = AggregationType.NONE;
        }
        boolean unique = declared != null && "true".equalsIgnoreCase(attr(declared, "unique"));
        return new Column(name, internalName, remoteName, dataType, role, defaultAggregation, unique);
    }

    private static String sourceObjectOf(Element datasource, String tableName) {
        List<Element> tableRelations = new ArrayList<>();
        for (Element relation : descendants(datasource, "relation")) {
            if ("table".equals(attr(relation, "type"))) {
                tableRelations.add(relation);
            }
        }
        for (Element relation : tableRelations) {
            if (tableName.equals(attr(relation, "name")) && attr(relation, "table") != null) {
                return lastPart(attr(relation, "table"));
            }
        }
        if (tableRelations.size() == 1 && attr(tableRelations.get(0), "table") != null) {
            return lastPart(attr(tableRelations.get(0), "table"));
        }
        return tableName;
    }

    private static DataType dataTypeOf(String datatype, String location, State state) {
        DataType dataType = DataType.fromTableau(datatype);
        if (dataType == DataType.UNSUPPORTED) {
            LOGGER.warning(() -> "Unsupported data type '" + datatype + "' for " + location);
            state.assume(
                    AssumptionCategory.EXTRACTION,
                    location,
                    datatype,
                    "string",
                    "Data type has no counterpart and is treated as unsupported");
        }
        return dataType;
    }

    private CalculatedField calculatedField(Datasource datasource, Element column, String owningTable, State state) {
        String internalName = unbracket(attr(column, "name"));
        String caption = attr(column, "caption");
        String name = caption == null ? internalName : caption;
        Element calculation = child(column, "calculation");
        String formula = attr(calculation, "formula");
        DataType dataType = dataTypeOf(attr(column, "datatype"), datasource.getCaption() + "/" + name, state);
        ColumnRole role = ColumnRole.fromTableau(attr(column, "role"), dataType);
        return new CalculatedField(
                new FieldKey(datasource.getName(), internalName),
                name,
                formula == null ? "" : formula,
                dataType,
                role,
                owningTable,
                attr(column, "default-format"),
                addressingOf(child(calculation, "table-calc")),
                state.nextDeclarationIndex++);
    }

    private static TableCalcAddressing addressingOf(Element tableCalc) {
        if (tableCalc == null) {
            return TableCalcAddressing.none();
        }
        List<String> ordering = new ArrayList<>();
        List<String> partitions = new ArrayList<>();
        String orderingField = attr(tableCalc, "ordering-field");
        if (orderingField != null) {
            ordering.add(fieldNameOf(orderingField));
        }
        for (Element order : children(tableCalc, "order")) {
            if (attr(order, "field") != null) {
                ordering.add(fieldNameOf(attr(order, "field")));
            }
        }
        for (Element partition : children(tableCalc, "partition")) {
            if (attr(partition, "field") != null) {
                partitions.add(fieldNameOf(attr(partition, "field")));
            }
        }
        boolean descending = "desc".equalsIgnoreCase(attr(tableCalc, "direction"));
        return new TableCalcAddressing(ordering, partitions, descending);
    }

    private static String fieldNameOf(String reference) {
        FieldUsage usage = ShelfParser.parseReference(reference);
        return usage != null ? usage.getFieldName() : unbracket(reference);
    }

    private void extractParameters(Element element, State state) {
        for (Element column : children(element, "column")) {
            String internalName = unbracket(attr(column, "name"));
            if (internalName == null) {
                continue;
            }
            String caption = attr(column, "caption");
            String value = attr(column, "value");
            if (value == null) {
                value = attr(child(column, "calculation"), "formula");
            }
            String name = caption == null ? internalName : caption;
            state.parameters.add(
                    new Parameter(
                            name,
                            internalName,
                            dataTypeOf(attr(column, "datatype"), PARAMETERS_DATASOURCE + "/" + name, state),
                            value,
                            attr(column, "param-domain-type")));
        }
    }

    private void extractJoinRelations(Datasource datasource, Element element, State state) {
        for (Element relation : descendants(element, "relation")) {
            if (!"join".equals(attr(relation, "type"))) {
                continue;
            }
            String joinType = attr(relation, "join");
            for (Element clause : children(relation, "clause")) {
                for (Element expression : descendants(clause, "expression")) {
                    if (!"=".equals(attr(expression, "op"))) {
                        continue;
                    }
                    List<Element> operands = children(expression, "expression");
                    if (operands.size() != 2) {
                        continue;
                    }
                    String left = attr(operands.get(0), "op");
                    String right = attr(operands.get(1), "op");
                    String[] leftParts = splitQualified(left);
                    String[] rightParts = splitQualified(right);
                    if (leftParts == null || rightParts == null) {
                        state.assume(
                                AssumptionCategory.EXTRACTION,
                                "datasource " + datasource.getCaption(),
                                left + " = " + right,
                                "",
                                "Join clause without table-qualified operands was skipped");
                        continue;
                    }
                    state.joinEdges.add(
                            new JoinEdge(
                                    datasource.getName(),
                                    leftParts[0],
                                    leftParts[1],
                                    rightParts[0],
                                    rightParts[1],
                                    joinType,
                                    null,
                                    null,
                                    false));
                }
            }
        }
    }

    private static String[] splitQualified(String reference) {
        if (reference == null) {
            return null;
        }
        String trimmed = reference.trim();
        int split = trimmed.indexOf("].[");
        if (split < 0) {
            return null;
        }
        return new String[] {unbracket(trimmed.substring(0, split + 1)), unbracket(trimmed.substring(split + 2))};
    }

    private void extractObjectGraph(Datasource datasource, Element element, State state) {
        Element graph = child(element, "object-graph");
        if (graph == null) {
            return;
        }
        Map<String, String> captionsById = new HashMap<>();
        for (Element object : children(child(graph, "objects"), "object")) {
            String id = attr(object, "id");
            if (id != null) {
                String caption = attr(object, "caption");
                captionsById.put(id, caption == null ? id : caption);
            }
        }
        for (Element relationship : children(child(graph, "relationships"), "relationship")) {
            Element first = child(relationship, "first-end-point");
            Element second = child(relationship, "second-end-point");
            Element expression = child(relationship, "expression");
            List<Element> operands = children(expression, "expression");
            String leftTable = captionsById.get(attr(first, "object-id"));
            String rightTable = captionsById.get(attr(second, "object-id"));
            if (leftTable == null || rightTable == null || operands.size() != 2) {
                state.assume(
                        AssumptionCategory.EXTRACTION,
                        "datasource " + datasource.getCaption(),
                        "<relationship>",
                        "",
                        "Relationship without two resolvable end points was skipped");
                continue;
            }
            boolean bidirectional =
                    "both".equalsIgnoreCase(attr(relationship, "cross-filter"))
                            || "true".equalsIgnoreCase(attr(relationship, "bidirectional"));
            state.joinEdges.add(
                    new JoinEdge(
                            datasource.getName(),
                            leftTable,
                            unbracket(attr(operands.get(0), "op")),
                            rightTable,
                            unbracket(attr(operands.get(1), "op")),
                            "relationship",
                            uniqueHint(first),
                            uniqueHint(second),
                            bidirectional));
        }
    }

    private static Boolean uniqueHint(Element endPoint) {
        String value = attr(endPoint, "unique-key");
        return value == null ? null : Boolean.valueOf(value);
    }

    // ---------------------------------------------------------------- worksheets

    private void extractWorksheet(Element element, State state)
            throws MalformedDocumentException, DuplicateNameException {
        String name = requireName(element, "worksheet");
        if (!state.worksheetNames.add(name)) {
            throw new DuplicateNameException("worksheet", name, "the workbook");
        }
        Element table = child(element, "table");
        Element view = child(table, "view");

        List<String> datasourceNames = new ArrayList<>();
        for (Element datasource : children(child(view, "datasources"), "datasource")) {
            String datasourceName = attr(datasource, "name");
            if (datasourceName != null && !PARAMETERS_DATASOURCE.equals(datasourceName)) {
                datasourceNames.add(datasourceName);
            }
        }

        List<WorksheetFilter> filters = new ArrayList<>();
        List<String> measureNameMembers = new ArrayList<>();
        for (Element filter : children(view, "filter")) {
            FieldUsage usage = ShelfParser.parseReference(attr(filter, "column"));
            if (usage == null) {
                state.assume(
                        AssumptionCategory.EXTRACTION,
                        "worksheet " + name,
                        String.valueOf(attr(filter, "column")),
                        "",
                        "Filter on a field that is not a column instance was skipped");
                continue;
            }
            List<String> members = new ArrayList<>();
            for (Element group : descendants(filter, "groupfilter")) {
                String member = attr(group, "member");
                if (member != null) {
                    members.add(unquoteMember(member));
                }
            }
            if (usage.isMeasureNames()) {
                measureNameMembers.addAll(members);
            } else {
                filters.add(new WorksheetFilter(usage, attr(filter, "class"), members));
            }
        }

        Map<String, TableCalcAddressing> addressing = new LinkedHashMap<>();
        for (Element dependencies : children(view, "datasource-dependencies")) {
            String datasourceName = String.valueOf(attr(dependencies, "datasource"));
            for (Element instance : children(dependencies, "column-instance")) {
                Element tableCalc = child(instance, "table-calc");
                String instanceName = unbracket(attr(instance, "name"));
                if (tableCalc != null && instanceName != null) {
                    String fieldName = ShelfParser.parseInstance(datasourceName, instanceName).getFieldName();
                    addressing.put(fieldName, addressingOf(tableCalc));
                }
            }
        }

        String markClass = null;
        List<Encoding> encodings = new ArrayList<>();
        List<Element> panes = descendants(child(table, "panes"), "pane");
        if (!panes.isEmpty()) {
            Element pane = panes.get(0);
            markClass = attr(child(pane, "mark"), "class");
            for (Element encoding : children(child(pane, "encodings"))) {
                FieldUsage usage = ShelfParser.parseReference(attr(encoding, "column"));
                if (usage != null) {
                    encodings.add(new Encoding(encoding.getTagName(), usage));
                }
            }
        }

        state.worksheets.add(
                new Worksheet(
                        name,
                        datasourceNames,
                        ShelfParser.parseShelf(text(child(table, "rows"))),
                        ShelfParser.parseShelf(text(child(table, "cols"))),
                        markClass,
                        encodings,
                        filters,
                        measureNameMembers,
                        addressing,
                        formattedText(path(element, "layout-options", "title"))));
    }

    private static String unquoteMember(String member) {
        String trimmed = member.trim();
        if (trimmed.length() >= 2 && trimmed.startsWith("\"") && trimmed.endsWith("\"")) {
            return trimmed.substring(1, trimmed.length() - 1).replace("\"\"", "\"");
        }
        return trimmed;
    }

    // ---------------------------------------------------------------- dashboards

    private void extractDashboard(Element element, State state)
            throws MalformedDocumentException, DuplicateNameException {
        String name = requireName(element, "dashboard");
        if (!state.dashboardNames.add(name)) {
            throw new DuplicateNameException("dashboard", name, "the workbook");
        }
        Element size = child(element, "size");
        Integer width = intAttr(size, name, "maxwidth", "width");
        Integer height = intAttr(size, name, "maxheight", "height");

        List<DashboardZone> zones = new ArrayList<>();
        int index = 0;
        for (Element zone : descendants(child(element, "zones"), "zone")) {
            index++;
            String id = attr(zone, "id");
            ZoneType type = zoneTypeOf(zone);
            String text = null;
            if (type == ZoneType.TEXT) {
                text = formattedText(zone);
            } else if (type == ZoneType.TITLE) {
                String formatted = formattedText(zone);
                text = formatted == null ? name : formatted;
            }
            zones.add(
                    new DashboardZone(
                            id == null ? "zone-" + index : id,
                            type,
                            attr(zone, "name"),
                            attr(zone, "param"),
                            doubleAttr(zone, name, "x"),
                            doubleAttr(zone, name, "y"),
                            doubleAttr(zone, name, "w"),
                            doubleAttr(zone, name, "h"),
                            text));
        }
        state.dashboards.add(new Dashboard(name, width, height, zones));
    }

    private static ZoneType zoneTypeOf(Element zone) {
        String type = attr(zone, "type-v2");
        if (type == null) {
            type = attr(zone, "type");
        }
        if (type == null) {
            return attr(zone, "name") != null ? ZoneType.WORKSHEET : ZoneType.LAYOUT;
        }
        switch (type) {
            case "layout-basic":
            case "layout-flow":
                return ZoneType.LAYOUT;
            case "filter":
                return ZoneType.FILTER;
            case "text":
                return ZoneType.TEXT;
            case "title":
                return ZoneType.TITLE;
            default:
                return ZoneType.OTHER;
        }
    }

    private static Integer intAttr(Element element, String dashboard, String... names)
            throws MalformedDocumentException {
        for (String attribute : names) {
            String value = attr(element, attribute);
            if (value != null) {
                try {
                    return Integer.valueOf(value.trim());
                } catch (NumberFormatException ex) {
                    throw new MalformedDocumentException(
                            "Dashboard '" + dashboard + "' has a non-numeric " + attribute + " '" + value + "'", ex);
                }
            }
        }
        return null;
    }

    private static double doubleAttr(Element zone, String dashboard, String attribute)
            throws MalformedDocumentException {
        String value = attr(zone, attribute);
        if (value == null) {
            return 0;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException ex) {
            throw new MalformedDocumentException(
                    "Zone in dashboard '" + dashboard + "' has a non-numeric " + attribute + " '" + value + "'", ex);
        }
    }

    // ---------------------------------------------------------------- actions

    private void extractAction(Element element, State state) {
        String name = attr(element, "caption");
        if (name == null) {
            name = unbracket(attr(element, "name"));
        }
        if (name == null) {
            name = "Action " + (state.filterActions.size() + 1);
        }
        Element source = child(element, "source");
        Element command = child(element, "command");
        String commandName = String.valueOf(attr(command, "command"));
        FilterAction.Kind kind;
        if (commandName.contains("brush")) {
            kind = FilterAction.Kind.HIGHLIGHT;
        } else if (commandName.contains("filter")) {
            kind = FilterAction.Kind.FILTER;
        } else {
            state.assume(
                    AssumptionCategory.EXTRACTION,
                    "action " + name,
                    commandName,
                    "",
                    "Only filter and highlight actions become visual interactions");
            return;
        }
        String target = null;
        List<String> excluded = new ArrayList<>();
        for (Element param : children(command, "param")) {
            String paramName = attr(param, "name");
            String value = attr(param, "value");
            if ("target".equals(paramName)) {
                target = value;
            } else if ("exclude".equals(paramName) && value != null) {
                Arrays.stream(value.split(","))
                        .map(String::trim)
                        .filter(s -> !s.isEmpty())
                        .forEach(excluded::add);
            }
        }
        String sourceDashboard = attr(source, "dashboard");
        state.filterActions.add(
                new FilterAction(
                        name,
                        kind,
                        sourceDashboard,
                        attr(source, "worksheet"),
                        target == null ? sourceDashboard : target,
                        excluded));
    }

    /** Mutable accumulator for one extraction call. */
    private static final class State {
        final List<Datasource> datasources = new ArrayList<>();
        final List<Table> tables = new ArrayList<>();
        final List<CalculatedField> calculatedFields = new ArrayList<>();
        final List<Parameter> parameters = new ArrayList<>();
        final List<JoinEdge> joinEdges = new ArrayList<>();
        final List<Worksheet> worksheets = new ArrayList<>();
        final List<Dashboard> dashboards = new ArrayList<>();
        final List<FilterAction> filterActions = new ArrayList<>();
        final List<Assumption> assumptions = new ArrayList<>();
        final Set<String> tableNames = new HashSet<>();
        final Set<String> worksheetNames = new HashSet<>();
        final Set<String> dashboardNames = new HashSet<>();
        int nextDeclarationIndex;

        void assume(AssumptionCategory category, String location, String source, String target, String reason) {
            assumptions.add(new Assumption(category, location, source, target, reason));
        }
    }
}
