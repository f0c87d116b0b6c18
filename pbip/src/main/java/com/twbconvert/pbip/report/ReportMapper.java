package com.twbconvert.pbip.report;

import com.twbconvert.assumption.Assumption;
import com.twbconvert.assumption.AssumptionCategory;
import com.twbconvert.assumption.AssumptionLog;
import com.twbconvert.extract.ShelfParser;
import com.twbconvert.pbip.ConversionOptions;
import com.twbconvert.pbip.LayoutHints;
import com.twbconvert.pbip.StableIdentifiers;
import com.twbconvert.pbip.model.ModelColumn;
import com.twbconvert.pbip.model.ModelMeasure;
import com.twbconvert.pbip.model.ModelTable;
import com.twbconvert.translate.FieldSymbol;
import com.twbconvert.translate.SymbolTable;
import com.twbconvert.translate.TranslationResult;
import com.twbconvert.workbook.Dashboard;
import com.twbconvert.workbook.DashboardZone;
import com.twbconvert.workbook.DataType;
import com.twbconvert.workbook.Encoding;
import com.twbconvert.workbook.FieldUsage;
import com.twbconvert.workbook.FilterAction;
import com.twbconvert.workbook.WorkbookModel;
import com.twbconvert.workbook.Worksheet;
import com.twbconvert.workbook.WorksheetFilter;
import com.twbconvert.workbook.ZoneType;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Maps worksheets to visuals and dashboards to pages.
 *
 * <p>The visual type comes from the worksheet's mark class:</p>
 *
 * <table>
 *   <caption>Mark class to visual type</caption>
 *   <tr><th>Mark</th><th>Visual</th></tr>
 *   <tr><td>Bar</td><td>columnChart</td></tr>
 *   <tr><td>Line</td><td>lineChart</td></tr>
 *   <tr><td>Area</td><td>areaChart</td></tr>
 *   <tr><td>Pie</td><td>pieChart</td></tr>
 *   <tr><td>Circle, Square, Shape</td><td>scatterChart</td></tr>
 *   <tr><td>Multipolygon</td><td>filledMap</td></tr>
 *   <tr><td>Map</td><td>map</td></tr>
 *   <tr><td>Text</td><td>card for a lone measure, matrix with dimensions on both shelves, else tableEx</td></tr>
 *   <tr><td>Automatic, other</td><td>lineChart with a date dimension, map with a geographic one, else tableEx</td></tr>
 * </table>
 *
 * <p>Worksheets using Measure Names always become tableEx. Every projection must resolve to an emitted column or
 * measure; one that does not is dropped on its own and reported.</p>
 */
public final class ReportMapper {
    private static final Logger LOGGER = Logger.getLogger(ReportMapper.class.getName());

    static final double MARGIN = 20;

    private static final Map<String, String> VISUAL_BY_MARK =
            Map.of(
                    "Bar", "columnChart",
                    "Line", "lineChart",
                    "Area", "areaChart",
                    "Pie", "pieChart",
                    "Circle", "scatterChart",
                    "Square", "scatterChart",
                    "Shape", "scatterChart",
                    "Multipolygon", "filledMap",
                    "Map", "map");

    private static final Set<String> GEOGRAPHIC =
            Set.of(
                    "latitude",
                    "longitude",
                    "country",
                    "country/region",
                    "state",
                    "state/province",
                    "city",
                    "county",
                    "postal code",
                    "zip code");

    private static final Set<String> UNDERIVED = Set.of("none", "usr", "attr");
    private static final String GENERATED_SUFFIX = "(generated)";

    public ReportMappingResult map(
            WorkbookModel model,
            TranslationResult translation,
            List<ModelTable> tables,
            ConversionOptions options,
            AssumptionLog log) {
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(translation, "translation");
        Objects.requireNonNull(tables, "tables");
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(log, "log");
        return new Mapping(model, translation.getSymbols(), tables, options, log).run();
    }

    /** A resolved projection plus where it came from. */
    private static final class Placed {
        final Projection projection;
        final String shelf;
        final DataType dataType;

        Placed(Projection projection, String shelf, DataType dataType) {
            this.projection = projection;
            this.shelf = shelf;
            this.dataType = dataType;
        }

        boolean isMeasure() {
            return projection.isMeasureLike();
        }

        boolean isPrimary() {
            return "rows".equals(shelf) || "cols".equals(shelf);
        }
    }

    private static final class Mapping {
        private final WorkbookModel model;
        private final SymbolTable symbols;
        private final Map<String, ModelTable> tables = new HashMap<>();
        private final ConversionOptions options;
        private final AssumptionLog log;
        private final List<UnresolvedFieldProjectionException> failures = new ArrayList<>();

        Mapping(
                WorkbookModel model,
                SymbolTable symbols,
                List<ModelTable> tables,
                ConversionOptions options,
                AssumptionLog log) {
            this.model = model;
            this.symbols = symbols;
            for (ModelTable table : tables) {
                this.tables.put(table.getName(), table);
            }
            this.options = options;
            this.log = log;
        }

        ReportMappingResult run() {
            List<PageSpec> pages = new ArrayList<>();
            Set<String> placedWorksheets = new HashSet<>();
            List<Dashboard> dashboards = model.getDashboards();
            for (int i = 0; i < dashboards.size(); i++) {
                pages.add(dashboardPage(dashboards.get(i), i, placedWorksheets));
            }
            List<Worksheet> worksheets = model.getWorksheets();
            for (int i = 0; i < worksheets.size(); i++) {
                Worksheet worksheet = worksheets.get(i);
                if (!placedWorksheets.contains(worksheet.getName())) {
                    pages.add(worksheetPage(worksheet, i));
                }
            }
            if (pages.isEmpty()) {
                String name = StableIdentifiers.pageName("page:Page 1");
                pages.add(
                        new PageSpec(
                                name, "Page 1", null, options.getPageWidth(), options.getPageHeight(), List.of(), List.of()));
            }
            pages = applyActions(pages);
            LOGGER.fine(() -> "Mapped " + worksheets.size() + " worksheet(s) and " + dashboards.size() + " dashboard(s)");
            return new ReportMappingResult(new ReportSpec(pages, pages.get(0).getName()), failures);
        }

        // ------------------------------------------------------------ pages

        private PageSpec dashboardPage(Dashboard dashboard, int dashboardIndex, Set<String> placedWorksheets) {
            int entity = model.getWorksheets().size() + dashboardIndex;
            int width = dashboard.getDeclaredWidth() != null ? dashboard.getDeclaredWidth() : options.getPageWidth();
            int height = dashboard.getDeclaredHeight() != null ? dashboard.getDeclaredHeight() : options.getPageHeight();
            String pageName = StableIdentifiers.pageName("dashboard:" + dashboard.getName());

            DashboardZone root = null;
            for (DashboardZone zone : dashboard.getZones()) {
                if (zone.getWidth() > 0 && zone.getHeight() > 0) {
                    root = zone;
                    break;
                }
            }
            List<VisualSpec> visuals = new ArrayList<>();
            for (DashboardZone zone : dashboard.getZones()) {
                int order = visuals.size();
                String visualName = StableIdentifiers.visualName(pageName, "zone:" + zone.getId());
                ZoneType type = zone.getType();
                if (type == ZoneType.WORKSHEET) {
                    Optional<Worksheet> worksheet = model.findWorksheet(zone.getWorksheetName());
                    if (worksheet.isEmpty()) {
                        assume(entity, dashboard.getName(), zone.getWorksheetName(), "",
                                "Zone shows a worksheet the workbook does not define; the zone was skipped");
                        continue;
                    }
                    placedWorksheets.add(worksheet.get().getName());
                    Position position = hasLayout(zone)
                            ? scaled(zone, root, width, height, order)
                            : fallbackPosition(worksheet.get().getName(), width, height, order);
                    int worksheetIndex = model.getWorksheets().indexOf(worksheet.get());
                    visuals.add(worksheetVisual(worksheet.get(), worksheetIndex, visualName, position));
                } else if (type == ZoneType.FILTER) {
                    slicer(zone, dashboard.getName(), entity, visualName, scaled(zone, root, width, height, order))
                            .ifPresent(visuals::add);
                } else if (type == ZoneType.TEXT) {
                    if (zone.getText() != null && !zone.getText().isBlank()) {
                        visuals.add(textbox(visualName, zone.getText(), scaled(zone, root, width, height, order)));
                    }
                } else if (type == ZoneType.TITLE) {
                    String title = zone.getText() != null ? zone.getText() : dashboard.getName();
                    visuals.add(textbox(visualName, title, scaled(zone, root, width, height, order)));
                }
            }
            return new PageSpec(pageName, dashboard.getName(), dashboard.getName(), width, height, visuals, List.of());
        }

        private PageSpec worksheetPage(Worksheet worksheet, int worksheetIndex) {
            int width = options.getPageWidth();
            int height = options.getPageHeight();
            String pageName = StableIdentifiers.pageName("worksheet:" + worksheet.getName());
            String visualName = StableIdentifiers.visualName(pageName, "worksheet:" + worksheet.getName());
            VisualSpec visual = worksheetVisual(
                    worksheet, worksheetIndex, visualName, fallbackPosition(worksheet.getName(), width, height, 0));
            return new PageSpec(pageName, worksheet.getName(), null, width, height, List.of(visual), List.of());
        }

        private static boolean hasLayout(DashboardZone zone) {
            return zone.getWidth() > 0 && zone.getHeight() > 0;
        }

        /** Zone rectangle scaled from the root zone's coordinate space to the page. */
        private static Position scaled(DashboardZone zone, DashboardZone root, int width, int height, int order) {
            if (root == null) {
                return Position.of(zone.getX(), zone.getY(), zone.getWidth(), zone.getHeight(), order);
            }
            double scaleX = width / root.getWidth();
            double scaleY = height / root.getHeight();
            return Position.of(
                    (zone.getX() - root.getX()) * scaleX,
                    (zone.getY() - root.getY()) * scaleY,
                    zone.getWidth() * scaleX,
                    zone.getHeight() * scaleY,
                    order);
        }

        private Position fallbackPosition(String worksheet, int width, int height, int order) {
            Optional<LayoutHints.Rectangle> hint = options.getLayoutHints().forWorksheet(worksheet);
            if (hint.isPresent()) {
                LayoutHints.Rectangle r = hint.get();
                return Position.of(r.getX(), r.getY(), r.getWidth(), r.getHeight(), order);
            }
            return Position.of(MARGIN, MARGIN, width - 2 * MARGIN, height - 2 * MARGIN, order);
        }

        // ------------------------------------------------------------ visuals

        private VisualSpec worksheetVisual(Worksheet worksheet, int index, String visualName, Position position) {
            String owner = worksheet.getName();
            List<Placed> placed = new ArrayList<>();
            for (FieldUsage usage : worksheet.getRows()) {
                place(usage, "rows", owner, index).ifPresent(placed::add);
            }
            for (FieldUsage usage : worksheet.getColumns()) {
                place(usage, "cols", owner, index).ifPresent(placed::add);
            }
            for (Encoding encoding : worksheet.getEncodings()) {
                place(encoding.getUsage(), encoding.getChannel().toLowerCase(Locale.ROOT), owner, index)
                        .ifPresent(placed::add);
            }

            String visualType = visualType(worksheet, placed, index);
            List<Projection> projections = new ArrayList<>();
            Set<String> seen = new HashSet<>();
            if (worksheet.usesMeasureNames()) {
                for (Placed field : placed) {
                    if (field.isPrimary()) {
                        add(projections, seen, field.projection.withRole("Values"));
                    }
                }
                for (String member : worksheet.getMeasureNameMembers()) {
                    FieldUsage usage = ShelfParser.parseReference(member);
                    if (usage == null) {
                        assume(index, owner, member, "", "Measure Names member is not a field reference and was skipped");
                        continue;
                    }
                    place(usage, "text", owner, index)
                            .ifPresent(field -> add(projections, seen, field.projection.withRole("Values")));
                }
            } else {
                int measureOrdinal = 0;
                for (Placed field : placed) {
                    String role = role(visualType, field, measureOrdinal);
                    if (field.isMeasure() && field.isPrimary()) {
                        measureOrdinal++;
                    }
                    if (role == null) {
                        LOGGER.fine(() -> "No " + visualType + " role for " + field.shelf + " field "
                                + field.projection.queryRef() + " in " + owner);
                        continue;
                    }
                    add(projections, seen, field.projection.withRole(role));
                }
            }

            List<Projection> filters = new ArrayList<>();
            for (WorksheetFilter filter : worksheet.getFilters()) {
                place(filter.getUsage(), "filter", owner, index)
                        .ifPresent(field -> add(filters, new HashSet<>(), field.projection.withRole("Filter")));
            }
            String title = worksheet.getTitle() != null ? worksheet.getTitle() : worksheet.getName();
            return new VisualSpec(visualName, owner, visualType, projections, filters, position, title, null);
        }

        private static void add(List<Projection> projections, Set<String> seen, Projection projection) {
            if (seen.add(projection.getRole() + "\u0000" + projection.queryRef())) {
                projections.add(projection);
            }
        }

        private String visualType(Worksheet worksheet, List<Placed> placed, int index) {
            if (worksheet.usesMeasureNames()) {
                return "tableEx";
            }
            String mark = worksheet.getMarkClass();
            boolean dimensionsOnRows = false;
            boolean dimensionsOnColumns = false;
            int measures = 0;
            boolean temporal = false;
            boolean geographic = false;
            for (Placed field : placed) {
                if (field.isMeasure()) {
                    if (field.isPrimary() || "text".equals(field.shelf) || "label".equals(field.shelf)) {
                        measures++;
                    }
                    continue;
                }
                dimensionsOnRows |= "rows".equals(field.shelf);
                dimensionsOnColumns |= "cols".equals(field.shelf);
                temporal |= field.isPrimary() && field.dataType.isTemporal();
                geographic |= GEOGRAPHIC.contains(field.projection.getProperty().toLowerCase(Locale.ROOT));
            }
            if ("Text".equals(mark)) {
                if (measures == 1 && !dimensionsOnRows && !dimensionsOnColumns) {
                    return "card";
                }
                return dimensionsOnRows && dimensionsOnColumns ? "matrix" : "tableEx";
            }
            String mapped = mark == null ? null : VISUAL_BY_MARK.get(mark);
            if (mapped != null) {
                return mapped;
            }
            String fallback = temporal ? "lineChart" : geographic ? "map" : "tableEx";
            assume(index, worksheet.getName(), mark, fallback,
                    "Mark class has no direct visual; chosen from the fields on the shelves");
            return fallback;
        }

        /** Visual role for a field, or {@code null} when the visual has no place for it. */
        private static String role(String visualType, Placed field, int measureOrdinal) {
            String shelf = field.shelf;
            boolean primary = field.isPrimary() || "text".equals(shelf) || "label".equals(shelf);
            boolean measure = field.isMeasure();
            switch (visualType) {
                case "columnChart":
                case "lineChart":
                case "areaChart":
                    if (primary) {
                        return measure ? "Y" : "Category";
                    }
                    return "color".equals(shelf) && !measure ? "Series" : null;
                case "pieChart":
                    if (measure) {
                        return primary || "size".equals(shelf) || "wedge-size".equals(shelf) ? "Y" : null;
                    }
                    return primary || "color".equals(shelf) ? "Category" : null;
                case "scatterChart":
                    if (measure) {
                        if ("size".equals(shelf)) {
                            return "Size";
                        }
                        if (!field.isPrimary()) {
                            return null;
                        }
                        return measureOrdinal == 0 ? "X" : measureOrdinal == 1 ? "Y" : "Size";
                    }
                    if ("color".equals(shelf)) {
                        return "Series";
                    }
                    return primary || "lod".equals(shelf) ? "Category" : null;
                case "map":
                    if (measure) {
                        return primary || "size".equals(shelf) ? "Size" : null;
                    }
                    return primary || "lod".equals(shelf) || "color".equals(shelf) ? "Category" : null;
                case "filledMap":
                    if (measure) {
                        return primary || "color".equals(shelf) ? "Tooltips" : null;
                    }
                    return primary || "lod".equals(shelf) ? "Location" : null;
                case "matrix":
                    if (measure) {
                        return primary ? "Values" : null;
                    }
                    if ("rows".equals(shelf)) {
                        return "Rows";
                    }
                    return "cols".equals(shelf) ? "Columns" : null;
                case "card":
                    return measure && primary ? "Values" : null;
                default:
                    return primary || (!measure && "color".equals(shelf)) ? "Values" : null;
            }
        }

        private Optional<VisualSpec> slicer(
                DashboardZone zone, String dashboard, int entity, String visualName, Position position) {
            FieldUsage usage = ShelfParser.parseReference(zone.getFilterParameter());
            if (usage == null) {
                assume(entity, dashboard, String.valueOf(zone.getFilterParameter()), "",
                        "Filter zone does not name a field; no slicer was created");
                return Optional.empty();
            }
            return place(usage, "filter", dashboard, entity)
                    .map(field -> new VisualSpec(
                            visualName,
                            null,
                            "slicer",
                            List.of(field.projection.withRole("Values")),
                            List.of(),
                            position,
                            field.projection.getProperty(),
                            null));
        }

        private static VisualSpec textbox(String visualName, String text, Position position) {
            return new VisualSpec(visualName, null, "textbox", List.of(), List.of(), position, null, text);
        }

        // ------------------------------------------------------------ projections

        private Optional<Placed> place(FieldUsage usage, String shelf, String owner, int index) {
            if (usage.isMeasureNames() || usage.isMeasureValues()) {
                return Optional.empty();
            }
            if (usage.getFieldName().endsWith(GENERATED_SUFFIX)) {
                assume(index, owner, usage.getFieldName(), "",
                        "Generated geocoding field has no model counterpart; the map locates by its geographic field");
                return Optional.empty();
            }
            try {
                return Optional.of(resolve(usage, shelf, owner, index));
            } catch (UnresolvedFieldProjectionException e) {
                LOGGER.warning(e.getMessage());
                failures.add(e);
                assume(index, owner, usage.toString(), "",
                        "Field is not an emitted column or measure; the projection was dropped");
                return Optional.empty();
            }
        }

        private Placed resolve(FieldUsage usage, String shelf, String owner, int index)
                throws UnresolvedFieldProjectionException {
            Optional<FieldSymbol> resolved = symbols.resolve(usage.getDatasource(), usage.getFieldName(), usage.getDatasource());
            if (resolved.isEmpty()) {
                throw new UnresolvedFieldProjectionException(owner, usage.getFieldName());
            }
            FieldSymbol symbol = resolved.get();
            ModelTable table = tables.get(symbol.getTable());
            if (table == null) {
                throw new UnresolvedFieldProjectionException(owner, symbol.getTable() + "." + symbol.getName());
            }
            if (!symbol.isRowLevel()) {
                Optional<ModelMeasure> measure = table.findMeasure(symbol.getName());
                if (measure.isEmpty()) {
                    throw new UnresolvedFieldProjectionException(owner, table.getName() + "." + symbol.getName());
                }
                return new Placed(
                        new Projection(shelf, Projection.Kind.MEASURE, table.getName(), symbol.getName(), null,
                                measure.get().getLineageTag()),
                        shelf,
                        symbol.getDataType());
            }
            Optional<ModelColumn> column = table.findColumn(symbol.getName());
            if (column.isEmpty()) {
                throw new UnresolvedFieldProjectionException(owner, table.getName() + "." + symbol.getName());
            }
            AggregateFunction aggregation = AggregateFunction.of(usage.impliedAggregation());
            if (aggregation == null && !UNDERIVED.contains(usage.getDerivation())) {
                assume(index, owner, usage.toString(), table.getName() + "." + symbol.getName(),
                        "Date part derivation '" + usage.getDerivation() + "' is projected as the whole column");
            }
            Projection.Kind kind = aggregation == null ? Projection.Kind.COLUMN : Projection.Kind.AGGREGATION;
            return new Placed(
                    new Projection(shelf, kind, table.getName(), symbol.getName(), aggregation, column.get().getLineageTag()),
                    shelf,
                    symbol.getDataType());
        }

        // ------------------------------------------------------------ actions

        private List<PageSpec> applyActions(List<PageSpec> pages) {
            Map<String, Map<String, VisualInteraction>> byPage = new LinkedHashMap<>();
            List<FilterAction> actions = model.getFilterActions();
            int base = model.getWorksheets().size() + model.getDashboards().size();
            for (int i = 0; i < actions.size(); i++) {
                FilterAction action = actions.get(i);
                Optional<PageSpec> page = pages.stream()
                        .filter(p -> action.getSourceDashboard() != null
                                && action.getSourceDashboard().equals(p.getSourceDashboard()))
                        .findFirst();
                if (page.isEmpty()) {
                    assume(base + i, action.getName(), String.valueOf(action.getSourceDashboard()), "",
                            "Action source is not a dashboard page; the action was skipped");
                    continue;
                }
                if (action.getTargetDashboard() != null
                        && !action.getTargetDashboard().equals(action.getSourceDashboard())) {
                    assume(base + i, action.getName(), action.getTargetDashboard(), "",
                            "Actions targeting another dashboard have no page interaction; the action was skipped");
                    continue;
                }
                VisualInteraction.Type type = action.getKind() == FilterAction.Kind.HIGHLIGHT
                        ? VisualInteraction.Type.HIGHLIGHT_FILTER
                        : VisualInteraction.Type.DATA_FILTER;
                Map<String, VisualInteraction> interactions =
                        byPage.computeIfAbsent(page.get().getName(), n -> new LinkedHashMap<>());
                for (VisualSpec source : page.get().getVisuals()) {
                    if (source.getSourceWorksheet() == null
                            || (action.getSourceWorksheet() != null
                                    && !action.getSourceWorksheet().equals(source.getSourceWorksheet()))) {
                        continue;
                    }
                    for (VisualSpec target : page.get().getVisuals()) {
                        if (target == source || target.getSourceWorksheet() == null) {
                            continue;
                        }
                        VisualInteraction.Type effective =
                                action.getExcludedSheets().contains(target.getSourceWorksheet())
                                        ? VisualInteraction.Type.NO_FILTER
                                        : type;
                        interactions.putIfAbsent(
                                source.getName() + "\u0000" + target.getName(),
                                new VisualInteraction(source.getName(), target.getName(), effective));
                    }
                }
            }
            if (byPage.isEmpty()) {
                return pages;
            }
            List<PageSpec> result = new ArrayList<>(pages.size());
            for (PageSpec page : pages) {
                Map<String, VisualInteraction> interactions = byPage.get(page.getName());
                result.add(interactions == null
                        ? page
                        : new PageSpec(
                                page.getName(),
                                page.getDisplayName(),
                                page.getSourceDashboard(),
                                page.getWidth(),
                                page.getHeight(),
                                page.getVisuals(),
                                new ArrayList<>(interactions.values())));
            }
            return result;
        }

        private void assume(int index, String location, String source, String target, String reason) {
            log.append(index, new Assumption(AssumptionCategory.REPORT, location, source, target, reason));
        }
    }
}
