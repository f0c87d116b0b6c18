package com.twbconvert.pbip.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** One {@code tables/<fileName>.tmdl} document. */
public final class ModelTable {
    private final String name;
    private final String fileName;
    private final String lineageTag;
    private final List<ModelColumn> columns;
    private final List<ModelMeasure> measures;
    private final ModelPartition partition;

    public ModelTable(
            String name,
            String fileName,
            String lineageTag,
            List<ModelColumn> columns,
            List<ModelMeasure> measures,
            ModelPartition partition) {
        this.name = Objects.requireNonNull(name, "name");
        this.fileName = Objects.requireNonNull(fileName, "fileName");
        this.lineageTag = Objects.requireNonNull(lineageTag, "lineageTag");
        this.columns = List.copyOf(columns);
        this.measures = List.copyOf(measures);
        this.partition = Objects.requireNonNull(partition, "partition");
    }

    public String getName() {
        return name;
    }

    public String getFileName() {
        return fileName;
    }

    public String getLineageTag() {
        return lineageTag;
    }

    public List<ModelColumn> getColumns() {
        return columns;
    }

    public List<ModelMeasure> getMeasures() {
        return measures;
    }

    public ModelPartition getPartition() {
        return partition;
    }

    public Optional<ModelColumn> findColumn(String columnName) {
        return columns.stream().filter(c -> c.getName().equals(columnName)).findFirst();
    }

    public Optional<ModelMeasure> findMeasure(String measureName) {
        return measures.stream().filter(m -> m.getName().equals(measureName)).findFirst();
    }
}
