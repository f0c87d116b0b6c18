package com.twbconvert.workbook;

import java.util.Objects;

/**
 * One equality predicate of a join or logical-table relationship. Uniqueness hints are {@code null} when the
 * workbook does not declare them for that side.
 */
public final class JoinEdge {
    private final String datasourceName;
    private final String leftTable;
    private final String leftColumn;
    private final String rightTable;
    private final String rightColumn;
    private final String joinType;
    private final Boolean leftUnique;
    private final Boolean rightUnique;
    private final boolean bidirectional;

    public JoinEdge(
            String datasourceName,
            String leftTable,
            String leftColumn,
            String rightTable,
            String rightColumn,
            String joinType,
            Boolean leftUnique,
            Boolean rightUnique,
            boolean bidirectional) {
        this.datasourceName = Objects.requireNonNull(datasourceName, "datasourceName");
        this.leftTable = Objects.requireNonNull(leftTable, "leftTable");
        this.leftColumn = Objects.requireNonNull(leftColumn, "leftColumn");
        this.rightTable = Objects.requireNonNull(rightTable, "rightTable");
        this.rightColumn = Objects.requireNonNull(rightColumn, "rightColumn");
        this.joinType = joinType == null ? "inner" : joinType;
        this.leftUnique = leftUnique;
        this.rightUnique = rightUnique;
        this.bidirectional = bidirectional;
    }

    public String getDatasourceName() {
        return datasourceName;
    }

    public String getLeftTable() {
        return leftTable;
    }

    public String getLeftColumn() {
        return leftColumn;
    }

    public String getRightTable() {
        return rightTable;
    }

    public String getRightColumn() {
        return rightColumn;
    }

    public String getJoinType() {
        return joinType;
    }

    public Boolean getLeftUnique() {
        return leftUnique;
    }

    public Boolean getRightUnique() {
        return rightUnique;
    }

    public boolean isBidirectional() {
        return bidirectional;
    }

    public String describe() {
        return "[" + leftTable + "].[" + leftColumn + "] = [" + rightTable + "].[" + rightColumn + "]";
    }
}
