package domain.lineage;

import domain.model.CteBoundary;

/** Column-list text between the outermost SELECT keyword and its FROM, plus where it was found. */
final class ProjectionSlice {

    private final String columnList;
    private final CteBoundary boundary;

    ProjectionSlice(String columnList, CteBoundary boundary) {
        this.columnList = columnList == null ? "" : columnList;
        this.boundary = boundary;
    }

    String getColumnList() {
        return columnList;
    }

    CteBoundary getBoundary() {
        return boundary;
    }

    /** Drops a leading DISTINCT so it is not read as part of the first expression. */
    static String stripDistinct(String columnList) {
        int i = 0;
        while (i < columnList.length() && Character.isWhitespace(columnList.charAt(i))) i++;
        if (SqlScan.isWordAt(columnList, i, "DISTINCT")) return columnList.substring(i + "DISTINCT".length());
        return columnList;
    }
}
