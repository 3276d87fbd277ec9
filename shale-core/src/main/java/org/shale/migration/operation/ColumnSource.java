package org.shale.migration.operation;

/**
 * Where a column of a rebuilt table gets its value from: either a column of the original row
 * ({@code sourceColumn}) or a raw SQL expression evaluated against the original row.
 */
public record ColumnSource(String targetColumn, String sourceColumn, String expression) {

    public static ColumnSource carry(String targetColumn, String sourceColumn) {
        return new ColumnSource(targetColumn, sourceColumn, null);
    }

    public static ColumnSource expression(String targetColumn, String expression) {
        return new ColumnSource(targetColumn, null, expression);
    }

    public boolean isCarried() {
        return expression == null;
    }
}
