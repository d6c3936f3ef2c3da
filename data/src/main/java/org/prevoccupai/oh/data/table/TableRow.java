package org.prevoccupai.oh.data.table;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One row of a {@link TidyTable}. Only observed cells are stored; any column of the owning table that the row does
 * not hold reads as {@code null}, the missing marker.
 */
public class TableRow {

    private final Map<String, Object> cells;

    public TableRow() {
        this.cells = new LinkedHashMap<>();
    }

    public TableRow(Map<String, ?> values) {
        this();
        values.forEach(this::put);
    }

    public Object get(String column) {
        return cells.get(column);
    }

    public boolean isMissing(String column) {
        return cells.get(column) == null;
    }

    /**
     * Setting a null value clears the cell.
     */
    public TableRow put(String column, Object value) {
        if (value == null) {
            cells.remove(column);
        } else {
            cells.put(column, value);
        }
        return this;
    }

    public TableRow remove(String column) {
        cells.remove(column);
        return this;
    }

    public String getString(String column) {
        Object value = cells.get(column);
        return value == null ? null : value.toString();
    }

    /**
     * @return the numeric value of the cell, or null if it is missing or not a number
     */
    public Double getDouble(String column) {
        Object value = cells.get(column);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return null;
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(cells);
    }

    public TableRow copy() {
        return new TableRow(cells);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return cells.equals(((TableRow) o).cells);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cells);
    }

    @Override
    public String toString() {
        return cells.toString();
    }
}
