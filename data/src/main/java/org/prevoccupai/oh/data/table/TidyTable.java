package org.prevoccupai.oh.data.table;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Row/column table with a uniform schema. The column list is ordered and every row exposes every column; a cell
 * that was never observed reads as {@code null}.
 *
 * Tables are built incrementally by the extractor and then handed out by value: every transforming operation in
 * the processing layer works on a {@link #copy()}.
 */
public class TidyTable {

    private final LinkedHashSet<String> columns;
    private final List<TableRow> rows;

    public TidyTable() {
        this(List.of());
    }

    public TidyTable(Collection<String> columns) {
        this.columns = new LinkedHashSet<>(columns);
        this.rows = new ArrayList<>();
    }

    public static TidyTable empty() {
        return new TidyTable();
    }

    public List<String> getColumns() {
        return List.copyOf(columns);
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    public List<TableRow> getRows() {
        return Collections.unmodifiableList(rows);
    }

    public TableRow getRow(int index) {
        return rows.get(index);
    }

    public int size() {
        return rows.size();
    }

    /**
     * A table is empty when it has no rows, whatever its schema.
     */
    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * Appends a column to the schema if it is not there yet. Existing rows read it as missing.
     */
    public TidyTable addColumn(String column) {
        columns.add(column);
        return this;
    }

    public TidyTable addColumns(Collection<String> newColumns) {
        columns.addAll(newColumns);
        return this;
    }

    /**
     * Adds a row, extending the schema with any column the row introduces.
     */
    public TidyTable addRow(TableRow row) {
        columns.addAll(row.asMap().keySet());
        rows.add(row);
        return this;
    }

    public TidyTable addRow(Map<String, ?> values) {
        return addRow(new TableRow(values));
    }

    public Object get(int rowIndex, String column) {
        return rows.get(rowIndex).get(column);
    }

    public List<Object> column(String column) {
        List<Object> values = new ArrayList<>(rows.size());
        for (TableRow row : rows) {
            values.add(row.get(column));
        }
        return values;
    }

    public TidyTable copy() {
        TidyTable copy = new TidyTable(columns);
        for (TableRow row : rows) {
            copy.rows.add(row.copy());
        }
        return copy;
    }

    public TidyTable filterRows(Predicate<TableRow> predicate) {
        TidyTable filtered = new TidyTable(columns);
        for (TableRow row : rows) {
            if (predicate.test(row)) {
                filtered.rows.add(row.copy());
            }
        }
        return filtered;
    }

    /**
     * Stable sort into a new table.
     */
    public TidyTable sortRows(Comparator<TableRow> order) {
        TidyTable sorted = copy();
        sorted.rows.sort(order);
        return sorted;
    }

    public TidyTable dropColumns(Set<String> toDrop) {
        List<String> kept = new ArrayList<>(columns);
        kept.removeAll(toDrop);
        TidyTable result = new TidyTable(kept);
        for (TableRow row : rows) {
            TableRow copy = row.copy();
            toDrop.forEach(copy::remove);
            result.rows.add(copy);
        }
        return result;
    }

    @Override
    public String toString() {
        return "TidyTable{columns=" + columns + ", rows=" + rows.size() + "}";
    }
}
