package org.prevoccupai.oh.processing.compose;

import com.google.common.base.Preconditions;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import org.prevoccupai.oh.data.profile.ProfileDates;
import org.prevoccupai.oh.data.table.Columns;
import org.prevoccupai.oh.data.table.TableRow;
import org.prevoccupai.oh.data.table.TidyTable;
import org.prevoccupai.oh.exception.ExtractionConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Combines and derives columns on extracted tables. Every operation returns a new table and leaves its inputs
 * untouched.
 */
@Service
public class TableComposer {

    public static final String DEFAULT_GROUP_MARKER = "distributions";
    public static final int DEFAULT_MIN_GROUP_SIZE = 2;
    public static final double GROUP_FILL_VALUE = 0.0;

    private static final Logger log = LoggerFactory.getLogger(TableComposer.class);

    public TidyTable outerMerge(TidyTable left, TidyTable right) {
        return outerMerge(left, right, Columns.SESSION_KEYS);
    }

    /**
     * Full outer join on the key columns. Rows of {@code left} come first, in order, each joined with every
     * {@code right} row sharing its key; {@code right} rows whose key never occurred on the left follow. Missing key
     * cells are equal to each other. A non-key column present on both sides takes the left value unless it is
     * missing.
     *
     * @throws ExtractionConfigurationException if a key column is absent from a non-empty input
     */
    public TidyTable outerMerge(TidyTable left, TidyTable right, List<String> keys) {
        Set<String> columns = new LinkedHashSet<>(left.getColumns());
        columns.addAll(right.getColumns());
        if (left.isEmpty() && right.isEmpty()) {
            return new TidyTable(columns);
        }
        if (right.isEmpty()) {
            return left.copy();
        }
        if (left.isEmpty()) {
            return right.copy();
        }
        requireColumns(left, keys, "left");
        requireColumns(right, keys, "right");

        Map<List<Object>, List<TableRow>> rightByKey = new LinkedHashMap<>();
        for (TableRow row : right.getRows()) {
            rightByKey.computeIfAbsent(keyOf(row, keys), key -> new ArrayList<>()).add(row);
        }

        TidyTable merged = new TidyTable(columns);
        Set<List<Object>> matchedKeys = new HashSet<>();
        for (TableRow leftRow : left.getRows()) {
            List<Object> key = keyOf(leftRow, keys);
            List<TableRow> matches = rightByKey.get(key);
            if (matches == null) {
                merged.addRow(leftRow.copy());
                continue;
            }
            matchedKeys.add(key);
            for (TableRow rightRow : matches) {
                TableRow row = leftRow.copy();
                rightRow.asMap().forEach((column, value) -> {
                    if (row.isMissing(column)) {
                        row.put(column, value);
                    }
                });
                merged.addRow(row);
            }
        }
        rightByKey.forEach((key, rows) -> {
            if (!matchedKeys.contains(key)) {
                rows.forEach(row -> merged.addRow(row.copy()));
            }
        });

        log.debug("Outer merge of {} and {} rows on {} gave {} rows", left.size(), right.size(), keys, merged.size());
        return merged;
    }

    public TidyTable addWeekday(TidyTable table) {
        return addWeekday(table, Columns.DATE);
    }

    /**
     * Adds {@code weekday_num} (Monday = 0 ... Sunday = 6) from a {@code DD-MM-YYYY} date column. The date column
     * itself is left as text; an unparseable date gives a missing weekday.
     */
    public TidyTable addWeekday(TidyTable table, String dateColumn) {
        requireColumns(table, List.of(dateColumn), "input");
        TidyTable result = table.copy().addColumn(Columns.WEEKDAY_NUM);
        for (TableRow row : result.getRows()) {
            Optional<LocalDate> date = ProfileDates.parseDayMonthYear(row.getString(dateColumn));
            row.put(Columns.WEEKDAY_NUM, date.map(d -> d.getDayOfWeek().getValue() - 1).orElse(null));
        }
        return result;
    }

    public TidyTable addSessionNumber(TidyTable table) {
        return addSessionNumber(table, Columns.DATE, Columns.SESSION);
    }

    /**
     * Adds {@code n_session}, the 1-based position of each session within its (subject, date) in order of time of
     * day. Sessions sharing a time keep their row order. Rows whose date or session time does not parse stay in the
     * table with a missing ordinal and are not counted.
     */
    public TidyTable addSessionNumber(TidyTable table, String dateColumn, String sessionColumn) {
        requireColumns(table, List.of(Columns.SUBJECT_ID, dateColumn, sessionColumn), "input");
        TidyTable result = table.copy().addColumn(Columns.N_SESSION);

        ListMultimap<List<Object>, TableRow> sessionsByDay = ArrayListMultimap.create();
        Map<TableRow, LocalTime> times = new IdentityHashMap<>();
        for (TableRow row : result.getRows()) {
            Optional<LocalDate> date = ProfileDates.parseDayMonthYear(row.getString(dateColumn));
            Optional<LocalTime> time = ProfileDates.parseSessionTime(row.getString(sessionColumn));
            if (date.isEmpty() || time.isEmpty()) {
                row.put(Columns.N_SESSION, null);
                continue;
            }
            times.put(row, time.get());
            sessionsByDay.put(Arrays.asList(row.get(Columns.SUBJECT_ID), date.get()), row);
        }

        for (List<Object> day : sessionsByDay.keySet()) {
            List<TableRow> sessions = new ArrayList<>(sessionsByDay.get(day));
            sessions.sort(Comparator.comparing(times::get));
            for (int i = 0; i < sessions.size(); i++) {
                sessions.get(i).put(Columns.N_SESSION, i + 1);
            }
        }
        return result;
    }

    public TidyTable fillMissingGroups(TidyTable table) {
        return fillMissingGroups(table, DEFAULT_GROUP_MARKER, DEFAULT_MIN_GROUP_SIZE);
    }

    /**
     * Zero-fills related columns row by row. Columns whose name contains a {@code .} and the marker are grouped by
     * everything before the last {@code .}; groups smaller than {@code minGroupSize} are left alone. In a row where
     * some member of a group has a value, the missing members become {@value #GROUP_FILL_VALUE}; a row where every
     * member is missing stays missing.
     */
    public TidyTable fillMissingGroups(TidyTable table, String marker, int minGroupSize) {
        Preconditions.checkArgument(minGroupSize >= 1, "minGroupSize must be positive, got %s", minGroupSize);
        Map<String, List<String>> groups = fillGroups(table.getColumns(), marker);
        TidyTable result = table.copy();

        int filled = 0;
        for (Map.Entry<String, List<String>> group : groups.entrySet()) {
            List<String> members = group.getValue();
            if (members.size() < minGroupSize) {
                continue;
            }
            for (TableRow row : result.getRows()) {
                if (members.stream().allMatch(row::isMissing)) {
                    continue;
                }
                for (String column : members) {
                    if (row.isMissing(column)) {
                        row.put(column, GROUP_FILL_VALUE);
                        filled++;
                    }
                }
            }
        }
        log.debug("Filled {} missing cells across {} column groups", filled, groups.size());
        return result;
    }

    static Map<String, List<String>> fillGroups(List<String> columns, String marker) {
        Map<String, List<String>> groups = new LinkedHashMap<>();
        for (String column : columns) {
            int lastDot = column.lastIndexOf('.');
            if (lastDot < 0 || !column.contains(marker)) {
                continue;
            }
            groups.computeIfAbsent(column.substring(0, lastDot), prefix -> new ArrayList<>()).add(column);
        }
        return groups;
    }

    private static List<Object> keyOf(TableRow row, List<String> keys) {
        List<Object> key = new ArrayList<>(keys.size());
        for (String column : keys) {
            key.add(row.get(column));
        }
        return key;
    }

    private static void requireColumns(TidyTable table, List<String> columns, String side) {
        for (String column : columns) {
            if (!table.hasColumn(column)) {
                throw new ExtractionConfigurationException(
                    "Column '" + column + "' is missing from the " + side + " table, columns are " + table.getColumns()
                );
            }
        }
    }
}
