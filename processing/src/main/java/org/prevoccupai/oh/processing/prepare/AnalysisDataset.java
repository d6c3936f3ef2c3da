package org.prevoccupai.oh.processing.prepare;

import org.prevoccupai.oh.data.table.Columns;
import org.prevoccupai.oh.data.table.TableRow;
import org.prevoccupai.oh.data.table.TidyTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Analysis-ready long-format data with the roles of its columns.
 *
 * @param data one row per observation
 * @param outcomeVars measured variables; names not present in {@code data} are dropped on construction
 * @param idVar subject identifier column
 * @param timeVar time column, the subject column again for data without a time dimension
 * @param groupingVars extra grouping columns such as {@code side}
 * @param sensor source of the data, e.g. {@code emg}
 * @param level aggregation level, e.g. {@code daily}
 */
public record AnalysisDataset(
    TidyTable data,
    List<String> outcomeVars,
    String idVar,
    String timeVar,
    List<String> groupingVars,
    String sensor,
    String level
) {

    private static final Logger log = LoggerFactory.getLogger(AnalysisDataset.class);

    /**
     * @throws IllegalArgumentException if the id or time column is absent from {@code data}
     */
    public AnalysisDataset {
        if (!data.hasColumn(idVar)) {
            throw new IllegalArgumentException("ID variable '" + idVar + "' not found in data");
        }
        if (!data.hasColumn(timeVar)) {
            throw new IllegalArgumentException("Time variable '" + timeVar + "' not found in data");
        }
        List<String> missing = outcomeVars.stream().filter(v -> !data.hasColumn(v)).collect(Collectors.toList());
        if (!missing.isEmpty()) {
            log.warn("Outcome variables not found in data: {}", missing);
            outcomeVars = outcomeVars.stream().filter(data::hasColumn).collect(Collectors.toList());
        }
        outcomeVars = List.copyOf(outcomeVars);
        groupingVars = groupingVars == null ? List.of() : List.copyOf(groupingVars);
    }

    /**
     * Dataset with no observations, for sources that had no data.
     */
    public static AnalysisDataset empty(String sensor, String level) {
        return new AnalysisDataset(
            new TidyTable(List.of(Columns.SUBJECT_ID, Columns.DATE)), List.of(), Columns.SUBJECT_ID, Columns.DATE,
            List.of(), sensor, level
        );
    }

    public int nSubjects() {
        return (int) data.column(idVar).stream().filter(Objects::nonNull).distinct().count();
    }

    public int nObservations() {
        return data.size();
    }

    /**
     * Earliest and latest time value, empty when there are no comparable time values.
     */
    public Optional<List<Object>> timeRange() {
        List<Comparable<Object>> times = new ArrayList<>();
        for (Object value : data.column(timeVar)) {
            if (value instanceof Comparable) {
                @SuppressWarnings("unchecked")
                Comparable<Object> comparable = (Comparable<Object>) value;
                times.add(comparable);
            }
        }
        if (times.isEmpty()) {
            return Optional.empty();
        }
        Comparator<Comparable<Object>> natural = Comparator.naturalOrder();
        return Optional.of(List.of(times.stream().min(natural).get(), times.stream().max(natural).get()));
    }

    public Map<String, Integer> observationsPerSubject() {
        Map<String, Integer> counts = new TreeMap<>();
        for (TableRow row : data.getRows()) {
            String subject = row.getString(idVar);
            if (subject != null) {
                counts.merge(subject, 1, Integer::sum);
            }
        }
        return counts;
    }

    /**
     * @param outcomes outcome subset, null keeps the current outcomes
     * @param subjects subjects to keep, null keeps all
     * @param sides sides to keep when the data is grouped by side, null keeps all
     */
    public AnalysisDataset subset(List<String> outcomes, List<String> subjects, List<String> sides) {
        TidyTable rows = data.filterRows(row ->
            (subjects == null || subjects.contains(row.getString(idVar)))
                && (sides == null || !groupingVars.contains(Columns.SIDE) || sides.contains(row.getString(Columns.SIDE)))
        );
        return new AnalysisDataset(
            rows, outcomes == null ? outcomeVars : outcomes, idVar, timeVar, groupingVars, sensor, level
        );
    }
}
