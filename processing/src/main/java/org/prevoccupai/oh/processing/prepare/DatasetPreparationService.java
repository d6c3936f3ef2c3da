package org.prevoccupai.oh.processing.prepare;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.prevoccupai.oh.data.profile.ProfileDates;
import org.prevoccupai.oh.data.query.NestedExtraction;
import org.prevoccupai.oh.data.table.Columns;
import org.prevoccupai.oh.data.table.TableRow;
import org.prevoccupai.oh.data.table.TidyTable;
import org.prevoccupai.oh.processing.extract.TidyExtractor;
import org.prevoccupai.oh.processing.path.PathNavigator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Builds analysis datasets from profiles: daily and weekly EMG, daily questionnaires.
 */
@Service
public class DatasetPreparationService {

    public static final String EMG_BASE_PATH = "sensor_metrics.emg";
    public static final String EMG_DAILY_LEVEL = "EMG_daily_metrics";
    public static final String EMG_WEEKLY_PATH = "sensor_metrics.emg.EMG_weekly_metrics";
    public static final String QUESTIONNAIRE_PATH = "daily_questionnaires";
    public static final List<String> EMG_VALUE_PATHS = ImmutableList.of(
        "EMG_session.*",
        "EMG_intensity.*",
        "EMG_apdf.full.*",
        "EMG_apdf.active.*",
        "EMG_rest_recovery.*",
        "EMG_relative_bins.*"
    );

    public static final String LEVEL = "level";
    public static final String DOMAIN = "domain";
    public static final String DAY_INDEX = "day_index";
    public static final String WEEKDAY = "weekday";

    private static final Logger log = LoggerFactory.getLogger(DatasetPreparationService.class);

    private static final Set<String> DAILY_META_COLUMNS =
        ImmutableSet.of(Columns.SUBJECT_ID, Columns.WORK_TYPE, Columns.DATE, Columns.SIDE, DOMAIN, DAY_INDEX, WEEKDAY);

    private final TidyExtractor extractor;

    @Autowired
    public DatasetPreparationService(TidyExtractor extractor) {
        this.extractor = extractor;
    }

    /**
     * Daily EMG metrics, one row per subject and date (and side, for {@link SideOption#BOTH}). Dates become
     * {@link LocalDate}; rows whose date does not parse are dropped.
     */
    public AnalysisDataset prepareDailyEmg(
        Map<String, JsonNode> profiles, SideOption side, boolean addDayIndex, boolean addWeekday
    ) {
        TidyTable extracted = extractor.extractNested(
            profiles,
            NestedExtraction.builder(EMG_BASE_PATH)
                .levelNames(Columns.DATE, LEVEL, Columns.SIDE)
                .valuePaths(EMG_VALUE_PATHS)
                .build()
        );
        if (extracted.isEmpty()) {
            log.warn("No EMG data found in {} profiles", profiles.size());
            return AnalysisDataset.empty("emg", "daily");
        }

        TidyTable daily = extracted
            .filterRows(row -> EMG_DAILY_LEVEL.equals(row.getString(LEVEL)))
            .dropColumns(Set.of(LEVEL));
        daily = parseDates(daily);

        SideHandling handled = handleSides(daily, side);
        TidyTable data = handled.data();
        if (addDayIndex) {
            data = addDayIndex(data);
        }
        if (addWeekday) {
            data = addWeekdayName(data);
        }
        Comparator<TableRow> order = Comparator
            .comparing((TableRow row) -> row.getString(Columns.SUBJECT_ID))
            .thenComparing(row -> (LocalDate) row.get(Columns.DATE));
        if (data.hasColumn(Columns.SIDE)) {
            order = order.thenComparing(
                row -> row.getString(Columns.SIDE), Comparator.nullsLast(Comparator.<String>naturalOrder())
            );
        }
        data = data.sortRows(order);

        return new AnalysisDataset(
            data, outcomeColumns(data, DAILY_META_COLUMNS), Columns.SUBJECT_ID, Columns.DATE, handled.groupingVars(),
            "emg", "daily"
        );
    }

    /**
     * Daily questionnaire answers for one domain, or for every domain (grouped by {@code domain}) when
     * {@code domain} is null.
     *
     * @return empty when no subject has questionnaire data
     */
    public Optional<AnalysisDataset> prepareDailyQuestionnaires(
        Map<String, JsonNode> profiles, String domain, boolean addDayIndex, boolean addWeekday
    ) {
        if (profiles.values().stream().noneMatch(profile -> hasQuestionnaireData(profile, domain))) {
            log.info("No questionnaire data{} in {} profiles", domain == null ? "" : " for " + domain, profiles.size());
            return Optional.empty();
        }

        String basePath = domain == null ? QUESTIONNAIRE_PATH : QUESTIONNAIRE_PATH + "." + domain;
        NestedExtraction.Builder extraction = NestedExtraction.builder(basePath).valuePaths("*");
        if (domain == null) {
            extraction.levelNames(DOMAIN, Columns.DATE);
        } else {
            extraction.levelNames(Columns.DATE);
        }
        TidyTable data = parseDates(extractor.extractNested(profiles, extraction.build()));
        if (data.isEmpty()) {
            return Optional.empty();
        }
        if (addDayIndex) {
            data = addDayIndex(data);
        }
        if (addWeekday) {
            data = addWeekdayName(data);
        }
        List<String> groupingVars = data.hasColumn(DOMAIN) ? List.of(DOMAIN) : List.of();
        return Optional.of(new AnalysisDataset(
            data, outcomeColumns(data, DAILY_META_COLUMNS), Columns.SUBJECT_ID, Columns.DATE, groupingVars,
            "questionnaire", "daily"
        ));
    }

    /**
     * Weekly EMG aggregates, one row per subject and side. There is no time dimension, so the subject column doubles
     * as the time variable.
     */
    public AnalysisDataset prepareWeeklyEmg(Map<String, JsonNode> profiles, SideOption side) {
        TidyTable wide = extractor.extractFlat(profiles, EMG_WEEKLY_PATH, null);
        if (wide.isEmpty()) {
            log.warn("No weekly EMG data found in {} profiles", profiles.size());
            return AnalysisDataset.empty("emg", "weekly");
        }

        Map<String, List<String>> columnsBySide = new LinkedHashMap<>();
        for (String sideLabel : List.of("left", "right")) {
            List<String> sideColumns = wide.getColumns().stream()
                .filter(column -> column.startsWith(sideLabel + "."))
                .collect(Collectors.toList());
            if (!sideColumns.isEmpty()) {
                columnsBySide.put(sideLabel, sideColumns);
            }
        }

        TidyTable longFormat = new TidyTable(List.of(Columns.SUBJECT_ID, Columns.SIDE));
        for (TableRow row : wide.getRows()) {
            columnsBySide.forEach((sideLabel, sideColumns) -> {
                TableRow sideRow = new TableRow()
                    .put(Columns.SUBJECT_ID, row.get(Columns.SUBJECT_ID))
                    .put(Columns.SIDE, sideLabel);
                for (String column : sideColumns) {
                    String metric = column.substring(sideLabel.length() + 1);
                    longFormat.addColumn(metric);
                    sideRow.put(metric, row.get(column));
                }
                longFormat.addRow(sideRow);
            });
        }

        SideHandling handled = handleSides(longFormat, side);
        return new AnalysisDataset(
            handled.data(), outcomeColumns(handled.data(), Set.of(Columns.SUBJECT_ID, Columns.SIDE)),
            Columns.SUBJECT_ID, Columns.SUBJECT_ID, handled.groupingVars(), "emg", "weekly"
        );
    }

    public String describe(AnalysisDataset dataset) {
        String range = dataset.timeRange()
            .map(bounds -> bounds.get(0) + " to " + bounds.get(1))
            .orElse("n/a");
        return String.join(
            "\n",
            "AnalysisDataset: " + dataset.sensor() + " (" + dataset.level() + " level)",
            "  Subjects: " + dataset.nSubjects(),
            "  Observations: " + dataset.nObservations(),
            "  Date range: " + range,
            "  Outcomes: " + dataset.outcomeVars().size() + " variables",
            "  Grouping: " + dataset.groupingVars()
        );
    }

    private record SideHandling(TidyTable data, List<String> groupingVars) {
    }

    private SideHandling handleSides(TidyTable table, SideOption side) {
        if (!table.hasColumn(Columns.SIDE)) {
            return new SideHandling(table, List.of());
        }
        return switch (side) {
            case LEFT, RIGHT -> new SideHandling(
                table.filterRows(row -> side.label().equals(row.getString(Columns.SIDE))).dropColumns(Set.of(Columns.SIDE)),
                List.of()
            );
            case BOTH -> new SideHandling(table, List.of(Columns.SIDE));
            case AVERAGE -> averageSides(table);
        };
    }

    /**
     * Means of the numeric columns over observations measured on both sides. Observations with a single side are
     * dropped; if no observation has both sides the data is returned unchanged, grouped by side.
     */
    private SideHandling averageSides(TidyTable table) {
        List<String> keyColumns = table.hasColumn(Columns.DATE)
            ? List.of(Columns.SUBJECT_ID, Columns.DATE)
            : List.of(Columns.SUBJECT_ID);

        Map<List<Object>, List<TableRow>> byObservation = new LinkedHashMap<>();
        for (TableRow row : table.getRows()) {
            List<Object> key = new ArrayList<>();
            keyColumns.forEach(column -> key.add(row.get(column)));
            byObservation.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
        }
        Map<List<Object>, List<TableRow>> bilateral = new LinkedHashMap<>();
        byObservation.forEach((key, rows) -> {
            Set<String> sides = new HashSet<>();
            rows.forEach(row -> sides.add(row.getString(Columns.SIDE)));
            if (sides.size() == 2) {
                bilateral.put(key, rows);
            }
        });
        if (bilateral.isEmpty()) {
            log.warn("No subject and date has both sides measured, keeping sides separate");
            return new SideHandling(table, List.of(Columns.SIDE));
        }

        List<String> numericColumns = numericColumns(table, keyColumns);
        List<String> columns = new ArrayList<>(keyColumns);
        columns.addAll(numericColumns);
        TidyTable averaged = new TidyTable(columns);
        int kept = 0;
        for (Map.Entry<List<Object>, List<TableRow>> observation : bilateral.entrySet()) {
            TableRow row = new TableRow();
            for (int i = 0; i < keyColumns.size(); i++) {
                row.put(keyColumns.get(i), observation.getKey().get(i));
            }
            for (String column : numericColumns) {
                row.put(column, mean(observation.getValue(), column));
            }
            averaged.addRow(row);
            kept += observation.getValue().size();
        }
        if (kept < table.size()) {
            log.warn(
                "Dropped {} rows where only one side existed, kept {} averaged observations",
                table.size() - kept, averaged.size()
            );
        }
        return new SideHandling(averaged, List.of());
    }

    private static List<String> numericColumns(TidyTable table, List<String> exclude) {
        List<String> numeric = new ArrayList<>();
        for (String column : table.getColumns()) {
            if (exclude.contains(column)) {
                continue;
            }
            List<Object> values = table.column(column);
            boolean anyValue = values.stream().anyMatch(v -> v != null);
            boolean allNumbers = values.stream().allMatch(v -> v == null || v instanceof Number);
            if (anyValue && allNumbers) {
                numeric.add(column);
            }
        }
        return numeric;
    }

    private static Double mean(List<TableRow> rows, String column) {
        double sum = 0;
        int count = 0;
        for (TableRow row : rows) {
            Double value = row.getDouble(column);
            if (value != null) {
                sum += value;
                count++;
            }
        }
        return count == 0 ? null : sum / count;
    }

    private static TidyTable parseDates(TidyTable table) {
        TidyTable parsed = table.copy();
        for (TableRow row : parsed.getRows()) {
            row.put(Columns.DATE, ProfileDates.parseDate(row.getString(Columns.DATE)).orElse(null));
        }
        TidyTable dated = parsed.filterRows(row -> !row.isMissing(Columns.DATE));
        if (dated.size() < parsed.size()) {
            log.warn("Dropped {} rows with unparseable dates", parsed.size() - dated.size());
        }
        return dated;
    }

    /**
     * 1-based position of each row's date among the subject's distinct dates.
     */
    private static TidyTable addDayIndex(TidyTable table) {
        Map<String, TreeSet<LocalDate>> datesBySubject = new HashMap<>();
        for (TableRow row : table.getRows()) {
            datesBySubject
                .computeIfAbsent(row.getString(Columns.SUBJECT_ID), subject -> new TreeSet<>())
                .add((LocalDate) row.get(Columns.DATE));
        }
        TidyTable indexed = table.copy().addColumn(DAY_INDEX);
        for (TableRow row : indexed.getRows()) {
            TreeSet<LocalDate> dates = datesBySubject.get(row.getString(Columns.SUBJECT_ID));
            row.put(DAY_INDEX, dates.headSet((LocalDate) row.get(Columns.DATE)).size() + 1);
        }
        return indexed;
    }

    private static TidyTable addWeekdayName(TidyTable table) {
        TidyTable named = table.copy().addColumn(WEEKDAY);
        for (TableRow row : named.getRows()) {
            LocalDate date = (LocalDate) row.get(Columns.DATE);
            row.put(WEEKDAY, date.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH));
        }
        return named;
    }

    private static List<String> outcomeColumns(TidyTable table, Set<String> metaColumns) {
        return table.getColumns().stream().filter(column -> !metaColumns.contains(column)).collect(Collectors.toList());
    }

    private static boolean hasQuestionnaireData(JsonNode profile, String domain) {
        JsonNode questionnaires = PathNavigator.resolve(profile, QUESTIONNAIRE_PATH);
        if (questionnaires == null || !questionnaires.isObject()) {
            return false;
        }
        if (domain != null) {
            JsonNode answers = questionnaires.get(domain);
            return answers != null && !answers.isNull() && !(answers.isContainerNode() && answers.isEmpty());
        }
        for (JsonNode answers : questionnaires) {
            if (answers.isObject() && !answers.isEmpty()) {
                return true;
            }
        }
        return false;
    }
}
