package org.prevoccupai.oh.processing.extract;

import com.fasterxml.jackson.databind.JsonNode;
import org.prevoccupai.oh.data.profile.ProfileValues;
import org.prevoccupai.oh.data.query.DateRange;
import org.prevoccupai.oh.data.query.FilterSpec;
import org.prevoccupai.oh.data.query.NestedExtraction;
import org.prevoccupai.oh.data.query.ProfilePath;
import org.prevoccupai.oh.data.query.ValuePathSpec;
import org.prevoccupai.oh.data.table.Columns;
import org.prevoccupai.oh.data.table.TableRow;
import org.prevoccupai.oh.data.table.TidyTable;
import org.prevoccupai.oh.exception.ExtractionConfigurationException;
import org.prevoccupai.oh.processing.filter.DateKeyFilter;
import org.prevoccupai.oh.processing.filter.ProfileFilter;
import org.prevoccupai.oh.processing.path.KeyPatterns;
import org.prevoccupai.oh.processing.path.PathNavigator;
import org.prevoccupai.oh.processing.path.WildcardExpander;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiPredicate;

/**
 * Turns profiles into tidy tables.
 *
 * <p>{@link #extractNested} produces long format: one row per subject and per combination of keys reached by the
 * wildcard levels, e.g. one row per (subject, date, session) for sensor metrics. The schema is fixed per call:
 * {@code subject_id}, the metadata columns, every requested level name, then value columns in the order they were
 * first seen. {@link #extract} and {@link #extractFlat} produce one row per subject.</p>
 */
@Service
public class TidyExtractor {

    private static final Logger log = LoggerFactory.getLogger(TidyExtractor.class);

    private final ProfileFilter profileFilter;

    @Autowired
    public TidyExtractor(ProfileFilter profileFilter) {
        this.profileFilter = profileFilter;
    }

    public TidyTable extractNested(Map<String, JsonNode> profiles, NestedExtraction extraction) {
        KeyPatterns.validate(extraction.excludePatterns());
        Map<String, JsonNode> selected = profileFilter.filter(profiles, extraction.filterSpec());

        ProfilePath expansionPath = expansionPath(extraction);
        DateRange dateRange = extraction.filterSpec() == null ? null : extraction.filterSpec().dateRange();
        List<String> excludePatterns = extraction.excludePatterns();
        BiPredicate<String, String> keyFilter =
            (level, key) -> !KeyPatterns.matches(key, excludePatterns) && DateKeyFilter.accepts(key, dateRange);
        ValueFlattener flattener = new ValueFlattener(excludePatterns);

        List<String> schema = new ArrayList<>();
        schema.add(Columns.SUBJECT_ID);
        schema.addAll(extraction.metadataColumns().keySet());
        schema.addAll(extraction.levelNames());
        TidyTable table = new TidyTable(schema);

        selected.forEach((subjectId, profile) -> {
            TableRow subjectCells = subjectCells(subjectId, profile, extraction.metadataColumns());
            int before = table.size();
            WildcardExpander.expand(profile, expansionPath, extraction.levelNames(), keyFilter).forEach(match -> {
                TableRow row = subjectCells.copy();
                match.context().asMap().forEach(row::put);
                putValues(row, match.value(), extraction.valuePaths(), flattener);
                table.addRow(row);
            });
            log.debug("Subject {} contributed {} rows under {}", subjectId, table.size() - before, expansionPath);
        });

        log.info(
            "Extracted {} rows and {} columns from {} subjects under {}",
            table.size(), table.getColumns().size(), selected.size(), extraction.basePath()
        );
        return table;
    }

    /**
     * Wide format: one row per subject, one column per named literal path. A path resolving to a mapping is
     * flattened under its column name.
     *
     * @param paths column name to literal dot-path
     */
    public TidyTable extract(Map<String, JsonNode> profiles, Map<String, String> paths, FilterSpec filterSpec) {
        Map<String, ProfilePath> parsed = new LinkedHashMap<>();
        paths.forEach((column, path) -> parsed.put(column, literal(path)));

        List<String> schema = new ArrayList<>();
        schema.add(Columns.SUBJECT_ID);
        schema.addAll(parsed.keySet());
        TidyTable table = new TidyTable(schema);
        ValueFlattener flattener = new ValueFlattener(List.of());

        profileFilter.filter(profiles, filterSpec).forEach((subjectId, profile) -> {
            TableRow row = new TableRow().put(Columns.SUBJECT_ID, subjectId);
            parsed.forEach((column, path) -> {
                JsonNode value = PathNavigator.resolve(profile, path, null);
                if (value != null) {
                    flattener.put(row, column, column, value);
                }
            });
            table.addRow(row);
        });

        // a column only ever seen as a flattened mapping is represented by its children
        Set<String> replaced = new HashSet<>();
        for (String column : parsed.keySet()) {
            boolean hasChildren = table.getColumns().stream().anyMatch(c -> c.startsWith(column + "."));
            if (hasChildren && table.column(column).stream().allMatch(Objects::isNull)) {
                replaced.add(column);
            }
        }
        return replaced.isEmpty() ? table : table.dropColumns(replaced);
    }

    public TidyTable extractFlat(Map<String, JsonNode> profiles, String basePath, FilterSpec filterSpec) {
        return extractFlat(profiles, basePath, List.of(), filterSpec);
    }

    /**
     * One row per subject that has {@code basePath}, with every leaf beneath it as a dotted column relative to the
     * base path.
     */
    public TidyTable extractFlat(
        Map<String, JsonNode> profiles, String basePath, List<String> excludePatterns, FilterSpec filterSpec
    ) {
        KeyPatterns.validate(excludePatterns);
        ProfilePath base = literal(basePath);
        ValueFlattener flattener = new ValueFlattener(excludePatterns);
        TidyTable table = new TidyTable(List.of(Columns.SUBJECT_ID));

        profileFilter.filter(profiles, filterSpec).forEach((subjectId, profile) -> {
            JsonNode node = PathNavigator.resolve(profile, base, null);
            if (node == null) {
                return;
            }
            TableRow row = new TableRow().put(Columns.SUBJECT_ID, subjectId);
            flattener.putAll(row, node);
            table.addRow(row);
        });
        log.info("Flattened {} for {} subjects into {} columns", basePath, table.size(), table.getColumns().size());
        return table;
    }

    /**
     * Base path plus one wildcard for each level name the base path's own wildcards do not already account for.
     */
    static ProfilePath expansionPath(NestedExtraction extraction) {
        ProfilePath basePath = extraction.basePath();
        int extraLevels = Math.max(0, extraction.levelNames().size() - basePath.wildcardCount());
        return basePath.appendWildcards(extraLevels);
    }

    private static TableRow subjectCells(String subjectId, JsonNode profile, Map<String, ProfilePath> metadataColumns) {
        TableRow cells = new TableRow().put(Columns.SUBJECT_ID, subjectId);
        metadataColumns.forEach((column, path) -> {
            JsonNode value = PathNavigator.resolve(profile, path, null);
            if (!ProfileValues.isMapping(value)) {
                cells.put(column, ProfileValues.toCell(value));
            }
        });
        return cells;
    }

    private static void putValues(TableRow row, JsonNode terminal, List<ValuePathSpec> valuePaths, ValueFlattener flattener) {
        if (valuePaths.isEmpty()) {
            flattener.putAll(row, terminal);
            return;
        }
        for (ValuePathSpec spec : valuePaths) {
            JsonNode target = PathNavigator.resolve(terminal, spec.prefix(), null);
            if (target == null) {
                continue;
            }
            if (!spec.allChildren()) {
                String key = spec.prefix().get(spec.prefix().size() - 1).key();
                flattener.put(row, key, spec.path(), target);
            } else if (ProfileValues.isMapping(target)) {
                flattener.putChildren(row, spec.columnPrefix(), target);
            }
        }
    }

    private static ProfilePath literal(String path) {
        ProfilePath parsed = ProfilePath.parse(path);
        if (!parsed.isLiteral()) {
            throw new ExtractionConfigurationException("Expected a literal path without wildcards, got " + path);
        }
        return parsed;
    }
}
