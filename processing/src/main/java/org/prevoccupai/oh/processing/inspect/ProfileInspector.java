package org.prevoccupai.oh.processing.inspect;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableSet;
import org.prevoccupai.oh.data.profile.ProfileDates;
import org.prevoccupai.oh.data.profile.ProfileValues;
import org.prevoccupai.oh.data.table.Columns;
import org.prevoccupai.oh.data.table.TableRow;
import org.prevoccupai.oh.data.table.TidyTable;
import org.prevoccupai.oh.processing.path.KeyPatterns;
import org.prevoccupai.oh.processing.path.PathNavigator;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only views of profile structure, used to discover which paths to extract.
 */
@Component
public class ProfileInspector {

    public static final int DEFAULT_MAX_DEPTH = 10;
    public static final int DEFAULT_SUMMARY_DEPTH = 4;
    public static final String SENSOR_METRICS = "sensor_metrics";
    public static final String N_SENSORS = "n_sensors";

    private static final int PREVIEW_KEYS = 5;
    private static final int PREVIEW_LENGTH = 50;
    private static final Set<String> SIDE_KEYS = ImmutableSet.of("left", "right", "Left", "Right", "LEFT", "RIGHT", "L", "R");

    public List<String> availablePaths(JsonNode profile) {
        return availablePaths(profile, DEFAULT_MAX_DEPTH);
    }

    /**
     * Dotted paths of every leaf. Mappings deeper than {@code maxDepth} are reported as leaves.
     */
    public List<String> availablePaths(JsonNode profile, int maxDepth) {
        List<String> paths = new ArrayList<>();
        collectPaths(profile, "", 0, maxDepth, false, paths);
        return paths;
    }

    /**
     * Paths, leaves and intermediate mappings alike, whose whole dotted form matches a {@code *} glob, e.g.
     * {@code sensor_metrics.*.EMG_*}.
     */
    public List<String> findPathsMatching(JsonNode profile, String pattern, int maxDepth) {
        KeyPatterns.validate(pattern);
        List<String> paths = new ArrayList<>();
        collectPaths(profile, "", 0, maxDepth, true, paths);
        paths.removeIf(path -> !KeyPatterns.matches(path, pattern));
        return paths;
    }

    /**
     * Key names and node types below {@code path}, without values. Mappings beyond {@code maxDepth} are cut off and
     * show their first few keys.
     */
    public Map<String, Object> structureSummary(JsonNode profile, String path, int maxDepth) {
        JsonNode target = PathNavigator.resolve(profile, path);
        if (!ProfileValues.isMapping(target)) {
            Map<String, Object> leaf = new LinkedHashMap<>();
            leaf.put("_type", typeName(target));
            leaf.put("_value_preview", preview(target));
            return leaf;
        }
        return summarize(target, 0, maxDepth);
    }

    public LevelType inferLevelType(List<String> keys) {
        if (keys.isEmpty()) {
            return LevelType.EMPTY;
        }
        if (keys.stream().allMatch(ProfileDates::isDateKey)) {
            return LevelType.DATE;
        }
        if (keys.stream().allMatch(ProfileDates::isTimeKey)) {
            return LevelType.TIME;
        }
        if (SIDE_KEYS.containsAll(keys)) {
            return LevelType.SIDE;
        }
        return LevelType.GENERIC;
    }

    /**
     * Indented key tree, two spaces per level, leaves annotated with their node type.
     */
    public String renderTree(JsonNode profile, int maxDepth) {
        StringBuilder tree = new StringBuilder();
        renderLevel(profile, 0, maxDepth, tree);
        return tree.toString();
    }

    /**
     * One row per subject with its group, work type, sensor count and a {@code has_<sensor>} flag for every sensor
     * found under {@code sensor_metrics} in any of the profiles.
     */
    public TidyTable summarizeProfiles(Map<String, JsonNode> profiles) {
        Set<String> sensors = new LinkedHashSet<>();
        profiles.values().forEach(profile -> sensors.addAll(PathNavigator.keysAt(profile, SENSOR_METRICS)));

        List<String> schema = new ArrayList<>(List.of(Columns.SUBJECT_ID, Columns.GROUP, Columns.WORK_TYPE, N_SENSORS));
        sensors.forEach(sensor -> schema.add("has_" + sensor));
        TidyTable summary = new TidyTable(schema);

        profiles.forEach((subjectId, profile) -> {
            List<String> present = PathNavigator.keysAt(profile, SENSOR_METRICS);
            TableRow row = new TableRow()
                .put(Columns.SUBJECT_ID, subjectId)
                .put(Columns.GROUP, ProfileValues.toText(PathNavigator.resolve(profile, "meta_data.group")))
                .put(Columns.WORK_TYPE, ProfileValues.toText(PathNavigator.resolve(profile, "meta_data.work_type")))
                .put(N_SENSORS, present.size());
            sensors.forEach(sensor -> row.put("has_" + sensor, present.contains(sensor)));
            summary.addRow(row);
        });
        return summary;
    }

    private void collectPaths(JsonNode node, String prefix, int depth, int maxDepth, boolean withIntermediate, List<String> paths) {
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String path = prefix.isEmpty() ? field.getKey() : prefix + "." + field.getKey();
            JsonNode child = field.getValue();
            if (child.isObject() && child.size() > 0 && depth + 1 < maxDepth) {
                if (withIntermediate) {
                    paths.add(path);
                }
                collectPaths(child, path, depth + 1, maxDepth, withIntermediate, paths);
            } else {
                paths.add(path);
            }
        }
    }

    private Map<String, Object> summarize(JsonNode mapping, int depth, int maxDepth) {
        Map<String, Object> summary = new LinkedHashMap<>();
        if (depth >= maxDepth) {
            List<String> keys = new ArrayList<>();
            Iterator<String> names = mapping.fieldNames();
            while (names.hasNext() && keys.size() < PREVIEW_KEYS) {
                keys.add(names.next());
            }
            summary.put("_type", typeName(mapping));
            summary.put("_keys", keys);
            summary.put("_truncated", true);
            return summary;
        }
        mapping.fields().forEachRemaining(field -> summary.put(
            field.getKey(),
            field.getValue().isObject()
                ? summarize(field.getValue(), depth + 1, maxDepth)
                : Map.of("_type", typeName(field.getValue()))
        ));
        return summary;
    }

    private void renderLevel(JsonNode node, int depth, int maxDepth, StringBuilder tree) {
        String indent = Strings.repeat("  ", depth);
        node.fields().forEachRemaining(field -> {
            JsonNode child = field.getValue();
            if (child.isObject() && depth + 1 < maxDepth) {
                tree.append(indent).append(field.getKey()).append('\n');
                renderLevel(child, depth + 1, maxDepth, tree);
            } else if (child.isObject()) {
                tree.append(indent).append(field.getKey()).append(" {").append(child.size()).append(" keys}\n");
            } else {
                tree.append(indent).append(field.getKey()).append(": ").append(typeName(child)).append('\n');
            }
        });
    }

    private static String typeName(JsonNode node) {
        return node == null ? "missing" : node.getNodeType().name().toLowerCase();
    }

    private static String preview(JsonNode node) {
        String text = node == null ? "null" : node.toString();
        return text.length() > PREVIEW_LENGTH ? text.substring(0, PREVIEW_LENGTH) : text;
    }
}
