package org.prevoccupai.oh.data.query;

import com.google.common.collect.ImmutableMap;
import org.prevoccupai.oh.data.table.Columns;
import org.prevoccupai.oh.exception.ExtractionConfigurationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One long-format extraction request: where to start, how to name the wildcard levels below it, which values to
 * take from each branch and which keys to leave out.
 *
 * @param basePath literal or wildcard path the levels hang off, e.g. {@code sensor_metrics.heart_rate}
 * @param levelNames names for the wildcard levels, in order; basePath wildcards consume names first
 * @param valuePaths values taken at every branch; empty means every leaf of the branch
 * @param excludePatterns glob patterns for keys to skip, at wildcard levels and among value keys
 * @param filterSpec optional subject/date filter, null for none
 * @param metadataColumns column name to literal profile path, resolved once per subject
 */
public record NestedExtraction(
    ProfilePath basePath,
    List<String> levelNames,
    List<ValuePathSpec> valuePaths,
    List<String> excludePatterns,
    FilterSpec filterSpec,
    Map<String, ProfilePath> metadataColumns
) {

    public static final Map<String, String> DEFAULT_METADATA_COLUMNS = ImmutableMap.of(Columns.WORK_TYPE, "meta_data.work_type");

    public NestedExtraction {
        levelNames = List.copyOf(levelNames);
        valuePaths = List.copyOf(valuePaths);
        excludePatterns = List.copyOf(excludePatterns);
        metadataColumns = ImmutableMap.copyOf(metadataColumns);
        metadataColumns.forEach((column, path) -> {
            if (!path.isLiteral()) {
                throw new ExtractionConfigurationException("Metadata column " + column + " must use a literal path, got " + path);
            }
        });
    }

    public static Builder builder(String basePath) {
        return new Builder(basePath);
    }

    public static class Builder {
        private final ProfilePath basePath;
        private final List<String> levelNames = new ArrayList<>();
        private final List<ValuePathSpec> valuePaths = new ArrayList<>();
        private final List<String> excludePatterns = new ArrayList<>();
        private final Map<String, ProfilePath> metadataColumns = new LinkedHashMap<>();
        private FilterSpec filterSpec;

        private Builder(String basePath) {
            this.basePath = ProfilePath.parse(basePath);
            DEFAULT_METADATA_COLUMNS.forEach((column, path) -> metadataColumns.put(column, ProfilePath.parse(path)));
        }

        public Builder levelNames(String... names) {
            levelNames.addAll(List.of(names));
            return this;
        }

        public Builder levelNames(List<String> names) {
            levelNames.addAll(names);
            return this;
        }

        public Builder valuePaths(String... paths) {
            for (String path : paths) {
                valuePaths.add(ValuePathSpec.parse(path));
            }
            return this;
        }

        public Builder valuePaths(List<String> paths) {
            return valuePaths(paths.toArray(new String[0]));
        }

        public Builder excludePatterns(String... patterns) {
            excludePatterns.addAll(List.of(patterns));
            return this;
        }

        public Builder excludePatterns(List<String> patterns) {
            excludePatterns.addAll(patterns);
            return this;
        }

        public Builder filterSpec(FilterSpec filterSpec) {
            this.filterSpec = filterSpec;
            return this;
        }

        public Builder metadataColumn(String column, String path) {
            metadataColumns.put(column, ProfilePath.parse(path));
            return this;
        }

        public Builder noMetadataColumns() {
            metadataColumns.clear();
            return this;
        }

        public NestedExtraction build() {
            return new NestedExtraction(basePath, levelNames, valuePaths, excludePatterns, filterSpec, metadataColumns);
        }
    }
}
