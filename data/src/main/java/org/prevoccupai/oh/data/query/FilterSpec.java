package org.prevoccupai.oh.data.query;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.function.BiPredicate;

/**
 * Subject and record filters applied before extraction. Every field is optional; a null field is not checked.
 *
 * @param subjectIds keep only these subjects
 * @param excludeSubjects drop these subjects
 * @param groups keep only subjects whose {@code meta_data.group} is one of these
 * @param dateRange keep only date keys inside this range while expanding wildcard levels
 * @param requireKeys keep only subjects where every one of these literal paths exists
 * @param customFilter caller predicate over (subject id, profile)
 */
public record FilterSpec(
    List<String> subjectIds,
    List<String> excludeSubjects,
    List<String> groups,
    DateRange dateRange,
    List<String> requireKeys,
    BiPredicate<String, JsonNode> customFilter
) {

    public FilterSpec {
        subjectIds = subjectIds == null ? null : List.copyOf(subjectIds);
        excludeSubjects = excludeSubjects == null ? null : List.copyOf(excludeSubjects);
        groups = groups == null ? null : List.copyOf(groups);
        requireKeys = requireKeys == null ? null : List.copyOf(requireKeys);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private List<String> subjectIds;
        private List<String> excludeSubjects;
        private List<String> groups;
        private DateRange dateRange;
        private List<String> requireKeys;
        private BiPredicate<String, JsonNode> customFilter;

        public Builder subjectIds(List<String> subjectIds) {
            this.subjectIds = subjectIds;
            return this;
        }

        public Builder excludeSubjects(List<String> excludeSubjects) {
            this.excludeSubjects = excludeSubjects;
            return this;
        }

        public Builder groups(List<String> groups) {
            this.groups = groups;
            return this;
        }

        public Builder dateRange(DateRange dateRange) {
            this.dateRange = dateRange;
            return this;
        }

        public Builder dateRange(String start, String end) {
            this.dateRange = DateRange.of(start, end);
            return this;
        }

        public Builder requireKeys(List<String> requireKeys) {
            this.requireKeys = requireKeys;
            return this;
        }

        public Builder customFilter(BiPredicate<String, JsonNode> customFilter) {
            this.customFilter = customFilter;
            return this;
        }

        public FilterSpec build() {
            return new FilterSpec(subjectIds, excludeSubjects, groups, dateRange, requireKeys, customFilter);
        }
    }
}
