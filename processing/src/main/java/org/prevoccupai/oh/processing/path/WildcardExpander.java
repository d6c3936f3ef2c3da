package org.prevoccupai.oh.processing.path;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.Streams;
import org.prevoccupai.oh.data.query.ProfilePath;

import java.util.List;
import java.util.function.BiPredicate;
import java.util.stream.Stream;

/**
 * Expands a wildcard path against one profile.
 *
 * <p>Each {@code *} segment fans out over every key of the mapping at that depth; each literal segment follows one
 * key or ends the branch. The resulting stream is lazy, finite and single-use. Branches are visited depth first and
 * keys in document order, so for a fixed profile the order of matches is stable.</p>
 *
 * <p>Branches that meet a missing key or a non-mapping node before the path is exhausted yield nothing.</p>
 */
public class WildcardExpander {

    private static final BiPredicate<String, String> ALL_KEYS = (level, key) -> true;

    private WildcardExpander() {
    }

    public static Stream<WildcardMatch> expand(JsonNode profile, String path, List<String> levelNames) {
        return expand(profile, ProfilePath.parse(path), levelNames, ALL_KEYS);
    }

    /**
     * @param levelNames names for the wildcards in order; missing names become {@code level_<n>}
     * @param keyFilter tested with (level name, key) before a wildcard descends into a key
     */
    public static Stream<WildcardMatch> expand(
        JsonNode profile, ProfilePath path, List<String> levelNames, BiPredicate<String, String> keyFilter
    ) {
        return descend(profile, path, 0, 0, MatchContext.empty(), levelNames, keyFilter);
    }

    public static String levelName(List<String> levelNames, int wildcardIndex) {
        return wildcardIndex < levelNames.size() ? levelNames.get(wildcardIndex) : "level_" + wildcardIndex;
    }

    private static Stream<WildcardMatch> descend(
        JsonNode current, ProfilePath path, int depth, int wildcardIndex, MatchContext context, List<String> levelNames,
        BiPredicate<String, String> keyFilter
    ) {
        if (depth == path.size()) {
            return Stream.of(new WildcardMatch(context, current));
        }
        if (current == null || !current.isObject()) {
            return Stream.empty();
        }

        ProfilePath.Segment segment = path.get(depth);
        if (!segment.wildcard()) {
            JsonNode child = current.get(segment.key());
            if (child == null) {
                return Stream.empty();
            }
            return descend(child, path, depth + 1, wildcardIndex, context, levelNames, keyFilter);
        }

        String level = levelName(levelNames, wildcardIndex);
        return Streams.stream(current.fieldNames())
            .filter(key -> keyFilter.test(level, key))
            .flatMap(
                key -> descend(current.get(key), path, depth + 1, wildcardIndex + 1, context.with(level, key), levelNames, keyFilter)
            );
    }
}
