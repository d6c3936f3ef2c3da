package org.prevoccupai.oh.data.query;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import org.prevoccupai.oh.exception.ExtractionConfigurationException;

import java.util.List;

/**
 * Dot-notation path into a profile, e.g. {@code sensor_metrics.emg.*.*}. Each segment is either a literal key or the
 * single-level wildcard {@code *}. Recursive wildcards ({@code **}) and partial globs inside a segment are rejected.
 */
public record ProfilePath(List<Segment> segments) {

    public static final String WILDCARD = "*";

    private static final Splitter DOT_SPLITTER = Splitter.on('.');
    private static final Joiner DOT_JOINER = Joiner.on('.');
    private static final ProfilePath ROOT = new ProfilePath(List.of());

    public record Segment(String key, boolean wildcard) {

        public static Segment literal(String key) {
            return new Segment(key, false);
        }

        public static Segment any() {
            return new Segment(WILDCARD, true);
        }
    }

    public ProfilePath {
        segments = ImmutableList.copyOf(segments);
    }

    public static ProfilePath root() {
        return ROOT;
    }

    /**
     * @param path dot-notation path, null or empty for the profile root
     * @throws ExtractionConfigurationException if a segment uses unsupported wildcard syntax
     */
    public static ProfilePath parse(String path) {
        if (path == null || path.isEmpty()) {
            return ROOT;
        }
        ImmutableList.Builder<Segment> segments = ImmutableList.builder();
        for (String part : DOT_SPLITTER.split(path)) {
            if (WILDCARD.equals(part)) {
                segments.add(Segment.any());
            } else if ("**".equals(part)) {
                throw new ExtractionConfigurationException("Recursive wildcard '**' is not supported in path: " + path);
            } else if (part.contains(WILDCARD)) {
                throw new ExtractionConfigurationException(
                    "Segment '" + part + "' of path " + path + " mixes a wildcard with literal text; only '*' on its own is supported"
                );
            } else {
                segments.add(Segment.literal(part));
            }
        }
        return new ProfilePath(segments.build());
    }

    public boolean isEmpty() {
        return segments.isEmpty();
    }

    public int size() {
        return segments.size();
    }

    public Segment get(int index) {
        return segments.get(index);
    }

    public int wildcardCount() {
        return (int) segments.stream().filter(Segment::wildcard).count();
    }

    public boolean isLiteral() {
        return wildcardCount() == 0;
    }

    public ProfilePath withoutLast() {
        return new ProfilePath(segments.subList(0, segments.size() - 1));
    }

    public ProfilePath appendWildcards(int count) {
        ImmutableList.Builder<Segment> builder = ImmutableList.<Segment>builder().addAll(segments);
        for (int i = 0; i < count; i++) {
            builder.add(Segment.any());
        }
        return new ProfilePath(builder.build());
    }

    @Override
    public String toString() {
        return DOT_JOINER.join(segments.stream().map(Segment::key).iterator());
    }
}
