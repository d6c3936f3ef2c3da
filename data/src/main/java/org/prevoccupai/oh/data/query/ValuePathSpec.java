package org.prevoccupai.oh.data.query;

import org.prevoccupai.oh.exception.ExtractionConfigurationException;

/**
 * Selects row values relative to the node a wildcard expansion stopped at.
 *
 * {@code HR_BPM_stats.*} makes every child of {@code HR_BPM_stats} a column named {@code HR_BPM_stats.<child>};
 * {@code WRIST_significant_rotation_percentage} addresses a single column; a bare {@code *} takes every child under
 * its own name.
 */
public record ValuePathSpec(String path, ProfilePath prefix, boolean allChildren) {

    public static ValuePathSpec parse(String path) {
        ProfilePath parsed = ProfilePath.parse(path);
        if (parsed.isEmpty()) {
            throw new ExtractionConfigurationException("Value path must not be empty");
        }
        boolean allChildren = parsed.get(parsed.size() - 1).wildcard();
        ProfilePath prefix = allChildren ? parsed.withoutLast() : parsed;
        if (!prefix.isLiteral()) {
            throw new ExtractionConfigurationException(
                "Value path " + path + " may only use a wildcard as its last segment"
            );
        }
        return new ValuePathSpec(path, prefix, allChildren);
    }

    /**
     * Column name prefix for values selected by this spec, empty for a bare wildcard.
     */
    public String columnPrefix() {
        return prefix.toString();
    }
}
