package org.prevoccupai.oh.processing.path;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Level name to resolved key for one expansion branch. Immutable: {@link #with(String, String)} returns an extended
 * copy so sibling branches never see each other's keys.
 */
public final class MatchContext {

    private static final MatchContext EMPTY = new MatchContext(Map.of());

    private final Map<String, String> keysByLevel;

    private MatchContext(Map<String, String> keysByLevel) {
        this.keysByLevel = keysByLevel;
    }

    public static MatchContext empty() {
        return EMPTY;
    }

    public MatchContext with(String levelName, String key) {
        Map<String, String> extended = new LinkedHashMap<>(keysByLevel);
        extended.put(levelName, key);
        return new MatchContext(Collections.unmodifiableMap(extended));
    }

    public String get(String levelName) {
        return keysByLevel.get(levelName);
    }

    /**
     * @return level name to key, in the order the levels were traversed
     */
    public Map<String, String> asMap() {
        return keysByLevel;
    }

    public int depth() {
        return keysByLevel.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MatchContext)) return false;
        return keysByLevel.equals(((MatchContext) o).keysByLevel);
    }

    @Override
    public int hashCode() {
        return keysByLevel.hashCode();
    }

    @Override
    public String toString() {
        return keysByLevel.toString();
    }
}
