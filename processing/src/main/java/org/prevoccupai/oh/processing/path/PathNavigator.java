package org.prevoccupai.oh.processing.path;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.google.common.base.Splitter;
import org.prevoccupai.oh.data.query.ProfilePath;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Literal dot-path navigation over a profile. A missing key, or a non-mapping node reached while segments remain,
 * resolves to the caller's default; navigation never throws on profile shape.
 */
public class PathNavigator {

    private static final Splitter DOT_SPLITTER = Splitter.on('.');

    // compared by identity, no profile can contain this instance
    private static final JsonNode ABSENT = new TextNode("\u0000absent");

    private PathNavigator() {
    }

    public static JsonNode resolve(JsonNode profile, String path) {
        return resolve(profile, path, null);
    }

    /**
     * @param path dot-notation path; every segment is taken literally, an empty path returns the profile itself
     */
    public static JsonNode resolve(JsonNode profile, String path, JsonNode defaultValue) {
        if (path == null || path.isEmpty()) {
            return profile;
        }
        return walk(profile, DOT_SPLITTER.split(path).iterator(), defaultValue);
    }

    public static JsonNode resolve(JsonNode profile, ProfilePath path, JsonNode defaultValue) {
        return walk(profile, path.segments().stream().map(ProfilePath.Segment::key).iterator(), defaultValue);
    }

    /**
     * True when the path leads to a stored node, including a stored JSON null.
     */
    public static boolean exists(JsonNode profile, String path) {
        return resolve(profile, path, ABSENT) != ABSENT;
    }

    public static boolean exists(JsonNode profile, ProfilePath path) {
        return resolve(profile, path, ABSENT) != ABSENT;
    }

    /**
     * @return keys of the mapping at the path in document order, empty if the path does not lead to a mapping
     */
    public static List<String> keysAt(JsonNode profile, String path) {
        JsonNode target = resolve(profile, path, null);
        List<String> keys = new ArrayList<>();
        if (target != null && target.isObject()) {
            target.fieldNames().forEachRemaining(keys::add);
        }
        return keys;
    }

    private static JsonNode walk(JsonNode current, Iterator<String> keys, JsonNode defaultValue) {
        while (keys.hasNext()) {
            String key = keys.next();
            if (current == null || !current.isObject()) {
                return defaultValue;
            }
            JsonNode child = current.get(key);
            if (child == null) {
                return defaultValue;
            }
            current = child;
        }
        return current;
    }
}
