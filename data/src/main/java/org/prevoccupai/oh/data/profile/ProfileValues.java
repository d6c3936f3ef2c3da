package org.prevoccupai.oh.data.profile;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Conversion of profile nodes into table cells.
 *
 * Numbers become {@link Double}, booleans {@link Boolean}, text {@link String}, arrays an unmodifiable {@link List} of
 * converted elements. JSON null, absent nodes and non-finite numbers ({@code NaN}, {@code Infinity}) become
 * {@code null}, the missing marker. Text passes through verbatim.
 */
public class ProfileValues {

    private ProfileValues() {
    }

    public static boolean isMapping(JsonNode node) {
        return node != null && node.isObject();
    }

    /**
     * @param node a non-mapping profile node, may be null
     * @return the cell value, or null when the node carries no observation
     * @throws IllegalArgumentException if the node is a mapping, callers flatten mappings before converting
     */
    public static Object toCell(JsonNode node) {
        if (node == null) {
            return null;
        }
        return switch (node.getNodeType()) {
            case NUMBER -> finiteOrNull(node.doubleValue());
            case BOOLEAN -> node.booleanValue();
            case STRING -> node.textValue();
            case NULL, MISSING -> null;
            case ARRAY -> toList(node);
            case OBJECT -> throw new IllegalArgumentException("Mapping nodes have no single cell value");
            case BINARY, POJO -> node.asText();
        };
    }

    /**
     * Text form of a scalar node, used for key-like values such as a subject's group. Returns null for anything
     * that is not a scalar.
     */
    public static String toText(JsonNode node) {
        if (node == null || node.isContainerNode() || node.isNull() || node.isMissingNode()) {
            return null;
        }
        return node.asText();
    }

    private static Double finiteOrNull(double value) {
        return Double.isFinite(value) ? value : null;
    }

    private static List<Object> toList(JsonNode array) {
        List<Object> values = new ArrayList<>(array.size());
        for (JsonNode element : array) {
            values.add(element.isObject() ? element.toString() : toCell(element));
        }
        return Collections.unmodifiableList(values);
    }
}
