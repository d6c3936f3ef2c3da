package org.prevoccupai.oh.processing.extract;

import com.fasterxml.jackson.databind.JsonNode;
import org.prevoccupai.oh.data.profile.ProfileValues;
import org.prevoccupai.oh.data.table.TableRow;
import org.prevoccupai.oh.processing.path.KeyPatterns;

import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Writes profile nodes into a row, turning nested mappings into dotted column names. A key is skipped, together
 * with everything below it, when either the key itself or its full column name matches an exclude pattern.
 */
class ValueFlattener {

    static final String SCALAR_COLUMN = "value";

    private final Collection<String> excludePatterns;

    ValueFlattener(Collection<String> excludePatterns) {
        this.excludePatterns = excludePatterns == null ? List.of() : excludePatterns;
    }

    /**
     * Writes the node under {@code column}, or under {@code column.<child>...} if it is a mapping.
     */
    void put(TableRow row, String key, String column, JsonNode node) {
        if (excluded(key, column)) {
            return;
        }
        if (ProfileValues.isMapping(node)) {
            putChildren(row, column, node);
        } else {
            row.put(column, ProfileValues.toCell(node));
        }
    }

    /**
     * Writes every child of a mapping; an empty prefix uses the child keys as column names.
     */
    void putChildren(TableRow row, String prefix, JsonNode mapping) {
        Iterator<Map.Entry<String, JsonNode>> fields = mapping.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String column = prefix.isEmpty() ? field.getKey() : prefix + "." + field.getKey();
            put(row, field.getKey(), column, field.getValue());
        }
    }

    /**
     * Writes a whole node: children of a mapping under their own names, a scalar under {@value #SCALAR_COLUMN}.
     */
    void putAll(TableRow row, JsonNode node) {
        if (ProfileValues.isMapping(node)) {
            putChildren(row, "", node);
        } else {
            row.put(SCALAR_COLUMN, ProfileValues.toCell(node));
        }
    }

    private boolean excluded(String key, String column) {
        return KeyPatterns.matches(key, excludePatterns) || KeyPatterns.matches(column, excludePatterns);
    }
}
