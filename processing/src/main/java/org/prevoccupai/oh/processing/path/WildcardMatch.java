package org.prevoccupai.oh.processing.path;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A node reached by wildcard expansion, together with the keys chosen on the way there.
 */
public record WildcardMatch(MatchContext context, JsonNode value) {
}
