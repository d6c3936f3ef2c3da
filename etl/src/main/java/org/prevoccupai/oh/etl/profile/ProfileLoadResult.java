package org.prevoccupai.oh.etl.profile;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Outcome of loading a profile directory.
 *
 * @param profiles loaded profiles by subject id, in subject order
 * @param failures every file that was skipped
 */
public record ProfileLoadResult(Map<String, JsonNode> profiles, List<ProfileLoadFailure> failures) {

    public static final int MAX_SAMPLE_MESSAGES = 5;

    public ProfileLoadResult {
        profiles = Collections.unmodifiableMap(new LinkedHashMap<>(profiles));
        failures = List.copyOf(failures);
    }

    public int failureCount() {
        return failures.size();
    }

    public List<String> sampleMessages() {
        return failures.stream()
            .limit(MAX_SAMPLE_MESSAGES)
            .map(ProfileLoadFailure::message)
            .collect(Collectors.toList());
    }
}
