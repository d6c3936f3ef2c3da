package org.prevoccupai.oh.processing.filter;

import com.fasterxml.jackson.databind.JsonNode;
import org.prevoccupai.oh.data.profile.ProfileValues;
import org.prevoccupai.oh.data.query.FilterSpec;
import org.prevoccupai.oh.processing.path.PathNavigator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Subject-level pre-filter. Criteria are checked in a fixed order (allow-list, deny-list, group, required paths,
 * custom predicate) and the first failing one rejects the subject.
 */
@Component
public class ProfileFilter {

    public static final String GROUP_PATH = "meta_data.group";

    private static final Logger log = LoggerFactory.getLogger(ProfileFilter.class);

    /**
     * @return retained profiles in their original order; the input itself when {@code spec} is null
     */
    public Map<String, JsonNode> filter(Map<String, JsonNode> profiles, FilterSpec spec) {
        if (spec == null) {
            return profiles;
        }
        Map<String, JsonNode> retained = new LinkedHashMap<>();
        profiles.forEach((subjectId, profile) -> {
            if (accepts(subjectId, profile, spec)) {
                retained.put(subjectId, profile);
            }
        });
        log.debug("Profile filter kept {} of {} subjects", retained.size(), profiles.size());
        return retained;
    }

    public boolean accepts(String subjectId, JsonNode profile, FilterSpec spec) {
        if (spec.subjectIds() != null && !spec.subjectIds().contains(subjectId)) {
            return false;
        }
        if (spec.excludeSubjects() != null && spec.excludeSubjects().contains(subjectId)) {
            return false;
        }
        if (spec.groups() != null) {
            String group = ProfileValues.toText(PathNavigator.resolve(profile, GROUP_PATH));
            if (group == null || !spec.groups().contains(group)) {
                return false;
            }
        }
        if (spec.requireKeys() != null) {
            for (String path : spec.requireKeys()) {
                if (!PathNavigator.exists(profile, path)) {
                    return false;
                }
            }
        }
        return spec.customFilter() == null || spec.customFilter().test(subjectId, profile);
    }
}
