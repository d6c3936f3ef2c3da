package org.prevoccupai.oh.processing.path;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.prevoccupai.oh.data.query.ProfilePath;
import org.prevoccupai.oh.exception.ExtractionConfigurationException;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.prevoccupai.oh.processing.TestProfiles.json;

class WildcardExpanderTest {

    private JsonNode profile;

    @BeforeEach
    public void setup() {
        profile = json("""
            {"emg": {
               "06-01-2025": {"09-00-00": {"left": {"v": 1}, "right": {"v": 2}}, "14-00-00": {"left": {"v": 3}}},
               "07-01-2025": {"10-00-00": "not a mapping"},
               "EMG_weekly_metrics": 5
            }}
            """);
    }

    @Test
    public void expand_namesEveryLevel() {
        List<WildcardMatch> matches = WildcardExpander.expand(profile, "emg.*.*.*", List.of("date", "session", "side"))
            .collect(Collectors.toList());

        assertEquals(3, matches.size());
        assertEquals(
            Map.of("date", "06-01-2025", "session", "09-00-00", "side", "left"),
            matches.get(0).context().asMap()
        );
        assertEquals(1, matches.get(0).value().get("v").intValue());
        assertEquals("right", matches.get(1).context().get("side"));
        assertEquals("14-00-00", matches.get(2).context().get("session"));
    }

    @Test
    public void expand_keepsTraversalOrderOfLevels() {
        WildcardMatch first = WildcardExpander.expand(profile, "emg.*.*", List.of("date", "session")).findFirst().get();

        assertEquals(List.of("date", "session"), List.copyOf(first.context().asMap().keySet()));
    }

    @Test
    public void expand_nonMappingBeforeEnd_dropsBranch() {
        List<String> dates = WildcardExpander.expand(profile, "emg.*.*.*", List.of("date", "session", "side"))
            .map(match -> match.context().get("date"))
            .distinct()
            .collect(Collectors.toList());

        assertEquals(List.of("06-01-2025"), dates);
    }

    @Test
    public void expand_nonMappingAtEnd_isYielded() {
        List<WildcardMatch> matches = WildcardExpander.expand(profile, "emg.*", List.of("date")).collect(Collectors.toList());

        assertEquals(3, matches.size());
        assertEquals(5, matches.get(2).value().intValue());
    }

    @Test
    public void expand_missingLiteral_yieldsNothing() {
        assertEquals(0, WildcardExpander.expand(profile, "heart_rate.*", List.of("date")).count());
    }

    @Test
    public void expand_tooFewNames_usesSyntheticNames() {
        WildcardMatch match = WildcardExpander.expand(profile, "emg.*.*", List.of("date")).findFirst().get();

        assertEquals("09-00-00", match.context().get("level_1"));
    }

    @Test
    public void expand_keyFilter_skipsRejectedKeys() {
        List<String> sides = WildcardExpander
            .expand(profile, ProfilePath.parse("emg.*.*.*"), List.of("date", "session", "side"), (level, key) -> !key.equals("left"))
            .map(match -> match.context().get("side"))
            .collect(Collectors.toList());

        assertEquals(List.of("right"), sides);
    }

    @Test
    public void expand_siblingBranchesDoNotShareContext() {
        List<WildcardMatch> matches = WildcardExpander.expand(profile, "emg.06-01-2025.*.*", List.of("session", "side"))
            .collect(Collectors.toList());

        assertEquals(2, matches.get(0).context().depth());
        assertEquals("left", matches.get(0).context().get("side"));
        assertEquals("right", matches.get(1).context().get("side"));
    }

    @Test
    public void expand_recursiveWildcard_isRejected() {
        assertThrows(ExtractionConfigurationException.class, () -> WildcardExpander.expand(profile, "emg.**", List.of()));
    }
}
