package org.prevoccupai.oh.processing.path;

import org.junit.jupiter.api.Test;
import org.prevoccupai.oh.exception.ExtractionConfigurationException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KeyPatternsTest {

    private static final List<String> KEYS =
        List.of("EMG_daily_metrics", "EMG_weekly_metrics", "HR_timeline", "Noise_timeline_raw", "06-01-2025");

    @Test
    public void matches_exactPrefixSuffixAndSubstring() {
        assertTrue(KeyPatterns.matches("EMG_weekly_metrics", "EMG_weekly_metrics"));
        assertTrue(KeyPatterns.matches("EMG_weekly_metrics", "EMG_*"));
        assertTrue(KeyPatterns.matches("EMG_weekly_metrics", "*_metrics"));
        assertTrue(KeyPatterns.matches("EMG_weekly_metrics", "*weekly*"));
        assertFalse(KeyPatterns.matches("EMG_weekly_metrics", "weekly"));
    }

    @Test
    public void matches_isCaseSensitive() {
        assertFalse(KeyPatterns.matches("HR_timeline", "hr_*"));
    }

    @Test
    public void matches_starMatchesEmptyRun() {
        assertTrue(KeyPatterns.matches("HR_timeline", "HR_timeline*"));
        assertTrue(KeyPatterns.matches("anything", "*"));
    }

    @Test
    public void matches_regexCharactersAreLiteral() {
        assertTrue(KeyPatterns.matches("Noise (dB).mean", "Noise (dB).*"));
        assertFalse(KeyPatterns.matches("NoiseXdB", "Noise.dB"));
    }

    @Test
    public void matches_unsupportedSyntax_throwsException() {
        assertThrows(ExtractionConfigurationException.class, () -> KeyPatterns.matches("HR_1", "HR_?"));
        assertThrows(ExtractionConfigurationException.class, () -> KeyPatterns.matches("HR_1", "HR_[0-9]"));
    }

    @Test
    public void include_and_exclude_preserveOrder() {
        assertEquals(List.of("EMG_daily_metrics", "EMG_weekly_metrics"), KeyPatterns.include(KEYS, List.of("EMG_*")));
        assertEquals(
            List.of("EMG_daily_metrics", "EMG_weekly_metrics", "06-01-2025"),
            KeyPatterns.exclude(KEYS, List.of("*timeline*"))
        );
    }

    @Test
    public void select_exclusionWins() {
        List<String> selected = KeyPatterns.select(KEYS, List.of("EMG_*", "HR_*"), List.of("*weekly*", "HR_timeline"));

        assertEquals(List.of("EMG_daily_metrics"), selected);
    }

    @Test
    public void select_noIncludePatterns_keepsEverythingNotExcluded() {
        assertEquals(List.of("06-01-2025"), KeyPatterns.select(KEYS, null, List.of("*_*")));
    }
}
