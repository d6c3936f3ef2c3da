package org.prevoccupai.oh.processing.prepare;

import org.prevoccupai.oh.exception.ExtractionConfigurationException;

import java.util.Arrays;
import java.util.Locale;

/**
 * How bilateral EMG measurements are turned into observations.
 */
public enum SideOption {
    /** Only left side rows, side column dropped. */
    LEFT,
    /** Only right side rows, side column dropped. */
    RIGHT,
    /** Both sides as separate rows, grouped by side. */
    BOTH,
    /** Mean of both sides where both were measured. */
    AVERAGE;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SideOption parse(String value) {
        if (value != null) {
            for (SideOption option : values()) {
                if (option.name().equalsIgnoreCase(value.trim())) {
                    return option;
                }
            }
        }
        throw new ExtractionConfigurationException(
            "Unknown side option '" + value + "', expected one of " + Arrays.toString(values())
        );
    }
}
