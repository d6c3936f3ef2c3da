package org.prevoccupai.oh.processing.sensor;

import org.prevoccupai.oh.exception.ExtractionConfigurationException;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * Sensor streams that can be exported, by the device that records them.
 */
public enum SensorComponent {
    HR(Device.SMARTWATCH),
    WRIST(Device.SMARTWATCH),
    NOISE(Device.SMARTPHONE),
    ACTIVITY(Device.SMARTPHONE);

    public enum Device {
        SMARTWATCH,
        SMARTPHONE
    }

    private final Device device;

    SensorComponent(Device device) {
        this.device = device;
    }

    public Device getDevice() {
        return device;
    }

    public static Set<SensorComponent> all() {
        return EnumSet.allOf(SensorComponent.class);
    }

    /**
     * Case-insensitive, so {@code "wrist"} and {@code "WRIST"} both work.
     */
    public static SensorComponent parse(String value) {
        if (value != null) {
            for (SensorComponent component : values()) {
                if (component.name().equalsIgnoreCase(value.trim())) {
                    return component;
                }
            }
        }
        throw new ExtractionConfigurationException(
            "Unknown sensor component '" + value + "', expected one of " + Arrays.toString(values())
        );
    }
}
