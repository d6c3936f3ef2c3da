package org.prevoccupai.oh.processing.sensor;

import org.prevoccupai.oh.data.table.TidyTable;

/**
 * Session-level tables per recording device. A device with no requested or available component has an empty table.
 */
public record SensorTables(TidyTable smartwatch, TidyTable smartphone) {
}
