package org.prevoccupai.oh.export.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.prevoccupai.oh.data.query.FilterSpec;
import org.prevoccupai.oh.processing.prepare.SideOption;
import org.prevoccupai.oh.processing.sensor.SensorComponent;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExportConfigTest {

    @TempDir
    Path tempDir;

    private ExportConfig config;

    @BeforeEach
    public void setup() {
        config = new ExportConfig();
        config.setProfilesDir(tempDir.toString());
        config.setOutputDir(tempDir.resolve("out").toString());
    }

    @Test
    public void validateAndLog_defaults() {
        config.validateAndLog();

        assertEquals(SensorComponent.all(), config.getSensorComponents());
        assertTrue(config.getSideOption().isEmpty());
        assertTrue(Files.isDirectory(tempDir.resolve("out")));
        assertNull(config.filterSpec().dateRange());
    }

    @Test
    public void validateAndLog_missingRequired_throwsException() {
        config.setProfilesDir(null);
        config.setOutputDir(" ");

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> config.validateAndLog());

        assertTrue(e.getMessage().contains("export.profiles-dir is required"));
        assertTrue(e.getMessage().contains("export.output-dir is required"));
    }

    @Test
    public void validateAndLog_collectsEveryProblem() {
        config.setProfilesDir(tempDir.resolve("absent").toString());
        config.setComponents(List.of("hr", "gps"));
        config.setEmgSide("middle");

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> config.validateAndLog());

        assertTrue(e.getMessage().contains("Profiles directory not found"));
        assertTrue(e.getMessage().contains("gps"));
        assertTrue(e.getMessage().contains("middle"));
    }

    @Test
    public void validateAndLog_halfOpenDateRange_throwsException() {
        config.setStartDate("2025-01-06");

        assertThrows(IllegalStateException.class, () -> config.validateAndLog());
    }

    @Test
    public void filterSpec_fromProperties() {
        config.setComponents(List.of("Noise", "activity"));
        config.setGroups(List.of("office"));
        config.setExcludeSubjects(List.of("S9"));
        config.setStartDate("2025-01-06");
        config.setEndDate("2025-01-07");
        config.setEmgSide("average");

        config.validateAndLog();
        FilterSpec filterSpec = config.filterSpec();

        assertEquals(EnumSet.of(SensorComponent.NOISE, SensorComponent.ACTIVITY), config.getSensorComponents());
        assertEquals(SideOption.AVERAGE, config.getSideOption().get());
        assertEquals(List.of("office"), filterSpec.groups());
        assertEquals(List.of("S9"), filterSpec.excludeSubjects());
        assertNull(filterSpec.subjectIds());
        assertEquals(LocalDate.of(2025, 1, 7), filterSpec.dateRange().end());
    }
}
