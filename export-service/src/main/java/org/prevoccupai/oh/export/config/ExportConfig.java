package org.prevoccupai.oh.export.config;

import jakarta.annotation.PostConstruct;
import org.prevoccupai.oh.data.query.DateRange;
import org.prevoccupai.oh.data.query.FilterSpec;
import org.prevoccupai.oh.exception.ExtractionConfigurationException;
import org.prevoccupai.oh.processing.prepare.SideOption;
import org.prevoccupai.oh.processing.sensor.SensorComponent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Configuration properties for the profile export.
 *
 * All properties use the "export.*" prefix and are validated at startup.
 */
@ConfigurationProperties(prefix = "export")
public class ExportConfig {
    private static final Logger log = LoggerFactory.getLogger(ExportConfig.class);

    // Required properties
    private String profilesDir;
    private String outputDir;

    // Optional properties, null = no filtering
    private List<String> components = List.of("hr", "wrist", "noise", "activity");
    private List<String> subjectIds;
    private List<String> excludeSubjects;
    private List<String> groups;
    private String startDate;
    private String endDate;
    private String emgSide; // null = skip daily EMG export

    private Set<SensorComponent> sensorComponents;
    private SideOption sideOption;
    private DateRange dateRange;

    @PostConstruct
    public void validateAndLog() {
        log.info("=== VALIDATING CONFIGURATION ===");

        List<String> errors = new ArrayList<>();

        if (profilesDir == null || profilesDir.isBlank()) {
            errors.add("export.profiles-dir is required");
        }
        if (outputDir == null || outputDir.isBlank()) {
            errors.add("export.output-dir is required");
        }

        if (!errors.isEmpty()) {
            String errorMsg = "Missing required configuration properties:\n  - " + String.join("\n  - ", errors);
            log.error(errorMsg);
            throw new IllegalStateException(errorMsg);
        }

        Path profilesPath = Path.of(profilesDir);
        if (!Files.exists(profilesPath)) {
            errors.add("Profiles directory not found: " + profilesDir);
        } else if (!Files.isDirectory(profilesPath)) {
            errors.add("Profiles path is not a directory: " + profilesDir);
        }

        Path outputPath = Path.of(outputDir);
        try {
            Files.createDirectories(outputPath);
            if (!Files.isWritable(outputPath)) {
                errors.add("Output directory is not writable: " + outputDir);
            }
        } catch (Exception e) {
            errors.add("Cannot create output directory: " + outputDir + " - " + e.getMessage());
        }

        sensorComponents = EnumSet.noneOf(SensorComponent.class);
        for (String component : components == null ? List.<String>of() : components) {
            try {
                sensorComponents.add(SensorComponent.parse(component));
            } catch (ExtractionConfigurationException e) {
                errors.add(e.getMessage());
            }
        }

        if (emgSide != null && !emgSide.isBlank()) {
            try {
                sideOption = SideOption.parse(emgSide);
            } catch (ExtractionConfigurationException e) {
                errors.add(e.getMessage());
            }
        }

        if (startDate != null || endDate != null) {
            try {
                dateRange = DateRange.of(startDate, endDate);
            } catch (ExtractionConfigurationException e) {
                errors.add(e.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            String errorMsg = "Configuration validation failed:\n  - " + String.join("\n  - ", errors);
            log.error(errorMsg);
            throw new IllegalStateException(errorMsg);
        }

        log.info("=== EFFECTIVE CONFIGURATION ===");
        log.info("Profiles dir: {}", profilesDir);
        log.info("Output dir: {}", outputDir);
        log.info("Components: {}", sensorComponents);
        log.info("Subjects: {}", subjectIds != null ? subjectIds : "(all)");
        log.info("Excluded subjects: {}", excludeSubjects != null ? excludeSubjects : "(none)");
        log.info("Groups: {}", groups != null ? groups : "(all)");
        log.info("Date range: {}", dateRange != null ? dateRange : "(all dates)");
        log.info("Daily EMG side: {}", sideOption != null ? sideOption.label() : "(none - EMG export disabled)");
        log.info("================================");
    }

    public FilterSpec filterSpec() {
        return FilterSpec.builder()
            .subjectIds(subjectIds)
            .excludeSubjects(excludeSubjects)
            .groups(groups)
            .dateRange(dateRange)
            .build();
    }

    public Set<SensorComponent> getSensorComponents() {
        return sensorComponents;
    }

    public Optional<SideOption> getSideOption() {
        return Optional.ofNullable(sideOption);
    }

    public String getProfilesDir() {
        return profilesDir;
    }

    public void setProfilesDir(String profilesDir) {
        this.profilesDir = profilesDir;
    }

    public String getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(String outputDir) {
        this.outputDir = outputDir;
    }

    public List<String> getComponents() {
        return components;
    }

    public void setComponents(List<String> components) {
        this.components = components;
    }

    public List<String> getSubjectIds() {
        return subjectIds;
    }

    public void setSubjectIds(List<String> subjectIds) {
        this.subjectIds = subjectIds;
    }

    public List<String> getExcludeSubjects() {
        return excludeSubjects;
    }

    public void setExcludeSubjects(List<String> excludeSubjects) {
        this.excludeSubjects = excludeSubjects;
    }

    public List<String> getGroups() {
        return groups;
    }

    public void setGroups(List<String> groups) {
        this.groups = groups;
    }

    public String getStartDate() {
        return startDate;
    }

    public void setStartDate(String startDate) {
        this.startDate = startDate;
    }

    public String getEndDate() {
        return endDate;
    }

    public void setEndDate(String endDate) {
        this.endDate = endDate;
    }

    public String getEmgSide() {
        return emgSide;
    }

    public void setEmgSide(String emgSide) {
        this.emgSide = emgSide;
    }
}
