package org.prevoccupai.oh.processing.sensor;

import com.fasterxml.jackson.databind.JsonNode;
import org.prevoccupai.oh.data.query.FilterSpec;
import org.prevoccupai.oh.data.query.NestedExtraction;
import org.prevoccupai.oh.data.table.Columns;
import org.prevoccupai.oh.data.table.TidyTable;
import org.prevoccupai.oh.processing.compose.TableComposer;
import org.prevoccupai.oh.processing.extract.TidyExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Set;

/**
 * Builds the per-session smartwatch and smartphone tables. Each component is extracted on its own with levels
 * {@code [date, session]}; components of the same device are outer-merged on the session keys.
 */
@Service
public class SensorTableService {

    private static final Logger log = LoggerFactory.getLogger(SensorTableService.class);

    private final TidyExtractor extractor;
    private final TableComposer composer;

    @Autowired
    public SensorTableService(TidyExtractor extractor, TableComposer composer) {
        this.extractor = extractor;
        this.composer = composer;
    }

    public SensorTables extractSmartwatchAndSmartphone(Map<String, JsonNode> profiles, Set<SensorComponent> components) {
        return extractSmartwatchAndSmartphone(profiles, components, null);
    }

    /**
     * Smartwatch: heart rate (distribution groups zero-filled) merged with wrist activities, then weekday and
     * session number. Smartphone: human activities merged with noise, then distribution groups zero-filled and
     * weekday.
     */
    public SensorTables extractSmartwatchAndSmartphone(
        Map<String, JsonNode> profiles, Set<SensorComponent> components, FilterSpec filterSpec
    ) {
        log.info("Extracting {} for {} subjects", components, profiles.size());

        TidyTable heartRate = TidyTable.empty();
        if (components.contains(SensorComponent.HR)) {
            heartRate = composer.fillMissingGroups(extractor.extractNested(profiles, heartRate(filterSpec)));
        }
        TidyTable wrist = TidyTable.empty();
        if (components.contains(SensorComponent.WRIST)) {
            wrist = extractor.extractNested(profiles, wristActivities(filterSpec));
        }
        TidyTable smartwatch = composer.outerMerge(heartRate, wrist, Columns.SESSION_KEYS);
        if (!smartwatch.isEmpty()) {
            smartwatch = composer.addSessionNumber(composer.addWeekday(smartwatch));
        }

        TidyTable noise = TidyTable.empty();
        if (components.contains(SensorComponent.NOISE)) {
            noise = extractor.extractNested(profiles, noise(filterSpec));
        }
        TidyTable activity = TidyTable.empty();
        if (components.contains(SensorComponent.ACTIVITY)) {
            activity = extractor.extractNested(profiles, humanActivities(filterSpec));
        }
        TidyTable smartphone = composer.outerMerge(activity, noise, Columns.SESSION_KEYS);
        if (!smartphone.isEmpty()) {
            smartphone = composer.addWeekday(composer.fillMissingGroups(smartphone));
        }

        log.info(
            "Built {} {} rows and {} {} rows",
            smartwatch.size(), SensorComponent.Device.SMARTWATCH, smartphone.size(), SensorComponent.Device.SMARTPHONE
        );
        return new SensorTables(smartwatch, smartphone);
    }

    static NestedExtraction heartRate(FilterSpec filterSpec) {
        return NestedExtraction.builder("sensor_metrics.heart_rate")
            .levelNames(Columns.DATE, Columns.SESSION)
            .valuePaths("HR_BPM_stats.*", "HR_ratio_stats.*", "HR_distributions.*")
            .excludePatterns("HR_timeline")
            .filterSpec(filterSpec)
            .build();
    }

    static NestedExtraction wristActivities(FilterSpec filterSpec) {
        return NestedExtraction.builder("sensor_metrics.wrist_activities")
            .levelNames(Columns.DATE, Columns.SESSION)
            .valuePaths("WRIST_significant_rotation_percentage", "WRIST_significant_acceleration_percentage")
            .filterSpec(filterSpec)
            .build();
    }

    static NestedExtraction noise(FilterSpec filterSpec) {
        return NestedExtraction.builder("sensor_metrics.noise")
            .levelNames(Columns.DATE, Columns.SESSION)
            .valuePaths("Noise_statistics.*", "Noise_distributions.*", "Noise_durations.*")
            .excludePatterns("Noise_timeline*")
            .filterSpec(filterSpec)
            .build();
    }

    static NestedExtraction humanActivities(FilterSpec filterSpec) {
        return NestedExtraction.builder("sensor_metrics.human_activities")
            .levelNames(Columns.DATE, Columns.SESSION)
            .valuePaths("HAR_distributions.*", "HAR_durations.*", "HAR_steps.*")
            .excludePatterns("HAR_timeline*")
            .filterSpec(filterSpec)
            .build();
    }
}
