package org.prevoccupai.oh.export;

import com.fasterxml.jackson.databind.JsonNode;
import org.prevoccupai.oh.data.table.TidyTable;
import org.prevoccupai.oh.etl.io.CsvTableWriter;
import org.prevoccupai.oh.etl.profile.ProfileLoadResult;
import org.prevoccupai.oh.etl.profile.ProfileLoader;
import org.prevoccupai.oh.export.config.ExportConfig;
import org.prevoccupai.oh.processing.filter.ProfileFilter;
import org.prevoccupai.oh.processing.prepare.AnalysisDataset;
import org.prevoccupai.oh.processing.prepare.DatasetPreparationService;
import org.prevoccupai.oh.processing.prepare.SideOption;
import org.prevoccupai.oh.processing.sensor.SensorTableService;
import org.prevoccupai.oh.processing.sensor.SensorTables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Loads the configured profiles and writes the session-level sensor tables, plus daily EMG when a side option is
 * configured, as CSV files in the output directory.
 */
@Service
public class ProfileExportJob {
    private static final Logger log = LoggerFactory.getLogger(ProfileExportJob.class);

    public static final String SMARTWATCH_FILE = "smartwatch.csv";
    public static final String SMARTPHONE_FILE = "smartphone.csv";
    public static final String EMG_DAILY_FILE = "emg_daily.csv";

    private final ExportConfig config;
    private final ProfileLoader profileLoader;
    private final ProfileFilter profileFilter;
    private final SensorTableService sensorTableService;
    private final DatasetPreparationService preparationService;

    @Autowired
    public ProfileExportJob(
        ExportConfig config,
        ProfileLoader profileLoader,
        ProfileFilter profileFilter,
        SensorTableService sensorTableService,
        DatasetPreparationService preparationService
    ) {
        this.config = config;
        this.profileLoader = profileLoader;
        this.profileFilter = profileFilter;
        this.sensorTableService = sensorTableService;
        this.preparationService = preparationService;
    }

    /**
     * @return the files written, empty when no profile passed the filters
     */
    public List<Path> run() throws IOException {
        ProfileLoadResult loaded = profileLoader.loadProfiles(Path.of(config.getProfilesDir()), config.getSubjectIds());
        Map<String, JsonNode> profiles = profileFilter.filter(loaded.profiles(), config.filterSpec());
        if (profiles.isEmpty()) {
            log.warn("No profiles to export from {} ({} failed to load)", config.getProfilesDir(), loaded.failureCount());
            return List.of();
        }
        log.info("Exporting {} of {} loaded profiles", profiles.size(), loaded.profiles().size());

        Path outputDir = Path.of(config.getOutputDir());
        List<Path> written = new ArrayList<>();

        // the date range is the only filter left to apply while expanding
        SensorTables tables = sensorTableService.extractSmartwatchAndSmartphone(
            profiles, config.getSensorComponents(), config.filterSpec()
        );
        written.add(write(tables.smartwatch(), outputDir.resolve(SMARTWATCH_FILE)));
        written.add(write(tables.smartphone(), outputDir.resolve(SMARTPHONE_FILE)));

        Optional<SideOption> side = config.getSideOption();
        if (side.isPresent()) {
            AnalysisDataset emg = preparationService.prepareDailyEmg(profiles, side.get(), true, true);
            log.info(preparationService.describe(emg));
            written.add(write(emg.data(), outputDir.resolve(EMG_DAILY_FILE)));
        }

        log.info("Export complete: {}", written);
        return written;
    }

    private static Path write(TidyTable table, Path file) throws IOException {
        CsvTableWriter.write(table, file);
        return file;
    }
}
