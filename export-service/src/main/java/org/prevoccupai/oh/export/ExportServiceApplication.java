package org.prevoccupai.oh.export;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Exports session-level sensor tables from a directory of OH profiles.
 *
 * Run with:
 * java -jar export-service.jar \
 *   --export.profiles-dir=/path/to/OH_profiles \
 *   --export.output-dir=/path/to/output \
 *   --export.components=hr,wrist,noise,activity \
 *   --export.emg-side=both
 */
@SpringBootApplication(scanBasePackages = "org.prevoccupai.oh")
@ConfigurationPropertiesScan("org.prevoccupai.oh.export.config")
public class ExportServiceApplication implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(ExportServiceApplication.class);

    private final ProfileExportJob exportJob;

    public ExportServiceApplication(ProfileExportJob exportJob) {
        this.exportJob = exportJob;
    }

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(ExportServiceApplication.class);
        app.run(args);
    }

    @Override
    public void run(String... args) throws Exception {
        log.info("Starting OH profile export");
        Instant startTime = Instant.now();

        List<Path> written = exportJob.run();

        log.info("Wrote {} files in {} s", written.size(), Duration.between(startTime, Instant.now()).toSeconds());
    }
}
