package org.prevoccupai.oh.etl.profile;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads {@code <subject_id>_OH_profile.json} files into Jackson trees keyed by subject id.
 */
@Component
public class ProfileLoader {

    public static final String PROFILE_SUFFIX = "_OH_profile.json";

    private static final Logger log = LoggerFactory.getLogger(ProfileLoader.class);

    private static final int PROGRESS_INTERVAL = 50;

    private final ObjectMapper mapper;

    /**
     * Accepts the {@code NaN} and {@code Infinity} tokens that profile writers emit for undefined statistics.
     */
    public ProfileLoader() {
        this(JsonMapper.builder().enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS).build());
    }

    public ProfileLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @return profile files directly inside {@code dir}, sorted by file name
     */
    public List<Path> discover(Path dir) throws IOException {
        checkDirectory(dir);
        try (Stream<Path> files = Files.list(dir)) {
            return files
                .filter(Files::isRegularFile)
                .filter(file -> file.getFileName().toString().endsWith(PROFILE_SUFFIX))
                .sorted()
                .collect(Collectors.toList());
        }
    }

    public static String subjectIdOf(Path file) {
        String name = file.getFileName().toString();
        if (name.endsWith(PROFILE_SUFFIX)) {
            return name.substring(0, name.length() - PROFILE_SUFFIX.length());
        }
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    /**
     * @throws InvalidProfileException if the file is JSON but its root is not an object
     */
    public JsonNode loadProfile(Path file) throws IOException {
        JsonNode profile = mapper.readTree(file.toFile());
        if (profile == null || !profile.isObject()) {
            throw new InvalidProfileException(
                "Expected a JSON object at the root of " + file + ", got " + (profile == null ? "nothing" : profile.getNodeType())
            );
        }
        return profile;
    }

    /**
     * Loads every profile in {@code dir}, or only those of {@code subjectIds} when it is not null. Files that cannot
     * be read or parsed are recorded as failures and skipped.
     *
     * @throws FileNotFoundException if {@code dir} does not exist
     * @throws NotDirectoryException if {@code dir} is not a directory
     */
    public ProfileLoadResult loadProfiles(Path dir, Collection<String> subjectIds) throws IOException {
        List<Path> files = discover(dir);
        if (subjectIds != null) {
            Set<String> wanted = new HashSet<>(subjectIds);
            files = files.stream().filter(file -> wanted.contains(subjectIdOf(file))).collect(Collectors.toList());
            if (files.size() < wanted.size()) {
                Set<String> found = files.stream().map(ProfileLoader::subjectIdOf).collect(Collectors.toSet());
                List<String> missing = subjectIds.stream().filter(id -> !found.contains(id)).sorted().collect(Collectors.toList());
                log.warn("No profile file for subjects {}", missing);
            }
        }
        log.info("Loading {} profiles from {}", files.size(), dir);

        Map<String, JsonNode> profiles = new LinkedHashMap<>();
        List<ProfileLoadFailure> failures = new ArrayList<>();
        int processed = 0;
        for (Path file : files) {
            String subjectId = subjectIdOf(file);
            try {
                profiles.put(subjectId, loadProfile(file));
            } catch (InvalidProfileException e) {
                failures.add(new ProfileLoadFailure(file, subjectId, LoadFailureReason.NOT_AN_OBJECT, e.getMessage()));
            } catch (JsonProcessingException e) {
                failures.add(new ProfileLoadFailure(file, subjectId, LoadFailureReason.MALFORMED_JSON, e.getOriginalMessage()));
            } catch (IOException e) {
                failures.add(new ProfileLoadFailure(file, subjectId, LoadFailureReason.FILE_READ_ERROR, e.getMessage()));
            }
            processed++;
            if (processed % PROGRESS_INTERVAL == 0) {
                log.info("Loaded {}/{} profile files", processed, files.size());
            }
        }

        ProfileLoadResult result = new ProfileLoadResult(profiles, failures);
        if (result.failureCount() > 0) {
            log.warn("Failed to load {} of {} profiles, e.g. {}", result.failureCount(), files.size(), result.sampleMessages());
        }
        log.info("Loaded {} profiles from {}", profiles.size(), dir);
        return result;
    }

    public static List<String> listSubjects(Map<String, JsonNode> profiles) {
        return profiles.keySet().stream().sorted().collect(Collectors.toList());
    }

    private static void checkDirectory(Path dir) throws IOException {
        if (!Files.exists(dir)) {
            throw new FileNotFoundException("Profile directory not found: " + dir);
        }
        if (!Files.isDirectory(dir)) {
            throw new NotDirectoryException(dir.toString());
        }
    }
}
