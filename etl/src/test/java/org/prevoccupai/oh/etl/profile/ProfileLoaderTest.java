package org.prevoccupai.oh.etl.profile;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ProfileLoaderTest {

    @TempDir
    Path profilesDir;

    private ProfileLoader loader;

    @BeforeEach
    public void setup() throws IOException {
        loader = new ProfileLoader();
        write("S2_OH_profile.json", "{\"meta_data\": {\"group\": \"factory\"}}");
        write("S1_OH_profile.json", "{\"meta_data\": {\"group\": \"office\"}}");
        write("notes.txt", "not a profile");
    }

    @Test
    public void discover_onlyProfileFilesSortedByName() throws IOException {
        List<Path> files = loader.discover(profilesDir);

        assertEquals(List.of(profilesDir.resolve("S1_OH_profile.json"), profilesDir.resolve("S2_OH_profile.json")), files);
    }

    @Test
    public void subjectIdOf_stripsProfileSuffix() {
        assertEquals("S001", ProfileLoader.subjectIdOf(Path.of("data", "S001_OH_profile.json")));
        assertEquals("S001", ProfileLoader.subjectIdOf(Path.of("S001.json")));
        assertEquals("README", ProfileLoader.subjectIdOf(Path.of("README")));
    }

    @Test
    public void loadProfiles_allSubjectsInOrder() throws IOException {
        ProfileLoadResult result = loader.loadProfiles(profilesDir, null);

        assertEquals(List.of("S1", "S2"), List.copyOf(result.profiles().keySet()));
        assertEquals("office", result.profiles().get("S1").at("/meta_data/group").asText());
        assertEquals(0, result.failureCount());
    }

    @Test
    public void loadProfiles_selectedSubjects() throws IOException {
        ProfileLoadResult result = loader.loadProfiles(profilesDir, List.of("S2", "S9"));

        assertEquals(List.of("S2"), List.copyOf(result.profiles().keySet()));
    }

    @Test
    public void loadProfiles_nonNumericNumbersAccepted() throws IOException {
        write("S1_OH_profile.json", "{\"sensor_metrics\": {\"HR_BPM_stats\": {\"mean\": NaN, \"max\": Infinity}}}");

        ProfileLoadResult result = loader.loadProfiles(profilesDir, List.of("S1"));

        assertEquals(0, result.failureCount());
        JsonNode stats = result.profiles().get("S1").at("/sensor_metrics/HR_BPM_stats");
        assertTrue(Double.isNaN(stats.get("mean").doubleValue()));
        assertTrue(Double.isInfinite(stats.get("max").doubleValue()));
    }

    @Test
    public void loadProfiles_badFilesAreCountedNotFatal() throws IOException {
        write("S3_OH_profile.json", "{\"meta_data\": ");
        write("S4_OH_profile.json", "[1, 2]");

        ProfileLoadResult result = loader.loadProfiles(profilesDir, null);

        assertEquals(2, result.profiles().size());
        assertEquals(2, result.failureCount());
        assertEquals(LoadFailureReason.MALFORMED_JSON, result.failures().get(0).reason());
        assertEquals(LoadFailureReason.NOT_AN_OBJECT, result.failures().get(1).reason());
        assertEquals("S4", result.failures().get(1).subjectId());
        assertTrue(result.sampleMessages().get(0).startsWith("S3_OH_profile.json"));
    }

    @Test
    public void loadProfiles_sampleMessagesAreBounded() throws IOException {
        for (int i = 0; i < 7; i++) {
            write("X" + i + "_OH_profile.json", "oops");
        }

        ProfileLoadResult result = loader.loadProfiles(profilesDir, null);

        assertEquals(7, result.failureCount());
        assertEquals(ProfileLoadResult.MAX_SAMPLE_MESSAGES, result.sampleMessages().size());
    }

    @Test
    public void loadProfiles_missingDirectory_throwsException() {
        assertThrows(FileNotFoundException.class, () -> loader.loadProfiles(profilesDir.resolve("absent"), null));
        assertThrows(NotDirectoryException.class, () -> loader.loadProfiles(profilesDir.resolve("notes.txt"), null));
    }

    @Test
    public void loadProfile_rejectsNonObjectRoot() throws IOException {
        Path file = write("S5_OH_profile.json", "\"just text\"");

        assertThrows(InvalidProfileException.class, () -> loader.loadProfile(file));
    }

    @Test
    public void listSubjects_sorted() {
        Map<String, JsonNode> profiles = new LinkedHashMap<>();
        profiles.put("S2", null);
        profiles.put("S10", null);
        profiles.put("S1", null);

        assertEquals(List.of("S1", "S10", "S2"), ProfileLoader.listSubjects(profiles));
    }

    private Path write(String name, String content) throws IOException {
        return Files.writeString(profilesDir.resolve(name), content);
    }
}
