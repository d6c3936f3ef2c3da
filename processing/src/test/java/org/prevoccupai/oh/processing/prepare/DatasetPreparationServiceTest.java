package org.prevoccupai.oh.processing.prepare;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.prevoccupai.oh.data.table.Columns;
import org.prevoccupai.oh.exception.ExtractionConfigurationException;
import org.prevoccupai.oh.processing.TestProfiles;
import org.prevoccupai.oh.processing.extract.TidyExtractor;
import org.prevoccupai.oh.processing.filter.ProfileFilter;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DatasetPreparationServiceTest {

    private static final String INTENSITY = "EMG_intensity.mean_percent_mvc";
    private static final String APDF_P50 = "EMG_apdf.active.p50";

    private DatasetPreparationService preparationService;

    @BeforeEach
    public void setup() {
        preparationService = new DatasetPreparationService(new TidyExtractor(new ProfileFilter()));
    }

    @Test
    public void prepareDailyEmg_bothSides_keepsDailyMetricsOnly() {
        AnalysisDataset dataset = preparationService.prepareDailyEmg(TestProfiles.all(), SideOption.BOTH, true, true);

        assertEquals(3, dataset.nObservations());
        assertEquals(1, dataset.nSubjects());
        assertEquals(List.of(Columns.SIDE), dataset.groupingVars());
        assertEquals(List.of(INTENSITY, APDF_P50), dataset.outcomeVars());
        assertFalse(dataset.data().hasColumn(DatasetPreparationService.LEVEL));

        assertEquals(
            Arrays.asList(LocalDate.of(2025, 1, 6), LocalDate.of(2025, 1, 7), LocalDate.of(2025, 1, 7)),
            dataset.data().column(Columns.DATE)
        );
        assertEquals(Arrays.asList("left", "left", "right"), dataset.data().column(Columns.SIDE));
        assertEquals(Arrays.asList(8.0, 10.0, 14.0), dataset.data().column(INTENSITY));
        assertEquals(Arrays.asList(1, 2, 2), dataset.data().column(DatasetPreparationService.DAY_INDEX));
        assertEquals(Arrays.asList("Monday", "Tuesday", "Tuesday"), dataset.data().column(DatasetPreparationService.WEEKDAY));
    }

    @Test
    public void prepareDailyEmg_leftSide_dropsSideColumn() {
        AnalysisDataset dataset = preparationService.prepareDailyEmg(TestProfiles.all(), SideOption.LEFT, false, false);

        assertEquals(Arrays.asList(8.0, 10.0), dataset.data().column(INTENSITY));
        assertFalse(dataset.data().hasColumn(Columns.SIDE));
        assertFalse(dataset.data().hasColumn(DatasetPreparationService.DAY_INDEX));
        assertEquals(List.of(), dataset.groupingVars());
    }

    @Test
    public void prepareDailyEmg_average_keepsOnlyBilateralDays() {
        AnalysisDataset dataset = preparationService.prepareDailyEmg(TestProfiles.all(), SideOption.AVERAGE, true, false);

        assertEquals(1, dataset.nObservations());
        assertEquals(LocalDate.of(2025, 1, 7), dataset.data().get(0, Columns.DATE));
        assertEquals(12.0, dataset.data().get(0, INTENSITY));
        assertEquals(5.0, dataset.data().get(0, APDF_P50));
        assertEquals(1, dataset.data().get(0, DatasetPreparationService.DAY_INDEX));
    }

    @Test
    public void prepareDailyEmg_noEmgData_returnsEmptyDataset() {
        AnalysisDataset dataset = preparationService.prepareDailyEmg(
            TestProfiles.profiles("S1", TestProfiles.OFFICE_WORKER), SideOption.BOTH, true, true
        );

        assertEquals(0, dataset.nObservations());
        assertEquals(List.of(), dataset.outcomeVars());
        assertTrue(dataset.timeRange().isEmpty());
    }

    @Test
    public void prepareDailyQuestionnaires_allDomains_groupedByDomain() {
        Optional<AnalysisDataset> dataset = preparationService.prepareDailyQuestionnaires(TestProfiles.all(), null, true, true);

        assertTrue(dataset.isPresent());
        assertEquals(List.of(DatasetPreparationService.DOMAIN), dataset.get().groupingVars());
        assertEquals(List.of("score", "neck"), dataset.get().outcomeVars());
        assertEquals(Arrays.asList("workload", "workload", "pain"), dataset.get().data().column(DatasetPreparationService.DOMAIN));
        assertEquals(Arrays.asList(1, 2, 1), dataset.get().data().column(DatasetPreparationService.DAY_INDEX));
    }

    @Test
    public void prepareDailyQuestionnaires_singleDomain() {
        Optional<AnalysisDataset> dataset = preparationService.prepareDailyQuestionnaires(TestProfiles.all(), "workload", false, false);

        assertTrue(dataset.isPresent());
        assertEquals(2, dataset.get().nObservations());
        assertEquals(List.of(), dataset.get().groupingVars());
    }

    @Test
    public void prepareDailyQuestionnaires_noData_isEmpty() {
        assertTrue(preparationService.prepareDailyQuestionnaires(TestProfiles.all(), "sleep", true, true).isEmpty());
        assertTrue(
            preparationService
                .prepareDailyQuestionnaires(TestProfiles.profiles("S2", TestProfiles.FACTORY_WORKER), null, true, true)
                .isEmpty()
        );
    }

    @Test
    public void prepareWeeklyEmg_oneRowPerSide() {
        AnalysisDataset dataset = preparationService.prepareWeeklyEmg(TestProfiles.all(), SideOption.BOTH);

        assertEquals(List.of(Columns.SUBJECT_ID, Columns.SIDE, APDF_P50), dataset.data().getColumns());
        assertEquals(Arrays.asList("left", "right"), dataset.data().column(Columns.SIDE));
        assertEquals(Arrays.asList(3.5, 5.5), dataset.data().column(APDF_P50));
        assertEquals(Columns.SUBJECT_ID, dataset.timeVar());
        assertEquals("weekly", dataset.level());
    }

    @Test
    public void prepareWeeklyEmg_average() {
        AnalysisDataset dataset = preparationService.prepareWeeklyEmg(TestProfiles.all(), SideOption.AVERAGE);

        assertEquals(1, dataset.nObservations());
        assertEquals(4.5, dataset.data().get(0, APDF_P50));
    }

    @Test
    public void describe_summarisesDataset() {
        AnalysisDataset dataset = preparationService.prepareDailyEmg(TestProfiles.all(), SideOption.BOTH, true, true);

        String description = preparationService.describe(dataset);

        assertTrue(description.startsWith("AnalysisDataset: emg (daily level)"));
        assertTrue(description.contains("Subjects: 1"));
        assertTrue(description.contains("Date range: 2025-01-06 to 2025-01-07"));
        assertTrue(description.contains("Outcomes: 2 variables"));
    }

    @Test
    public void sideOption_parse() {
        assertEquals(SideOption.AVERAGE, SideOption.parse("average"));
        assertEquals(SideOption.LEFT, SideOption.parse(" Left "));
        assertThrows(ExtractionConfigurationException.class, () -> SideOption.parse("centre"));
        assertThrows(ExtractionConfigurationException.class, () -> SideOption.parse(null));
    }
}
