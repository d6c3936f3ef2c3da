package org.prevoccupai.oh.etl.io;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.prevoccupai.oh.data.table.TableRow;
import org.prevoccupai.oh.data.table.TidyTable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvTableWriterTest {

    @TempDir
    Path outputDir;

    @Test
    public void write_headerAndRowsInColumnOrder() throws IOException {
        TidyTable table = new TidyTable(List.of("subject_id", "date", "HR_BPM_stats.mean", "HR_timeline"));
        table.addRow(new TableRow().put("subject_id", "S1").put("date", "06-01-2025").put("HR_BPM_stats.mean", 70.0));
        table.addRow(new TableRow().put("HR_timeline", List.of(72.0, 75.0)).put("subject_id", "S2"));
        Path file = outputDir.resolve("smartwatch.csv");

        CsvTableWriter.write(table, file);

        assertEquals(
            List.of("subject_id,date,HR_BPM_stats.mean,HR_timeline", "S1,06-01-2025,70.0,", "S2,,,72.0;75.0"),
            Files.readAllLines(file)
        );
    }

    @Test
    public void write_emptyTableHasHeaderOnly() throws IOException {
        Path file = outputDir.resolve("empty.csv");

        CsvTableWriter.write(new TidyTable(List.of("subject_id", "date")), file);

        assertEquals(List.of("subject_id,date"), Files.readAllLines(file));
    }

    @Test
    public void write_quotesValuesWithSeparators() throws IOException {
        TidyTable table = new TidyTable(List.of("subject_id", "note"));
        table.addRow(new TableRow().put("subject_id", "S1").put("note", "left, then right"));
        Path file = outputDir.resolve("notes.csv");

        CsvTableWriter.write(table, file);

        assertEquals("S1,\"left, then right\"", Files.readAllLines(file).get(1));
    }

    @Test
    public void writeRows_beforeHeader_throwsException() throws IOException {
        try (CsvTableWriter writer = new CsvTableWriter(outputDir.resolve("rows.csv"))) {
            assertThrows(IllegalStateException.class, () -> writer.writeRows(List.of(new TableRow())));
        }
    }

    @Test
    public void format_cells() {
        assertEquals("", CsvTableWriter.format(null));
        assertEquals("true", CsvTableWriter.format(true));
        assertEquals("a;b", CsvTableWriter.format(List.of("a", "b")));
    }
}
