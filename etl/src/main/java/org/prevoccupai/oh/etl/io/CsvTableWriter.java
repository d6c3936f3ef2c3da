package org.prevoccupai.oh.etl.io;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.prevoccupai.oh.data.table.TableRow;
import org.prevoccupai.oh.data.table.TidyTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Writes tidy tables as CSV. Missing cells become empty fields and list cells are joined with {@code ;}.
 */
public class CsvTableWriter implements TableWriter {

    private static final Logger log = LoggerFactory.getLogger(CsvTableWriter.class);

    static final String LIST_SEPARATOR = ";";

    private final Path file;

    private final CSVPrinter printer;

    private List<String> columns;

    public CsvTableWriter(Path file) throws IOException {
        this.file = file;
        this.printer = new CSVPrinter(Files.newBufferedWriter(file, StandardCharsets.UTF_8), CSVFormat.DEFAULT);
    }

    /**
     * Writes the whole table, header first, to {@code file}.
     */
    public static void write(TidyTable table, Path file) throws IOException {
        try (CsvTableWriter writer = new CsvTableWriter(file)) {
            writer.writeHeader(table.getColumns());
            writer.writeRows(table.getRows());
        }
        log.info("Wrote {} rows and {} columns to {}", table.size(), table.getColumns().size(), file);
    }

    @Override
    public void writeHeader(List<String> columns) throws IOException {
        this.columns = List.copyOf(columns);
        printer.printRecord(this.columns);
    }

    @Override
    public void writeRows(Collection<TableRow> rows) throws IOException {
        if (columns == null) {
            throw new IllegalStateException("Header must be written before rows of " + file);
        }
        for (TableRow row : rows) {
            List<String> record = new ArrayList<>(columns.size());
            for (String column : columns) {
                record.add(format(row.get(column)));
            }
            printer.printRecord(record);
        }
    }

    @Override
    public Path getFile() {
        return file;
    }

    @Override
    public void close() throws IOException {
        printer.close(true);
    }

    static String format(Object cell) {
        if (cell == null) {
            return "";
        }
        if (cell instanceof List) {
            return ((List<?>) cell).stream().map(CsvTableWriter::format).collect(Collectors.joining(LIST_SEPARATOR));
        }
        return cell.toString();
    }
}
