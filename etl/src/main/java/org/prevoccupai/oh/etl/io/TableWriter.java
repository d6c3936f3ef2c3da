package org.prevoccupai.oh.etl.io;

import org.prevoccupai.oh.data.table.TableRow;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;

public interface TableWriter extends Closeable {
    void writeHeader(List<String> columns) throws IOException;

    /**
     * Rows are written in the column order given to {@link #writeHeader}.
     */
    void writeRows(Collection<TableRow> rows) throws IOException;

    Path getFile();
}
