package com.example.transtructiver.report;

import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.apache.commons.io.FileUtils;

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Appends result rows to a headerless CSV file. Existing content is never truncated.
 * <p>
 * Every write opens the file in append mode and closes it again, and writes are serialized
 * on this instance, so concurrent callers never interleave partial rows.
 */
public class SummaryLogWriter {

    private final File file;
    private final ObjectWriter rowWriter;

    public SummaryLogWriter(Path file) {
        this.file = file.toFile();
        CsvMapper csvMapper = new CsvMapper();
        CsvSchema schema = csvMapper.schemaFor(SummaryRecord.class).withoutHeader();
        this.rowWriter = csvMapper.writer(schema);
    }

    public synchronized void append(SummaryRecord record) {
        appendAll(List.of(record));
    }

    public synchronized void appendAll(List<SummaryRecord> records) {
        if (records.isEmpty()) {
            return;
        }
        try (OutputStream out = FileUtils.openOutputStream(file, true);
             SequenceWriter rows = rowWriter.writeValues(out)) {
            rows.writeAll(records);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot append to result log " + file, e);
        }
    }

    public Path getPath() {
        return file.toPath();
    }
}
