package space.ketterling.gridload.store;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;

import space.ketterling.gridload.model.Dataset;
import space.ketterling.gridload.model.LoadRecord;
import space.ketterling.gridload.model.TimestampParser;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Maps one dataset's records to and from history CSV rows.
 *
 * <p>
 * Timestamps are written as {@code 2024-01-01T00:05:00Z} (UTC) and
 * {@code 2024-01-01T00:05:00} (wall clock); a null load is an empty cell.
 * </p>
 */
public interface RecordCsvCodec<R extends LoadRecord> {

    Dataset dataset();

    Class<R> type();

    List<String> header();

    List<String> toRow(R record);

    /**
     * Reads one row.
     *
     * @throws IllegalArgumentException when a required cell is missing or
     *                                  unreadable
     */
    R fromRow(CSVRecord row);

    /**
     * Reads a whole partition file; an absent file reads as empty.
     */
    default List<R> read(Path file) throws IOException {
        if (!Files.exists(file))
            return List.of();
        CSVFormat fmt = CSVFormat.DEFAULT.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .setIgnoreEmptyLines(true)
                .setTrim(true)
                .build();
        List<R> out = new ArrayList<>();
        try (BufferedReader r = Files.newBufferedReader(file, StandardCharsets.UTF_8);
                CSVParser parser = new CSVParser(r, fmt)) {
            for (CSVRecord row : parser) {
                try {
                    out.add(fromRow(row));
                } catch (IllegalArgumentException e) {
                    throw new IOException("Malformed row " + row.getRecordNumber() + " in " + file + ": "
                            + e.getMessage(), e);
                }
            }
        }
        return out;
    }

    /**
     * Writes rows with a header line, replacing any existing file content.
     */
    default void write(Path file, List<? extends R> rows) throws IOException {
        CSVFormat fmt = CSVFormat.DEFAULT.builder()
                .setHeader(header().toArray(new String[0]))
                .setRecordSeparator("\n")
                .build();
        try (BufferedWriter w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter printer = new CSVPrinter(w, fmt)) {
            for (R rec : rows)
                printer.printRecord(toRow(rec));
        }
    }

    /**
     * Codec for a dataset; {@code defaultIso} fills rows with a blank iso
     * cell.
     */
    static RecordCsvCodec<? extends LoadRecord> forDataset(Dataset dataset, String defaultIso) {
        return switch (dataset) {
            case SYSTEM -> new SystemLoadCsvCodec(defaultIso);
            case ZONAL -> new ZonalLoadCsvCodec(defaultIso);
        };
    }

    // ----------------------------
    // cell helpers
    // ----------------------------

    static String cell(CSVRecord row, String column) {
        if (!row.isMapped(column) || !row.isSet(column))
            return null;
        String v = row.get(column);
        return v == null || v.isBlank() ? null : v.trim();
    }

    static Instant utcCell(CSVRecord row, String column) {
        String v = cell(row, column);
        if (v == null)
            throw new IllegalArgumentException("missing " + column);
        return TimestampParser.parse(v)
                .map(TimestampParser.Parsed::utc)
                .orElseThrow(() -> new IllegalArgumentException("unreadable " + column + " '" + v + "'"));
    }

    static LocalDateTime localCell(CSVRecord row, String column) {
        String v = cell(row, column);
        if (v == null)
            return null;
        return TimestampParser.parse(v)
                .map(TimestampParser.Parsed::local)
                .orElseThrow(() -> new IllegalArgumentException("unreadable " + column + " '" + v + "'"));
    }

    static Double loadCell(CSVRecord row, String column) {
        String v = cell(row, column);
        if (v == null)
            return null;
        try {
            double d = Double.parseDouble(v);
            return Double.isFinite(d) ? d : null;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("unreadable " + column + " '" + v + "'", e);
        }
    }

    static String loadText(Double loadMw) {
        return loadMw == null ? "" : loadMw.toString();
    }
}
