package space.ketterling.gridload.store;

import org.apache.commons.csv.CSVRecord;

import space.ketterling.gridload.model.Dataset;
import space.ketterling.gridload.model.SystemLoadRecord;
import space.ketterling.gridload.model.TimestampParser;

import java.util.List;

public final class SystemLoadCsvCodec implements RecordCsvCodec<SystemLoadRecord> {
    static final List<String> HEADER = List.of("iso", "ts_utc", "ts_local", "location", "load_mw", "is_system");

    private final String defaultIso;

    public SystemLoadCsvCodec(String defaultIso) {
        this.defaultIso = defaultIso;
    }

    @Override
    public Dataset dataset() {
        return Dataset.SYSTEM;
    }

    @Override
    public Class<SystemLoadRecord> type() {
        return SystemLoadRecord.class;
    }

    @Override
    public List<String> header() {
        return HEADER;
    }

    @Override
    public List<String> toRow(SystemLoadRecord r) {
        return List.of(
                r.iso() == null ? "" : r.iso(),
                r.tsUtc().toString(),
                TimestampParser.formatLocal(r.tsLocal()),
                r.location(),
                RecordCsvCodec.loadText(r.loadMw()),
                Boolean.toString(r.isSystem()));
    }

    @Override
    public SystemLoadRecord fromRow(CSVRecord row) {
        String iso = RecordCsvCodec.cell(row, "iso");
        String location = RecordCsvCodec.cell(row, "location");
        if (location == null)
            throw new IllegalArgumentException("missing location");
        return new SystemLoadRecord(
                iso == null ? defaultIso : iso,
                RecordCsvCodec.utcCell(row, "ts_utc"),
                RecordCsvCodec.localCell(row, "ts_local"),
                location,
                RecordCsvCodec.loadCell(row, "load_mw"),
                Boolean.parseBoolean(RecordCsvCodec.cell(row, "is_system")));
    }
}
