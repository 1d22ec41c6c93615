package space.ketterling.gridload.store;

import org.apache.commons.csv.CSVRecord;

import space.ketterling.gridload.model.Dataset;
import space.ketterling.gridload.model.TimestampParser;
import space.ketterling.gridload.model.ZonalLoadRecord;

import java.util.List;

public final class ZonalLoadCsvCodec implements RecordCsvCodec<ZonalLoadRecord> {
    static final List<String> HEADER = List.of("iso", "ts_utc", "ts_local", "zone_id", "zone_name", "load_mw");

    private final String defaultIso;

    public ZonalLoadCsvCodec(String defaultIso) {
        this.defaultIso = defaultIso;
    }

    @Override
    public Dataset dataset() {
        return Dataset.ZONAL;
    }

    @Override
    public Class<ZonalLoadRecord> type() {
        return ZonalLoadRecord.class;
    }

    @Override
    public List<String> header() {
        return HEADER;
    }

    @Override
    public List<String> toRow(ZonalLoadRecord r) {
        return List.of(
                r.iso() == null ? "" : r.iso(),
                r.tsUtc().toString(),
                TimestampParser.formatLocal(r.tsLocal()),
                r.zoneId() == null ? "" : r.zoneId(),
                r.zoneName() == null ? "" : r.zoneName(),
                RecordCsvCodec.loadText(r.loadMw()));
    }

    @Override
    public ZonalLoadRecord fromRow(CSVRecord row) {
        String iso = RecordCsvCodec.cell(row, "iso");
        String zoneId = RecordCsvCodec.cell(row, "zone_id");
        String zoneName = RecordCsvCodec.cell(row, "zone_name");
        if (zoneId == null && zoneName == null)
            throw new IllegalArgumentException("missing zone_id and zone_name");
        return new ZonalLoadRecord(
                iso == null ? defaultIso : iso,
                RecordCsvCodec.utcCell(row, "ts_utc"),
                RecordCsvCodec.localCell(row, "ts_local"),
                zoneId,
                zoneName,
                RecordCsvCodec.loadCell(row, "load_mw"));
    }
}
