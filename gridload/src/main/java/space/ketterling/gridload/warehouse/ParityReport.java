package space.ketterling.gridload.warehouse;

import java.time.Instant;
import java.util.Locale;

/**
 * Difference between the sum of the zonal estimates and the system load at
 * one timestamp.
 */
public record ParityReport(Instant tsUtc, double systemMw, double zonesSumMw, int zoneCount) {

    public double deltaMw() {
        return zonesSumMw - systemMw;
    }

    /** Delta as a percentage of system load; 0 when system load is 0. */
    public double deltaPct() {
        return systemMw == 0.0 ? 0.0 : deltaMw() / systemMw * 100.0;
    }

    /**
     * Signed text such as {@code +50.0 MW (+0.33%)}.
     */
    public String format() {
        return String.format(Locale.ROOT, "%+.1f MW (%+.2f%%)", deltaMw(), deltaPct());
    }
}
