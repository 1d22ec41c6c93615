package space.ketterling.gridload.warehouse;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ParityReportTest {
    private static final Instant TS = Instant.parse("2024-01-01T05:05:00Z");

    @Test
    void positiveDelta() {
        ParityReport r = new ParityReport(TS, 15000.0, 15050.0, 8);

        assertThat(r.deltaMw()).isEqualTo(50.0);
        assertThat(r.deltaPct()).isCloseTo(0.3333, within(1e-4));
        assertThat(r.format()).isEqualTo("+50.0 MW (+0.33%)");
    }

    @Test
    void negativeDelta() {
        assertThat(new ParityReport(TS, 16000.0, 15840.0, 8).format()).isEqualTo("-160.0 MW (-1.00%)");
    }

    @Test
    void zeroSystemLoadHasZeroPercent() {
        ParityReport r = new ParityReport(TS, 0.0, 12.0, 1);

        assertThat(r.deltaPct()).isZero();
        assertThat(r.format()).isEqualTo("+12.0 MW (+0.00%)");
    }
}
