package space.ketterling.gridload.normalize;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ZoneDirectoryTest {
    private final ZoneDirectory zones = ZoneDirectory.isoNewEngland();

    @Test
    void holdsTheEightLoadZonesAndTheHub() {
        assertThat(zones.size()).isEqualTo(9);
        assertThat(zones.nameForId("4000")).contains("HUB");
        assertThat(zones.nameForId("4008")).contains("NEMA/Boston");
        assertThat(zones.nameForId("4999")).isEmpty();
        assertThat(zones.nameForId(null)).isEmpty();
    }

    @Test
    void namesAndAliasesResolveCaseInsensitively() {
        assertThat(zones.idForName("ct")).contains("4004");
        assertThat(zones.idForName(" nema/boston ")).contains("4008");
        assertThat(zones.idForName("NEMASSBOST")).contains("4008");
        assertThat(zones.idForName("Maine")).contains("4001");
        assertThat(zones.idForName("Offshore")).isEmpty();
    }

    @Test
    void aliasMustPointAtAKnownZone() {
        assertThatThrownBy(() -> ZoneDirectory.of(Map.of("1", "A"), Map.of("ALPHA", "2")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("2");
    }
}
