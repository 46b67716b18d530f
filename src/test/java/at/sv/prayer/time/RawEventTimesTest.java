package at.sv.prayer.time;

import at.sv.prayer.Prayer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.OptionalDouble;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RawEventTimesTest {

    private RawEventTimes times;

    @BeforeEach
    void setUp() {
        times = new RawEventTimes();
    }

    @Test
    void initiallyUnresolved() {
        assertThat(times.getUnresolved()).containsExactly(Prayer.values());
        assertThatThrownBy(() -> times.get(Prayer.FAJR)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void set_emptyOptional_staysUnresolved() {
        times.set(Prayer.FAJR, OptionalDouble.empty());

        assertThat(times.isResolved(Prayer.FAJR)).isFalse();
        assertThat(times.find(Prayer.FAJR)).isEmpty();
    }

    @Test
    void shiftAll_onlyResolved() {
        times.set(Prayer.SUNRISE, 6.0);
        times.set(Prayer.SUNSET, OptionalDouble.of(18.0));

        times.shiftAll(0.5);

        assertThat(times.get(Prayer.SUNRISE)).isEqualTo(6.5);
        assertThat(times.get(Prayer.SUNSET)).isEqualTo(18.5);
        assertThat(times.isResolved(Prayer.ISHA)).isFalse();
    }

    @Test
    void clear_removesValue() {
        times.set(Prayer.ISHA, 20.0);

        times.clear(Prayer.ISHA);

        assertThat(times.getUnresolved()).contains(Prayer.ISHA);
    }
}
