package at.sv.prayer.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class HighLatitudeMethodTest {

    @Test
    void nightPortion() {
        assertThat(HighLatitudeMethod.NONE.nightPortion(18)).isEqualTo(0);
        assertThat(HighLatitudeMethod.NIGHT_MIDDLE.nightPortion(18)).isEqualTo(0.5);
        assertThat(HighLatitudeMethod.ONE_SEVENTH.nightPortion(18)).isCloseTo(0.142857, within(1e-6));
        assertThat(HighLatitudeMethod.ANGLE_BASED.nightPortion(18)).isCloseTo(0.3, within(1e-12));
        assertThat(HighLatitudeMethod.ANGLE_BASED.nightPortion(15)).isCloseTo(0.25, within(1e-12));
    }

    @Test
    void fromIndex() {
        assertThat(HighLatitudeMethod.fromIndex(0)).isEqualTo(HighLatitudeMethod.NONE);
        assertThat(HighLatitudeMethod.fromIndex(3)).isEqualTo(HighLatitudeMethod.ANGLE_BASED);
        assertThatThrownBy(() -> HighLatitudeMethod.fromIndex(4)).isInstanceOf(InvalidCalculationConfig.class);
    }
}
