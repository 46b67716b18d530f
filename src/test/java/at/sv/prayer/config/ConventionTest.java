package at.sv.prayer.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConventionTest {

    @Test
    void fromIndex_legacyOrder() {
        assertThat(Convention.fromIndex(0)).isEqualTo(Convention.JAFARI);
        assertThat(Convention.fromIndex(1)).isEqualTo(Convention.KARACHI);
        assertThat(Convention.fromIndex(2)).isEqualTo(Convention.ISNA);
        assertThat(Convention.fromIndex(3)).isEqualTo(Convention.MWL);
        assertThat(Convention.fromIndex(4)).isEqualTo(Convention.MAKKAH);
        assertThat(Convention.fromIndex(5)).isEqualTo(Convention.EGYPT);
        assertThat(Convention.fromIndex(6)).isEqualTo(Convention.TEHRAN);
        assertThat(Convention.fromIndex(7)).isEqualTo(Convention.CUSTOM);
    }

    @Test
    void fromIndex_outOfBounds_fails() {
        assertThatThrownBy(() -> Convention.fromIndex(8)).isInstanceOf(InvalidCalculationConfig.class)
                                                         .hasMessageContaining("8");
        assertThatThrownBy(() -> Convention.fromIndex(-1)).isInstanceOf(InvalidCalculationConfig.class);
    }

    @Test
    void jafari_angleBasedEvenings() {
        ConventionAngles angles = Convention.JAFARI.getAngles();

        assertThat(angles.fajrAngle()).isEqualTo(16);
        assertThat(angles.maghrib()).isEqualTo(EveningDefinition.angle(4));
        assertThat(angles.isha()).isEqualTo(EveningDefinition.angle(14));
    }

    @Test
    void makkah_ishaNinetyMinutesAfterMaghrib() {
        ConventionAngles angles = Convention.MAKKAH.getAngles();

        assertThat(angles.fajrAngle()).isEqualTo(18.5);
        assertThat(angles.maghrib().isMinutesAfter()).isTrue();
        assertThat(angles.maghrib().value()).isEqualTo(0);
        assertThat(angles.isha()).isEqualTo(EveningDefinition.minutesAfter(90));
    }

    @Test
    void remainingTable() {
        assertAngles(Convention.KARACHI, 18, EveningDefinition.minutesAfter(0), EveningDefinition.angle(18));
        assertAngles(Convention.ISNA, 15, EveningDefinition.minutesAfter(0), EveningDefinition.angle(15));
        assertAngles(Convention.MWL, 18, EveningDefinition.minutesAfter(0), EveningDefinition.angle(17));
        assertAngles(Convention.EGYPT, 19.5, EveningDefinition.minutesAfter(0), EveningDefinition.angle(17.5));
        assertAngles(Convention.TEHRAN, 17.7, EveningDefinition.angle(4.5), EveningDefinition.angle(14));
        assertAngles(Convention.CUSTOM, 18, EveningDefinition.minutesAfter(0), EveningDefinition.angle(17));
    }

    @Test
    void onlyJafari_usesFajrForMidnight() {
        assertThat(Convention.JAFARI.isMidnightUntilFajr()).isTrue();
        assertThat(Convention.TEHRAN.isMidnightUntilFajr()).isFalse();
        assertThat(Convention.MWL.isMidnightUntilFajr()).isFalse();
    }

    private static void assertAngles(Convention convention, double fajr, EveningDefinition maghrib, EveningDefinition isha) {
        assertThat(convention.getAngles()).isEqualTo(new ConventionAngles(fajr, maghrib, isha));
    }
}
