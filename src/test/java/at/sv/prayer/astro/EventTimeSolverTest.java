package at.sv.prayer.astro;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.OptionalDouble;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class EventTimeSolverTest {

    private static final double MORNING = 6 / 24.0;
    private static final double NOON = 12 / 24.0;
    private static final double EVENING = 18 / 24.0;

    private double equinox;
    private double summerSolstice;
    private double winterSolstice;

    @BeforeEach
    void setUp() {
        equinox = JulianDay.of(2021, 3, 20);
        summerSolstice = JulianDay.of(2021, 6, 21);
        winterSolstice = JulianDay.of(2021, 12, 21);
    }

    private static double sunrise(double julianDay, double latitude) {
        return EventTimeSolver.timeForAngle(180 - EventTimeSolver.HORIZON_ANGLE, MORNING, julianDay, latitude).orElseThrow();
    }

    private static double sunset(double julianDay, double latitude) {
        return EventTimeSolver.timeForAngle(EventTimeSolver.HORIZON_ANGLE, EVENING, julianDay, latitude).orElseThrow();
    }

    @Test
    void midday_j2000_equationOfTime() {
        assertThat(EventTimeSolver.midday(NOON, 2451545.0)).isCloseTo(12.059, within(1e-3));
    }

    @Test
    void equator_equinox_twelveHourDay() {
        double sunrise = sunrise(equinox, 0);
        double sunset = sunset(equinox, 0);
        double noon = EventTimeSolver.midday(NOON, equinox);

        assertThat(sunrise).isLessThan(noon);
        assertThat(sunset).isGreaterThan(noon);
        assertThat(sunset - sunrise).isCloseTo(12.1, within(0.1));
    }

    @Test
    void anglesAbove90_areMorningEvents() {
        double dawn = EventTimeSolver.timeForAngle(180 - 18, MORNING, equinox, 48).orElseThrow();
        double dusk = EventTimeSolver.timeForAngle(18, EVENING, equinox, 48).orElseThrow();
        double noon = EventTimeSolver.midday(NOON, equinox);

        assertThat(dawn).isLessThan(sunrise(equinox, 48));
        assertThat(dusk).isGreaterThan(sunset(equinox, 48));
        assertThat(noon - dawn).isCloseTo(dusk - noon, within(0.05));
    }

    @Test
    void polarDay_sunNeverSets_unsolvable() {
        OptionalDouble sunset = EventTimeSolver.timeForAngle(EventTimeSolver.HORIZON_ANGLE, EVENING, summerSolstice, 78.2);

        assertThat(sunset).isEmpty();
    }

    @Test
    void polarNight_sunNeverRises_unsolvable() {
        OptionalDouble sunrise = EventTimeSolver.timeForAngle(180 - EventTimeSolver.HORIZON_ANGLE, MORNING, winterSolstice, 78.2);

        assertThat(sunrise).isEmpty();
    }

    @Test
    void staysAbove_onlyForMidnightSun() {
        assertThat(EventTimeSolver.staysAbove(EventTimeSolver.HORIZON_ANGLE, EVENING, summerSolstice, 66.5)).isTrue();
        assertThat(EventTimeSolver.staysAbove(EventTimeSolver.HORIZON_ANGLE, EVENING, winterSolstice, -66.5)).isTrue();
        assertThat(EventTimeSolver.staysAbove(EventTimeSolver.HORIZON_ANGLE, EVENING, winterSolstice, 78.2)).isFalse();
        assertThat(EventTimeSolver.staysAbove(EventTimeSolver.HORIZON_ANGLE, EVENING, summerSolstice, 60)).isFalse();
        assertThat(EventTimeSolver.staysAbove(EventTimeSolver.HORIZON_ANGLE, EVENING, equinox, Double.NaN)).isFalse();
    }

    @Test
    void whiteNight_sunsetExists_butNoAstronomicalDusk() {
        assertThat(EventTimeSolver.timeForAngle(EventTimeSolver.HORIZON_ANGLE, EVENING, summerSolstice, 60)).isPresent();
        assertThat(EventTimeSolver.timeForAngle(18, EVENING, summerSolstice, 60)).isEmpty();
    }

    @Test
    void pole_unsolvable_insteadOfNaN() {
        assertThat(EventTimeSolver.timeForAngle(18, EVENING, equinox, 90)).isEmpty();
    }

    @Test
    void asr_afterNoon_hanafiLaterThanStandard() {
        double noon = EventTimeSolver.midday(NOON, equinox);
        double standard = EventTimeSolver.timeForAsr(1, 13 / 24.0, equinox, 30).orElseThrow();
        double hanafi = EventTimeSolver.timeForAsr(2, 13 / 24.0, equinox, 30).orElseThrow();

        assertThat(standard).isGreaterThan(noon);
        assertThat(hanafi).isGreaterThan(standard);
        assertThat(hanafi).isLessThan(sunset(equinox, 30));
    }
}
