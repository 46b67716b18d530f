package at.sv.prayer.astro;

import java.time.LocalDate;

/**
 * Converts Gregorian calendar dates to Julian days, following Jean Meeus, <i>Astronomical Algorithms</i>.
 */
public final class JulianDay {

    private JulianDay() {
    }

    public static double of(LocalDate date) {
        return of(date.getYear(), date.getMonthValue(), date.getDayOfMonth());
    }

    /**
     * @param year  proleptic Gregorian year
     * @param month [1, 12]
     * @param day   day of month
     * @return the julian day for the given date
     */
    public static double of(int year, int month, int day) {
        double y = year;
        double m = month;
        if (m <= 2) {
            y -= 1;
            m += 12;
        }
        double a = Math.floor(y / 100.0);
        double b = 2 - a + Math.floor(a / 4.0);
        return Math.floor(365.25 * (y + 4716)) + Math.floor(30.6001 * (m + 1)) + day + b - 1524;
    }
}
