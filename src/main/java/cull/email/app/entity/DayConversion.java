package cull.email.app.entity;

import lombok.Value;

/**
 * Day counts used when an age in months or years is rendered as a day-granular
 * search term. Month and year lengths are approximations.
 */
@Value
public class DayConversion {
    public static final DayConversion DEFAULT = new DayConversion(30, 365);

    int daysPerMonth;
    int daysPerYear;

    public DayConversion(int daysPerMonth, int daysPerYear) {
        if (daysPerMonth <= 0 || daysPerYear <= 0) {
            throw new IllegalArgumentException("Day conversion constants must be positive");
        }
        if (daysPerYear < daysPerMonth) {
            throw new IllegalArgumentException("daysPerYear must not be smaller than daysPerMonth");
        }
        this.daysPerMonth = daysPerMonth;
        this.daysPerYear = daysPerYear;
    }
}
