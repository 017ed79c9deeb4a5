package cull.email.app.entity;

import cull.email.app.exception.InvalidMessageAgeException;
import cull.email.app.exception.InvalidMessageAgeException.Reason;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Minimum age a message must reach before a rule disposes of it.
 * Built from a compact token ({@code d:30}, {@code m:6}, {@code y:1}) or from
 * an explicit unit and count; immutable.
 */
@Getter
@EqualsAndHashCode
public final class MessageAge implements Comparable<MessageAge> {
    /** Largest accepted count; keeps day rendering far from long overflow. */
    public static final long MAX_COUNT = 100_000;

    private final AgeUnit unit;
    private final long count;

    private MessageAge(AgeUnit unit, long count) {
        this.unit = unit;
        this.count = count;
    }

    public static MessageAge of(AgeUnit unit, long count) {
        if (unit == null) {
            throw new InvalidMessageAgeException(Reason.UNKNOWN_UNIT, "Message age unit is required");
        }
        if (count <= 0) {
            throw new InvalidMessageAgeException(Reason.INVALID_COUNT,
                "Message age count must be positive, got " + count);
        }
        if (count > MAX_COUNT) {
            throw new InvalidMessageAgeException(Reason.INVALID_COUNT,
                "Message age count must not exceed " + MAX_COUNT + ", got " + count);
        }
        return new MessageAge(unit, count);
    }

    public static MessageAge days(long count) {
        return of(AgeUnit.DAYS, count);
    }

    public static MessageAge months(long count) {
        return of(AgeUnit.MONTHS, count);
    }

    public static MessageAge years(long count) {
        return of(AgeUnit.YEARS, count);
    }

    /**
     * Parses a token of the form {@code <unit>:<count>} where unit is one of
     * {@code d}, {@code m} or {@code y} and count is a positive integer.
     * @throws InvalidMessageAgeException if the token is malformed, the unit is
     *         unknown or the count is not a positive integer
     */
    public static MessageAge parse(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidMessageAgeException(Reason.MALFORMED, "Message age token is empty");
        }
        String trimmed = token.trim();
        int separator = trimmed.indexOf(':');
        if (separator != 1 || trimmed.length() < 3) {
            throw new InvalidMessageAgeException(Reason.MALFORMED,
                "Message age token `" + token + "` does not match <d|m|y>:<count>");
        }

        AgeUnit unit = AgeUnit.fromToken(trimmed.charAt(0));
        if (unit == null) {
            throw new InvalidMessageAgeException(Reason.UNKNOWN_UNIT,
                "Unknown message age unit `" + trimmed.charAt(0) + "` in `" + token + "`");
        }

        long count;
        try {
            count = Long.parseLong(trimmed.substring(2));
        } catch (NumberFormatException e) {
            throw new InvalidMessageAgeException(Reason.INVALID_COUNT,
                "Message age count in `" + token + "` is not a number", e);
        }
        return of(unit, count);
    }

    public String toToken() {
        return unit.getToken() + ":" + count;
    }

    public long toDays(DayConversion conversion) {
        switch (unit) {
            case MONTHS:
                return Math.multiplyExact(count, (long) conversion.getDaysPerMonth());
            case YEARS:
                return Math.multiplyExact(count, (long) conversion.getDaysPerYear());
            default:
                return count;
        }
    }

    /**
     * Search term matching messages older than this age, e.g. {@code older_than:180d}.
     */
    public String render(DayConversion conversion) {
        return "older_than:" + toDays(conversion) + "d";
    }

    public String render() {
        return render(DayConversion.DEFAULT);
    }

    /** "6 months", "1 year". */
    public String describe() {
        return count + " " + unit.describe(count);
    }

    /** "6-months", used in generated label names. */
    public String label() {
        return count + "-" + unit.describe(count);
    }

    @Override
    public int compareTo(MessageAge other) {
        if (unit != other.unit) {
            throw new IllegalArgumentException("Cannot compare " + this + " with " + other + ": units differ");
        }
        return Long.compare(count, other.count);
    }

    @Override
    public String toString() {
        return toToken();
    }
}
