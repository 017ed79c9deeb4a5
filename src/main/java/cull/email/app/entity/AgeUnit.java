package cull.email.app.entity;

/**
 * Unit of a {@link MessageAge}. The token character is the prefix used in
 * compact age tokens such as {@code m:6}.
 */
public enum AgeUnit {
    DAYS('d', "day"),
    MONTHS('m', "month"),
    YEARS('y', "year");

    private final char token;
    private final String singular;

    AgeUnit(char token, String singular) {
        this.token = token;
        this.singular = singular;
    }

    public char getToken() {
        return token;
    }

    public String describe(long count) {
        return count == 1 ? singular : singular + "s";
    }

    public static AgeUnit fromToken(char token) {
        for (AgeUnit unit : values()) {
            if (unit.token == Character.toLowerCase(token)) {
                return unit;
            }
        }
        return null;
    }
}
