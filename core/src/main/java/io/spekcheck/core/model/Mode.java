package io.spekcheck.core.model;

/** How a filter is used at its position in a light path. */
public enum Mode {
    TRANSMIT("t"),
    REFLECT("r");

    private final String code;

    Mode(String code) {
        this.code = code;
    }

    /** Single-letter code used in setup files and descriptions ({@code t} or {@code r}). */
    public String code() {
        return code;
    }

    public Mode toggle() {
        return this == TRANSMIT ? REFLECT : TRANSMIT;
    }

    /**
     * Parses a mode code, case-insensitive.
     *
     * @throws IllegalArgumentException if the code is neither {@code t} nor {@code r}
     */
    public static Mode fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("invalid filter mode 'null'");
        }
        return switch (code.trim().toLowerCase()) {
            case "t" -> TRANSMIT;
            case "r" -> REFLECT;
            default -> throw new IllegalArgumentException("invalid filter mode '" + code + "'");
        };
    }
}
