/* (C)2026 */
package com.ammann.riskscore.enumeration;

import com.ammann.riskscore.exception.ValidationException;

/**
 * Direction of a threshold predicate. A subject is classified positive when its value
 * lies strictly beyond the cut in the given direction.
 */
public enum Direction
{
    /** Positive when {@code value > cut}. */
    GREATER(">", "≤"),
    /** Positive when {@code value < cut}. */
    LESS("<", "≥");

    private final String symbol;
    private final String complementSymbol;

    Direction(String symbol, String complementSymbol) {
        this.symbol = symbol;
        this.complementSymbol = complementSymbol;
    }

    /**
     * Returns {@code true} if the value is classified positive against the cut.
     */
    public boolean isPositive(double value, double cut) {
        return this == GREATER ? value > cut : value < cut;
    }

    public String getSymbol() { return symbol; }

    public String getComplementSymbol() { return complementSymbol; }

    /**
     * Parses the configuration notation ({@code >} or {@code <}, or the enum name).
     */
    public static Direction fromSymbol(String text) {
        String trimmed = text == null ? "" : text.trim();
        for (Direction direction : values()) {
            if (direction.symbol.equals(trimmed) || direction.name().equalsIgnoreCase(trimmed)) {
                return direction;
            }
        }
        throw ValidationException.invalidParameter("direction", text, "'>' or '<'");
    }
}
