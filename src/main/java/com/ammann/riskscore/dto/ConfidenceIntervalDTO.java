/* (C)2026 */
package com.ammann.riskscore.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Two-sided interval with its nominal coverage (for example 0.95).
 */
public record ConfidenceIntervalDTO(double lower, double upper, double level) {

    @JsonIgnore
    public double width() {
        return upper - lower;
    }

    public boolean contains(double value) {
        return value >= lower && value <= upper;
    }
}
