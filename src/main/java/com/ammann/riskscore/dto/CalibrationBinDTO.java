/* (C)2026 */
package com.ammann.riskscore.dto;

/**
 * One group of the Hosmer-Lemeshow table.
 */
public record CalibrationBinDTO(int bin, int subjects, double meanPredicted, double observedRate) {
}
