package com.example.pos.utils;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Conversions between the {@code REAL} columns of the store and the {@link BigDecimal} values
 * used everywhere in Java code.
 */
public final class Decimals {

    public static final int DISPLAY_SCALE = 2;

    private Decimals() {
    }

    public static BigDecimal fromDb(double value) {
        return BigDecimal.valueOf(value);
    }

    public static double toDb(BigDecimal value) {
        return value == null ? 0.0 : value.doubleValue();
    }

    public static BigDecimal orZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }

    public static BigDecimal forDisplay(BigDecimal value) {
        return orZero(value).setScale(DISPLAY_SCALE, RoundingMode.HALF_UP);
    }
}
