package com.example.pos.utils;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;

/**
 * Date-of-birth handling for the customer ledger. Values are stored as {@code yyyy-MM-dd};
 * input may also come as {@code dd-MM-yyyy}, the format shown at the counter.
 */
public final class DateTimeUtils {

    public static final DateTimeFormatter DOB_STORAGE = DateTimeFormatter.ofPattern("uuuu-MM-dd")
            .withResolverStyle(ResolverStyle.STRICT);
    public static final DateTimeFormatter DOB_DISPLAY = DateTimeFormatter.ofPattern("dd-MM-uuuu")
            .withResolverStyle(ResolverStyle.STRICT);

    private DateTimeUtils() {
    }

    /**
     * Parses a date of birth in either accepted format. Returns null for blank or unparseable
     * input.
     */
    public static LocalDate parseDobOrNull(String s) {
        if (s == null || s.isBlank())
            return null;
        String trimmed = s.trim();
        try {
            return LocalDate.parse(trimmed, DOB_STORAGE);
        } catch (DateTimeParseException ignored) {
            // second accepted format below
        }
        try {
            return LocalDate.parse(trimmed, DOB_DISPLAY);
        } catch (DateTimeParseException ignored) {
            return null;
        }
    }

    public static String formatDobForDisplay(String dob) {
        LocalDate parsed = parseDobOrNull(dob);
        if (parsed == null)
            return dob == null || dob.isBlank() ? "-" : dob;
        return parsed.format(DOB_DISPLAY);
    }
}
