package com.ai.scheduling.utils;

import org.apache.commons.lang3.StringUtils;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Structural checks on patient input. No check digits are verified for the CPF, only shape.
 */
public final class PatientDataValidator {

    public static final int NATIONAL_ID_LENGTH = 11;
    public static final int MIN_NAME_LENGTH = 3;

    /** Only ASCII digits, so one CPF has exactly one key form. */
    private static final String ASCII_DIGITS = "0123456789";

    private static final Pattern BRAZILIAN_DATE = Pattern.compile("\\d{2}/\\d{2}/\\d{4}");
    private static final DateTimeFormatter BRAZILIAN_FORMAT =
            DateTimeFormatter.ofPattern("dd/MM/uuuu").withResolverStyle(ResolverStyle.STRICT);

    private PatientDataValidator() {
    }

    /** Strips the usual {@code 123.456.789-00} punctuation and surrounding whitespace. */
    public static String normalizeNationalId(String raw) {
        if (raw == null) return null;
        return StringUtils.remove(StringUtils.remove(raw.trim(), '.'), '-');
    }

    public static boolean isValidNationalId(String raw) {
        String digits = normalizeNationalId(raw);
        return digits != null
                && digits.length() == NATIONAL_ID_LENGTH
                && StringUtils.containsOnly(digits, ASCII_DIGITS);
    }

    public static Optional<LocalDate> parseDateOfBirth(String raw) {
        String value = StringUtils.trimToNull(raw);
        if (value == null) return Optional.empty();
        DateTimeFormatter format = BRAZILIAN_DATE.matcher(value).matches()
                ? BRAZILIAN_FORMAT
                : DateTimeFormatter.ISO_LOCAL_DATE;
        try {
            return Optional.of(LocalDate.parse(value, format));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    public static boolean isValidName(String raw) {
        return StringUtils.length(StringUtils.trim(raw)) >= MIN_NAME_LENGTH;
    }
}
