package com.task.formfill.service.autofill;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses the date spellings found in profiles and saved dates and formats them as {@code MM/dd/yyyy}.
 */
final class DateValues {

    static final DateTimeFormatter DISPLAY = DateTimeFormatter.ofPattern("MM/dd/yyyy", Locale.ROOT);

    private static final List<DateTimeFormatter> INPUTS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("M/d/yyyy", Locale.ROOT),
            DateTimeFormatter.ofPattern("M-d-yyyy", Locale.ROOT),
            DateTimeFormatter.ofPattern("yyyy/M/d", Locale.ROOT)
    );

    private DateValues() {
    }

    static Optional<LocalDate> parse(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        String text = value.trim();
        // ISO timestamps carry the date in the first ten characters
        if (text.length() > 10 && text.charAt(4) == '-' && (text.charAt(10) == 'T' || text.charAt(10) == ' ')) {
            text = text.substring(0, 10);
        }
        for (DateTimeFormatter f : INPUTS) {
            try {
                return Optional.of(LocalDate.parse(text, f));
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        return Optional.empty();
    }

    /** Unparseable values are returned unchanged. */
    static String format(String value) {
        return parse(value).map(DISPLAY::format).orElse(value);
    }
}
