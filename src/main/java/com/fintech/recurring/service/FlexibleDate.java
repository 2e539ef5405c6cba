package com.fintech.recurring.service;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Objects;

/**
 * A calendar date that may be absent, parsed from either of the two textual forms clients send:
 * a plain date ({@code 2026-01-15}) or a full ISO-8601 timestamp ({@code 2026-01-15T10:30:00Z}).
 * <p>
 * The timestamp form keeps the calendar date written in the text; its offset is not applied.
 */
public final class FlexibleDate {

    private static final FlexibleDate EMPTY = new FlexibleDate(null);

    private final LocalDate date;

    private FlexibleDate(LocalDate date) {
        this.date = date;
    }

    public static FlexibleDate empty() {
        return EMPTY;
    }

    /**
     * Parses {@code text}. Null, blank and the literal {@code "null"} give an empty value.
     *
     * @throws DateTimeParseException when the text is neither a date nor a timestamp
     */
    public static FlexibleDate parse(String text) {
        if (text == null) {
            return EMPTY;
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty() || "null".equals(trimmed)) {
            return EMPTY;
        }
        if (trimmed.indexOf('T') < 0) {
            return new FlexibleDate(LocalDate.parse(trimmed, DateTimeFormatter.ISO_LOCAL_DATE));
        }
        return new FlexibleDate(LocalDate.from(DateTimeFormatter.ISO_DATE_TIME.parse(trimmed)));
    }

    public boolean isPresent() {
        return date != null;
    }

    public LocalDate orNull() {
        return date;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FlexibleDate)) {
            return false;
        }
        return Objects.equals(date, ((FlexibleDate) o).date);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(date);
    }

    @Override
    public String toString() {
        return date == null ? "FlexibleDate[empty]" : "FlexibleDate[" + date + "]";
    }
}
