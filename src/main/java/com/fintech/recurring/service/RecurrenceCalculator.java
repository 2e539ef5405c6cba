package com.fintech.recurring.service;

import com.fintech.recurring.entity.RecurrencePattern;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;

/**
 * Computes the next occurrence of a recurrence pattern.
 * <p>
 * An occurrence is a calendar date; it qualifies when its start of day is strictly after the
 * reference instant. Monthly occurrences clamp to the last day of a short month instead of rolling
 * into the next one. Yearly occurrences count days from January 1st, so day 366 of a non-leap year
 * is January 1st of the following year.
 */
@Component
public class RecurrenceCalculator {

    /**
     * Next occurrence after {@code from}.
     * <p>
     * {@code ONE_TIME} returns the date of {@code from} itself; callers that have already generated
     * the single occurrence must not reschedule. A missing day falls back to one month or one year
     * after {@code from}.
     *
     * @throws IllegalArgumentException when {@code pattern} is null
     */
    public LocalDate nextScheduledDate(LocalDateTime from, RecurrencePattern pattern,
                                       Integer dayOfMonth, Integer dayOfYear) {
        if (pattern == null) {
            throw new IllegalArgumentException("recurrence pattern is required");
        }

        return switch (pattern) {
            case ONE_TIME -> from.toLocalDate();
            case MONTHLY -> nextMonthly(from, dayOfMonth);
            case YEARLY -> nextYearly(from, dayOfYear);
        };
    }

    private LocalDate nextMonthly(LocalDateTime from, Integer dayOfMonth) {
        if (dayOfMonth == null) {
            return from.toLocalDate().plusMonths(1);
        }

        YearMonth month = YearMonth.from(from);
        LocalDate candidate = clampToMonth(month, dayOfMonth);
        if (candidate.atStartOfDay().isAfter(from)) {
            return candidate;
        }
        return clampToMonth(month.plusMonths(1), dayOfMonth);
    }

    private LocalDate nextYearly(LocalDateTime from, Integer dayOfYear) {
        if (dayOfYear == null) {
            return from.toLocalDate().plusYears(1);
        }

        LocalDate candidate = dayOfYear(from.getYear(), dayOfYear);
        if (candidate.atStartOfDay().isAfter(from)) {
            return candidate;
        }
        return dayOfYear(from.getYear() + 1, dayOfYear);
    }

    private static LocalDate clampToMonth(YearMonth month, int dayOfMonth) {
        return month.atDay(Math.min(dayOfMonth, month.lengthOfMonth()));
    }

    private static LocalDate dayOfYear(int year, int dayOfYear) {
        return LocalDate.of(year, 1, 1).plusDays(dayOfYear - 1L);
    }
}
