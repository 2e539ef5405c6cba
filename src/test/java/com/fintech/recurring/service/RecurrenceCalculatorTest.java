package com.fintech.recurring.service;

import com.fintech.recurring.entity.RecurrencePattern;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecurrenceCalculatorTest {

    private final RecurrenceCalculator calculator = new RecurrenceCalculator();

    private LocalDate monthly(String from, int dayOfMonth) {
        return calculator.nextScheduledDate(LocalDateTime.parse(from), RecurrencePattern.MONTHLY, dayOfMonth, null);
    }

    private LocalDate yearly(String from, int dayOfYear) {
        return calculator.nextScheduledDate(LocalDateTime.parse(from), RecurrencePattern.YEARLY, null, dayOfYear);
    }

    @Nested
    @DisplayName("Monthly")
    class MonthlyTests {

        @Test
        @DisplayName("Should use the current month when the day is still ahead")
        void shouldUseCurrentMonthWhenDayIsAhead() {
            assertThat(monthly("2026-01-15T10:00:00", 20)).isEqualTo(LocalDate.of(2026, 1, 20));
        }

        @Test
        @DisplayName("Should move to the next month when the day has passed")
        void shouldMoveToNextMonthWhenDayHasPassed() {
            assertThat(monthly("2026-01-25T10:00:00", 20)).isEqualTo(LocalDate.of(2026, 2, 20));
        }

        @Test
        @DisplayName("Should require the occurrence to be strictly after the reference instant")
        void shouldRequireStrictlyLaterOccurrence() {
            assertThat(monthly("2026-01-20T00:00:00", 20)).isEqualTo(LocalDate.of(2026, 2, 20));
            assertThat(monthly("2026-01-20T08:30:00", 20)).isEqualTo(LocalDate.of(2026, 2, 20));
        }

        @Test
        @DisplayName("Should clamp day 31 to the end of February in a non-leap year")
        void shouldClampToEndOfFebruary() {
            assertThat(monthly("2025-01-31T09:00:00", 31)).isEqualTo(LocalDate.of(2025, 2, 28));
        }

        @Test
        @DisplayName("Should clamp day 31 to February 29 in a leap year")
        void shouldClampToLeapDay() {
            assertThat(monthly("2024-01-31T09:00:00", 31)).isEqualTo(LocalDate.of(2024, 2, 29));
        }

        @Test
        @DisplayName("Should clamp day 31 to April 30")
        void shouldClampToEndOfApril() {
            assertThat(monthly("2026-03-31T09:00:00", 31)).isEqualTo(LocalDate.of(2026, 4, 30));
        }

        @Test
        @DisplayName("Should clamp within the current month when its clamped day is still ahead")
        void shouldClampWithinCurrentMonth() {
            assertThat(monthly("2026-02-10T09:00:00", 31)).isEqualTo(LocalDate.of(2026, 2, 28));
        }

        @Test
        @DisplayName("Should roll December into January of the next year")
        void shouldRollYearForward() {
            assertThat(monthly("2025-12-20T09:00:00", 5)).isEqualTo(LocalDate.of(2026, 1, 5));
        }

        @Test
        @DisplayName("Should seed the first occurrence of a template starting mid-month")
        void shouldSeedFirstOccurrenceFromStartDate() {
            assertThat(monthly("2026-01-15T00:00:00", 31)).isEqualTo(LocalDate.of(2026, 1, 31));
        }

        @Test
        @DisplayName("Should advance from a late generation to the clamped end of February")
        void shouldAdvanceFromLateGeneration() {
            assertThat(monthly("2026-02-01T08:00:00", 31)).isEqualTo(LocalDate.of(2026, 2, 28));
        }

        @Test
        @DisplayName("Should fall back to one month later without a day")
        void shouldFallBackWithoutDay() {
            LocalDate next = calculator.nextScheduledDate(
                    LocalDateTime.parse("2026-01-15T10:00:00"), RecurrencePattern.MONTHLY, null, null);

            assertThat(next).isEqualTo(LocalDate.of(2026, 2, 15));
        }

        @Test
        @DisplayName("Should land in the reference month or the one after for every day and start")
        void shouldStayWithinOneMonthForAllDays() {
            LocalDate day = LocalDate.of(2025, 1, 1);
            while (day.getYear() < 2027) {
                LocalDateTime from = day.atTime(12, 0);
                for (int dayOfMonth = 1; dayOfMonth <= 31; dayOfMonth++) {
                    LocalDate next = monthly(from.toString(), dayOfMonth);

                    assertThat(next.atStartOfDay()).isAfter(from);
                    YearMonth month = YearMonth.from(next);
                    assertThat(month).isIn(YearMonth.from(from), YearMonth.from(from).plusMonths(1));
                    assertThat(next.getDayOfMonth()).isEqualTo(Math.min(dayOfMonth, month.lengthOfMonth()));
                }
                day = day.plusDays(1);
            }
        }
    }

    @Nested
    @DisplayName("Yearly")
    class YearlyTests {

        @Test
        @DisplayName("Should use the current year when the day is still ahead")
        void shouldUseCurrentYear() {
            assertThat(yearly("2026-01-10T09:00:00", 32)).isEqualTo(LocalDate.of(2026, 2, 1));
        }

        @Test
        @DisplayName("Should move to the next year when the day has passed")
        void shouldMoveToNextYear() {
            assertThat(yearly("2026-03-01T09:00:00", 32)).isEqualTo(LocalDate.of(2027, 2, 1));
        }

        @Test
        @DisplayName("Should count days from January 1st in a leap year")
        void shouldCountDaysInLeapYear() {
            assertThat(yearly("2024-01-10T09:00:00", 60)).isEqualTo(LocalDate.of(2024, 2, 29));
        }

        @Test
        @DisplayName("Should resolve day 366 of a non-leap year to January 1st of the next year")
        void shouldResolveDay366ToNextJanuaryFirst() {
            assertThat(yearly("2025-12-31T10:00:00", 366)).isEqualTo(LocalDate.of(2026, 1, 1));
        }

        @Test
        @DisplayName("Should fall back to one year later without a day")
        void shouldFallBackWithoutDay() {
            LocalDate next = calculator.nextScheduledDate(
                    LocalDateTime.parse("2026-05-04T10:00:00"), RecurrencePattern.YEARLY, null, null);

            assertThat(next).isEqualTo(LocalDate.of(2027, 5, 4));
        }
    }

    @Nested
    @DisplayName("One time")
    class OneTimeTests {

        @Test
        @DisplayName("Should return the reference date unchanged")
        void shouldReturnReferenceDate() {
            LocalDate next = calculator.nextScheduledDate(
                    LocalDateTime.parse("2026-03-10T00:00:00"), RecurrencePattern.ONE_TIME, 15, null);

            assertThat(next).isEqualTo(LocalDate.of(2026, 3, 10));
        }
    }

    @Test
    @DisplayName("Should reject a missing pattern")
    void shouldRejectMissingPattern() {
        assertThatThrownBy(() -> calculator.nextScheduledDate(LocalDateTime.now(), null, 1, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
