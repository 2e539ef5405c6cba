package com.fintech.recurring.entity;

/**
 * How often an auto-generating template fires.
 */
public enum RecurrencePattern {
    /**
     * Once a month on a day-of-month (1-31, clamped to the month's length).
     */
    MONTHLY,

    /**
     * Once a year on a day-of-year (1-365).
     */
    YEARLY,

    /**
     * A single occurrence on the start date, never rescheduled.
     */
    ONE_TIME
}
