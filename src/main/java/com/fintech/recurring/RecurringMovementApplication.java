package com.fintech.recurring;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.retry.annotation.EnableRetry;

/**
 * Recurring Movement Service
 * <p>
 * Manages the recurring movement templates of a household (rent, subscriptions, loan repayments)
 * and generates their ledger movements when they fall due.
 * <p>
 * Key Features:
 * - Templates as budget placeholders, form pre-fill or automatic movements
 * - Monthly, yearly and one-time schedules with month-end clamping
 * - Background generation loop with per-template failure isolation
 * - Category budgets kept in line with template sums
 */
@SpringBootApplication
@EnableRetry
public class RecurringMovementApplication {

    public static void main(String[] args) {
        SpringApplication.run(RecurringMovementApplication.class, args);
    }
}
