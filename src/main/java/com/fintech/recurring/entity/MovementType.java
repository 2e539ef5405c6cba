package com.fintech.recurring.entity;

/**
 * Kind of ledger movement a template produces.
 * A template without a movement type only feeds budget forecasts.
 */
public enum MovementType {
    /**
     * Expense paid by the household as a unit.
     */
    HOUSEHOLD,

    /**
     * Expense paid by one actor and shared among participants by percentage.
     */
    SPLIT,

    /**
     * Settlement of a debt from a payer to a counterparty.
     */
    DEBT_PAYMENT
}
