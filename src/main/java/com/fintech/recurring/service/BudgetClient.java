package com.fintech.recurring.service;

import com.fintech.recurring.dto.BudgetAmount;
import com.fintech.recurring.exception.CollaboratorException;

/**
 * Interface for the monthly category budgets of a household.
 */
public interface BudgetClient {

    /**
     * Sets the budget of one category for one month, creating it when it does not exist.
     *
     * @throws CollaboratorException if the budget cannot be written
     */
    void set(String actingUserId, BudgetAmount budget) throws CollaboratorException;
}
