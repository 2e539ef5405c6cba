package com.fintech.recurring.service;

import com.fintech.recurring.dto.BudgetAmount;
import com.fintech.recurring.entity.MonthlyBudget;
import com.fintech.recurring.exception.CollaboratorException;
import com.fintech.recurring.repository.MonthlyBudgetRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Budgets stored in the service's own {@code monthly_budgets} table, one row per household,
 * category and month.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LocalBudgetClient implements BudgetClient {

    static final String COLLABORATOR = "budgets";

    private final MonthlyBudgetRepository budgetRepository;
    private final HouseholdDirectory householdDirectory;

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void set(String actingUserId, BudgetAmount budget) throws CollaboratorException {
        String householdId = householdDirectory.getHouseholdId(actingUserId)
                .orElseThrow(() -> new CollaboratorException(
                        "user " + actingUserId + " does not belong to a household", COLLABORATOR, false));

        MonthlyBudget row = budgetRepository
                .findByHouseholdIdAndCategoryIdAndMonth(householdId, budget.getCategoryId(), budget.getMonth())
                .orElseGet(() -> MonthlyBudget.builder()
                        .householdId(householdId)
                        .categoryId(budget.getCategoryId())
                        .month(budget.getMonth())
                        .build());
        row.setAmount(budget.getAmount());
        budgetRepository.save(row);

        log.debug("Budget {} for household {} category {} set to {}",
                budget.getMonth(), householdId, budget.getCategoryId(), budget.getAmount());
    }
}
