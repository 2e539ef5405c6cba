package com.fintech.recurring.service;

import com.fintech.recurring.dto.BudgetAmount;
import com.fintech.recurring.repository.TemplateRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.YearMonth;
import java.util.Arrays;
import java.util.Objects;

/**
 * Pushes the sum of a category's active templates into the current month's budget.
 * <p>
 * Runs after a template mutation has been stored. Failures are logged and never reach the caller.
 */
@Service
@Slf4j
public class BudgetSynchronizer {

    private final TemplateRepository templateRepository;
    private final BudgetClient budgetClient;
    private final Clock clock;
    private final boolean enabled;

    public BudgetSynchronizer(TemplateRepository templateRepository,
                              BudgetClient budgetClient,
                              Clock clock,
                              @Value("${recurring.budget-sync.enabled:true}") boolean enabled) {
        this.templateRepository = templateRepository;
        this.budgetClient = budgetClient;
        this.clock = clock;
        this.enabled = enabled;
    }

    /**
     * Recomputes the budget of each given category. Null and repeated ids are ignored.
     */
    public void sync(String actingUserId, String householdId, String... categoryIds) {
        if (!enabled) {
            log.debug("Budget sync disabled, skipping categories {}", Arrays.toString(categoryIds));
            return;
        }

        String month = YearMonth.now(clock).toString();
        Arrays.stream(categoryIds)
                .filter(Objects::nonNull)
                .distinct()
                .forEach(categoryId -> syncCategory(actingUserId, householdId, categoryId, month));
    }

    private void syncCategory(String actingUserId, String householdId, String categoryId, String month) {
        try {
            BigDecimal sum = templateRepository.sumActiveAmountByCategory(householdId, categoryId);
            if (sum == null || sum.signum() == 0) {
                log.debug("No active templates in category {} of household {}, budget left untouched",
                        categoryId, householdId);
                return;
            }

            budgetClient.set(actingUserId, BudgetAmount.builder()
                    .month(month)
                    .categoryId(categoryId)
                    .amount(sum)
                    .build());

            log.info("Budget {} of category {} in household {} set to template sum {}",
                    month, categoryId, householdId, sum);
        } catch (Exception e) {
            log.warn("Budget sync failed for category {} in household {}: {}",
                    categoryId, householdId, e.getMessage(), e);
        }
    }
}
