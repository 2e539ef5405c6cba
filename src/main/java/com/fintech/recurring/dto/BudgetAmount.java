package com.fintech.recurring.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Request to set the budget of a category for a month.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BudgetAmount {

    /**
     * Calendar month as {@code YYYY-MM}.
     */
    private String month;
    private String categoryId;
    private BigDecimal amount;
}
