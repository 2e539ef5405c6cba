package com.fintech.recurring.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Planned spending of a household for one category in one calendar month.
 */
@Entity
@Table(name = "monthly_budgets", uniqueConstraints = {
        @UniqueConstraint(name = "uk_budget_household_category_month",
                columnNames = {"household_id", "category_id", "budget_month"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MonthlyBudget {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "household_id", nullable = false, length = 64)
    private String householdId;

    @Column(name = "category_id", nullable = false, length = 64)
    private String categoryId;

    /**
     * Calendar month as {@code YYYY-MM}.
     */
    @Column(name = "budget_month", nullable = false, length = 7)
    private String month;

    @Column(nullable = false, precision = 15, scale = 2)
    private BigDecimal amount;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    @PreUpdate
    protected void touch() {
        updatedAt = LocalDateTime.now();
    }
}
