package com.fintech.recurring.repository;

import com.fintech.recurring.entity.MonthlyBudget;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface MonthlyBudgetRepository extends JpaRepository<MonthlyBudget, Long> {

    Optional<MonthlyBudget> findByHouseholdIdAndCategoryIdAndMonth(String householdId, String categoryId, String month);
}
