package com.fintech.recurring.repository;

import com.fintech.recurring.entity.MovementType;
import com.fintech.recurring.entity.RecurringMovementTemplate;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Repository for recurring movement templates, including the query that gates generation work.
 */
@Repository
public interface TemplateRepository extends JpaRepository<RecurringMovementTemplate, Long> {

    /**
     * Templates due for generation at the given date, least overdue last.
     * Backed by the {@code (is_active, auto_generate, next_scheduled_date)} index.
     */
    @Query("SELECT t FROM RecurringMovementTemplate t WHERE t.active = true " +
            "AND t.autoGenerate = true " +
            "AND t.nextScheduledDate IS NOT NULL " +
            "AND t.nextScheduledDate <= :today " +
            "ORDER BY t.nextScheduledDate ASC, t.id ASC")
    List<RecurringMovementTemplate> findPendingAutoGeneration(@Param("today") LocalDate today);

    /**
     * Household templates ordered by name. Null filters are ignored.
     */
    @Query("SELECT t FROM RecurringMovementTemplate t WHERE t.householdId = :householdId " +
            "AND (:categoryId IS NULL OR t.categoryId = :categoryId) " +
            "AND (:active IS NULL OR t.active = :active) " +
            "AND (:movementType IS NULL OR t.movementType = :movementType) " +
            "ORDER BY t.name ASC")
    List<RecurringMovementTemplate> findByHousehold(
            @Param("householdId") String householdId,
            @Param("categoryId") String categoryId,
            @Param("active") Boolean active,
            @Param("movementType") MovementType movementType
    );

    List<RecurringMovementTemplate> findByHouseholdIdOrderByNameAsc(String householdId);

    List<RecurringMovementTemplate> findByHouseholdIdAndCategoryIdAndActiveTrueOrderByNameAsc(
            String householdId, String categoryId);

    boolean existsByHouseholdIdAndName(String householdId, String name);

    boolean existsByHouseholdIdAndNameAndIdNot(String householdId, String name, Long id);

    /**
     * Sum of the amounts of the active templates of one household category, zero when there are none.
     */
    @Query("SELECT COALESCE(SUM(t.amount), 0) FROM RecurringMovementTemplate t " +
            "WHERE t.householdId = :householdId AND t.categoryId = :categoryId AND t.active = true")
    BigDecimal sumActiveAmountByCategory(
            @Param("householdId") String householdId,
            @Param("categoryId") String categoryId
    );

    /**
     * Records a generation. Touches only the tracking columns, never the business fields,
     * and commits on its own so it is independent of the ledger write.
     * <p>
     * Applies only while the row still has {@code version}; returns 0 when the template was
     * changed or deleted since it was read.
     */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE RecurringMovementTemplate t SET t.lastGeneratedDate = :lastGenerated, " +
            "t.nextScheduledDate = :nextScheduled, t.updatedAt = :now, t.version = t.version + 1 " +
            "WHERE t.id = :id AND t.version = :version")
    int updateGenerationTracking(
            @Param("id") Long id,
            @Param("version") Long version,
            @Param("lastGenerated") LocalDate lastGenerated,
            @Param("nextScheduled") LocalDate nextScheduled,
            @Param("now") LocalDateTime now
    );
}
