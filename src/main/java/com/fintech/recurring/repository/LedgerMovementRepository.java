package com.fintech.recurring.repository;

import com.fintech.recurring.entity.LedgerMovement;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface LedgerMovementRepository extends JpaRepository<LedgerMovement, Long> {

    /**
     * Movements produced from one template, oldest first.
     */
    List<LedgerMovement> findByGeneratedFromTemplateIdOrderByMovementDateAsc(Long templateId);

    long countByGeneratedFromTemplateId(Long templateId);
}
