package com.fintech.recurring.repository;

import com.fintech.recurring.entity.HouseholdMember;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface HouseholdMemberRepository extends JpaRepository<HouseholdMember, Long> {

    Optional<HouseholdMember> findByUserId(String userId);

    boolean existsByHouseholdIdAndUserId(String householdId, String userId);
}
