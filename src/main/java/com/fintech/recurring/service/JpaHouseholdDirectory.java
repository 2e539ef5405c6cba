package com.fintech.recurring.service;

import com.fintech.recurring.entity.HouseholdMember;
import com.fintech.recurring.repository.HouseholdMemberRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class JpaHouseholdDirectory implements HouseholdDirectory {

    private final HouseholdMemberRepository memberRepository;

    @Override
    public Optional<String> getHouseholdId(String userId) {
        if (userId == null) {
            return Optional.empty();
        }
        return memberRepository.findByUserId(userId).map(HouseholdMember::getHouseholdId);
    }

    @Override
    public boolean isMember(String householdId, String userId) {
        return householdId != null && userId != null
                && memberRepository.existsByHouseholdIdAndUserId(householdId, userId);
    }
}
