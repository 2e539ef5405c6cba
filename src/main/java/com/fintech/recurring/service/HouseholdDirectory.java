package com.fintech.recurring.service;

import java.util.Optional;

/**
 * Answers which household a user belongs to.
 */
public interface HouseholdDirectory {

    Optional<String> getHouseholdId(String userId);

    boolean isMember(String householdId, String userId);
}
