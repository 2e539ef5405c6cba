package com.fintech.recurring.service;

import com.fintech.recurring.dto.CreatedMovement;
import com.fintech.recurring.dto.MovementRequest;
import com.fintech.recurring.exception.CollaboratorException;

/**
 * Interface for the ledger that records household movements.
 * <p>
 * The ledger is principal-scoped: every movement is created on behalf of a household member,
 * whose household owns the movement.
 */
public interface LedgerClient {

    /**
     * Creates a movement on behalf of {@code actingUserId}.
     *
     * @param actingUserId household member the movement is created for
     * @param request      the movement to create
     * @return id and amount of the created movement
     * @throws CollaboratorException if the ledger cannot create the movement
     */
    CreatedMovement create(String actingUserId, MovementRequest request) throws CollaboratorException;
}
