package com.fintech.recurring.service;

import com.fintech.recurring.dto.CreatedMovement;
import com.fintech.recurring.dto.MovementRequest;
import com.fintech.recurring.entity.LedgerMovement;
import com.fintech.recurring.entity.TemplateParticipant;
import com.fintech.recurring.exception.CollaboratorException;
import com.fintech.recurring.repository.LedgerMovementRepository;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.stream.Collectors;

/**
 * Ledger backed by the service's own {@code ledger_movements} table.
 * <p>
 * Transient database failures are retried; repeated failures open the {@code ledger} circuit
 * breaker so a failing ledger is not hammered once per due template.
 */
@Service
@Slf4j
public class LocalLedgerClient implements LedgerClient {

    static final String COLLABORATOR = "ledger";

    private final LedgerMovementRepository movementRepository;
    private final HouseholdDirectory householdDirectory;

    public LocalLedgerClient(LedgerMovementRepository movementRepository,
                             HouseholdDirectory householdDirectory) {
        this.movementRepository = movementRepository;
        this.householdDirectory = householdDirectory;
    }

    @Override
    @CircuitBreaker(name = COLLABORATOR, fallbackMethod = "createFallback")
    @Retryable(
            retryFor = TransientDataAccessException.class,
            maxAttempts = 3,
            backoff = @Backoff(delay = 500, multiplier = 2)
    )
    @Transactional
    public CreatedMovement create(String actingUserId, MovementRequest request) throws CollaboratorException {
        String householdId = householdDirectory.getHouseholdId(actingUserId)
                .orElseThrow(() -> new CollaboratorException(
                        "user " + actingUserId + " does not belong to a household", COLLABORATOR, false));

        LedgerMovement movement = LedgerMovement.builder()
                .householdId(householdId)
                .createdByUserId(actingUserId)
                .movementType(request.getType())
                .description(request.getDescription())
                .amount(request.getAmount())
                .currency(request.getCurrency())
                .categoryId(request.getCategoryId())
                .movementDate(request.getMovementDate())
                .payer(request.getPayer())
                .counterparty(request.getCounterparty())
                .paymentMethodId(request.getPaymentMethodId())
                .receiverAccountId(request.getReceiverAccountId())
                .participants(request.getParticipants().stream()
                        .map(p -> TemplateParticipant.builder()
                                .participant(p.getParticipant())
                                .percentage(p.getPercentage())
                                .build())
                        .collect(Collectors.toList()))
                .generatedFromTemplateId(request.getGeneratedFromTemplateId())
                .build();

        LedgerMovement saved = movementRepository.save(movement);
        log.debug("Ledger movement {} created for household {} by user {}",
                saved.getId(), householdId, actingUserId);

        return CreatedMovement.builder()
                .id(saved.getId())
                .amount(saved.getAmount())
                .build();
    }

    /**
     * Called when the call fails or the circuit breaker is open. Ledger failures surface as
     * {@link CollaboratorException} so the generator treats them uniformly.
     */
    public CreatedMovement createFallback(String actingUserId, MovementRequest request, Throwable throwable) {
        if (throwable instanceof CollaboratorException) {
            throw (CollaboratorException) throwable;
        }

        log.warn("Ledger call failed for user {} (template {}): {}",
                actingUserId, request.getGeneratedFromTemplateId(), throwable.getMessage());

        throw new CollaboratorException(
                "Ledger temporarily unavailable: " + throwable.getMessage(),
                COLLABORATOR,
                throwable
        );
    }
}
