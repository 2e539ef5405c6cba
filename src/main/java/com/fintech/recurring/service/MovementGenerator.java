package com.fintech.recurring.service;

import com.fintech.recurring.dto.CreatedMovement;
import com.fintech.recurring.dto.GenerationResult;
import com.fintech.recurring.dto.MovementRequest;
import com.fintech.recurring.entity.ActorRef;
import com.fintech.recurring.entity.MovementType;
import com.fintech.recurring.entity.RecurrencePattern;
import com.fintech.recurring.entity.RecurringMovementTemplate;
import com.fintech.recurring.entity.TemplateParticipant;
import com.fintech.recurring.exception.ActorResolutionException;
import com.fintech.recurring.exception.CollaboratorException;
import com.fintech.recurring.exception.GenerationInProgressException;
import com.fintech.recurring.repository.TemplateRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Generates ledger movements for auto-generating templates that are due.
 * <p>
 * Key Design Decisions:
 * 1. Sequential: templates of one pass are generated one after the other, least overdue first
 * 2. Isolation: a failing template is reported and the pass moves on
 * 3. At-least-once: the ledger write and the tracking update are separate commits, so a crash
 *    between them regenerates the occurrence on the next pass
 * 4. Observability: emits metrics for every pass and every template
 */
@Service
@Slf4j
public class MovementGenerator {

    private final TemplateRepository templateRepository;
    private final LedgerClient ledgerClient;
    private final RecurrenceCalculator recurrenceCalculator;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    // Metrics
    private Counter templatesCounter;
    private Counter successCounter;
    private Counter failureCounter;
    private Counter resolutionErrorCounter;
    private Counter rejectionCounter;
    private Timer generationTimer;

    // Prevents concurrent generation passes
    private final AtomicBoolean isRunning = new AtomicBoolean(false);

    public MovementGenerator(TemplateRepository templateRepository,
                             LedgerClient ledgerClient,
                             RecurrenceCalculator recurrenceCalculator,
                             MeterRegistry meterRegistry,
                             Clock clock) {
        this.templateRepository = templateRepository;
        this.ledgerClient = ledgerClient;
        this.recurrenceCalculator = recurrenceCalculator;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    @PostConstruct
    public void initMetrics() {
        templatesCounter = Counter.builder("recurring.generation.templates.total")
                .description("Due templates picked up for generation")
                .register(meterRegistry);

        successCounter = Counter.builder("recurring.generation.templates.success")
                .description("Templates that generated their movement")
                .register(meterRegistry);

        failureCounter = Counter.builder("recurring.generation.templates.failure")
                .description("Templates whose generation failed and will be retried")
                .register(meterRegistry);

        resolutionErrorCounter = Counter.builder("recurring.generation.resolution.errors")
                .description("Templates with no household member to act for")
                .register(meterRegistry);

        rejectionCounter = Counter.builder("recurring.generation.collaborator.rejections")
                .description("Templates the ledger refused for a reason retrying will not fix")
                .register(meterRegistry);

        generationTimer = Timer.builder("recurring.generation.duration")
                .description("Time taken to complete a generation pass")
                .register(meterRegistry);
    }

    /**
     * Generates every template due at {@code now}.
     *
     * @return counts and per-template errors of the pass
     * @throws GenerationInProgressException if another pass is running
     */
    public GenerationResult processPending(LocalDateTime now) {
        if (!isRunning.compareAndSet(false, true)) {
            log.warn("Movement generation already in progress, skipping this run");
            throw new GenerationInProgressException();
        }

        GenerationResult result = GenerationResult.builder()
                .startedAt(LocalDateTime.now(clock))
                .build();

        try {
            return generationTimer.record(() -> {
                List<RecurringMovementTemplate> due = templateRepository.findPendingAutoGeneration(now.toLocalDate());
                log.debug("Found {} templates due at {}", due.size(), now);

                for (RecurringMovementTemplate template : due) {
                    processTemplate(template, now, result);
                }

                result.setCompletedAt(LocalDateTime.now(clock));
                if (result.getTotalProcessed() > 0) {
                    log.info("Generation pass completed. Processed: {}, Generated: {}, Errors: {}",
                            result.getTotalProcessed(), result.getGenerated(), result.getErrors());
                }
                return result;
            });
        } finally {
            isRunning.set(false);
        }
    }

    public boolean isRunning() {
        return isRunning.get();
    }

    private void processTemplate(RecurringMovementTemplate template, LocalDateTime now, GenerationResult result) {
        result.incrementTotalProcessed();
        templatesCounter.increment();

        try {
            generateOne(template, now);
            result.incrementGenerated();
            successCounter.increment();
        } catch (ActorResolutionException e) {
            log.warn("Cannot generate template {} ({}): {}", template.getId(), template.getName(), e.getMessage());
            resolutionErrorCounter.increment();
            failureCounter.increment();
            result.addError(template.getId(), template.getName(), e.getMessage(), now);
        } catch (CollaboratorException e) {
            if (e.isRetryable()) {
                log.warn("Ledger error for template {} ({}), will retry next pass: {}",
                        template.getId(), template.getName(), e.getMessage());
            } else {
                log.error("Ledger rejected template {} ({}), it stays due until the template is fixed: {}",
                        template.getId(), template.getName(), e.getMessage());
                rejectionCounter.increment();
            }
            failureCounter.increment();
            result.addError(template.getId(), template.getName(), e.getMessage(), now);
        } catch (Exception e) {
            log.error("Unexpected error generating template {} ({}): {}",
                    template.getId(), template.getName(), e.getMessage(), e);
            failureCounter.increment();
            result.addError(template.getId(), template.getName(), "Unexpected error: " + e.getMessage(), now);
        }
    }

    /**
     * Creates the movement of one template and advances its schedule.
     * <p>
     * The schedule is advanced only once the ledger accepted the movement. A one-time template is
     * left unscheduled afterwards.
     *
     * @return the created movement, or empty when the template does not auto-generate
     */
    public Optional<CreatedMovement> generateOne(RecurringMovementTemplate template, LocalDateTime now) {
        if (!template.isAutoGenerate()) {
            log.debug("Template {} does not auto-generate, nothing to do", template.getId());
            return Optional.empty();
        }

        LocalDate today = now.toLocalDate();
        MovementRequest request = buildRequest(template, today);
        String actingUserId = resolveActingUser(template);

        CreatedMovement created = ledgerClient.create(actingUserId, request);
        LocalDate next = recordGeneration(template, today, now);

        log.info("Generated movement {} from template {} ({}), amount {} {}, next occurrence {}",
                created.getId(), template.getId(), template.getName(),
                template.getAmount(), template.getCurrency(), next);

        return Optional.of(created);
    }

    /**
     * Stores the generation on the template and returns its next occurrence.
     * <p>
     * When the template was changed while the movement was being created, the schedule is
     * recomputed from the stored state: a template that was deactivated or stopped auto-generating
     * is left unscheduled, one whose recurrence changed follows the new recurrence.
     */
    private LocalDate recordGeneration(RecurringMovementTemplate template, LocalDate today, LocalDateTime now) {
        LocalDate next = nextAfterGeneration(template, now);
        if (templateRepository.updateGenerationTracking(template.getId(), template.getVersion(), today, next, now) > 0) {
            return next;
        }

        Optional<RecurringMovementTemplate> current = templateRepository.findById(template.getId());
        if (current.isEmpty()) {
            log.info("Template {} was deleted while generating, nothing to track", template.getId());
            return null;
        }

        RecurringMovementTemplate stored = current.get();
        LocalDate storedNext = stored.isActive() && stored.isAutoGenerate() ? nextAfterGeneration(stored, now) : null;
        log.info("Template {} changed while generating, next occurrence recomputed as {}", stored.getId(), storedNext);
        if (templateRepository.updateGenerationTracking(stored.getId(), stored.getVersion(), today, storedNext, now) == 0) {
            log.warn("Template {} changed again while generating, generation of {} not recorded",
                    stored.getId(), today);
        }
        return storedNext;
    }

    private LocalDate nextAfterGeneration(RecurringMovementTemplate template, LocalDateTime now) {
        if (template.getRecurrencePattern() == null || template.getRecurrencePattern() == RecurrencePattern.ONE_TIME) {
            return null;
        }
        return recurrenceCalculator.nextScheduledDate(now, template.getRecurrencePattern(),
                template.getDayOfMonth(), template.getDayOfYear());
    }

    /**
     * The household member the ledger call is made for: the payer if it is a member, else the
     * first member participant. Household templates carry neither and act as their creator.
     */
    String resolveActingUser(RecurringMovementTemplate template) {
        ActorRef payer = template.getPayer();
        if (payer != null && payer.isMember()) {
            return payer.userId();
        }

        for (TemplateParticipant participant : template.getParticipants()) {
            if (participant.getParticipant().isMember()) {
                return participant.getParticipant().userId();
            }
        }

        if (template.getMovementType() == MovementType.HOUSEHOLD && template.getCreatedByUserId() != null) {
            return template.getCreatedByUserId();
        }

        throw new ActorResolutionException(template.getId(),
                "no household member can act for template " + template.getId());
    }

    private MovementRequest buildRequest(RecurringMovementTemplate template, LocalDate movementDate) {
        return MovementRequest.builder()
                .type(template.getMovementType())
                .description(template.getName())
                .amount(template.getAmount())
                .currency(template.getCurrency())
                .categoryId(template.getCategoryId())
                .movementDate(movementDate)
                .payer(template.getPayer())
                .counterparty(template.getCounterparty())
                .paymentMethodId(template.getPaymentMethodId())
                .receiverAccountId(template.getReceiverAccountId())
                .participants(template.getParticipants().stream()
                        .map(p -> TemplateParticipant.builder()
                                .participant(p.getParticipant())
                                .percentage(p.getPercentage())
                                .build())
                        .collect(Collectors.toList()))
                .generatedFromTemplateId(template.getId())
                .build();
    }
}
