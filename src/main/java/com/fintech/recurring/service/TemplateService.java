package com.fintech.recurring.service;

import com.fintech.recurring.dto.GenerationResult;
import com.fintech.recurring.dto.PreFillData;
import com.fintech.recurring.dto.TemplateFilters;
import com.fintech.recurring.dto.TemplateRequest;
import com.fintech.recurring.entity.ActorRef;
import com.fintech.recurring.entity.MovementType;
import com.fintech.recurring.entity.RecurrencePattern;
import com.fintech.recurring.entity.RecurringMovementTemplate;
import com.fintech.recurring.entity.TemplateParticipant;
import com.fintech.recurring.exception.DuplicateTemplateNameException;
import com.fintech.recurring.exception.NotAuthorizedException;
import com.fintech.recurring.exception.TemplateNotFoundException;
import com.fintech.recurring.repository.TemplateRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Household-scoped operations on recurring movement templates.
 * <p>
 * Every operation first resolves the requester's household; templates of other households are
 * reported as not authorized. Mutations are validated as a whole before anything is written and
 * are followed by a budget sync of the affected categories.
 */
@Service
@Slf4j
public class TemplateService {

    private final TemplateRepository templateRepository;
    private final TemplateValidator validator;
    private final RecurrenceCalculator recurrenceCalculator;
    private final HouseholdDirectory householdDirectory;
    private final BudgetSynchronizer budgetSynchronizer;
    private final MovementGenerator movementGenerator;
    private final Clock clock;

    public TemplateService(TemplateRepository templateRepository,
                           TemplateValidator validator,
                           RecurrenceCalculator recurrenceCalculator,
                           HouseholdDirectory householdDirectory,
                           BudgetSynchronizer budgetSynchronizer,
                           MovementGenerator movementGenerator,
                           Clock clock) {
        this.templateRepository = templateRepository;
        this.validator = validator;
        this.recurrenceCalculator = recurrenceCalculator;
        this.householdDirectory = householdDirectory;
        this.budgetSynchronizer = budgetSynchronizer;
        this.movementGenerator = movementGenerator;
        this.clock = clock;
    }

    public RecurringMovementTemplate create(String userId, TemplateRequest request) {
        String householdId = requireHousehold(userId);

        ValidatedTemplate validated = validator.validate(request);
        checkActorsBelongTo(householdId, validated);
        if (templateRepository.existsByHouseholdIdAndName(householdId, validated.getName())) {
            throw new DuplicateTemplateNameException(validated.getName());
        }

        RecurringMovementTemplate template = RecurringMovementTemplate.builder()
                .householdId(householdId)
                .createdByUserId(userId)
                .build();
        validated.applyTo(template);
        template.setNextScheduledDate(scheduleOf(template));

        RecurringMovementTemplate saved = templateRepository.save(template);
        log.info("Created {} template {} ({}) in household {}, next occurrence {}",
                validated.getMode(), saved.getId(), saved.getName(), householdId, saved.getNextScheduledDate());

        budgetSynchronizer.sync(userId, householdId, saved.getCategoryId());
        return saved;
    }

    public RecurringMovementTemplate get(String userId, Long templateId) {
        return loadAuthorized(requireHousehold(userId), templateId);
    }

    public List<RecurringMovementTemplate> list(String userId, TemplateFilters filters) {
        String householdId = requireHousehold(userId);
        TemplateFilters effective = filters != null ? filters : TemplateFilters.none();
        return templateRepository.findByHousehold(householdId,
                effective.getCategoryId(), effective.getActive(), effective.getMovementType());
    }

    /**
     * Active templates of one category of the requester's household.
     */
    public List<RecurringMovementTemplate> listByCategory(String userId, String categoryId) {
        String householdId = requireHousehold(userId);
        return templateRepository.findByHouseholdIdAndCategoryIdAndActiveTrueOrderByNameAsc(householdId, categoryId);
    }

    /**
     * All templates of the requester's household keyed by category id, categories in order of first
     * appearance by template name.
     */
    public Map<String, List<RecurringMovementTemplate>> listGroupedByCategory(String userId) {
        String householdId = requireHousehold(userId);
        return templateRepository.findByHouseholdIdOrderByNameAsc(householdId).stream()
                .collect(Collectors.groupingBy(RecurringMovementTemplate::getCategoryId,
                        LinkedHashMap::new, Collectors.toList()));
    }

    /**
     * Form values derived from a template.
     * <p>
     * With {@code invertRoles} a SPLIT template is turned into the DEBT_PAYMENT that settles it:
     * the payer becomes the counterparty, the participant with the largest share becomes
     * the payer, and participants are dropped. Other types ignore the flag.
     */
    public PreFillData getPreFillData(String userId, Long templateId, boolean invertRoles) {
        RecurringMovementTemplate template = loadAuthorized(requireHousehold(userId), templateId);

        PreFillData.PreFillDataBuilder data = PreFillData.builder()
                .templateId(template.getId())
                .templateName(template.getName())
                .movementType(template.getMovementType())
                .amount(template.getAmount())
                .currency(template.getCurrency())
                .categoryId(template.getCategoryId())
                .paymentMethodId(template.getPaymentMethodId())
                .receiverAccountId(template.getReceiverAccountId());

        ActorRef payer = template.getPayer();
        if (invertRoles && template.getMovementType() == MovementType.SPLIT) {
            data.movementType(MovementType.DEBT_PAYMENT)
                    .counterpartyUserId(payer != null ? payer.userId() : null)
                    .counterpartyContactId(payer != null ? payer.contactId() : null)
                    .participants(new ArrayList<>());

            largestShare(template.getParticipants()).ifPresent(p -> data
                    .payerUserId(p.getParticipant().userId())
                    .payerContactId(p.getParticipant().contactId()));
            return data.build();
        }

        ActorRef counterparty = template.getCounterparty();
        return data
                .payerUserId(payer != null ? payer.userId() : null)
                .payerContactId(payer != null ? payer.contactId() : null)
                .counterpartyUserId(counterparty != null ? counterparty.userId() : null)
                .counterpartyContactId(counterparty != null ? counterparty.contactId() : null)
                .participants(template.getParticipants().stream()
                        .map(TemplateRequest::toInput)
                        .collect(Collectors.toList()))
                .build();
    }

    /**
     * Merges {@code changes} onto the stored template. Absent fields keep their value; see
     * {@link #merge(TemplateRequest, TemplateRequest)} for clearing rules.
     */
    public RecurringMovementTemplate update(String userId, Long templateId, TemplateRequest changes) {
        String householdId = requireHousehold(userId);
        RecurringMovementTemplate template = loadAuthorized(householdId, templateId);

        ValidatedTemplate validated = validator.validate(merge(TemplateRequest.fromTemplate(template), changes));
        checkActorsBelongTo(householdId, validated);
        if (!validated.getName().equals(template.getName())
                && templateRepository.existsByHouseholdIdAndNameAndIdNot(householdId, validated.getName(), templateId)) {
            throw new DuplicateTemplateNameException(validated.getName());
        }

        String previousCategoryId = template.getCategoryId();
        boolean reschedule = validated.changesScheduleOf(template);
        validated.applyTo(template);
        if (reschedule) {
            template.setNextScheduledDate(scheduleOf(template));
        }

        RecurringMovementTemplate saved = templateRepository.save(template);
        log.info("Updated template {} ({}), next occurrence {}",
                saved.getId(), saved.getName(), saved.getNextScheduledDate());

        budgetSynchronizer.sync(userId, householdId, previousCategoryId, saved.getCategoryId());
        return saved;
    }

    public void delete(String userId, Long templateId) {
        String householdId = requireHousehold(userId);
        RecurringMovementTemplate template = loadAuthorized(householdId, templateId);

        templateRepository.delete(template);
        log.info("Deleted template {} ({}) from household {}", template.getId(), template.getName(), householdId);

        budgetSynchronizer.sync(userId, householdId, template.getCategoryId());
    }

    /**
     * Runs a generation pass now, outside the scheduler cadence.
     */
    public GenerationResult triggerGenerationNow() {
        log.info("Manual generation pass triggered");
        return movementGenerator.processPending(LocalDateTime.now(clock));
    }

    /**
     * Overlays {@code changes} on {@code base}.
     * <p>
     * A movement type change first clears the fields the new type forbids, so the request may
     * supply their replacements. An empty string clears the payment method, the receiver account,
     * an actor pair or the movement type; a participant list replaces the stored one.
     */
    TemplateRequest merge(TemplateRequest base, TemplateRequest changes) {
        TemplateRequest.TemplateRequestBuilder merged = base.toBuilder();

        if (changes.getMovementType() != null) {
            String newType = normalizeType(changes.getMovementType());
            if (!Objects.equals(newType, normalizeType(base.getMovementType()))) {
                clearForType(merged, newType);
            }
            merged.movementType(newType);
        }

        if (changes.getName() != null) {
            merged.name(changes.getName());
        }
        if (changes.getDescription() != null) {
            merged.description(changes.getDescription());
        }
        if (changes.getIsActive() != null) {
            merged.isActive(changes.getIsActive());
        }
        if (changes.getCategoryId() != null) {
            merged.categoryId(changes.getCategoryId());
        }
        if (changes.getAmount() != null) {
            merged.amount(changes.getAmount());
        }
        if (changes.getCurrency() != null) {
            merged.currency(changes.getCurrency());
        }
        if (changes.getAutoGenerate() != null) {
            merged.autoGenerate(changes.getAutoGenerate());
        }
        if (changes.getPayerUserId() != null || changes.getPayerContactId() != null) {
            merged.payerUserId(changes.getPayerUserId()).payerContactId(changes.getPayerContactId());
        }
        if (changes.getCounterpartyUserId() != null || changes.getCounterpartyContactId() != null) {
            merged.counterpartyUserId(changes.getCounterpartyUserId())
                    .counterpartyContactId(changes.getCounterpartyContactId());
        }
        if (changes.getPaymentMethodId() != null) {
            merged.paymentMethodId(changes.getPaymentMethodId());
        }
        if (changes.getReceiverAccountId() != null) {
            merged.receiverAccountId(changes.getReceiverAccountId());
        }
        if (changes.getParticipants() != null) {
            merged.participants(new ArrayList<>(changes.getParticipants()));
        }
        if (changes.getRecurrencePattern() != null) {
            merged.recurrencePattern(changes.getRecurrencePattern());
        }
        if (changes.getDayOfMonth() != null) {
            merged.dayOfMonth(changes.getDayOfMonth());
        }
        if (changes.getDayOfYear() != null) {
            merged.dayOfYear(changes.getDayOfYear());
        }
        if (changes.getStartDate() != null) {
            merged.startDate(changes.getStartDate());
        }
        return merged.build();
    }

    private static void clearForType(TemplateRequest.TemplateRequestBuilder merged, String newType) {
        if (newType == null) {
            merged.payerUserId(null).payerContactId(null)
                    .counterpartyUserId(null).counterpartyContactId(null)
                    .paymentMethodId(null).receiverAccountId(null)
                    .participants(new ArrayList<>())
                    .autoGenerate(false)
                    .recurrencePattern(null).dayOfMonth(null).dayOfYear(null).startDate(null);
            return;
        }

        switch (newType) {
            case "HOUSEHOLD":
                merged.payerUserId(null).payerContactId(null)
                        .counterpartyUserId(null).counterpartyContactId(null)
                        .participants(new ArrayList<>())
                        .receiverAccountId(null);
                break;
            case "SPLIT":
                merged.counterpartyUserId(null).counterpartyContactId(null)
                        .receiverAccountId(null);
                break;
            case "DEBT_PAYMENT":
                merged.participants(new ArrayList<>());
                break;
            default:
                // unknown types are rejected by the validator
                break;
        }
    }

    private static String normalizeType(String movementType) {
        String text = TemplateValidator.trimToNull(movementType);
        return text != null ? text.toUpperCase(Locale.ROOT) : null;
    }

    /**
     * Next occurrence of a template, or null when it does not generate.
     * <p>
     * The first occurrence follows {@code startDate}; once the template has generated, later ones
     * follow the last generation, or {@code startDate} when that was moved past it. A one-time
     * template that already generated stays unscheduled unless its start date was moved past the
     * generation.
     */
    LocalDate scheduleOf(RecurringMovementTemplate template) {
        if (!template.isAutoGenerate() || !template.isActive() || template.getStartDate() == null) {
            return null;
        }

        LocalDate startDate = template.getStartDate();
        LocalDate lastGenerated = template.getLastGeneratedDate();
        if (lastGenerated != null && !startDate.isAfter(lastGenerated)) {
            if (template.getRecurrencePattern() == RecurrencePattern.ONE_TIME) {
                return null;
            }
            return recurrenceCalculator.nextScheduledDate(lastGenerated.atStartOfDay(),
                    template.getRecurrencePattern(), template.getDayOfMonth(), template.getDayOfYear());
        }

        return recurrenceCalculator.nextScheduledDate(startDate.atStartOfDay(),
                template.getRecurrencePattern(), template.getDayOfMonth(), template.getDayOfYear());
    }

    private void checkActorsBelongTo(String householdId, ValidatedTemplate validated) {
        checkMember(householdId, validated.getPayer(), "payer");
        checkMember(householdId, validated.getCounterparty(), "counterparty");
        for (TemplateParticipant participant : validated.getParticipants()) {
            checkMember(householdId, participant.getParticipant(), "participant");
        }
    }

    private void checkMember(String householdId, ActorRef actor, String role) {
        if (actor != null && actor.isMember() && !householdDirectory.isMember(householdId, actor.userId())) {
            throw new NotAuthorizedException(role + " " + actor.userId() + " is not a member of the household");
        }
    }

    private String requireHousehold(String userId) {
        return householdDirectory.getHouseholdId(userId)
                .orElseThrow(() -> new NotAuthorizedException("user " + userId + " does not belong to a household"));
    }

    private RecurringMovementTemplate loadAuthorized(String householdId, Long templateId) {
        RecurringMovementTemplate template = templateRepository.findById(templateId)
                .orElseThrow(() -> new TemplateNotFoundException(templateId));
        if (!template.getHouseholdId().equals(householdId)) {
            throw new NotAuthorizedException("template " + templateId + " belongs to another household");
        }
        return template;
    }

    private static Optional<TemplateParticipant> largestShare(List<TemplateParticipant> participants) {
        // max keeps the first of equal shares
        return participants.stream().max(Comparator.comparing(TemplateParticipant::getPercentage));
    }
}
