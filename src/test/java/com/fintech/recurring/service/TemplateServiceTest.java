package com.fintech.recurring.service;

import com.fintech.recurring.dto.GenerationResult;
import com.fintech.recurring.dto.ParticipantInput;
import com.fintech.recurring.dto.PreFillData;
import com.fintech.recurring.dto.TemplateRequest;
import com.fintech.recurring.entity.ActorRef;
import com.fintech.recurring.entity.MovementType;
import com.fintech.recurring.entity.RecurrencePattern;
import com.fintech.recurring.entity.RecurringMovementTemplate;
import com.fintech.recurring.entity.TemplateParticipant;
import com.fintech.recurring.exception.DuplicateTemplateNameException;
import com.fintech.recurring.exception.NotAuthorizedException;
import com.fintech.recurring.exception.TemplateNotFoundException;
import com.fintech.recurring.exception.TemplateValidationException;
import com.fintech.recurring.exception.ValidationError;
import com.fintech.recurring.repository.TemplateRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for TemplateService.
 * <p>
 * Tests cover:
 * - Creation with household and name checks
 * - Update merging and rescheduling
 * - Pre-fill role inversion
 * - Budget sync after every mutation
 */
@ExtendWith(MockitoExtension.class)
class TemplateServiceTest {

    @Mock
    private TemplateRepository templateRepository;

    @Mock
    private HouseholdDirectory householdDirectory;

    @Mock
    private BudgetSynchronizer budgetSynchronizer;

    @Mock
    private MovementGenerator movementGenerator;

    private TemplateService templateService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-02-01T08:00:00Z"), ZoneOffset.UTC);
        RecurrenceCalculator calculator = new RecurrenceCalculator();
        templateService = new TemplateService(
                templateRepository,
                new TemplateValidator("COP"),
                calculator,
                householdDirectory,
                budgetSynchronizer,
                movementGenerator,
                clock
        );

        lenient().when(householdDirectory.getHouseholdId("user-a")).thenReturn(Optional.of("hh-1"));
        lenient().when(householdDirectory.getHouseholdId("user-b")).thenReturn(Optional.of("hh-1"));
        lenient().when(householdDirectory.getHouseholdId("user-x")).thenReturn(Optional.of("hh-2"));
        lenient().when(householdDirectory.isMember("hh-1", "user-a")).thenReturn(true);
        lenient().when(householdDirectory.isMember("hh-1", "user-b")).thenReturn(true);
        lenient().when(templateRepository.save(any(RecurringMovementTemplate.class))).thenAnswer(invocation -> {
            RecurringMovementTemplate template = invocation.getArgument(0);
            if (template.getId() == null) {
                template.setId(10L);
            }
            return template;
        });
    }

    @Nested
    @DisplayName("Create Tests")
    class CreateTests {

        @Test
        @DisplayName("Should store a budget-only household template without recurrence")
        void shouldCreateBudgetOnlyTemplate() {
            // Given
            TemplateRequest request = TemplateRequest.builder()
                    .name("Groceries")
                    .movementType("HOUSEHOLD")
                    .categoryId("cat-food")
                    .amount(new BigDecimal("50000"))
                    .autoGenerate(false)
                    .build();

            // When
            RecurringMovementTemplate created = templateService.create("user-a", request);

            // Then
            assertThat(created.getId()).isEqualTo(10L);
            assertThat(created.getHouseholdId()).isEqualTo("hh-1");
            assertThat(created.getCreatedByUserId()).isEqualTo("user-a");
            assertThat(created.getMovementType()).isEqualTo(MovementType.HOUSEHOLD);
            assertThat(created.getCurrency()).isEqualTo("COP");
            assertThat(created.isActive()).isTrue();
            assertThat(created.getNextScheduledDate()).isNull();
            verify(budgetSynchronizer).sync("user-a", "hh-1", "cat-food");
        }

        @Test
        @DisplayName("Should schedule a monthly split on the clamped end of the start month")
        void shouldScheduleMonthlySplit() {
            RecurringMovementTemplate created = templateService.create("user-a", rentRequest().build());

            assertThat(created.getNextScheduledDate()).isEqualTo(LocalDate.of(2026, 1, 31));
            assertThat(created.getLastGeneratedDate()).isNull();
            assertThat(created.getParticipants()).hasSize(2);
            assertThat(created.getPayer()).isEqualTo(ActorRef.member("user-a"));
        }

        @Test
        @DisplayName("Should reject a debt payment to a member without a receiver account and store nothing")
        void shouldRejectIncompleteDebtPayment() {
            TemplateRequest request = TemplateRequest.builder()
                    .name("Pay back B")
                    .movementType("DEBT_PAYMENT")
                    .categoryId("cat-debt")
                    .amount(new BigDecimal("100000"))
                    .autoGenerate(true)
                    .recurrencePattern("MONTHLY")
                    .dayOfMonth(5)
                    .startDate("2026-01-01")
                    .payerUserId("user-a")
                    .paymentMethodId("pm-1")
                    .counterpartyUserId("user-b")
                    .build();

            assertThatThrownBy(() -> templateService.create("user-a", request))
                    .isInstanceOf(TemplateValidationException.class)
                    .extracting("error")
                    .isEqualTo(ValidationError.RECEIVER_ACCOUNT_REQUIRED);

            verify(templateRepository, never()).save(any());
            verifyNoInteractions(budgetSynchronizer);
        }

        @Test
        @DisplayName("Should reject actors outside the household")
        void shouldRejectForeignActor() {
            TemplateRequest request = rentRequest()
                    .participants(List.of(participant("user-a", "0.5"), participant("user-x", "0.5")))
                    .build();

            assertThatThrownBy(() -> templateService.create("user-a", request))
                    .isInstanceOf(NotAuthorizedException.class)
                    .hasMessageContaining("user-x");
            verify(templateRepository, never()).save(any());
        }

        @Test
        @DisplayName("Should reject a user without a household")
        void shouldRejectUserWithoutHousehold() {
            assertThatThrownBy(() -> templateService.create("user-z", rentRequest().build()))
                    .isInstanceOf(NotAuthorizedException.class);
            verifyNoInteractions(templateRepository);
        }

        @Test
        @DisplayName("Should reject a name already used in the household")
        void shouldRejectDuplicateName() {
            when(templateRepository.existsByHouseholdIdAndName("hh-1", "Rent")).thenReturn(true);

            assertThatThrownBy(() -> templateService.create("user-a", rentRequest().build()))
                    .isInstanceOf(DuplicateTemplateNameException.class);
            verify(templateRepository, never()).save(any());
        }
    }

    @Nested
    @DisplayName("Access Tests")
    class AccessTests {

        @Test
        @DisplayName("Should hide templates of other households")
        void shouldRejectOtherHousehold() {
            when(templateRepository.findById(1L)).thenReturn(Optional.of(storedRent()));

            assertThatThrownBy(() -> templateService.get("user-x", 1L))
                    .isInstanceOf(NotAuthorizedException.class);
        }

        @Test
        @DisplayName("Should report a missing template")
        void shouldReportMissingTemplate() {
            when(templateRepository.findById(99L)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> templateService.get("user-a", 99L))
                    .isInstanceOf(TemplateNotFoundException.class);
        }

        @Test
        @DisplayName("Should group templates by category in name order")
        void shouldGroupByCategory() {
            RecurringMovementTemplate internet = storedRent();
            internet.setId(2L);
            internet.setName("Internet");
            internet.setCategoryId("cat-services");
            RecurringMovementTemplate rent = storedRent();
            RecurringMovementTemplate water = storedRent();
            water.setId(3L);
            water.setName("Water");
            water.setCategoryId("cat-services");
            when(templateRepository.findByHouseholdIdOrderByNameAsc("hh-1")).thenReturn(List.of(internet, rent, water));

            Map<String, List<RecurringMovementTemplate>> grouped = templateService.listGroupedByCategory("user-b");

            assertThat(grouped).containsOnlyKeys("cat-services", "cat-home");
            assertThat(grouped.keySet()).containsExactly("cat-services", "cat-home");
            assertThat(grouped.get("cat-services")).extracting(RecurringMovementTemplate::getName)
                    .containsExactly("Internet", "Water");
        }
    }

    @Nested
    @DisplayName("Update Tests")
    class UpdateTests {

        @Test
        @DisplayName("Should change only the supplied fields")
        void shouldChangeOnlySuppliedFields() {
            // Given
            when(templateRepository.findById(1L)).thenReturn(Optional.of(storedRent()));

            // When
            RecurringMovementTemplate updated = templateService.update("user-a", 1L,
                    TemplateRequest.builder().amount(new BigDecimal("2600000")).build());

            // Then
            assertThat(updated.getAmount()).isEqualByComparingTo("2600000");
            assertThat(updated.getName()).isEqualTo("Rent");
            assertThat(updated.getParticipants()).hasSize(2);
            assertThat(updated.getNextScheduledDate()).isEqualTo(LocalDate.of(2026, 2, 28));
            verify(budgetSynchronizer).sync("user-a", "hh-1", "cat-home", "cat-home");
        }

        @Test
        @DisplayName("Should sync both categories when the category changes")
        void shouldSyncBothCategories() {
            when(templateRepository.findById(1L)).thenReturn(Optional.of(storedRent()));

            templateService.update("user-a", 1L, TemplateRequest.builder().categoryId("cat-living").build());

            verify(budgetSynchronizer).sync("user-a", "hh-1", "cat-home", "cat-living");
        }

        @Test
        @DisplayName("Should drop fields the new movement type forbids")
        void shouldClearForbiddenFieldsOnTypeChange() {
            when(templateRepository.findById(1L)).thenReturn(Optional.of(storedRent()));

            RecurringMovementTemplate updated = templateService.update("user-a", 1L, TemplateRequest.builder()
                    .movementType("DEBT_PAYMENT")
                    .counterpartyUserId("user-b")
                    .receiverAccountId("acc-b")
                    .build());

            assertThat(updated.getMovementType()).isEqualTo(MovementType.DEBT_PAYMENT);
            assertThat(updated.getParticipants()).isEmpty();
            assertThat(updated.getPayer()).isEqualTo(ActorRef.member("user-a"));
            assertThat(updated.getCounterparty()).isEqualTo(ActorRef.member("user-b"));
            assertThat(updated.getReceiverAccountId()).isEqualTo("acc-b");
        }

        @Test
        @DisplayName("Should clear the payment method with an empty string")
        void shouldClearPaymentMethod() {
            RecurringMovementTemplate stored = storedRent();
            stored.setAutoGenerate(false);
            when(templateRepository.findById(1L)).thenReturn(Optional.of(stored));

            RecurringMovementTemplate updated = templateService.update("user-a", 1L,
                    TemplateRequest.builder().paymentMethodId("").build());

            assertThat(updated.getPaymentMethodId()).isNull();
        }

        @Test
        @DisplayName("Should unschedule a template that stops auto-generating")
        void shouldUnscheduleWhenAutoGenerateDisabled() {
            when(templateRepository.findById(1L)).thenReturn(Optional.of(storedRent()));

            RecurringMovementTemplate updated = templateService.update("user-a", 1L,
                    TemplateRequest.builder().autoGenerate(false).build());

            assertThat(updated.isAutoGenerate()).isFalse();
            assertThat(updated.getNextScheduledDate()).isNull();
        }

        @Test
        @DisplayName("Should reschedule from the last generation")
        void shouldRescheduleFromLastGeneration() {
            when(templateRepository.findById(1L)).thenReturn(Optional.of(storedRent()));

            RecurringMovementTemplate updated = templateService.update("user-a", 1L,
                    TemplateRequest.builder().dayOfMonth(10).build());

            assertThat(updated.getNextScheduledDate()).isEqualTo(LocalDate.of(2026, 2, 10));
            assertThat(updated.getLastGeneratedDate()).isEqualTo(LocalDate.of(2026, 2, 1));
        }

        @Test
        @DisplayName("Should reschedule from a start date moved past the last generation")
        void shouldRescheduleFromLaterStartDate() {
            when(templateRepository.findById(1L)).thenReturn(Optional.of(storedRent()));

            RecurringMovementTemplate updated = templateService.update("user-a", 1L,
                    TemplateRequest.builder().startDate("2026-06-01").build());

            assertThat(updated.getNextScheduledDate()).isEqualTo(LocalDate.of(2026, 6, 30));
        }

        @Test
        @DisplayName("Should keep the stored template when the merge is invalid")
        void shouldNotSaveInvalidMerge() {
            RecurringMovementTemplate stored = storedRent();
            when(templateRepository.findById(1L)).thenReturn(Optional.of(stored));

            assertThatThrownBy(() -> templateService.update("user-a", 1L,
                    TemplateRequest.builder().paymentMethodId("").build()))
                    .isInstanceOf(TemplateValidationException.class)
                    .extracting("error")
                    .isEqualTo(ValidationError.PAYMENT_METHOD_REQUIRED);

            assertThat(stored.getPaymentMethodId()).isEqualTo("pm-1");
            verify(templateRepository, never()).save(any());
            verifyNoInteractions(budgetSynchronizer);
        }
    }

    @Nested
    @DisplayName("Pre-fill Tests")
    class PreFillTests {

        @Test
        @DisplayName("Should copy the template as is without inversion")
        void shouldCopyTemplate() {
            when(templateRepository.findById(1L)).thenReturn(Optional.of(storedRent()));

            PreFillData data = templateService.getPreFillData("user-b", 1L, false);

            assertThat(data.getMovementType()).isEqualTo(MovementType.SPLIT);
            assertThat(data.getPayerUserId()).isEqualTo("user-a");
            assertThat(data.getParticipants()).extracting(ParticipantInput::getUserId)
                    .containsExactly("user-a", "user-b");
        }

        @Test
        @DisplayName("Should turn a split into the debt payment that settles it")
        void shouldInvertSplit() {
            RecurringMovementTemplate stored = storedRent();
            stored.getParticipants().get(0).setPercentage(new BigDecimal("0.4"));
            stored.getParticipants().get(1).setPercentage(new BigDecimal("0.6"));
            when(templateRepository.findById(1L)).thenReturn(Optional.of(stored));

            PreFillData first = templateService.getPreFillData("user-b", 1L, true);
            PreFillData second = templateService.getPreFillData("user-b", 1L, true);

            assertThat(first.getMovementType()).isEqualTo(MovementType.DEBT_PAYMENT);
            assertThat(first.getPayerUserId()).isEqualTo("user-b");
            assertThat(first.getCounterpartyUserId()).isEqualTo("user-a");
            assertThat(first.getParticipants()).isEmpty();
            assertThat(first.getPaymentMethodId()).isEqualTo("pm-1");
            assertThat(second).isEqualTo(first);
            assertThat(stored.getMovementType()).isEqualTo(MovementType.SPLIT);
            assertThat(stored.getParticipants()).hasSize(2);
        }
    }

    @Test
    @DisplayName("Should sync the category after deleting")
    void shouldSyncAfterDelete() {
        RecurringMovementTemplate stored = storedRent();
        when(templateRepository.findById(1L)).thenReturn(Optional.of(stored));

        templateService.delete("user-a", 1L);

        verify(templateRepository).delete(stored);
        verify(budgetSynchronizer).sync("user-a", "hh-1", "cat-home");
    }

    @Test
    @DisplayName("Should run a generation pass at the current time")
    void shouldTriggerGenerationNow() {
        GenerationResult result = GenerationResult.builder().build();
        when(movementGenerator.processPending(LocalDateTime.of(2026, 2, 1, 8, 0))).thenReturn(result);

        assertThat(templateService.triggerGenerationNow()).isSameAs(result);
    }

    // Helper methods

    private static TemplateRequest.TemplateRequestBuilder rentRequest() {
        return TemplateRequest.builder()
                .name("Rent")
                .movementType("SPLIT")
                .categoryId("cat-home")
                .amount(new BigDecimal("2400000"))
                .autoGenerate(true)
                .recurrencePattern("MONTHLY")
                .dayOfMonth(31)
                .startDate("2026-01-15")
                .payerUserId("user-a")
                .paymentMethodId("pm-1")
                .participants(List.of(participant("user-a", "0.5"), participant("user-b", "0.5")));
    }

    private static ParticipantInput participant(String userId, String percentage) {
        return ParticipantInput.builder().userId(userId).percentage(new BigDecimal(percentage)).build();
    }

    private static RecurringMovementTemplate storedRent() {
        return RecurringMovementTemplate.builder()
                .id(1L)
                .householdId("hh-1")
                .createdByUserId("user-a")
                .name("Rent")
                .movementType(MovementType.SPLIT)
                .categoryId("cat-home")
                .amount(new BigDecimal("2400000"))
                .currency("COP")
                .payer(ActorRef.member("user-a"))
                .paymentMethodId("pm-1")
                .participants(new ArrayList<>(List.of(
                        TemplateParticipant.builder().participant(ActorRef.member("user-a"))
                                .percentage(new BigDecimal("0.5")).build(),
                        TemplateParticipant.builder().participant(ActorRef.member("user-b"))
                                .percentage(new BigDecimal("0.5")).build())))
                .autoGenerate(true)
                .recurrencePattern(RecurrencePattern.MONTHLY)
                .dayOfMonth(31)
                .startDate(LocalDate.of(2026, 1, 15))
                .lastGeneratedDate(LocalDate.of(2026, 2, 1))
                .nextScheduledDate(LocalDate.of(2026, 2, 28))
                .version(1L)
                .build();
    }
}
