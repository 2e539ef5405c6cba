package com.fintech.recurring.controller;

import com.fintech.recurring.dto.GenerationResult;
import com.fintech.recurring.dto.PreFillData;
import com.fintech.recurring.dto.TemplateFilters;
import com.fintech.recurring.dto.TemplateRequest;
import com.fintech.recurring.dto.TemplateResponse;
import com.fintech.recurring.entity.MovementType;
import com.fintech.recurring.entity.RecurringMovementTemplate;
import com.fintech.recurring.service.TemplateService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * REST API for recurring movement templates.
 * <p>
 * The requesting user is identified by the {@code X-User-Id} header; every operation is scoped to
 * that user's household.
 */
@RestController
@RequestMapping("/api/v1/recurring-movements")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Recurring movements", description = "Recurring movement templates and their generation")
public class TemplateController {

    static final String USER_HEADER = "X-User-Id";

    private final TemplateService templateService;

    @Operation(
            summary = "Create a template",
            description = "Creates a budget-only, pre-fill or auto-generating template depending on which fields are set."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Template created",
                    content = @Content(schema = @Schema(implementation = TemplateResponse.class))),
            @ApiResponse(responseCode = "400", description = "Validation error"),
            @ApiResponse(responseCode = "403", description = "An actor is not a member of the household"),
            @ApiResponse(responseCode = "409", description = "Name already used in the household")
    })
    @PostMapping
    public ResponseEntity<TemplateResponse> create(
            @Parameter(description = "Requesting user") @RequestHeader(USER_HEADER) String userId,
            @RequestBody TemplateRequest request) {
        RecurringMovementTemplate created = templateService.create(userId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(TemplateResponse.from(created));
    }

    @Operation(summary = "List templates", description = "Household templates ordered by name, optionally filtered.")
    @ApiResponse(responseCode = "200", description = "Templates retrieved successfully")
    @GetMapping
    public ResponseEntity<List<TemplateResponse>> list(
            @RequestHeader(USER_HEADER) String userId,
            @Parameter(description = "Only this category") @RequestParam(required = false) String categoryId,
            @Parameter(description = "Only active or only inactive templates") @RequestParam(required = false) Boolean isActive,
            @Parameter(description = "Only this movement type") @RequestParam(required = false) MovementType movementType) {
        TemplateFilters filters = TemplateFilters.builder()
                .categoryId(categoryId)
                .active(isActive)
                .movementType(movementType)
                .build();
        return ResponseEntity.ok(toResponses(templateService.list(userId, filters)));
    }

    @Operation(summary = "Get a template")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Template found",
                    content = @Content(schema = @Schema(implementation = TemplateResponse.class))),
            @ApiResponse(responseCode = "403", description = "Template belongs to another household"),
            @ApiResponse(responseCode = "404", description = "Template not found")
    })
    @GetMapping("/{id}")
    public ResponseEntity<TemplateResponse> get(
            @RequestHeader(USER_HEADER) String userId,
            @Parameter(description = "Template ID") @PathVariable Long id) {
        return ResponseEntity.ok(TemplateResponse.from(templateService.get(userId, id)));
    }

    @Operation(summary = "Templates grouped by category", description = "All household templates keyed by category id.")
    @GetMapping("/by-category")
    public ResponseEntity<Map<String, List<TemplateResponse>>> listGroupedByCategory(
            @RequestHeader(USER_HEADER) String userId) {
        Map<String, List<TemplateResponse>> grouped = new LinkedHashMap<>();
        templateService.listGroupedByCategory(userId)
                .forEach((categoryId, templates) -> grouped.put(categoryId, toResponses(templates)));
        return ResponseEntity.ok(grouped);
    }

    @Operation(summary = "Active templates of a category")
    @GetMapping("/by-category/{categoryId}")
    public ResponseEntity<List<TemplateResponse>> listByCategory(
            @RequestHeader(USER_HEADER) String userId,
            @Parameter(description = "Category ID") @PathVariable String categoryId) {
        return ResponseEntity.ok(toResponses(templateService.listByCategory(userId, categoryId)));
    }

    @Operation(
            summary = "Movement form pre-fill",
            description = "Form values derived from a template. With invertRoles a SPLIT template is turned into the DEBT_PAYMENT that settles it."
    )
    @ApiResponse(responseCode = "200", description = "Pre-fill data",
            content = @Content(schema = @Schema(implementation = PreFillData.class)))
    @GetMapping("/{id}/prefill")
    public ResponseEntity<PreFillData> getPreFillData(
            @RequestHeader(USER_HEADER) String userId,
            @PathVariable Long id,
            @Parameter(description = "Swap payer and counterparty of a SPLIT template")
            @RequestParam(defaultValue = "false") boolean invertRoles) {
        return ResponseEntity.ok(templateService.getPreFillData(userId, id, invertRoles));
    }

    @Operation(
            summary = "Update a template",
            description = "Absent fields keep their value. An empty string clears paymentMethodId, receiverAccountId, an actor or the movement type."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Template updated",
                    content = @Content(schema = @Schema(implementation = TemplateResponse.class))),
            @ApiResponse(responseCode = "400", description = "Validation error"),
            @ApiResponse(responseCode = "404", description = "Template not found")
    })
    @PatchMapping("/{id}")
    public ResponseEntity<TemplateResponse> update(
            @RequestHeader(USER_HEADER) String userId,
            @PathVariable Long id,
            @RequestBody TemplateRequest changes) {
        return ResponseEntity.ok(TemplateResponse.from(templateService.update(userId, id, changes)));
    }

    @Operation(summary = "Delete a template")
    @ApiResponse(responseCode = "204", description = "Template deleted")
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(
            @RequestHeader(USER_HEADER) String userId,
            @PathVariable Long id) {
        templateService.delete(userId, id);
        return ResponseEntity.noContent().build();
    }

    @Operation(
            summary = "Trigger generation",
            description = "Runs a generation pass now. Useful after downtime or to check a newly due template without waiting for the scheduler."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Generation pass completed",
                    content = @Content(schema = @Schema(implementation = GenerationResult.class))),
            @ApiResponse(responseCode = "409", description = "Generation already in progress")
    })
    @PostMapping("/generate")
    public ResponseEntity<GenerationResult> triggerGeneration() {
        log.info("Manual generation triggered via API");
        return ResponseEntity.ok(templateService.triggerGenerationNow());
    }

    private static List<TemplateResponse> toResponses(List<RecurringMovementTemplate> templates) {
        return templates.stream().map(TemplateResponse::from).collect(Collectors.toList());
    }
}
