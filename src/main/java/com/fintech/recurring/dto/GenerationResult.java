package com.fintech.recurring.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one generation pass. Used for logging, the manual trigger response and monitoring.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerationResult {

    private LocalDateTime startedAt;
    private LocalDateTime completedAt;

    @Builder.Default
    private int totalProcessed = 0;

    @Builder.Default
    private int generated = 0;

    @Builder.Default
    private int errors = 0;

    @Builder.Default
    private List<GenerationError> errorDetails = new ArrayList<>();

    /**
     * Why a single template could not generate its movement.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GenerationError {
        private Long templateId;
        private String templateName;
        private String errorMessage;
        private LocalDateTime occurredAt;
    }

    public void incrementTotalProcessed() {
        this.totalProcessed++;
    }

    public void incrementGenerated() {
        this.generated++;
    }

    public void addError(Long templateId, String templateName, String errorMessage, LocalDateTime occurredAt) {
        this.errors++;
        if (this.errorDetails == null) {
            this.errorDetails = new ArrayList<>();
        }
        this.errorDetails.add(GenerationError.builder()
                .templateId(templateId)
                .templateName(templateName)
                .errorMessage(errorMessage)
                .occurredAt(occurredAt)
                .build());
    }

    public long getDurationMs() {
        if (startedAt == null || completedAt == null) {
            return 0;
        }
        return Duration.between(startedAt, completedAt).toMillis();
    }
}
