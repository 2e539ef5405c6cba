package com.fintech.recurring.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * A split participant as sent by, and returned to, the movement form.
 * Exactly one of {@code userId} and {@code contactId} must be set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParticipantInput {

    private String userId;

    private String contactId;

    /**
     * Share carried by this participant, 0 exclusive to 1 inclusive (0.25 = 25%).
     */
    private BigDecimal percentage;
}
