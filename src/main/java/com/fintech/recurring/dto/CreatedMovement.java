package com.fintech.recurring.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * What the ledger reports back after creating a movement.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreatedMovement {
    private Long id;
    private BigDecimal amount;
}
