package com.fintech.recurring.entity;

import jakarta.persistence.AttributeOverride;
import jakarta.persistence.AttributeOverrides;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.Embedded;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * One share of a SPLIT template: who takes part and which fraction (0, 1] they carry.
 * Stored as an ordered child row of its template.
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TemplateParticipant {

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "kind", column = @Column(name = "participant_kind", length = 10, nullable = false)),
            @AttributeOverride(name = "id", column = @Column(name = "participant_id", length = 64, nullable = false))
    })
    private ActorRef participant;

    @Column(nullable = false, precision = 5, scale = 4)
    private BigDecimal percentage;
}
