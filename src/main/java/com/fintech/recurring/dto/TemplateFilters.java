package com.fintech.recurring.dto;

import com.fintech.recurring.entity.MovementType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Optional filters for listing a household's templates. Null means "any".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TemplateFilters {
    private String categoryId;
    private Boolean active;
    private MovementType movementType;

    public static TemplateFilters none() {
        return new TemplateFilters();
    }
}
