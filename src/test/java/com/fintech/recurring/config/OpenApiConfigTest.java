package com.fintech.recurring.config;

import com.fintech.recurring.exception.ValidationError;
import io.swagger.v3.oas.models.OpenAPI;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OpenApiConfigTest {

    @Test
    @DisplayName("Should document every validation code with its message")
    void shouldListValidationCodes() {
        OpenAPI api = new OpenApiConfig().recurringMovementOpenAPI("2.0.0");

        assertThat(api.getInfo().getVersion()).isEqualTo("2.0.0");
        assertThat(api.getInfo().getDescription())
                .contains("X-User-Id")
                .contains("`AMOUNT_TOO_PRECISE`: " + ValidationError.AMOUNT_TOO_PRECISE.getMessage())
                .contains("`PARTICIPANTS_REQUIRED`");
    }
}
