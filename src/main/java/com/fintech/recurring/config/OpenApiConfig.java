package com.fintech.recurring.config;

import com.fintech.recurring.exception.ValidationError;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * API metadata for springdoc. The description lists the validation codes a 400 response may carry.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI recurringMovementOpenAPI(@Value("${recurring.api.version:1.0.0}") String apiVersion) {
        return new OpenAPI()
                .info(new Info()
                        .title("Recurring Movement Service API")
                        .version(apiVersion)
                        .description(description()));
    }

    static String description() {
        String codes = Arrays.stream(ValidationError.values())
                .map(error -> "- `" + error.name() + "`: " + error.getMessage())
                .collect(Collectors.joining("\n"));
        return "Recurring movement templates of a household: budget placeholders, movement form pre-fill, "
                + "and movements generated on a monthly, yearly or one-time schedule. "
                + "Every request names its user in the `X-User-Id` header.\n\n"
                + "Validation error codes:\n" + codes;
    }
}
