package com.example.fok.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Contact;
import io.swagger.v3.oas.annotations.info.Info;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
        info =
                @Info(
                        title = "FOK Bot API",
                        version = "1.0",
                        description = "Inbound bot events, application lifecycle and staff administration.",
                        contact = @Contact(name = "FOK Bot Team", email = "support@example.com")))
public class OpenApiConfig {

    @Bean
    public GroupedOpenApi fokApi() {
        return GroupedOpenApi.builder()
                .group("fok")
                .pathsToMatch("/api/**")
                .build();
    }
}
