package com.example.voice.config;

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
                        title = "Conversation Control API",
                        version = "1.0",
                        description = "Call sessions, human takeover, conversation context and provider webhooks.",
                        contact = @Contact(name = "Voice Platform Team", email = "voice-platform@example.com")))
public class OpenApiConfig {

    @Bean
    public GroupedOpenApi controlApi() {
        return GroupedOpenApi.builder()
                .group("control")
                .pathsToMatch("/api/**")
                .pathsToExclude("/api/webhooks/**")
                .build();
    }

    @Bean
    public GroupedOpenApi webhookApi() {
        return GroupedOpenApi.builder()
                .group("webhooks")
                .pathsToMatch("/api/webhooks/**")
                .build();
    }
}
