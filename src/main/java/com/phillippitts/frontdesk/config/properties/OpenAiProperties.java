package com.phillippitts.frontdesk.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Reply generator and embedding model settings. Binds to "openai".
 *
 * @param apiKey         provider key
 * @param chatModel      streaming chat model name
 * @param embeddingModel embedding model used by the knowledge base
 * @param temperature    sampling temperature
 * @param maxTokens      maximum reply tokens
 * @param timeout        HTTP timeout for provider calls
 */
@ConfigurationProperties(prefix = "openai")
@Validated
public record OpenAiProperties(
        @NotBlank @DefaultValue("not-configured") String apiKey,
        @NotBlank @DefaultValue("gpt-4o-mini") String chatModel,
        @NotBlank @DefaultValue("text-embedding-3-small") String embeddingModel,
        @DecimalMin("0.0") @DecimalMax("2.0") @DefaultValue("0.7") double temperature,
        @Positive @DefaultValue("150") int maxTokens,
        @NotNull @DefaultValue("60s") Duration timeout
) {
}
