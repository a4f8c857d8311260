package com.phillippitts.frontdesk.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Knowledge-base bootstrap settings. Binds to "knowledge-base".
 *
 * @param loadOnStartup   index the curated QA resource when the application is ready
 * @param curatedQaLocation Spring resource location of the curated QA JSONL file
 */
@ConfigurationProperties(prefix = "knowledge-base")
@Validated
public record KnowledgeBaseProperties(
        @DefaultValue("true") boolean loadOnStartup,
        @NotBlank @DefaultValue("classpath:knowledge/curated-qa.jsonl") String curatedQaLocation
) {
}
