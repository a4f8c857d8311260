package com.phillippitts.frontdesk.service.health;

import com.phillippitts.frontdesk.config.properties.KnowledgeBaseProperties;
import com.phillippitts.frontdesk.service.routing.KnowledgeBase;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;

/**
 * Reports whether the knowledge base index holds passages.
 *
 * <p>An empty index is {@code DEGRADED}, not down: calls still work, routed as open generation.
 * Exposed via /actuator/health.
 */
@Component
public class KnowledgeBaseHealthIndicator implements HealthIndicator {

    static final Status DEGRADED = new Status("DEGRADED", "Knowledge base empty; answers are ungrounded");

    private final KnowledgeBase knowledgeBase;
    private final KnowledgeBaseProperties properties;

    public KnowledgeBaseHealthIndicator(KnowledgeBase knowledgeBase, KnowledgeBaseProperties properties) {
        this.knowledgeBase = knowledgeBase;
        this.properties = properties;
    }

    @Override
    public Health health() {
        int passages = knowledgeBase.size();
        Health.Builder builder = passages > 0 ? Health.up() : Health.status(DEGRADED);
        return builder
                .withDetail("passages", passages)
                .withDetail("source", properties.curatedQaLocation())
                .build();
    }
}
