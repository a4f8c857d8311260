package com.phillippitts.frontdesk.service.routing;

import com.phillippitts.frontdesk.config.properties.KnowledgeBaseProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

/**
 * Indexes the curated QA file once the application is ready.
 *
 * <p>A failure here is logged, not fatal: calls still work with ungrounded replies and the
 * knowledge-base health indicator reports the degraded state.
 */
@Component
class KnowledgeBaseBootstrap {

    private static final Logger LOG = LogManager.getLogger(KnowledgeBaseBootstrap.class);

    private final KnowledgeBaseProperties properties;
    private final ResourceLoader resourceLoader;
    private final EmbeddingStoreKnowledgeBase knowledgeBase;
    private final CuratedQaLoader loader = new CuratedQaLoader();

    KnowledgeBaseBootstrap(KnowledgeBaseProperties properties, ResourceLoader resourceLoader,
                           EmbeddingStoreKnowledgeBase knowledgeBase) {
        this.properties = properties;
        this.resourceLoader = resourceLoader;
        this.knowledgeBase = knowledgeBase;
    }

    @EventListener(ApplicationReadyEvent.class)
    void loadCuratedPairs() {
        if (!properties.loadOnStartup()) {
            LOG.info("Knowledge base loading disabled (knowledge-base.load-on-startup=false)");
            return;
        }
        try {
            int count = knowledgeBase.indexCuratedPairs(
                    loader.load(resourceLoader.getResource(properties.curatedQaLocation())));
            LOG.info("Knowledge base ready: {} curated passages", count);
        } catch (RuntimeException e) {
            LOG.error("Knowledge base unavailable; calls will use ungrounded replies", e);
        }
    }
}
