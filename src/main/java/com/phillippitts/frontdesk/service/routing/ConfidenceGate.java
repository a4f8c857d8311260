package com.phillippitts.frontdesk.service.routing;

import com.phillippitts.frontdesk.config.properties.RoutingProperties;
import com.phillippitts.frontdesk.domain.ConfidenceTier;
import com.phillippitts.frontdesk.domain.Passage;
import com.phillippitts.frontdesk.domain.RouteDecision;
import com.phillippitts.frontdesk.exception.KnowledgeBaseUnavailableException;
import com.phillippitts.frontdesk.service.metrics.PipelineMetrics;
import com.phillippitts.frontdesk.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * Picks the answer strategy for a finalized query.
 *
 * <ol>
 *   <li>No domain keyword: open generation, the knowledge base is not queried.</li>
 *   <li>Otherwise retrieve the top-k passages and drop those below the minimum score.</li>
 *   <li>Nothing left: open generation ({@link ConfidenceTier#NONE}).</li>
 *   <li>Top passage curated and at or above the high threshold: speak its stored answer
 *       ({@link ConfidenceTier#HIGH}, no generation).</li>
 *   <li>At or above the mid threshold (or high but free text): grounded, {@link ConfidenceTier#MEDIUM}.</li>
 *   <li>Else grounded, {@link ConfidenceTier#LOW}.</li>
 * </ol>
 *
 * <p>Never fails a turn: an unavailable knowledge base routes as {@link ConfidenceTier#NONE}.
 */
@Component
public class ConfidenceGate {

    private static final Logger LOG = LogManager.getLogger(ConfidenceGate.class);

    private final KnowledgeBase knowledgeBase;
    private final RoutingProperties properties;
    private final RelevanceFilter relevanceFilter;
    private final PipelineMetrics metrics;

    public ConfidenceGate(KnowledgeBase knowledgeBase, RoutingProperties properties, PipelineMetrics metrics) {
        this.knowledgeBase = knowledgeBase;
        this.properties = properties;
        this.relevanceFilter = new RelevanceFilter(properties.getKeywords());
        this.metrics = metrics;
    }

    public RouteDecision route(String query) {
        RouteDecision decision = decide(query);
        metrics.recordRoute(decision.tier(), decision.retrievalPerformed());
        LOG.info("Routed query '{}': tier={}, passages={}, retrieval={}",
                LogSanitizer.preview(query), decision.tier(), decision.context().size(),
                decision.retrievalPerformed());
        return decision;
    }

    private RouteDecision decide(String query) {
        if (!relevanceFilter.isRelevant(query)) {
            return RouteDecision.open(false);
        }
        List<Passage> retrieved;
        try {
            retrieved = knowledgeBase.search(query, properties.getTopK());
        } catch (KnowledgeBaseUnavailableException e) {
            LOG.warn("Knowledge base unavailable, answering without context: {}", e.getMessage());
            return RouteDecision.open(true);
        }
        List<Passage> kept = retrieved.stream()
                .filter(p -> p.score() >= properties.getMinScore())
                .sorted(Comparator.comparingDouble(Passage::score).reversed())
                .toList();
        if (kept.isEmpty()) {
            return RouteDecision.open(true);
        }
        Passage top = kept.get(0);
        if (top.score() >= properties.getHighScore() && top.isCurated() && top.storedAnswer() != null) {
            return RouteDecision.direct(top);
        }
        if (top.score() >= properties.getMidScore()) {
            return RouteDecision.grounded(ConfidenceTier.MEDIUM, kept);
        }
        return RouteDecision.grounded(ConfidenceTier.LOW, kept);
    }
}
