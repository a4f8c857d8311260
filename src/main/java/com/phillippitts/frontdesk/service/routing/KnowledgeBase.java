package com.phillippitts.frontdesk.service.routing;

import com.phillippitts.frontdesk.domain.Passage;
import com.phillippitts.frontdesk.exception.KnowledgeBaseUnavailableException;

import java.util.List;

/**
 * Read-only, thread-safe similarity index over clinic knowledge.
 */
public interface KnowledgeBase {

    /**
     * Finds passages similar to the query.
     *
     * @param query      free-text query
     * @param maxResults number of passages to return at most
     * @return passages ranked best first, scores in [0, 1] (higher is better)
     * @throws KnowledgeBaseUnavailableException if the index is empty or cannot be searched
     */
    List<Passage> search(String query, int maxResults);

    /** Number of indexed passages. */
    int size();
}
