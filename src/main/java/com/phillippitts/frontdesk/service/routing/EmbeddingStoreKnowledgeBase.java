package com.phillippitts.frontdesk.service.routing;

import com.phillippitts.frontdesk.domain.Passage;
import com.phillippitts.frontdesk.domain.PassageKind;
import com.phillippitts.frontdesk.exception.KnowledgeBaseUnavailableException;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Knowledge base on a LangChain4j embedding store.
 *
 * <p>Scores are the store's relevance scores (cosine similarity mapped to [0, 1], higher is better),
 * the convention the router thresholds are written against. Curated entries are stored with
 * metadata {@code type=qa_pair} plus their question and answer.
 */
@Component
public class EmbeddingStoreKnowledgeBase implements KnowledgeBase {

    private static final Logger LOG = LogManager.getLogger(EmbeddingStoreKnowledgeBase.class);

    static final String TYPE_KEY = "type";
    static final String QA_PAIR_TYPE = "qa_pair";

    private final EmbeddingModel embeddingModel;
    private final EmbeddingStore<TextSegment> store;
    private final AtomicInteger indexed = new AtomicInteger();

    public EmbeddingStoreKnowledgeBase(EmbeddingModel embeddingModel, EmbeddingStore<TextSegment> store) {
        this.embeddingModel = embeddingModel;
        this.store = store;
    }

    @Override
    public List<Passage> search(String query, int maxResults) {
        if (indexed.get() == 0) {
            throw new KnowledgeBaseUnavailableException("Knowledge base index is empty");
        }
        try {
            Embedding queryEmbedding = embeddingModel.embed(query).content();
            EmbeddingSearchRequest request = EmbeddingSearchRequest.builder()
                    .queryEmbedding(queryEmbedding)
                    .maxResults(maxResults)
                    .minScore(0.0)
                    .build();
            return store.search(request).matches().stream()
                    .filter(match -> match.embedded() != null)
                    .map(EmbeddingStoreKnowledgeBase::toPassage)
                    .toList();
        } catch (RuntimeException e) {
            throw new KnowledgeBaseUnavailableException("Knowledge base search failed", e);
        }
    }

    /**
     * Embeds and indexes curated QA pairs.
     *
     * @return number of pairs indexed
     */
    public int indexCuratedPairs(List<CuratedQa> pairs) {
        if (pairs.isEmpty()) {
            return 0;
        }
        List<TextSegment> segments = pairs.stream()
                .map(pair -> TextSegment.from(pair.indexText(), Metadata.from(Map.of(
                        TYPE_KEY, QA_PAIR_TYPE,
                        Passage.QUESTION_KEY, pair.question(),
                        Passage.ANSWER_KEY, pair.answer()))))
                .toList();
        List<Embedding> embeddings = embeddingModel.embedAll(segments).content();
        store.addAll(embeddings, segments);
        int total = indexed.addAndGet(segments.size());
        LOG.info("Indexed {} curated QA pairs ({} passages total)", segments.size(), total);
        return segments.size();
    }

    @Override
    public int size() {
        return indexed.get();
    }

    private static Passage toPassage(EmbeddingMatch<TextSegment> match) {
        TextSegment segment = match.embedded();
        Map<String, String> metadata = new HashMap<>();
        segment.metadata().toMap().forEach((key, value) -> metadata.put(key, String.valueOf(value)));
        PassageKind kind = QA_PAIR_TYPE.equals(metadata.get(TYPE_KEY)) ? PassageKind.CURATED_QA : PassageKind.FREE_TEXT;
        double score = match.score() == null ? 0.0 : Math.max(0.0, Math.min(1.0, match.score()));
        return new Passage(segment.text(), score, kind, metadata);
    }
}
