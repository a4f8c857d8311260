package com.phillippitts.frontdesk.service.routing;

import com.phillippitts.frontdesk.config.properties.KnowledgeBaseProperties;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class KnowledgeBaseBootstrapTest {

    private final EmbeddingStoreKnowledgeBase knowledgeBase = new EmbeddingStoreKnowledgeBase(
            new EmbeddingStoreKnowledgeBaseTest.KeywordEmbeddingModel(), new InMemoryEmbeddingStore<>());

    @Test
    void indexesBundledPairsWhenReady() {
        bootstrap(new KnowledgeBaseProperties(true, "classpath:knowledge/curated-qa.jsonl")).loadCuratedPairs();

        assertThat(knowledgeBase.size()).isEqualTo(8);
    }

    @Test
    void skipsLoadingWhenDisabled() {
        bootstrap(new KnowledgeBaseProperties(false, "classpath:knowledge/curated-qa.jsonl")).loadCuratedPairs();

        assertThat(knowledgeBase.size()).isZero();
    }

    @Test
    void missingFileLeavesIndexEmptyWithoutFailingStartup() {
        KnowledgeBaseBootstrap bootstrap =
                bootstrap(new KnowledgeBaseProperties(true, "classpath:knowledge/does-not-exist.jsonl"));

        assertThatCode(bootstrap::loadCuratedPairs).doesNotThrowAnyException();
        assertThat(knowledgeBase.size()).isZero();
    }

    private KnowledgeBaseBootstrap bootstrap(KnowledgeBaseProperties properties) {
        return new KnowledgeBaseBootstrap(properties, new DefaultResourceLoader(), knowledgeBase);
    }
}
