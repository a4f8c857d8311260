package com.phillippitts.frontdesk.service.routing;

import com.phillippitts.frontdesk.exception.KnowledgeBaseUnavailableException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.core.io.Resource;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads curated QA pairs from a JSONL resource, one {@code {"question": .., "answer": ..}} object
 * per line. Blank lines are ignored; malformed or incomplete lines are skipped with a warning.
 */
public final class CuratedQaLoader {

    private static final Logger LOG = LogManager.getLogger(CuratedQaLoader.class);

    /**
     * @throws KnowledgeBaseUnavailableException if the resource is missing or unreadable
     */
    public List<CuratedQa> load(Resource resource) {
        if (!resource.exists()) {
            throw new KnowledgeBaseUnavailableException("Curated QA resource not found: " + resource.getDescription());
        }
        List<CuratedQa> pairs = new ArrayList<>();
        int lineNumber = 0;
        int skipped = 0;
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                CuratedQa pair = parse(line, lineNumber);
                if (pair == null) {
                    skipped++;
                } else {
                    pairs.add(pair);
                }
            }
        } catch (IOException e) {
            throw new KnowledgeBaseUnavailableException("Failed to read " + resource.getDescription(), e);
        }
        LOG.info("Loaded {} curated QA pairs from {} ({} skipped)", pairs.size(), resource.getDescription(), skipped);
        return pairs;
    }

    private static CuratedQa parse(String line, int lineNumber) {
        try {
            JSONObject json = new JSONObject(line);
            String question = json.optString("question", "").trim();
            String answer = json.optString("answer", "").trim();
            if (question.isEmpty() || answer.isEmpty()) {
                LOG.warn("Skipping curated QA line {}: missing question or answer", lineNumber);
                return null;
            }
            return new CuratedQa(question, answer);
        } catch (JSONException e) {
            LOG.warn("Skipping curated QA line {}: {}", lineNumber, e.getMessage());
            return null;
        }
    }
}
