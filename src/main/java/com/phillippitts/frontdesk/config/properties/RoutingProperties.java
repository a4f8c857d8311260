package com.phillippitts.frontdesk.config.properties;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Typed properties for the confidence-gated query router.
 *
 * <p>Scores are relevance values in [0, 1] where higher is better. Thresholds must be ordered
 * {@code min <= mid <= high}; this is checked on startup.
 */
@Validated
@ConfigurationProperties(prefix = "routing")
public class RoutingProperties {

    static final List<String> DEFAULT_KEYWORDS = List.of(
            "pain", "appointment", "schedule", "doctor", "treatment", "insurance", "service",
            "therapy", "medication", "procedure", "clinic", "center", "provider", "physician",
            "hours", "open", "close", "location", "address", "directions", "parking", "cost",
            "price", "billing", "accept", "coverage", "blue cross", "medicare", "injection",
            "physical therapy", "back", "neck", "chronic", "acute", "referral", "northview");

    /** Domain keywords; a query matching none skips retrieval. */
    private final List<String> keywords;

    @Min(1)
    @Max(10)
    private final int topK;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private final double minScore;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private final double midScore;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private final double highScore;

    @ConstructorBinding
    public RoutingProperties(List<String> keywords, Integer topK, Double minScore, Double midScore,
                             Double highScore) {
        this.keywords = (keywords == null || keywords.isEmpty()) ? DEFAULT_KEYWORDS : List.copyOf(keywords);
        this.topK = topK == null ? 3 : topK;
        this.minScore = minScore == null ? 0.5 : minScore;
        this.midScore = midScore == null ? 0.6 : midScore;
        this.highScore = highScore == null ? 0.8 : highScore;
    }

    /**
     * Defaults with the given thresholds, for tests and tuning tools.
     */
    public RoutingProperties(double minScore, double midScore, double highScore) {
        this(null, null, minScore, midScore, highScore);
    }

    @AssertTrue(message = "routing thresholds must satisfy min-score <= mid-score <= high-score")
    public boolean isThresholdsOrdered() {
        return minScore <= midScore && midScore <= highScore;
    }

    public List<String> getKeywords() {
        return keywords;
    }

    public int getTopK() {
        return topK;
    }

    public double getMinScore() {
        return minScore;
    }

    public double getMidScore() {
        return midScore;
    }

    public double getHighScore() {
        return highScore;
    }
}
