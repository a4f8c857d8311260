package com.phillippitts.frontdesk.domain;

/**
 * Retrieval trustworthiness of the top passage, used to pick an answer strategy.
 */
public enum ConfidenceTier {
    /** Curated entry above the high threshold: its stored answer is spoken without generation. */
    HIGH,
    /** Above the mid threshold (or above high but free text): grounded generation. */
    MEDIUM,
    /** Between the minimum and mid thresholds: grounded generation with weaker trust. */
    LOW,
    /** Nothing retrieved or retrieval skipped: open generation without context. */
    NONE
}
