package com.phillippitts.frontdesk.domain;

/**
 * Kind of knowledge-base entry. Curated entries carry a canonical stored answer.
 */
public enum PassageKind {
    CURATED_QA,
    FREE_TEXT
}
