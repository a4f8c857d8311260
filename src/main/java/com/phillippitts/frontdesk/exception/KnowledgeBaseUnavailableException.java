package com.phillippitts.frontdesk.exception;

/**
 * Thrown when the knowledge-base index cannot be searched (not loaded, embedding failure).
 * The query router degrades to ungrounded generation when it sees this.
 */
public class KnowledgeBaseUnavailableException extends FrontDeskException {

    public KnowledgeBaseUnavailableException(String message) {
        super(message);
    }

    public KnowledgeBaseUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
