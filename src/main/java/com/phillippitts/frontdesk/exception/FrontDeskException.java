package com.phillippitts.frontdesk.exception;

/**
 * Base exception for all front-desk voice agent errors.
 * Domain exceptions extend this class so boundaries can handle them uniformly.
 */
public class FrontDeskException extends RuntimeException {

    public FrontDeskException(String message) {
        super(message);
    }

    public FrontDeskException(String message, Throwable cause) {
        super(message, cause);
    }

    public FrontDeskException(Throwable cause) {
        super(cause);
    }
}
