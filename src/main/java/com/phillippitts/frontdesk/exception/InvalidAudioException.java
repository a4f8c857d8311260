package com.phillippitts.frontdesk.exception;

/**
 * Thrown when an inbound media payload cannot be turned into an audio frame
 * (bad encoding, empty payload). Callers drop the frame; the session is unaffected.
 */
public class InvalidAudioException extends FrontDeskException {

    private final int frameSize;
    private final String reason;

    public InvalidAudioException(String reason) {
        super("Invalid audio frame: " + reason);
        this.frameSize = 0;
        this.reason = reason;
    }

    public InvalidAudioException(int frameSize, String reason) {
        super("Invalid audio frame (" + frameSize + " bytes): " + reason);
        this.frameSize = frameSize;
        this.reason = reason;
    }

    public int getFrameSize() {
        return frameSize;
    }

    public String getReason() {
        return reason;
    }
}
