package com.phillippitts.frontdesk.service.reply;

/**
 * Result of streaming one reply.
 *
 * @param status    terminal status
 * @param text      full reply text (COMPLETED only)
 * @param sentences sentences handed to synthesis
 * @param error     failure cause (FAILED only)
 */
public record ReplyOutcome(Status status, String text, int sentences, Throwable error) {

    public enum Status { COMPLETED, CANCELLED, FAILED }

    static ReplyOutcome completed(String text, int sentences) {
        return new ReplyOutcome(Status.COMPLETED, text, sentences, null);
    }

    static ReplyOutcome cancelled(int sentences) {
        return new ReplyOutcome(Status.CANCELLED, null, sentences, null);
    }

    static ReplyOutcome failed(int sentences, Throwable error) {
        return new ReplyOutcome(Status.FAILED, null, sentences, error);
    }
}
