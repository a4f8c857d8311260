package com.phillippitts.frontdesk.service.reply;

import com.phillippitts.frontdesk.domain.ChatTurn;

import java.util.List;

/**
 * Streaming reply generator. Generation parameters (model, temperature, token limit) are fixed
 * by the implementation's configuration.
 */
public interface ReplyGenerator {

    /**
     * Starts streaming a reply to the ordered conversation turns. Returns immediately; results
     * arrive on the listener. May also throw synchronously if the request cannot be sent.
     */
    void generate(List<ChatTurn> turns, ReplyStreamListener listener);
}
