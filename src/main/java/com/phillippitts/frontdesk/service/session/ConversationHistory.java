package com.phillippitts.frontdesk.service.session;

import com.phillippitts.frontdesk.domain.ChatTurn;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Bounded conversation history: the system preamble plus the most recent turns.
 *
 * <p>Only raw caller text and final reply text are stored; prompts augmented with retrieved
 * context never enter the history.
 */
public final class ConversationHistory {

    private final ChatTurn preamble;
    private final int maxTurns;
    private final Deque<ChatTurn> turns = new ArrayDeque<>();

    public ConversationHistory(String systemPrompt, int maxTurns) {
        Objects.requireNonNull(systemPrompt, "systemPrompt must not be null");
        if (maxTurns < 1) {
            throw new IllegalArgumentException("maxTurns must be positive: " + maxTurns);
        }
        this.preamble = ChatTurn.system(systemPrompt);
        this.maxTurns = maxTurns;
    }

    public synchronized void append(ChatTurn turn) {
        if (turn.role() == ChatTurn.Role.SYSTEM) {
            throw new IllegalArgumentException("System preamble is fixed at construction");
        }
        turns.addLast(turn);
        while (turns.size() > maxTurns) {
            turns.removeFirst();
        }
    }

    /**
     * Records a completed caller/assistant exchange.
     */
    public synchronized void recordExchange(String callerText, String replyText) {
        append(ChatTurn.user(callerText));
        append(ChatTurn.assistant(replyText));
    }

    /**
     * Preamble first, then turns oldest to newest.
     */
    public synchronized List<ChatTurn> snapshot() {
        List<ChatTurn> copy = new ArrayList<>(turns.size() + 1);
        copy.add(preamble);
        copy.addAll(turns);
        return List.copyOf(copy);
    }

    /** Number of turns after the preamble. */
    public synchronized int size() {
        return turns.size();
    }
}
