package com.phillippitts.frontdesk.testutil;

import com.phillippitts.frontdesk.domain.ChatTurn;
import com.phillippitts.frontdesk.service.reply.ReplyGenerator;
import com.phillippitts.frontdesk.service.reply.ReplyStreamListener;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Reply generator that streams scripted fragments synchronously on the calling thread.
 *
 * <p>Modes: complete after the fragments, fail after the fragments, or stay silent (never
 * complete) so tests can exercise timeouts and cancellation.
 */
public class ScriptedReplyGenerator implements ReplyGenerator {

    public final List<List<ChatTurn>> prompts = new CopyOnWriteArrayList<>();

    private volatile List<String> fragments = List.of();
    private volatile Throwable failure;
    private volatile boolean silent;
    private volatile Consumer<String> onFragment = f -> { };

    public static ScriptedReplyGenerator replying(String... fragments) {
        ScriptedReplyGenerator generator = new ScriptedReplyGenerator();
        generator.fragments = List.of(fragments);
        return generator;
    }

    public static ScriptedReplyGenerator failingWith(Throwable failure, String... fragments) {
        ScriptedReplyGenerator generator = replying(fragments);
        generator.failure = failure;
        return generator;
    }

    /** Streams the fragments and then never completes. */
    public static ScriptedReplyGenerator hanging(String... fragments) {
        ScriptedReplyGenerator generator = replying(fragments);
        generator.silent = true;
        return generator;
    }

    /** Hook run after each fragment is delivered, for example to cancel mid-stream. */
    public ScriptedReplyGenerator afterEachFragment(Consumer<String> hook) {
        this.onFragment = hook;
        return this;
    }

    @Override
    public void generate(List<ChatTurn> turns, ReplyStreamListener listener) {
        prompts.add(List.copyOf(turns));
        for (String fragment : fragments) {
            listener.onFragment(fragment);
            onFragment.accept(fragment);
        }
        if (silent) {
            return;
        }
        if (failure != null) {
            listener.onError(failure);
        } else {
            listener.onComplete(String.join("", fragments));
        }
    }

    public int calls() {
        return prompts.size();
    }

    public List<ChatTurn> lastPrompt() {
        return prompts.get(prompts.size() - 1);
    }
}
