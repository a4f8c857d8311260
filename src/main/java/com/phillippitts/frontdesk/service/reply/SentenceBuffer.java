package com.phillippitts.frontdesk.service.reply;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Accumulates streamed fragments and cuts them into sentences.
 *
 * <p>A sentence ends at {@code .}, {@code !} or {@code ?} (optionally followed by closing quotes or
 * brackets) when whitespace follows. The terminator stays with its sentence. Whatever remains at
 * end of stream comes out of {@link #flush()}.
 */
final class SentenceBuffer {

    private static final Pattern TERMINATOR = Pattern.compile("[.!?]+[\"')\\]]*\\s+");

    private final StringBuilder pending = new StringBuilder();
    private final StringBuilder full = new StringBuilder();

    /**
     * @return sentences completed by this fragment, in order
     */
    List<String> append(String fragment) {
        if (fragment == null || fragment.isEmpty()) {
            return List.of();
        }
        full.append(fragment);
        pending.append(fragment);
        List<String> sentences = new ArrayList<>();
        Matcher matcher = TERMINATOR.matcher(pending);
        int start = 0;
        while (matcher.find()) {
            String sentence = pending.substring(start, matcher.end()).trim();
            if (!sentence.isEmpty()) {
                sentences.add(sentence);
            }
            start = matcher.end();
        }
        pending.delete(0, start);
        return sentences;
    }

    /**
     * Trailing partial sentence, if any. Empties the buffer.
     */
    Optional<String> flush() {
        String rest = pending.toString().trim();
        pending.setLength(0);
        return rest.isEmpty() ? Optional.empty() : Optional.of(rest);
    }

    String fullText() {
        return full.toString().trim();
    }
}
