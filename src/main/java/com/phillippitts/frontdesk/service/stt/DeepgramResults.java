package com.phillippitts.frontdesk.service.stt;

import org.json.JSONArray;
import org.json.JSONObject;

import java.util.Optional;

/**
 * Parses streaming recognition result messages.
 *
 * <p>Only {@code Results} messages with a non-empty first alternative produce a transcript.
 * {@code is_final} or {@code speech_final} marks it final.
 */
final class DeepgramResults {

    record Parsed(String text, boolean isFinal) {}

    private DeepgramResults() {}

    /**
     * @throws org.json.JSONException if the payload is not JSON
     */
    static Optional<Parsed> parse(String payload) {
        JSONObject json = new JSONObject(payload);
        if (!"Results".equals(json.optString("type"))) {
            return Optional.empty();
        }
        JSONObject channel = json.optJSONObject("channel");
        JSONArray alternatives = channel == null ? null : channel.optJSONArray("alternatives");
        if (alternatives == null || alternatives.isEmpty()) {
            return Optional.empty();
        }
        String transcript = alternatives.getJSONObject(0).optString("transcript", "").trim();
        if (transcript.isEmpty()) {
            return Optional.empty();
        }
        boolean isFinal = json.optBoolean("is_final", false) || json.optBoolean("speech_final", false);
        return Optional.of(new Parsed(transcript, isFinal));
    }
}
