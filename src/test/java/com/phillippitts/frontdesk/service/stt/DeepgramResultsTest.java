package com.phillippitts.frontdesk.service.stt;

import org.json.JSONException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeepgramResultsTest {

    private static String results(String transcript, boolean isFinal, boolean speechFinal) {
        return "{\"type\":\"Results\",\"is_final\":" + isFinal + ",\"speech_final\":" + speechFinal
                + ",\"channel\":{\"alternatives\":[{\"transcript\":\"" + transcript + "\",\"confidence\":0.98}]}}";
    }

    @Test
    void interimResult() {
        assertThat(DeepgramResults.parse(results("what are your", false, false)))
                .contains(new DeepgramResults.Parsed("what are your", false));
    }

    @Test
    void eitherFinalFlagMarksTheTranscriptFinal() {
        assertThat(DeepgramResults.parse(results("What are your hours?", true, false)))
                .contains(new DeepgramResults.Parsed("What are your hours?", true));
        assertThat(DeepgramResults.parse(results("What are your hours?", false, true)))
                .contains(new DeepgramResults.Parsed("What are your hours?", true));
    }

    @Test
    void trimsTranscript() {
        assertThat(DeepgramResults.parse(results("  hello  ", true, true)))
                .map(DeepgramResults.Parsed::text)
                .contains("hello");
    }

    @Test
    void blankTranscriptIsIgnored() {
        assertThat(DeepgramResults.parse(results("", true, true))).isEmpty();
        assertThat(DeepgramResults.parse(results("   ", false, false))).isEmpty();
    }

    @Test
    void nonResultMessagesAreIgnored() {
        assertThat(DeepgramResults.parse("{\"type\":\"Metadata\",\"request_id\":\"abc\"}")).isEmpty();
        assertThat(DeepgramResults.parse("{\"type\":\"SpeechStarted\"}")).isEmpty();
        assertThat(DeepgramResults.parse("{\"type\":\"Results\",\"channel\":{\"alternatives\":[]}}")).isEmpty();
        assertThat(DeepgramResults.parse("{\"type\":\"Results\"}")).isEmpty();
    }

    @Test
    void malformedPayloadThrows() {
        assertThatThrownBy(() -> DeepgramResults.parse("not json")).isInstanceOf(JSONException.class);
    }
}
