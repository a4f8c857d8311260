package com.phillippitts.frontdesk.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Reply generation and conversation behaviour for a call.
 */
@Validated
@ConfigurationProperties(prefix = "reply")
public class ReplyProperties {

    static final String DEFAULT_SYSTEM_PROMPT = """
            You are the virtual front-desk assistant for Northview Pain Management Center, \
            a medical practice caring for patients with chronic pain.
            You are speaking on the phone: keep answers to one to three short sentences, \
            warm and professional, with no lists or formatting.
            Only answer using information from the provided context. If the context does not contain \
            the answer, say you don't have that information available and offer to connect the caller \
            with the team. Never invent information.
            For appointments, urgent medical concerns or detailed questions, direct callers to the \
            office at (555) 123-4567.""";

    /** System preamble kept at the head of every conversation. */
    @NotBlank
    private String systemPrompt = DEFAULT_SYSTEM_PROMPT;

    /** Spoken when a call connects. */
    @NotBlank
    private String greeting = "Hello! How can I help you today?";

    /** Spoken when a turn fails. */
    @NotBlank
    private String apology = "I'm sorry, I encountered an error processing your request.";

    /** Recent turns kept after the system preamble. */
    @Min(1)
    @Max(100)
    private int historyTurns = 19;

    /** Upper bound on one streamed reply, including provider latency. */
    @NotNull
    private Duration generationTimeout = Duration.ofSeconds(30);

    /** Instruction appended after retrieved context in a grounded prompt. */
    @NotBlank
    private String groundingInstruction = "Provide a natural, conversational answer using ONLY the information "
            + "in the context above. Do not mention sources, relevance scores, or any technical details. "
            + "If the context doesn't contain the answer, say \"I don't have that information in our records.\"";

    public String getSystemPrompt() {
        return systemPrompt;
    }

    public void setSystemPrompt(String systemPrompt) {
        this.systemPrompt = systemPrompt;
    }

    public String getGreeting() {
        return greeting;
    }

    public void setGreeting(String greeting) {
        this.greeting = greeting;
    }

    public String getApology() {
        return apology;
    }

    public void setApology(String apology) {
        this.apology = apology;
    }

    public int getHistoryTurns() {
        return historyTurns;
    }

    public void setHistoryTurns(int historyTurns) {
        this.historyTurns = historyTurns;
    }

    public Duration getGenerationTimeout() {
        return generationTimeout;
    }

    public void setGenerationTimeout(Duration generationTimeout) {
        this.generationTimeout = generationTimeout;
    }

    public String getGroundingInstruction() {
        return groundingInstruction;
    }

    public void setGroundingInstruction(String groundingInstruction) {
        this.groundingInstruction = groundingInstruction;
    }
}
