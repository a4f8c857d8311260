package com.phillippitts.frontdesk.service.reply;

import com.phillippitts.frontdesk.domain.ChatTurn;
import com.phillippitts.frontdesk.exception.ProviderException;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * {@link ReplyGenerator} on a LangChain4j streaming chat model (OpenAI-compatible).
 */
@Component
public class OpenAiReplyGenerator implements ReplyGenerator {

    static final String PROVIDER = "openai";

    private final StreamingChatModel model;

    public OpenAiReplyGenerator(StreamingChatModel model) {
        this.model = model;
    }

    @Override
    public void generate(List<ChatTurn> turns, ReplyStreamListener listener) {
        ChatRequest request = ChatRequest.builder()
                .messages(turns.stream().map(OpenAiReplyGenerator::toMessage).toList())
                .build();
        model.chat(request, new StreamingChatResponseHandler() {
            @Override
            public void onPartialResponse(String partialResponse) {
                listener.onFragment(partialResponse);
            }

            @Override
            public void onCompleteResponse(ChatResponse completeResponse) {
                AiMessage message = completeResponse.aiMessage();
                listener.onComplete(message == null ? null : message.text());
            }

            @Override
            public void onError(Throwable error) {
                listener.onError(new ProviderException("Reply stream failed", PROVIDER, error));
            }
        });
    }

    static ChatMessage toMessage(ChatTurn turn) {
        return switch (turn.role()) {
            case SYSTEM -> SystemMessage.from(turn.text());
            case USER -> UserMessage.from(turn.text());
            case ASSISTANT -> AiMessage.from(turn.text());
        };
    }
}
