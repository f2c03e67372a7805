package com.tdnet.insight.summarize;

import com.google.api.gax.rpc.ApiException;
import com.google.api.gax.rpc.ResourceExhaustedException;
import com.google.api.gax.rpc.StatusCode;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.HttpException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import java.util.regex.Pattern;

public class GeminiSummarizationClient implements SummarizationClient {

    private static final int TOO_MANY_REQUESTS = 429;
    private static final Pattern RATE_LIMIT_MESSAGE = Pattern.compile("\\b429\\b|\\bRESOURCE_EXHAUSTED\\b");

    private final ChatModel chatModel;

    public GeminiSummarizationClient(ChatModel chatModel) {
        this.chatModel = chatModel;
    }

    @Override
    public String summarize(String systemPrompt, String userPrompt, String content) {
        String message = content == null || content.isEmpty() ? userPrompt : userPrompt + "\n\n" + content;
        ChatResponse response;
        try {
            response = chatModel.chat(SystemMessage.from(systemPrompt), UserMessage.from(message));
        } catch (RuntimeException ex) {
            throw new SummarizationException(classify(ex), "Gemini call failed: " + ex.getMessage(), ex);
        }
        if (response == null || response.aiMessage() == null || response.aiMessage().text() == null) {
            throw new SummarizationException(SummarizationException.Kind.FATAL, "Gemini returned no text", null);
        }
        return response.aiMessage().text();
    }

    static SummarizationException.Kind classify(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof ResourceExhaustedException || current instanceof RateLimitException) {
                return SummarizationException.Kind.RATE_LIMITED;
            }
            if (current instanceof ApiException api
                && api.getStatusCode() != null
                && api.getStatusCode().getCode() == StatusCode.Code.RESOURCE_EXHAUSTED) {
                return SummarizationException.Kind.RATE_LIMITED;
            }
            if (current instanceof HttpException http && http.statusCode() == TOO_MANY_REQUESTS) {
                return SummarizationException.Kind.RATE_LIMITED;
            }
            String message = current.getMessage();
            if (message != null && RATE_LIMIT_MESSAGE.matcher(message).find()) {
                return SummarizationException.Kind.RATE_LIMITED;
            }
        }
        return SummarizationException.Kind.FATAL;
    }
}
