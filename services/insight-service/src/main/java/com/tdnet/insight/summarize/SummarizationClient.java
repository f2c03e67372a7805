package com.tdnet.insight.summarize;

/**
 * One call to the generative model. Implementations throw {@link SummarizationException} with the failure
 * classified, never retry on their own.
 */
public interface SummarizationClient {

    String summarize(String systemPrompt, String userPrompt, String content);
}
