package com.chatgateway.providers.chat;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Token counts reported by the backend, when it reports them.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Usage {

    private final Integer promptTokens;
    private final Integer completionTokens;

    public Usage(Integer promptTokens, Integer completionTokens) {
        this.promptTokens = promptTokens;
        this.completionTokens = completionTokens;
    }

    public static Usage unknown() {
        return new Usage(null, null);
    }

    public Integer getPromptTokens() {
        return promptTokens;
    }

    public Integer getCompletionTokens() {
        return completionTokens;
    }

    @Override
    public String toString() {
        return "Usage{prompt=" + promptTokens + ", completion=" + completionTokens + "}";
    }
}
