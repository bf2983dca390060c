package com.healloop.core.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "healloop.llm")
public class LlmProperties {

    private long timeoutSeconds = 60;
    private int contextChars = 1000;
    private String systemPrompt = "You are the planning brain of a self-healing tool execution engine. "
            + "When a JSON object is requested, answer with that JSON object only.";

    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(long timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public int getContextChars() {
        return contextChars;
    }

    public void setContextChars(int contextChars) {
        this.contextChars = contextChars;
    }

    public String getSystemPrompt() {
        return systemPrompt;
    }

    public void setSystemPrompt(String systemPrompt) {
        this.systemPrompt = systemPrompt;
    }
}
