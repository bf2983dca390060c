package com.healloop.core.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Default {@link Oracle} backed by Spring AI's {@link ChatClient}.
 * <p>
 * Sends the configured system prompt plus the caller's prompt and returns the raw
 * content. JSON extraction is left to {@link OracleResponseParser} so every call site
 * applies the same fence-stripping and lenient parsing rules.
 */
@Service
public class LlmService implements Oracle {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private final ChatClient chatClient;
    private final LlmProperties properties;

    public LlmService(ChatClient.Builder builder, LlmProperties properties,
                      @Value("${spring.ai.openai.base-url:NOT_SET}") String baseUrl) {
        this.chatClient = builder.build();
        this.properties = properties;
        log.info("LlmService initialized — OpenAI base-url: {}", baseUrl);
    }

    @Override
    public String invoke(String prompt) {
        log.info("LLM call started ({} chars)", prompt.length());
        long start = System.currentTimeMillis();
        String response = chatClient.prompt()
                .system(properties.getSystemPrompt())
                .user(prompt)
                .call()
                .content();
        long elapsed = System.currentTimeMillis() - start;
        log.info("LLM call complete ({}s)", String.format("%.1f", elapsed / 1000.0));
        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException("LLM returned empty content. "
                    + "Check that the model is running and reachable.");
        }
        return response;
    }
}
