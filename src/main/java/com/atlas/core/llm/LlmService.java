package com.atlas.core.llm;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Thin wrapper around Spring AI's {@link ChatClient}: one request, one response.
 * <p>
 * Wire-level concerns live here: sending the prompt, rejecting empty content,
 * extracting the embedded JSON object and mapping it onto a target type. Callers
 * decide what to do when any of that fails; this class never retries.
 */
@Service
public class LlmService {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private final ChatClient chatClient;
    private final LlmProperties properties;
    private final ObjectMapper mapper;

    public LlmService(ChatClient.Builder builder, LlmProperties properties,
                      @Value("${spring.ai.openai.base-url:NOT_SET}") String baseUrl) {
        this.chatClient = builder.build();
        this.properties = properties;
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true)
                .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true)
                .registerModule(new ParameterNamesModule());
        log.info("LlmService initialized - OpenAI base-url: {}", baseUrl);
    }

    /**
     * Sends a prompt and returns the raw text content of the reply.
     *
     * @param systemPrompt instructions for the model, or null for none
     * @param userPrompt   the user turn
     * @param maxTokens    completion token cap
     * @return non-blank response text
     * @throws LlmEmptyResponseException if the model returned no content
     */
    public String call(String systemPrompt, String userPrompt, int maxTokens) {
        long start = System.currentTimeMillis();
        var options = ChatOptions.builder().maxTokens(maxTokens);
        if (properties.hasModelOverride()) {
            options.model(properties.getModel());
        }
        var request = chatClient.prompt();
        if (systemPrompt != null) {
            request = request.system(systemPrompt);
        }
        String response = request
                .user(userPrompt)
                .options(options.build())
                .call()
                .content();
        long elapsed = System.currentTimeMillis() - start;
        log.info("LLM call complete ({}s)", String.format("%.1f", elapsed / 1000.0));
        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException("LLM returned empty content. Check that the model is running.");
        }
        return response;
    }

    /**
     * Sends a prompt whose reply is expected to contain a single JSON object and
     * maps that object onto {@code outputType}.
     *
     * @throws LlmEmptyResponseException if the model returned no content
     * @throws LlmParseException         if no JSON object was found or it did not parse
     */
    public <T> T structuredCall(String systemPrompt, String userPrompt, int maxTokens, Class<T> outputType) {
        String response = call(systemPrompt, userPrompt, maxTokens);
        String json = JsonExtractor.extractObject(response).orElseThrow(() -> {
            log.debug("Raw LLM response without JSON: {}", response);
            return new LlmParseException("No JSON object found in LLM response for " + outputType.getSimpleName());
        });
        try {
            return mapper.readValue(json, outputType);
        } catch (Exception e) {
            log.debug("Unparseable LLM JSON: {}", json);
            throw new LlmParseException("Failed to parse LLM response to " + outputType.getSimpleName()
                    + ": " + e.getMessage(), e);
        }
    }
}
