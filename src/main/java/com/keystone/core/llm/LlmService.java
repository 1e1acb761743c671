package com.keystone.core.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.stereotype.Service;

/**
 * Turns a prompt into a typed record through Spring AI's {@link ChatClient}.
 * <p>
 * {@link BeanOutputConverter} supplies the JSON schema appended to the user prompt and
 * does the first parse. Replies it rejects get a second, lenient Jackson pass that also
 * unwraps markdown fences. Every call carries its own sampling temperature because the
 * orchestrator raises it on each retry of a node.
 */
@Service
public class LlmService {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private final ChatClient chatClient;
    private final LlmProperties properties;
    private final ObjectMapper lenientMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true)
            .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true)
            .registerModule(new ParameterNamesModule());

    public LlmService(ChatClient.Builder builder, LlmProperties properties) {
        this.chatClient = builder.build();
        this.properties = properties;
        log.info("LlmService initialized, provider: {}, model: {}", properties.getProvider(),
                properties.getModel().isBlank() ? "(default)" : properties.getModel());
    }

    /**
     * Sends a system + user prompt and returns the reply as {@code outputType}.
     *
     * @param temperature sampling temperature for this call only
     * @throws LlmEmptyResponseException if the model returns no content
     * @throws LlmParseException         if neither parser accepts the reply
     */
    public <T> T structuredCall(String systemPrompt, String userPrompt, Class<T> outputType, double temperature) {
        String target = outputType.getSimpleName();
        log.info("LLM call started → {} (temperature {})", target, temperature);
        long start = System.currentTimeMillis();
        var converter = new BeanOutputConverter<>(outputType);
        String response = chatClient.prompt()
                .system(systemPrompt)
                .user(userPrompt + "\n\n" + converter.getFormat())
                .options(options(temperature))
                .call()
                .content();
        log.info("LLM call complete → {} ({}s)", target, String.format("%.1f", (System.currentTimeMillis() - start) / 1000.0));

        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException(outputType);
        }
        try {
            return converter.convert(response);
        } catch (RuntimeException e) {
            log.warn("Schema parse of {} failed, trying lenient parse: {}", target, e.getMessage());
            log.debug("Raw LLM response: {}", response);
            return parseLeniently(response, outputType);
        }
    }

    private ChatOptions options(double temperature) {
        var builder = ChatOptions.builder().temperature(temperature);
        if (!properties.getModel().isBlank()) {
            builder.model(properties.getModel());
        }
        return builder.build();
    }

    private <T> T parseLeniently(String reply, Class<T> outputType) {
        try {
            return lenientMapper.readValue(stripFence(reply), outputType);
        } catch (JsonProcessingException e) {
            log.error("Lenient parse of {} failed: {}", outputType.getSimpleName(), e.getOriginalMessage());
            throw new LlmParseException(outputType, reply, e);
        }
    }

    /**
     * Removes a surrounding markdown code fence, with or without a {@code json} tag.
     */
    static String stripFence(String reply) {
        String cleaned = reply.strip();
        if (cleaned.startsWith("```")) {
            int firstLineEnd = cleaned.indexOf('\n');
            cleaned = firstLineEnd < 0 ? cleaned.substring(3) : cleaned.substring(firstLineEnd + 1);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        return cleaned.strip();
    }
}
