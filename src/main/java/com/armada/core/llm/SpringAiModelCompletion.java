package com.armada.core.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.ChatOptions;

/**
 * {@link ModelCompletion} backed by Spring AI's {@link ChatClient}.
 */
public class SpringAiModelCompletion implements ModelCompletion {

    private static final Logger log = LoggerFactory.getLogger(SpringAiModelCompletion.class);

    private final ChatClient chatClient;
    private final String provider;

    public SpringAiModelCompletion(ChatClient chatClient, String provider) {
        this.chatClient = chatClient;
        this.provider = provider;
    }

    @Override
    public String provider() {
        return provider;
    }

    @Override
    public CompletionResponse complete(CompletionRequest request) {
        log.debug("Model call started ({} prompt chars)", request.prompt().length());
        long start = System.currentTimeMillis();

        var spec = chatClient.prompt();
        if (request.systemPrompt() != null && !request.systemPrompt().isBlank()) {
            spec = spec.system(request.systemPrompt());
        }
        ChatOptions.Builder options = ChatOptions.builder();
        if (request.maxTokens() != null) {
            options.maxTokens(request.maxTokens());
        }
        if (request.temperature() != null) {
            options.temperature(request.temperature());
        }
        if (!request.stopSequences().isEmpty()) {
            options.stopSequences(request.stopSequences());
        }
        ChatResponse response = spec.user(request.prompt()).options(options.build()).call().chatResponse();

        Generation generation = response != null ? response.getResult() : null;
        String content = generation != null && generation.getOutput() != null ? generation.getOutput().getText() : null;
        if (content == null || content.isBlank()) {
            throw new ModelEmptyResponseException("Model returned empty content from provider " + provider);
        }

        CompletionUsage usage = CompletionUsage.NONE;
        String model = null;
        if (response.getMetadata() != null) {
            model = response.getMetadata().getModel();
            Usage reported = response.getMetadata().getUsage();
            if (reported != null) {
                long prompt = reported.getPromptTokens() != null ? reported.getPromptTokens() : 0;
                long completion = reported.getCompletionTokens() != null ? reported.getCompletionTokens() : 0;
                usage = CompletionUsage.of(prompt, completion);
            }
        }
        String finishReason = generation.getMetadata() != null ? generation.getMetadata().getFinishReason() : null;

        log.info("Model call complete ({}s, {} tokens)",
                String.format("%.1f", (System.currentTimeMillis() - start) / 1000.0), usage.totalTokens());
        return new CompletionResponse(content, usage, finishReason, model);
    }
}
