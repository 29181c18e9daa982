package com.phonepe.memsight.models;

import com.phonepe.memsight.core.utils.EnvLoader;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;

/**
 * Connection settings for any server that speaks the OpenAI REST dialect (OpenAI, Azure, Ollama, vLLM etc.)
 */
@Value
@Builder
@Jacksonized
public class OpenAICompatibleClientConfig {
    public static final String DEFAULT_BASE_URL = "http://localhost:11434/v1";
    public static final String DEFAULT_EMBEDDING_MODEL = "nomic-embed-text";
    public static final String DEFAULT_CHAT_MODEL = "qwen2.5:3b";

    @Builder.Default
    String baseUrl = DEFAULT_BASE_URL;

    /**
     * Sent as a bearer token when set. Local servers usually need none
     */
    String apiKey;

    @Builder.Default
    String embeddingModel = DEFAULT_EMBEDDING_MODEL;

    @Builder.Default
    String chatModel = DEFAULT_CHAT_MODEL;

    @Builder.Default
    Duration timeout = Duration.ofSeconds(30);

    public static OpenAICompatibleClientConfig fromEnv() {
        return OpenAICompatibleClientConfig.builder()
                .baseUrl(EnvLoader.readEnv("MEMSIGHT_OPENAI_BASE_URL", DEFAULT_BASE_URL).orElseThrow())
                .apiKey(EnvLoader.readEnv("MEMSIGHT_OPENAI_API_KEY", null).orElse(null))
                .embeddingModel(EnvLoader.readEnv("MEMSIGHT_EMBEDDING_MODEL", DEFAULT_EMBEDDING_MODEL).orElseThrow())
                .chatModel(EnvLoader.readEnv("MEMSIGHT_CHAT_MODEL", DEFAULT_CHAT_MODEL).orElseThrow())
                .build();
    }
}
