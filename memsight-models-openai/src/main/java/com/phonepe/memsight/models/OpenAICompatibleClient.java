package com.phonepe.memsight.models;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Strings;
import com.phonepe.memsight.core.errors.ErrorType;
import com.phonepe.memsight.core.errors.MemsightError;
import com.phonepe.memsight.core.errors.MemsightException;
import com.phonepe.memsight.core.utils.JsonUtils;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Minimal JSON-over-HTTP client for OpenAI style endpoints. Shared by the embedding model, the classifier and the
 * conflict judge.
 */
@Slf4j
public class OpenAICompatibleClient {
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final int MAX_ERROR_BODY = 256;

    private final OpenAICompatibleClientConfig config;
    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;

    public OpenAICompatibleClient(OpenAICompatibleClientConfig config) {
        this(config, null, null);
    }

    public OpenAICompatibleClient(@NonNull OpenAICompatibleClientConfig config,
                                  OkHttpClient httpClient,
                                  ObjectMapper mapper) {
        this.config = config;
        this.httpClient = Objects.requireNonNullElseGet(
                httpClient,
                () -> new OkHttpClient.Builder()
                        .callTimeout(config.getTimeout())
                        .build());
        this.mapper = Objects.requireNonNullElseGet(mapper, JsonUtils::createMapper);
    }

    public OpenAICompatibleClientConfig config() {
        return config;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    /**
     * Run a chat completion that must answer with a JSON object
     *
     * @return the parsed object, empty when the model answered with nothing or with something other than JSON
     */
    public Optional<JsonNode> chatJson(@NonNull String systemPrompt, @NonNull String userContent) {
        final var response = post("/chat/completions", Map.of(
                "model", config.getChatModel(),
                "temperature", 0,
                "response_format", Map.of("type", "json_object"),
                "messages", List.of(Map.of("role", "system", "content", systemPrompt),
                                    Map.of("role", "user", "content", userContent))));
        final var content = response.path("choices").path(0).path("message").path("content").asText("");
        if (Strings.isNullOrEmpty(content)) {
            log.warn("Empty completion from model {}", config.getChatModel());
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readTree(content));
        }
        catch (JsonProcessingException e) {
            log.warn("Model {} did not return JSON: {}", config.getChatModel(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * POST a JSON body to a path under the base url and return the parsed response.
     *
     * @throws MemsightException with {@link ErrorType#MODEL_CALL_HTTP_FAILURE} for transport errors and non 2xx
     *                           responses
     */
    public JsonNode post(@NonNull String path, @NonNull Object body) {
        final byte[] payload;
        try {
            payload = mapper.writeValueAsBytes(body);
        }
        catch (JsonProcessingException e) {
            throw new MemsightException(MemsightError.error(ErrorType.SERIALIZATION_ERROR, e.getMessage()), e);
        }
        final var requestBuilder = new Request.Builder()
                .url(StringUtils.removeEnd(config.getBaseUrl(), "/") + path)
                .post(RequestBody.create(payload, JSON));
        if (!Strings.isNullOrEmpty(config.getApiKey())) {
            requestBuilder.header("Authorization", "Bearer " + config.getApiKey());
        }
        try (final var response = httpClient.newCall(requestBuilder.build()).execute()) {
            final var responseBody = response.body();
            final var bodyStr = null == responseBody ? "" : responseBody.string();
            if (!response.isSuccessful()) {
                log.warn("Call to {} failed with status {}", path, response.code());
                throw new MemsightException(MemsightError.error(
                        ErrorType.MODEL_CALL_HTTP_FAILURE,
                        "status %d: %s".formatted(response.code(), StringUtils.abbreviate(bodyStr, MAX_ERROR_BODY))));
            }
            return mapper.readTree(bodyStr);
        }
        catch (JsonProcessingException e) {
            throw new MemsightException(MemsightError.error(ErrorType.DESERIALIZATION_ERROR, e.getMessage()), e);
        }
        catch (IOException e) {
            throw new MemsightException(MemsightError.error(ErrorType.MODEL_CALL_HTTP_FAILURE, e.getMessage()), e);
        }
    }
}
