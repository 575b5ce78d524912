package me.golemcore.stockagent.adapter.outbound.llm;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import feign.FeignException;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import feign.RetryableException;
import feign.codec.DecodeException;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.stockagent.domain.model.CompletionException;
import me.golemcore.stockagent.domain.model.CompletionFailureKind;
import me.golemcore.stockagent.domain.model.CompletionRequest;
import me.golemcore.stockagent.domain.model.CompletionResponse;
import me.golemcore.stockagent.domain.model.Message;
import me.golemcore.stockagent.domain.model.ToolDefinition;
import me.golemcore.stockagent.infrastructure.config.AgentProperties;
import me.golemcore.stockagent.infrastructure.http.FeignClientFactory;
import me.golemcore.stockagent.port.outbound.CompletionPort;
import org.springframework.stereotype.Component;

import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Completion gateway for the CLOVA Studio chat-completions API (and any
 * OpenAI-compatible endpoint).
 *
 * <p>
 * Two response shapes are accepted: {@code {"result":{"message":{...}}}} and
 * {@code {"choices":[{"message":{...}}]}}. Tool calls may be listed under
 * {@code toolCalls} or {@code tool_calls}, with arguments either as a JSON
 * object or as JSON-encoded text.
 *
 * <p>
 * The Feign client is created lazily on first use, never retries, and uses
 * the configured completion timeout as its read timeout.
 *
 * @see FeignClientFactory
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ClovaCompletionAdapter implements CompletionPort {

    static final String REQUEST_ID_HEADER = "X-NCP-CLOVASTUDIO-REQUEST-ID";

    private final AgentProperties properties;
    private final FeignClientFactory feignClientFactory;
    private final ObjectMapper objectMapper;

    private volatile ClovaCompletionApi client;

    @Override
    public boolean isAvailable() {
        String apiUrl = properties.getCompletion().getApiUrl();
        return apiUrl != null && !apiUrl.isBlank();
    }

    @Override
    public CompletionResponse complete(CompletionRequest request) {
        ClovaCompletionApi api = ensureClient();
        ChatCompletionRequest body = buildRequest(request);

        JsonNode response;
        try {
            response = api.chatCompletion(request.getCredential(), request.getSessionId(), body);
        } catch (RetryableException e) {
            if (isTimeout(e)) {
                throw new CompletionException(CompletionFailureKind.TIMEOUT,
                        "Completion request timed out after " + properties.getCompletion().getTimeout(), e);
            }
            throw new CompletionException(CompletionFailureKind.TRANSPORT,
                    "Completion request failed: " + e.getMessage(), e);
        } catch (DecodeException e) {
            throw new CompletionException(CompletionFailureKind.MALFORMED_RESPONSE,
                    "Invalid API response: " + e.getMessage(), e);
        } catch (FeignException e) {
            if (e.status() >= 200 && e.status() < 300) {
                throw new CompletionException(CompletionFailureKind.MALFORMED_RESPONSE,
                        "Invalid API response: " + e.getMessage(), e);
            }
            throw new CompletionException(CompletionFailureKind.HTTP_STATUS,
                    "Completion service returned HTTP " + e.status(), e);
        }

        return convertResponse(response);
    }

    private ClovaCompletionApi ensureClient() {
        if (!isAvailable()) {
            throw new CompletionException(CompletionFailureKind.NOT_CONFIGURED,
                    "Completion API URL is not configured");
        }
        ClovaCompletionApi current = client;
        if (current == null) {
            synchronized (this) {
                current = client;
                if (current == null) {
                    AgentProperties.CompletionProperties config = properties.getCompletion();
                    String endpoint = config.getApiUrl() + (config.getPath() != null ? config.getPath() : "");
                    current = feignClientFactory.createSingleShot(ClovaCompletionApi.class, endpoint,
                            config.getConnectTimeout(), config.getTimeout());
                    client = current;
                    log.info("[Completion] Client initialized for {}", endpoint);
                }
            }
        }
        return current;
    }

    private ChatCompletionRequest buildRequest(CompletionRequest request) {
        AgentProperties.CompletionProperties config = properties.getCompletion();
        ChatCompletionRequest apiRequest = new ChatCompletionRequest();
        apiRequest.setTemperature(config.getTemperature());
        apiRequest.setMaxTokens(config.getMaxTokens());
        apiRequest.setMessages(request.getMessages().stream().map(this::toApiMessage).toList());
        if (request.hasTools()) {
            apiRequest.setTools(request.getTools().stream().map(ClovaCompletionAdapter::toApiTool).toList());
        }
        return apiRequest;
    }

    private ApiMessage toApiMessage(Message message) {
        ApiMessage apiMessage = new ApiMessage();
        apiMessage.setRole(message.getRole());
        apiMessage.setContent(message.getContent() != null ? message.getContent() : "");
        apiMessage.setToolCallId(message.getToolCallId());
        if (message.hasToolCalls()) {
            apiMessage.setToolCalls(message.getToolCalls().stream().map(toolCall -> {
                ApiFunction function = new ApiFunction();
                function.setName(toolCall.getName());
                function.setArguments(argumentsAsText(toolCall));
                ApiToolCall apiToolCall = new ApiToolCall();
                apiToolCall.setId(toolCall.getId());
                apiToolCall.setType("function");
                apiToolCall.setFunction(function);
                return apiToolCall;
            }).toList());
        }
        return apiMessage;
    }

    private static ApiTool toApiTool(ToolDefinition definition) {
        ApiToolFunction function = new ApiToolFunction();
        function.setName(definition.getName());
        function.setDescription(definition.getDescription());
        function.setParameters(definition.getInputSchema());
        ApiTool tool = new ApiTool();
        tool.setType("function");
        tool.setFunction(function);
        return tool;
    }

    private String argumentsAsText(Message.ToolCall toolCall) {
        if (toolCall.getRawArguments() != null) {
            return toolCall.getRawArguments();
        }
        if (toolCall.getArguments() == null || toolCall.getArguments().isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(toolCall.getArguments());
        } catch (JsonProcessingException e) {
            return "{}";
        }
    }

    CompletionResponse convertResponse(JsonNode response) {
        JsonNode message = null;
        String finishReason = null;
        if (response != null && response.path("result").path("message").isObject()) {
            message = response.path("result").path("message");
            finishReason = textOrNull(response.path("result").get("finishReason"));
        } else if (response != null && response.path("choices").isArray() && !response.path("choices").isEmpty()) {
            JsonNode choice = response.path("choices").get(0);
            if (choice.path("message").isObject()) {
                message = choice.path("message");
                finishReason = textOrNull(choice.get("finish_reason"));
            }
        }
        if (message == null) {
            throw new CompletionException(CompletionFailureKind.MALFORMED_RESPONSE, "Invalid API response");
        }

        JsonNode toolCallsNode = message.has("toolCalls") ? message.get("toolCalls") : message.get("tool_calls");
        List<Message.ToolCall> toolCalls = null;
        if (toolCallsNode != null && toolCallsNode.isArray() && !toolCallsNode.isEmpty()) {
            toolCalls = new ArrayList<>();
            for (JsonNode callNode : toolCallsNode) {
                toolCalls.add(convertToolCall(callNode));
            }
        }

        return CompletionResponse.builder()
                .content(textOrNull(message.get("content")))
                .toolCalls(toolCalls)
                .finishReason(finishReason)
                .build();
    }

    @SuppressWarnings("unchecked")
    private Message.ToolCall convertToolCall(JsonNode callNode) {
        JsonNode function = callNode.path("function");
        JsonNode arguments = function.get("arguments");
        Message.ToolCall.ToolCallBuilder builder = Message.ToolCall.builder()
                .id(textOrNull(callNode.get("id")))
                .name(textOrNull(function.get("name")));
        if (arguments == null || arguments.isNull()) {
            builder.arguments(Map.of());
        } else if (arguments.isObject()) {
            builder.arguments(objectMapper.convertValue(arguments, Map.class));
        } else {
            builder.rawArguments(arguments.asText());
        }
        return builder.build();
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }

    private static boolean isTimeout(Throwable error) {
        Throwable cursor = error;
        while (cursor != null) {
            if (cursor instanceof SocketTimeoutException || cursor instanceof InterruptedIOException) {
                return true;
            }
            cursor = cursor.getCause() == cursor ? null : cursor.getCause();
        }
        return false;
    }

    // Feign API interface
    public interface ClovaCompletionApi {
        @RequestLine("POST")
        @Headers({
                "Content-Type: application/json",
                "Authorization: Bearer {credential}",
                REQUEST_ID_HEADER + ": {requestId}"
        })
        JsonNode chatCompletion(@Param("credential") String credential, @Param("requestId") String requestId,
                ChatCompletionRequest request);
    }

    // API DTOs
    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ChatCompletionRequest {
        private List<ApiMessage> messages;
        private List<ApiTool> tools;
        private double temperature;
        @JsonProperty("max_tokens")
        private Integer maxTokens;
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ApiMessage {
        private String role;
        private String content;
        @JsonProperty("tool_calls")
        private List<ApiToolCall> toolCalls;
        @JsonProperty("tool_call_id")
        private String toolCallId;
    }

    @Data
    public static class ApiTool {
        private String type;
        private ApiToolFunction function;
    }

    @Data
    public static class ApiToolFunction {
        private String name;
        private String description;
        private Map<String, Object> parameters;
    }

    @Data
    public static class ApiToolCall {
        private String id;
        private String type;
        private ApiFunction function;
    }

    @Data
    public static class ApiFunction {
        private String name;
        private String arguments;
    }
}
