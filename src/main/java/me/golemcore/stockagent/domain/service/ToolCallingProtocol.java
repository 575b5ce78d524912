package me.golemcore.stockagent.domain.service;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.stockagent.domain.model.CompletionException;
import me.golemcore.stockagent.domain.model.CompletionFailureKind;
import me.golemcore.stockagent.domain.model.CompletionRequest;
import me.golemcore.stockagent.domain.model.CompletionResponse;
import me.golemcore.stockagent.domain.model.Message;
import me.golemcore.stockagent.domain.model.ToolCallResult;
import me.golemcore.stockagent.domain.model.ToolFailureKind;
import me.golemcore.stockagent.domain.model.ToolResult;
import me.golemcore.stockagent.domain.model.ToolRoundRequest;
import me.golemcore.stockagent.domain.model.ToolRoundResult;
import me.golemcore.stockagent.port.outbound.CompletionPort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Runs one tool round: a single completion call, then a sequential pass over
 * the tool calls the model requested, in the order requested.
 *
 * <p>
 * The round never makes a second completion call. The transcript returned in
 * {@link ToolRoundResult#getTranscript()} holds the assistant tool-request turn
 * and one tool turn per call, for callers that want to continue the
 * conversation themselves.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ToolCallingProtocol {

    static final String AGGREGATE_ERROR_PREFIX = "도구 실행 실패: ";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final CompletionPort completionPort;
    private final ToolRegistry toolRegistry;
    private final ObjectMapper objectMapper;

    public ToolRoundResult execute(ToolRoundRequest roundRequest) {
        List<Message> transcript = new ArrayList<>();
        if (roundRequest.getSystemPrompt() != null) {
            transcript.add(Message.system(roundRequest.getSystemPrompt()));
        }
        transcript.add(Message.user(roundRequest.getUserPrompt()));
        if (roundRequest.getFeedback() != null && !roundRequest.getFeedback().isBlank()) {
            transcript.add(Message.user(roundRequest.getFeedback()));
        }

        CompletionRequest request = CompletionRequest.builder()
                .messages(List.copyOf(transcript))
                .tools(toolRegistry.definitions(roundRequest.getToolNames()))
                .sessionId(roundRequest.getSessionId())
                .credential(roundRequest.getCredential())
                .build();

        CompletionResponse response;
        try {
            response = completionPort.complete(request);
        } catch (CompletionException e) {
            log.warn("[Tools] Completion call failed ({}): {}", e.getKind(), e.getMessage());
            return protocolFailure(transcript, e.getKind(), e.getMessage());
        }

        if (!response.hasToolCalls()) {
            if (response.getContent() == null) {
                return protocolFailure(transcript, CompletionFailureKind.MALFORMED_RESPONSE,
                        "Response has neither tool calls nor content");
            }
            transcript.add(response.toAssistantMessage());
            return ToolRoundResult.builder()
                    .success(true)
                    .finalResponse(response.getContent())
                    .toolResults(List.of())
                    .transcript(transcript)
                    .build();
        }

        transcript.add(response.toAssistantMessage());
        List<ToolCallResult> results = new ArrayList<>();
        for (Message.ToolCall toolCall : response.getToolCalls()) {
            ToolCallResult callResult = executeCall(toolCall);
            results.add(callResult);
            transcript.add(Message.builder()
                    .role(Message.ROLE_TOOL)
                    .toolCallId(toolCall.getId())
                    .toolName(toolCall.getName())
                    .content(toolMessageContent(callResult))
                    .build());
        }

        List<ToolCallResult> failures = results.stream().filter(r -> !r.isSuccess()).toList();
        boolean success = failures.isEmpty();
        String error = success ? null
                : AGGREGATE_ERROR_PREFIX + failures.stream()
                        .map(r -> r.getToolName() + ": " + r.describe())
                        .collect(Collectors.joining("; "));
        if (success) {
            log.info("[Tools] Round completed: {} tool call(s) succeeded", results.size());
        } else {
            log.warn("[Tools] Round completed with {} failed call(s) of {}", failures.size(), results.size());
        }

        return ToolRoundResult.builder()
                .success(success)
                .finalResponse(response.getContent())
                .toolResults(results)
                .transcript(transcript)
                .error(error)
                .build();
    }

    private ToolCallResult executeCall(Message.ToolCall toolCall) {
        Map<String, Object> arguments;
        try {
            arguments = resolveArguments(toolCall);
        } catch (JsonProcessingException e) {
            return ToolCallResult.builder()
                    .toolCallId(toolCall.getId())
                    .toolName(toolCall.getName())
                    .arguments(Map.of())
                    .success(false)
                    .error("Invalid arguments: " + e.getOriginalMessage())
                    .build();
        }

        Message.ToolCall resolved = Message.ToolCall.builder()
                .id(toolCall.getId())
                .name(toolCall.getName())
                .arguments(arguments)
                .build();
        ToolResult result = toolRegistry.execute(resolved);
        if (!result.isSuccess() && result.getFailureKind() != ToolFailureKind.EXECUTION_FAILED) {
            log.warn("[Tools] {} rejected: {}", toolCall.getName(), result.getError());
        }

        return ToolCallResult.builder()
                .toolCallId(toolCall.getId())
                .toolName(toolCall.getName())
                .arguments(arguments)
                .success(result.isSuccess())
                .result(result.isSuccess() ? (result.getData() != null ? result.getData() : result.getOutput()) : null)
                .error(result.getError())
                .build();
    }

    private Map<String, Object> resolveArguments(Message.ToolCall toolCall) throws JsonProcessingException {
        if (toolCall.getArguments() != null) {
            return toolCall.getArguments();
        }
        String raw = toolCall.getRawArguments();
        if (raw == null || raw.isBlank()) {
            return Map.of();
        }
        return objectMapper.readValue(raw, MAP_TYPE);
    }

    private String toolMessageContent(ToolCallResult callResult) {
        Object payload = callResult.isSuccess()
                ? callResult.getResult()
                : Map.of("error", callResult.describe());
        if (payload instanceof String text) {
            return text;
        }
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            return String.valueOf(payload);
        }
    }

    private ToolRoundResult protocolFailure(List<Message> transcript, CompletionFailureKind kind, String message) {
        return ToolRoundResult.builder()
                .success(false)
                .toolResults(List.of())
                .transcript(transcript)
                .error(message)
                .completionFailure(kind)
                .build();
    }
}
