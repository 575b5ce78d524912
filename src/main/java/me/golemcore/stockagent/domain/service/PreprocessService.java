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
import me.golemcore.stockagent.domain.model.ConversationState;
import me.golemcore.stockagent.domain.model.Message;
import me.golemcore.stockagent.domain.model.ToolCallResult;
import me.golemcore.stockagent.domain.model.ToolGroup;
import me.golemcore.stockagent.domain.model.ToolResult;
import me.golemcore.stockagent.domain.model.ToolRoundRequest;
import me.golemcore.stockagent.domain.model.ToolRoundResult;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Builds the background-knowledge map for a query: trading-date check for an
 * explicit date and ticker resolution for mentioned company names.
 *
 * <p>
 * Direct tool calls are tried first. If one of them fails, a single tool round
 * lets the model drive the same two tools; if that fails too, the map stays
 * empty. Preprocessing never fails the turn.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PreprocessService {

    static final String TRADING_DATE_KEY = "check_trading_date";
    static final String TICKERS_KEY = "names_to_tickers";
    static final String TICKERS_TOOL = "names_to_ticker";

    private static final Set<String> NO_NAMES = Set.of("없음", "", "None", "null", "[]");
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private static final String NAMES_PROMPT = """
            질문에 언급된 주식 종목명을 모두 추출해서 JSON 배열로만 답할 것. 예: ["삼성전자", "SK하이닉스"]
            종목명이 없으면 "없음"이라고 답할 것.
            """;

    private static final String FALLBACK_PROMPT = """
            너는 주식 질문 전처리 에이전트임. 질문에 날짜가 있으면 check_trading_date를,
            종목명이 있으면 names_to_ticker를 호출할 것.
            """;

    private final ToolRegistry toolRegistry;
    private final ToolCallingProtocol toolCallingProtocol;
    private final TextCompletionService textCompletionService;
    private final ObjectMapper objectMapper;

    public Map<String, Object> preprocess(ConversationState state) {
        String query = state.getQuery();
        try {
            Map<String, Object> knowledge = new LinkedHashMap<>();

            Optional<String> date = QueryDates.extract(query);
            if (date.isPresent()) {
                log.info("[Router] Checking trading date {}", date.get());
                knowledge.put(TRADING_DATE_KEY, invokeDirect(TRADING_DATE_KEY, Map.of("date", date.get())));
            }

            List<String> names = extractStockNames(state);
            if (!names.isEmpty()) {
                log.info("[Router] Resolving stock names {}", names);
                knowledge.put(TICKERS_KEY, invokeDirect(TICKERS_TOOL, Map.of("names", names)));
            }
            return knowledge;
        } catch (PreprocessException e) {
            log.warn("[Router] Direct preprocessing failed ({}), falling back to a tool round", e.getMessage());
            return preprocessWithToolRound(state);
        }
    }

    List<String> extractStockNames(ConversationState state) {
        String text;
        try {
            text = textCompletionService.complete(NAMES_PROMPT, "질문: " + state.getQuery(),
                    state.getSessionId(), state.getCredential());
        } catch (CompletionException e) {
            log.warn("[Router] Stock name extraction failed: {}", e.getMessage());
            return List.of();
        }
        return parseStockNames(text);
    }

    /**
     * Accepts a JSON array, a comma-separated list or a single name. Marker
     * answers such as {@code 없음} or {@code null} mean no names.
     */
    List<String> parseStockNames(String text) {
        String trimmed = text == null ? "" : text.trim();
        if (NO_NAMES.contains(trimmed)) {
            return List.of();
        }
        if (trimmed.startsWith("[")) {
            try {
                return objectMapper.readValue(trimmed, STRING_LIST).stream()
                        .map(String::trim)
                        .filter(name -> !name.isEmpty())
                        .toList();
            } catch (JsonProcessingException e) {
                log.debug("[Router] Stock names are not a JSON array: {}", trimmed);
            }
        }
        if (trimmed.contains(",")) {
            return Arrays.stream(trimmed.split(","))
                    .map(String::trim)
                    .filter(name -> !name.isEmpty())
                    .toList();
        }
        return List.of(trimmed);
    }

    private Object invokeDirect(String toolName, Map<String, Object> arguments) {
        ToolResult result = toolRegistry.execute(Message.ToolCall.builder()
                .id("preprocess-" + UUID.randomUUID())
                .name(toolName)
                .arguments(arguments)
                .build());
        if (!result.isSuccess()) {
            throw new PreprocessException(toolName + ": " + result.getError());
        }
        return result.getData() != null ? result.getData() : result.getOutput();
    }

    private Map<String, Object> preprocessWithToolRound(ConversationState state) {
        ToolRoundResult round = toolCallingProtocol.execute(ToolRoundRequest.builder()
                .systemPrompt(FALLBACK_PROMPT)
                .userPrompt(state.getQuery())
                .toolNames(ToolGroup.PREPROCESS.getToolNames())
                .sessionId(state.getSessionId())
                .credential(state.getCredential())
                .build());
        if (!round.isSuccess()) {
            log.error("[Router] Preprocessing tool round failed: {}", round.getError());
            return new LinkedHashMap<>();
        }

        Map<String, Object> knowledge = new LinkedHashMap<>();
        for (ToolCallResult callResult : round.getToolResults()) {
            String key = TICKERS_TOOL.equals(callResult.getToolName()) ? TICKERS_KEY : callResult.getToolName();
            knowledge.put(key, callResult.getResult());
        }
        return knowledge;
    }

    private static final class PreprocessException extends RuntimeException {
        private static final long serialVersionUID = 1L;

        private PreprocessException(String message) {
            super(message);
        }
    }
}
