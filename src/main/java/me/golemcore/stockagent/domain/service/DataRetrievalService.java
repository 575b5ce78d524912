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
import me.golemcore.stockagent.domain.model.ConversationState;
import me.golemcore.stockagent.domain.model.RetrievalResult;
import me.golemcore.stockagent.domain.model.RetrievalSource;
import me.golemcore.stockagent.domain.model.ToolCallResult;
import me.golemcore.stockagent.domain.model.ToolGroup;
import me.golemcore.stockagent.domain.model.ToolRoundRequest;
import me.golemcore.stockagent.domain.model.ToolRoundResult;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the tool round of a data branch (fetch, conditional search or technical
 * signal) and shapes its tool outputs into a {@link RetrievalResult}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DataRetrievalService {

    static final String STOCK_LIST_KEY = "stock_list";
    static final int CONDITIONAL_RESULT_LIMIT = 10;

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private static final String FETCH_PROMPT = """
            너는 주식 데이터 조회 에이전트임. 질문과 배경지식을 보고 필요한 도구를 호출할 것.
            - 종목 티커는 배경지식의 names_to_tickers 값을 사용할 것.
            - 날짜는 YYYY-MM-DD 형식으로 전달할 것.
            - 휴장일이면 check_trading_date 결과의 직전 거래일을 사용할 것.
            """;

    private static final String CONDITIONAL_PROMPT = """
            너는 조건 검색 에이전트임. 가격, 거래량, 등락률 등 질문의 조건을 도구 인자로 옮겨서
            조건에 맞는 종목을 찾는 도구를 정확히 한 번 호출할 것.
            - 날짜는 YYYY-MM-DD 형식, 비율은 퍼센트 숫자로 전달할 것.
            - 시장 언급이 없으면 market은 ALL로 할 것.
            """;

    private static final String SIGNAL_PROMPT = """
            너는 기술적 분석 에이전트임. 볼린저 밴드, 골든/데드 크로스, RSI, 이동평균 이격도,
            거래량 급증 같은 신호 질문에 맞는 도구를 정확히 한 번 호출할 것.
            - 기간 질문은 start_date와 end_date, 단일 날짜 질문은 date를 사용할 것.
            """;

    static final String COMPARISON_HINT = """
            - 복수 종목명이 감지되었으므로 get_stock_comparison 도구 사용을 강력히 권장함.
            - 질문이 비교 분석을 요구하면 반드시 get_stock_comparison을 사용할 것.
            """;

    private final ToolCallingProtocol toolCallingProtocol;
    private final ObjectMapper objectMapper;

    public RetrievalResult retrieve(ConversationState state, RetrievalSource source) {
        String query = state.getQuery();
        String context = serializeContext(state.getBackgroundKnowledge());

        ToolRoundResult round = toolCallingProtocol.execute(ToolRoundRequest.builder()
                .systemPrompt(systemPrompt(state, source))
                .userPrompt("question: " + query + "\nbackground_knowledge: " + context)
                .toolNames(toolGroup(source).getToolNames())
                .sessionId(state.getSessionId())
                .credential(state.getCredential())
                .build());

        if (!round.isSuccess()) {
            log.error("[Tools] {} round failed: {}", source.getQueryType(), round.getError());
            Map<String, Object> parameters = new LinkedHashMap<>();
            parameters.put("query", query);
            parameters.put("context", context);
            return RetrievalResult.failure(source, parameters, round.getError());
        }

        RetrievalResult result = source == RetrievalSource.FETCH
                ? mergeFetchResults(query, round)
                : searchResult(query, source, round);
        log.info("[Tools] {} finished: {} result(s)", source.getQueryType(), result.getTotalCount());
        return result;
    }

    private RetrievalResult mergeFetchResults(String query, ToolRoundResult round) {
        Map<String, Object> merged = new LinkedHashMap<>();
        for (ToolCallResult callResult : safeList(round.getToolResults())) {
            if (callResult.isSuccess()) {
                merged.put(callResult.getToolName(), callResult.getResult());
            }
        }
        List<Map<String, Object>> results = new ArrayList<>();
        if (!merged.isEmpty()) {
            results.add(merged);
        }
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("query", query);
        return RetrievalResult.builder()
                .source(RetrievalSource.FETCH)
                .results(results)
                .totalCount(merged.size())
                .returnedCount(merged.size())
                .summary("주식 데이터 조회 완료: " + query)
                .parameters(parameters)
                .build();
    }

    private RetrievalResult searchResult(String query, RetrievalSource source, ToolRoundResult round) {
        Map<String, Object> payload = payloadOf(round.lastToolResult());
        List<Map<String, Object>> results = resultRows(payload.get("results"));
        int total = intValue(payload.get("total_count"), results.size());
        int returned = intValue(payload.get("returned_count"), results.size());

        boolean capped = source == RetrievalSource.CONDITIONAL;
        if (capped && results.size() > CONDITIONAL_RESULT_LIMIT) {
            results = new ArrayList<>(results.subList(0, CONDITIONAL_RESULT_LIMIT));
        }
        if (capped) {
            returned = Math.min(returned, CONDITIONAL_RESULT_LIMIT);
        }

        String summary;
        if (total == 0) {
            summary = "조건 '" + query + "'에 해당하는 종목이 없습니다.";
        } else {
            summary = "조건 '" + query + "'에 해당하는 종목 " + total + "개를 찾았습니다.";
            if (returned < total) {
                summary += " (상위 " + returned + "개 표시)";
            }
        }

        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("query", query);
        ToolCallResult last = round.lastToolResult();
        if (last != null && last.getArguments() != null) {
            parameters.put("arguments", last.getArguments());
        }
        return RetrievalResult.builder()
                .source(source)
                .results(results)
                .totalCount(total)
                .returnedCount(returned)
                .summary(summary)
                .parameters(parameters)
                .build();
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> payloadOf(ToolCallResult last) {
        if (last == null || !last.isSuccess() || last.getResult() == null) {
            return Map.of();
        }
        Object value = last.getResult();
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        if (value instanceof String text) {
            try {
                return objectMapper.readValue(JsonResponses.extractObject(text), MAP_TYPE);
            } catch (JsonProcessingException e) {
                log.warn("[Tools] Tool output is not a JSON object: {}", e.getOriginalMessage());
            }
        }
        return Map.of();
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> resultRows(Object value) {
        List<Map<String, Object>> rows = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof Map<?, ?> row) {
                    rows.add((Map<String, Object>) row);
                }
            }
        }
        return rows;
    }

    private static int intValue(Object value, int fallback) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text) {
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }

    private String systemPrompt(ConversationState state, RetrievalSource source) {
        return switch (source) {
        case FETCH -> hasMultipleTickers(state) ? FETCH_PROMPT + COMPARISON_HINT : FETCH_PROMPT;
        case CONDITIONAL -> CONDITIONAL_PROMPT;
        case SIGNAL -> SIGNAL_PROMPT;
        case QUIZ -> throw new IllegalArgumentException("Quiz turns do not retrieve market data");
        };
    }

    private static ToolGroup toolGroup(RetrievalSource source) {
        return switch (source) {
        case FETCH -> ToolGroup.FETCH;
        case CONDITIONAL -> ToolGroup.CONDITIONAL;
        case SIGNAL -> ToolGroup.SIGNAL;
        case QUIZ -> throw new IllegalArgumentException("Quiz turns do not retrieve market data");
        };
    }

    private static boolean hasMultipleTickers(ConversationState state) {
        Object tickers = state.getBackgroundKnowledge() == null
                ? null
                : state.getBackgroundKnowledge().get(PreprocessService.TICKERS_KEY);
        if (!(tickers instanceof Map<?, ?> map) || !(map.get(STOCK_LIST_KEY) instanceof List<?> stockList)) {
            return false;
        }
        // the hint only helps when at least one of the names resolved
        return stockList.size() > 1 && stockList.stream()
                .anyMatch(item -> item instanceof Map<?, ?> entry && entry.get("ticker") != null
                        && !String.valueOf(entry.get("ticker")).isBlank());
    }

    private String serializeContext(Map<String, Object> knowledge) {
        if (knowledge == null || knowledge.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(knowledge);
        } catch (JsonProcessingException e) {
            return String.valueOf(knowledge);
        }
    }

    private static <T> List<T> safeList(List<T> list) {
        return list != null ? list : List.of();
    }
}
