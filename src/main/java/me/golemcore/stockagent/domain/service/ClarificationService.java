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
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.stockagent.domain.model.ClarificationAction;
import me.golemcore.stockagent.domain.model.ClarificationRecord;
import me.golemcore.stockagent.domain.model.CompletenessAnalysis;
import me.golemcore.stockagent.domain.model.CompletionException;
import me.golemcore.stockagent.domain.model.ConversationState;
import me.golemcore.stockagent.domain.model.InformationCompleteness;
import me.golemcore.stockagent.domain.model.MissingInformationType;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Locale;

/**
 * Handles queries classified as ambiguous: analyses what is missing, then
 * either drafts a follow-up question for the user or rewrites the query into
 * an explicit, dated, scoped form.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ClarificationService {

    private static final String ANALYSIS_PROMPT = """
            주식 질문의 정보 완성도를 분석하고 JSON으로만 답할 것.
            {"has_stock_name": bool, "has_specific_date": bool, "has_relative_time": bool,
             "has_metrics": bool, "has_conditions": bool,
             "missing_information_type": "STOCK_NAME|SPECIFIC_DATE|TIME_PERIOD|NONE",
             "information_completeness": "COMPLETE|PARTIAL|AMBIGUOUS"}
            """;

    private static final String ASK_USER_PROMPT = """
            사용자 질문에 부족한 정보를 묻는 짧고 친절한 재질의 문장을 만들 것.
            JSON으로만 답할 것: {"clarification_message": "..."}
            """;

    private static final String SELF_CLARIFY_PROMPT = """
            애매한 주식 질문을 바로 조회 가능한 구체적인 질문으로 바꿀 것. 상대적 날짜는 오늘 날짜 기준으로 계산할 것.
            JSON으로만 답할 것:
            {"specific_question": "...", "start_date": "YYYY-MM-DD", "end_date": "YYYY-MM-DD",
             "market_scope": "KOSPI|KOSDAQ|ALL", "primary_criteria": "...", "secondary_criteria": "..."}
            """;

    private final TextCompletionService textCompletionService;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public CompletenessAnalysis analyze(ConversationState state) {
        String query = state.getQuery();
        try {
            String response = textCompletionService.complete(ANALYSIS_PROMPT, "질문: " + query,
                    state.getSessionId(), state.getCredential());
            JsonNode node = objectMapper.readTree(JsonResponses.extractObject(response));
            CompletenessAnalysis analysis = CompletenessAnalysis.builder()
                    .hasStockName(node.path("has_stock_name").asBoolean(false))
                    .hasSpecificDate(node.path("has_specific_date").asBoolean(false))
                    .hasRelativeTime(node.path("has_relative_time").asBoolean(false))
                    .hasMetrics(node.path("has_metrics").asBoolean(false))
                    .hasConditions(node.path("has_conditions").asBoolean(false))
                    .missingInformationType(parseEnum(MissingInformationType.class,
                            node.path("missing_information_type").asText(), MissingInformationType.NONE))
                    .completeness(parseEnum(InformationCompleteness.class,
                            node.path("information_completeness").asText(), InformationCompleteness.AMBIGUOUS))
                    .build();
            log.info("[Clarify] Analysis: completeness={}, missing={}",
                    analysis.getCompleteness(), analysis.getMissingInformationType());
            return analysis;
        } catch (CompletionException | JsonProcessingException e) {
            log.warn("[Clarify] Completeness analysis failed: {}", e.getMessage());
            CompletenessAnalysis fallback = CompletenessAnalysis.fallback();
            fallback.setHasSpecificDate(QueryDates.extract(query).isPresent());
            return fallback;
        }
    }

    /**
     * COMPLETE reaching this branch is a routing anomaly and self-clarifies.
     * PARTIAL asks the user for a missing stock name, date or period, except a
     * missing date with a relative-time expression, which is resolvable.
     * AMBIGUOUS self-clarifies.
     */
    public ClarificationAction decide(CompletenessAnalysis analysis) {
        return switch (analysis.getCompleteness()) {
        case COMPLETE -> {
            log.warn("[Clarify] Complete query reached clarification, self-clarifying");
            yield ClarificationAction.SELF_CLARIFY;
        }
        case PARTIAL -> decidePartial(analysis);
        case AMBIGUOUS -> ClarificationAction.SELF_CLARIFY;
        };
    }

    private ClarificationAction decidePartial(CompletenessAnalysis analysis) {
        MissingInformationType missing = analysis.getMissingInformationType();
        if (missing == MissingInformationType.SPECIFIC_DATE && analysis.isHasRelativeTime()) {
            return ClarificationAction.SELF_CLARIFY;
        }
        if (missing == MissingInformationType.STOCK_NAME
                || missing == MissingInformationType.SPECIFIC_DATE
                || missing == MissingInformationType.TIME_PERIOD) {
            return ClarificationAction.ASK_USER;
        }
        return ClarificationAction.SELF_CLARIFY;
    }

    public String askUser(ConversationState state, CompletenessAnalysis analysis) {
        MissingInformationType missing = analysis.getMissingInformationType();
        try {
            String response = textCompletionService.complete(ASK_USER_PROMPT,
                    "질문: " + state.getQuery() + "\n부족한 정보: " + missing,
                    state.getSessionId(), state.getCredential());
            String message = objectMapper.readTree(JsonResponses.extractObject(response))
                    .path("clarification_message").asText("");
            if (!message.isBlank()) {
                return message;
            }
        } catch (CompletionException | JsonProcessingException e) {
            log.warn("[Clarify] Follow-up question generation failed: {}", e.getMessage());
        }
        return fallbackQuestion(missing);
    }

    /**
     * Rewrites the query. The returned record always carries a non-empty
     * clarified query; the original query is used when rewriting fails.
     */
    public ClarificationRecord selfClarify(ConversationState state) {
        String query = state.getQuery();
        String originalQuery = state.getClarification() != null
                ? state.getClarification().getOriginalQuery()
                : query;

        JsonNode node = objectMapper.createObjectNode();
        try {
            String response = textCompletionService.complete(SELF_CLARIFY_PROMPT,
                    "오늘 날짜: " + LocalDate.now(clock) + "\n질문: " + query
                            + "\n배경지식: " + state.getBackgroundKnowledge(),
                    state.getSessionId(), state.getCredential());
            node = objectMapper.readTree(JsonResponses.extractObject(response));
        } catch (CompletionException | JsonProcessingException e) {
            log.warn("[Clarify] Query rewrite failed, keeping the query as is: {}", e.getMessage());
        }

        String clarified = node.path("specific_question").asText("");
        if (clarified.isBlank()) {
            clarified = query;
        }
        ClarificationRecord record = ClarificationRecord.builder()
                .originalQuery(originalQuery)
                .clarifiedQuery(clarified)
                .startDate(node.path("start_date").asText(""))
                .endDate(node.path("end_date").asText(""))
                .marketScope(node.path("market_scope").asText(""))
                .primaryCriteria(node.path("primary_criteria").asText(""))
                .secondaryCriteria(node.path("secondary_criteria").asText(""))
                .build();
        log.info("[Clarify] Rewrote '{}' as '{}'", originalQuery, clarified);
        return record;
    }

    static String fallbackQuestion(MissingInformationType missing) {
        return "질문을 처리하기 위해 추가 정보가 필요합니다. " + missing + " 정보를 제공해주시겠어요?";
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, E fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }
}
