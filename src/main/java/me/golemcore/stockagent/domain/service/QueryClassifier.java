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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.stockagent.domain.model.CompletionException;
import me.golemcore.stockagent.domain.model.ConversationState;
import me.golemcore.stockagent.domain.model.QueryCategory;
import me.golemcore.stockagent.infrastructure.config.AgentProperties;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides which branch handles a query.
 *
 * <p>
 * Two overrides run before any model call: an active quiz and the quiz trigger
 * phrase both route to {@link QueryCategory#QUIZ}. Otherwise the model is asked
 * for a category token. A pass that follows a self-clarification uses a prompt
 * without the ambiguous category and falls back to
 * {@link QueryCategory#FETCH}; a first pass falls back to
 * {@link QueryCategory#AMBIGUOUS}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class QueryClassifier {

    static final Set<QueryCategory> FIRST_PASS = EnumSet.of(
            QueryCategory.FETCH, QueryCategory.CONDITIONAL, QueryCategory.SIGNAL, QueryCategory.AMBIGUOUS);
    static final Set<QueryCategory> CLARIFIED_PASS = EnumSet.of(
            QueryCategory.FETCH, QueryCategory.CONDITIONAL, QueryCategory.SIGNAL);

    private static final Set<QueryCategory> MODEL_CATEGORIES = FIRST_PASS;
    private static final Pattern TOKEN_PATTERN = Pattern.compile(
            "\\b(fetch_stock_data|conditional_stock_data|signal_stock_data|ambiguous_query)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final String SYSTEM_PROMPT = """
            너는 주식 질문 분류기임. 사용자 질문을 아래 카테고리 중 하나로 분류하고 카테고리 이름만 답할 것.
            - fetch_stock_data: 특정 종목/시장의 특정 날짜 또는 기간 데이터 조회 (가격, 거래량, 순위, 비교)
            - conditional_stock_data: 가격, 거래량, 등락률 등의 조건에 맞는 종목 검색
            - signal_stock_data: 기술적 지표 신호 검색 (볼린저 밴드, 골든/데드 크로스, RSI, 이동평균 편차, 거래량 급증)
            - ambiguous_query: 종목, 날짜, 조건이 불분명해서 바로 조회할 수 없는 질문
            """;

    private static final String CLARIFIED_SYSTEM_PROMPT = """
            너는 주식 질문 분류기임. 이 질문은 이미 구체화되었으므로 아래 세 카테고리 중 하나로만 분류하고 카테고리 이름만 답할 것.
            - fetch_stock_data: 특정 종목/시장의 특정 날짜 또는 기간 데이터 조회
            - conditional_stock_data: 가격, 거래량, 등락률 등의 조건에 맞는 종목 검색
            - signal_stock_data: 기술적 지표 신호 검색
            """;

    private final TextCompletionService textCompletionService;
    private final AgentProperties properties;

    /**
     * Classifies the query held in {@code state}.
     *
     * @param clarifiedPass
     *            true when the query is the product of a self-clarification
     */
    public QueryCategory classify(ConversationState state, boolean clarifiedPass) {
        if (state.isQuizActive()) {
            log.debug("[Classifier] Active quiz, routing to quiz");
            return QueryCategory.QUIZ;
        }
        String query = state.getQuery() != null ? state.getQuery() : "";
        if (query.contains(properties.getQuiz().getTriggerPhrase())) {
            log.info("[Classifier] Quiz trigger phrase detected");
            return QueryCategory.QUIZ;
        }

        Set<QueryCategory> allowed = clarifiedPass ? CLARIFIED_PASS : FIRST_PASS;
        QueryCategory fallback = clarifiedPass ? QueryCategory.FETCH : QueryCategory.AMBIGUOUS;
        String prompt = "질문: " + query + "\n배경지식: " + state.getBackgroundKnowledge();

        String response;
        try {
            response = textCompletionService.complete(
                    clarifiedPass ? CLARIFIED_SYSTEM_PROMPT : SYSTEM_PROMPT,
                    prompt, state.getSessionId(), state.getCredential());
        } catch (CompletionException e) {
            log.warn("[Classifier] Classification call failed ({}), falling back to {}", e.getKind(), fallback);
            return fallback;
        }

        QueryCategory category = parseCategory(response, allowed, fallback);
        log.info("[Classifier] Query category: {}", category.getToken());
        return category;
    }

    /**
     * Reduces a free-text model answer to one allowed category: exact match of
     * the whole answer, then a word-bounded token, then plain containment.
     * Anything else yields {@code fallback}.
     */
    static QueryCategory parseCategory(String response, Set<QueryCategory> allowed, QueryCategory fallback) {
        if (response == null || response.isBlank()) {
            return fallback;
        }
        String trimmed = response.strip().replaceAll("^[`'\"*\\s]+|[`'\".*\\s]+$", "");

        QueryCategory found = QueryCategory.fromToken(trimmed.toLowerCase(Locale.ROOT)).orElse(null);
        if (found == null) {
            Matcher matcher = TOKEN_PATTERN.matcher(response);
            if (matcher.find()) {
                found = QueryCategory.fromToken(matcher.group(1).toLowerCase(Locale.ROOT)).orElse(null);
            }
        }
        if (found == null) {
            String lower = response.toLowerCase(Locale.ROOT);
            for (QueryCategory candidate : MODEL_CATEGORIES) {
                if (lower.contains(candidate.getToken())) {
                    found = candidate;
                    break;
                }
            }
        }

        if (found == null || !allowed.contains(found)) {
            log.warn("[Classifier] Unknown category in response, falling back to {}", fallback.getToken());
            return fallback;
        }
        return found;
    }
}
