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

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.stockagent.domain.model.ClarificationAction;
import me.golemcore.stockagent.domain.model.ClarificationRecord;
import me.golemcore.stockagent.domain.model.CompletenessAnalysis;
import me.golemcore.stockagent.domain.model.CompletionException;
import me.golemcore.stockagent.domain.model.CompletionFailureKind;
import me.golemcore.stockagent.domain.model.ConversationState;
import me.golemcore.stockagent.domain.model.InformationCompleteness;
import me.golemcore.stockagent.domain.model.MissingInformationType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ClarificationServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-02T01:00:00Z"), ZoneId.of("Asia/Seoul"));

    private TextCompletionService textCompletionService;
    private ClarificationService service;

    @BeforeEach
    void setUp() {
        textCompletionService = mock(TextCompletionService.class);
        service = new ClarificationService(textCompletionService, new ObjectMapper(), CLOCK);
    }

    @ParameterizedTest
    @CsvSource({
            "COMPLETE, NONE, false, SELF_CLARIFY",
            "PARTIAL, STOCK_NAME, false, ASK_USER",
            "PARTIAL, SPECIFIC_DATE, false, ASK_USER",
            "PARTIAL, SPECIFIC_DATE, true, SELF_CLARIFY",
            "PARTIAL, TIME_PERIOD, true, ASK_USER",
            "PARTIAL, NONE, false, SELF_CLARIFY",
            "AMBIGUOUS, STOCK_NAME, false, SELF_CLARIFY"
    })
    void decideShouldFollowDecisionTable(InformationCompleteness completeness, MissingInformationType missing,
            boolean relativeTime, ClarificationAction expected) {
        CompletenessAnalysis analysis = CompletenessAnalysis.builder()
                .completeness(completeness)
                .missingInformationType(missing)
                .hasRelativeTime(relativeTime)
                .build();

        assertEquals(expected, service.decide(analysis));
    }

    @Test
    void analyzeShouldParseFencedJson() {
        when(textCompletionService.complete(anyString(), anyString(), any(), any())).thenReturn("""
                ```json
                {"has_stock_name": true, "has_specific_date": false, "has_relative_time": true,
                 "missing_information_type": "specific_date", "information_completeness": "PARTIAL"}
                ```
                """);

        CompletenessAnalysis analysis = service.analyze(state("삼성전자 어제 종가"));

        assertTrue(analysis.isHasStockName());
        assertTrue(analysis.isHasRelativeTime());
        assertEquals(MissingInformationType.SPECIFIC_DATE, analysis.getMissingInformationType());
        assertEquals(InformationCompleteness.PARTIAL, analysis.getCompleteness());
    }

    @Test
    void analyzeShouldFallBackAndDetectExplicitDate() {
        when(textCompletionService.complete(anyString(), anyString(), any(), any()))
                .thenThrow(new CompletionException(CompletionFailureKind.TIMEOUT, "timed out"));

        CompletenessAnalysis analysis = service.analyze(state("20240102 뭐가 올랐어?"));

        assertEquals(InformationCompleteness.AMBIGUOUS, analysis.getCompleteness());
        assertTrue(analysis.isHasSpecificDate());
    }

    @Test
    void askUserShouldUseFallbackQuestionWhenModelAnswerIsEmpty() {
        when(textCompletionService.complete(anyString(), anyString(), any(), any()))
                .thenReturn("{\"clarification_message\": \"\"}");
        CompletenessAnalysis analysis = CompletenessAnalysis.builder()
                .completeness(InformationCompleteness.PARTIAL)
                .missingInformationType(MissingInformationType.STOCK_NAME)
                .build();

        String question = service.askUser(state("종가 알려줘"), analysis);

        assertEquals(ClarificationService.fallbackQuestion(MissingInformationType.STOCK_NAME), question);
    }

    @Test
    void askUserShouldReturnModelQuestion() {
        when(textCompletionService.complete(anyString(), anyString(), any(), any()))
                .thenReturn("{\"clarification_message\": \"어떤 종목이 궁금하신가요?\"}");

        String question = service.askUser(state("종가 알려줘"), CompletenessAnalysis.fallback());

        assertEquals("어떤 종목이 궁금하신가요?", question);
    }

    @Test
    void selfClarifyShouldRecordRewriteAndPassTodayDate() {
        when(textCompletionService.complete(anyString(), anyString(), any(), any())).thenReturn("""
                {"specific_question": "2026-02-27 KOSPI 거래량 상위 5개 종목", "start_date": "2026-02-27",
                 "end_date": "2026-02-27", "market_scope": "KOSPI", "primary_criteria": "거래량"}
                """);

        ClarificationRecord record = service.selfClarify(state("요즘 거래 많은 종목"));

        assertEquals("요즘 거래 많은 종목", record.getOriginalQuery());
        assertEquals("2026-02-27 KOSPI 거래량 상위 5개 종목", record.getClarifiedQuery());
        assertEquals("KOSPI", record.getMarketScope());
        assertEquals("", record.getSecondaryCriteria());

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(textCompletionService).complete(anyString(), prompt.capture(), eq("req-1"), eq("token"));
        assertTrue(prompt.getValue().contains("2026-03-02"));
    }

    @Test
    void selfClarifyShouldKeepQueryWhenRewriteFails() {
        when(textCompletionService.complete(anyString(), anyString(), any(), any())).thenReturn("모르겠습니다");

        ClarificationRecord record = service.selfClarify(state("요즘 어때?"));

        assertEquals("요즘 어때?", record.getClarifiedQuery());
        assertFalse(record.getClarifiedQuery().isEmpty());
    }

    @Test
    void selfClarifyShouldKeepFirstOriginalQueryAcrossRewrites() {
        ConversationState state = state("두 번째 구체화 대상");
        state.setClarification(ClarificationRecord.builder()
                .originalQuery("처음 질문")
                .clarifiedQuery("두 번째 구체화 대상")
                .build());
        when(textCompletionService.complete(anyString(), anyString(), any(), any()))
                .thenReturn("{\"specific_question\": \"세 번째\"}");

        assertEquals("처음 질문", service.selfClarify(state).getOriginalQuery());
    }

    private static ConversationState state(String query) {
        ConversationState state = ConversationState.empty("req-1");
        state.beginTurn(query, "token");
        return state;
    }
}
