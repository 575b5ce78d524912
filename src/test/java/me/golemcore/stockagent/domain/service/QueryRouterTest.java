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

import me.golemcore.stockagent.domain.model.ClarificationAction;
import me.golemcore.stockagent.domain.model.ClarificationRecord;
import me.golemcore.stockagent.domain.model.CompletenessAnalysis;
import me.golemcore.stockagent.domain.model.ConversationState;
import me.golemcore.stockagent.domain.model.QueryCategory;
import me.golemcore.stockagent.domain.model.QuizOutcome;
import me.golemcore.stockagent.domain.model.QuizOutcomeType;
import me.golemcore.stockagent.domain.model.RetrievalResult;
import me.golemcore.stockagent.domain.model.RetrievalSource;
import me.golemcore.stockagent.domain.service.quiz.QuizResponseFormatter;
import me.golemcore.stockagent.domain.service.quiz.QuizService;
import me.golemcore.stockagent.infrastructure.config.AgentProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class QueryRouterTest {

    private static final Map<String, Object> SAMSUNG_TICKERS = Map.of(
            "stock_list", List.of(Map.of("ticker", "005930", "name", "삼성전자")), "count", 1);

    private PreprocessService preprocessService;
    private QueryClassifier queryClassifier;
    private ClarificationService clarificationService;
    private DataRetrievalService dataRetrievalService;
    private ResponseGenerationService responseGenerationService;
    private QuizService quizService;
    private QueryRouter router;

    @BeforeEach
    void setUp() {
        preprocessService = mock(PreprocessService.class);
        queryClassifier = mock(QueryClassifier.class);
        clarificationService = mock(ClarificationService.class);
        dataRetrievalService = mock(DataRetrievalService.class);
        responseGenerationService = mock(ResponseGenerationService.class);
        quizService = mock(QuizService.class);

        when(preprocessService.preprocess(any())).thenReturn(Map.of("names_to_tickers", SAMSUNG_TICKERS));
        when(dataRetrievalService.retrieve(any(), any())).thenReturn(RetrievalResult.builder()
                .source(RetrievalSource.FETCH)
                .summary("ok")
                .build());
        when(responseGenerationService.generate(any())).thenReturn("답변");

        router = new QueryRouter(preprocessService, queryClassifier, clarificationService, dataRetrievalService,
                responseGenerationService, quizService, new QuizResponseFormatter(), new AgentProperties());
    }

    @Test
    void shouldDispatchConditionalQueryToRetrievalAndAnswer() {
        when(queryClassifier.classify(any(), eq(false))).thenReturn(QueryCategory.CONDITIONAL);
        ConversationState state = state("거래량 100만 이상 종목");

        ConversationState result = router.route(state);

        assertSame(state, result);
        assertEquals(QueryCategory.CONDITIONAL, state.getCategory());
        assertEquals("답변", state.getResponse());
        assertEquals(SAMSUNG_TICKERS, state.getBackgroundKnowledge().get("names_to_tickers"));
        verify(dataRetrievalService).retrieve(state, RetrievalSource.CONDITIONAL);
    }

    @Test
    void shouldEndTurnWithQuestionWhenUserMustClarify() {
        when(queryClassifier.classify(any(), anyBoolean())).thenReturn(QueryCategory.AMBIGUOUS);
        CompletenessAnalysis analysis = CompletenessAnalysis.fallback();
        when(clarificationService.analyze(any())).thenReturn(analysis);
        when(clarificationService.decide(analysis)).thenReturn(ClarificationAction.ASK_USER);
        when(clarificationService.askUser(any(), eq(analysis))).thenReturn("어떤 종목인가요?");

        ConversationState state = router.route(state("종가 알려줘"));

        assertEquals(QueryCategory.ASK_CLARIFICATION, state.getCategory());
        assertEquals("어떤 종목인가요?", state.getResponse());
        verify(dataRetrievalService, never()).retrieve(any(), any());
    }

    @Test
    void shouldReclassifyRewrittenQuery() {
        when(queryClassifier.classify(any(), eq(false))).thenReturn(QueryCategory.AMBIGUOUS);
        when(queryClassifier.classify(any(), eq(true))).thenReturn(QueryCategory.FETCH);
        when(clarificationService.analyze(any())).thenReturn(CompletenessAnalysis.fallback());
        when(clarificationService.decide(any())).thenReturn(ClarificationAction.SELF_CLARIFY);
        when(clarificationService.selfClarify(any())).thenReturn(ClarificationRecord.builder()
                .originalQuery("요즘 삼성 어때")
                .clarifiedQuery("삼성전자 2026-02-27 종가")
                .build());

        ConversationState state = router.route(state("요즘 삼성 어때"));

        assertEquals("삼성전자 2026-02-27 종가", state.getQuery());
        assertEquals("요즘 삼성 어때", state.getClarification().getOriginalQuery());
        assertEquals(QueryCategory.FETCH, state.getCategory());
        verify(dataRetrievalService).retrieve(state, RetrievalSource.FETCH);
    }

    @Test
    void shouldFallBackToFetchAfterClarificationLimit() {
        when(queryClassifier.classify(any(), anyBoolean())).thenReturn(QueryCategory.AMBIGUOUS);
        when(clarificationService.analyze(any())).thenReturn(CompletenessAnalysis.fallback());
        when(clarificationService.decide(any())).thenReturn(ClarificationAction.SELF_CLARIFY);
        when(clarificationService.selfClarify(any())).thenReturn(ClarificationRecord.builder()
                .originalQuery("애매한 질문")
                .clarifiedQuery("여전히 애매한 질문")
                .build());

        ConversationState state = router.route(state("애매한 질문"));

        assertEquals(QueryCategory.FETCH, state.getCategory());
        verify(clarificationService, times(2)).selfClarify(any());
        verify(queryClassifier, times(3)).classify(any(), anyBoolean());
        assertEquals("답변", state.getResponse());
    }

    @Test
    void shouldFormatQuizOutcome() {
        when(queryClassifier.classify(any(), anyBoolean())).thenReturn(QueryCategory.QUIZ);
        when(quizService.handle(any())).thenReturn(QuizOutcome.error("퀴즈 파일을 찾을 수 없습니다."));

        ConversationState state = router.route(state("주식퀴즈도전"));

        assertEquals(QueryCategory.QUIZ, state.getCategory());
        assertEquals("퀴즈 파일을 찾을 수 없습니다.\n\n" + QuizOutcome.RETRY_SUGGESTION, state.getResponse());
        verify(responseGenerationService, never()).generate(any());
    }

    @Test
    void shouldReturnQuizTextAsIs() {
        when(queryClassifier.classify(any(), anyBoolean())).thenReturn(QueryCategory.QUIZ);
        when(quizService.handle(any())).thenReturn(QuizOutcome.of(QuizOutcomeType.HINT_PROVIDED, "💡 힌트", 3));

        assertEquals("💡 힌트", router.route(state("힌트")).getResponse());
    }

    private static ConversationState state(String query) {
        ConversationState state = ConversationState.empty("req-1");
        state.beginTurn(query, null);
        return state;
    }
}
