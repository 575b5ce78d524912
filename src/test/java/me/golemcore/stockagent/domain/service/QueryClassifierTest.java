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

import me.golemcore.stockagent.domain.model.CompletionException;
import me.golemcore.stockagent.domain.model.CompletionFailureKind;
import me.golemcore.stockagent.domain.model.ConversationState;
import me.golemcore.stockagent.domain.model.QueryCategory;
import me.golemcore.stockagent.domain.model.QuizPhase;
import me.golemcore.stockagent.domain.model.QuizSession;
import me.golemcore.stockagent.infrastructure.config.AgentProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class QueryClassifierTest {

    private TextCompletionService textCompletionService;
    private QueryClassifier classifier;

    @BeforeEach
    void setUp() {
        textCompletionService = mock(TextCompletionService.class);
        classifier = new QueryClassifier(textCompletionService, new AgentProperties());
    }

    @Test
    void shouldRouteActiveQuizWithoutModelCall() {
        ConversationState state = state("2번");
        state.setQuiz(QuizSession.builder().phase(QuizPhase.ASKING).startTime(Instant.now()).build());

        assertEquals(QueryCategory.QUIZ, classifier.classify(state, false));
        verifyNoInteractions(textCompletionService);
    }

    @Test
    void shouldRouteTriggerPhraseToQuiz() {
        assertEquals(QueryCategory.QUIZ, classifier.classify(state("주식퀴즈도전"), false));
        verifyNoInteractions(textCompletionService);
    }

    @Test
    void shouldUseModelAnswer() {
        when(textCompletionService.complete(anyString(), anyString(), any(), any()))
                .thenReturn("signal_stock_data");

        assertEquals(QueryCategory.SIGNAL, classifier.classify(state("골든크로스 종목 알려줘"), false));
    }

    @Test
    void shouldFallBackToAmbiguousOnFirstPassFailure() {
        when(textCompletionService.complete(anyString(), anyString(), any(), any()))
                .thenThrow(new CompletionException(CompletionFailureKind.TIMEOUT, "timed out"));

        assertEquals(QueryCategory.AMBIGUOUS, classifier.classify(state("요즘 뭐가 좋아?"), false));
    }

    @Test
    void shouldFallBackToFetchOnClarifiedPassFailure() {
        when(textCompletionService.complete(anyString(), anyString(), any(), any()))
                .thenThrow(new CompletionException(CompletionFailureKind.TRANSPORT, "refused"));

        assertEquals(QueryCategory.FETCH, classifier.classify(state("삼성전자 2024-01-02 종가"), true));
    }

    @Test
    void parseCategoryShouldAcceptDecoratedTokens() {
        assertEquals(QueryCategory.FETCH, QueryClassifier.parseCategory("`fetch_stock_data`",
                QueryClassifier.FIRST_PASS, QueryCategory.AMBIGUOUS));
        assertEquals(QueryCategory.CONDITIONAL, QueryClassifier.parseCategory(
                "분류 결과: conditional_stock_data 입니다.", QueryClassifier.FIRST_PASS, QueryCategory.AMBIGUOUS));
        assertEquals(QueryCategory.SIGNAL, QueryClassifier.parseCategory("SIGNAL_STOCK_DATA",
                QueryClassifier.FIRST_PASS, QueryCategory.AMBIGUOUS));
    }

    @Test
    void parseCategoryShouldFallBackForUnknownOrDisallowed() {
        assertEquals(QueryCategory.AMBIGUOUS, QueryClassifier.parseCategory("잘 모르겠습니다",
                QueryClassifier.FIRST_PASS, QueryCategory.AMBIGUOUS));
        assertEquals(QueryCategory.AMBIGUOUS, QueryClassifier.parseCategory(null,
                QueryClassifier.FIRST_PASS, QueryCategory.AMBIGUOUS));
        assertEquals(QueryCategory.FETCH, QueryClassifier.parseCategory("ambiguous_query",
                QueryClassifier.CLARIFIED_PASS, QueryCategory.FETCH));
        assertEquals(QueryCategory.AMBIGUOUS, QueryClassifier.parseCategory("quiz_stock_data",
                QueryClassifier.FIRST_PASS, QueryCategory.AMBIGUOUS));
    }

    private static ConversationState state(String query) {
        ConversationState state = ConversationState.empty("req-1");
        state.beginTurn(query, null);
        return state;
    }
}
