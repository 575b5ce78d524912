package me.golemcore.stockagent.domain.service.quiz;

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
import me.golemcore.stockagent.domain.model.QuizQuestion;
import me.golemcore.stockagent.domain.service.TextCompletionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class CompanyInsightServiceTest {

    private static final String LONG_INSIGHT = "삼성전자는 메모리 반도체와 스마트폰을 주력으로 하는 국내 최대 전자 기업입니다. "
            + "글로벌 D램 시장 점유율 1위를 유지하고 있습니다.";

    private TextCompletionService textCompletionService;
    private CompanyInsightService service;
    private ConversationState state;

    @BeforeEach
    void setUp() {
        textCompletionService = mock(TextCompletionService.class);
        service = new CompanyInsightService(textCompletionService);
        state = ConversationState.empty("req-1");
    }

    @Test
    void shouldReturnGeneratedInsight() {
        when(textCompletionService.complete(any(), anyString(), any(), any())).thenReturn(LONG_INSIGHT);

        assertEquals(LONG_INSIGHT, service.insight(state, QuizFixtures.samsungSplit()));
    }

    @Test
    void shouldFallBackWhenInsightIsTooShort() {
        when(textCompletionService.complete(any(), anyString(), any(), any())).thenReturn("좋은 회사입니다.");

        assertEquals(CompanyInsightService.fallback("삼성전자"), service.insight(state, QuizFixtures.samsungSplit()));
    }

    @Test
    void shouldFallBackWhenCompletionFails() {
        when(textCompletionService.complete(any(), anyString(), any(), any()))
                .thenThrow(new CompletionException(CompletionFailureKind.TIMEOUT, "timed out"));

        assertEquals(CompanyInsightService.fallback("삼성전자"), service.insight(state, QuizFixtures.samsungSplit()));
    }

    @Test
    void shouldSkipQuestionsWithoutCompany() {
        QuizQuestion question = QuizFixtures.samsungSplit();
        question.setCorrectCompany(null);

        assertEquals("", service.insight(state, question));
        verifyNoInteractions(textCompletionService);
    }
}
