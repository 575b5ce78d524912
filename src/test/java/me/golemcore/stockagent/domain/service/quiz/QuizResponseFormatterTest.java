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

import me.golemcore.stockagent.domain.model.QuizOutcome;
import me.golemcore.stockagent.domain.model.QuizOutcomeType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class QuizResponseFormatterTest {

    private final QuizResponseFormatter formatter = new QuizResponseFormatter();

    @Test
    void shouldReturnOutcomeText() {
        assertEquals("정답입니다!", formatter.format(QuizOutcome.of(QuizOutcomeType.ANSWER_CHECKING, "정답입니다!", 2)));
    }

    @Test
    void shouldAppendSuggestionToErrors() {
        assertEquals("퀴즈를 불러오지 못했습니다.\n\n" + QuizOutcome.RETRY_SUGGESTION,
                formatter.format(QuizOutcome.error("퀴즈를 불러오지 못했습니다.")));
    }

    @Test
    void shouldHandleMissingOutcomeOrText() {
        assertEquals(QuizResponseFormatter.MISSING_OUTCOME, formatter.format(null));
        assertEquals(QuizResponseFormatter.MISSING_OUTCOME, formatter.format(QuizOutcome.builder().text("x").build()));
        assertEquals(QuizResponseFormatter.DEFAULT_TEXT,
                formatter.format(QuizOutcome.of(QuizOutcomeType.SESSION_COMPLETED, "", null)));
    }
}
