package me.golemcore.stockagent.domain.model;

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

import lombok.Builder;
import lombok.Data;

/**
 * Result of one quiz-mode turn, rendered to the user by the quiz formatter.
 */
@Data
@Builder
public class QuizOutcome {

    public static final String RETRY_SUGGESTION = "다시 '주식퀴즈도전'으로 시도해보세요.";

    private QuizOutcomeType type;
    private String text;
    private String suggestion;
    private Integer quizId;

    public static QuizOutcome of(QuizOutcomeType type, String text, Integer quizId) {
        return QuizOutcome.builder().type(type).text(text).quizId(quizId).build();
    }

    public static QuizOutcome error(String text) {
        return QuizOutcome.builder()
                .type(QuizOutcomeType.ERROR)
                .text(text)
                .suggestion(RETRY_SUGGESTION)
                .build();
    }
}
