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
import org.springframework.stereotype.Component;

/**
 * Final text of a quiz turn.
 */
@Component
public class QuizResponseFormatter {

    static final String MISSING_OUTCOME = "퀴즈 응답을 생성하는 중 오류가 발생했습니다. 다시 시도해주세요.";
    static final String DEFAULT_TEXT = "퀴즈 처리가 완료되었습니다.";

    public String format(QuizOutcome outcome) {
        if (outcome == null || outcome.getType() == null) {
            return MISSING_OUTCOME;
        }
        String text = outcome.getText();
        if (text == null || text.isEmpty()) {
            return DEFAULT_TEXT;
        }
        if (outcome.getType() == QuizOutcomeType.ERROR && outcome.getSuggestion() != null) {
            return text + "\n\n" + outcome.getSuggestion();
        }
        return text;
    }
}
