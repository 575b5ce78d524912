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

import me.golemcore.stockagent.domain.model.ConversationState;
import me.golemcore.stockagent.domain.model.QuizOption;
import me.golemcore.stockagent.domain.model.QuizQuestion;

import java.util.List;

final class QuizFixtures {

    private QuizFixtures() {
    }

    static QuizQuestion samsungSplit() {
        return QuizQuestion.builder()
                .id(2)
                .question("2018년 5월 50대 1 액면분할을 단행해 주가가 5만원대가 된 기업은?")
                .options(List.of(
                        new QuizOption("1", "①", "현대자동차"),
                        new QuizOption("2", "②", "삼성전자"),
                        new QuizOption("3", "③", "네이버"),
                        new QuizOption("4", "④", "POSCO홀딩스")))
                .correctNumber("2")
                .correctSymbol("②")
                .correctCompany("삼성전자")
                .background("2018년 5월 액면가 5,000원을 100원으로 나누는 액면분할을 시행했다. 유가증권시장 시가총액 1위 기업이다.")
                .build();
    }

    static ConversationState turn(ConversationState state, String input) {
        state.beginTurn(input, "token");
        return state;
    }
}
