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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.stockagent.domain.model.CompletionException;
import me.golemcore.stockagent.domain.model.ConversationState;
import me.golemcore.stockagent.domain.model.QuizQuestion;
import me.golemcore.stockagent.domain.service.TextCompletionService;
import org.springframework.stereotype.Component;

/**
 * Short investor-oriented paragraph about the answer company, shown after a
 * correct answer.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CompanyInsightService {

    static final int MIN_INSIGHT_LENGTH = 50;

    private final TextCompletionService textCompletionService;

    public String insight(ConversationState state, QuizQuestion question) {
        String company = question.getCorrectCompany();
        if (company == null || company.isEmpty()) {
            return "";
        }
        String prompt = """
                너는 투자 전문 분석가임. 아래 기업에 대해 투자자 관점의 짧은 소개글을 쓸 것.
                업종, 시장 내 위치, 사업 모델, 최근 상황 순서로 4-6문장 한 문단, 존댓말로 쓸 것.

                회사명: %s
                퀴즈 배경지식 참고: %s
                """.formatted(company, question.getBackground() != null ? question.getBackground() : "없음");
        try {
            String text = textCompletionService.complete(null, prompt, state.getSessionId(), state.getCredential());
            if (text.length() < MIN_INSIGHT_LENGTH) {
                log.warn("[Quiz] Insight for {} is too short, using fallback", company);
                return fallback(company);
            }
            return text;
        } catch (CompletionException e) {
            log.warn("[Quiz] Insight generation for {} failed: {}", company, e.getMessage());
            return fallback(company);
        }
    }

    static String fallback(String company) {
        return company + "는 해당 업종 분야의 주요 기업으로, 주요 사업을 통해 수익을 창출하고 있습니다. "
                + "투자 전에는 기업의 재무상태와 시장 전망을 종합적으로 검토해보시기 바랍니다.";
    }
}
