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
import me.golemcore.stockagent.domain.model.AnswerCheckResult;
import me.golemcore.stockagent.domain.model.CompletionException;
import me.golemcore.stockagent.domain.model.ConversationState;
import me.golemcore.stockagent.domain.model.QuizOption;
import me.golemcore.stockagent.domain.model.QuizQuestion;
import me.golemcore.stockagent.domain.service.TextCompletionService;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides whether a free-text answer matches the correct option.
 *
 * <p>
 * An exact option number or symbol, or a mention of the answer company, is
 * settled locally. Anything else goes to the model, which answers in the
 * {@code 정답여부 / 신뢰도 / 이유} format.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class QuizAnswerChecker {

    static final int DEFAULT_CONFIDENCE = 50;
    static final int MAX_CONFIDENCE = 100;
    static final int LOCAL_CONFIDENCE = 100;

    private static final Pattern VERDICT = Pattern.compile("정답여부:\\s*정답");
    private static final Pattern CONFIDENCE = Pattern.compile("신뢰도:\\s*(\\d+)");
    private static final Pattern REASON = Pattern.compile("이유:\\s*(.+)");

    private final TextCompletionService textCompletionService;

    /**
     * @throws QuizException
     *             when the model verdict cannot be obtained
     */
    public AnswerCheckResult check(ConversationState state, QuizQuestion question, String userAnswer) {
        String answer = userAnswer == null ? "" : userAnswer.strip();

        AnswerCheckResult local = checkLocally(question, answer);
        if (local != null) {
            return local;
        }

        String verdict;
        try {
            verdict = textCompletionService.complete(null, buildPrompt(question, answer),
                    state.getSessionId(), state.getCredential());
        } catch (CompletionException e) {
            log.error("[Quiz] Answer check failed ({}): {}", e.getKind(), e.getMessage());
            throw new QuizException("답변 검증 중 오류가 발생했습니다.", e);
        }
        return parseVerdict(verdict, answer);
    }

    static AnswerCheckResult checkLocally(QuizQuestion question, String answer) {
        if (answer.isEmpty()) {
            return null;
        }
        if (answer.equals(question.getCorrectNumber()) || answer.equals(question.getCorrectSymbol())
                || answer.contains(question.getCorrectCompany())) {
            return AnswerCheckResult.builder()
                    .correct(true)
                    .confidence(LOCAL_CONFIDENCE)
                    .reason("정답 선택지와 일치합니다.")
                    .userAnswer(answer)
                    .build();
        }
        for (QuizOption option : question.getOptions()) {
            if (answer.equals(option.getNumber()) || answer.equals(option.getSymbol())) {
                return AnswerCheckResult.builder()
                        .correct(false)
                        .confidence(LOCAL_CONFIDENCE)
                        .reason(option.getNumber() + "번은 정답이 아닙니다.")
                        .userAnswer(answer)
                        .build();
            }
        }
        return null;
    }

    static AnswerCheckResult parseVerdict(String verdict, String answer) {
        String text = verdict == null ? "" : verdict;
        int confidence = DEFAULT_CONFIDENCE;
        Matcher confidenceMatcher = CONFIDENCE.matcher(text);
        if (confidenceMatcher.find()) {
            confidence = parseConfidence(confidenceMatcher.group(1));
        }
        Matcher reasonMatcher = REASON.matcher(text);
        String reason = reasonMatcher.find() ? reasonMatcher.group(1).strip() : "LLM 판단 결과";
        return AnswerCheckResult.builder()
                .correct(VERDICT.matcher(text).find())
                .confidence(confidence)
                .reason(reason)
                .userAnswer(answer)
                .build();
    }

    private static int parseConfidence(String digits) {
        try {
            return Math.min(Integer.parseInt(digits), MAX_CONFIDENCE);
        } catch (NumberFormatException e) {
            log.warn("[Quiz] Confidence out of range: {}", digits);
            return DEFAULT_CONFIDENCE;
        }
    }

    private static String buildPrompt(QuizQuestion question, String answer) {
        StringBuilder options = new StringBuilder();
        for (QuizOption option : question.getOptions()) {
            options.append(option.getNumber()).append("번: ").append(option.getText()).append('\n');
        }
        return """
                다음 주식 퀴즈의 사용자 답변이 정답인지 판단할 것.

                질문: %s

                선택지:
                %s
                정답: %s번 - %s

                사용자 답변: "%s"

                정답 번호나 정답 기업명(일부 포함)을 언급하면 정답으로 판단할 것.
                다음 형식으로만 답할 것:
                정답여부: [정답/오답]
                신뢰도: [0-100 숫자]
                이유: [간단한 설명]
                """.formatted(question.getQuestion(), options, question.getCorrectNumber(),
                question.getCorrectCompany(), answer);
    }
}
