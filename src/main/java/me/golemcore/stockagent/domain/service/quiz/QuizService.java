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
import me.golemcore.stockagent.domain.model.ConversationState;
import me.golemcore.stockagent.domain.model.QuizOption;
import me.golemcore.stockagent.domain.model.QuizOutcome;
import me.golemcore.stockagent.domain.model.QuizOutcomeType;
import me.golemcore.stockagent.domain.model.QuizPhase;
import me.golemcore.stockagent.domain.model.QuizQuestion;
import me.golemcore.stockagent.domain.model.QuizSession;
import me.golemcore.stockagent.domain.model.RewardEligibility;
import me.golemcore.stockagent.domain.model.RewardQuote;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Quiz sub-state machine driver, invoked by the router for every quiz turn.
 *
 * <p>
 * {@code inactive} starts a quiz. In {@code asking} the input is either a hint
 * request or an answer: a wrong answer keeps the phase, a correct one moves
 * through {@code processing} and {@code completed}, writes one history record
 * and tears the quiz down. An expired quiz is removed before anything else
 * runs.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QuizService {

    static final String COMPLETION_TEXT = "퀴즈가 완료되었습니다. '주식퀴즈도전'으로 새로운 퀴즈를 시작할 수 있습니다!";
    static final String NEXT_QUIZ_LINE = "🎯 새로운 퀴즈를 원하시면 '주식퀴즈도전'을 입력해주세요!";
    static final double FALLBACK_SHARES = 0.001;

    private final QuizBank quizBank;
    private final QuizSessionManager sessionManager;
    private final QuizAnswerChecker answerChecker;
    private final QuizHintService hintService;
    private final RewardEligibilityService eligibilityService;
    private final QuizRewardService rewardService;
    private final CompanyInsightService insightService;

    public QuizOutcome handle(ConversationState state) {
        try {
            sessionManager.cleanupExpired(state);

            QuizSession quiz = state.getQuiz();
            QuizPhase phase = quiz != null ? quiz.getPhase() : null;
            if (phase == null) {
                log.error("[Quiz] Unknown quiz phase for session {}", state.getSessionId());
                sessionManager.end(state);
                return QuizOutcome.error("퀴즈 세션 상태 오류가 발생했습니다.");
            }

            return switch (phase) {
            case INACTIVE -> start(state);
            case ASKING -> answer(state, state.getQuery());
            case PROCESSING -> {
                log.debug("[Quiz] Re-entered while processing, completing");
                sessionManager.transition(state, QuizPhase.COMPLETED);
                yield complete(state);
            }
            case COMPLETED -> complete(state);
            };
        } catch (QuizException e) {
            log.error("[Quiz] {}", e.getMessage());
            sessionManager.end(state);
            return QuizOutcome.error(e.getMessage());
        } catch (RuntimeException e) {
            log.error("[Quiz] Quiz turn failed for session {}", state.getSessionId(), e);
            sessionManager.end(state);
            return QuizOutcome.error("퀴즈 처리 중 오류가 발생했습니다: " + e.getMessage());
        }
    }

    private QuizOutcome start(ConversationState state) {
        QuizQuestion question = quizBank.select(state.getSessionId());
        sessionManager.start(state, question);
        return QuizOutcome.of(QuizOutcomeType.QUIZ_GENERATION, startMessage(question), question.getId());
    }

    private QuizOutcome answer(ConversationState state, String input) {
        QuizQuestion question = state.getQuiz().getCurrentQuestion();
        if (question == null) {
            throw new QuizException("활성화된 퀴즈가 없습니다.");
        }
        String userAnswer = input == null ? "" : input.strip();

        if (QuizHintService.isHintRequest(userAnswer)) {
            log.info("[Quiz] Hint requested for quiz #{}", question.getId());
            state.getQuiz().setHintUsed(true);
            return QuizOutcome.of(QuizOutcomeType.HINT_PROVIDED, hintService.hintMessage(state, question),
                    question.getId());
        }

        AnswerCheckResult result = answerChecker.check(state, question, userAnswer);
        if (!result.isCorrect()) {
            log.info("[Quiz] Wrong answer for quiz #{} (confidence {})", question.getId(), result.getConfidence());
            String hint = hintService.keywordHint(state, question);
            String message = "**오답입니다!**\n\n"
                    + "입력하신 답변: " + userAnswer + "\n"
                    + "정답은 다른 선택지입니다.\n\n"
                    + "💡 **힌트**: " + hint + "\n\n"
                    + "다시 답변해보세요!";
            return QuizOutcome.of(QuizOutcomeType.WRONG_ANSWER_WITH_HINT, message, question.getId());
        }

        log.info("[Quiz] Correct answer for quiz #{} (confidence {})", question.getId(), result.getConfidence());
        sessionManager.transition(state, QuizPhase.PROCESSING);
        return rewardCorrectAnswer(state, question, userAnswer);
    }

    private QuizOutcome rewardCorrectAnswer(ConversationState state, QuizQuestion question, String userAnswer) {
        String requestId = state.getSessionId();
        String company = question.getCorrectCompany();
        List<String> parts = new ArrayList<>();
        parts.add("🎉 정답입니다!");
        parts.add("");

        String insight = insightService.insight(state, question);
        if (!insight.isEmpty()) {
            parts.add("📚 **기업 정보**");
            parts.add(insight);
            parts.add("");
        }

        double rewardAmount = 0;
        RewardEligibility eligibility = eligibilityService.check(requestId);
        if (!eligibility.isEligible()) {
            parts.add(eligibilityService.limitationMessage(eligibility));
        } else {
            Optional<RewardQuote> quote = rewardService.quote(company);
            parts.add("🎁 **보상**");
            if (quote.isPresent()) {
                RewardQuote reward = quote.get();
                rewardAmount = reward.getShares();
                parts.add("🎁 축하합니다! " + reward.getPriceDate() + " 종가 기준 "
                        + String.format("%,.0f", reward.getTotalValue()) + "원 가치의 " + company + " 주식 "
                        + QuizRewardService.formatShares(reward.getShares()) + "주를 선물로 드렸습니다!");
                parts.add("종가: " + String.format("%,.0f", reward.getClosingPrice()) + "원");
            } else {
                rewardAmount = FALLBACK_SHARES;
                parts.add("🎁 축하합니다! " + company + " 주식을 선물로 드렸습니다!");
                parts.add("종가: 가격 조회 실패");
            }
        }
        parts.add("");

        sessionManager.transition(state, QuizPhase.COMPLETED);
        sessionManager.endWithHistory(state, userAnswer, true, company, rewardAmount);

        parts.add(rewardService.rewardsSummary(requestId));
        parts.add("");
        parts.add("---");
        parts.add(NEXT_QUIZ_LINE);
        return QuizOutcome.of(QuizOutcomeType.ANSWER_CHECKING, String.join("\n", parts), question.getId());
    }

    private QuizOutcome complete(ConversationState state) {
        sessionManager.transition(state, QuizPhase.INACTIVE);
        sessionManager.end(state);
        return QuizOutcome.of(QuizOutcomeType.SESSION_COMPLETED, COMPLETION_TEXT, null);
    }

    static String startMessage(QuizQuestion question) {
        List<String> lines = new ArrayList<>();
        lines.add("🎯 주식 퀴즈 도전!");
        lines.add("문제 #" + question.getId());
        lines.add("");
        lines.add("Q. " + question.getQuestion());
        lines.add("");
        for (QuizOption option : question.getOptions()) {
            lines.add(option.getSymbol() + " " + option.getText());
        }
        lines.add("");
        lines.add("💡 번호(1,2,3,4), 기업명, 또는 '힌트'를 입력해주세요!");
        return String.join("\n", lines);
    }
}
