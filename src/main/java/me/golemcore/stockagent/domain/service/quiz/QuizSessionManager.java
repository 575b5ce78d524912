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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.stockagent.domain.model.ConversationState;
import me.golemcore.stockagent.domain.model.QuizHistoryRecord;
import me.golemcore.stockagent.domain.model.QuizPhase;
import me.golemcore.stockagent.domain.model.QuizQuestion;
import me.golemcore.stockagent.domain.model.QuizSession;
import me.golemcore.stockagent.infrastructure.config.AgentProperties;
import me.golemcore.stockagent.port.outbound.QuizHistoryPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.UUID;

/**
 * Owns the quiz sub-record of a conversation: start, phase transitions,
 * teardown and expiry.
 */
@Component
@Slf4j
public class QuizSessionManager {

    private final QuizHistoryPort historyPort;
    private final Clock clock;
    private final Duration timeout;

    public QuizSessionManager(QuizHistoryPort historyPort, Clock clock, AgentProperties properties) {
        this.historyPort = historyPort;
        this.clock = clock;
        this.timeout = properties.getQuiz().getTimeout();
    }

    /**
     * Replaces any running quiz with a fresh one in phase {@code asking}.
     */
    public QuizSession start(ConversationState state, QuizQuestion question) {
        if (state.isQuizActive()) {
            log.warn("[Quiz] Session {} already has an active quiz, ending it", state.getSessionId());
            end(state);
        }
        QuizSession session = QuizSession.builder()
                .quizSessionId(UUID.randomUUID().toString().substring(0, 8))
                .phase(QuizPhase.ASKING)
                .startTime(clock.instant())
                .currentQuestion(question)
                .hintUsed(false)
                .build();
        state.setQuiz(session);
        log.info("[Quiz] Started quiz session {} with quiz #{}", session.getQuizSessionId(), question.getId());
        return session;
    }

    /**
     * Moves the quiz to {@code target} if the allow-list permits it. A rejected
     * transition leaves the phase unchanged.
     */
    public boolean transition(ConversationState state, QuizPhase target) {
        QuizSession quiz = state.getQuiz();
        QuizPhase current = quiz != null && quiz.getPhase() != null ? quiz.getPhase() : QuizPhase.INACTIVE;
        if (!current.canTransitionTo(target)) {
            log.warn("[Quiz] Rejected phase transition {} -> {}", current.getValue(),
                    target != null ? target.getValue() : null);
            return false;
        }
        quiz.setPhase(target);
        log.debug("[Quiz] Phase {} -> {}", current.getValue(), target.getValue());
        return true;
    }

    /**
     * Tears the quiz down without writing history.
     */
    public void end(ConversationState state) {
        QuizSession quiz = state.getQuiz();
        String quizSessionId = quiz != null ? quiz.getQuizSessionId() : null;
        state.setQuiz(QuizSession.inactive());
        log.info("[Quiz] Ended quiz session {}", quizSessionId);
    }

    /**
     * Writes one history record for the current question, then tears the quiz
     * down. A storage failure is logged and does not keep the quiz alive.
     */
    public void endWithHistory(ConversationState state, String userAnswer, boolean correct,
            String rewardStock, double rewardAmount) {
        QuizSession quiz = state.getQuiz();
        QuizQuestion question = quiz != null ? quiz.getCurrentQuestion() : null;
        if (question != null) {
            QuizHistoryRecord record = QuizHistoryRecord.builder()
                    .requestId(state.getSessionId())
                    .quizId(question.getId())
                    .question(question.getQuestion())
                    .correctCompany(question.getCorrectCompany())
                    .userAnswer(userAnswer)
                    .correct(correct)
                    .hintUsed(quiz.isHintUsed())
                    .rewardStock(rewardStock != null ? rewardStock : "")
                    .rewardAmount(rewardAmount)
                    .completedAt(clock.instant())
                    .build();
            try {
                historyPort.save(record);
                log.info("[Quiz] Saved quiz #{} result for {}", question.getId(), state.getSessionId());
            } catch (RuntimeException e) {
                log.error("[Quiz] Failed to save quiz #{} result for {}", question.getId(),
                        state.getSessionId(), e);
            }
        }
        if (quiz != null && quiz.getPhase() == QuizPhase.COMPLETED) {
            transition(state, QuizPhase.INACTIVE);
        }
        end(state);
    }

    public boolean isExpired(ConversationState state) {
        QuizSession quiz = state.getQuiz();
        return quiz != null && quiz.isExpired(clock.instant(), timeout);
    }

    /**
     * Ends an expired quiz. Returns true when one was removed.
     */
    public boolean cleanupExpired(ConversationState state) {
        if (!isExpired(state)) {
            return false;
        }
        log.info("[Quiz] Quiz session {} expired", state.getQuiz().getQuizSessionId());
        end(state);
        return true;
    }
}
