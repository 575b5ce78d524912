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

import me.golemcore.stockagent.adapter.outbound.storage.JsonlQuizHistoryAdapter;
import me.golemcore.stockagent.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.stockagent.domain.model.ConversationState;
import me.golemcore.stockagent.domain.model.QuizHistoryRecord;
import me.golemcore.stockagent.domain.model.QuizOutcome;
import me.golemcore.stockagent.domain.model.QuizOutcomeType;
import me.golemcore.stockagent.domain.model.QuizPhase;
import me.golemcore.stockagent.domain.model.QuizQuestion;
import me.golemcore.stockagent.domain.service.TextCompletionService;
import me.golemcore.stockagent.infrastructure.config.AgentProperties;
import me.golemcore.stockagent.infrastructure.config.AutoConfiguration;
import me.golemcore.stockagent.port.outbound.MarketDataPort;
import me.golemcore.stockagent.port.outbound.NewsSearchPort;
import me.golemcore.stockagent.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class QuizServiceTest {

    private static final String REQUEST_ID = "req-1";
    private static final String INSIGHT = "삼성전자는 메모리 반도체와 스마트폰을 주력으로 하는 국내 시가총액 1위 기업입니다. "
            + "글로벌 메모리 시장 점유율 1위를 유지하고 있습니다.";

    private MutableClock clock;
    private QuizBank quizBank;
    private TextCompletionService textCompletionService;
    private NewsSearchPort newsSearchPort;
    private MarketDataPort marketDataPort;
    @TempDir
    Path tempDir;

    private JsonlQuizHistoryAdapter historyAdapter;
    private QuizService quizService;
    private QuizQuestion question;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-02T01:00:00Z"), ZoneId.of("Asia/Seoul"));
        AgentProperties properties = new AgentProperties();
        quizBank = mock(QuizBank.class);
        textCompletionService = mock(TextCompletionService.class);
        newsSearchPort = mock(NewsSearchPort.class);
        marketDataPort = mock(MarketDataPort.class);
        properties.getStorage().setBasePath(tempDir.toString());
        LocalStorageAdapter storageAdapter = new LocalStorageAdapter(properties);
        storageAdapter.init();
        historyAdapter = new JsonlQuizHistoryAdapter(storageAdapter, AutoConfiguration.objectMapper());

        question = QuizFixtures.samsungSplit();
        when(quizBank.select(REQUEST_ID)).thenReturn(question);
        when(textCompletionService.complete(any(), anyString(), any(), any())).thenReturn(INSIGHT);
        when(newsSearchPort.isAvailable()).thenReturn(false);
        when(marketDataPort.previousClose(eq("삼성전자"), any())).thenReturn(Optional.of(
                new MarketDataPort.ClosingPrice("005930", LocalDate.of(2026, 2, 27), 50000)));

        quizService = new QuizService(
                quizBank,
                new QuizSessionManager(historyAdapter, clock, properties),
                new QuizAnswerChecker(textCompletionService),
                new QuizHintService(textCompletionService, newsSearchPort, properties),
                new RewardEligibilityService(historyAdapter, clock, properties),
                new QuizRewardService(marketDataPort, historyAdapter, clock, properties),
                new CompanyInsightService(textCompletionService));
    }

    @Test
    void shouldStartQuizFromInactive() {
        ConversationState state = ConversationState.empty(REQUEST_ID);

        QuizOutcome outcome = quizService.handle(QuizFixtures.turn(state, "주식퀴즈도전"));

        assertEquals(QuizOutcomeType.QUIZ_GENERATION, outcome.getType());
        assertEquals(2, outcome.getQuizId());
        assertTrue(outcome.getText().startsWith("🎯 주식 퀴즈 도전!\n문제 #2"));
        assertTrue(outcome.getText().contains("② 삼성전자"));
        assertEquals(QuizPhase.ASKING, state.getQuiz().getPhase());
        assertEquals(8, state.getQuiz().getQuizSessionId().length());
    }

    @Test
    void wrongThenCorrectAnswerShouldWriteExactlyOneHistoryRecord() {
        ConversationState state = ConversationState.empty(REQUEST_ID);
        quizService.handle(QuizFixtures.turn(state, "주식퀴즈도전"));

        QuizOutcome wrong = quizService.handle(QuizFixtures.turn(state, "1"));

        assertEquals(QuizOutcomeType.WRONG_ANSWER_WITH_HINT, wrong.getType());
        assertTrue(wrong.getText().startsWith("**오답입니다!**\n\n입력하신 답변: 1"));
        assertTrue(wrong.getText().contains("💡 **힌트**: 💡 "));
        assertEquals(QuizPhase.ASKING, state.getQuiz().getPhase());
        assertTrue(historyAdapter.findByRequestId(REQUEST_ID).isEmpty());

        QuizOutcome correct = quizService.handle(QuizFixtures.turn(state, "②"));

        assertEquals(QuizOutcomeType.ANSWER_CHECKING, correct.getType());
        assertTrue(correct.getText().startsWith("🎉 정답입니다!"));
        assertTrue(correct.getText().contains("📚 **기업 정보**\n" + INSIGHT));
        assertTrue(correct.getText().contains("2026-02-27 종가 기준 100원 가치의 삼성전자 주식 0.002주를 선물로 드렸습니다!"));
        assertTrue(correct.getText().contains("종가: 50,000원"));
        assertTrue(correct.getText().contains("• 삼성전자: 0.002주"));
        assertTrue(correct.getText().endsWith(QuizService.NEXT_QUIZ_LINE));
        assertFalse(state.isQuizActive());
        assertEquals(QuizPhase.INACTIVE, state.getQuiz().getPhase());

        List<QuizHistoryRecord> history = historyAdapter.findByRequestId(REQUEST_ID);
        assertEquals(1, history.size());
        QuizHistoryRecord record = history.get(0);
        assertEquals(2, record.getQuizId());
        assertEquals("②", record.getUserAnswer());
        assertTrue(record.isCorrect());
        assertEquals("삼성전자", record.getRewardStock());
        assertEquals(0.002, record.getRewardAmount(), 1e-9);
    }

    @Test
    void hintShouldKeepQuizAskingAndMarkHintUsed() {
        ConversationState state = ConversationState.empty(REQUEST_ID);
        quizService.handle(QuizFixtures.turn(state, "주식퀴즈도전"));

        QuizOutcome hint = quizService.handle(QuizFixtures.turn(state, "힌트 주세요"));

        assertEquals(QuizOutcomeType.HINT_PROVIDED, hint.getType());
        assertTrue(hint.getText().startsWith("📰 " + QuizHintService.NEWS_UNAVAILABLE));
        assertTrue(hint.getText().endsWith(QuizHintService.CONTINUE_LINE));
        assertEquals(QuizPhase.ASKING, state.getQuiz().getPhase());
        assertTrue(state.getQuiz().isHintUsed());

        quizService.handle(QuizFixtures.turn(state, "삼성전자인가요?"));

        assertTrue(historyAdapter.findByRequestId(REQUEST_ID).get(0).isHintUsed());
    }

    @Test
    void secondCorrectAnswerWithinIntervalShouldNotBeRewarded() {
        ConversationState state = ConversationState.empty(REQUEST_ID);
        quizService.handle(QuizFixtures.turn(state, "주식퀴즈도전"));
        quizService.handle(QuizFixtures.turn(state, "2"));
        clock.advance(Duration.ofHours(1));

        quizService.handle(QuizFixtures.turn(state, "주식퀴즈도전"));
        QuizOutcome second = quizService.handle(QuizFixtures.turn(state, "2"));

        assertTrue(second.getText().contains("⏰ **보상 지급 제한**"));
        assertTrue(second.getText().contains("다음 보상 가능 시간: 2026-03-03 10:00:00"));
        assertTrue(second.getText().contains("총 1회 퀴즈 정답으로 1종목 보유"));
        List<QuizHistoryRecord> history = historyAdapter.findByRequestId(REQUEST_ID);
        assertEquals(2, history.size());
        assertEquals(0.0, history.get(0).getRewardAmount());
    }

    @Test
    void priceFailureShouldGrantFallbackShares() {
        when(marketDataPort.previousClose(eq("삼성전자"), any())).thenReturn(Optional.empty());
        ConversationState state = ConversationState.empty(REQUEST_ID);
        quizService.handle(QuizFixtures.turn(state, "주식퀴즈도전"));

        QuizOutcome outcome = quizService.handle(QuizFixtures.turn(state, "2"));

        assertTrue(outcome.getText().contains("종가: 가격 조회 실패"));
        assertEquals(QuizService.FALLBACK_SHARES, historyAdapter.findByRequestId(REQUEST_ID).get(0).getRewardAmount(),
                1e-9);
    }

    @Test
    void expiredQuizShouldBeReplacedByFreshOne() {
        ConversationState state = ConversationState.empty(REQUEST_ID);
        quizService.handle(QuizFixtures.turn(state, "주식퀴즈도전"));
        String firstSession = state.getQuiz().getQuizSessionId();
        clock.advance(Duration.ofMinutes(11));

        QuizOutcome outcome = quizService.handle(QuizFixtures.turn(state, "2"));

        assertEquals(QuizOutcomeType.QUIZ_GENERATION, outcome.getType());
        assertFalse(firstSession.equals(state.getQuiz().getQuizSessionId()));
        assertTrue(historyAdapter.findByRequestId(REQUEST_ID).isEmpty());
    }

    @Test
    void missingQuizRecordShouldEndWithError() {
        ConversationState state = QuizFixtures.turn(ConversationState.empty(REQUEST_ID), "2");
        state.setQuiz(null);

        QuizOutcome outcome = quizService.handle(state);

        assertEquals(QuizOutcomeType.ERROR, outcome.getType());
        assertEquals("퀴즈 세션 상태 오류가 발생했습니다.", outcome.getText());
        assertEquals(QuizOutcome.RETRY_SUGGESTION, outcome.getSuggestion());
        assertFalse(state.isQuizActive());
    }

    @Test
    void quizBankFailureShouldReturnErrorOutcome() {
        when(quizBank.select(REQUEST_ID)).thenThrow(new QuizException("퀴즈 파일을 찾을 수 없습니다."));
        ConversationState state = ConversationState.empty(REQUEST_ID);

        QuizOutcome outcome = quizService.handle(QuizFixtures.turn(state, "주식퀴즈도전"));

        assertEquals(QuizOutcomeType.ERROR, outcome.getType());
        assertEquals("퀴즈 파일을 찾을 수 없습니다.", outcome.getText());
        assertFalse(state.isQuizActive());
    }

    @Test
    void askingWithoutQuestionShouldEndWithError() {
        ConversationState state = QuizFixtures.turn(ConversationState.empty(REQUEST_ID), "2");
        state.getQuiz().setPhase(QuizPhase.ASKING);
        state.getQuiz().setStartTime(clock.instant());

        QuizOutcome outcome = quizService.handle(state);

        assertEquals("활성화된 퀴즈가 없습니다.", outcome.getText());
        assertFalse(state.isQuizActive());
    }

    @Test
    void completedPhaseShouldCloseQuiz() {
        ConversationState state = QuizFixtures.turn(ConversationState.empty(REQUEST_ID), "아무거나");
        state.getQuiz().setPhase(QuizPhase.COMPLETED);
        state.getQuiz().setStartTime(clock.instant());

        QuizOutcome outcome = quizService.handle(state);

        assertEquals(QuizOutcomeType.SESSION_COMPLETED, outcome.getType());
        assertEquals(QuizService.COMPLETION_TEXT, outcome.getText());
        assertNull(outcome.getQuizId());
        assertFalse(state.isQuizActive());
        verify(quizBank, never()).select(any());
    }

    @Test
    void processingPhaseShouldCompleteWithoutSecondHistoryRecord() {
        ConversationState state = QuizFixtures.turn(ConversationState.empty(REQUEST_ID), "삼성전자");
        state.getQuiz().setPhase(QuizPhase.PROCESSING);
        state.getQuiz().setStartTime(clock.instant());
        state.getQuiz().setCurrentQuestion(question);

        QuizOutcome outcome = quizService.handle(state);

        assertEquals(QuizOutcomeType.SESSION_COMPLETED, outcome.getType());
        assertEquals(QuizService.COMPLETION_TEXT, outcome.getText());
        assertFalse(state.isQuizActive());
        assertEquals(QuizPhase.INACTIVE, state.getQuiz().getPhase());
        assertTrue(historyAdapter.findByRequestId(REQUEST_ID).isEmpty());
        verify(quizBank, never()).select(any());
    }
}
