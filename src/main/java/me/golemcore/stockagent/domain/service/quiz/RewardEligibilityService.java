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
import me.golemcore.stockagent.domain.model.QuizHistoryRecord;
import me.golemcore.stockagent.domain.model.RewardEligibility;
import me.golemcore.stockagent.infrastructure.config.AgentProperties;
import me.golemcore.stockagent.port.outbound.QuizHistoryPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.Optional;

/**
 * Allows at most one quiz reward per conversation within the reward interval,
 * judged from the stored quiz history.
 */
@Component
@Slf4j
public class RewardEligibilityService {

    private static final DateTimeFormatter NEXT_TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final QuizHistoryPort historyPort;
    private final Clock clock;
    private final Duration interval;

    public RewardEligibilityService(QuizHistoryPort historyPort, Clock clock, AgentProperties properties) {
        this.historyPort = historyPort;
        this.clock = clock;
        this.interval = properties.getQuiz().getRewardInterval();
    }

    public RewardEligibility check(String requestId) {
        if (requestId == null || requestId.isBlank()) {
            return RewardEligibility.eligible();
        }
        Instant now = clock.instant();
        Instant cutoff = now.minus(interval);
        Optional<Instant> lastReward;
        try {
            lastReward = historyPort.findByRequestId(requestId).stream()
                    .filter(QuizHistoryRecord::isRewarded)
                    .map(QuizHistoryRecord::getCompletedAt)
                    .filter(completedAt -> completedAt != null && completedAt.isAfter(cutoff))
                    .max(Comparator.naturalOrder());
        } catch (RuntimeException e) {
            log.warn("[Reward] History lookup failed for {}, allowing reward", requestId, e);
            return RewardEligibility.eligible();
        }

        if (lastReward.isEmpty()) {
            return RewardEligibility.eligible();
        }
        Instant next = lastReward.get().plus(interval);
        if (!now.isBefore(next)) {
            return RewardEligibility.eligible();
        }
        log.info("[Reward] {} already rewarded, next reward at {}", requestId, next);
        return RewardEligibility.deniedUntil(next);
    }

    public String limitationMessage(RewardEligibility eligibility) {
        String next = eligibility.getNextEligibleAt() != null
                ? NEXT_TIME_FORMAT.format(eligibility.getNextEligibleAt().atZone(clock.getZone()))
                : "";
        return "⏰ **보상 지급 제한**\n"
                + "하루에 한 번만 주식 보상을 받을 수 있습니다.\n"
                + "다음 보상 가능 시간: " + next + "\n"
                + "그래도 퀴즈는 계속 풀 수 있으니 도전해보세요!";
    }
}
