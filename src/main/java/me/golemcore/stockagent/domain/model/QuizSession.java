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

import java.time.Duration;
import java.time.Instant;

/**
 * Quiz sub-record embedded in a conversation. While the phase is
 * {@link QuizPhase#INACTIVE} there is no current question.
 */
@Data
@Builder
public class QuizSession {

    private String quizSessionId;
    @Builder.Default
    private QuizPhase phase = QuizPhase.INACTIVE;
    private Instant startTime;
    private QuizQuestion currentQuestion;
    private boolean hintUsed;

    public static QuizSession inactive() {
        return QuizSession.builder().build();
    }

    public boolean isActive() {
        return phase != QuizPhase.INACTIVE;
    }

    /**
     * An active quiz without a start time counts as expired.
     */
    public boolean isExpired(Instant now, Duration timeout) {
        if (!isActive()) {
            return false;
        }
        return startTime == null || Duration.between(startTime, now).compareTo(timeout) > 0;
    }
}
