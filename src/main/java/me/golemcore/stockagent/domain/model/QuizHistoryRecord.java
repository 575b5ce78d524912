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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Record of one finished quiz attempt, keyed by conversation id and
 * quiz id.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuizHistoryRecord {

    private String requestId;
    private int quizId;
    private String question;
    private String correctCompany;
    private String userAnswer;
    private boolean correct;
    private boolean hintUsed;
    private String rewardStock;
    private double rewardAmount;
    private Instant completedAt;

    @JsonIgnore
    public boolean isRewarded() {
        return correct && rewardAmount > 0;
    }
}
