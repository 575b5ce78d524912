package me.golemcore.stockagent.port.outbound;

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

import me.golemcore.stockagent.domain.model.QuizHistoryRecord;

import java.util.List;
import java.util.Set;

/**
 * Durable storage for finished quiz attempts.
 */
public interface QuizHistoryPort {

    void save(QuizHistoryRecord record);

    /**
     * Quiz ids this conversation has already attempted.
     */
    Set<Integer> findPlayedQuizIds(String requestId);

    /**
     * All records of a conversation, newest first.
     */
    List<QuizHistoryRecord> findByRequestId(String requestId);
}
