package me.golemcore.stockagent.domain.service;

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
import me.golemcore.stockagent.domain.model.SessionSnapshot;
import me.golemcore.stockagent.domain.model.SweepReport;

import java.util.List;
import java.util.function.Function;

/**
 * Holds one conversation state per external session id, with an idle timeout
 * and a population cap. A blank id always yields a fresh, unpersisted state.
 */
public interface ConversationSessionStore {

    /**
     * Sweeps, then returns the existing state (refreshing its activity time) or
     * a new default state, inserted when the id is not blank.
     */
    ConversationState getOrCreate(String sessionId);

    /**
     * Upserts the state and refreshes its activity time. Ignored for a blank id.
     */
    void save(String sessionId, ConversationState state);

    /**
     * Removes idle sessions and sessions whose quiz expired, then evicts the
     * least recently active sessions while the population exceeds capacity.
     */
    SweepReport sweep();

    /**
     * Runs get, work and save as one unit, serialized per session id.
     */
    <T> T withSession(String sessionId, Function<ConversationState, T> work);

    List<SessionSnapshot> snapshot();

    int size();
}
