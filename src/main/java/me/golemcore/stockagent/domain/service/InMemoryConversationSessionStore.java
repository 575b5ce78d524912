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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.stockagent.domain.model.ConversationState;
import me.golemcore.stockagent.domain.model.SessionSnapshot;
import me.golemcore.stockagent.domain.model.SweepReport;
import me.golemcore.stockagent.infrastructure.config.AgentProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Process-local session store.
 *
 * <p>
 * Map mutations (sweep, insert, capacity eviction) run under the store
 * monitor, so the population never exceeds capacity once an insert returns.
 * A separate lock per session id serializes whole turns of the same
 * conversation through {@link #withSession(String, Function)}, while turns of
 * different conversations proceed concurrently. A session lock lives as long
 * as some turn holds or waits for it, independent of whether the session
 * itself has been evicted meanwhile.
 */
@Service
@Slf4j
public class InMemoryConversationSessionStore implements ConversationSessionStore {

    private final Map<String, SessionRecord> sessions = new HashMap<>();
    private final Map<String, SessionLock> sessionLocks = new HashMap<>();
    private final Clock clock;
    private final Duration idleTimeout;
    private final Duration quizTimeout;
    private final int capacity;

    public InMemoryConversationSessionStore(AgentProperties properties, Clock clock) {
        this.clock = clock;
        this.idleTimeout = properties.getSession().getIdleTimeout();
        this.quizTimeout = properties.getQuiz().getTimeout();
        this.capacity = properties.getSession().getCapacity();
    }

    @Override
    public synchronized ConversationState getOrCreate(String sessionId) {
        sweep();
        if (isBlank(sessionId)) {
            return ConversationState.empty(null);
        }

        Instant now = clock.instant();
        SessionRecord existing = sessions.get(sessionId);
        if (existing != null) {
            existing.lastActivity = now;
            return existing.state;
        }

        ConversationState state = ConversationState.empty(sessionId);
        insert(sessionId, state, now);
        log.debug("[Session] Created session {}", sessionId);
        return state;
    }

    @Override
    public synchronized void save(String sessionId, ConversationState state) {
        if (isBlank(sessionId) || state == null) {
            return;
        }
        Instant now = clock.instant();
        SessionRecord existing = sessions.get(sessionId);
        if (existing != null) {
            existing.state = state;
            existing.lastActivity = now;
        } else {
            insert(sessionId, state, now);
        }
    }

    @Override
    public synchronized SweepReport sweep() {
        Instant now = clock.instant();
        List<String> idle = new ArrayList<>();
        List<String> quizExpired = new ArrayList<>();

        for (Map.Entry<String, SessionRecord> entry : sessions.entrySet()) {
            SessionRecord record = entry.getValue();
            if (Duration.between(record.lastActivity, now).compareTo(idleTimeout) > 0) {
                idle.add(entry.getKey());
            } else if (record.state.getQuiz() != null && record.state.getQuiz().isExpired(now, quizTimeout)) {
                quizExpired.add(entry.getKey());
            }
        }
        for (String id : idle) {
            remove(id);
            log.info("[Session] Removed idle session {} (timeout {})", id, idleTimeout);
        }
        for (String id : quizExpired) {
            remove(id);
            log.info("[Session] Removed session {} with expired quiz", id);
        }

        List<String> evicted = enforceCapacity(null);
        return new SweepReport(idle, quizExpired, evicted);
    }

    @Override
    public <T> T withSession(String sessionId, Function<ConversationState, T> work) {
        if (isBlank(sessionId)) {
            return work.apply(getOrCreate(sessionId));
        }

        SessionLock sessionLock = acquireLock(sessionId);
        sessionLock.lock.lock();
        try {
            ConversationState state = getOrCreate(sessionId);
            T result = work.apply(state);
            save(sessionId, state);
            return result;
        } finally {
            sessionLock.lock.unlock();
            releaseLock(sessionId, sessionLock);
        }
    }

    private synchronized SessionLock acquireLock(String sessionId) {
        SessionLock sessionLock = sessionLocks.computeIfAbsent(sessionId, id -> new SessionLock());
        sessionLock.users++;
        return sessionLock;
    }

    private synchronized void releaseLock(String sessionId, SessionLock sessionLock) {
        sessionLock.users--;
        if (sessionLock.users == 0) {
            sessionLocks.remove(sessionId, sessionLock);
        }
    }

    synchronized int lockCount() {
        return sessionLocks.size();
    }

    @Override
    public synchronized List<SessionSnapshot> snapshot() {
        List<SessionSnapshot> snapshots = new ArrayList<>();
        for (Map.Entry<String, SessionRecord> entry : sessions.entrySet()) {
            ConversationState state = entry.getValue().state;
            snapshots.add(new SessionSnapshot(
                    entry.getKey(),
                    state.isQuizActive(),
                    state.getQuiz() != null ? state.getQuiz().getPhase() : null,
                    entry.getValue().lastActivity));
        }
        snapshots.sort(Comparator.comparing(SessionSnapshot::lastActivity).reversed());
        return snapshots;
    }

    @Override
    public synchronized int size() {
        return sessions.size();
    }

    private void insert(String sessionId, ConversationState state, Instant now) {
        sessions.put(sessionId, new SessionRecord(state, now));
        enforceCapacity(sessionId);
    }

    private List<String> enforceCapacity(String protectedId) {
        List<String> evicted = new ArrayList<>();
        if (sessions.size() <= capacity) {
            return evicted;
        }

        int excess = sessions.size() - capacity;
        List<Map.Entry<String, SessionRecord>> oldestFirst = new ArrayList<>(sessions.entrySet());
        oldestFirst.sort(Comparator.comparing(entry -> entry.getValue().lastActivity));
        for (Map.Entry<String, SessionRecord> entry : oldestFirst) {
            if (evicted.size() >= excess) {
                break;
            }
            if (!entry.getKey().equals(protectedId)) {
                evicted.add(entry.getKey());
            }
        }
        for (String id : evicted) {
            remove(id);
        }
        log.warn("[Session] Capacity {} exceeded, evicted least recently active: {}", capacity, evicted);
        return evicted;
    }

    private void remove(String sessionId) {
        sessions.remove(sessionId);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    // Guarded by the store monitor except for the lock itself.
    private static final class SessionLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }

    private static final class SessionRecord {
        private ConversationState state;
        private Instant lastActivity;

        private SessionRecord(ConversationState state, Instant lastActivity) {
            this.state = state;
            this.lastActivity = lastActivity;
        }
    }
}
