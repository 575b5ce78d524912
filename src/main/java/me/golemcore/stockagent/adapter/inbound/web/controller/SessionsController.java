package me.golemcore.stockagent.adapter.inbound.web.controller;

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
import me.golemcore.stockagent.adapter.inbound.web.dto.SessionInfoDto;
import me.golemcore.stockagent.adapter.inbound.web.dto.SessionsResponse;
import me.golemcore.stockagent.domain.model.QuizPhase;
import me.golemcore.stockagent.domain.model.SessionSnapshot;
import me.golemcore.stockagent.domain.service.ConversationSessionStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Diagnostics view of the live conversation sessions. Idle and expired
 * sessions are swept before the listing is taken.
 */
@RestController
@RequiredArgsConstructor
public class SessionsController {

    private final ConversationSessionStore sessionStore;
    private final Clock clock;

    @GetMapping("/sessions")
    public Mono<ResponseEntity<SessionsResponse>> listSessions() {
        sessionStore.sweep();
        Instant now = clock.instant();
        List<SessionInfoDto> sessions = sessionStore.snapshot().stream()
                .map(snapshot -> toDto(snapshot, now, clock.getZone()))
                .toList();
        return Mono.just(ResponseEntity.ok(SessionsResponse.builder()
                .totalSessions(sessions.size())
                .sessions(sessions)
                .build()));
    }

    private static SessionInfoDto toDto(SessionSnapshot snapshot, Instant now, ZoneId zone) {
        Instant lastActivity = snapshot.lastActivity();
        double elapsed = 0;
        if (lastActivity != null) {
            elapsed = Math.round(Duration.between(lastActivity, now).toMillis() / 6000.0) / 10.0;
        }
        QuizPhase phase = snapshot.quizPhase();
        return SessionInfoDto.builder()
                .sessionId(snapshot.sessionId())
                .quizActive(snapshot.quizActive())
                .quizPhase(phase != null ? phase.getValue() : "")
                .elapsedMinutes(elapsed)
                .lastActivity(lastActivity != null
                        ? DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(lastActivity.atZone(zone))
                        : null)
                .build();
    }
}
