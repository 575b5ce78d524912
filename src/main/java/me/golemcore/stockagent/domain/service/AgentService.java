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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.stockagent.domain.model.ConversationState;
import org.springframework.stereotype.Service;

/**
 * Runs one question through the router inside the conversation's session.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AgentService {

    static final String NO_ANSWER = "응답을 생성할 수 없습니다.";

    private final ConversationSessionStore sessionStore;
    private final QueryRouter queryRouter;

    public String answer(String sessionId, String question, String credential) {
        log.info("[Router] Turn for session {} (credential provided: {}): {}", sessionId, credential != null,
                question);
        return sessionStore.withSession(sessionId, state -> {
            state.beginTurn(question, credential);
            ConversationState result = queryRouter.route(state);
            String response = result.getResponse();
            return response != null ? response : NO_ANSWER;
        });
    }
}
