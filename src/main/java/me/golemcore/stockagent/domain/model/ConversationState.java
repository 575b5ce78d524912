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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mutable record of one conversation, carried through a router pass and
 * persisted by the session store between turns.
 */
@Data
@Builder
public class ConversationState {

    private String sessionId;
    private String query;
    private QueryCategory category;
    @Builder.Default
    private Map<String, Object> backgroundKnowledge = new LinkedHashMap<>();
    private RetrievalResult retrievalResult;
    private String response;
    private ClarificationRecord clarification;
    private String credential;
    @Builder.Default
    private QuizSession quiz = QuizSession.inactive();

    public static ConversationState empty(String sessionId) {
        return ConversationState.builder().sessionId(sessionId).build();
    }

    /**
     * Clears per-turn fields before a new question is routed. Quiz state and the
     * session id survive.
     */
    public void beginTurn(String question, String credential) {
        this.query = question;
        this.credential = credential;
        this.category = null;
        this.backgroundKnowledge = new LinkedHashMap<>();
        this.retrievalResult = null;
        this.response = null;
        this.clarification = null;
    }

    public boolean isQuizActive() {
        return quiz != null && quiz.isActive();
    }

    @Override
    public String toString() {
        return "ConversationState(sessionId=" + sessionId + ", category=" + category
                + ", quizPhase=" + (quiz != null ? quiz.getPhase() : null) + ")";
    }
}
