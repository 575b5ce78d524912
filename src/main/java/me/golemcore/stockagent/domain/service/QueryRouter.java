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
import me.golemcore.stockagent.domain.model.ClarificationAction;
import me.golemcore.stockagent.domain.model.ClarificationRecord;
import me.golemcore.stockagent.domain.model.CompletenessAnalysis;
import me.golemcore.stockagent.domain.model.ConversationState;
import me.golemcore.stockagent.domain.model.QueryCategory;
import me.golemcore.stockagent.domain.model.QuizOutcome;
import me.golemcore.stockagent.domain.model.RetrievalSource;
import me.golemcore.stockagent.domain.service.quiz.QuizResponseFormatter;
import me.golemcore.stockagent.domain.service.quiz.QuizService;
import me.golemcore.stockagent.infrastructure.config.AgentProperties;
import org.springframework.stereotype.Service;

/**
 * Top-level state machine of one conversation turn.
 *
 * <p>
 * {@code preprocess -> classify -> (fetch | conditional | signal | quiz | ambiguous)}.
 * The ambiguous branch either asks the user (turn ends) or rewrites the query
 * and loops back to classification. Data branches end in answer generation,
 * the quiz branch ends in the quiz formatter.
 */
@Service
@Slf4j
public class QueryRouter {

    private final PreprocessService preprocessService;
    private final QueryClassifier queryClassifier;
    private final ClarificationService clarificationService;
    private final DataRetrievalService dataRetrievalService;
    private final ResponseGenerationService responseGenerationService;
    private final QuizService quizService;
    private final QuizResponseFormatter quizResponseFormatter;
    private final int maxClarifications;

    public QueryRouter(PreprocessService preprocessService, QueryClassifier queryClassifier,
            ClarificationService clarificationService, DataRetrievalService dataRetrievalService,
            ResponseGenerationService responseGenerationService, QuizService quizService,
            QuizResponseFormatter quizResponseFormatter, AgentProperties properties) {
        this.preprocessService = preprocessService;
        this.queryClassifier = queryClassifier;
        this.clarificationService = clarificationService;
        this.dataRetrievalService = dataRetrievalService;
        this.responseGenerationService = responseGenerationService;
        this.quizService = quizService;
        this.quizResponseFormatter = quizResponseFormatter;
        this.maxClarifications = Math.max(0, properties.getRouter().getMaxClarifications());
    }

    /**
     * Routes the current query of {@code state} and leaves the answer in
     * {@link ConversationState#getResponse()}.
     */
    public ConversationState route(ConversationState state) {
        state.setBackgroundKnowledge(preprocessService.preprocess(state));

        int clarifications = 0;
        while (true) {
            QueryCategory category = queryClassifier.classify(state, state.getClarification() != null);
            if (category == QueryCategory.AMBIGUOUS && clarifications >= maxClarifications) {
                log.warn("[Clarify] Clarification limit {} reached, dispatching to fetch", maxClarifications);
                category = QueryCategory.FETCH;
            }
            state.setCategory(category);
            log.info("[Router] Session {} classified as {}", state.getSessionId(), category.getToken());

            switch (category) {
            case QUIZ -> {
                return handleQuiz(state);
            }
            case FETCH -> {
                return retrieveAndAnswer(state, RetrievalSource.FETCH);
            }
            case CONDITIONAL -> {
                return retrieveAndAnswer(state, RetrievalSource.CONDITIONAL);
            }
            case SIGNAL -> {
                return retrieveAndAnswer(state, RetrievalSource.SIGNAL);
            }
            case AMBIGUOUS -> {
                if (clarify(state)) {
                    return state;
                }
                clarifications++;
            }
            default -> throw new IllegalStateException("Unroutable category: " + category);
            }
        }
    }

    /**
     * Returns true when the turn ends with a question to the user.
     */
    private boolean clarify(ConversationState state) {
        CompletenessAnalysis analysis = clarificationService.analyze(state);
        ClarificationAction action = clarificationService.decide(analysis);
        log.info("[Clarify] completeness={}, missing={}, action={}", analysis.getCompleteness(),
                analysis.getMissingInformationType(), action);

        if (action == ClarificationAction.ASK_USER) {
            state.setCategory(QueryCategory.ASK_CLARIFICATION);
            state.setResponse(clarificationService.askUser(state, analysis));
            return true;
        }

        ClarificationRecord record = clarificationService.selfClarify(state);
        state.setClarification(record);
        state.setQuery(record.getClarifiedQuery());
        log.info("[Clarify] Rewrote query for session {}", state.getSessionId());
        return false;
    }

    private ConversationState retrieveAndAnswer(ConversationState state, RetrievalSource source) {
        state.setRetrievalResult(dataRetrievalService.retrieve(state, source));
        state.setResponse(responseGenerationService.generate(state));
        return state;
    }

    private ConversationState handleQuiz(ConversationState state) {
        QuizOutcome outcome = quizService.handle(state);
        state.setResponse(quizResponseFormatter.format(outcome));
        return state;
    }
}
