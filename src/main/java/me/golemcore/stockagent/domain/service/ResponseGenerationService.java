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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.stockagent.domain.model.ClarificationRecord;
import me.golemcore.stockagent.domain.model.CompletionException;
import me.golemcore.stockagent.domain.model.ConversationState;
import me.golemcore.stockagent.domain.model.RetrievalResult;
import org.springframework.stereotype.Service;

/**
 * Turns the retrieval payload of a data branch into the final answer text.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ResponseGenerationService {

    static final String APOLOGY = "죄송합니다. 답변을 생성하는 중 오류가 발생했습니다. 잠시 후 다시 시도해주세요.";

    private static final String SYSTEM_PROMPT = """
            너는 한국 주식시장 데이터를 설명하는 금융 어시스턴트임.
            조회 결과에 있는 사실만 사용해서 질문에 간결하게 답할 것.
            조회 결과가 비어 있거나 요청이 실패했으면 그 사실을 알릴 것.
            """;

    private static final String CLARIFIED_SYSTEM_PROMPT = """
            너는 한국 주식시장 데이터를 설명하는 금융 어시스턴트임.
            사용자의 원래 질문은 모호해서 구체화된 질문으로 조회했음.
            어떤 기준으로 해석했는지 먼저 밝히고, 조회 결과에 있는 사실만 사용해서 답할 것.
            """;

    private final TextCompletionService textCompletionService;
    private final ObjectMapper objectMapper;

    public String generate(ConversationState state) {
        ClarificationRecord clarification = state.getClarification();
        boolean clarified = isClarified(clarification);

        StringBuilder prompt = new StringBuilder();
        if (clarified) {
            prompt.append("원본 질문: ").append(clarification.getOriginalQuery()).append('\n')
                    .append("구체화된 질문: ").append(clarification.getClarifiedQuery()).append('\n')
                    .append("기간: ").append(nullToEmpty(clarification.getStartDate()))
                    .append(" ~ ").append(nullToEmpty(clarification.getEndDate())).append('\n')
                    .append("조건: ").append(clarification.getPrimaryCriteria());
            if (clarification.getSecondaryCriteria() != null && !clarification.getSecondaryCriteria().isBlank()) {
                prompt.append(", ").append(clarification.getSecondaryCriteria());
            }
            prompt.append("\n\n");
        } else {
            prompt.append("질문: ").append(state.getQuery()).append("\n\n");
        }
        prompt.append("[조회 결과]\n").append(formatRetrieval(state.getRetrievalResult()));

        try {
            return textCompletionService.complete(clarified ? CLARIFIED_SYSTEM_PROMPT : SYSTEM_PROMPT,
                    prompt.toString(), state.getSessionId(), state.getCredential());
        } catch (CompletionException e) {
            log.error("[Router] Answer generation failed ({}): {}", e.getKind(), e.getMessage());
            return APOLOGY;
        }
    }

    static boolean isClarified(ClarificationRecord clarification) {
        return clarification != null
                && clarification.getOriginalQuery() != null
                && clarification.getPrimaryCriteria() != null
                && !clarification.getPrimaryCriteria().isBlank();
    }

    private String formatRetrieval(RetrievalResult result) {
        if (result == null) {
            return "조회된 데이터가 없습니다.";
        }
        StringBuilder text = new StringBuilder();
        text.append("요약: ").append(result.getSummary()).append('\n');
        if (result.isFailure()) {
            text.append("오류: ").append(nullToEmpty(result.getError()));
            return text.toString();
        }
        if (result.getResults().isEmpty()) {
            text.append("조회된 데이터가 없습니다.");
            return text.toString();
        }
        text.append("전체 ").append(result.getTotalCount()).append("건\n");
        try {
            text.append(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result.getResults()));
        } catch (JsonProcessingException e) {
            text.append(result.getResults());
        }
        return text.toString();
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
