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

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.stockagent.domain.model.CompletionException;
import me.golemcore.stockagent.domain.model.CompletionFailureKind;
import me.golemcore.stockagent.domain.model.ConversationState;
import me.golemcore.stockagent.domain.model.Message;
import me.golemcore.stockagent.domain.model.ToolCallResult;
import me.golemcore.stockagent.domain.model.ToolFailureKind;
import me.golemcore.stockagent.domain.model.ToolResult;
import me.golemcore.stockagent.domain.model.ToolRoundResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PreprocessServiceTest {

    private static final Map<String, Object> SAMSUNG_TICKERS = Map.of(
            "stock_list", List.of(Map.of("ticker", "005930", "name", "삼성전자")), "count", 1);
    private static final Map<String, Object> KAKAO_TICKERS = Map.of(
            "stock_list", List.of(Map.of("ticker", "035720", "name", "카카오")), "count", 1);

    private ToolRegistry toolRegistry;
    private ToolCallingProtocol toolCallingProtocol;
    private TextCompletionService textCompletionService;
    private PreprocessService service;

    @BeforeEach
    void setUp() {
        toolRegistry = mock(ToolRegistry.class);
        toolCallingProtocol = mock(ToolCallingProtocol.class);
        textCompletionService = mock(TextCompletionService.class);
        service = new PreprocessService(toolRegistry, toolCallingProtocol, textCompletionService,
                new ObjectMapper());
    }

    @Test
    void parseStockNamesShouldAcceptSeveralShapes() {
        assertEquals(List.of("삼성전자", "SK하이닉스"), service.parseStockNames("[\"삼성전자\", \"SK하이닉스\"]"));
        assertEquals(List.of("삼성전자", "카카오"), service.parseStockNames("삼성전자, 카카오"));
        assertEquals(List.of("네이버"), service.parseStockNames(" 네이버 "));
        assertTrue(service.parseStockNames("없음").isEmpty());
        assertTrue(service.parseStockNames("[]").isEmpty());
        assertTrue(service.parseStockNames(null).isEmpty());
    }

    @Test
    void shouldCollectTradingDateAndTickersFromDirectCalls() {
        when(textCompletionService.complete(anyString(), anyString(), any(), any())).thenReturn("[\"삼성전자\"]");
        when(toolRegistry.execute(argThat(call -> call != null && "check_trading_date".equals(call.getName()))))
                .thenReturn(ToolResult.success("ok", Map.of("is_trading_day", true)));
        when(toolRegistry.execute(argThat(call -> call != null && "names_to_ticker".equals(call.getName()))))
                .thenReturn(ToolResult.success("ok", SAMSUNG_TICKERS));

        Map<String, Object> knowledge = service.preprocess(state("2024-01-02 삼성전자 종가"));

        assertEquals(Map.of("is_trading_day", true), knowledge.get(PreprocessService.TRADING_DATE_KEY));
        assertEquals(SAMSUNG_TICKERS, knowledge.get(PreprocessService.TICKERS_KEY));
        verify(toolCallingProtocol, never()).execute(any());
    }

    @Test
    void shouldFallBackToToolRoundWhenDirectCallFails() {
        when(textCompletionService.complete(anyString(), anyString(), any(), any())).thenReturn("카카오");
        when(toolRegistry.execute(any(Message.ToolCall.class)))
                .thenReturn(ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "503"));
        when(toolCallingProtocol.execute(any())).thenReturn(ToolRoundResult.builder()
                .success(true)
                .toolResults(List.of(ToolCallResult.builder()
                        .toolName("names_to_ticker")
                        .success(true)
                        .result(KAKAO_TICKERS)
                        .build()))
                .build());

        Map<String, Object> knowledge = service.preprocess(state("카카오 주가"));

        assertEquals(KAKAO_TICKERS, knowledge.get(PreprocessService.TICKERS_KEY));
    }

    @Test
    void shouldReturnEmptyKnowledgeWhenEverythingFails() {
        when(textCompletionService.complete(anyString(), anyString(), any(), any()))
                .thenThrow(new CompletionException(CompletionFailureKind.TRANSPORT, "down"));
        when(toolRegistry.execute(any(Message.ToolCall.class)))
                .thenReturn(ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "503"));
        when(toolCallingProtocol.execute(any())).thenReturn(ToolRoundResult.builder()
                .success(false)
                .toolResults(List.of())
                .error("down")
                .build());

        Map<String, Object> knowledge = service.preprocess(state("2024-01-02 시장 요약"));

        assertTrue(knowledge.isEmpty());
    }

    @Test
    void shouldSkipToolsWhenNothingToResolve() {
        when(textCompletionService.complete(anyString(), anyString(), any(), any())).thenReturn("없음");

        assertTrue(service.preprocess(state("요즘 시장 어때?")).isEmpty());
        verify(toolRegistry, never()).execute(any());
    }

    private static ConversationState state(String query) {
        ConversationState state = ConversationState.empty("req-1");
        state.beginTurn(query, null);
        return state;
    }
}
