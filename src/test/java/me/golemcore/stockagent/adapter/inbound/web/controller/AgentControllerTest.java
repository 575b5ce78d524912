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

import me.golemcore.stockagent.domain.service.AgentService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class AgentControllerTest {

    private AgentService agentService;
    private AgentController controller;

    @BeforeEach
    void setUp() {
        agentService = mock(AgentService.class);
        controller = new AgentController(agentService);
    }

    @Test
    void shouldAnswerQuestionForConversation() {
        when(agentService.answer("req-1", "삼성전자 종가", "secret")).thenReturn("71,200원입니다.");

        StepVerifier.create(controller.ask("삼성전자 종가", "req-1", "Bearer secret"))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals("71,200원입니다.", response.getBody().getAnswer());
                })
                .verifyComplete();
        verify(agentService).answer("req-1", "삼성전자 종가", "secret");
    }

    @Test
    void shouldRejectMissingQuestion() {
        ResponseStatusException error = assertThrows(ResponseStatusException.class,
                () -> controller.ask(" ", "req-1", "Bearer secret"));

        assertEquals(HttpStatus.BAD_REQUEST, error.getStatusCode());
        assertEquals("question(질문) 요청이 비었습니다.", error.getReason());
        verifyNoInteractions(agentService);
    }

    @Test
    void shouldRejectMissingRequestId() {
        ResponseStatusException error = assertThrows(ResponseStatusException.class,
                () -> controller.ask("삼성전자 종가", null, "Bearer secret"));

        assertEquals(HttpStatus.BAD_REQUEST, error.getStatusCode());
        assertEquals("request_id 요청이 비었습니다.", error.getReason());
    }

    @Test
    void shouldPropagateServiceFailure() {
        when(agentService.answer(any(), any(), any())).thenThrow(new IllegalStateException("boom"));

        StepVerifier.create(controller.ask("삼성전자 종가", "req-1", null))
                .expectError(IllegalStateException.class)
                .verify();
    }

    @Test
    void shouldExtractBearerCredential() {
        assertEquals("abc", AgentController.extractCredential("Bearer abc"));
        assertEquals("abc", AgentController.extractCredential("bearer  abc "));
        assertEquals("raw-key", AgentController.extractCredential("raw-key"));
        assertNull(AgentController.extractCredential("   "));
        assertNull(AgentController.extractCredential(null));
    }
}
