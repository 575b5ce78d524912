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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.stockagent.adapter.inbound.web.dto.AnswerResponse;
import me.golemcore.stockagent.domain.service.AgentService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Question answering endpoint. The conversation id arrives in the
 * {@code X-NCP-CLOVASTUDIO-REQUEST-ID} header, the completion credential in
 * {@code Authorization}.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class AgentController {

    public static final String REQUEST_ID_HEADER = "X-NCP-CLOVASTUDIO-REQUEST-ID";
    private static final String BEARER_PREFIX = "Bearer ";

    private final AgentService agentService;

    @GetMapping("/agent")
    public Mono<ResponseEntity<AnswerResponse>> ask(
            @RequestParam(required = false) String question,
            @RequestHeader(name = REQUEST_ID_HEADER, required = false) String requestId,
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        if (question == null || question.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "question(질문) 요청이 비었습니다.");
        }
        if (requestId == null || requestId.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "request_id 요청이 비었습니다.");
        }
        String credential = extractCredential(authorization);

        return Mono.fromCallable(() -> {
            String answer = agentService.answer(requestId, question, credential);
            return ResponseEntity.ok(AnswerResponse.builder().answer(answer).build());
        }).subscribeOn(Schedulers.boundedElastic());
    }

    static String extractCredential(String authorization) {
        if (authorization == null || authorization.isBlank()) {
            return null;
        }
        String value = authorization.strip();
        if (value.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            value = value.substring(BEARER_PREFIX.length()).strip();
        }
        return value.isEmpty() ? null : value;
    }
}
