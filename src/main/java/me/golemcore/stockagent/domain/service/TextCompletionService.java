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
import me.golemcore.stockagent.domain.model.CompletionException;
import me.golemcore.stockagent.domain.model.CompletionFailureKind;
import me.golemcore.stockagent.domain.model.CompletionRequest;
import me.golemcore.stockagent.domain.model.CompletionResponse;
import me.golemcore.stockagent.domain.model.Message;
import me.golemcore.stockagent.port.outbound.CompletionPort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Single-shot completion without tools, used for classification, analysis,
 * rewriting and answer generation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TextCompletionService {

    private final CompletionPort completionPort;

    /**
     * Returns the trimmed text answer.
     *
     * @throws CompletionException
     *             when the call fails or the model answers without text
     */
    public String complete(String systemPrompt, String userPrompt, String sessionId, String credential) {
        List<Message> messages = new ArrayList<>();
        if (systemPrompt != null) {
            messages.add(Message.system(systemPrompt));
        }
        messages.add(Message.user(userPrompt));

        CompletionResponse response = completionPort.complete(CompletionRequest.builder()
                .messages(messages)
                .sessionId(sessionId)
                .credential(credential)
                .build());
        if (response.getContent() == null) {
            throw new CompletionException(CompletionFailureKind.MALFORMED_RESPONSE, "Response has no content");
        }
        return response.getContent().trim();
    }
}
