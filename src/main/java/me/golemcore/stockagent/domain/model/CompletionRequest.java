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

import java.util.List;

/**
 * A single call to the completion service. The credential is opaque and must
 * never be logged; {@link #toString()} masks it.
 */
@Data
@Builder
public class CompletionRequest {

    private List<Message> messages;
    private List<ToolDefinition> tools;
    private String sessionId;
    private String credential;

    public boolean hasTools() {
        return tools != null && !tools.isEmpty();
    }

    @Override
    public String toString() {
        return "CompletionRequest(messages=" + (messages != null ? messages.size() : 0)
                + ", tools=" + (tools != null ? tools.size() : 0)
                + ", sessionId=" + sessionId + ")";
    }
}
