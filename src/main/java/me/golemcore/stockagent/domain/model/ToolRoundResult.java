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
 * Aggregate outcome of one tool round: at most one completion call followed by
 * at most one sequential pass over the requested tools.
 */
@Data
@Builder
public class ToolRoundResult {

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName")
    private boolean success;
    private String finalResponse;
    private List<ToolCallResult> toolResults;
    private List<Message> transcript;
    private String error;
    private CompletionFailureKind completionFailure;

    /**
     * True when the round failed before any tool ran.
     */
    public boolean isProtocolFailure() {
        return completionFailure != null;
    }

    public ToolCallResult lastToolResult() {
        if (toolResults == null || toolResults.isEmpty()) {
            return null;
        }
        return toolResults.get(toolResults.size() - 1);
    }
}
