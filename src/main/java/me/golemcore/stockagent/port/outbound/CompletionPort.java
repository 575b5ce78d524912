package me.golemcore.stockagent.port.outbound;

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

import me.golemcore.stockagent.domain.model.CompletionRequest;
import me.golemcore.stockagent.domain.model.CompletionResponse;

/**
 * Gateway to the external completion service.
 */
public interface CompletionPort {

    /**
     * Sends one transcript (and optional tool declarations) and returns either
     * a direct text answer or the tool calls the model requested. Performs no
     * retries.
     *
     * @throws me.golemcore.stockagent.domain.model.CompletionException
     *             on timeout, transport error, non-2xx status or a response that
     *             matches no accepted shape
     */
    CompletionResponse complete(CompletionRequest request);

    /**
     * Checks if the gateway is configured with an endpoint.
     */
    boolean isAvailable();
}
