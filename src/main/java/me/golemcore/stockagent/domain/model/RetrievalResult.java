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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Payload produced by a data-retrieval branch and consumed by answer
 * generation.
 */
@Data
@Builder
public class RetrievalResult {

    public static final String FAILURE_SUMMARY = "요청 실패";

    private RetrievalSource source;
    @Builder.Default
    private List<Map<String, Object>> results = new ArrayList<>();
    private int totalCount;
    private int returnedCount;
    private String summary;
    private Map<String, Object> parameters;
    private String error;

    public static RetrievalResult failure(RetrievalSource source, Map<String, Object> parameters, String error) {
        return RetrievalResult.builder()
                .source(source)
                .totalCount(0)
                .returnedCount(0)
                .summary(FAILURE_SUMMARY)
                .parameters(parameters)
                .error(error)
                .build();
    }

    public boolean isFailure() {
        return FAILURE_SUMMARY.equals(summary);
    }
}
