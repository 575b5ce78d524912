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

/**
 * Model-assisted judgement of how much a query leaves unspecified.
 */
@Data
@Builder
public class CompletenessAnalysis {

    private boolean hasStockName;
    private boolean hasSpecificDate;
    private boolean hasRelativeTime;
    private boolean hasMetrics;
    private boolean hasConditions;
    @Builder.Default
    private MissingInformationType missingInformationType = MissingInformationType.NONE;
    @Builder.Default
    private InformationCompleteness completeness = InformationCompleteness.AMBIGUOUS;

    /**
     * Used when the analysis call fails or returns nothing parseable.
     */
    public static CompletenessAnalysis fallback() {
        return CompletenessAnalysis.builder().build();
    }
}
