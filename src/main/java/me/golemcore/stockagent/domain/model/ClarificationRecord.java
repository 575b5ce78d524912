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
 * Written when the router rewrites an underspecified query itself instead of
 * asking the user. {@code clarifiedQuery} is never empty once recorded.
 */
@Data
@Builder
public class ClarificationRecord {

    private String originalQuery;
    private String clarifiedQuery;
    private String startDate;
    private String endDate;
    private String marketScope;
    private String primaryCriteria;
    private String secondaryCriteria;
}
