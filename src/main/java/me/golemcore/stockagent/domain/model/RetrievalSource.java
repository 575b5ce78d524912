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

/**
 * Category a retrieval payload came from, with the query-type tag echoed in it.
 */
public enum RetrievalSource {

    FETCH("stock_data_fetch"),
    CONDITIONAL("conditional_search"),
    SIGNAL("technical_analysis"),
    QUIZ("quiz");

    private final String queryType;

    RetrievalSource(String queryType) {
        this.queryType = queryType;
    }

    public String getQueryType() {
        return queryType;
    }
}
