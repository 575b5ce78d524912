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

import java.util.Arrays;
import java.util.Optional;

/**
 * Route chosen by the classifier. {@code token} is the literal the completion
 * service answers with.
 */
public enum QueryCategory {

    FETCH("fetch_stock_data"),
    CONDITIONAL("conditional_stock_data"),
    SIGNAL("signal_stock_data"),
    AMBIGUOUS("ambiguous_query"),
    QUIZ("quiz_stock_data"),
    ASK_CLARIFICATION("ask_clarification");

    private final String token;

    QueryCategory(String token) {
        this.token = token;
    }

    public String getToken() {
        return token;
    }

    public static Optional<QueryCategory> fromToken(String token) {
        return Arrays.stream(values())
                .filter(category -> category.token.equals(token))
                .findFirst();
    }
}
