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

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Phase of the nested quiz interaction, with its allow-listed transitions.
 */
public enum QuizPhase {

    INACTIVE("inactive"),
    ASKING("asking"),
    PROCESSING("processing"),
    COMPLETED("completed");

    private static final Map<QuizPhase, Set<QuizPhase>> ALLOWED = Map.of(
            INACTIVE, EnumSet.of(ASKING),
            ASKING, EnumSet.of(PROCESSING, COMPLETED),
            PROCESSING, EnumSet.of(COMPLETED),
            COMPLETED, EnumSet.of(INACTIVE));

    private final String value;

    QuizPhase(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean canTransitionTo(QuizPhase target) {
        return target != null && ALLOWED.get(this).contains(target);
    }
}
