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

import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class QuizPhaseTest {

    private static final Map<QuizPhase, Set<QuizPhase>> EXPECTED = Map.of(
            QuizPhase.INACTIVE, EnumSet.of(QuizPhase.ASKING),
            QuizPhase.ASKING, EnumSet.of(QuizPhase.PROCESSING, QuizPhase.COMPLETED),
            QuizPhase.PROCESSING, EnumSet.of(QuizPhase.COMPLETED),
            QuizPhase.COMPLETED, EnumSet.of(QuizPhase.INACTIVE));

    @Test
    void shouldAllowOnlyListedTransitions() {
        for (QuizPhase from : QuizPhase.values()) {
            for (QuizPhase to : QuizPhase.values()) {
                assertEquals(EXPECTED.get(from).contains(to), from.canTransitionTo(to), from + " -> " + to);
            }
        }
    }

    @Test
    void shouldRejectNullTarget() {
        assertFalse(QuizPhase.ASKING.canTransitionTo(null));
    }

    @Test
    void processingCannotReturnToAsking() {
        assertFalse(QuizPhase.PROCESSING.canTransitionTo(QuizPhase.ASKING));
    }
}
