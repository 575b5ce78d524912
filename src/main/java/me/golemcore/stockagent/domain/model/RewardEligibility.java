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

import java.time.Instant;

/**
 * Whether a conversation may receive a quiz reward now, and if not, when.
 */
@Data
@Builder
public class RewardEligibility {

    private boolean eligible;
    private Instant nextEligibleAt;

    public static RewardEligibility eligible() {
        return RewardEligibility.builder().eligible(true).build();
    }

    public static RewardEligibility deniedUntil(Instant next) {
        return RewardEligibility.builder().eligible(false).nextEligibleAt(next).build();
    }
}
