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

import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;

/**
 * Market data service that executes the parameterized lookups behind every
 * data tool.
 */
public interface MarketDataPort {

    /**
     * Runs the named lookup and returns its JSON result as a map.
     */
    Map<String, Object> invoke(String toolName, Map<String, Object> arguments);

    /**
     * Closing price of a company on the last trading day strictly before the
     * reference date.
     */
    Optional<ClosingPrice> previousClose(String companyName, LocalDate referenceDate);

    record ClosingPrice(String ticker, LocalDate date, double price) {
    }
}
