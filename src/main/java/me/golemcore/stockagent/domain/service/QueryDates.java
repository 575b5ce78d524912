package me.golemcore.stockagent.domain.service;

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

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Explicit calendar date detection in free text.
 */
final class QueryDates {

    private static final Pattern ISO_DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");
    private static final Pattern COMPACT_DATE = Pattern.compile("\\d{8}");

    private QueryDates() {
    }

    /**
     * First {@code yyyy-MM-dd} date, or an 8-digit {@code yyyyMMdd} run
     * rewritten to {@code yyyy-MM-dd}.
     */
    static Optional<String> extract(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher iso = ISO_DATE.matcher(text);
        if (iso.find()) {
            return Optional.of(iso.group());
        }
        Matcher compact = COMPACT_DATE.matcher(text);
        if (compact.find()) {
            String digits = compact.group();
            return Optional.of(digits.substring(0, 4) + "-" + digits.substring(4, 6) + "-" + digits.substring(6, 8));
        }
        return Optional.empty();
    }
}
