package me.golemcore.hrms.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Instant answers for common HR questions, matched without any external call.
 *
 * <p>
 * Entries are tested in order; the first entry with any matching pattern wins
 * and its answer is returned verbatim. Matching is case-insensitive against the
 * trimmed query.
 */
@Component
@Slf4j
public class FaqMatcher {

    private final List<FaqEntry> entries;

    public FaqMatcher() {
        this(defaultEntries());
    }

    public FaqMatcher(List<FaqEntry> entries) {
        this.entries = List.copyOf(entries);
    }

    public Optional<String> match(String query) {
        if (query == null || query.isBlank()) {
            return Optional.empty();
        }
        String candidate = query.trim().toLowerCase(Locale.ROOT);
        for (FaqEntry entry : entries) {
            for (Pattern pattern : entry.patterns()) {
                if (pattern.matcher(candidate).find()) {
                    log.trace("[FAQ] '{}' matched {}", candidate, pattern.pattern());
                    return Optional.of(entry.answer());
                }
            }
        }
        return Optional.empty();
    }

    public List<FaqEntry> getEntries() {
        return entries;
    }

    /**
     * One FAQ answer and the patterns that select it.
     */
    public record FaqEntry(List<Pattern> patterns, String answer) {

        public static FaqEntry of(String answer, String... regexes) {
            List<Pattern> compiled = Arrays.stream(regexes)
                    .map(regex -> Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE))
                    .toList();
            return new FaqEntry(compiled, answer);
        }
    }

    static List<FaqEntry> defaultEntries() {
        return List.of(
                FaqEntry.of("""
                        **Leave Policy:**
                        - **Casual Leave:** 12 days/year
                        - **Sick Leave:** 10 days/year
                        - **Earned Leave:** 15 days/year

                        Unused earned leave can be carried forward (max 30 days). \
                        Casual leaves cannot be carried forward.""",
                        "\\bleave policy\\b", "\\bhow many leaves\\b", "\\bleave entitlement\\b"),
                FaqEntry.of("""
                        **Company Holidays 2026:**
                        - Jan 26 — Republic Day
                        - Mar 14 — Holi
                        - Apr 14 — Ambedkar Jayanti
                        - May 1 — May Day
                        - Aug 15 — Independence Day
                        - Oct 2 — Gandhi Jayanti
                        - Oct 20 — Dussehra
                        - Nov 9 — Diwali
                        - Dec 25 — Christmas""",
                        "\\bcompany holidays\\b", "\\bpublic holidays\\b", "\\bholiday list\\b"),
                FaqEntry.of("""
                        **Working Hours:** 9:00 AM to 6:00 PM (Mon-Fri)
                        **Lunch Break:** 1:00 PM to 2:00 PM
                        Flexible timing available with manager approval.""",
                        "\\bworking hours\\b", "\\boffice timings?\\b", "\\bwork schedule\\b"),
                FaqEntry.of("""
                        I'm your **HRMS Agent**. I can help you with:
                        - 🔍 Employee lookup (by code or name)
                        - 📋 Leave management (apply, status, approve/reject)
                        - ⏰ Attendance records
                        - 💰 Payroll & salary slips
                        - 📊 Company statistics
                        - ➕ Add/update employees (HR admin only)
                        - 🚪 Resignation management (HR admin only)
                        - 👥 Role management (super admin only)

                        Just ask in plain English!""",
                        "\\bhelp\\b", "\\bwhat can you do\\b", "\\bcapabilities\\b"));
    }
}
