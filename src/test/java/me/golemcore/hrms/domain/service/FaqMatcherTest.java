package me.golemcore.hrms.domain.service;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FaqMatcherTest {

    private final FaqMatcher matcher = new FaqMatcher();

    @Test
    void shouldAnswerHolidayQuestion() {
        Optional<String> answer = matcher.match("what are the public holidays");

        assertTrue(answer.isPresent());
        assertTrue(answer.get().contains("Company Holidays"));
    }

    @Test
    void shouldMatchCaseInsensitivelyAndIgnoreSurroundingWhitespace() {
        Optional<String> lower = matcher.match("what is the leave policy?");
        Optional<String> upper = matcher.match("   WHAT IS THE LEAVE POLICY?   ");

        assertTrue(lower.isPresent());
        assertEquals(lower, upper);
    }

    @Test
    void shouldMatchOptionalPluralInPattern() {
        assertEquals(matcher.match("office timing"), matcher.match("office timings"));
        assertTrue(matcher.match("office timings").get().contains("Working Hours"));
    }

    @Test
    void shouldReturnEmptyWhenNothingMatches() {
        assertTrue(matcher.match("show my payroll").isEmpty());
        assertTrue(matcher.match("").isEmpty());
        assertTrue(matcher.match(null).isEmpty());
    }

    @Test
    void shouldRequireWholeWordMatch() {
        assertTrue(matcher.match("helpdesk ticket status").isEmpty());
    }

    @Test
    void shouldPreferFirstEntryWhenSeveralMatch() {
        FaqMatcher ordered = new FaqMatcher(List.of(
                FaqMatcher.FaqEntry.of("first", "\\bpayroll\\b"),
                FaqMatcher.FaqEntry.of("second", "\\bmy payroll\\b")));

        assertEquals("first", ordered.match("show my payroll").orElseThrow());
    }

    @Test
    void shouldBeDeterministic() {
        String query = "what can you do for me";
        assertEquals(matcher.match(query), matcher.match(query));
        assertTrue(matcher.match(query).get().contains("HRMS Agent"));
    }

    @Test
    void shouldShipFourDefaultEntries() {
        assertEquals(4, matcher.getEntries().size());
    }

    @Test
    void shouldReturnHolidayListVerbatim() {
        String answer = matcher.match("holiday list").orElseThrow();

        assertTrue(answer.startsWith("**Company Holidays 2026:**\n- Jan 26 — Republic Day\n"));
        assertTrue(answer.endsWith("- Dec 25 — Christmas"));
    }

    @Test
    void shouldKeepIconsInCapabilitiesList() {
        String answer = matcher.match("help").orElseThrow();

        assertTrue(answer.contains("- 🔍 Employee lookup (by code or name)\n"));
        assertTrue(answer.contains("- 👥 Role management (super admin only)\n\nJust ask in plain English!"));
    }
}
