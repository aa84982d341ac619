package com.example.almanac.scheduler;

import com.example.almanac.common.ConfigException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

import static org.junit.jupiter.api.Assertions.*;

class CronExpressionTest {

    private static final ZoneId UTC = ZoneId.of("UTC");

    @Test
    void dailyJobRollsOverMonthEnd() {
        CronExpression cron = CronExpression.parse("0 9 * * *");
        assertEquals(Instant.parse("2026-02-01T09:00:00Z"), cron.next(Instant.parse("2026-01-31T09:00:01Z")));
    }

    @Test
    void nextIsStrictlyAfterAMatchingInstant() {
        CronExpression cron = CronExpression.parse("0 9 * * *");
        assertEquals(Instant.parse("2026-01-02T09:00:00Z"), cron.next(Instant.parse("2026-01-01T09:00:00Z")));
    }

    @Test
    void everyMinuteIsMinuteAligned() {
        CronExpression cron = CronExpression.parse("* * * * *");
        assertEquals(Instant.parse("2026-03-10T12:35:00Z"), cron.next(Instant.parse("2026-03-10T12:34:56.789Z")));
    }

    @Test
    void stepsRangesAndLists() {
        CronExpression cron = CronExpression.parse("*/15 8-10 * * *");
        assertEquals(Instant.parse("2026-03-10T08:00:00Z"), cron.next(Instant.parse("2026-03-10T07:59:00Z")));
        assertEquals(Instant.parse("2026-03-10T10:45:00Z"), cron.next(Instant.parse("2026-03-10T10:30:00Z")));
        assertEquals(Instant.parse("2026-03-11T08:00:00Z"), cron.next(Instant.parse("2026-03-10T10:45:00Z")));

        CronExpression list = CronExpression.parse("5,35 * * * *");
        assertEquals(Instant.parse("2026-03-10T12:35:00Z"), list.next(Instant.parse("2026-03-10T12:05:00Z")));
    }

    @Test
    void monthAndDayNames() {
        CronExpression cron = CronExpression.parse("0 0 1 jan-mar *");
        assertEquals(Instant.parse("2027-01-01T00:00:00Z"), cron.next(Instant.parse("2026-03-01T00:00:00Z")));

        // 2026-03-10 is a Tuesday
        CronExpression fridays = CronExpression.parse("30 17 * * FRI");
        assertEquals(Instant.parse("2026-03-13T17:30:00Z"), fridays.next(Instant.parse("2026-03-10T00:00:00Z")));
    }

    @Test
    void sundayIsBothZeroAndSeven() {
        Instant after = Instant.parse("2026-03-10T00:00:00Z");
        Instant expected = Instant.parse("2026-03-15T00:00:00Z");
        assertEquals(expected, CronExpression.parse("0 0 * * 0").next(after));
        assertEquals(expected, CronExpression.parse("0 0 * * 7").next(after));
        assertEquals(expected, CronExpression.parse("0 0 * * SUN").next(after));
    }

    @Test
    void restrictedDayOfMonthAndDayOfWeekCombineWithOr() {
        // the 13th, or any Friday
        CronExpression cron = CronExpression.parse("0 0 13 * 5");
        // 2026-03-06 is a Friday, not the 13th
        assertTrue(cron.dayMatches(ZonedDateTime.of(2026, 3, 6, 0, 0, 0, 0, UTC)));
        // 2026-04-13 is a Monday
        assertTrue(cron.dayMatches(ZonedDateTime.of(2026, 4, 13, 0, 0, 0, 0, UTC)));
        assertFalse(cron.dayMatches(ZonedDateTime.of(2026, 3, 10, 0, 0, 0, 0, UTC)));
        assertEquals(Instant.parse("2026-03-06T00:00:00Z"), cron.next(Instant.parse("2026-03-01T00:00:00Z")));
    }

    @Test
    void starredDayOfWeekLeavesDayOfMonthAlone() {
        CronExpression cron = CronExpression.parse("0 0 13 * *");
        assertFalse(cron.dayMatches(ZonedDateTime.of(2026, 3, 6, 0, 0, 0, 0, UTC)));
        assertTrue(cron.dayMatches(ZonedDateTime.of(2026, 3, 13, 0, 0, 0, 0, UTC)));
    }

    @Test
    void steppedStarStillCountsAsStar() {
        // "*/2" in day-of-month starts with "*", so day-of-week alone decides among odd days
        CronExpression cron = CronExpression.parse("0 0 */2 * MON");
        // 2026-03-09 is a Monday, day 9 is in */2 (1,3,5,...)
        assertTrue(cron.dayMatches(ZonedDateTime.of(2026, 3, 9, 0, 0, 0, 0, UTC)));
        // 2026-03-16 is a Monday but day 16 is even
        assertFalse(cron.dayMatches(ZonedDateTime.of(2026, 3, 16, 0, 0, 0, 0, UTC)));
        // 2026-03-11 is odd but a Wednesday
        assertFalse(cron.dayMatches(ZonedDateTime.of(2026, 3, 11, 0, 0, 0, 0, UTC)));
    }

    @Test
    void leapDayIsFound() {
        CronExpression cron = CronExpression.parse("0 12 29 2 *");
        assertEquals(Instant.parse("2028-02-29T12:00:00Z"), cron.next(Instant.parse("2026-03-01T00:00:00Z")));
    }

    @Test
    void evaluatesInTheGivenZone() {
        CronExpression cron = CronExpression.parse("0 9 * * *");
        ZoneId berlin = ZoneId.of("Europe/Berlin");
        // 09:00 CET is 08:00 UTC in January
        assertEquals(Instant.parse("2026-01-15T08:00:00Z"), cron.next(Instant.parse("2026-01-15T07:00:00Z"), berlin));
    }

    @Test
    void skipsNonexistentLocalTimeInDstGap() {
        // 2026-03-29 02:30 does not exist in Berlin
        CronExpression cron = CronExpression.parse("30 2 * * *");
        ZoneId berlin = ZoneId.of("Europe/Berlin");
        Instant next = cron.next(Instant.parse("2026-03-28T23:00:00Z"), berlin);
        assertEquals(Instant.parse("2026-03-30T00:30:00Z"), next);
    }

    @Test
    void rejectsMalformedExpressions() {
        assertThrows(ConfigException.class, () -> CronExpression.parse(""));
        assertThrows(ConfigException.class, () -> CronExpression.parse("* * * *"));
        assertThrows(ConfigException.class, () -> CronExpression.parse("* * * * * *"));
        assertThrows(ConfigException.class, () -> CronExpression.parse("60 * * * *"));
        assertThrows(ConfigException.class, () -> CronExpression.parse("* 24 * * *"));
        assertThrows(ConfigException.class, () -> CronExpression.parse("* * 0 * *"));
        assertThrows(ConfigException.class, () -> CronExpression.parse("* * * 13 *"));
        assertThrows(ConfigException.class, () -> CronExpression.parse("* * * * 8"));
        assertThrows(ConfigException.class, () -> CronExpression.parse("*/0 * * * *"));
        assertThrows(ConfigException.class, () -> CronExpression.parse("10-5 * * * *"));
        assertThrows(ConfigException.class, () -> CronExpression.parse("a * * * *"));
        assertThrows(ConfigException.class, () -> CronExpression.parse("1,,2 * * * *"));
    }

    @Test
    void rejectsExpressionThatNeverFires() {
        assertThrows(ConfigException.class, () -> CronExpression.parse("0 0 30 2 *"));
        assertThrows(ConfigException.class, () -> CronExpression.parse("0 0 31 4 *"));
    }
}
