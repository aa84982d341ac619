package com.example.almanac.eventlog;

import com.example.almanac.config.AlmanacProperties;
import com.example.almanac.domain.EventLogEntry;
import com.example.almanac.repository.EventLogRepository;
import com.example.almanac.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.annotation.DirtiesContext;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@Import({EventLogService.class, EventLogServiceTest.Config.class})
class EventLogServiceTest {

    private static final Instant T0 = Instant.parse("2026-03-10T12:00:00Z");

    @TestConfiguration
    static class Config {
        @Bean
        MutableClock clock() {
            return new MutableClock(T0);
        }

        @Bean
        AlmanacProperties almanacProperties() {
            return new AlmanacProperties();
        }
    }

    @Autowired
    private EventLogService eventLogService;
    @Autowired
    private EventLogRepository repository;
    @Autowired
    private AlmanacProperties properties;
    @Autowired
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock.set(T0);
        eventLogService.append(EventLevel.INFO, "herald.bot", "started", Map.of("version", "2.1"));
        clock.advance(Duration.ofSeconds(10));
        eventLogService.append(EventLevel.ERROR, "herald.bot", "handler crashed");
        clock.advance(Duration.ofSeconds(10));
        eventLogService.append(EventLevel.CRITICAL, "herald.scheduler", "database locked");
        clock.advance(Duration.ofSeconds(10));
        eventLogService.append(EventLevel.ERROR, "heraldry", "not herald, shares a prefix");
        clock.advance(Duration.ofSeconds(10));
        eventLogService.append(EventLevel.WARNING, "almanac.alerts", "Alert fired");
    }

    @Test
    void queryFiltersBySourcePrefixAndLevelOldestFirst() {
        List<EventLogEntry> herald = eventLogService.query("herald.", null, T0, T0.plusSeconds(60));
        assertEquals(List.of("started", "handler crashed", "database locked"),
                herald.stream().map(EventLogEntry::getMessage).toList());

        List<EventLogEntry> errors = eventLogService.query(null, EventLevel.ERROR, T0, T0.plusSeconds(60));
        assertEquals(2, errors.size());
    }

    @Test
    void fieldsSurviveTheRoundTrip() {
        EventLogEntry started = eventLogService.query("herald.bot", EventLevel.INFO, T0, T0).get(0);
        assertEquals("2.1", started.getFields().get("version"));
        assertEquals(T0, started.getTimestamp());
    }

    @Test
    void countIncludesMoreSevereLevels() {
        assertEquals(2, eventLogService.countAtOrAbove(EventLevel.ERROR, "herald.", T0, T0.plusSeconds(60)));
        assertEquals(3, eventLogService.countAtOrAbove(EventLevel.ERROR, null, T0, T0.plusSeconds(60)));
        assertEquals(4, eventLogService.countAtOrAbove(EventLevel.WARNING, "", T0, T0.plusSeconds(60)));
    }

    @Test
    void windowBoundsAreInclusive() {
        assertEquals(1, eventLogService.countAtOrAbove(EventLevel.ERROR, "herald.bot", T0.plusSeconds(10), T0.plusSeconds(10)));
        assertEquals(0, eventLogService.countAtOrAbove(EventLevel.ERROR, "herald.bot", T0.plusSeconds(11), T0.plusSeconds(60)));
    }

    @Test
    void latestIsNewestFirst() {
        List<EventLogEntry> latest = eventLogService.latest("herald", T0, T0.plusSeconds(60), 2);
        assertEquals(List.of("database locked", "handler crashed"),
                latest.stream().map(EventLogEntry::getMessage).toList());
        assertTrue(eventLogService.latestOne("herald.bot", T0.plusSeconds(11), T0.plusSeconds(60)).isEmpty());
    }

    @Test
    void sourceMatchesWholeDottedComponents() {
        assertEquals(3, eventLogService.query("herald", null, T0, T0.plusSeconds(60)).size());
        assertEquals(1, eventLogService.query("heraldry", null, T0, T0.plusSeconds(60)).size());
        assertEquals(0, eventLogService.query("herald.bo", null, T0, T0.plusSeconds(60)).size());
        assertEquals(1, eventLogService.countAtOrAbove(EventLevel.ERROR, "heraldry", T0, T0.plusSeconds(60)));
    }

    @Test
    void likeWildcardsInSourceAreLiteral() {
        eventLogService.append(EventLevel.ERROR, "almanac_jobs", "underscore source");

        assertEquals(0, eventLogService.query("almanac%", null, T0, T0.plusSeconds(60)).size());
        assertEquals(0, eventLogService.query("her_ld", null, T0, T0.plusSeconds(60)).size());
        assertEquals(1, eventLogService.query("almanac_jobs", null, T0, T0.plusSeconds(60)).size());
        assertEquals(List.of("Alert fired"), eventLogService.query("almanac", null, T0, T0.plusSeconds(60))
                .stream().map(EventLogEntry::getMessage).toList());
    }

    @Test
    @DirtiesContext(methodMode = DirtiesContext.MethodMode.AFTER_METHOD)
    void queryPagesPastTheLimit() {
        properties.getEventLog().setQueryLimit(2);

        List<EventLogEntry> first = eventLogService.query(null, null, T0, T0.plusSeconds(60));
        List<EventLogEntry> second = eventLogService.query(null, null, T0, T0.plusSeconds(60), 1);
        List<EventLogEntry> third = eventLogService.query(null, null, T0, T0.plusSeconds(60), 2);

        assertEquals(List.of("started", "handler crashed"), first.stream().map(EventLogEntry::getMessage).toList());
        assertEquals(List.of("database locked", "not herald, shares a prefix"),
                second.stream().map(EventLogEntry::getMessage).toList());
        assertEquals(List.of("Alert fired"), third.stream().map(EventLogEntry::getMessage).toList());
    }

    @Test
    void oversizedControlCharacterOutputIsStillRecorded() {
        String noisy = "\u0001\u0002\u0003\u0004".repeat(1000);
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("exit_code", 0);
        fields.put("stdout", noisy);
        fields.put("stderr", noisy);
        clock.set(T0.plusSeconds(45));

        eventLogService.append(EventLevel.INFO, "almanac.jobs", "Job 'noisy' run 1 success: exit 0", fields);

        List<EventLogEntry> recorded = eventLogService.query("almanac.jobs", null, T0.plusSeconds(45), T0.plusSeconds(45));
        assertEquals(1, recorded.size());
        Map<String, Object> stored = recorded.get(0).getFields();
        assertEquals(0, stored.get("exit_code"));
        assertTrue(((String) stored.get("stdout")).endsWith("...[truncated]"));
        assertTrue(((String) stored.get("stderr")).endsWith("...[truncated]"));
    }

    @Test
    void fieldsThatCannotBeShrunkAreReplacedByAMarker() {
        Map<String, Object> fields = new LinkedHashMap<>();
        for (int i = 0; i < 2000; i++) {
            fields.put("key_" + i, i);
        }

        Map<String, Object> fitted = eventLogService.fitFields(fields);

        assertEquals(Boolean.TRUE, fitted.get("fields_dropped"));
        assertTrue((Integer) fitted.get("fields_chars") > EventLogEntry.FIELDS_LENGTH);
    }

    @Test
    void purgeDropsExpiredEntries() {
        properties.getEventLog().setRetentionHours(1);
        clock.set(T0.plus(Duration.ofHours(1)).plusSeconds(25));

        eventLogService.purgeExpired();

        assertEquals(List.of("not herald, shares a prefix", "Alert fired"),
                repository.findAll().stream()
                        .sorted(Comparator.comparing(EventLogEntry::getId))
                        .map(EventLogEntry::getMessage).toList());
    }
}
