package com.example.almanac.eventlog;

import com.example.almanac.common.JsonMapConverter;
import com.example.almanac.config.AlmanacProperties;
import com.example.almanac.domain.EventLogEntry;
import com.example.almanac.repository.EventLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Append/read access to the shared event log. The scheduler records job outcomes here and
 * the alert engine reads it back, so neither needs a reference to the other.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EventLogService {

    private final EventLogRepository repository;
    private final AlmanacProperties properties;
    private final Clock clock;

    private final JsonMapConverter fieldsConverter = new JsonMapConverter();

    /**
     * Append an event synchronously, so callers can rely on it being visible once this returns.
     */
    public void append(EventLevel level, String source, String message, Map<String, Object> fields) {
        try {
            EventLogEntry entry = EventLogEntry.builder()
                    .timestamp(clock.instant())
                    .level(level)
                    .source(source)
                    .message(truncate(message, 4096))
                    .fields(fitFields(fields))
                    .build();
            repository.save(entry);
            log.debug("Event: [{}] {} {}", level, source, message);
        } catch (Exception e) {
            log.error("Failed to append event from {}: {}", source, e.getMessage());
        }
    }

    public void append(EventLevel level, String source, String message) {
        append(level, source, message, null);
    }

    /**
     * Events from {@code source} and its dotted children (any source when null), optionally of
     * exactly {@code level}, within [since, until], oldest first.
     *
     * <p>Returns at most {@code queryLimit} events; use {@link #query(String, EventLevel, Instant, Instant, int)}
     * to page past them.</p>
     */
    public List<EventLogEntry> query(String source, EventLevel level, Instant since, Instant until) {
        return query(source, level, since, until, 0);
    }

    /** One page of {@code queryLimit} events, oldest first. */
    public List<EventLogEntry> query(String source, EventLevel level, Instant since, Instant until, int page) {
        String prefix = normalizeSource(source);
        return repository.query(prefix, childrenPattern(prefix), level, since, until,
                PageRequest.of(Math.max(0, page), queryLimit()));
    }

    public int queryLimit() {
        return properties.getEventLog().getQueryLimit();
    }

    /** Count events at {@code minLevel} or more severe. */
    public long countAtOrAbove(EventLevel minLevel, String source, Instant since, Instant until) {
        String prefix = normalizeSource(source);
        return repository.countByLevels(minLevel.andAbove(), prefix, childrenPattern(prefix), since, until);
    }

    /** Most recent events first, used by predicates that only care about the newest datapoint. */
    public List<EventLogEntry> latest(String source, Instant since, Instant until, int limit) {
        String prefix = normalizeSource(source);
        return repository.findLatest(prefix, childrenPattern(prefix), since, until, PageRequest.of(0, limit));
    }

    public Optional<EventLogEntry> latestOne(String source, Instant since, Instant until) {
        return latest(source, since, until, 1).stream().findFirst();
    }

    @Scheduled(fixedDelay = 3_600_000, initialDelay = 60_000)
    public void purgeExpired() {
        int hours = properties.getEventLog().getRetentionHours();
        if (hours <= 0) return;
        Instant cutoff = clock.instant().minus(Duration.ofHours(hours));
        int removed = repository.deleteOlderThan(cutoff);
        if (removed > 0) {
            log.info("Purged {} event log entries older than {}", removed, cutoff);
        }
    }

    /**
     * Shrink the fields until their JSON fits the column. The longest string value is halved
     * each round; when that is not enough the fields are replaced by a marker, so the event itself
     * is still written.
     */
    Map<String, Object> fitFields(Map<String, Object> fields) {
        Map<String, Object> fitted = fields != null ? new LinkedHashMap<>(fields) : new LinkedHashMap<>();
        try {
            int size = serializedSize(fitted);
            int rounds = 0;
            while (size > EventLogEntry.FIELDS_LENGTH && rounds++ < 32) {
                String key = longestString(fitted);
                if (key == null) break;
                String value = (String) fitted.get(key);
                fitted.put(key, value.substring(0, value.length() / 2) + "...[truncated]");
                size = serializedSize(fitted);
            }
            if (size <= EventLogEntry.FIELDS_LENGTH) {
                return fitted;
            }
            log.warn("Event fields of {} chars do not fit, dropping them", size);
            Map<String, Object> marker = new LinkedHashMap<>();
            marker.put("fields_dropped", true);
            marker.put("fields_chars", size);
            return marker;
        } catch (IllegalArgumentException e) {
            Map<String, Object> marker = new LinkedHashMap<>();
            marker.put("fields_error", e.getMessage());
            return marker;
        }
    }

    private int serializedSize(Map<String, Object> fields) {
        String json = fieldsConverter.convertToDatabaseColumn(fields);
        return json != null ? json.length() : 0;
    }

    private static String longestString(Map<String, Object> fields) {
        String longest = null;
        int longestLength = 32;
        for (Map.Entry<String, Object> entry : fields.entrySet()) {
            if (entry.getValue() instanceof String text && text.length() > longestLength) {
                longest = entry.getKey();
                longestLength = text.length();
            }
        }
        return longest;
    }

    /** Blank means any source; a trailing dot is dropped, so "herald." and "herald" are the same filter. */
    static String normalizeSource(String source) {
        if (source == null) return null;
        String trimmed = source.strip();
        while (trimmed.endsWith(".")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed.isEmpty() ? null : trimmed;
    }

    /** LIKE pattern for the dotted children of {@code source}, with '!' as escape character. */
    static String childrenPattern(String source) {
        if (source == null) return null;
        String escaped = source.replace("!", "!!").replace("%", "!%").replace("_", "!_");
        return escaped + ".%";
    }

    private static String truncate(String value, int max) {
        if (value == null) return "";
        return value.length() <= max ? value : value.substring(0, max - 3) + "...";
    }
}
