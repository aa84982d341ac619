package com.example.almanac.domain;

import com.example.almanac.common.JsonMapConverter;
import com.example.almanac.eventlog.EventLevel;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One structured event. Written by every process of the platform, never updated.
 */
@Entity
@Table(name = "event_log", indexes = {
        @Index(name = "idx_event_ts_level", columnList = "timestamp, level"),
        @Index(name = "idx_event_source", columnList = "source")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventLogEntry {

    /** Column size of the serialized {@link #fields}. */
    public static final int FIELDS_LENGTH = 16384;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Instant timestamp;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private EventLevel level;

    /** Dotted origin, e.g. "herald.bot" or "almanac.jobs"; queries match by prefix. */
    @Column(nullable = false)
    private String source;

    @Column(nullable = false, length = 4096)
    private String message;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "fields", length = FIELDS_LENGTH)
    @Builder.Default
    private Map<String, Object> fields = new LinkedHashMap<>();

    @PrePersist
    protected void onCreate() {
        if (timestamp == null) timestamp = Instant.now();
    }
}
