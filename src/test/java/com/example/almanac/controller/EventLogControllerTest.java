package com.example.almanac.controller;

import com.example.almanac.domain.EventLogEntry;
import com.example.almanac.eventlog.EventLevel;
import com.example.almanac.eventlog.EventLogService;
import com.example.almanac.support.MutableClock;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(EventLogController.class)
@Import(EventLogControllerTest.Config.class)
class EventLogControllerTest {

    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

    @TestConfiguration
    static class Config {
        @Bean
        MutableClock clock() {
            return new MutableClock(NOW);
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private EventLogService eventLogService;

    private static EventLogEntry entry(String message) {
        return EventLogEntry.builder().timestamp(NOW).level(EventLevel.INFO).source("herald.bot").message(message).build();
    }

    @Test
    void fullPageAnnouncesTheNextOne() throws Exception {
        when(eventLogService.queryLimit()).thenReturn(2);
        when(eventLogService.query("herald", null, NOW.minusSeconds(3600), NOW, 0))
                .thenReturn(List.of(entry("a"), entry("b")));

        mockMvc.perform(get("/api/events").param("source", "herald"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Next-Page", "1"))
                .andExpect(jsonPath("$.length()").value(2));
    }

    @Test
    void partialPageHasNoNextPage() throws Exception {
        when(eventLogService.queryLimit()).thenReturn(2);
        when(eventLogService.query("herald", null, NOW.minusSeconds(3600), NOW, 1))
                .thenReturn(List.of(entry("c")));

        mockMvc.perform(get("/api/events").param("source", "herald").param("page", "1"))
                .andExpect(status().isOk())
                .andExpect(header().doesNotExist("X-Next-Page"))
                .andExpect(jsonPath("$[0].message").value("c"));
    }

    @Test
    void unknownLevelIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/events").param("level", "loud"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void appendDefaultsToInfo() throws Exception {
        mockMvc.perform(post("/api/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"source\":\"herald.bot\",\"message\":\"started\",\"fields\":{\"v\":\"2\"}}"))
                .andExpect(status().isOk());

        verify(eventLogService).append(eq(EventLevel.INFO), eq("herald.bot"), eq("started"), anyMap());
    }
}
