package com.example.almanac.outbox;

import com.example.almanac.config.AlmanacProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TelegramChannelAdapterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockWebServer server;
    private AlmanacProperties properties;
    private TelegramChannelAdapter adapter;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        properties = new AlmanacProperties();
        properties.getChannels().getTelegram().setEnabled(true);
        properties.getChannels().getTelegram().setBotToken("123:abc");
        properties.getChannels().getTelegram().setApiBaseUrl(server.url("/").toString());
        OkHttpClient client = new OkHttpClient.Builder().readTimeout(2, TimeUnit.SECONDS).build();
        adapter = new TelegramChannelAdapter(properties, client, objectMapper);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void postsSendMessageForChat() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"ok\":true}"));

        adapter.deliver("4242", "backup finished");

        RecordedRequest request = server.takeRequest();
        assertEquals("POST", request.getMethod());
        assertEquals("/bot123:abc/sendMessage", request.getPath());
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertEquals("4242", body.get("chat_id").asText());
        assertEquals("backup finished", body.get("text").asText());
        assertEquals("HTML", body.get("parse_mode").asText());
        assertTrue(body.get("disable_web_page_preview").asBoolean());
    }

    @Test
    void longTextIsCut() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"ok\":true}"));

        adapter.deliver("4242", "x".repeat(5000));

        JsonNode body = objectMapper.readTree(server.takeRequest().getBody().readUtf8());
        assertEquals(4096, body.get("text").asText().length());
    }

    @Test
    void rateLimitIsRetryable() {
        server.enqueue(new MockResponse().setResponseCode(429).setBody("{\"ok\":false,\"description\":\"Too Many Requests\"}"));

        DeliveryException e = assertThrows(DeliveryException.class, () -> adapter.deliver("4242", "hi"));
        assertFalse(e.isPermanent());
        assertTrue(e.getMessage().contains("429"));
    }

    @Test
    void serverErrorIsRetryable() {
        server.enqueue(new MockResponse().setResponseCode(502));

        DeliveryException e = assertThrows(DeliveryException.class, () -> adapter.deliver("4242", "hi"));
        assertFalse(e.isPermanent());
    }

    @Test
    void badRequestIsPermanent() {
        server.enqueue(new MockResponse().setResponseCode(400).setBody("{\"ok\":false,\"description\":\"chat not found\"}"));

        DeliveryException e = assertThrows(DeliveryException.class, () -> adapter.deliver("0", "hi"));
        assertTrue(e.isPermanent());
        assertTrue(e.getMessage().contains("chat not found"));
    }

    @Test
    void missingTokenIsPermanent() {
        properties.getChannels().getTelegram().setBotToken("");

        DeliveryException e = assertThrows(DeliveryException.class, () -> adapter.deliver("4242", "hi"));
        assertTrue(e.isPermanent());
        assertEquals(0, server.getRequestCount());
    }

    @Test
    void connectionFailureIsRetryable() {
        // nothing listens on port 1
        properties.getChannels().getTelegram().setApiBaseUrl("http://127.0.0.1:1/");

        DeliveryException e = assertThrows(DeliveryException.class, () -> adapter.deliver("4242", "hi"));
        assertFalse(e.isPermanent());
    }
}
