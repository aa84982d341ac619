package com.example.almanac.outbox;

import com.example.almanac.config.AlmanacProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.*;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Telegram Bot API adapter ({@code sendMessage}). The target is a chat id.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "almanac.channels.telegram", name = "enabled", havingValue = "true")
public class TelegramChannelAdapter implements ChannelAdapter {

    private static final MediaType JSON = MediaType.get("application/json");
    /** Telegram rejects longer texts. */
    private static final int MAX_TEXT = 4096;

    private final AlmanacProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    @Override
    public String channel() {
        return "telegram";
    }

    @Override
    public void deliver(String target, String body) {
        AlmanacProperties.ChannelConfig.TelegramConfig config = properties.getChannels().getTelegram();
        if (config.getBotToken() == null || config.getBotToken().isEmpty()) {
            throw DeliveryException.permanent("Telegram bot token not configured");
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("chat_id", target);
        payload.put("text", body.length() <= MAX_TEXT ? body : body.substring(0, MAX_TEXT - 3) + "...");
        if (config.getParseMode() != null && !config.getParseMode().isEmpty()) {
            payload.put("parse_mode", config.getParseMode());
        }
        payload.put("disable_web_page_preview", true);

        String url = stripTrailingSlash(config.getApiBaseUrl()) + "/bot" + config.getBotToken() + "/sendMessage";
        try {
            String json = objectMapper.writeValueAsString(payload);
            Request request = new Request.Builder()
                    .url(url)
                    .post(RequestBody.create(json, JSON))
                    .build();

            try (Response response = httpClient.newCall(request).execute()) {
                HttpStatusMapping.check("Telegram", response);
                log.debug("Telegram message delivered to chat {}", target);
            }
        } catch (IOException e) {
            throw new DeliveryException("Telegram request failed: " + e.getMessage(), false, e);
        }
    }

    private static String stripTrailingSlash(String value) {
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }
}
