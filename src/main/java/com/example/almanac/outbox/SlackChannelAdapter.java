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
 * Slack incoming-webhook adapter. The target is either a full webhook URL or a channel name
 * posted through the configured default webhook.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "almanac.channels.slack", name = "enabled", havingValue = "true")
public class SlackChannelAdapter implements ChannelAdapter {

    private static final MediaType JSON = MediaType.get("application/json");

    private final AlmanacProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    @Override
    public String channel() {
        return "slack";
    }

    @Override
    public void deliver(String target, String body) {
        boolean targetIsUrl = target.startsWith("https://") || target.startsWith("http://");
        String webhookUrl = targetIsUrl ? target : properties.getChannels().getSlack().getWebhookUrl();
        if (webhookUrl == null || webhookUrl.isEmpty()) {
            throw DeliveryException.permanent("Slack webhook URL not configured");
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("text", body);
        payload.put("username", "Almanac");
        if (!targetIsUrl) {
            payload.put("channel", target);
        }

        try {
            String json = objectMapper.writeValueAsString(payload);
            Request request = new Request.Builder()
                    .url(webhookUrl)
                    .post(RequestBody.create(json, JSON))
                    .build();

            try (Response response = httpClient.newCall(request).execute()) {
                HttpStatusMapping.check("Slack", response);
                log.debug("Slack message delivered to {}", targetIsUrl ? "webhook" : target);
            }
        } catch (IOException e) {
            throw new DeliveryException("Slack request failed: " + e.getMessage(), false, e);
        }
    }
}
