package com.example.almanac.action;

import com.example.almanac.common.ConfigException;
import com.example.almanac.common.JsonListConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import okhttp3.HttpUrl;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * What a job does when it fires:
 * {@code NOTIFY(channel, target, template)}, {@code COMMAND(argv, timeoutSeconds)} or
 * {@code WEBHOOK(url, payload)}. Only the fields of the active {@link #type} are used.
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobAction {

    private static final Set<String> WEBHOOK_METHODS = Set.of("POST", "PUT", "PATCH", "GET");

    @Enumerated(EnumType.STRING)
    @Column(name = "action_type", nullable = false)
    private ActionType type;

    // NOTIFY
    @Column(name = "notify_channel")
    private String channel;

    @Column(name = "notify_target")
    private String target;

    @Column(name = "notify_template", length = 4096)
    private String template;

    // COMMAND
    @Convert(converter = JsonListConverter.class)
    @Column(name = "command_argv", length = 4096)
    @Builder.Default
    private List<String> argv = new ArrayList<>();

    @Column(name = "timeout_seconds")
    private Integer timeoutSeconds;

    @Column(name = "working_directory")
    private String workingDirectory;

    // WEBHOOK
    @Column(name = "webhook_url", length = 2048)
    private String url;

    @Column(name = "webhook_method")
    private String method;

    @Column(name = "webhook_payload", length = 8192)
    private String payload;

    public static JobAction notify(String channel, String target, String template) {
        return JobAction.builder().type(ActionType.NOTIFY).channel(channel).target(target).template(template).build();
    }

    public static JobAction command(List<String> argv, int timeoutSeconds) {
        return JobAction.builder().type(ActionType.COMMAND).argv(new ArrayList<>(argv)).timeoutSeconds(timeoutSeconds).build();
    }

    public static JobAction webhook(String url, String payload) {
        return JobAction.builder().type(ActionType.WEBHOOK).url(url).payload(payload).build();
    }

    /**
     * @throws ConfigException if the action is missing what its type needs
     */
    public void validate(int maxTimeoutSeconds) {
        if (type == null) {
            throw new ConfigException("Action type is required (NOTIFY, COMMAND or WEBHOOK)");
        }
        switch (type) {
            case NOTIFY -> {
                if (isBlank(channel) || isBlank(target)) {
                    throw new ConfigException("Notify action needs a channel and a target");
                }
                if (isBlank(template)) {
                    throw new ConfigException("Notify action needs a message template");
                }
            }
            case COMMAND -> {
                if (argv == null || argv.isEmpty() || isBlank(argv.get(0))) {
                    throw new ConfigException("Command action needs a non-empty argv");
                }
                if (timeoutSeconds != null && (timeoutSeconds <= 0 || timeoutSeconds > maxTimeoutSeconds)) {
                    throw new ConfigException("Command timeout must be between 1 and " + maxTimeoutSeconds + " seconds");
                }
            }
            case WEBHOOK -> {
                if (isBlank(url) || HttpUrl.parse(url) == null) {
                    throw new ConfigException("Webhook action needs a valid http(s) url, got '" + url + "'");
                }
                if (method != null && !WEBHOOK_METHODS.contains(method.toUpperCase(Locale.ROOT))) {
                    throw new ConfigException("Unsupported webhook method '" + method + "'");
                }
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
