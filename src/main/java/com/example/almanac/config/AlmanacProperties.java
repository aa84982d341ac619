package com.example.almanac.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Central configuration for Almanac.
 * Maps to the 'almanac' prefix in application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "almanac")
public class AlmanacProperties {

    private SchedulerConfig scheduler = new SchedulerConfig();
    private ActionConfig actions = new ActionConfig();
    private AlertConfig alerts = new AlertConfig();
    private OutboxConfig outbox = new OutboxConfig();
    private ChannelConfig channels = new ChannelConfig();
    private EventLogConfig eventLog = new EventLogConfig();
    /** Dependent processes the alert engine may restart, keyed by process name. */
    private Map<String, ProcessConfig> processes = new HashMap<>();

    @Data
    public static class SchedulerConfig {
        private boolean enabled = true;
        private long tickMillis = 5000;
        private boolean recoverOnStartup = true;
    }

    @Data
    public static class ActionConfig {
        private int defaultCommandTimeoutSeconds = 60;
        private int maxCommandTimeoutSeconds = 3600;
        private int webhookTimeoutSeconds = 30;
        private int outputLimitChars = 4000;
        private int shutdownGraceSeconds = 10;
        private String notifySender = "almanac";
    }

    @Data
    public static class AlertConfig {
        private boolean enabled = true;
        private long tickMillis = 30000;
        /** Consecutive fires after which notifications for a rule are suppressed. */
        private int breakerCeiling = 5;
        private int endpointTimeoutSeconds = 5;
        private String defaultChannel = "telegram";
        private String defaultTarget = "";
        private String sender = "watchtower";
        /** Insert the built-in rules at startup when their ids are absent. */
        private boolean seedDefaultRules = true;
        /** Platform data directory; the built-in PID-file and disk rules point into it. */
        private String dataDir = "~/.homestead";
        private String manorHealthUrl = "http://localhost:8700/health";
        private double diskLimitMb = 500;
    }

    @Data
    public static class OutboxConfig {
        private boolean enabled = true;
        private long pollMillis = 2000;
        private int maxAttempts = 5;
        private long baseBackoffSeconds = 2;
        private long maxBackoffSeconds = 300;
        /** Messages loaded per lane and pass. */
        private int batchSize = 100;
        private int maxLanesPerPass = 200;
    }

    @Data
    public static class ChannelConfig {
        private SlackConfig slack = new SlackConfig();
        private TelegramConfig telegram = new TelegramConfig();

        @Data
        public static class SlackConfig {
            private boolean enabled = false;
            private String webhookUrl = "";
        }

        @Data
        public static class TelegramConfig {
            private boolean enabled = false;
            private String botToken = "";
            private String apiBaseUrl = "https://api.telegram.org";
            private String parseMode = "HTML";
        }
    }

    @Data
    public static class EventLogConfig {
        private int retentionHours = 168;
        private int queryLimit = 1000;
    }

    @Data
    public static class ProcessConfig {
        /** Out-of-process health probe, e.g. [python, -c, "import herald.bot"]. */
        private List<String> probeCommand = new ArrayList<>();
        private List<String> restartCommand = new ArrayList<>();
        private String workingDirectory;
        private int probeTimeoutSeconds = 15;
        private int restartTimeoutSeconds = 60;
    }
}
