package com.example.almanac.action;

import com.example.almanac.config.AlmanacProperties;
import com.example.almanac.eventlog.EventLevel;
import com.example.almanac.eventlog.EventLogService;
import com.example.almanac.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.*;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Runs the action of a job and records what happened.
 *
 * Failures never escape {@link #execute}: every path ends in an {@link Outcome} that has already
 * been written to the event log under source {@value #EVENT_SOURCE}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ActionExecutor {

    public static final String EVENT_SOURCE = "almanac.jobs";

    private static final MediaType JSON = MediaType.get("application/json");

    private final CommandRunner commandRunner;
    private final OutboxService outboxService;
    private final EventLogService eventLogService;
    private final OkHttpClient httpClient;
    private final AlmanacProperties properties;
    private final Clock clock;

    public Outcome execute(JobAction action, ActionContext context) {
        long start = System.nanoTime();
        Outcome outcome;
        try {
            outcome = switch (action.getType()) {
                case NOTIFY -> runNotify(action, context);
                case COMMAND -> runCommand(action);
                case WEBHOOK -> runWebhook(action);
            };
        } catch (ActionTimeoutException e) {
            outcome = Outcome.timeout(e.getMessage(), e.getFields());
        } catch (ActionExecutionException e) {
            outcome = Outcome.error(e.getMessage(), e.getFields());
        } catch (Exception e) {
            log.error("Action of job {} failed unexpectedly", context.jobId(), e);
            outcome = Outcome.error(e.getClass().getSimpleName() + ": " + e.getMessage(), null);
        }
        outcome = outcome.withDuration(Duration.ofNanos(System.nanoTime() - start));
        record(action, context, outcome);
        return outcome;
    }

    private Outcome runNotify(JobAction action, ActionContext context) {
        String body = render(action.getTemplate(), context);
        String dedupKey = "job:" + context.jobId() + ":run:" + context.runNumber();
        long messageId = outboxService.enqueue(action.getChannel(), action.getTarget(), body,
                properties.getActions().getNotifySender(), dedupKey);
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("outbox_id", messageId);
        fields.put("channel", action.getChannel());
        fields.put("target", action.getTarget());
        return Outcome.success("queued outbox message " + messageId, fields);
    }

    private Outcome runCommand(JobAction action) {
        int timeoutSeconds = action.getTimeoutSeconds() != null
                ? action.getTimeoutSeconds()
                : properties.getActions().getDefaultCommandTimeoutSeconds();
        CommandResult result = commandRunner.run(action.getArgv(), Duration.ofSeconds(timeoutSeconds),
                action.getWorkingDirectory());

        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("argv", action.getArgv());
        fields.put("exit_code", result.exitCode());
        fields.put("stdout", result.stdout());
        fields.put("stderr", result.stderr());
        if (!result.succeeded()) {
            throw new ActionExecutionException("Command exited with code " + result.exitCode(), fields);
        }
        return Outcome.success("exit 0", fields);
    }

    private Outcome runWebhook(JobAction action) {
        String method = action.getMethod() != null ? action.getMethod().toUpperCase(Locale.ROOT) : "POST";
        String payload = action.getPayload() != null ? action.getPayload() : "{}";

        Request.Builder builder = new Request.Builder().url(action.getUrl());
        if ("GET".equals(method)) {
            builder.get();
        } else {
            builder.method(method, RequestBody.create(payload, JSON));
        }

        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("url", action.getUrl());
        fields.put("method", method);
        try (Response response = httpClient.newCall(builder.build()).execute()) {
            fields.put("status_code", response.code());
            ResponseBody body = response.body();
            String text = body != null ? body.string() : "";
            int limit = properties.getActions().getOutputLimitChars();
            fields.put("response", text.length() <= limit ? text : text.substring(0, limit));
            if (!response.isSuccessful()) {
                throw new ActionExecutionException("Webhook answered HTTP " + response.code(), fields);
            }
            return Outcome.success("HTTP " + response.code(), fields);
        } catch (InterruptedIOException e) {
            throw new ActionTimeoutException("Webhook timed out: " + e.getMessage(), fields);
        } catch (IOException e) {
            fields.put("error", e.getMessage());
            throw new ActionExecutionException("Webhook request failed: " + e.getMessage(), fields);
        }
    }

    String render(String template, ActionContext context) {
        return template
                .replace("{{job_id}}", context.jobId())
                .replace("{{job_name}}", context.jobName() != null ? context.jobName() : context.jobId())
                .replace("{{run}}", Long.toString(context.runNumber()))
                .replace("{{now}}", clock.instant().toString());
    }

    private void record(JobAction action, ActionContext context, Outcome outcome) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("job_id", context.jobId());
        fields.put("job_name", context.jobName());
        fields.put("run", context.runNumber());
        fields.put("action", action.getType() != null ? action.getType().name() : null);
        fields.put("manual", context.manual());
        fields.putAll(outcome.toEventFields());

        EventLevel level = outcome.isSuccess() ? EventLevel.INFO : EventLevel.ERROR;
        String message = String.format("Job '%s' run %d %s: %s", context.jobName(), context.runNumber(),
                outcome.status().name().toLowerCase(Locale.ROOT), outcome.detail());
        eventLogService.append(level, EVENT_SOURCE, message, fields);

        if (outcome.isSuccess()) {
            log.info("Job {} run {} succeeded in {}ms", context.jobId(), context.runNumber(), outcome.duration().toMillis());
        } else {
            log.warn("Job {} run {} ended {}: {}", context.jobId(), context.runNumber(), outcome.status(), outcome.detail());
        }
    }
}
