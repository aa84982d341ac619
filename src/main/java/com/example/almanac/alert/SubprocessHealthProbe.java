package com.example.almanac.alert;

import com.example.almanac.action.ActionExecutionException;
import com.example.almanac.action.ActionTimeoutException;
import com.example.almanac.action.CommandResult;
import com.example.almanac.action.CommandRunner;
import com.example.almanac.config.AlmanacProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Runs the configured probe command of a process out of process, e.g.
 * {@code python -c "import herald.bot"}. Exit 0 means the process can start.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SubprocessHealthProbe implements HealthProbe {

    private final CommandRunner commandRunner;
    private final AlmanacProperties properties;

    @Override
    public ProbeResult probe(String processName) {
        AlmanacProperties.ProcessConfig config = properties.getProcesses().get(processName);
        if (config == null) {
            throw new ProbeException("Unknown process '" + processName + "'");
        }
        if (config.getProbeCommand() == null || config.getProbeCommand().isEmpty()) {
            return ProbeResult.failed("No probe command configured for " + processName);
        }

        try {
            CommandResult result = commandRunner.run(config.getProbeCommand(),
                    Duration.ofSeconds(config.getProbeTimeoutSeconds()), config.getWorkingDirectory());
            if (result.succeeded()) {
                log.info("Health probe for {} passed ({}ms)", processName, result.duration().toMillis());
                return ProbeResult.ok("probe passed");
            }
            String stderr = result.stderr().isBlank() ? result.stdout() : result.stderr();
            log.warn("Health probe for {} failed with exit {}", processName, result.exitCode());
            return ProbeResult.failed("probe exit " + result.exitCode() + ": " + tail(stderr));
        } catch (ActionTimeoutException e) {
            return ProbeResult.failed("probe timed out after " + config.getProbeTimeoutSeconds() + "s");
        } catch (ActionExecutionException e) {
            throw new ProbeException("Probe for " + processName + " could not run: " + e.getMessage(), e);
        }
    }

    private static String tail(String text) {
        String trimmed = text.strip();
        return trimmed.length() <= 500 ? trimmed : "..." + trimmed.substring(trimmed.length() - 500);
    }
}
