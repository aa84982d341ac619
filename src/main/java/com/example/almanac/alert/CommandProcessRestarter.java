package com.example.almanac.alert;

import com.example.almanac.action.ActionExecutionException;
import com.example.almanac.action.CommandResult;
import com.example.almanac.action.CommandRunner;
import com.example.almanac.common.ConfigException;
import com.example.almanac.config.AlmanacProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;

/**
 * Restarts a process through its configured restart command, e.g.
 * {@code systemctl --user restart herald}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CommandProcessRestarter implements ProcessRestarter {

    private final CommandRunner commandRunner;
    private final AlmanacProperties properties;

    @Override
    public String restart(String processName) {
        AlmanacProperties.ProcessConfig config = properties.getProcesses().get(processName);
        if (config == null || config.getRestartCommand() == null || config.getRestartCommand().isEmpty()) {
            throw new ConfigException("No restart command configured for process '" + processName + "'");
        }

        log.info("Restarting {}: {}", processName, String.join(" ", config.getRestartCommand()));
        CommandResult result = commandRunner.run(config.getRestartCommand(),
                Duration.ofSeconds(config.getRestartTimeoutSeconds()), config.getWorkingDirectory());
        if (!result.succeeded()) {
            throw new ActionExecutionException("Restart command exited with code " + result.exitCode(),
                    Map.of("exit_code", result.exitCode(), "stderr", result.stderr()));
        }
        return "restart command exit 0 (" + result.duration().toMillis() + "ms)";
    }
}
