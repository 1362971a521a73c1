package com.example.webhook_handler.action;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.example.webhook_handler.config.WebhookProperties;

/**
 * Launches the configured script as a child process.
 * The process inherits the server's stdout/stderr; its exit code is only logged.
 */
@Component
public class ScriptActionLauncher implements ActionLauncher {

    private static final Logger log = LoggerFactory.getLogger(ScriptActionLauncher.class);

    private final WebhookProperties properties;

    public ScriptActionLauncher(WebhookProperties properties) {
        this.properties = properties;
    }

    @Override
    public Process launch(Path script) {
        if (script == null || !Files.isRegularFile(script)) {
            throw new ActionLaunchException("script not found: " + script);
        }
        if (!Files.isReadable(script)) {
            throw new ActionLaunchException("script not readable: " + script);
        }

        List<String> command = command(script);
        Process process;
        try {
            process = new ProcessBuilder(command).inheritIO().start();
        } catch (IOException e) {
            throw new ActionLaunchException("could not start " + String.join(" ", command), e);
        }

        log.info("[ScriptActionLauncher] started pid={} command={}", process.pid(), command);
        process.onExit().thenAccept(p -> {
            if (p.exitValue() == 0) {
                log.info("[ScriptActionLauncher] pid={} finished", p.pid());
            } else {
                log.warn("[ScriptActionLauncher] pid={} exited with code {}", p.pid(), p.exitValue());
            }
        });
        return process;
    }

    List<String> command(Path script) {
        List<String> command = new ArrayList<>();
        String interpreter = properties.getInterpreter();
        if (interpreter != null && !interpreter.isBlank()) {
            command.add(interpreter.trim());
        } else if (!Files.isExecutable(script)) {
            throw new ActionLaunchException("script not executable and no interpreter configured: " + script);
        }
        command.add(script.toString());
        return command;
    }
}
