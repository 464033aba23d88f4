package com.example.goserver.ai;

import com.example.goserver.config.GoServerProperties;
import com.example.goserver.model.domain.AiLevel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spawns one engine subprocess per game, speaking GTP on stdin/stdout.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KataGoEngineFactory implements AiEngineFactory {

    private static final AtomicInteger SEQ = new AtomicInteger(1);

    private final GoServerProperties properties;

    @Override
    public AiEngine acquire(AiLevel level) {
        String name = "katago-" + SEQ.getAndIncrement();
        int retries = properties.getAi().getMaxRetries();
        return new GtpAiEngine(name, () -> launch(name, level), retries).start();
    }

    List<String> command(AiLevel level) {
        GoServerProperties.Ai ai = properties.getAi();
        List<String> command = new ArrayList<>();
        command.add(ai.getCommand());
        command.addAll(ai.getArgs());
        command.add("-override-config");
        command.add(String.format(Locale.ROOT, "maxVisits=%d,maxTime=%.1f,numSearchThreads=%d",
                level.maxVisits(), level.maxTimeSeconds(), level.searchThreads()));
        return command;
    }

    private GtpClient launch(String name, AiLevel level) {
        List<String> command = command(level);
        Process process;
        try {
            process = new ProcessBuilder(command).start();
        } catch (IOException e) {
            throw new AiUnavailableException("Could not start " + String.join(" ", command), e);
        }
        log.info("{} spawned (pid {}, level {})", name, process.pid(), level);
        drainStderr(name, process);
        return new GtpClient(name, process.getInputStream(), process.getOutputStream(),
                properties.getAi().getCommandTimeout(), () -> destroy(name, process)).start();
    }

    private void drainStderr(String name, Process process) {
        Thread drain = new Thread(() -> {
            try (BufferedReader err = new BufferedReader(
                    new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = err.readLine()) != null) {
                    log.debug("{} stderr: {}", name, line);
                }
            } catch (IOException e) {
                log.debug("{} stderr closed: {}", name, e.getMessage());
            }
        }, name + "-stderr");
        drain.setDaemon(true);
        drain.start();
    }

    private void destroy(String name, Process process) {
        process.destroy();
        try {
            if (!process.waitFor(2, TimeUnit.SECONDS)) {
                process.destroyForcibly();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
        log.info("{} stopped", name);
    }
}
