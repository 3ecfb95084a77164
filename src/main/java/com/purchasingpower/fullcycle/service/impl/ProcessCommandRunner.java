package com.purchasingpower.fullcycle.service.impl;

import com.purchasingpower.fullcycle.model.CallContext;
import com.purchasingpower.fullcycle.model.CommandResult;
import com.purchasingpower.fullcycle.model.ServiceType;
import com.purchasingpower.fullcycle.service.CommandRunner;
import com.purchasingpower.fullcycle.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

@Slf4j
@Service
public class ProcessCommandRunner implements CommandRunner {

    static final int EXIT_START_FAILED = 127;
    static final int EXIT_TIMEOUT = 124;

    @Override
    public CommandResult run(Path workingDir, List<String> argv, Duration timeout) {
        String commandLine = String.join(" ", argv);
        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.BUILD, commandLine, log);
        callCtx.logRequest("Running command", "Directory", workingDir);

        long startTime = System.currentTimeMillis();
        StringBuffer output = new StringBuffer();

        Process process;
        try {
            ProcessBuilder builder = new ProcessBuilder(wrapForPlatform(argv));
            builder.directory(workingDir.toFile());
            builder.redirectErrorStream(true); // Merge stderr into stdout
            process = builder.start();
        } catch (IOException e) {
            callCtx.logError("Failed to start: " + e.getMessage(), e);
            return new CommandResult(EXIT_START_FAILED, "Failed to start '" + commandLine + "': " + e.getMessage(),
                    System.currentTimeMillis() - startTime);
        }

        Thread pump = new Thread(() -> pumpOutput(process, output), "command-output");
        pump.setDaemon(true);
        pump.start();

        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                pump.join(TimeUnit.SECONDS.toMillis(5));
                callCtx.logError("Timed out after " + timeout, null);
                output.append("\nCommand timed out after ").append(timeout.toSeconds()).append("s\n");
                return new CommandResult(EXIT_TIMEOUT, output.toString(), System.currentTimeMillis() - startTime);
            }
            pump.join(TimeUnit.SECONDS.toMillis(5));

            int exitCode = process.exitValue();
            long durationMs = System.currentTimeMillis() - startTime;
            callCtx.logResponse("Exit code " + exitCode, "Output", ExternalCallLogger.truncate(output.toString(), 500));
            return new CommandResult(exitCode, output.toString(), durationMs);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            callCtx.logError("Interrupted", e);
            return new CommandResult(EXIT_TIMEOUT, output + "\nCommand interrupted\n",
                    System.currentTimeMillis() - startTime);
        }
    }

    private void pumpOutput(Process process, StringBuffer output) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                log.debug("[CMD] {}", line);
                output.append(line).append('\n');
            }
        } catch (IOException e) {
            log.debug("Output stream closed: {}", e.getMessage());
        }
    }

    private List<String> wrapForPlatform(List<String> argv) {
        boolean isWindows = System.getProperty("os.name").toLowerCase(Locale.ROOT).startsWith("windows");
        if (!isWindows) {
            return argv;
        }
        // mvn/gradle are .cmd scripts on Windows and need the shell to resolve them
        List<String> command = new ArrayList<>();
        command.add("cmd.exe");
        command.add("/c");
        command.addAll(argv);
        return command;
    }
}
