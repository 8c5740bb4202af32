package com.dailyBrief.accountBrief.provider.service;

import com.dailyBrief.accountBrief.config.BriefProperties;
import com.dailyBrief.accountBrief.provider.exception.ProviderCommandException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs the external provider executable as a bounded subprocess.
 *
 * Stdout and stderr are redirected to temporary files so that a chatty process
 * can never block on a full pipe while we wait for it.
 */
@Slf4j
@Service
public class ProviderCommandRunner {

    private final String command;

    @Autowired
    public ProviderCommandRunner(BriefProperties properties) {
        this(properties.getProvider().getCommand());
    }

    ProviderCommandRunner(String command) {
        this.command = command;
    }

    /**
     * Executable name, used as the prefix of generic error messages.
     */
    public String getCommand() {
        return command;
    }

    /**
     * Runs the provider with the given arguments and waits at most {@code timeout}.
     *
     * @param args    Arguments passed after the executable
     * @param timeout Upper bound on the run time
     * @return Exit code and captured output of the finished process
     * @throws ProviderCommandException if the process cannot start, times out, or the wait is interrupted
     */
    public ProviderCommandResult run(List<String> args, Duration timeout) {
        List<String> commandLine = new ArrayList<>(args.size() + 1);
        commandLine.add(command);
        commandLine.addAll(args);

        Path stdoutFile = null;
        Path stderrFile = null;
        Process process = null;
        try {
            stdoutFile = Files.createTempFile("provider-", ".out");
            stderrFile = Files.createTempFile("provider-", ".err");

            log.debug("Running provider - command: {}, args: {}", command, args.size());
            process = new ProcessBuilder(commandLine)
                    .redirectOutput(stdoutFile.toFile())
                    .redirectError(stderrFile.toFile())
                    .redirectInput(ProcessBuilder.Redirect.PIPE)
                    .start();
            process.getOutputStream().close();

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new ProviderCommandException(
                        String.format("%s timed out after %ds", command, timeout.toSeconds()));
            }

            return new ProviderCommandResult(
                    process.exitValue(),
                    Files.readString(stdoutFile, StandardCharsets.UTF_8),
                    Files.readString(stderrFile, StandardCharsets.UTF_8));

        } catch (IOException e) {
            throw new ProviderCommandException("Failed to run " + command + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (process != null) {
                process.destroyForcibly();
            }
            throw new ProviderCommandException(command + " was interrupted", e);
        } finally {
            deleteQuietly(stdoutFile);
            deleteQuietly(stderrFile);
        }
    }

    private void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete temp file {}: {}", file, e.getMessage());
        }
    }
}
