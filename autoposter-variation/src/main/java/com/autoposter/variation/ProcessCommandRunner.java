package com.autoposter.variation;

import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}. Output goes to a temp file so the
 * wait can be bounded; a process still running at the deadline is destroyed.
 */
@Slf4j
public class ProcessCommandRunner implements CommandRunner {

    @Override
    public CommandResult run(List<String> command, Duration timeout) throws IOException, InterruptedException {
        File outputLog = File.createTempFile("ffmpeg_", ".log");
        try {
            Process process = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .redirectOutput(outputLog)
                    .start();

            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(5, TimeUnit.SECONDS);
                log.warn("Command timed out after {}: {}", timeout, command.get(0));
                return CommandResult.timeout(readOutput(outputLog));
            }

            String output = readOutput(outputLog);
            if (log.isDebugEnabled()) {
                output.lines().forEach(line -> log.debug("[FFmpeg Variation] {}", line));
            }
            return new CommandResult(process.exitValue(), output, false);
        } finally {
            Files.deleteIfExists(outputLog.toPath());
        }
    }

    private String readOutput(File outputLog) throws IOException {
        return new String(Files.readAllBytes(outputLog.toPath()), StandardCharsets.UTF_8);
    }
}
